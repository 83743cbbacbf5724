package com.sams.authservice.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@Getter
@ConfigurationProperties(prefix = "auth.password")
public class PasswordProperties {

    private final int bcryptStrength;
    private final int minLength;
    private final boolean requireUppercase;
    private final boolean requireLowercase;
    private final boolean requireDigit;
    private final boolean requireSpecial;

    public PasswordProperties(@DefaultValue("10") int bcryptStrength,
                              @DefaultValue("8") int minLength,
                              @DefaultValue("true") boolean requireUppercase,
                              @DefaultValue("true") boolean requireLowercase,
                              @DefaultValue("true") boolean requireDigit,
                              @DefaultValue("false") boolean requireSpecial) {
        this.bcryptStrength = bcryptStrength;
        this.minLength = minLength;
        this.requireUppercase = requireUppercase;
        this.requireLowercase = requireLowercase;
        this.requireDigit = requireDigit;
        this.requireSpecial = requireSpecial;
    }
}
