package com.sams.authservice.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Optional first administrator, created at startup when email and password are set. */
@Getter
@ConfigurationProperties(prefix = "auth.bootstrap-admin")
public class BootstrapAdminProperties {

    private final String username;
    private final String email;
    private final String password;

    public BootstrapAdminProperties(@DefaultValue("admin") String username, String email, String password) {
        this.username = username;
        this.email = email;
        this.password = password;
    }

    public boolean isConfigured() {
        return email != null && !email.isBlank() && password != null && !password.isBlank();
    }
}
