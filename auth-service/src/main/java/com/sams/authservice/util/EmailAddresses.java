package com.sams.authservice.util;

import java.util.Locale;

public final class EmailAddresses {

    private EmailAddresses() {}

    /**
     * Lookup and uniqueness are case-insensitive: every email is trimmed and
     * lower-cased before it reaches the store.
     */
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
