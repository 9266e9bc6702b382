package com.workledger.api.security;

import java.security.Principal;
import java.util.List;

/**
 * The caller behind a verified token. {@code userId} is the token subject, the same id
 * extraction jobs and mailbox settings are keyed by.
 */
public record AuthenticatedUser(String userId, String email, String name, List<String> roles) implements Principal {

    @Override
    public String getName() {
        return userId;
    }

    /**
     * Name shown to employees in extraction notifications: the {@code name} claim, else the email.
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return email != null && !email.isBlank() ? email : null;
    }
}
