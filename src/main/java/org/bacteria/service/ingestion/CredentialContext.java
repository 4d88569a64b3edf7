package org.bacteria.service.ingestion;

import org.springframework.util.StringUtils;

public final class CredentialContext {

    static final String MISSING_MESSAGE = "SESSION_COOKIE environment variable is required";

    private final String sessionCookie;

    public CredentialContext(String sessionCookie) {
        this.sessionCookie = sessionCookie;
    }

    public boolean isPresent() {
        return StringUtils.hasText(sessionCookie);
    }

    public void verify() {
        if (!isPresent()) {
            throw new MissingCredentialException(MISSING_MESSAGE);
        }
    }

    public String sessionCookie() {
        verify();
        return sessionCookie;
    }

    @Override
    public String toString() {
        return "CredentialContext[present=" + isPresent() + "]";
    }
}
