package org.bacteria.service.ingestion;

public class MissingCredentialException extends IllegalStateException {

    public MissingCredentialException(String message) {
        super(message);
    }
}
