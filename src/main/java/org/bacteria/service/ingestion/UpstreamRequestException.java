package org.bacteria.service.ingestion;

import lombok.Getter;

@Getter
public class UpstreamRequestException extends RuntimeException {

    private final Integer status;
    private final boolean transientFailure;

    public UpstreamRequestException(String message, Integer status, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.transientFailure = transientFailure;
    }

    public boolean isNotFound() {
        return status != null && status == 404;
    }
}
