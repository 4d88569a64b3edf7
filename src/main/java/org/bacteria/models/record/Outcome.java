package org.bacteria.models.record;

import org.bacteria.models.enums.OutcomeStatus;

/**
 * Result of one pipeline step for one identifier. {@code value} is set only for
 * {@link OutcomeStatus#SUCCESS}; {@code message} explains the other two.
 */
public record Outcome<T>(OutcomeStatus status, T value, String message, Throwable cause) {

    public static <T> Outcome<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("A successful outcome requires a value");
        }
        return new Outcome<>(OutcomeStatus.SUCCESS, value, null, null);
    }

    public static <T> Outcome<T> empty(String reason) {
        return new Outcome<>(OutcomeStatus.EMPTY, null, reason, null);
    }

    public static <T> Outcome<T> error(String reason) {
        return new Outcome<>(OutcomeStatus.ERROR, null, reason, null);
    }

    public static <T> Outcome<T> error(String reason, Throwable cause) {
        return new Outcome<>(OutcomeStatus.ERROR, null, reason, cause);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
