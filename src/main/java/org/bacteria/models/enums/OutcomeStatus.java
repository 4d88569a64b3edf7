package org.bacteria.models.enums;

public enum OutcomeStatus {
    SUCCESS,
    EMPTY,
    ERROR
}
