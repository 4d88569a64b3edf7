package org.bacteria.models.enums;

public enum ValueKind {
    VALUE,
    LIST
}
