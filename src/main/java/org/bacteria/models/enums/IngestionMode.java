package org.bacteria.models.enums;

public enum IngestionMode {
    RANGE,
    GENUS
}
