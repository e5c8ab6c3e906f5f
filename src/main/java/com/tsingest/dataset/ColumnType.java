package com.tsingest.dataset;

/**
 * Value type of a {@link Column}, decided once at ingestion time.
 */
public enum ColumnType {
    NUMERIC((byte) 1, 8),
    TEXT((byte) 2, 48),
    TIMESTAMP((byte) 3, 16);

    private final byte code;
    private final int estimatedWidthBytes;

    ColumnType(byte code, int estimatedWidthBytes) {
        this.code = code;
        this.estimatedWidthBytes = estimatedWidthBytes;
    }

    /** Stable code used by the columnar file format. */
    public byte getCode() {
        return code;
    }

    /** Per-value memory estimate. Text and timestamps are charged a wider fixed width. */
    public int getEstimatedWidthBytes() {
        return estimatedWidthBytes;
    }

    public static ColumnType fromCode(byte code) {
        for (ColumnType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type code: " + code);
    }
}
