package com.sparkify.etl;

/**
 * The two raw input record types.
 */
public enum RecordType {
    SONG("song"),
    LOG("log");

    private final String tag;

    RecordType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static RecordType fromTag(String tag) {
        for (RecordType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type tag: " + tag);
    }
}
