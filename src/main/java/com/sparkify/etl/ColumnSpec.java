package com.sparkify.etl;

import java.util.Objects;

/**
 * One column of a raw record type: name, semantic type and nullability.
 */
public final class ColumnSpec {

    private final String name;
    private final SemanticType type;
    private final boolean nullable;

    private ColumnSpec(String name, SemanticType type, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable;
    }

    public static ColumnSpec required(String name, SemanticType type) {
        return new ColumnSpec(name, type, false);
    }

    public static ColumnSpec optional(String name, SemanticType type) {
        return new ColumnSpec(name, type, true);
    }

    public String name() {
        return name;
    }

    public SemanticType type() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnSpec)) {
            return false;
        }
        ColumnSpec other = (ColumnSpec) o;
        return nullable == other.nullable && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable);
    }

    @Override
    public String toString() {
        return name + ":" + type + (nullable ? "?" : "");
    }
}
