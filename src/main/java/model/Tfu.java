package model;

import java.util.Locale;

/**
 * Tri-valued logic domain; each value is a constructor of the TFU datatype.
 */
public enum Tfu {
    TRUE("tfu_true"),
    FALSE("tfu_false"),
    UNKNOWN("tfu_true_or_false");

    private final String constructorName;

    Tfu(String constructorName) {
        this.constructorName = constructorName;
    }

    public String getConstructorName() {
        return constructorName;
    }

    public static Tfu fromConstructorName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Tfu value : values()) {
            if (value.constructorName.equals(lower)) {
                return value;
            }
        }
        return null;
    }

    public static Tfu of(Object value) {
        if (value instanceof Tfu) {
            return (Tfu) value;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? TRUE : FALSE;
        }
        Tfu parsed = value == null ? null : fromConstructorName(value.toString());
        if (parsed == null) {
            throw new IllegalArgumentException("Not a TFU value: " + value);
        }
        return parsed;
    }
}
