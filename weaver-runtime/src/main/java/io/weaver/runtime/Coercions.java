package io.weaver.runtime;

/// Conversions applied by generated programs when a port value feeds a typed parameter.
///
/// Numbers convert between widths, strings parse, and `null` becomes the primitive's zero
/// value. These mirror the coercions the validator reports as lossy or unusual: they are
/// allowed, but may not preserve the value.
public final class Coercions {

    private Coercions() {}

    /// Truthiness of a STEP signal or condition value.
    ///
    /// `null`, `false`, zero and the empty string are false.
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0 && !Double.isNaN(n.doubleValue());
        }
        if (value instanceof CharSequence s) {
            return !s.isEmpty();
        }
        return true;
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return isTruthy(value);
    }

    public static double toDouble(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        String text = value.toString().trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Cannot convert '" + text + "' to a number", e);
        }
    }

    public static float toFloat(Object value) {
        return (float) toDouble(value);
    }

    public static long toLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer i) {
            return i;
        }
        return (long) toDouble(value);
    }

    public static int toInt(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        return (int) toLong(value);
    }

    public static short toShort(Object value) {
        return (short) toInt(value);
    }

    public static byte toByte(Object value) {
        return (byte) toInt(value);
    }

    public static char toChar(Object value) {
        if (value instanceof Character c) {
            return c;
        }
        String text = toStringValue(value);
        return text == null || text.isEmpty() ? '\0' : text.charAt(0);
    }

    /// Converts to a boxed type, keeping `null`.
    ///
    /// @param value the port value, may be null
    /// @param type target wrapper type or `String`, not null
    /// @return the converted value, null for a null value
    /// @throws IllegalArgumentException when `type` is not a supported target
    public static <T> T toBoxed(Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        Object converted;
        if (type == Integer.class) {
            converted = toInt(value);
        } else if (type == Long.class) {
            converted = toLong(value);
        } else if (type == Double.class) {
            converted = toDouble(value);
        } else if (type == Float.class) {
            converted = toFloat(value);
        } else if (type == Short.class) {
            converted = toShort(value);
        } else if (type == Byte.class) {
            converted = toByte(value);
        } else if (type == Boolean.class) {
            converted = toBoolean(value);
        } else if (type == Character.class) {
            converted = toChar(value);
        } else if (type == String.class) {
            converted = toStringValue(value);
        } else {
            throw new IllegalArgumentException("No conversion to " + type.getName());
        }
        return type.cast(converted);
    }

    /// Converts to a string, keeping `null`.
    ///
    /// Whole numbers held as doubles render without a fraction, so `2.0` becomes `"2"`.
    public static String toStringValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }

    /// Hands a port value to a parameter of a reference type without conversion.
    ///
    /// The target type is inferred from the parameter, so a value of the wrong type fails with
    /// a `ClassCastException` when the parameter is used.
    @SuppressWarnings("unchecked")
    public static <T> T cast(Object value) {
        return (T) value;
    }

    /// Returns `value` unless it is null.
    public static Object orDefault(Object value, Object defaultValue) {
        return value != null ? value : defaultValue;
    }

    /// Returns the first non-null value, or null.
    public static Object firstNonNull(Object... values) {
        for (Object value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
