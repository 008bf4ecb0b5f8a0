package org.codelibs.taste.util;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.codelibs.taste.exception.InvalidParameterException;

public final class SettingsUtils {
    private SettingsUtils() {
    }

    public static <T, V> T get(final Map<String, V> settings, final String key) {
        return get(settings, key, null);
    }

    @SuppressWarnings("unchecked")
    public static <T, V> T get(final Map<String, V> settings, final String key,
            final T defaultValue) {
        if (settings != null) {
            final V value = settings.get(key);
            if (value != null) {
                return (T) value;
            }
        }
        return defaultValue;
    }

    public static <V> int getInt(final Map<String, V> settings,
            final String key, final int defaultValue) {
        final Object value = get(settings, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            if (number != Math.rint(number) || number < Integer.MIN_VALUE
                    || number > Integer.MAX_VALUE) {
                throw new InvalidParameterException("Invalid integer for "
                        + key + ": " + value);
            }
            return ((Number) value).intValue();
        }
        final String text = StringUtils.trim(value.toString());
        try {
            return Integer.parseInt(text);
        } catch (final NumberFormatException e) {
            throw new InvalidParameterException("Invalid integer for " + key
                    + ": " + text, e);
        }
    }

    public static <V> double getDouble(final Map<String, V> settings,
            final String key, final double defaultValue) {
        final Object value = get(settings, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        final String text = StringUtils.trim(value.toString());
        try {
            return Double.parseDouble(text);
        } catch (final NumberFormatException e) {
            throw new InvalidParameterException("Invalid number for " + key
                    + ": " + text, e);
        }
    }

    public static <V> String getString(final Map<String, V> settings,
            final String key, final String defaultValue) {
        final Object value = get(settings, key);
        if (value == null || StringUtils.isBlank(value.toString())) {
            return defaultValue;
        }
        return value.toString().trim();
    }
}
