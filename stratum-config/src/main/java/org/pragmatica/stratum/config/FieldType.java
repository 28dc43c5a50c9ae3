package org.pragmatica.stratum.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Type annotation of a configuration field.
 *
 * <p>Values that arrive as text (dotenv entries, environment variables, command-line tokens)
 * are converted to the annotated type; values that already have the Java type pass through.
 */
public enum FieldType {
    STRING("string", String.class),
    INTEGER("integer", Integer.class),
    LONG("long", Long.class),
    DOUBLE("double", Double.class),
    BOOLEAN("boolean", Boolean.class),
    DURATION("duration", Duration.class);
    private final String displayName;
    private final Class< ? > javaType;
    FieldType(String displayName, Class< ? > javaType) {
        this.displayName = displayName;
        this.javaType = javaType;
    }
    public String displayName() {
        return displayName;
    }
    /**
     * Convert a value to this type.
     *
     * @param field  field name, for error reporting
     * @param source where the value came from, for error reporting
     * @param value  value to convert
     * @return converted value
     * @throws ConfigException.InvalidFieldValue if the value cannot be represented by this type
     */
    public Object convert(String field, String source, Object value) {
        if (javaType.isInstance(value)) {
            return value;
        }
        if (this == STRING) {
            return String.valueOf(value);
        }
        if (!(value instanceof String)) {
            throw ConfigException.invalidValue(field, source, value, this);
        }
        var text = ((String) value).trim();
        try{
            return switch (this) {
                case INTEGER -> Integer.valueOf(text);
                case LONG -> Long.valueOf(text);
                case DOUBLE -> Double.valueOf(text);
                case BOOLEAN -> parseBoolean(text);
                case DURATION -> parseDuration(text);
                case STRING -> text;
            };
        } catch (IllegalArgumentException e) {
            throw ConfigException.invalidValue(field, source, value, this);
        }
    }

    private static Boolean parseBoolean(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> Boolean.TRUE;
            case "false", "0", "no", "off" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException(value);
        };
    }

    /**
     * Parse duration from string (e.g., "1s", "500ms", "5m"). Bare numbers are seconds.
     */
    static Duration parseDuration(String value) {
        if (value.isBlank()) {
            throw new IllegalArgumentException("blank duration");
        }
        var normalized = value.toLowerCase(Locale.ROOT);
        if (normalized.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(normalized.substring(0, normalized.length() - 2)));
        }
        if (normalized.endsWith("s")) {
            return Duration.ofSeconds(Long.parseLong(normalized.substring(0, normalized.length() - 1)));
        }
        if (normalized.endsWith("m")) {
            return Duration.ofMinutes(Long.parseLong(normalized.substring(0, normalized.length() - 1)));
        }
        if (normalized.endsWith("h")) {
            return Duration.ofHours(Long.parseLong(normalized.substring(0, normalized.length() - 1)));
        }
        return Duration.ofSeconds(Long.parseLong(normalized));
    }
}
