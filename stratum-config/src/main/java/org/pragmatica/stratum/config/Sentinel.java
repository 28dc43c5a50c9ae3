package org.pragmatica.stratum.config;

/**
 * Placeholder values meaning "not set yet".
 *
 * <p>A base class uses them for fields that each environment (or each developer) must
 * supply. A derived field whose incoming value is a placeholder is computed by its resolver
 * as if nothing had been supplied.
 */
public enum Sentinel {
    ENV_SPECIFIC_OVERRIDE("?ENV_SPECIFIC_OVERRIDE?"),
    USER_SPECIFIC_OVERRIDE("?USER_SPECIFIC_OVERRIDE?");
    private final String value;
    Sentinel(String value) {
        this.value = value;
    }
    public String value() {
        return value;
    }
    public static boolean isSentinel(Object candidate) {
        for (var sentinel : values()) {
            if (sentinel.value.equals(candidate)) {
                return true;
            }
        }
        return false;
    }
}
