package org.pragmatica.stratum.config;

/**
 * Value of a field after the override layers, with the layer that supplied it.
 */
public record RawValue(Object value, OverrideLayer layer) {
    public static RawValue rawValue(Object value, OverrideLayer layer) {
        return new RawValue(value, layer);
    }
}
