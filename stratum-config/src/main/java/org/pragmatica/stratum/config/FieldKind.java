package org.pragmatica.stratum.config;

/**
 * Kind of a configuration field, fixed by its most-derived declaration.
 */
public enum FieldKind {
    /**
     * Value comes purely from the override layers.
     */
    PLAIN,
    /**
     * Computed accessor evaluated at read time. Invisible to overrides, validation and the
     * resolved value map.
     */
    OPAQUE,
    /**
     * Type-annotated field with a resolver that runs once during resolution.
     */
    DERIVED;
    /**
     * Whether fields of this kind are tracked by the override layers and the value map.
     */
    public boolean tracked() {
        return this != OPAQUE;
    }
}
