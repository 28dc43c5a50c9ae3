package org.pragmatica.stratum.config;

/**
 * Sources of field values, in ascending precedence.
 *
 * <p>A value supplied by a later constant always replaces one supplied by an earlier
 * constant. Computed accessors take part in {@link #DEFAULT} and {@link #SUBCLASS_OVERRIDE}
 * only; the remaining layers are never consulted for them.
 */
public enum OverrideLayer {
    /**
     * Value declared by the class that introduced the field.
     */
    DEFAULT("class default"),
    /**
     * Value redeclared by a descendant of the introducing class.
     */
    SUBCLASS_OVERRIDE("subclass override"),
    /**
     * Entry of a dotenv file supplied at load time.
     */
    DOTENV_FILE("dotenv file"),
    /**
     * Process environment variable named exactly as the field.
     */
    ENVIRONMENT_VARIABLE("environment variable"),
    /**
     * Constructor argument or command-line {@code --config KEY=VALUE} token.
     */
    EXPLICIT_ARGUMENT("explicit argument");
    private final String displayName;
    OverrideLayer(String displayName) {
        this.displayName = displayName;
    }
    public String displayName() {
        return displayName;
    }
    /**
     * Whether values from this layer arrive as text and need conversion to the field type.
     */
    public boolean external() {
        return this == DOTENV_FILE || this == ENVIRONMENT_VARIABLE || this == EXPLICIT_ARGUMENT;
    }
}
