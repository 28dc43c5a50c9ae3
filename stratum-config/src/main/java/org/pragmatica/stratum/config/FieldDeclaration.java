package org.pragmatica.stratum.config;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a configuration class's field table, as written by the class author.
 *
 * @param name         field name, also the name of its environment variable and dotenv key
 * @param kind         field kind
 * @param type         type annotation; empty for unannotated plain fields and accessors
 * @param defaultValue static default; must be empty for derived fields
 * @param derivation   resolver of a derived field
 * @param accessor     read-time computation of an opaque field
 */
public record FieldDeclaration(String name,
                               FieldKind kind,
                               Optional<FieldType> type,
                               Optional<Object> defaultValue,
                               Optional<Derivation> derivation,
                               Optional<ComputedAccessor> accessor) {
    public FieldDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValue, "defaultValue");
        Objects.requireNonNull(derivation, "derivation");
        Objects.requireNonNull(accessor, "accessor");
    }

    /**
     * Plain field without a type annotation.
     */
    public static FieldDeclaration plain(String name, Object defaultValue) {
        return new FieldDeclaration(name,
                                    FieldKind.PLAIN,
                                    Optional.empty(),
                                    Optional.of(defaultValue),
                                    Optional.empty(),
                                    Optional.empty());
    }

    /**
     * Plain field with a type annotation.
     */
    public static FieldDeclaration typed(String name, FieldType type, Object defaultValue) {
        return new FieldDeclaration(name,
                                    FieldKind.PLAIN,
                                    Optional.of(type),
                                    Optional.of(defaultValue),
                                    Optional.empty(),
                                    Optional.empty());
    }

    /**
     * Derived field. The static default stays unset so that any supplied value sticks.
     */
    public static FieldDeclaration derived(String name, FieldType type, Derivation derivation) {
        return new FieldDeclaration(name,
                                    FieldKind.DERIVED,
                                    Optional.of(type),
                                    Optional.empty(),
                                    Optional.of(derivation),
                                    Optional.empty());
    }

    /**
     * Read-time computed accessor.
     */
    public static FieldDeclaration opaque(String name, ComputedAccessor accessor) {
        return new FieldDeclaration(name,
                                    FieldKind.OPAQUE,
                                    Optional.empty(),
                                    Optional.empty(),
                                    Optional.empty(),
                                    Optional.of(accessor));
    }

    public boolean annotated() {
        return type.isPresent();
    }

    public FieldDeclaration withDefaultValue(Object value) {
        return new FieldDeclaration(name, kind, type, Optional.ofNullable(value), derivation, accessor);
    }
}
