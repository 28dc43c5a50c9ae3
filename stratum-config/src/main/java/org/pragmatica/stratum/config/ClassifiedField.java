package org.pragmatica.stratum.config;

import java.util.Optional;

/**
 * Field after classification across the inheritance chain.
 *
 * @param declaration  most-derived declaration, with any inherited type annotation applied
 * @param introducedIn class that first declared the field
 * @param declaredIn   class holding the most-derived declaration
 */
public record ClassifiedField(FieldDeclaration declaration, String introducedIn, String declaredIn) {
    public String name() {
        return declaration.name();
    }

    public FieldKind kind() {
        return declaration.kind();
    }

    public Optional<FieldType> type() {
        return declaration.type();
    }

    public Optional<Object> defaultValue() {
        return declaration.defaultValue();
    }

    public boolean annotated() {
        return declaration.annotated();
    }

    /**
     * Layer the static value belongs to.
     */
    public OverrideLayer staticLayer() {
        return introducedIn.equals(declaredIn)
               ? OverrideLayer.DEFAULT
               : OverrideLayer.SUBCLASS_OVERRIDE;
    }
}
