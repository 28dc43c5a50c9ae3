package org.pragmatica.stratum.config;

import java.util.Optional;

/**
 * Evaluates the resolver of one derived field.
 *
 * <p>Under {@link Derivation.Policy#HONOR_OVERRIDE} an incoming value that is neither empty
 * nor a {@link Sentinel} is returned unchanged, so a dotenv entry, environment variable or
 * explicit argument outranks the computed value. Otherwise the resolver computes the value
 * from the final values of the fields it depends on.
 */
public final class DerivedFieldResolver {
    private DerivedFieldResolver() {}

    /**
     * Resolve the final value of a derived field.
     *
     * @param field         the derived field
     * @param incoming      value left by the override layers, if any
     * @param staticDefault the field's static default, which must be unset
     * @param resolved      final values visible to the resolver
     * @return final value, converted to the field type
     * @throws ConfigException.InvalidFieldDeclaration if the default is set or the resolver reads
     *                                                 a field it cannot see
     */
    public static Object resolve(ClassifiedField field,
                                 Optional<Object> incoming,
                                 Optional<Object> staticDefault,
                                 ResolvedValues resolved) {
        if (staticDefault.isPresent()) {
            throw ConfigException.invalidDeclaration(field.name(),
                                                     field.declaredIn(),
                                                     "derived field must leave its default unset, found '"
                                                     + staticDefault.get() + "'");
        }
        var derivation = field.declaration()
                              .derivation()
                              .orElseThrow(() -> ConfigException.invalidDeclaration(field.name(),
                                                                                    field.declaredIn(),
                                                                                    "derived field has no resolver"));
        if (honorsIncoming(derivation, incoming)) {
            return incoming.get();
        }
        var computed = derivation.compute(resolved);
        if (computed == null) {
            throw ConfigException.invalidDeclaration(field.name(), field.declaredIn(), "resolver returned no value");
        }
        return field.type()
                    .map(type -> type.convert(field.name(), "resolver", computed))
                    .orElse(computed);
    }

    static boolean honorsIncoming(Derivation derivation, Optional<Object> incoming) {
        return derivation.policy() == Derivation.Policy.HONOR_OVERRIDE && incoming.filter(DerivedFieldResolver::supplied)
                                                                                  .isPresent();
    }

    /**
     * Whether an incoming value counts as explicitly supplied.
     */
    static boolean supplied(Object value) {
        if (value == null || Sentinel.isSentinel(value)) {
            return false;
        }
        return !(value instanceof String) || !((String) value).isEmpty();
    }
}
