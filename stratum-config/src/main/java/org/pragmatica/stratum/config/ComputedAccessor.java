package org.pragmatica.stratum.config;

import java.util.StringJoiner;

/**
 * Read-time computed field.
 *
 * <p>The accessor holds no state and is evaluated on every read against the resolved
 * configuration it belongs to, so it always sees the final values of the fields it reads.
 */
@FunctionalInterface
public interface ComputedAccessor {
    Object compute(ResolvedConfiguration self);

    /**
     * Accessor joining the final values of the given fields with a separator.
     *
     * @throws ConfigException.InvalidFieldDeclaration on read, if a named field is not declared
     */
    static ComputedAccessor joining(String separator, String... fields) {
        return self -> {
            var parts = new StringJoiner(separator);
            for (var field : fields) {
                var value = self.attribute(field)
                                .orElseThrow(() -> ConfigException.invalidDeclaration(field,
                                                                                      self.environmentCode(),
                                                                                      "read by a computed accessor but not declared"));
                parts.add(String.valueOf(value));
            }
            return parts.toString();
        };
    }
}
