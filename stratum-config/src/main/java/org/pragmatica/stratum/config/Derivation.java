package org.pragmatica.stratum.config;

import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Resolver attached to a derived field.
 *
 * <p>The resolver runs once per resolution, after every non-derived field is final, and reads
 * only the fields it declares as dependencies. Dependencies must be type-annotated and, when
 * derived themselves, declared earlier.
 */
public interface Derivation {
    /**
     * What to do when a layer already supplied a value for the derived field.
     */
    enum Policy {
        /**
         * A supplied value that is neither empty nor a {@link Sentinel} is kept verbatim; the
         * resolver only acts as the default factory.
         */
        HONOR_OVERRIDE,
        /**
         * The computed value always replaces the supplied one.
         */
        ALWAYS_COMPUTE
    }

    List<String> dependencies();

    Policy policy();

    Object compute(ResolvedValues resolved);

    static Derivation derivation(Policy policy, List<String> dependencies, Function<ResolvedValues, Object> compute) {
        return new SimpleDerivation(policy, List.copyOf(dependencies), compute);
    }

    /**
     * Resolver computing the value only when no layer supplied one.
     */
    static Derivation defaultFactory(Function<ResolvedValues, Object> compute, String... dependencies) {
        return derivation(Policy.HONOR_OVERRIDE, List.of(dependencies), compute);
    }

    /**
     * Resolver whose result replaces any supplied value.
     */
    static Derivation postProcessor(Function<ResolvedValues, Object> compute, String... dependencies) {
        return derivation(Policy.ALWAYS_COMPUTE, List.of(dependencies), compute);
    }

    /**
     * Default factory joining the final values of the given fields with a separator.
     */
    static Derivation joining(String separator, String... dependencies) {
        return defaultFactory(resolved -> {
                                  var joined = new StringJoiner(separator);
                                  for (var dependency : dependencies) {
                                      joined.add(resolved.getString(dependency));
                                  }
                                  return joined.toString();
                              },
                              dependencies);
    }

    record SimpleDerivation(Policy policy,
                            List<String> dependencies,
                            Function<ResolvedValues, Object> function) implements Derivation {
        @Override
        public Object compute(ResolvedValues resolved) {
            return function.apply(resolved);
        }
    }
}
