package org.pragmatica.stratum.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Highest-precedence values: constructor arguments or command-line {@code --config} tokens.
 *
 * <p>Both routes produce the same map. A caller is expected to use only one of them per
 * invocation for a given field.
 */
public record ExplicitArguments(Map<String, Object> values) {
    private static final ExplicitArguments NONE = new ExplicitArguments(Map.of());

    public ExplicitArguments {
        values = Map.copyOf(values);
    }

    public static ExplicitArguments none() {
        return NONE;
    }

    public static ExplicitArguments explicitArguments(Map<String, ?> values) {
        return new ExplicitArguments(Map.<String, Object>copyOf(values));
    }

    /**
     * Parse space-separated {@code KEY=VALUE} tokens, as passed in one {@code --config} argument.
     * The value is everything after the first {@code =}; later tokens win for repeated keys.
     *
     * @throws ConfigException.MalformedArgument for a token without a key or without {@code =}
     */
    public static ExplicitArguments parse(String tokens) {
        return parse(List.of(tokens == null
                             ? ""
                             : tokens));
    }

    /**
     * Parse several {@code --config} arguments, each holding space-separated tokens.
     */
    public static ExplicitArguments parse(List<String> arguments) {
        var parsed = new LinkedHashMap<String, Object>();
        for (var argument : arguments) {
            if (argument == null || argument.isBlank()) {
                continue;
            }
            for (var token : argument.trim()
                                     .split("\\s+")) {
                var separator = token.indexOf('=');
                if (separator <= 0) {
                    throw ConfigException.malformedArgument(token);
                }
                parsed.put(token.substring(0, separator), token.substring(separator + 1));
            }
        }
        return parsed.isEmpty()
               ? NONE
               : new ExplicitArguments(parsed);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public ExplicitArguments with(String name, Object value) {
        var copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new ExplicitArguments(copy);
    }
}
