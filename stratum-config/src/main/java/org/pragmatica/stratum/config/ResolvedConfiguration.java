package org.pragmatica.stratum.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, fully resolved configuration.
 *
 * <p>{@link #values()} holds the final value of every plain and derived field in declaration
 * order. Computed accessors are absent from it and are reachable only by name through
 * {@link #attribute(String)} or {@link #computed(String)}, which evaluate them on each read.
 */
public final class ResolvedConfiguration {
    private final ConfigurationClass configurationClass;
    private final Map<String, Object> values;
    private final Map<String, OverrideLayer> provenance;

    private ResolvedConfiguration(ConfigurationClass configurationClass,
                                  Map<String, Object> values,
                                  Map<String, OverrideLayer> provenance) {
        this.configurationClass = configurationClass;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.provenance = Map.copyOf(provenance);
    }

    static ResolvedConfiguration resolvedConfiguration(ConfigurationClass configurationClass,
                                                       Map<String, Object> values,
                                                       Map<String, OverrideLayer> provenance) {
        return new ResolvedConfiguration(configurationClass, values, provenance);
    }

    public ConfigurationClass configurationClass() {
        return configurationClass;
    }

    public String environmentCode() {
        return configurationClass.code();
    }

    /**
     * Final values of all plain and derived fields, in declaration order.
     */
    public Map<String, Object> values() {
        return values;
    }

    /**
     * Names of the computed accessors, which {@link #values()} never contains.
     */
    public Set<String> opaqueFields() {
        return configurationClass.fields()
                                 .opaqueNames();
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<String> getString(String name) {
        return get(name).map(String::valueOf);
    }

    public <T> Optional<T> get(String name, Class<T> type) {
        return get(name).filter(type::isInstance)
                        .map(type::cast);
    }

    /**
     * Evaluate a computed accessor against this configuration.
     */
    public Optional<Object> computed(String name) {
        return configurationClass.fields()
                                 .field(name)
                                 .filter(field -> field.kind() == FieldKind.OPAQUE)
                                 .flatMap(field -> field.declaration()
                                                        .accessor())
                                 .map(accessor -> accessor.compute(this));
    }

    /**
     * Named attribute access: the resolved value of a plain or derived field, or the current
     * result of a computed accessor.
     */
    public Optional<Object> attribute(String name) {
        return values.containsKey(name)
               ? get(name)
               : computed(name);
    }

    /**
     * Layer that supplied a field's value. Empty for computed accessors and for derived fields
     * whose value came from their resolver.
     */
    public Optional<OverrideLayer> provenance(String name) {
        return Optional.ofNullable(provenance.get(name));
    }

    /**
     * Plain fields still holding a {@link Sentinel} placeholder.
     */
    public Set<String> unsetFields() {
        var unset = new LinkedHashSet<String>();
        values.forEach((name, value) -> {
                           if (Sentinel.isSentinel(value)) {
                               unset.add(name);
                           }
                       });
        return Collections.unmodifiableSet(unset);
    }

    /**
     * {@code KEY=value} lines for an audit snapshot, optionally followed by the supplying layer.
     */
    public List<String> render(boolean withProvenance) {
        var lines = new ArrayList<String>();
        values.forEach((name, value) -> {
                           var line = name + "=" + value;
                           if (withProvenance) {
                               line += "  # " + provenance(name).map(OverrideLayer::displayName)
                                                                .orElse("resolver");
                           }
                           lines.add(line);
                       });
        return List.copyOf(lines);
    }

    @Override
    public String toString() {
        return "ResolvedConfiguration[" + environmentCode() + ", " + values + "]";
    }
}
