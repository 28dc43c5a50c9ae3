package org.pragmatica.stratum.config;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs one full resolution of a configuration class.
 *
 * <p>Plain fields are resolved first. Derived fields follow in declaration order, each
 * seeing the final values of every type-annotated plain field and of the derived fields
 * before it.
 */
public final class ConfigurationResolver {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

    private ConfigurationResolver() {}

    /**
     * Resolve a concrete configuration class against the given layer inputs.
     *
     * @throws ConfigException.AbstractInstantiation if the class is abstract
     * @throws ConfigException                       for any other resolution failure
     */
    public static ResolvedConfiguration resolve(ConfigurationClass configurationClass, LayerSources sources) {
        if (configurationClass.isAbstract()) {
            throw ConfigException.abstractInstantiation(configurationClass.code());
        }
        var raw = OverrideLayerStack.resolveRaw(configurationClass, sources);
        var table = configurationClass.fields();
        var finalValues = new HashMap<String, Object>();
        var provenance = new HashMap<String, OverrideLayer>();
        var visible = new LinkedHashMap<String, Object>();
        for (var field : table.plain()) {
            var value = raw.get(field.name());
            finalValues.put(field.name(), value.value());
            provenance.put(field.name(), value.layer());
            if (field.annotated()) {
                visible.put(field.name(), value.value());
            }
        }
        for (var field : table.derived()) {
            var incoming = Optional.ofNullable(raw.get(field.name()));
            var value = DerivedFieldResolver.resolve(field,
                                                     incoming.map(RawValue::value),
                                                     field.defaultValue(),
                                                     ResolvedValues.resolvedValues(field.name(),
                                                                                   field.declaredIn(),
                                                                                   visible));
            finalValues.put(field.name(), value);
            visible.put(field.name(), value);
            field.declaration()
                 .derivation()
                 .filter(derivation -> DerivedFieldResolver.honorsIncoming(derivation, incoming.map(RawValue::value)))
                 .ifPresent(honored -> provenance.put(field.name(),
                                                      incoming.get()
                                                              .layer()));
        }
        var ordered = new LinkedHashMap<String, Object>();
        table.tracked()
             .forEach(field -> ordered.put(field.name(), finalValues.get(field.name())));
        log.debug("Resolved {} fields for environment {}", ordered.size(), configurationClass.code());
        return ResolvedConfiguration.resolvedConfiguration(configurationClass, ordered, provenance);
    }

    /**
     * Resolve with only the class declarations and the given environment snapshot.
     */
    public static ResolvedConfiguration resolve(ConfigurationClass configurationClass, Map<String, String> environment) {
        return resolve(configurationClass, LayerSources.layerSources(environment));
    }
}
