package org.pragmatica.stratum.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the override layers to the plain and derived fields of a class.
 *
 * <p>Per field, lowest precedence first:
 * <ol>
 *   <li>Most-derived static default (class default or subclass override)</li>
 *   <li>Dotenv entry, when a dotenv file was supplied</li>
 *   <li>Environment variable with the field's exact name</li>
 *   <li>Explicit argument</li>
 * </ol>
 *
 * <p>Computed accessors are never looked up in layers 2-4. Derived fields without any value
 * are left out of the result so that their resolver acts as the default factory.
 */
public final class OverrideLayerStack {
    private static final Logger log = LoggerFactory.getLogger(OverrideLayerStack.class);

    private OverrideLayerStack() {}

    /**
     * Resolve the raw value of every plain and derived field.
     *
     * @param configurationClass class being resolved
     * @param sources            dotenv path, environment snapshot and explicit arguments
     * @return raw values by field name, in declaration order
     * @throws ConfigException.SourceReadError   if the supplied dotenv file cannot be read
     * @throws ConfigException.UnknownField      if an explicit argument names an undeclared field
     * @throws ConfigException.InvalidFieldValue if a value does not match the field type
     */
    public static Map<String, RawValue> resolveRaw(ConfigurationClass configurationClass, LayerSources sources) {
        var table = configurationClass.fields();
        checkExplicitNames(configurationClass, table, sources.arguments());
        var dotenv = sources.dotenvPath()
                            .map(DotenvSource::read)
                            .orElse(Map.of());
        var raw = new LinkedHashMap<String, RawValue>();
        for (var field : table.tracked()) {
            layered(field, dotenv, sources).ifPresent(value -> raw.put(field.name(), value));
        }
        return raw;
    }

    private static Optional<RawValue> layered(ClassifiedField field,
                                              Map<String, String> dotenv,
                                              LayerSources sources) {
        var name = field.name();
        var current = field.defaultValue()
                           .map(value -> RawValue.rawValue(value, field.staticLayer()));
        if (dotenv.containsKey(name)) {
            current = Optional.of(RawValue.rawValue(dotenv.get(name), OverrideLayer.DOTENV_FILE));
        }
        if (sources.environment()
                   .containsKey(name)) {
            current = Optional.of(RawValue.rawValue(sources.environment()
                                                           .get(name),
                                                    OverrideLayer.ENVIRONMENT_VARIABLE));
        }
        var explicit = sources.arguments()
                              .get(name);
        if (explicit.isPresent()) {
            current = Optional.of(RawValue.rawValue(explicit.get(), OverrideLayer.EXPLICIT_ARGUMENT));
        }
        current.filter(value -> value.layer()
                                     .external())
               .ifPresent(value -> log.debug("Field {} taken from {}",
                                             name,
                                             value.layer()
                                                  .displayName()));
        return current.map(value -> converted(field, value));
    }

    private static RawValue converted(ClassifiedField field, RawValue raw) {
        if (field.type()
                 .isEmpty() || Sentinel.isSentinel(raw.value())) {
            return raw;
        }
        // an empty value leaves a derived field to its resolver
        if (field.kind() == FieldKind.DERIVED && !DerivedFieldResolver.supplied(raw.value())) {
            return raw;
        }
        var converted = field.type()
                             .get()
                             .convert(field.name(),
                                      raw.layer()
                                         .displayName(),
                                      raw.value());
        return RawValue.rawValue(converted, raw.layer());
    }

    private static void checkExplicitNames(ConfigurationClass configurationClass,
                                           FieldTable table,
                                           ExplicitArguments arguments) {
        for (var name : arguments.names()) {
            var field = table.field(name);
            if (field.isEmpty()) {
                throw ConfigException.unknownField(name, configurationClass.code(), OverrideLayer.EXPLICIT_ARGUMENT);
            }
            if (field.get()
                     .kind() == FieldKind.OPAQUE) {
                log.debug("Ignoring explicit argument for computed accessor {}", name);
            }
        }
    }
}
