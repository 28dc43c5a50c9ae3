package org.pragmatica.stratum.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps environment codes to concrete configuration classes.
 *
 * <p>The active environment is named by the {@value #ENV_CODE_VAR} environment variable, or by
 * an explicit selector. When neither is given, {@value #DEFAULT_ENV_CODE} is selected.
 * Abstract base classes are never registered.
 */
public final class EnvironmentRegistry {
    public static final String ENV_CODE_VAR = "ENV_CODE";
    public static final String DEFAULT_ENV_CODE = "lcl";

    private final Map<String, ConfigurationClass> classes;

    private EnvironmentRegistry(Map<String, ConfigurationClass> classes) {
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    /**
     * Create a registry of concrete configuration classes.
     *
     * @throws ConfigException.AbstractInstantiation if an abstract class is registered
     * @throws ConfigException.DuplicateEnvironment  if two classes share a code
     */
    public static EnvironmentRegistry environmentRegistry(List<ConfigurationClass> configurationClasses) {
        var byCode = new LinkedHashMap<String, ConfigurationClass>();
        for (var configurationClass : configurationClasses) {
            if (configurationClass.isAbstract()) {
                throw ConfigException.abstractInstantiation(configurationClass.code());
            }
            if (byCode.putIfAbsent(configurationClass.code(), configurationClass) != null) {
                throw ConfigException.duplicateEnvironment(configurationClass.code());
            }
        }
        return new EnvironmentRegistry(byCode);
    }

    public static EnvironmentRegistry environmentRegistry(ConfigurationClass... configurationClasses) {
        return environmentRegistry(List.of(configurationClasses));
    }

    /**
     * Select a class by code, case-insensitively. A missing or blank code selects the default.
     *
     * @throws ConfigException.UnknownEnvironment if no class is registered under the code
     */
    public ConfigurationClass select(Optional<String> code) {
        var effective = code.map(String::trim)
                            .filter(value -> !value.isEmpty())
                            .orElse(DEFAULT_ENV_CODE);
        var selected = classes.get(effective);
        if (selected != null) {
            return selected;
        }
        return classes.entrySet()
                      .stream()
                      .filter(entry -> entry.getKey()
                                            .equalsIgnoreCase(effective))
                      .map(Map.Entry::getValue)
                      .findFirst()
                      .orElseThrow(() -> ConfigException.unknownEnvironment(effective, classes.keySet()));
    }

    /**
     * Select the class named by the selector variable of the given environment snapshot.
     */
    public ConfigurationClass selectFrom(Map<String, String> environment) {
        return select(Optional.ofNullable(environment.get(ENV_CODE_VAR)));
    }

    public Set<String> codes() {
        return classes.keySet();
    }

    public Optional<ConfigurationClass> find(String code) {
        return Optional.ofNullable(classes.get(code));
    }
}
