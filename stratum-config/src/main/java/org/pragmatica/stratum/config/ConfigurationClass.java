package org.pragmatica.stratum.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declarative configuration class: an ordered field table plus an optional parent.
 *
 * <p>Classes form a linear inheritance chain. Each class is identified by a unique
 * environment code. Abstract classes collect shared defaults and cannot be resolved directly.
 *
 * <p>Example:
 * <pre>{@code
 * var base = ConfigurationClass.abstractConfigurationClass("default")
 *                              .plain("COMPONENT_NAME", "Stratum Service")
 *                              .typed("DB_HOST", FieldType.STRING, Sentinel.ENV_SPECIFIC_OVERRIDE.value())
 *                              .typed("DB_PORT", FieldType.INTEGER, 5432)
 *                              .derived("DB_URL", FieldType.STRING, Derivation.joining(":", "DB_HOST", "DB_PORT"))
 *                              .build();
 * var local = base.extend("lcl")
 *                 .plain("DB_HOST", "localhost")
 *                 .build();
 * }</pre>
 */
public final class ConfigurationClass {
    private final String code;
    private final String longName;
    private final String description;
    private final boolean isAbstract;
    private final Optional<ConfigurationClass> parent;
    private final List<FieldDeclaration> declarations;
    private final FieldTable fields;

    private ConfigurationClass(String code,
                               String longName,
                               String description,
                               boolean isAbstract,
                               Optional<ConfigurationClass> parent,
                               List<FieldDeclaration> declarations,
                               FieldTable fields) {
        this.code = code;
        this.longName = longName;
        this.description = description;
        this.isAbstract = isAbstract;
        this.parent = parent;
        this.declarations = List.copyOf(declarations);
        this.fields = fields;
    }

    /**
     * Start a concrete root class.
     */
    public static Builder configurationClass(String code) {
        return new Builder(code, false, Optional.empty());
    }

    /**
     * Start an abstract root class.
     */
    public static Builder abstractConfigurationClass(String code) {
        return new Builder(code, true, Optional.empty());
    }

    /**
     * Start a concrete class extending this one.
     */
    public Builder extend(String code) {
        return new Builder(code, false, Optional.of(this));
    }

    /**
     * Start an abstract class extending this one.
     */
    public Builder extendAbstract(String code) {
        return new Builder(code, true, Optional.of(this));
    }

    public String code() {
        return code;
    }

    public String longName() {
        return longName;
    }

    public String description() {
        return description;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public Optional<ConfigurationClass> parent() {
        return parent;
    }

    /**
     * Declarations made by this class itself, in order.
     */
    public List<FieldDeclaration> declarations() {
        return declarations;
    }

    /**
     * Classified fields of the whole chain.
     */
    public FieldTable fields() {
        return fields;
    }

    /**
     * Classes of the inheritance chain, root first.
     */
    public List<ConfigurationClass> chain() {
        var chain = new ArrayList<ConfigurationClass>();
        Optional<ConfigurationClass> current = Optional.of(this);
        while (current.isPresent()) {
            chain.add(0, current.get());
            current = current.get().parent;
        }
        return List.copyOf(chain);
    }

    public boolean isSubclassOf(ConfigurationClass other) {
        return parent.map(p -> p == other || p.isSubclassOf(other))
                     .orElse(false);
    }

    @Override
    public String toString() {
        return "ConfigurationClass[" + code + (isAbstract
                                               ? ", abstract"
                                               : "") + "]";
    }

    /**
     * Collects field declarations and classifies them on {@link #build()}.
     */
    public static final class Builder {
        private final String code;
        private final boolean isAbstract;
        private final Optional<ConfigurationClass> parent;
        private final List<FieldDeclaration> declarations = new ArrayList<>();
        private String longName;
        private String description = "";

        private Builder(String code, boolean isAbstract, Optional<ConfigurationClass> parent) {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Configuration class code cannot be blank");
            }
            this.code = code;
            this.longName = code;
            this.isAbstract = isAbstract;
            this.parent = parent;
        }

        public Builder longName(String longName) {
            this.longName = longName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Unannotated plain field, or a subclass override of an inherited field.
         */
        public Builder plain(String name, Object defaultValue) {
            return declare(FieldDeclaration.plain(name, defaultValue));
        }

        public Builder typed(String name, FieldType type, Object defaultValue) {
            return declare(FieldDeclaration.typed(name, type, defaultValue));
        }

        public Builder derived(String name, FieldType type, Derivation derivation) {
            return declare(FieldDeclaration.derived(name, type, derivation));
        }

        public Builder opaque(String name, ComputedAccessor accessor) {
            return declare(FieldDeclaration.opaque(name, accessor));
        }

        public Builder declare(FieldDeclaration declaration) {
            declarations.add(declaration);
            return this;
        }

        /**
         * Classify the declarations against the inherited fields.
         *
         * @throws ConfigException.AmbiguousOverrideShadowing if a stored field replaces an inherited accessor
         * @throws ConfigException.InvalidFieldDeclaration    if a field cannot take part in resolution
         */
        public ConfigurationClass build() {
            var inherited = parent.map(ConfigurationClass::fields)
                                  .orElseGet(FieldTable::empty);
            var table = FieldClassifier.classify(inherited, code, declarations);
            return new ConfigurationClass(code, longName, description, isAbstract, parent, declarations, table);
        }
    }
}
