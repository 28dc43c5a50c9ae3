package org.pragmatica.stratum.config;

import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration engine failures.
 *
 * <p>Every failure is fatal for the resolution attempt that raised it: no partially
 * resolved configuration is ever handed out. Messages name the offending field together
 * with the layer or declaring class responsible.
 */
public abstract sealed class ConfigException extends RuntimeException
        permits ConfigException.AbstractInstantiation,
                ConfigException.InvalidFieldDeclaration,
                ConfigException.AmbiguousOverrideShadowing,
                ConfigException.SourceReadError,
                ConfigException.UnknownEnvironment,
                ConfigException.DuplicateEnvironment,
                ConfigException.UnknownField,
                ConfigException.InvalidFieldValue,
                ConfigException.MalformedArgument {

    ConfigException(String message) {
        super(message);
    }

    ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attempt to resolve an abstract (base) configuration class directly.
     */
    public static final class AbstractInstantiation extends ConfigException {
        private final String className;

        AbstractInstantiation(String className) {
            super("Configuration class '" + className + "' is abstract and cannot be instantiated;"
                  + " select a concrete environment that extends it");
            this.className = className;
        }

        public String className() {
            return className;
        }
    }

    /**
     * A field declaration that cannot take part in resolution as written.
     */
    public static final class InvalidFieldDeclaration extends ConfigException {
        private final String field;
        private final String className;

        InvalidFieldDeclaration(String field, String className, String reason) {
            super("Invalid declaration of field " + field + " in '" + className + "': " + reason);
            this.field = field;
            this.className = className;
        }

        public String field() {
            return field;
        }

        public String className() {
            return className;
        }
    }

    /**
     * A subclass redeclares a computed accessor as a stored value. The stored value would be
     * shadowed by the inherited accessor and never take effect.
     */
    public static final class AmbiguousOverrideShadowing extends ConfigException {
        private final String field;
        private final String parentClass;
        private final String childClass;

        AmbiguousOverrideShadowing(String field, String parentClass, String childClass) {
            super("Field " + field + " is a computed accessor in '" + parentClass + "' but '" + childClass
                  + "' redeclares it as a stored value; redeclare it as a computed accessor or rename it");
            this.field = field;
            this.parentClass = parentClass;
            this.childClass = childClass;
        }

        public String field() {
            return field;
        }

        public String parentClass() {
            return parentClass;
        }

        public String childClass() {
            return childClass;
        }
    }

    /**
     * A dotenv file at a supplied path could not be read.
     */
    public static final class SourceReadError extends ConfigException {
        private final Path path;

        SourceReadError(Path path, String reason, Throwable cause) {
            super("Unable to read " + OverrideLayer.DOTENV_FILE.displayName() + " " + path + ": " + reason, cause);
            this.path = path;
        }

        public Path path() {
            return path;
        }
    }

    /**
     * Environment selector names no registered configuration class.
     */
    public static final class UnknownEnvironment extends ConfigException {
        private final String code;

        UnknownEnvironment(String code, Set<String> known) {
            super("Unknown environment: " + code + ". Valid: " + String.join(", ", new TreeSet<>(known)));
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    /**
     * Two configuration classes registered under the same environment code.
     */
    public static final class DuplicateEnvironment extends ConfigException {
        DuplicateEnvironment(String code) {
            super("Environment code " + code + " is registered more than once");
        }
    }

    /**
     * An explicit argument names a field the configuration class does not declare.
     */
    public static final class UnknownField extends ConfigException {
        private final String field;

        UnknownField(String field, String className, OverrideLayer layer) {
            super("Field " + field + " supplied by " + layer.displayName() + " is not declared by '" + className + "'");
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    /**
     * A value could not be converted to the field's declared type.
     */
    public static final class InvalidFieldValue extends ConfigException {
        private final String field;

        InvalidFieldValue(String field, String source, Object value, FieldType type) {
            super("Value '" + value + "' for field " + field + " from " + source + " is not a valid "
                  + type.displayName());
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    /**
     * A command-line override token is not of the form KEY=VALUE.
     */
    public static final class MalformedArgument extends ConfigException {
        MalformedArgument(String token) {
            super("Malformed configuration override '" + token + "', expected KEY=VALUE");
        }
    }

    static AbstractInstantiation abstractInstantiation(String className) {
        return new AbstractInstantiation(className);
    }

    static InvalidFieldDeclaration invalidDeclaration(String field, String className, String reason) {
        return new InvalidFieldDeclaration(field, className, reason);
    }

    static AmbiguousOverrideShadowing ambiguousShadowing(String field, String parentClass, String childClass) {
        return new AmbiguousOverrideShadowing(field, parentClass, childClass);
    }

    static SourceReadError sourceReadError(Path path, String reason, Throwable cause) {
        return new SourceReadError(path, reason, cause);
    }

    static UnknownEnvironment unknownEnvironment(String code, Set<String> known) {
        return new UnknownEnvironment(code, known);
    }

    static DuplicateEnvironment duplicateEnvironment(String code) {
        return new DuplicateEnvironment(code);
    }

    static UnknownField unknownField(String field, String className, OverrideLayer layer) {
        return new UnknownField(field, className, layer);
    }

    static InvalidFieldValue invalidValue(String field, String source, Object value, FieldType type) {
        return new InvalidFieldValue(field, source, value, type);
    }

    static MalformedArgument malformedArgument(String token) {
        return new MalformedArgument(token);
    }
}
