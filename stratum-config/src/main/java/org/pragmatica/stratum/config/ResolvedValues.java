package org.pragmatica.stratum.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the values a resolver may see: every type-annotated plain field and the
 * derived fields resolved before the one being computed.
 */
public final class ResolvedValues {
    private final String requester;
    private final String className;
    private final Map<String, Object> values;

    private ResolvedValues(String requester, String className, Map<String, Object> values) {
        this.requester = requester;
        this.className = className;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    static ResolvedValues resolvedValues(String requester, String className, Map<String, Object> values) {
        return new ResolvedValues(requester, className, values);
    }

    /**
     * Final value of a visible field.
     *
     * @throws ConfigException.InvalidFieldDeclaration if the field is not visible at this point
     */
    public Object get(String name) {
        var value = values.get(name);
        if (value == null) {
            throw ConfigException.invalidDeclaration(requester,
                                                     className,
                                                     "resolver reads " + name
                                                     + ", which is not a type-annotated field resolved before it");
        }
        return value;
    }

    public String getString(String name) {
        return String.valueOf(get(name));
    }
}
