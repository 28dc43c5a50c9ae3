package org.pragmatica.stratum.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classified fields of a configuration class, in declaration order. Fields redeclared by a
 * subclass keep the position of their first declaration.
 */
public final class FieldTable {
    private final Map<String, ClassifiedField> fields;

    private FieldTable(Map<String, ClassifiedField> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    static FieldTable fieldTable(Map<String, ClassifiedField> fields) {
        return new FieldTable(fields);
    }

    static FieldTable empty() {
        return new FieldTable(Map.of());
    }

    public Optional<ClassifiedField> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public List<ClassifiedField> all() {
        return List.copyOf(fields.values());
    }

    /**
     * Plain and derived fields, in declaration order.
     */
    public List<ClassifiedField> tracked() {
        return fields.values()
                     .stream()
                     .filter(field -> field.kind()
                                           .tracked())
                     .toList();
    }

    public List<ClassifiedField> plain() {
        return ofKind(FieldKind.PLAIN);
    }

    public List<ClassifiedField> derived() {
        return ofKind(FieldKind.DERIVED);
    }

    public Set<String> opaqueNames() {
        var names = new LinkedHashSet<String>();
        ofKind(FieldKind.OPAQUE).forEach(field -> names.add(field.name()));
        return Collections.unmodifiableSet(names);
    }

    int position(String name) {
        var index = 0;
        for (var key : fields.keySet()) {
            if (key.equals(name)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    Map<String, ClassifiedField> asMap() {
        return fields;
    }

    private List<ClassifiedField> ofKind(FieldKind kind) {
        return fields.values()
                     .stream()
                     .filter(field -> field.kind() == kind)
                     .toList();
    }
}
