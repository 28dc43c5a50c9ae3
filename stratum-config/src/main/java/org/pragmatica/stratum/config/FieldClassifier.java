package org.pragmatica.stratum.config;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Partitions a configuration class's fields into plain, opaque and derived kinds.
 *
 * <p>Classification rules:
 * <ul>
 *   <li>The most-derived declaration of a name decides its kind, default, type and resolver</li>
 *   <li>A plain redeclaration without a type keeps the inherited type annotation</li>
 *   <li>A computed accessor may replace an inherited stored field</li>
 *   <li>A stored field may not replace an inherited computed accessor</li>
 *   <li>Derived fields have no static default, are type-annotated, and depend only on
 *       annotated fields that are resolved before them</li>
 * </ul>
 */
public final class FieldClassifier {
    private FieldClassifier() {}

    /**
     * Classify the full declaration of a configuration class.
     */
    public static FieldTable classify(ConfigurationClass configurationClass) {
        var inherited = configurationClass.parent()
                                          .map(ConfigurationClass::fields)
                                          .orElseGet(FieldTable::empty);
        return classify(inherited, configurationClass.code(), configurationClass.declarations());
    }

    /**
     * Merge a class's own declarations over the table inherited from its parent.
     *
     * @param inherited    classified fields of the parent, empty for a root class
     * @param className    code of the class being classified
     * @param declarations the class's own declarations, in order
     */
    static FieldTable classify(FieldTable inherited, String className, List<FieldDeclaration> declarations) {
        checkUniqueNames(className, declarations);
        var merged = new LinkedHashMap<>(inherited.asMap());
        for (var declaration : declarations) {
            var existing = merged.get(declaration.name());
            if (existing == null) {
                merged.put(declaration.name(), new ClassifiedField(declaration, className, className));
                continue;
            }
            if (existing.kind() == FieldKind.OPAQUE && declaration.kind() != FieldKind.OPAQUE) {
                throw ConfigException.ambiguousShadowing(declaration.name(), existing.declaredIn(), className);
            }
            merged.put(declaration.name(),
                       new ClassifiedField(inheritType(declaration, existing), existing.introducedIn(), className));
        }
        var table = FieldTable.fieldTable(merged);
        table.derived()
             .forEach(field -> validateDerived(table, field));
        return table;
    }

    private static void checkUniqueNames(String className, List<FieldDeclaration> declarations) {
        var seen = new HashSet<String>();
        for (var declaration : declarations) {
            if (!seen.add(declaration.name())) {
                throw ConfigException.invalidDeclaration(declaration.name(), className, "declared more than once");
            }
        }
    }

    private static FieldDeclaration inheritType(FieldDeclaration declaration, ClassifiedField existing) {
        if (declaration.kind() != FieldKind.PLAIN || declaration.annotated() || !existing.annotated()) {
            return declaration;
        }
        return new FieldDeclaration(declaration.name(),
                                    declaration.kind(),
                                    existing.type(),
                                    declaration.defaultValue(),
                                    declaration.derivation(),
                                    declaration.accessor());
    }

    private static void validateDerived(FieldTable table, ClassifiedField field) {
        var declaration = field.declaration();
        if (declaration.defaultValue()
                       .isPresent()) {
            throw ConfigException.invalidDeclaration(field.name(),
                                                     field.declaredIn(),
                                                     "derived field must leave its default unset, found '"
                                                     + declaration.defaultValue()
                                                                  .get() + "'");
        }
        if (!declaration.annotated()) {
            throw ConfigException.invalidDeclaration(field.name(),
                                                     field.declaredIn(),
                                                     "derived field must be type-annotated");
        }
        var derivation = declaration.derivation()
                                    .orElseThrow(() -> ConfigException.invalidDeclaration(field.name(),
                                                                                          field.declaredIn(),
                                                                                          "derived field has no resolver"));
        var position = table.position(field.name());
        for (var dependency : derivation.dependencies()) {
            var target = table.field(dependency)
                              .orElseThrow(() -> ConfigException.invalidDeclaration(field.name(),
                                                                                    field.declaredIn(),
                                                                                    "depends on undeclared field "
                                                                                    + dependency));
            if (target.kind() == FieldKind.OPAQUE) {
                throw ConfigException.invalidDeclaration(field.name(),
                                                         field.declaredIn(),
                                                         "depends on computed accessor " + dependency
                                                         + ", which is never part of resolution");
            }
            if (!target.annotated()) {
                throw ConfigException.invalidDeclaration(field.name(),
                                                         field.declaredIn(),
                                                         "depends on unannotated field " + dependency
                                                         + "; only type-annotated fields are visible to resolvers");
            }
            if (target.kind() == FieldKind.DERIVED && table.position(dependency) >= position) {
                throw ConfigException.invalidDeclaration(field.name(),
                                                         field.declaredIn(),
                                                         "depends on derived field " + dependency
                                                         + ", which is resolved after it");
            }
        }
    }
}
