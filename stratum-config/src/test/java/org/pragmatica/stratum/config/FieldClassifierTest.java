package org.pragmatica.stratum.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.stratum.config.TestConfigurations.BASE;
import static org.pragmatica.stratum.config.TestConfigurations.SUB;

class FieldClassifierTest {

    @Test
    void classify_partitionsFieldsByKind() {
        var fields = BASE.fields();

        assertThat(fields.field("CFG_A")
                         .map(ClassifiedField::kind)).contains(FieldKind.PLAIN);
        assertThat(fields.field("CFG_E")
                         .map(ClassifiedField::kind)).contains(FieldKind.OPAQUE);
        assertThat(fields.field("CFG_U")
                         .map(ClassifiedField::kind)).contains(FieldKind.DERIVED);
        assertThat(fields.opaqueNames()).containsExactly("CFG_E", "CFG_F", "CFG_G");
        assertThat(fields.derived()
                         .stream()
                         .map(ClassifiedField::name)).containsExactly(Environments.POSTGRES_DSN,
                                                                       "CFG_O",
                                                                       "CFG_U",
                                                                       "CFG_X");
    }

    @Test
    void classify_tracksInheritanceOrigin() {
        var overridden = SUB.fields()
                            .field("CFG_A")
                            .orElseThrow();
        var inherited = SUB.fields()
                           .field("CFG_B")
                           .orElseThrow();

        assertThat(overridden.introducedIn()).isEqualTo("utb");
        assertThat(overridden.declaredIn()).isEqualTo("uts");
        assertThat(overridden.staticLayer()).isEqualTo(OverrideLayer.SUBCLASS_OVERRIDE);
        assertThat(inherited.staticLayer()).isEqualTo(OverrideLayer.DEFAULT);
    }

    @Test
    void classify_keepsPositionOfRedeclaredField() {
        var names = SUB.fields()
                       .all()
                       .stream()
                       .map(ClassifiedField::name)
                       .toList();

        assertThat(names.indexOf("CFG_A")).isLessThan(names.indexOf("CFG_B"));
        assertThat(names).endsWith("SUB_1", "SUB_2", "SUB_3", "SUB_4", "SUB_5");
    }

    @Test
    void plainRedeclaration_inheritsTypeAnnotation() {
        var field = SUB.fields()
                       .field("CFG_X")
                       .orElseThrow();

        assertThat(field.kind()).isEqualTo(FieldKind.PLAIN);
        assertThat(field.type()).contains(FieldType.STRING);
    }

    @Test
    void computedAccessor_mayReplaceInheritedPlainField() {
        assertThat(SUB.fields()
                      .field("CFG_C")
                      .map(ClassifiedField::kind)).contains(FieldKind.OPAQUE);
        assertThat(SUB.fields()
                      .tracked()
                      .stream()
                      .map(ClassifiedField::name)).doesNotContain("CFG_C");
    }

    @Test
    void storedRedeclaration_ofComputedAccessor_isRejected() {
        assertThatThrownBy(() -> BASE.extend("shadow")
                                     .typed("CFG_F", FieldType.STRING, "F")
                                     .build())
            .isInstanceOfSatisfying(ConfigException.AmbiguousOverrideShadowing.class,
                                    error -> {
                                        assertThat(error.field()).isEqualTo("CFG_F");
                                        assertThat(error.parentClass()).isEqualTo("utb");
                                        assertThat(error.childClass()).isEqualTo("shadow");
                                    });
    }

    @Test
    void duplicateDeclaration_inOneClass_isRejected() {
        assertThatThrownBy(() -> ConfigurationClass.configurationClass("dup")
                                                   .plain("A", "1")
                                                   .plain("A", "2")
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("declared more than once");
    }

    @Test
    void derivedField_withStaticDefault_isRejected() {
        var declaration = FieldDeclaration.derived("URL", FieldType.STRING, Derivation.joining(":", "HOST"))
                                          .withDefaultValue("preset");

        assertThatThrownBy(() -> ConfigurationClass.configurationClass("preset")
                                                   .typed("HOST", FieldType.STRING, "localhost")
                                                   .declare(declaration)
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("URL")
            .hasMessageContaining("default unset");
    }

    @Test
    void derivedField_withoutTypeAnnotation_isRejected() {
        var declaration = new FieldDeclaration("URL",
                                               FieldKind.DERIVED,
                                               Optional.empty(),
                                               Optional.empty(),
                                               Optional.of(Derivation.joining(":", "HOST")),
                                               Optional.empty());

        assertThatThrownBy(() -> ConfigurationClass.configurationClass("untyped")
                                                   .typed("HOST", FieldType.STRING, "localhost")
                                                   .declare(declaration)
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("type-annotated");
    }

    @Test
    void derivedField_withoutResolver_isRejected() {
        var declaration = new FieldDeclaration("URL",
                                               FieldKind.DERIVED,
                                               Optional.of(FieldType.STRING),
                                               Optional.empty(),
                                               Optional.empty(),
                                               Optional.empty());

        assertThatThrownBy(() -> ConfigurationClass.configurationClass("noresolver")
                                                   .declare(declaration)
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("no resolver");
    }

    @Test
    void derivedField_readingUnannotatedField_isRejected() {
        assertThatThrownBy(() -> ConfigurationClass.configurationClass("unannotated")
                                                   .plain("HOST", "localhost")
                                                   .derived("URL", FieldType.STRING, Derivation.joining(":", "HOST"))
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("unannotated field HOST");
    }

    @Test
    void derivedField_readingComputedAccessor_isRejected() {
        assertThatThrownBy(() -> BASE.extend("opaque-dependency")
                                     .derived("CFG_Z", FieldType.STRING, Derivation.joining(":", "CFG_E"))
                                     .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("computed accessor CFG_E");
    }

    @Test
    void derivedField_readingLaterDerivedField_isRejected() {
        assertThatThrownBy(() -> ConfigurationClass.configurationClass("order")
                                                   .typed("HOST", FieldType.STRING, "localhost")
                                                   .derived("FIRST", FieldType.STRING, Derivation.joining(":", "SECOND"))
                                                   .derived("SECOND", FieldType.STRING, Derivation.joining(":", "HOST"))
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("resolved after it");
    }

    @Test
    void derivedField_readingUndeclaredField_isRejected() {
        assertThatThrownBy(() -> ConfigurationClass.configurationClass("undeclared")
                                                   .derived("URL", FieldType.STRING, Derivation.joining(":", "HOST"))
                                                   .build())
            .isInstanceOf(ConfigException.InvalidFieldDeclaration.class)
            .hasMessageContaining("undeclared field HOST");
    }

    @Test
    void derivedField_readingEarlierDerivedField_isAccepted() {
        var chained = ConfigurationClass.configurationClass("chained")
                                        .typed("HOST", FieldType.STRING, "localhost")
                                        .typed("PORT", FieldType.INTEGER, 5432)
                                        .derived("ADDRESS", FieldType.STRING, Derivation.joining(":", "HOST", "PORT"))
                                        .derived("URL",
                                                 FieldType.STRING,
                                                 Derivation.defaultFactory(resolved -> "tcp://" + resolved.get("ADDRESS"),
                                                                           "ADDRESS"))
                                        .build();

        var config = ConfigurationResolver.resolve(chained, Map.of("PORT", "6432"));

        assertThat(config.get("ADDRESS")).contains("localhost:6432");
        assertThat(config.get("URL")).contains("tcp://localhost:6432");
    }

    @Test
    void classify_ofBuiltClass_matchesItsTable() {
        assertThat(FieldClassifier.classify(SUB)
                                  .all()).isEqualTo(SUB.fields()
                                                       .all());
        assertThat(FieldClassifier.classify(FieldTable.empty(), "empty", List.of())
                                  .all()).isEmpty();
    }
}
