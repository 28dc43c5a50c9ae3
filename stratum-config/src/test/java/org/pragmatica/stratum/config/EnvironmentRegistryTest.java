package org.pragmatica.stratum.config;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.stratum.config.TestConfigurations.REGISTRY;
import static org.pragmatica.stratum.config.TestConfigurations.SUB;

class EnvironmentRegistryTest {

    @Test
    void select_defaultsToLocal() {
        assertThat(REGISTRY.select(Optional.empty())).isSameAs(Environments.LOCAL);
        assertThat(REGISTRY.select(Optional.of("  "))).isSameAs(Environments.LOCAL);
        assertThat(REGISTRY.selectFrom(Map.of())).isSameAs(Environments.LOCAL);
    }

    @Test
    void select_matchesCodeIgnoringCaseAndWhitespace() {
        assertThat(REGISTRY.select(Optional.of("uts"))).isSameAs(SUB);
        assertThat(REGISTRY.select(Optional.of(" UTS "))).isSameAs(SUB);
    }

    @Test
    void selectFrom_readsSelectorVariable() {
        assertThat(REGISTRY.selectFrom(Map.of(EnvironmentRegistry.ENV_CODE_VAR, "uts"))).isSameAs(SUB);
    }

    @Test
    void select_rejectsUnknownCode_listingValidOnes() {
        assertThatThrownBy(() -> REGISTRY.select(Optional.of("prd")))
            .isInstanceOfSatisfying(ConfigException.UnknownEnvironment.class,
                                    error -> assertThat(error.code()).isEqualTo("prd"))
            .hasMessage("Unknown environment: prd. Valid: lcl, utb, uts");
    }

    @Test
    void registry_rejectsAbstractClass() {
        assertThatThrownBy(() -> EnvironmentRegistry.environmentRegistry(Environments.LOCAL, Environments.DEFAULT))
            .isInstanceOf(ConfigException.AbstractInstantiation.class);
    }

    @Test
    void registry_rejectsDuplicateCode() {
        var twin = Environments.DEFAULT.extend(EnvironmentRegistry.DEFAULT_ENV_CODE)
                                       .build();

        assertThatThrownBy(() -> EnvironmentRegistry.environmentRegistry(Environments.LOCAL, twin))
            .isInstanceOf(ConfigException.DuplicateEnvironment.class)
            .hasMessageContaining("lcl");
    }

    @Test
    void codes_keepRegistrationOrder() {
        assertThat(REGISTRY.codes()).containsExactly("lcl", "utb", "uts");
        assertThat(REGISTRY.find("utb")).isPresent();
        assertThat(REGISTRY.find("default")).isEmpty();
    }
}
