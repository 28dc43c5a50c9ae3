package org.pragmatica.stratum.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GlobalConfigurationTest {

    @Test
    void configuration_isSharedUntilInvalidated() {
        assumeTrue(System.getenv(EnvironmentRegistry.ENV_CODE_VAR) == null, "selector variable set by the build");

        var first = GlobalConfiguration.configuration();

        assertThat(GlobalConfiguration.configuration()).isSameAs(first);
        assertThat(first.environmentCode()).isEqualTo(EnvironmentRegistry.DEFAULT_ENV_CODE);

        GlobalConfiguration.invalidate();

        assertThat(GlobalConfiguration.configuration()).isNotSameAs(first);
    }

    @Test
    void load_withArguments_appliesThemOnTopOfProcessEnvironment() {
        assumeTrue(System.getenv(EnvironmentRegistry.ENV_CODE_VAR) == null, "selector variable set by the build");

        var config = GlobalConfiguration.load(ExplicitArguments.parse("COMPONENT_NAME=global-test"));

        assertThat(config.get(Environments.COMPONENT_NAME)).contains("global-test");
        assertThat(config.provenance(Environments.COMPONENT_NAME)).contains(OverrideLayer.EXPLICIT_ARGUMENT);
    }

    @Test
    void defaultRequest_isDecidedOncePerGeneration() {
        var first = GlobalConfiguration.defaultRequest();

        assertThat(GlobalConfiguration.defaultRequest()).isSameAs(first);

        GlobalConfiguration.invalidate();
        var next = GlobalConfiguration.defaultRequest();

        assertThat(next).isEqualTo(first);
        assertThat(GlobalConfiguration.defaultRequest()).isSameAs(next);
    }
}
