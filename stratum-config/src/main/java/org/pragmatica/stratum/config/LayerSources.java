package org.pragmatica.stratum.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Inputs of the layers above the class declarations, captured for one resolution.
 *
 * @param dotenvPath  dotenv file to read; absent means the layer is skipped
 * @param environment snapshot of the process environment
 * @param arguments   explicit arguments
 */
public record LayerSources(Optional<Path> dotenvPath, Map<String, String> environment, ExplicitArguments arguments) {
    public LayerSources {
        environment = Map.copyOf(environment);
    }

    public static LayerSources layerSources(Map<String, String> environment) {
        return new LayerSources(Optional.empty(), environment, ExplicitArguments.none());
    }

    public static LayerSources layerSources(Optional<Path> dotenvPath,
                                            Map<String, String> environment,
                                            ExplicitArguments arguments) {
        return new LayerSources(dotenvPath, environment, arguments);
    }

    public LayerSources withDotenv(Path path) {
        return new LayerSources(Optional.of(path), environment, arguments);
    }

    public LayerSources withArguments(ExplicitArguments arguments) {
        return new LayerSources(dotenvPath, environment, arguments);
    }
}
