package org.pragmatica.stratum.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What a caller asks the resolution cache for. Equal requests share one resolved
 * configuration within a cache generation.
 *
 * @param environmentCode explicit environment selector; empty defers to {@value EnvironmentRegistry#ENV_CODE_VAR}
 * @param dotenvPath      dotenv file to read; empty skips the dotenv layer
 * @param arguments       explicit arguments
 */
public record LoadRequest(Optional<String> environmentCode, Optional<Path> dotenvPath, ExplicitArguments arguments) {
    private static final LoadRequest DEFAULT = new LoadRequest(Optional.empty(), Optional.empty(), ExplicitArguments.none());

    public static LoadRequest loadRequest() {
        return DEFAULT;
    }

    public static LoadRequest loadRequest(ExplicitArguments arguments) {
        return DEFAULT.withArguments(arguments);
    }

    public LoadRequest withEnvironment(String code) {
        return new LoadRequest(Optional.ofNullable(code), dotenvPath, arguments);
    }

    public LoadRequest withDotenv(Path path) {
        return new LoadRequest(environmentCode, Optional.ofNullable(path), arguments);
    }

    public LoadRequest withArguments(ExplicitArguments arguments) {
        return new LoadRequest(environmentCode, dotenvPath, arguments);
    }
}
