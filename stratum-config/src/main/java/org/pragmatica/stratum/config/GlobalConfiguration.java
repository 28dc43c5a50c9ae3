package org.pragmatica.stratum.config;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Process-wide configuration over the built-in environments and the real process environment.
 *
 * <p>Resolved on first access and shared afterwards. A {@code .env} file in the working
 * directory is used as the dotenv layer when present; its absence is not an error. Whether the
 * file is used is decided once per cache generation, so it appearing or disappearing later has
 * no effect until {@link #invalidate()}, which is meant for tests and administrative code paths only.
 */
public final class GlobalConfiguration {
    public static final Path DEFAULT_DOTENV = Path.of(".env");

    private static final ResolutionCache CACHE = ResolutionCache.resolutionCache(Environments.registry(),
                                                                                 System::getenv);
    private static final Object generationLock = new Object();
    private static volatile LoadRequest defaultRequest = detectDefaultRequest();

    private GlobalConfiguration() {}

    /**
     * The process configuration, without explicit arguments.
     */
    public static ResolvedConfiguration configuration() {
        return load(ExplicitArguments.none());
    }

    public static ResolvedConfiguration load(ExplicitArguments arguments) {
        return load(defaultRequest().withArguments(arguments));
    }

    public static ResolvedConfiguration load(LoadRequest request) {
        return CACHE.load(request);
    }

    public static void invalidate() {
        synchronized (generationLock) {
            defaultRequest = detectDefaultRequest();
            CACHE.invalidate();
        }
    }

    static LoadRequest defaultRequest() {
        return defaultRequest;
    }

    private static LoadRequest detectDefaultRequest() {
        return Files.isRegularFile(DEFAULT_DOTENV)
               ? LoadRequest.loadRequest()
                            .withDotenv(DEFAULT_DOTENV)
               : LoadRequest.loadRequest();
    }
}
