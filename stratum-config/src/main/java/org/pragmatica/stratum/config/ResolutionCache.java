package org.pragmatica.stratum.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes resolved configurations per {@link LoadRequest}.
 *
 * <p>At most one resolution runs at a time. Callers that miss concurrently wait for it and
 * receive the same instance, or the same failure. A hit returns the memoized result without
 * reading any layer. {@link #invalidate()} starts a new generation: the next load reads the
 * environment and the dotenv file afresh, while references handed out earlier stay unchanged.
 */
public final class ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

    private final EnvironmentRegistry registry;
    private final Supplier<Map<String, String>> environment;
    private final ConcurrentHashMap<LoadRequest, Outcome> entries = new ConcurrentHashMap<>();
    private final Object resolveLock = new Object();
    private volatile long generation;

    private ResolutionCache(EnvironmentRegistry registry, Supplier<Map<String, String>> environment) {
        this.registry = registry;
        this.environment = environment;
    }

    /**
     * Create a cache over the given registry.
     *
     * @param registry    environments to select from
     * @param environment source of the process environment, read once per resolution
     */
    public static ResolutionCache resolutionCache(EnvironmentRegistry registry,
                                                  Supplier<Map<String, String>> environment) {
        return new ResolutionCache(registry, environment);
    }

    public ResolvedConfiguration load() {
        return load(LoadRequest.loadRequest());
    }

    public ResolvedConfiguration load(ExplicitArguments arguments) {
        return load(LoadRequest.loadRequest(arguments));
    }

    /**
     * Return the configuration for the request, resolving it on a miss.
     *
     * @throws ConfigException if resolution failed in this generation
     */
    public ResolvedConfiguration load(LoadRequest request) {
        // Fast path: already resolved in this generation
        var existing = entries.get(request);
        if (existing != null) {
            return existing.get();
        }
        synchronized (resolveLock) {
            existing = entries.get(request);
            if (existing != null) {
                log.debug("Returning configuration resolved by a concurrent caller");
                return existing.get();
            }
            var outcome = resolve(request);
            entries.put(request, outcome);
            return outcome.get();
        }
    }

    /**
     * Discard every memoized configuration. Intended for tests and administrative tooling.
     */
    public void invalidate() {
        synchronized (resolveLock) {
            entries.clear();
            generation++;
            log.info("Configuration cache invalidated, generation {}", generation);
        }
    }

    public long generation() {
        return generation;
    }

    private Outcome resolve(LoadRequest request) {
        try{
            var snapshot = Map.copyOf(environment.get());
            var configurationClass = request.environmentCode()
                                            .map(code -> registry.select(Optional.of(code)))
                                            .orElseGet(() -> registry.selectFrom(snapshot));
            log.info("Resolving configuration for environment {}", configurationClass.code());
            var resolved = ConfigurationResolver.resolve(configurationClass,
                                                         LayerSources.layerSources(request.dotenvPath(),
                                                                                   snapshot,
                                                                                   request.arguments()));
            if (!resolved.unsetFields()
                         .isEmpty()) {
                log.warn("Environment {} leaves fields without a value: {}",
                         resolved.environmentCode(),
                         resolved.unsetFields());
            }
            return Outcome.resolved(resolved);
        } catch (ConfigException e) {
            log.error("Configuration resolution failed: {}", e.getMessage());
            return Outcome.failed(e);
        }
    }

    private record Outcome(ResolvedConfiguration configuration, ConfigException failure) {
        static Outcome resolved(ResolvedConfiguration configuration) {
            return new Outcome(configuration, null);
        }

        static Outcome failed(ConfigException failure) {
            return new Outcome(null, failure);
        }

        ResolvedConfiguration get() {
            if (failure != null) {
                throw failure;
            }
            return configuration;
        }
    }
}
