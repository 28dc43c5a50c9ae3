package org.pragmatica.stratum.config;

/**
 * Built-in runtime environments.
 *
 * <p>{@link #DEFAULT} holds the settings every environment shares and is abstract. Database
 * coordinates are placeholders there, to be supplied by each environment or its process
 * environment. {@code POSTGRES_DSN} is composed from them unless supplied directly.
 */
public final class Environments {
    public static final String COMPONENT_NAME = "COMPONENT_NAME";
    public static final String POSTGRES_HOST = "POSTGRES_HOST";
    public static final String POSTGRES_PORT = "POSTGRES_PORT";
    public static final String POSTGRES_USER = "POSTGRES_USER";
    public static final String POSTGRES_PASSWORD = "POSTGRES_PASSWORD";
    public static final String POSTGRES_DB = "POSTGRES_DB";
    public static final String POSTGRES_DSN = "POSTGRES_DSN";

    public static final ConfigurationClass DEFAULT = ConfigurationClass.abstractConfigurationClass("default")
                                                                       .longName("default")
                                                                       .description("Settings shared by every environment")
                                                                       .plain(COMPONENT_NAME, "Stratum Service")
                                                                       .typed(POSTGRES_HOST,
                                                                              FieldType.STRING,
                                                                              Sentinel.ENV_SPECIFIC_OVERRIDE.value())
                                                                       .typed(POSTGRES_PORT,
                                                                              FieldType.STRING,
                                                                              Sentinel.ENV_SPECIFIC_OVERRIDE.value())
                                                                       .typed(POSTGRES_USER,
                                                                              FieldType.STRING,
                                                                              Sentinel.ENV_SPECIFIC_OVERRIDE.value())
                                                                       .typed(POSTGRES_PASSWORD,
                                                                              FieldType.STRING,
                                                                              Sentinel.USER_SPECIFIC_OVERRIDE.value())
                                                                       .typed(POSTGRES_DB,
                                                                              FieldType.STRING,
                                                                              Sentinel.ENV_SPECIFIC_OVERRIDE.value())
                                                                       .derived(POSTGRES_DSN,
                                                                                FieldType.STRING,
                                                                                Derivation.defaultFactory(Environments::postgresDsn,
                                                                                                          POSTGRES_USER,
                                                                                                          POSTGRES_PASSWORD,
                                                                                                          POSTGRES_HOST,
                                                                                                          POSTGRES_PORT,
                                                                                                          POSTGRES_DB))
                                                                       .build();

    public static final ConfigurationClass LOCAL = DEFAULT.extend(EnvironmentRegistry.DEFAULT_ENV_CODE)
                                                          .longName("local")
                                                          .description("Developer workstation with a local database")
                                                          .plain(POSTGRES_HOST, "localhost")
                                                          .plain(POSTGRES_PORT, "5432")
                                                          .plain(POSTGRES_USER, "stratum")
                                                          .plain(POSTGRES_PASSWORD, "stratum")
                                                          .plain(POSTGRES_DB, "stratum")
                                                          .build();

    private static final EnvironmentRegistry REGISTRY = EnvironmentRegistry.environmentRegistry(LOCAL);

    private Environments() {}

    public static EnvironmentRegistry registry() {
        return REGISTRY;
    }

    static String postgresDsn(ResolvedValues resolved) {
        return "postgres://" + resolved.getString(POSTGRES_USER) + ":" + resolved.getString(POSTGRES_PASSWORD) + "@"
               + resolved.getString(POSTGRES_HOST) + ":" + resolved.getString(POSTGRES_PORT) + "/"
               + resolved.getString(POSTGRES_DB);
    }
}
