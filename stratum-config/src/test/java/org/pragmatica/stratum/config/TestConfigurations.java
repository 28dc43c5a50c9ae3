package org.pragmatica.stratum.config;

/**
 * Base and sub configuration classes exercising every field kind and override combination.
 */
final class TestConfigurations {
    static final String BASE_CODE = "utb";
    static final String SUB_CODE = "uts";

    static final ConfigurationClass BASE = Environments.DEFAULT.extend(BASE_CODE)
                                                               .longName("unittest_base")
                                                               .description("Unit Test Base Config")
                                                               .plain("CFG_A", "CFG_A")
                                                               .plain("CFG_B", "CFG_B")
                                                               .plain("CFG_C", "CFG_C")
                                                               .plain("CFG_D", "CFG_D")
                                                               .opaque("CFG_E", ComputedAccessor.joining(":", "CFG_A", "CFG_B"))
                                                               .opaque("CFG_F", self -> "CFG_F")
                                                               .opaque("CFG_G", self -> "CFG_G")
                                                               .plain("CFG_I", "CFG_I")
                                                               .plain("CFG_J", "CFG_J")
                                                               // composed once, from the declared defaults
                                                               .plain("CFG_K", "CFG_I" + ":" + "CFG_J")
                                                               .typed("CFG_M", FieldType.STRING, "CFG_M")
                                                               .typed("CFG_N", FieldType.STRING, "CFG_N")
                                                               .derived("CFG_O",
                                                                        FieldType.STRING,
                                                                        Derivation.postProcessor(resolved -> resolved.getString("CFG_M")
                                                                                                             + ":"
                                                                                                             + resolved.getString("CFG_N"),
                                                                                                 "CFG_M",
                                                                                                 "CFG_N"))
                                                               .typed("CFG_S", FieldType.STRING, "CFG_S")
                                                               .typed("CFG_T", FieldType.STRING, "CFG_T")
                                                               .derived("CFG_U", FieldType.STRING, Derivation.joining(":", "CFG_S", "CFG_T"))
                                                               .typed("CFG_V", FieldType.STRING, "CFG_V")
                                                               .typed("CFG_W", FieldType.STRING, "CFG_W")
                                                               .derived("CFG_X", FieldType.STRING, Derivation.joining(":", "CFG_V", "CFG_W"))
                                                               .build();

    static final ConfigurationClass SUB = BASE.extend(SUB_CODE)
                                              .longName("unittest_sub")
                                              .description("Unit Testing Sub Config")
                                              .plain(Environments.COMPONENT_NAME, "Unit Test SubConfig Component")
                                              .plain("CFG_A", "SUB_CFG_A")
                                              .opaque("SUB_1", ComputedAccessor.joining(":", "CFG_A", "CFG_D"))
                                              .plain("CFG_D", "SUB_CFG_D")
                                              .opaque("SUB_2", ComputedAccessor.joining(":", "CFG_A", "CFG_B"))
                                              .opaque("CFG_C", self -> "SUB_CFG_C")
                                              .opaque("CFG_G", self -> "SUB_CFG_G")
                                              .plain("SUB_3", "SUB_3")
                                              .plain("SUB_4", "SUB_4")
                                              .opaque("SUB_5", ComputedAccessor.joining(":", "SUB_3", "SUB_4"))
                                              .plain("CFG_X", "SUB_CFG_X")
                                              .build();

    static final EnvironmentRegistry REGISTRY = EnvironmentRegistry.environmentRegistry(Environments.LOCAL, BASE, SUB);

    private TestConfigurations() {}
}
