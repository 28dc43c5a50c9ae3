package org.pragmatica.stratum.cli;

import org.pragmatica.stratum.config.ConfigException;
import org.pragmatica.stratum.config.EnvironmentRegistry;
import org.pragmatica.stratum.config.Environments;
import org.pragmatica.stratum.config.ExplicitArguments;
import org.pragmatica.stratum.config.LoadRequest;
import org.pragmatica.stratum.config.ResolutionCache;
import org.pragmatica.stratum.config.ResolvedConfiguration;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Command-line access to the resolved configuration.
 *
 * <p>Usage examples:
 * <pre>
 * stratum dump
 * stratum --env lcl --env-file ./.env dump --show-provenance
 * stratum --config "COMPONENT_NAME=batch POSTGRES_PORT=6432" get POSTGRES_DSN
 * stratum environments
 * </pre>
 */
@Command(name = "stratum",
         mixinStandardHelpOptions = true,
         version = "Stratum 0.1.0",
         description = "Resolve and inspect the layered configuration of an environment",
         subcommands = {
                 StratumCli.DumpCommand.class,
                 StratumCli.GetCommand.class,
                 StratumCli.EnvironmentsCommand.class
         })
public class StratumCli implements Runnable {

    @Option(names = {"-e", "--env"},
            description = "Environment code; defaults to $" + EnvironmentRegistry.ENV_CODE_VAR + " or "
                          + EnvironmentRegistry.DEFAULT_ENV_CODE)
    private String environmentCode;

    @Option(names = "--env-file", description = "Dotenv file with KEY=VALUE lines")
    private Path envFile;

    @Option(names = "--config",
            description = "Space-separated KEY=VALUE overrides, e.g. --config \"A=1 B=2\"")
    private List<String> overrides = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final EnvironmentRegistry registry;
    private final Supplier<Map<String, String>> environment;

    public StratumCli() {
        this(Environments.registry(), System::getenv);
    }

    StratumCli(EnvironmentRegistry registry, Supplier<Map<String, String>> environment) {
        this.registry = registry;
        this.environment = environment;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new StratumCli()).execute(args));
    }

    static CommandLine commandLine(StratumCli cli) {
        return new CommandLine(cli).setExecutionExceptionHandler((exception, commandLine, parseResult) -> {
            if (exception instanceof ConfigException) {
                commandLine.getErr()
                           .println("Error: " + exception.getMessage());
                return 1;
            }
            throw exception;
        });
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    ResolvedConfiguration resolve() {
        var request = LoadRequest.loadRequest(ExplicitArguments.parse(overrides))
                                 .withEnvironment(environmentCode)
                                 .withDotenv(envFile);
        return ResolutionCache.resolutionCache(registry, environment)
                              .load(request);
    }

    PrintWriter out() {
        return spec.commandLine()
                   .getOut();
    }

    // ===== Subcommands =====

    @Command(name = "dump", description = "Print every resolved field as KEY=VALUE")
    static class DumpCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private StratumCli parent;

        @Option(names = "--show-provenance", description = "Append the layer that supplied each value")
        private boolean showProvenance;

        @Override
        public Integer call() {
            var configuration = parent.resolve();
            var out = parent.out();
            out.println("# environment: " + configuration.environmentCode());
            configuration.render(showProvenance)
                         .forEach(out::println);
            out.flush();
            return 0;
        }
    }

    @Command(name = "get", description = "Print one field or computed attribute")
    static class GetCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private StratumCli parent;

        @Parameters(index = "0", description = "Field or computed attribute name")
        private String name;

        @Override
        public Integer call() {
            var value = parent.resolve()
                              .attribute(name);
            if (value.isEmpty()) {
                parent.spec.commandLine()
                           .getErr()
                           .println("Error: no field or attribute named " + name);
                return 1;
            }
            parent.out()
                  .println(value.get());
            parent.out()
                  .flush();
            return 0;
        }
    }

    @Command(name = "environments", description = "List registered environments")
    static class EnvironmentsCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private StratumCli parent;

        @Override
        public Integer call() {
            var out = parent.out();
            for (var code : parent.registry.codes()) {
                parent.registry.find(code)
                      .ifPresent(configurationClass -> out.println(code + "\t" + configurationClass.longName() + "\t"
                                                                   + configurationClass.description()));
            }
            out.flush();
            return 0;
        }
    }
}
