package io.entryrender.cli;

import io.entryrender.cli.config.ConfigLoadException;
import io.entryrender.cli.config.ConfigLoader;
import io.entryrender.cli.config.RenderConfig;
import io.entryrender.core.engine.EntryPreviewService;
import io.entryrender.core.engine.EntryRenderer;
import io.entryrender.core.engine.RenderOptions;
import io.entryrender.core.error.ProfileLoadException;
import io.entryrender.core.model.DisplayProfile;
import io.entryrender.core.profile.DisplayProfileParser;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command-line renderer: loads the configuration and display profile, then prints the preview
 * markup of each entry file on its own line.
 *
 * <p>
 * Configuration comes from {@code --config}, else {@code entry-render.yaml} in the working
 * directory if present, else the environment alone. {@code --profile} overrides every other
 * profile setting.
 */
@Command(
        name = "entry-render",
        description = "Render dictionary entry XML files as preview markup with a display profile.")
public final class RenderCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RenderCli.class);

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_FAILURE = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @Option(
            names = "--config",
            paramLabel = "FILE",
            description = "YAML configuration file (default: ./" + ConfigLoader.DEFAULT_CONFIG_FILE + " if present)")
    private Path config;

    @Option(
            names = "--profile",
            paramLabel = "FILE",
            description = "Display profile YAML; overrides render.profile and ENTRY_RENDER_PROFILE")
    private String profile;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean help;

    @Parameters(paramLabel = "ENTRY", arity = "1..*", description = "Entry XML files to render")
    private List<Path> entries;

    @Spec
    private CommandSpec commandSpec;

    private final Function<String, String> envLookup;
    private final boolean configureLogging;

    public RenderCli() {
        this(System::getenv, true);
    }

    RenderCli(Function<String, String> envLookup, boolean configureLogging) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.configureLogging = configureLogging;
    }

    /**
     * Parses the arguments and runs the renderer.
     *
     * @param out receives the rendered markup and help output
     * @param err receives usage and error messages
     * @return {@code 0} on success, {@code 1} if configuration, the profile or any entry file
     *         could not be loaded, {@code 2} on a usage error
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        PrintWriter outWriter = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true);
        PrintWriter errWriter = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true);
        CommandLine commandLine = new CommandLine(this)
                .setOut(outWriter)
                .setErr(errWriter)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    LOG.error("Rendering failed: {}", e.getMessage(), e);
                    cmd.getErr().println("Rendering failed: " + e.getMessage());
                    return EXIT_FAILURE;
                });
        int status = commandLine.execute(args);
        outWriter.flush();
        errWriter.flush();
        return status;
    }

    @Override
    public Integer call() {
        PrintWriter out = commandSpec.commandLine().getOut();
        PrintWriter err = commandSpec.commandLine().getErr();

        RenderConfig renderConfig;
        try {
            renderConfig = loadConfig();
        } catch (ConfigLoadException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(renderConfig.loggingFormat(), renderConfig.loggingLevel());
        }

        DisplayProfile displayProfile;
        try {
            displayProfile = new DisplayProfileParser().parse(Path.of(renderConfig.profilePath()));
        } catch (ProfileLoadException e) {
            LOG.error("Failed to load display profile {}: {}", e.source(), e.getMessage());
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }

        EntryRenderer renderer =
                new EntryRenderer(new RenderOptions(renderConfig.assetBasePath(), renderConfig.language()));
        EntryPreviewService preview = new EntryPreviewService(renderer);

        int failures = 0;
        for (Path entry : entries) {
            String xml;
            try {
                xml = Files.readString(entry, StandardCharsets.UTF_8);
            } catch (IOException e) {
                LOG.error("Failed to read entry file {}: {}", entry, e.getMessage());
                err.println("Cannot read " + entry + ": " + e.getMessage());
                failures++;
                continue;
            }
            out.println(preview.render(xml, displayProfile));
        }
        LOG.info("Rendered {} of {} entries with profile '{}'", entries.size() - failures, entries.size(),
                displayProfile.id());
        return failures == 0 ? EXIT_OK : EXIT_FAILURE;
    }

    private RenderConfig loadConfig() {
        Function<String, String> lookup = profile == null
                ? envLookup
                : name -> "ENTRY_RENDER_PROFILE".equals(name) ? profile : envLookup.apply(name);
        if (config != null) {
            return ConfigLoader.load(config, lookup);
        }
        Path defaultConfig = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultConfig)) {
            return ConfigLoader.load(defaultConfig, lookup);
        }
        return ConfigLoader.fromEnvironment(lookup);
    }
}
