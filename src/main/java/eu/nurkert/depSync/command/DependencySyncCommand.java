package eu.nurkert.depSync.command;

import eu.nurkert.depSync.core.SettingsLoader;
import eu.nurkert.depSync.core.SyncSettings;
import eu.nurkert.depSync.handlers.UpdateHandler;
import eu.nurkert.depSync.handlers.UpdateRunSummary;
import eu.nurkert.depSync.persistence.ConfigFileNotFoundException;
import eu.nurkert.depSync.persistence.VersionsFileRepository;
import eu.nurkert.depSync.persistence.VersionsMetadata;
import eu.nurkert.depSync.report.ConsoleReporter;
import eu.nurkert.depSync.report.GithubOutputWriter;
import eu.nurkert.depSync.update.DependencyRegistry;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@CommandLine.Command(
        name = "dependency-sync",
        mixinStandardHelpOptions = true,
        version = "dependency-sync 1.0.0",
        description = "Checks pinned dependency versions against their upstream registries "
                + "and optionally writes the updates back.")
public class DependencySyncCommand implements Callable<Integer> {

    private static final Logger LOGGER = Logger.getLogger(DependencySyncCommand.class.getName());

    @CommandLine.Option(names = "--write", description = "Persist discovered updates to the versions file")
    private boolean writeMode;

    @CommandLine.Option(names = {"-f", "--file"}, paramLabel = "<path>",
            description = "Versions file to check (default: versionsFile setting, versions.properties)")
    private Path versionsFile;

    @CommandLine.Option(names = "--only", split = ",", paramLabel = "<name>",
            description = "Restrict the run to the named dependencies")
    private List<String> only = new ArrayList<>();

    @CommandLine.Option(names = "--settings", paramLabel = "<path>",
            description = "Settings file overriding the bundled defaults (default: ./dependency-sync.yml)")
    private Path settingsFile = Path.of(SettingsLoader.SETTINGS_FILE_NAME);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec commandSpec;

    private final Map<String, String> environment;
    private final PrintStream out;
    private final PrintStream err;
    private final HandlerFactory handlerFactory;

    public DependencySyncCommand() {
        this(System.getenv(), System.out, System.err, UpdateHandler::fromSettings);
    }

    public DependencySyncCommand(Map<String, String> environment,
                                 PrintStream out,
                                 PrintStream err,
                                 HandlerFactory handlerFactory) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory");
    }

    @Override
    public Integer call() throws Exception {
        DependencyRegistry registry = selectRegistry();

        try {
            SyncSettings settings = new SettingsLoader().load(settingsFile);
            Path file = versionsFile != null ? versionsFile : Path.of(settings.versionsFile());

            ConsoleReporter reporter = new ConsoleReporter(out, String.valueOf(file.getFileName()));
            reporter.banner();

            VersionsMetadata metadata = new VersionsFileRepository().metadata(file);
            out.printf("Versions file: %s (last updated %s, FFmpeg %s)%n%n",
                    file, metadata.lastUpdated(), metadata.ffmpegVersion());

            UpdateHandler handler = handlerFactory.create(settings, registry, file, resolveToken(settings));
            handler.setProgressListener(reporter);
            reporter.checkingForUpdates();
            UpdateRunSummary summary = handler.run(writeMode);
            reporter.report(summary);
            new GithubOutputWriter(environment, settings.githubOutputEnv()).write(summary.results());
            return summary.exitCode();
        } catch (ConfigFileNotFoundException e) {
            err.println("Fatal error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Fatal error: " + e.getMessage());
            LOGGER.log(Level.FINE, "Run aborted", e);
            return 1;
        }
    }

    private DependencyRegistry selectRegistry() {
        DependencyRegistry registry = DependencyRegistry.defaults();
        if (only == null || only.isEmpty()) {
            return registry;
        }
        try {
            return registry.select(only);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(commandSpec.commandLine(), e.getMessage(), e);
        }
    }

    /**
     * First non-blank value among the configured token variables.
     */
    String resolveToken(SyncSettings settings) {
        for (String variable : settings.tokenEnv()) {
            String value = environment.get(variable);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    @FunctionalInterface
    public interface HandlerFactory {
        UpdateHandler create(SyncSettings settings, DependencyRegistry registry, Path versionsFile, String githubToken);
    }
}
