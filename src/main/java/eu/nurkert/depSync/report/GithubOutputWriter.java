package eu.nurkert.depSync.report;

import eu.nurkert.depSync.update.UpdateResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Appends step outputs for GitHub Actions to the file named by the configured environment
 * variable ({@code GITHUB_OUTPUT} by default). Outside of Actions the variable is unset and
 * nothing is written.
 */
public class GithubOutputWriter {

    private static final Logger LOGGER = Logger.getLogger(GithubOutputWriter.class.getName());

    static final String DELIMITER = "EOF";

    private final Map<String, String> environment;
    private final String outputVariable;

    public GithubOutputWriter(Map<String, String> environment, String outputVariable) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.outputVariable = Objects.requireNonNull(outputVariable, "outputVariable");
    }

    /**
     * @return {@code true} if the outputs were appended
     */
    public boolean write(List<UpdateResult> results) {
        String target = environment.get(outputVariable);
        if (target == null || target.isBlank()) {
            return false;
        }
        Path outputFile = Path.of(target);
        try {
            Files.writeString(outputFile, format(results), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            return true;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to write GitHub output to {0}: {1}",
                    new Object[]{outputFile, e.getMessage()});
            return false;
        }
    }

    static String format(List<UpdateResult> results) {
        List<UpdateResult> updates = results.stream().filter(UpdateResult::updated).toList();
        String summary = updates.isEmpty()
                ? "No updates available"
                : updates.stream()
                        .map(u -> "- **" + u.name() + "**: " + u.currentVersion() + " → " + u.latestVersion())
                        .collect(Collectors.joining("\n"));
        return "updates_available=" + !updates.isEmpty() + "\n"
                + "update_summary<<" + DELIMITER + "\n"
                + summary + "\n"
                + DELIMITER + "\n";
    }
}
