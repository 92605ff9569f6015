package eu.nurkert.depSync.report;

import eu.nurkert.depSync.handlers.UpdateRunSummary;
import eu.nurkert.depSync.update.DependencyDescriptor;
import eu.nurkert.depSync.update.UpdateProgressListener;
import eu.nurkert.depSync.update.UpdateResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Human readable progress and summary output of a run. Progress lines arrive from the
 * worker threads as checks start and finish, so each line names its dependency.
 */
public class ConsoleReporter implements UpdateProgressListener {

    private static final String RULE = "========================================";

    private final PrintStream out;
    private final String fileName;

    public ConsoleReporter(PrintStream out, String fileName) {
        this.out = Objects.requireNonNull(out, "out");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
    }

    public void banner() {
        heading("Dependency Version Checker");
    }

    public synchronized void checkingForUpdates() {
        out.println("Checking for updates...");
        out.println();
    }

    @Override
    public synchronized void onCheckStarted(DependencyDescriptor dependency, String currentVersion) {
        out.printf("  Checking %s (current: %s)...%n", dependency.getName(), currentVersion);
    }

    @Override
    public synchronized void onCheckCompleted(DependencyDescriptor dependency, UpdateResult result) {
        String name = result.name();
        if (result.hasError()) {
            out.printf("    %s: Error: %s%n", name, result.error());
            return;
        }
        if (result.hasChecksumError()) {
            out.printf("    %s: Checksum error: %s%n", name, result.checksumError());
        }
        if (!result.updated()) {
            out.printf("    %s: Up to date%n", name);
            return;
        }
        out.printf("    %s: Update available: %s → %s%n", name, result.currentVersion(), result.latestVersion());
        dependency.getReleasesUrl()
                .or(dependency::getHomepage)
                .ifPresent(url -> out.printf("      Release notes: %s%n", url));
        dependency.getLicense()
                .ifPresent(license -> out.printf("      License: %s (%s)%n", license.name(), license.url()));
    }

    public synchronized void report(UpdateRunSummary summary) {
        out.println();
        heading("Summary");
        List<UpdateResult> updates = summary.updates();
        if (updates.isEmpty()) {
            out.println("All dependencies up to date");
        } else {
            out.printf("%d update(s) available:%n%n", updates.size());
            for (UpdateResult update : updates) {
                out.printf("  - %s: %s → %s%n", update.name(), update.currentVersion(), update.latestVersion());
            }
        }

        List<UpdateResult> errors = summary.errors();
        if (!errors.isEmpty()) {
            out.printf("%n%d error(s) occurred:%n%n", errors.size());
            for (UpdateResult error : errors) {
                out.printf("  - %s: %s%n", error.name(), error.hasError() ? error.error() : error.checksumError());
            }
        }

        if (summary.written()) {
            out.println();
            out.println("Updated " + fileName);
        } else if (summary.writeMode()) {
            out.println();
            out.println("No updates to write");
        } else if (!updates.isEmpty()) {
            out.println();
            out.println("Run with --write to update " + fileName);
        }
    }

    private void heading(String title) {
        out.println(RULE);
        out.println(title);
        out.println(RULE);
        out.println();
    }
}
