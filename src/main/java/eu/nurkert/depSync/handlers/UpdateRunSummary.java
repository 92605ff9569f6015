package eu.nurkert.depSync.handlers;

import eu.nurkert.depSync.update.UpdateResult;

import java.util.List;

/**
 * Everything one run produced: per dependency results in registry order and whether the
 * versions file was rewritten.
 */
public record UpdateRunSummary(List<UpdateResult> results, boolean writeMode, boolean written) {

    public UpdateRunSummary {
        results = List.copyOf(results);
    }

    public List<UpdateResult> updates() {
        return results.stream().filter(UpdateResult::updated).toList();
    }

    /**
     * Fetch failures and checksum failures.
     */
    public List<UpdateResult> errors() {
        return results.stream().filter(result -> result.hasError() || result.hasChecksumError()).toList();
    }

    public boolean hasUpdates() {
        return results.stream().anyMatch(UpdateResult::updated);
    }

    /**
     * {@code 1} when a dependency failed and nothing was written in this run, otherwise
     * {@code 0}. A run that persisted at least one update succeeds even if an unrelated
     * dependency failed to resolve.
     */
    public int exitCode() {
        return !errors().isEmpty() && !written ? 1 : 0;
    }
}
