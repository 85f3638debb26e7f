package com.phillippitts.scalogram.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Totals of one batch run.
 *
 * @param total     number of inputs
 * @param succeeded number of {@link ProcessingResult.Success} results
 * @param failures  failures in input order
 */
public record BatchSummary(int total, int succeeded, List<ProcessingResult.Failure> failures) {

    public BatchSummary {
        failures = List.copyOf(failures);
    }

    /**
     * Summarises an ordered result list.
     *
     * @param results results of one batch run
     * @return the summary
     */
    public static BatchSummary of(List<? extends ProcessingResult> results) {
        int ok = 0;
        List<ProcessingResult.Failure> failed = new ArrayList<>();
        for (ProcessingResult result : results) {
            if (result instanceof ProcessingResult.Failure failure) {
                failed.add(failure);
            } else {
                ok++;
            }
        }
        return new BatchSummary(results.size(), ok, failed);
    }

    public int failed() {
        return failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return one line per failure: {@code identifier [stage] kind: reason}
     */
    public List<String> failureLines() {
        return failures.stream()
                .map(f -> f.identifier() + " [" + f.stage() + "] "
                        + f.errorKind().getDisplayName() + ": " + f.reason())
                .toList();
    }
}
