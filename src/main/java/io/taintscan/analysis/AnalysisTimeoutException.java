package io.taintscan.analysis;

import java.time.Duration;

/**
 * Thrown when the whole classification run exceeds its time budget.
 */
public class AnalysisTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AnalysisTimeoutException(Duration timeout, int unfinishedSinks) {
        super("Classification did not finish within " + timeout.toSeconds() + "s ("
                + unfinishedSinks + " sink(s) unfinished)");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
