package io.taintscan.analysis;

/**
 * Thrown when a sink has more paths than the policy allows. Fails that sink only.
 */
public class PathLimitExceededException extends RuntimeException {

    public PathLimitExceededException(String sinkId, int limit) {
        super("Sink " + sinkId + " has more than " + limit + " paths");
    }
}
