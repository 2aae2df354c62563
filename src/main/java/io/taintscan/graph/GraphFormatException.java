package io.taintscan.graph;

import java.io.IOException;

/**
 * Thrown when a serialized graph cannot be parsed into the ingestion shape.
 */
public class GraphFormatException extends IOException {

    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
