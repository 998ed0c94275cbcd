package com.hvacops.copilot.client.stream;

/**
 * The event stream ended before a terminal reply record arrived.
 */
public class StreamIncompleteException extends RuntimeException {

    public StreamIncompleteException() {
        super("Streaming response incomplete");
    }
}
