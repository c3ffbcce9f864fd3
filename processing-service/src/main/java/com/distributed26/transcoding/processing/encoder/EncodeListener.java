package com.distributed26.transcoding.processing.encoder;

/**
 * Observer for a running encode. Purely informational: nothing it does changes the outcome.
 */
public interface EncodeListener {
    EncodeListener NONE = new EncodeListener() {};

    /** The encoder process is about to start; {@code commandLine} is the literal invocation. */
    default void onStart(String commandLine) {}

    /** Percentage of the source processed so far, 0..100. */
    default void onProgress(double percent) {}
}
