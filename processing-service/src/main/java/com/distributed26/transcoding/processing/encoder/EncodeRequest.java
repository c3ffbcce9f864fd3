package com.distributed26.transcoding.processing.encoder;

import com.distributed26.transcoding.shared.jobs.Resolution;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One HLS variant to produce: {@code <outputDir>/index.m3u8} plus numbered {@code .ts} segments.
 */
public class EncodeRequest {
    public static final String PLAYLIST_NAME = "index.m3u8";
    public static final String SEGMENT_PATTERN = "segment_%03d.ts";
    public static final int DEFAULT_SEGMENT_SECONDS = 10;

    private final Path input;
    private final Path outputDir;
    private final Resolution resolution;
    private final int segmentSeconds;

    public EncodeRequest(Path input, Path outputDir, Resolution resolution) {
        this(input, outputDir, resolution, DEFAULT_SEGMENT_SECONDS);
    }

    public EncodeRequest(Path input, Path outputDir, Resolution resolution, int segmentSeconds) {
        this.input = Objects.requireNonNull(input, "input");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        if (segmentSeconds <= 0) throw new IllegalArgumentException("segmentSeconds must be > 0");
        this.segmentSeconds = segmentSeconds;
    }

    public Path getInput() { return input; }
    public Path getOutputDir() { return outputDir; }
    public Resolution getResolution() { return resolution; }
    public int getSegmentSeconds() { return segmentSeconds; }

    public Path getPlaylist() {
        return outputDir.resolve(PLAYLIST_NAME);
    }

    public Path getSegmentTemplate() {
        return outputDir.resolve(SEGMENT_PATTERN);
    }
}
