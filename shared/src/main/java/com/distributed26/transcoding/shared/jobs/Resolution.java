package com.distributed26.transcoding.shared.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * One requested output variant: pixel size, target video bitrate in kbit/s and frame rate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Resolution {
    private final int width;
    private final int height;
    private final int bitrate;
    private final int fps;

    @JsonCreator
    public Resolution(
            @JsonProperty("width") int width,
            @JsonProperty("height") int height,
            @JsonProperty("bitrate") int bitrate,
            @JsonProperty("fps") int fps
    ) {
        if (width <= 0) throw new IllegalArgumentException("width must be > 0");
        if (height <= 0) throw new IllegalArgumentException("height must be > 0");
        if (bitrate <= 0) throw new IllegalArgumentException("bitrate must be > 0");
        if (fps <= 0) throw new IllegalArgumentException("fps must be > 0");
        this.width = width;
        this.height = height;
        this.bitrate = bitrate;
        this.fps = fps;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBitrate() { return bitrate; }
    public int getFps() { return fps; }

    /** e.g. 720 → "720p". Also the name of the variant's output folder. */
    public String label() {
        return height + "p";
    }

    /** "&lt;width&gt;x&lt;height&gt;" as written in the master playlist. */
    public String dimensions() {
        return width + "x" + height;
    }

    /** Bitrate scaled from kbit/s to bit/s. */
    public long bandwidth() {
        return bitrate * 1000L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resolution)) return false;
        Resolution that = (Resolution) o;
        return width == that.width && height == that.height && bitrate == that.bitrate && fps == that.fps;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, bitrate, fps);
    }

    @Override
    public String toString() {
        return "Resolution{" + dimensions() + ", " + bitrate + "kbps, " + fps + "fps}";
    }
}
