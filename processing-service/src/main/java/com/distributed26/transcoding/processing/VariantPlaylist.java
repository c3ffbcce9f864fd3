package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.shared.jobs.Resolution;
import java.util.Objects;

/**
 * A finished per-resolution playlist, as the master playlist refers to it.
 */
public class VariantPlaylist {
    private final Resolution resolution;
    private final String relativePath;
    private final long bandwidth;

    public VariantPlaylist(Resolution resolution, String relativePath, long bandwidth) {
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        if (bandwidth <= 0) throw new IllegalArgumentException("bandwidth must be > 0");
        this.bandwidth = bandwidth;
    }

    /** Playlist for {@code resolution} at {@code <height>p/index.m3u8}, bandwidth in bit/s. */
    public static VariantPlaylist of(Resolution resolution, String playlistName) {
        return new VariantPlaylist(resolution, resolution.label() + "/" + playlistName, resolution.bandwidth());
    }

    public Resolution getResolution() { return resolution; }
    public String getRelativePath() { return relativePath; }
    public long getBandwidth() { return bandwidth; }

    @Override
    public String toString() {
        return "VariantPlaylist{" + relativePath + ", " + bandwidth + "bps, " + resolution.dimensions() + "}";
    }
}
