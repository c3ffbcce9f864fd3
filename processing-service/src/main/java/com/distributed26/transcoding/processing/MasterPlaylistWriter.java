package com.distributed26.transcoding.processing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles and writes the top-level HLS playlist. The file appears complete or not at all.
 */
public final class MasterPlaylistWriter {
    public static final String MASTER_PLAYLIST = "master.m3u8";
    static final String HEADER = "#EXTM3U";

    private MasterPlaylistWriter() {}

    static String render(List<VariantPlaylist> variants) {
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("master playlist needs at least one variant");
        }
        return HEADER + "\n" + variants.stream()
                .map(v -> "#EXT-X-STREAM-INF:BANDWIDTH=" + v.getBandwidth()
                        + ",RESOLUTION=" + v.getResolution().dimensions()
                        + "\n" + v.getRelativePath())
                .collect(Collectors.joining("\n"));
    }

    /** Writes {@code master.m3u8} into {@code jobDir} via a temp file and a move. */
    public static Path write(Path jobDir, List<VariantPlaylist> variants) throws IOException {
        String content = render(variants);
        Path target = jobDir.resolve(MASTER_PLAYLIST);
        Path temp = Files.createTempFile(jobDir, ".master-", ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        return target;
    }
}
