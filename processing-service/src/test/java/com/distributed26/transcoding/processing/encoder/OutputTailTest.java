package com.distributed26.transcoding.processing.encoder;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutputTailTest {

    private static void feed(OutputTail tail, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        tail.write(bytes, 0, bytes.length);
    }

    @Test
    void keepsOnlyTheLastLines() {
        OutputTail tail = new OutputTail(2);
        feed(tail, "one\ntwo\nthree\n");

        assertEquals(List.of("two", "three"), tail.lines());
    }

    @Test
    void linesSplitAcrossReadsAreJoined() {
        OutputTail tail = new OutputTail(5);
        feed(tail, "Invalid data fo");
        feed(tail, "und when processing input\n");

        assertEquals(List.of("Invalid data found when processing input"), tail.lines());
    }

    @Test
    void unterminatedLastLineCounts() {
        OutputTail tail = new OutputTail(2);
        feed(tail, "a\nb\nconversion failed");

        assertEquals(List.of("b", "conversion failed"), tail.lines());
    }

    @Test
    void carriageReturnsAndBlankLinesAreDropped() {
        OutputTail tail = new OutputTail(5);
        feed(tail, "frame=1\rframe=2\r\n\n  \nerror\r\n");

        assertEquals(List.of("frame=1", "frame=2", "error"), tail.lines());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new OutputTail(0));
    }
}
