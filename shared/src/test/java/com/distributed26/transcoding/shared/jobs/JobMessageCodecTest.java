package com.distributed26.transcoding.shared.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobMessageCodecTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void encode_usesWireFieldNames() throws Exception {
        TranscodeJob job = new TranscodeJob("videos/a.mp4", "transcoded/1-a",
                List.of(new Resolution(640, 360, 800, 25)), 7L);

        JsonNode node = objectMapper.readTree(JobMessageCodec.encode(job));

        assertEquals("videos/a.mp4", node.get("inputPath").asText());
        assertEquals("transcoded/1-a", node.get("outputPath").asText());
        assertEquals(7L, node.get("queuedTaskId").asLong());
        JsonNode res = node.get("resolutions").get(0);
        assertEquals(640, res.get("width").asInt());
        assertEquals(360, res.get("height").asInt());
        assertEquals(800, res.get("bitrate").asInt());
        assertEquals(25, res.get("fps").asInt());
    }

    @Test
    void decode_readsPayloadFromOtherProducers() {
        String json = "{\"inputPath\":\"a.mp4\",\"outputPath\":\"transcoded/1-a\","
                + "\"resolutions\":[{\"width\":640,\"height\":360,\"bitrate\":800,\"fps\":25,\"name\":\"360p\"},"
                + "{\"width\":1280,\"height\":720,\"bitrate\":2500,\"fps\":30}],"
                + "\"queuedTaskId\":12,\"extra\":true}";

        TranscodeJob job = JobMessageCodec.decode(bytes(json));

        assertEquals("a.mp4", job.getInputPath());
        assertEquals(12L, job.getQueuedTaskId());
        assertEquals(2, job.getResolutions().size());
        assertEquals(new Resolution(1280, 720, 2500, 30), job.getResolutions().get(1));
    }

    @Test
    void decode_malformedJson_hasNoTaskId() {
        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> JobMessageCodec.decode(bytes("{not json")));
        assertNull(e.getQueuedTaskId());
    }

    @Test
    void decode_nonObject_hasNoTaskId() {
        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> JobMessageCodec.decode(bytes("[1,2,3]")));
        assertNull(e.getQueuedTaskId());
    }

    @Test
    void decode_missingTaskId_hasNoTaskId() {
        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> JobMessageCodec.decode(bytes("{\"inputPath\":\"a.mp4\",\"resolutions\":[]}")));
        assertNull(e.getQueuedTaskId());
    }

    @Test
    void decode_emptyResolutions_keepsTaskId() {
        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> JobMessageCodec.decode(bytes("{\"inputPath\":\"a.mp4\",\"resolutions\":[],\"queuedTaskId\":5}")));
        assertEquals(5L, e.getQueuedTaskId());
    }

    @Test
    void decode_nullResolution_keepsTaskId() {
        InvalidJobException e = assertThrows(InvalidJobException.class,
                () -> JobMessageCodec.decode(bytes("{\"inputPath\":\"a.mp4\",\"resolutions\":[null],\"queuedTaskId\":7}")));
        assertEquals(7L, e.getQueuedTaskId());
        assertTrue(e.getMessage().contains("null resolution"));
    }

    @Test
    void decode_invalidResolution_keepsTaskId() {
        String json = "{\"inputPath\":\"a.mp4\",\"queuedTaskId\":9,"
                + "\"resolutions\":[{\"width\":0,\"height\":360,\"bitrate\":800,\"fps\":25}]}";
        InvalidJobException e = assertThrows(InvalidJobException.class, () -> JobMessageCodec.decode(bytes(json)));
        assertEquals(9L, e.getQueuedTaskId());
        assertTrue(e.getMessage().contains("width"), e.getMessage());
    }

    @Test
    void decode_missingInputPath_keepsTaskId() {
        String json = "{\"queuedTaskId\":3,\"resolutions\":[{\"width\":640,\"height\":360,\"bitrate\":800,\"fps\":25}]}";
        InvalidJobException e = assertThrows(InvalidJobException.class, () -> JobMessageCodec.decode(bytes(json)));
        assertEquals(3L, e.getQueuedTaskId());
    }

    @Test
    void transcodeJob_resolutionsAreUnmodifiable() {
        TranscodeJob job = new TranscodeJob("a.mp4", null, List.of(new Resolution(640, 360, 800, 25)), 1L);
        assertThrows(UnsupportedOperationException.class,
                () -> job.getResolutions().add(new Resolution(1280, 720, 2500, 30)));
    }
}
