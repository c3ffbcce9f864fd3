package com.distributed26.transcoding.shared.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Queue payload describing one transcoding unit of work: a source file and the variants to produce.
 *
 * <p>Wire form: {@code {"inputPath", "outputPath", "resolutions": [...], "queuedTaskId"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscodeJob {
    private final String inputPath;
    private final String outputPath;
    private final List<Resolution> resolutions;
    private final long queuedTaskId;

    @JsonCreator
    public TranscodeJob(
            @JsonProperty("inputPath") String inputPath,
            @JsonProperty("outputPath") String outputPath,
            @JsonProperty("resolutions") List<Resolution> resolutions,
            @JsonProperty("queuedTaskId") long queuedTaskId
    ) {
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath is null");
        this.outputPath = outputPath;
        this.resolutions = new ArrayList<>(Objects.requireNonNull(resolutions, "resolutions is null"));
        this.queuedTaskId = queuedTaskId;
    }

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public List<Resolution> getResolutions() {
        return Collections.unmodifiableList(resolutions);
    }

    public long getQueuedTaskId() {
        return queuedTaskId;
    }

    @Override
    public String toString() {
        return "TranscodeJob{task=" + queuedTaskId + ", input='" + inputPath + "', resolutions=" + resolutions + '}';
    }
}
