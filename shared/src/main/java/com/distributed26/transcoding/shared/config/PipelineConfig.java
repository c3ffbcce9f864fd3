package com.distributed26.transcoding.shared.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings for the scheduler, the consumer and the encoder, read from the environment with
 * {@code .env} as fallback.
 */
public class PipelineConfig {
    private static final Logger logger = LogManager.getLogger(PipelineConfig.class);

    public enum ServiceMode {
        ALL, SCHEDULER, CONSUMER;

        public boolean runsScheduler() {
            return this != CONSUMER;
        }

        public boolean runsConsumer() {
            return this != SCHEDULER;
        }
    }

    private final String rabbitUrl;
    private final String queueName;
    private final int maxQueueCapacity;
    private final Duration schedulerInterval;
    private final Path uploadDir;
    private final Path outputDir;
    private final String registryBaseUrl;
    private final Duration registryTimeout;
    private final String ffmpegPath;
    private final String ffprobePath;
    private final int encodeParallelism;
    private final int httpPort;
    private final ServiceMode serviceMode;

    public PipelineConfig(
            String rabbitUrl,
            String queueName,
            int maxQueueCapacity,
            Duration schedulerInterval,
            Path uploadDir,
            Path outputDir,
            String registryBaseUrl,
            Duration registryTimeout,
            String ffmpegPath,
            String ffprobePath,
            int encodeParallelism,
            int httpPort,
            ServiceMode serviceMode
    ) {
        this.rabbitUrl = Objects.requireNonNull(rabbitUrl, "rabbitUrl");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        if (maxQueueCapacity <= 0) throw new IllegalArgumentException("maxQueueCapacity must be > 0");
        this.maxQueueCapacity = maxQueueCapacity;
        this.schedulerInterval = Objects.requireNonNull(schedulerInterval, "schedulerInterval");
        if (schedulerInterval.isZero() || schedulerInterval.isNegative()) {
            throw new IllegalArgumentException("schedulerInterval must be > 0");
        }
        this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.registryBaseUrl = normalizeBaseUrl(Objects.requireNonNull(registryBaseUrl, "registryBaseUrl"));
        this.registryTimeout = Objects.requireNonNull(registryTimeout, "registryTimeout");
        this.ffmpegPath = Objects.requireNonNull(ffmpegPath, "ffmpegPath");
        this.ffprobePath = Objects.requireNonNull(ffprobePath, "ffprobePath");
        if (encodeParallelism <= 0) throw new IllegalArgumentException("encodeParallelism must be > 0");
        this.encodeParallelism = encodeParallelism;
        this.httpPort = httpPort;
        this.serviceMode = Objects.requireNonNull(serviceMode, "serviceMode");
    }

    public static PipelineConfig fromEnv() {
        Dotenv dotenv = Dotenv.configure().directory("./").ignoreIfMissing().load();
        return fromLookup(key -> getEnvOrDotenv(dotenv, key));
    }

    /** Builds a config from any key lookup; a {@code null} or blank value means "use the default". */
    public static PipelineConfig fromLookup(Function<String, String> lookup) {
        return new PipelineConfig(
                get(lookup, "RABBITMQ_URL", "amqp://localhost"),
                get(lookup, "RABBITMQ_QUEUE", "transcoding-video"),
                getInt(lookup, "MAX_QUEUE_CAPACITY", 10),
                Duration.ofMillis(getInt(lookup, "SCHEDULER_INTERVAL", 60_000)),
                Path.of(get(lookup, "UPLOAD_DIR", "uploads")),
                Path.of(get(lookup, "TRANSCODE_OUTPUT_DIR", "transcoded-video")),
                get(lookup, "API_BASE_URL", "http://localhost:4000/api/"),
                Duration.ofMillis(getInt(lookup, "REGISTRY_TIMEOUT_MS", 10_000)),
                get(lookup, "FFMPEG_PATH", "/usr/bin/ffmpeg"),
                get(lookup, "FFPROBE_PATH", "/usr/bin/ffprobe"),
                getInt(lookup, "ENCODE_PARALLELISM", 4),
                getInt(lookup, "PROCESSING_PORT", 8082),
                parseMode(get(lookup, "SERVICE_MODE", "all"))
        );
    }

    public String getRabbitUrl() { return rabbitUrl; }
    public String getQueueName() { return queueName; }
    public int getMaxQueueCapacity() { return maxQueueCapacity; }
    public Duration getSchedulerInterval() { return schedulerInterval; }
    public Path getUploadDir() { return uploadDir; }
    public Path getOutputDir() { return outputDir; }
    public String getRegistryBaseUrl() { return registryBaseUrl; }
    public Duration getRegistryTimeout() { return registryTimeout; }
    public String getFfmpegPath() { return ffmpegPath; }
    public String getFfprobePath() { return ffprobePath; }
    public int getEncodeParallelism() { return encodeParallelism; }
    public int getHttpPort() { return httpPort; }
    public ServiceMode getServiceMode() { return serviceMode; }

    static String normalizeBaseUrl(String url) {
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static ServiceMode parseMode(String value) {
        try {
            return ServiceMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown SERVICE_MODE '" + value + "' (expected all, scheduler or consumer)", e);
        }
    }

    private static String get(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String getEnvOrDotenv(Dotenv dotenv, String key) {
        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal;
        }
        return dotenv.get(key);
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "queueName='" + queueName + '\'' +
                ", maxQueueCapacity=" + maxQueueCapacity +
                ", schedulerInterval=" + schedulerInterval +
                ", uploadDir=" + uploadDir +
                ", outputDir=" + outputDir +
                ", registryBaseUrl='" + registryBaseUrl + '\'' +
                ", ffmpegPath='" + ffmpegPath + '\'' +
                ", encodeParallelism=" + encodeParallelism +
                ", httpPort=" + httpPort +
                ", serviceMode=" + serviceMode +
                '}';
    }
}
