package com.distributed26.transcoding.processing;

import com.distributed26.transcoding.processing.encoder.FfmpegVideoEncoder;
import com.distributed26.transcoding.processing.encoder.VideoEncoder;
import com.distributed26.transcoding.shared.config.PipelineConfig;
import com.distributed26.transcoding.shared.queue.RabbitMQJobQueue;
import com.distributed26.transcoding.shared.registry.HttpTaskRegistryClient;
import io.javalin.Javalin;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for the processing service.
 *
 * <p>Connects to RabbitMQ, checks the task registry, then runs the pending-task scheduler and the
 * transcode consumer (or one of them, per {@code SERVICE_MODE}). Not being able to reach the
 * broker, the registry or FFmpeg at startup is fatal; everything after that is recovered per task.
 *
 * <p>Environment, with {@code .env} as fallback:
 * <pre>
 *   RABBITMQ_URL=amqp://localhost
 *   RABBITMQ_QUEUE=transcoding-video
 *   MAX_QUEUE_CAPACITY=10
 *   SCHEDULER_INTERVAL=60000
 *   API_BASE_URL=http://localhost:4000/api/
 *   UPLOAD_DIR=uploads
 *   TRANSCODE_OUTPUT_DIR=transcoded-video
 *   FFMPEG_PATH=/usr/bin/ffmpeg
 *   SERVICE_MODE=all|scheduler|consumer
 * </pre>
 */
public class ProcessingServiceApplication {
    private static final Logger LOGGER = LogManager.getLogger(ProcessingServiceApplication.class);

    public static void main(String[] args) throws Exception {
        PipelineConfig config = PipelineConfig.fromEnv();
        LOGGER.info("Starting processing service with {}", config);

        RabbitMQJobQueue queue = new RabbitMQJobQueue(config.getRabbitUrl(), "transcoding-processing-service");
        HttpTaskRegistryClient registry = new HttpTaskRegistryClient(
                config.getRegistryBaseUrl(), config.getRegistryTimeout());

        VideoEncoder encoder = null;
        try {
            if (config.getServiceMode().runsConsumer()) {
                encoder = new FfmpegVideoEncoder(config.getFfmpegPath(), config.getFfprobePath());
            }
            queue.connect();
            registry.checkReachable();
        } catch (IOException | RuntimeException e) {
            LOGGER.fatal("Startup failed: {}", e.getMessage(), e);
            queue.close();
            System.exit(1);
            return;
        }

        ProcessingService service = ProcessingService.create(config, queue, registry, encoder, Clock.systemUTC());
        service.start();

        Javalin app = startApp(config.getHttpPort(), service);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown: stopping scheduler and consumer...");
            app.stop();
            service.stop();
        }));

        Thread.currentThread().join();
    }

    /**
     * Operational endpoints: {@code GET /health} for liveness probes and {@code GET /status} for
     * the consumer, the queue depth and the last scheduler cycle.
     */
    static Javalin createApp(ProcessingService service) {
        ensureLogsDirectory();
        Javalin app = Javalin.create();

        app.get("/health", ctx -> ctx.json(Map.of("status", "ok")));
        app.get("/status", ctx -> ctx.json(service.status()));

        return app;
    }

    static Javalin startApp(int port, ProcessingService service) {
        Javalin app = createApp(service);
        LOGGER.info("Starting processing HTTP server on port {}", port);
        app.start(port);
        return app;
    }

    private static void ensureLogsDirectory() {
        try {
            Files.createDirectories(Path.of("logs"));
        } catch (IOException e) {
            LOGGER.warn("Failed to create logs directory", e);
        }
    }
}
