package com.gamewright.core.metrics;

import com.gamewright.core.error.GenerationErrorKind;
import com.gamewright.core.model.ProviderKind;
import com.gamewright.core.model.TaskKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for artifact generation.
 */
@Service
public class GenerationMetrics {

    private final MeterRegistry registry;

    public GenerationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGeneration(ProviderKind provider, TaskKind kind, boolean success, long ms) {
        Counter.builder("gamewright.generations.total")
                .tag("provider", provider.id())
                .tag("kind", kind.fileTag())
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();

        Timer.builder("gamewright.generation.duration")
                .tag("provider", provider.id())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordError(GenerationErrorKind kind) {
        Counter.builder("gamewright.generations.errors")
                .tag("error", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Time from an upload being accepted to the remote file reporting ACTIVE.
     */
    public void recordUploadWait(Duration wait) {
        Timer.builder("gamewright.upload.wait")
                .description("Time for an uploaded file to become ACTIVE")
                .register(registry)
                .record(wait);
    }

    /**
     * @param resource "local" for staging copies, "remote" for uploaded files
     */
    public void recordCleanupFailure(String resource) {
        Counter.builder("gamewright.cleanup.failures")
                .description("Staged or uploaded files that could not be deleted")
                .tag("resource", resource)
                .register(registry)
                .increment();
    }
}
