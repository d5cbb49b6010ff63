package br.edu.ifba.mindgraph.extraction;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Min;

import java.time.Duration;

/**
 * Configuration for background extraction, read from {@code mindgraph.extraction.*}.
 */
@ConfigMapping(prefix = "mindgraph.extraction")
public interface ExtractionConfig {

    /**
     * Worker threads running extraction.
     * Default: 2
     */
    @WithDefault("2")
    @Min(1)
    int workers();

    /**
     * Turns waiting for a worker before submissions are rejected.
     * Default: 100
     */
    @WithName("queue-capacity")
    @WithDefault("100")
    @Min(1)
    int queueCapacity();

    /**
     * Overall deadline of one text-understanding call, retries included.
     * Default: 15s
     */
    @WithName("understanding-timeout")
    @WithDefault("15s")
    Duration understandingTimeout();

    /**
     * Prior utterances sent along with the turn.
     * Default: 6
     */
    @WithName("context-window-turns")
    @WithDefault("6")
    @Min(0)
    int contextWindowTurns();

    /**
     * How long shutdown waits for queued and in-flight runs.
     * Default: 10s
     */
    @WithName("shutdown-grace")
    @WithDefault("10s")
    Duration shutdownGrace();
}
