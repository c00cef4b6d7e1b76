package com.chunkforge.engine.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Scheduler settings, bound from {@code chunkforge.scheduler.*}.
 *
 * @param workerThreads size of the pool shared by all running pipelines;
 *                      a pipeline never uses more than its own parallelism
 */
@Validated
@ConfigurationProperties(prefix = "chunkforge.scheduler")
public record SchedulerProperties(@DefaultValue("8") @Min(1) int workerThreads) {
}
