package com.chunkforge.engine.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Chunk store selection, bound from {@code chunkforge.store.*}.
 */
@Validated
@ConfigurationProperties(prefix = "chunkforge.store")
public record StoreProperties(@DefaultValue("memory") @NotNull Type type) {

    public enum Type {
        /** Process-local maps; state is lost on restart. */
        MEMORY,
        /** pipelines and chunks tables through Spring Data JPA. */
        JPA
    }
}
