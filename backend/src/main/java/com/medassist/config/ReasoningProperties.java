package com.medassist.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Reasoning core settings bound from {@code medassist.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "medassist")
@Validated
@Getter
@Setter
public class ReasoningProperties {

    @Valid
    private Terms terms = new Terms();

    @Valid
    private Guidelines guidelines = new Guidelines();

    @Valid
    private Sources sources = new Sources();

    @Valid
    private Retrieval retrieval = new Retrieval();

    @Getter
    @Setter
    public static class Terms {
        @NotBlank
        private String dictionary = "classpath:terms/term-dictionary.json";

        @Min(1)
        private int maxSuggestions = 5;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSimilarity = 0.4;
    }

    @Getter
    @Setter
    public static class Guidelines {
        // 0 means unlimited
        @Min(0)
        private int topK = 0;

        @NotNull
        private Duration refreshInterval = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Sources {
        @NotNull
        private Duration timeout = Duration.ofSeconds(2);

        @NotNull
        private Duration retryBackoff = Duration.ofMillis(200);

        @Min(1)
        private int poolSize = 8;
    }

    @Getter
    @Setter
    public static class Retrieval {
        // Blank disables the evidence corpus
        private String url = "";

        @Min(1)
        private int topK = 5;
    }
}
