package com.adlanda.ethicsassistant.config;

import com.adlanda.ethicsassistant.repository.DistanceMetric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the assistant.
 *
 * Maps to properties prefixed with 'assistant' in application.properties.
 * Binding is validated, so a bad value fails startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    @Valid
    private final Storage storage = new Storage();

    @Valid
    private final Chunking chunking = new Chunking();

    @Valid
    private final Index index = new Index();

    @Valid
    private final Generation generation = new Generation();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Ingestion ingestion = new Ingestion();

    private final Startup startup = new Startup();

    public Storage getStorage() {
        return storage;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Index getIndex() {
        return index;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public Startup getStartup() {
        return startup;
    }

    /**
     * Where source documents live.
     */
    public static class Storage {

        /**
         * Root directory that logical keys are relative to.
         */
        @NotBlank
        private String root = "./docs";

        /**
         * Prefix stripped from a logical key before deriving its document ID,
         * so moving documents under a new prefix keeps their IDs.
         */
        @NotNull
        private String prefix = "";

        /**
         * Only keys ending with this suffix (case-insensitive) are ingested.
         */
        @NotBlank
        private String suffix = ".pdf";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getSuffix() {
            return suffix;
        }

        public void setSuffix(String suffix) {
            this.suffix = suffix;
        }
    }

    public static class Chunking {

        /**
         * Maximum characters per chunk.
         */
        @Min(1)
        private int size = 1000;

        /**
         * Characters repeated from the end of the previous chunk.
         */
        @Min(0)
        private int overlap = 200;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Index {

        /**
         * "pgvector" (default) or "memory".
         */
        @NotBlank
        private String type = "pgvector";

        /**
         * Collection (table) name. Must be a plain SQL identifier.
         */
        @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]{0,62}")
        private String collection = "ai_ethics_docs";

        /**
         * Vector dimensionality. 0 means ask the embedding backend at startup.
         */
        @Min(0)
        private int dimensions = 0;

        @NotNull
        private DistanceMetric metric = DistanceMetric.COSINE;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public DistanceMetric getMetric() {
            return metric;
        }

        public void setMetric(DistanceMetric metric) {
            this.metric = metric;
        }
    }

    public static class Generation {

        @Min(1)
        private int maxTokens = 1000;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        @Min(1)
        private int reformulationMaxTokens = 100;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double reformulationTemperature = 0.3;

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getReformulationMaxTokens() {
            return reformulationMaxTokens;
        }

        public void setReformulationMaxTokens(int reformulationMaxTokens) {
            this.reformulationMaxTokens = reformulationMaxTokens;
        }

        public double getReformulationTemperature() {
            return reformulationTemperature;
        }

        public void setReformulationTemperature(double reformulationTemperature) {
            this.reformulationTemperature = reformulationTemperature;
        }
    }

    public static class Retrieval {

        @Min(1)
        private int defaultTopK = 5;

        @Min(1)
        private int maxTopK = 20;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMaxTopK() {
            return maxTopK;
        }

        public void setMaxTopK(int maxTopK) {
            this.maxTopK = maxTopK;
        }
    }

    public static class Ingestion {

        /**
         * Whether to ingest every document at startup.
         */
        private boolean runOnStartup = false;

        /**
         * Documents processed concurrently by a batch run. 1 means sequential.
         */
        @Min(1)
        private int parallelism = 1;

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }
    }

    public static class Startup {

        /**
         * Whether to probe collaborators and ensure the index collection at boot.
         * When false, nothing is contacted until first use (useful for testing).
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
