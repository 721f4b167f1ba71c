package com.adlanda.ethicsassistant.repository;

/**
 * Metric space of a collection, fixed when the collection is created.
 *
 * Every metric is exposed as a similarity where higher means closer.
 */
public enum DistanceMetric {

    COSINE("<=>", "vector_cosine_ops") {
        @Override
        public double similarityFromDistance(double distance) {
            return 1.0 - distance;
        }

        @Override
        public double similarity(float[] a, float[] b) {
            double dot = 0.0;
            double normA = 0.0;
            double normB = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            if (normA == 0 || normB == 0) {
                return 0.0;
            }
            return dot / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    EUCLIDEAN("<->", "vector_l2_ops") {
        @Override
        public double similarityFromDistance(double distance) {
            return 1.0 / (1.0 + distance);
        }

        @Override
        public double similarity(float[] a, float[] b) {
            double sum = 0.0;
            for (int i = 0; i < a.length; i++) {
                double d = a[i] - b[i];
                sum += d * d;
            }
            return similarityFromDistance(Math.sqrt(sum));
        }
    },

    DOT("<#>", "vector_ip_ops") {
        // pgvector's <#> is the negative inner product
        @Override
        public double similarityFromDistance(double distance) {
            return -distance;
        }

        @Override
        public double similarity(float[] a, float[] b) {
            double dot = 0.0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
            }
            return dot;
        }
    };

    private final String operator;
    private final String operatorClass;

    DistanceMetric(String operator, String operatorClass) {
        this.operator = operator;
        this.operatorClass = operatorClass;
    }

    /**
     * pgvector distance operator for this metric.
     */
    public String operator() {
        return operator;
    }

    /**
     * pgvector index operator class for this metric.
     */
    public String operatorClass() {
        return operatorClass;
    }

    public abstract double similarityFromDistance(double distance);

    /**
     * Computes the similarity of two vectors of equal dimension.
     */
    public abstract double similarity(float[] a, float[] b);
}
