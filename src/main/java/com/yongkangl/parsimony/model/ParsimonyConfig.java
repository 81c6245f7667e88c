package com.yongkangl.parsimony.model;

public final class ParsimonyConfig {
    public static final int DEFAULT_MAX_AMBIGUOUS_NODES = 10;

    private final int maxAmbiguousNodes;
    private final boolean deduplicate;
    private final boolean applyOriginVeto;
    private final int threads;

    private ParsimonyConfig(Builder builder) {
        this.maxAmbiguousNodes = builder.maxAmbiguousNodes;
        this.deduplicate = builder.deduplicate;
        this.applyOriginVeto = builder.applyOriginVeto;
        this.threads = builder.threads;
    }

    public static ParsimonyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Above this many distinct ambiguous nodes the exhaustive search is skipped.
     */
    public int getMaxAmbiguousNodes() {
        return maxAmbiguousNodes;
    }

    /**
     * Whether structurally identical histories are reported once.
     */
    public boolean isDeduplicate() {
        return deduplicate;
    }

    public boolean isApplyOriginVeto() {
        return applyOriginVeto;
    }

    public int getThreads() {
        return threads;
    }

    public static final class Builder {
        private int maxAmbiguousNodes = DEFAULT_MAX_AMBIGUOUS_NODES;
        private boolean deduplicate = true;
        private boolean applyOriginVeto = true;
        private int threads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder maxAmbiguousNodes(int maxAmbiguousNodes) {
            // 1 << maxAmbiguousNodes must stay a positive int
            if (maxAmbiguousNodes < 0 || maxAmbiguousNodes > 30) {
                throw new IllegalArgumentException("maxAmbiguousNodes must be between 0 and 30, got " + maxAmbiguousNodes);
            }
            this.maxAmbiguousNodes = maxAmbiguousNodes;
            return this;
        }

        public Builder deduplicate(boolean deduplicate) {
            this.deduplicate = deduplicate;
            return this;
        }

        public Builder applyOriginVeto(boolean applyOriginVeto) {
            this.applyOriginVeto = applyOriginVeto;
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("threads must be positive, got " + threads);
            }
            this.threads = threads;
            return this;
        }

        public ParsimonyConfig build() {
            return new ParsimonyConfig(this);
        }
    }
}
