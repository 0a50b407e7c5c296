package tree.suffix;

import staticds.RmqType;

import java.util.Objects;

// Immutable configuration for constructing SuffixTree instances.
public final class SuffixTreeConfiguration {

    private final BuildStrategy strategy;
    private final RmqType rmqType;
    private final boolean collectStats;

    private SuffixTreeConfiguration(Builder builder) {
        this.strategy = Objects.requireNonNull(builder.strategy, "strategy");
        this.rmqType = Objects.requireNonNull(builder.rmqType, "rmqType");
        this.collectStats = builder.collectStats;
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() {
        return builder().build();
    }

    public static SuffixTreeConfiguration of(BuildStrategy strategy) {
        return builder().strategy(strategy).build();
    }

    public BuildStrategy strategy() { return strategy; }
    public RmqType rmqType() { return rmqType; }
    public boolean collectStats() { return collectStats; }

    public Builder toBuilder() {
        return new Builder()
                .strategy(strategy)
                .rmqType(rmqType)
                .collectStats(collectStats);
    }

    @Override
    public String toString() {
        return "SuffixTreeConfiguration{strategy=" + strategy.token()
                + ", rmq=" + rmqType.token()
                + ", collectStats=" + collectStats + "}";
    }

    public static final class Builder {
        private BuildStrategy strategy = BuildStrategy.UKKONEN;
        private RmqType rmqType = RmqType.FISCHER_HEUN;
        private boolean collectStats;

        private Builder() {
        }

        public Builder strategy(BuildStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder rmqType(RmqType rmqType) {
            this.rmqType = rmqType;
            return this;
        }

        public Builder collectStats(boolean collectStats) {
            this.collectStats = collectStats;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
