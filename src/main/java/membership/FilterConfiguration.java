package membership;

import membership.hash.Murmur3SeedHash;
import membership.hash.SeedHash;

import java.util.Objects;

// Immutable configuration for constructing filters, either sized from (n, p) or from raw (m, k).
public final class FilterConfiguration {

    private final long expectedElements;
    private final double falsePositiveRate;
    private final long bitCount;
    private final long hashRounds;
    private final SeedHash seedHash;
    private final int historySize;
    private final boolean sized;
    private final boolean raw;

    private FilterConfiguration(Builder builder) {
        this.expectedElements = builder.expectedElements;
        this.falsePositiveRate = builder.falsePositiveRate;
        this.bitCount = builder.bitCount;
        this.hashRounds = builder.hashRounds;
        this.seedHash = Objects.requireNonNull(builder.seedHash, "seedHash");
        this.historySize = builder.historySize;
        this.sized = builder.sized;
        this.raw = builder.raw;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    private void validate() {
        if (sized && raw) {
            throw FilterException.invalidParameters("set either expectedElements/falsePositiveRate or bitCount/hashRounds, not both");
        }
        if (sized && expectedElements <= 0) {
            throw FilterException.invalidParameters("expectedElements must be positive");
        }
        if (sized && !(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw FilterException.invalidParameters("falsePositiveRate must be in (0,1)");
        }
        if (!sized && bitCount <= 0) {
            throw FilterException.invalidParameters("bitCount must be positive, or set expectedElements and falsePositiveRate");
        }
        if (!sized && hashRounds < 0) {
            throw FilterException.invalidParameters("hashRounds must be non-negative");
        }
        if (historySize < 0) {
            throw FilterException.invalidParameters("historySize must be non-negative");
        }
    }

    /** True when sizing comes from expectedElements and falsePositiveRate. */
    public boolean isSized() { return sized; }
    public long expectedElements() { return expectedElements; }
    public double falsePositiveRate() { return falsePositiveRate; }
    public long bitCount() { return bitCount; }
    public long hashRounds() { return hashRounds; }
    public SeedHash seedHash() { return seedHash; }
    public int historySize() { return historySize; }

    public static final class Builder {
        private long expectedElements;
        private double falsePositiveRate;
        private long bitCount;
        private long hashRounds;
        private SeedHash seedHash = Murmur3SeedHash.getDefault();
        private int historySize;
        private boolean sized;
        private boolean raw;

        private Builder() {
        }

        public Builder expectedElements(long expectedElements) {
            this.expectedElements = expectedElements;
            this.sized = true;
            return this;
        }

        public Builder falsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
            this.sized = true;
            return this;
        }

        public Builder bitCount(long bitCount) {
            this.bitCount = bitCount;
            this.raw = true;
            return this;
        }

        public Builder hashRounds(long hashRounds) {
            this.hashRounds = hashRounds;
            this.raw = true;
            return this;
        }

        public Builder seedHash(SeedHash seedHash) {
            this.seedHash = (seedHash == null) ? Murmur3SeedHash.getDefault() : seedHash;
            return this;
        }

        public Builder historySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public FilterConfiguration build() {
            return new FilterConfiguration(this);
        }
    }
}
