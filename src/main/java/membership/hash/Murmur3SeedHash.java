package membership.hash;

import org.apache.commons.codec.digest.MurmurHash3;

import java.util.Objects;

// Splits MurmurHash3 x64 128-bit into the two seed halves.
public final class Murmur3SeedHash implements SeedHash {

    public static final int DEFAULT_SEED = 0;

    private static final Murmur3SeedHash DEFAULT = new Murmur3SeedHash(DEFAULT_SEED);

    private final int seed;

    public Murmur3SeedHash(int seed) {
        this.seed = seed;
    }

    public static Murmur3SeedHash getDefault() {
        return DEFAULT;
    }

    @Override
    public long[] hash(byte[] data) {
        Objects.requireNonNull(data, "data");
        return MurmurHash3.hash128x64(data, 0, data.length, seed); // {h1, h2}
    }

    public int seed() {
        return seed;
    }

    @Override
    public String toString() {
        return "murmur3(seed=" + seed + ")";
    }
}
