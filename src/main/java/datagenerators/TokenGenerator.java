package datagenerators;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.apache.commons.codec.digest.MurmurHash3;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Streams random byte tokens of random length, never returning the same token twice.
 *
 * Seeded, so two generators built with the same seed and bounds emit the same sequence;
 * a test can replay what it inserted without holding every token in memory.
 */
public class TokenGenerator {

    public static final int DEFAULT_MIN_LENGTH = 8;
    public static final int DEFAULT_MAX_LENGTH = 4096;

    private final RandomGenerator rng;
    private final int minLength;
    private final int maxLength;
    private final LongOpenHashSet seen = new LongOpenHashSet();

    public TokenGenerator(long seed) {
        this(seed, DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    public TokenGenerator(long seed, int minLength, int maxLength) {
        if (minLength <= 0) throw new IllegalArgumentException("minLength must be > 0");
        if (maxLength < minLength) throw new IllegalArgumentException("maxLength must be >= minLength");
        this.rng = new Well19937c(seed);
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public byte[] next() {
        while (true) {
            int length = minLength + rng.nextInt(maxLength - minLength + 1);
            byte[] token = new byte[length];
            rng.nextBytes(token);
            // fingerprint collisions only cost a redraw
            long[] h = MurmurHash3.hash128x64(token);
            if (seen.add(h[0] ^ h[1])) {
                return token;
            }
        }
    }

    public int emitted() {
        return seen.size();
    }
}
