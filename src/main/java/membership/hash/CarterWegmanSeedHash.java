package membership.hash;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Two independent Carter–Wegman polynomial hashes over the input bytes, modulo the
 * Mersenne prime p = 2^61 - 1.
 *
 * Coefficients come from a caller-supplied seed so the pair is reproducible across
 * processes; two instances built from the same seed hash identically.
 */
public final class CarterWegmanSeedHash implements SeedHash {

    private static final long P61  = (1L << 61) - 1;
    private static final long MASK = P61;

    private final long seed;
    private final long a1, b1;
    private final long a2, b2;

    private CarterWegmanSeedHash(long seed) {
        SplittableRandom rng = new SplittableRandom(seed);
        long a, b, c, d;
        do { a = rng.nextLong() & MASK; } while (a == 0L || a == P61);
        b = fold61(rng.nextLong());
        do { c = rng.nextLong() & MASK; } while (c == 0L || c == P61 || c == a);
        d = fold61(rng.nextLong());
        this.seed = seed;
        this.a1 = a; this.b1 = b;
        this.a2 = c; this.b2 = d;
    }

    public static CarterWegmanSeedHash withSeed(long seed) {
        return new CarterWegmanSeedHash(seed);
    }

    @Override
    public long[] hash(byte[] data) {
        Objects.requireNonNull(data, "data");
        long h1 = b1;
        long h2 = b2;
        for (byte value : data) {
            int x = value & 0xFF;
            h1 = mulAdd61(h1, a1, x);
            h2 = mulAdd61(h2, a2, x);
        }
        // length terminator keeps {0} and {0,0} apart
        h1 = mulAdd61(h1, a1, data.length);
        h2 = mulAdd61(h2, a2, data.length);
        return new long[]{mix64(h1), mix64(h2)};
    }

    public long seed() {
        return seed;
    }

    private static long fold61(long x) {
        long t = (x & MASK) + (x >>> 61);
        return t >= P61 ? t - P61 : t;
    }

    private static long reduce128(long hi, long lo) {
        long lo_lo = lo & MASK;   // low 61 bits
        long lo_hi = lo >>> 61;   // high 3 bits
        long hi8   = hi << 3;     // * 2^3
        long hi8_lo = hi8 & MASK;
        long hi8_hi = hi >>> 58;  // >> 61 then * 2^3
        long s = lo_lo + lo_hi + hi8_lo + hi8_hi;
        s = (s & MASK) + (s >>> 61);
        return s >= P61 ? s - P61 : s;
    }

    // (h * a + x) mod p, with h, a < p and 0 <= x < p
    private static long mulAdd61(long h, long a, long x) {
        long lo = h * a;
        long hi = Math.multiplyHigh(h, a);
        long r  = reduce128(hi, lo);
        long y  = r + x;
        return y >= P61 ? y - P61 : y;
    }

    // Spreads the 61-bit residue over all 64 bits before modular reduction by bitCount.
    private static long mix64(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return z;
    }

    @Override
    public String toString() {
        return "carter-wegman(seed=" + seed + ")";
    }
}
