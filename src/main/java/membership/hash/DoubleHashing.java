package membership.hash;

// Kirsch–Mitzenmacher: k indices from two base hashes, g_i(x) = h1 + i * h2.
public final class DoubleHashing {

    private DoubleHashing() {
        throw new AssertionError("DoubleHashing must not be instantiated");
    }

    /** Wrapping 64-bit h1 + round * h2. */
    public static long derive(long h1, long h2, long round) {
        return h1 + round * h2;
    }

    /** Derived value read as unsigned and reduced into [0, bitCount). */
    public static long index(long h1, long h2, long round, long bitCount) {
        if (bitCount <= 0) {
            throw new IllegalArgumentException("bitCount must be > 0");
        }
        return Long.remainderUnsigned(derive(h1, h2, round), bitCount);
    }
}
