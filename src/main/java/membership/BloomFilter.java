package membership;

import membership.hash.DoubleHashing;
import membership.hash.Murmur3SeedHash;
import membership.hash.SeedHash;
import utilities.FilterLogger;

import java.nio.ByteBuffer;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread safe Bloom filter over byte strings, backed by a packed bit array.
 *
 * <p>Every public operation takes the filter's read/write lock: {@code add}, {@code reset},
 * {@code merge} and {@code unmarshalBinary} exclusively, {@code test}, {@code marshalBinary}
 * and the statistics shared. Bit indices come from two seed hashes expanded by
 * {@link DoubleHashing}, so one insert costs a single hash evaluation regardless of
 * {@code hashRounds}.
 *
 * <p>Binary layout: one version byte, {@code bitCount} and {@code hashRounds} as big-endian
 * 64-bit integers, then {@code ceil(bitCount / 8)} bytes of bits.
 */
public class BloomFilter implements Membership {

    public static final byte FORMAT_VERSION = 1;
    public static final int HEADER_BYTES = 1 + Long.BYTES + Long.BYTES;

    // Largest bit count whose marshaled form (header plus buffer) still fits a Java array.
    public static final long MAX_BIT_COUNT = 8L * (Integer.MAX_VALUE - 8 - HEADER_BYTES);

    // Bounds lock hold time; bySize never exceeds ~1075 rounds since p >= Double.MIN_VALUE.
    public static final long MAX_HASH_ROUNDS = 4096;

    private static final double LN2 = Math.log(2);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final SeedHash seedHash;

    // replaced together by unmarshalBinary, guarded by lock
    private long bitCount;
    private long hashRounds;
    private byte[] bits;

    private BloomFilter(long bitCount, long hashRounds, byte[] bits, SeedHash seedHash) {
        this.bitCount = bitCount;
        this.hashRounds = hashRounds;
        this.bits = bits;
        this.seedHash = seedHash;
    }

    public static BloomFilter bySize(long elements, double falsePositiveRate) {
        return bySize(elements, falsePositiveRate, Murmur3SeedHash.getDefault());
    }

    /**
     * Sizes the filter for {@code elements} insertions at the given false positive rate:
     * {@code m = ceil(-n ln p / ln(2)^2)} and {@code k = ceil(m / n * ln 2)}.
     */
    public static BloomFilter bySize(long elements, double falsePositiveRate, SeedHash seedHash) {
        if (elements <= 0) {
            throw FilterException.invalidParameters("elements must be > 0, got " + elements);
        }
        if (!(falsePositiveRate > 0.0 && falsePositiveRate < 1.0)) {
            throw FilterException.invalidParameters("falsePositiveRate must be in (0,1), got " + falsePositiveRate);
        }

        double m = Math.ceil(-(elements * Math.log(falsePositiveRate)) / (LN2 * LN2));
        if (m > MAX_BIT_COUNT) {
            throw FilterException.invalidParameters(String.format(Locale.ROOT,
                    "n=%d, p=%.4g needs %.0f bits, more than the supported %d", elements, falsePositiveRate, m, MAX_BIT_COUNT));
        }
        long bitCount = (long) m;
        long hashRounds = (long) Math.ceil((bitCount / (double) elements) * LN2);
        if (bitCount <= 0 || hashRounds <= 0) {
            throw FilterException.invalidParameters("parameters produce an empty filter: m=" + bitCount + ", k=" + hashRounds);
        }
        return allocate(bitCount, hashRounds, seedHash);
    }

    public static BloomFilter byParameters(long bitCount, long hashRounds) {
        return byParameters(bitCount, hashRounds, Murmur3SeedHash.getDefault());
    }

    /**
     * Builds a filter with explicit sizing. {@code hashRounds == 0} is accepted and gives
     * a filter that reports every input as present.
     */
    public static BloomFilter byParameters(long bitCount, long hashRounds, SeedHash seedHash) {
        if (bitCount <= 0) {
            throw FilterException.invalidParameters("bitCount must be > 0, got " + bitCount);
        }
        if (bitCount > MAX_BIT_COUNT) {
            throw FilterException.invalidParameters("bitCount must be <= " + MAX_BIT_COUNT + ", got " + bitCount);
        }
        if (hashRounds < 0 || hashRounds > MAX_HASH_ROUNDS) {
            throw FilterException.invalidParameters("hashRounds must be in [0, " + MAX_HASH_ROUNDS + "], got " + hashRounds);
        }
        return allocate(bitCount, hashRounds, seedHash);
    }

    public static BloomFilter create(FilterConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.isSized()) {
            return bySize(configuration.expectedElements(), configuration.falsePositiveRate(), configuration.seedHash());
        }
        return byParameters(configuration.bitCount(), configuration.hashRounds(), configuration.seedHash());
    }

    /** Decodes a filter written by {@link #marshalBinary()}, hashing with the default seed hash. */
    public static BloomFilter fromBinary(byte[] data) {
        return fromBinary(data, Murmur3SeedHash.getDefault());
    }

    public static BloomFilter fromBinary(byte[] data, SeedHash seedHash) {
        Decoded decoded = decode(data);
        return new BloomFilter(decoded.bitCount, decoded.hashRounds, decoded.bits,
                Objects.requireNonNull(seedHash, "seedHash"));
    }

    private static BloomFilter allocate(long bitCount, long hashRounds, SeedHash seedHash) {
        Objects.requireNonNull(seedHash, "seedHash");
        BloomFilter filter = new BloomFilter(bitCount, hashRounds, new byte[byteLength(bitCount)], seedHash);
        if (FilterLogger.isDebugEnabled()) {
            FilterLogger.debug("Created bloom filter " + filter + " hash=" + seedHash);
        }
        return filter;
    }

    static int byteLength(long bitCount) {
        return (int) ((bitCount + 7) >>> 3);
    }

    @Override
    public void add(byte[] data) {
        add(seedHash.hash(data));
    }

    // h is the {h1, h2} pair from this filter's seed hash
    void add(long[] h) {
        lock.writeLock().lock();
        try {
            for (long i = 0; i < hashRounds; i++) {
                long index = DoubleHashing.index(h[0], h[1], i, bitCount);
                bits[(int) (index >>> 3)] |= (byte) (1 << (index & 7));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean test(byte[] data) {
        return test(seedHash.hash(data));
    }

    boolean test(long[] h) {
        lock.readLock().lock();
        try {
            for (long i = 0; i < hashRounds; i++) {
                long index = DoubleHashing.index(h[0], h[1], i, bitCount);
                if ((bits[(int) (index >>> 3)] & (1 << (index & 7))) == 0) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            bits = new byte[bits.length];
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * ORs {@code other}'s bits into this filter. Only this filter is locked; the caller
     * must make sure {@code other} is not modified while the merge runs.
     *
     * @throws FilterException with {@link FilterException.Kind#INCOMPATIBLE_PARAMETERS} when the
     *                         bit counts or hash rounds differ; this filter is left untouched
     */
    public void merge(BloomFilter other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return;
        }
        // unlocked snapshot of other, see javadoc
        long otherBitCount = other.bitCount;
        long otherHashRounds = other.hashRounds;
        byte[] otherBits = other.bits;

        lock.writeLock().lock();
        try {
            if (bitCount != otherBitCount || hashRounds != otherHashRounds) {
                throw FilterException.incompatible(String.format(Locale.ROOT,
                        "cannot merge m=%d, k=%d into m=%d, k=%d", otherBitCount, otherHashRounds, bitCount, hashRounds));
            }
            if (otherBits.length != bits.length) {
                throw FilterException.incompatible("bit buffers differ in length: " + otherBits.length + " vs " + bits.length);
            }
            for (int i = 0; i < bits.length; i++) {
                bits[i] |= otherBits[i];
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isCompatible(BloomFilter other) {
        Objects.requireNonNull(other, "other");
        lock.readLock().lock();
        try {
            return bitCount == other.bitCount && hashRounds == other.hashRounds;
        } finally {
            lock.readLock().unlock();
        }
    }

    public byte[] marshalBinary() {
        lock.readLock().lock();
        try {
            ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + bits.length); // big-endian
            out.put(FORMAT_VERSION);
            out.putLong(bitCount);
            out.putLong(hashRounds);
            out.put(bits);
            return out.array();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces this filter's sizing and bits with the decoded content of {@code data}. The
     * whole input is validated before anything is swapped in, so a rejected input leaves the
     * filter unchanged.
     */
    public void unmarshalBinary(byte[] data) {
        Decoded decoded = decode(data);
        lock.writeLock().lock();
        try {
            bitCount = decoded.bitCount;
            hashRounds = decoded.hashRounds;
            bits = decoded.bits;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Decoded decode(byte[] data) {
        if (data == null || data.length < HEADER_BYTES) {
            int length = data == null ? 0 : data.length;
            FilterLogger.warning("Rejected filter data: " + length + " bytes is shorter than the " + HEADER_BYTES + " byte header");
            throw FilterException.truncated("need at least " + HEADER_BYTES + " bytes, got " + length);
        }
        ByteBuffer in = ByteBuffer.wrap(data);
        byte version = in.get();
        if (version != FORMAT_VERSION) {
            FilterLogger.warning("Rejected filter data with version " + version);
            throw FilterException.unsupportedVersion("unsupported format version " + version + ", expected " + FORMAT_VERSION);
        }
        long bitCount = in.getLong();
        long hashRounds = in.getLong();
        if (bitCount <= 0 || bitCount > MAX_BIT_COUNT) {
            FilterLogger.warning("Rejected filter data declaring bitCount " + Long.toUnsignedString(bitCount));
            throw FilterException.corrupt("declared bitCount " + Long.toUnsignedString(bitCount) + " is out of range");
        }
        if (hashRounds < 0 || hashRounds > MAX_HASH_ROUNDS) {
            FilterLogger.warning("Rejected filter data declaring hashRounds " + Long.toUnsignedString(hashRounds));
            throw FilterException.corrupt("declared hashRounds " + Long.toUnsignedString(hashRounds) + " is out of range");
        }
        int expected = byteLength(bitCount);
        if (in.remaining() != expected) {
            FilterLogger.warning("Rejected filter data: " + in.remaining() + " bit buffer bytes, header says " + expected);
            throw FilterException.corrupt("bit buffer has " + in.remaining() + " bytes, expected " + expected);
        }
        byte[] bits = new byte[expected];
        in.get(bits);
        return new Decoded(bitCount, hashRounds, bits);
    }

    public long bitCount() {
        lock.readLock().lock();
        try {
            return bitCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long hashRounds() {
        lock.readLock().lock();
        try {
            return hashRounds;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int sizeInBytes() {
        lock.readLock().lock();
        try {
            return bits.length;
        } finally {
            lock.readLock().unlock();
        }
    }

    public SeedHash seedHash() {
        return seedHash;
    }

    /** Number of set bits. */
    public long cardinality() {
        lock.readLock().lock();
        try {
            return countBits();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ignores padding bits past bitCount in the last byte; unmarshaled buffers may carry them
    private long countBits() {
        long count = 0;
        int full = (int) (bitCount >>> 3);
        for (int i = 0; i < full; i++) {
            count += Integer.bitCount(bits[i] & 0xFF);
        }
        int tail = (int) (bitCount & 7);
        if (tail != 0) {
            count += Integer.bitCount(bits[full] & ((1 << tail) - 1));
        }
        return count;
    }

    /** Current false positive probability estimated from the fill ratio: rho^k. */
    @Override
    public double approximateFalsePositiveRate() {
        lock.readLock().lock();
        try {
            if (hashRounds == 0) return 1.0;
            double rho = (double) countBits() / bitCount;
            if (rho <= 0) return 0.0;
            if (rho >= 1) return 1.0;
            return Math.pow(rho, hashRounds);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Estimated number of distinct items added: -(m/k) ln(1 - rho). */
    public long estimateDistinct() {
        lock.readLock().lock();
        try {
            if (hashRounds == 0) return 0;
            double rho = (double) countBits() / bitCount;
            if (rho <= 0) return 0;
            if (rho >= 1) return Long.MAX_VALUE;
            return Math.round(-(bitCount / (double) hashRounds) * Math.log(1.0 - rho));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return String.format(Locale.ROOT, "m=%d, k=%d, set=%d", bitCount, hashRounds, countBits());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class Decoded {
        final long bitCount;
        final long hashRounds;
        final byte[] bits;

        Decoded(long bitCount, long hashRounds, byte[] bits) {
            this.bitCount = bitCount;
            this.hashRounds = hashRounds;
            this.bits = bits;
        }
    }
}
