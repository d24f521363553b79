package utilities;

import membership.BloomFilter;
import org.openjdk.jol.info.ClassLayout;
import org.openjdk.jol.vm.VM;

import java.util.Locale;

/**
 * Heap footprint of a filter as laid out by the running VM (via JOL), next to the raw
 * bits it needs and the bytes the same items would take as plain keys.
 */
public final class FootprintReport {

    private final long shellBytes;
    private final long bufferBytes;
    private final long rawBitBytes;

    private FootprintReport(long shellBytes, long bufferBytes, long rawBitBytes) {
        this.shellBytes = shellBytes;
        this.bufferBytes = bufferBytes;
        this.rawBitBytes = rawBitBytes;
    }

    public static FootprintReport of(BloomFilter filter) {
        // The lock's internals and the seed hash are shared-size constants; only the shell is counted.
        long shell = ClassLayout.parseClass(BloomFilter.class).instanceSize();
        int align = VM.current().objectAlignment();
        // one read: the buffer length is ceil(bitCount / 8), so it also gives the raw bit bytes
        long raw = filter.sizeInBytes();
        long buffer = alignUp(VM.current().arrayHeaderSize() + raw, align);
        return new FootprintReport(shell, buffer, raw);
    }

    // Align size up to the nearest multiple of alignment (power of two).
    private static long alignUp(long size, int alignment) {
        long a = alignment;
        return (size + (a - 1)) & ~(a - 1);
    }

    public long shellBytes() { return shellBytes; }
    public long bufferBytes() { return bufferBytes; }
    public long rawBitBytes() { return rawBitBytes; }

    public long totalBytes() {
        return shellBytes + bufferBytes;
    }

    /** Ratio of the filter footprint to storing {@code items} keys of {@code keyBytes} each. */
    public double savingsAgainst(long items, long keyBytes) {
        double exact = (double) items * keyBytes;
        if (exact <= 0) return 0.0;
        return 1.0 - totalBytes() / exact;
    }

    @Override
    public String toString() {
        Locale L = Locale.ROOT;
        return String.format(L, "Total: %d B (%.3f MiB)", totalBytes(), totalBytes() / (1024.0 * 1024.0)) + "\n"
                + String.format(L, "  |_ Filter shell (JOL): %d B", shellBytes) + "\n"
                + String.format(L, "  |_ Bit buffer (JOL aligned): %d B", bufferBytes) + "\n"
                + String.format(L, "Raw bits: %d B (%.3f MiB)", rawBitBytes, rawBitBytes / (1024.0 * 1024.0));
    }
}
