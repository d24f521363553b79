package utilities;

import java.util.Arrays;

// Fixed-size circular buffer of longs; once full, each append overwrites the oldest value.
public class LongRingBuffer {

    private final long[] buf;
    private int          pos    = 0;
    private int          filled = 0;

    public LongRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buf = new long[capacity];
    }

    public int capacity() {
        return buf.length;
    }

    public int size() {
        return filled;
    }

    public boolean isFilled() {
        return filled >= buf.length;
    }

    public boolean isEmpty() {
        return filled == 0;
    }

    public void append(long value) {
        buf[pos] = value;
        pos = (pos + 1) % buf.length;
        if (filled < buf.length) {
            filled++;
        }
    }

    /** Scans from the newest value backwards, so recently appended keys are found first. */
    public boolean contains(long value) {
        // pointer to start
        for (int i = pos - 1; i >= 0; i--) {
            if (buf[i] == value) return true;
        }
        if (!isFilled()) {
            return false;
        }
        // end to pointer
        for (int i = buf.length - 1; i >= pos; i--) {
            if (buf[i] == value) return true;
        }
        return false;
    }

    public void clear() {
        Arrays.fill(buf, 0L);
        pos = 0;
        filled = 0;
    }
}
