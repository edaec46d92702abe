package com.phillippitts.livescribe.service.audio;

/**
 * Fixed-capacity ring of the most recent samples. Writing past capacity drops the oldest samples.
 *
 * <p>Thread-safe: the decode thread writes while callers read the tail for overlap.
 */
final class OverlapBuffer {

    private final short[] buffer;
    private int writePos = 0;
    private int size = 0;

    OverlapBuffer(int capacitySamples) {
        if (capacitySamples <= 0) {
            throw new IllegalArgumentException("capacitySamples must be positive");
        }
        this.buffer = new short[capacitySamples];
    }

    int capacity() {
        return buffer.length;
    }

    synchronized int size() {
        return size;
    }

    synchronized void write(short[] src, int off, int len) {
        if (len <= 0) {
            return;
        }
        if (len >= buffer.length) {
            // keep only the tail of src
            System.arraycopy(src, off + (len - buffer.length), buffer, 0, buffer.length);
            writePos = 0;
            size = buffer.length;
            return;
        }
        int first = Math.min(len, buffer.length - writePos);
        System.arraycopy(src, off, buffer, writePos, first);
        int remaining = len - first;
        if (remaining > 0) {
            System.arraycopy(src, off + first, buffer, 0, remaining);
            writePos = remaining;
        } else {
            writePos = (writePos + first) % buffer.length;
        }
        size = Math.min(size + len, buffer.length);
    }

    /**
     * Returns up to {@code count} most recent samples, oldest first.
     */
    synchronized short[] tail(int count) {
        int n = Math.min(Math.max(count, 0), size);
        short[] out = new short[n];
        if (n == 0) {
            return out;
        }
        int start = (writePos - n + buffer.length) % buffer.length;
        int first = Math.min(n, buffer.length - start);
        System.arraycopy(buffer, start, out, 0, first);
        if (first < n) {
            System.arraycopy(buffer, 0, out, first, n - first);
        }
        return out;
    }

    synchronized void clear() {
        writePos = 0;
        size = 0;
    }
}
