package com.questrail.plcsim.protocol.telegram.internal.frame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * TelegramStreamAccumulator
 * =============================================================================
 * Reassembles a TCP byte stream into whole fixed-length telegram frames.
 *
 * <p>TCP delivers arbitrary chunk boundaries. This class buffers partial data
 * between reads and releases every complete frame in arrival order. A trailing
 * partial frame is never released.</p>
 *
 * <h2>Overflow policy</h2>
 * <p>The buffer is capped at {@code frameLength * maxFrames} bytes. If an append
 * would exceed the cap, the <em>oldest</em> excess bytes are dropped from the
 * front and reported in {@link AppendResult#discardedBytes()}. Appends never
 * block and never fail. Once an append returns, the buffer holds no more than
 * the cap.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. It is owned by one connection session and touched only from
 * the endpoint's receive thread, and from the session worker after the endpoint
 * has been closed.</p>
 */
public final class TelegramStreamAccumulator {

    /**
     * Result of one append.
     *
     * @param frames         whole frames removed from the front, in arrival order
     * @param discardedBytes bytes dropped by the overflow policy, 0 if none
     */
    public record AppendResult(List<byte[]> frames, int discardedBytes) {
        public AppendResult {
            frames = List.copyOf(frames);
        }

        public boolean overflowed() {
            return discardedBytes > 0;
        }
    }

    private final int frameLength;
    private final byte[] buffer;
    private int size;

    /**
     * @param frameLength fixed frame size in bytes
     * @param maxFrames   number of frames the buffer may hold before discarding
     */
    public TelegramStreamAccumulator(int frameLength, int maxFrames) {
        if (frameLength <= 0) {
            throw new IllegalArgumentException("frameLength must be > 0");
        }
        if (maxFrames <= 0) {
            throw new IllegalArgumentException("maxFrames must be > 0");
        }
        this.frameLength = frameLength;
        this.buffer = new byte[Math.multiplyExact(frameLength, maxFrames)];
    }

    public AppendResult append(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");

        int discarded = 0;
        int total = size + chunk.length;

        if (total > buffer.length) {
            discarded = total - buffer.length;
            if (discarded >= size) {
                // Everything buffered goes, plus the head of the chunk.
                int skip = discarded - size;
                System.arraycopy(chunk, skip, buffer, 0, chunk.length - skip);
                size = chunk.length - skip;
            }
            else {
                System.arraycopy(buffer, discarded, buffer, 0, size - discarded);
                size -= discarded;
                System.arraycopy(chunk, 0, buffer, size, chunk.length);
                size += chunk.length;
            }
        }
        else {
            System.arraycopy(chunk, 0, buffer, size, chunk.length);
            size = total;
        }

        List<byte[]> frames = new ArrayList<>(size / frameLength);
        int offset = 0;
        while (size - offset >= frameLength) {
            frames.add(Arrays.copyOfRange(buffer, offset, offset + frameLength));
            offset += frameLength;
        }
        if (offset > 0) {
            System.arraycopy(buffer, offset, buffer, 0, size - offset);
            size -= offset;
        }

        return new AppendResult(frames, discarded);
    }

    /**
     * Drops any buffered partial frame.
     *
     * @return number of bytes discarded
     */
    public int clear() {
        int discarded = size;
        size = 0;
        return discarded;
    }

    public int bufferedBytes() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }
}
