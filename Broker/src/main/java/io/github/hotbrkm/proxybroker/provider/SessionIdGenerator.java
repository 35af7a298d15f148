package io.github.hotbrkm.proxybroker.provider;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates opaque session tokens.
 * <p>
 * The last (up to eight) bytes of a token are a keyed permutation of a per-generator sequence
 * number, so tokens of one width never repeat until that width's value space is exhausted and no
 * history of issued tokens is kept. Keys are drawn from a {@link SecureRandom} at construction;
 * bytes beyond the eighth are filled from it on every draw.
 */
class SessionIdGenerator {

    private static final int SEQUENCE_BYTES = Long.BYTES;

    private final SecureRandom random;
    private final AtomicLong sequence = new AtomicLong(0);
    private final long multiplier1;
    private final long increment1;
    private final long multiplier2;
    private final long increment2;

    SessionIdGenerator() {
        this(new SecureRandom());
    }

    SessionIdGenerator(SecureRandom random) {
        this.random = random;
        this.multiplier1 = random.nextLong() | 1L;
        this.increment1 = random.nextLong();
        this.multiplier2 = random.nextLong() | 1L;
        this.increment2 = random.nextLong();
    }

    /**
     * Returns a lowercase hex token of {@code 2 * bytes} characters.
     */
    String nextHex(int bytes) {
        return HexFormat.of().formatHex(next(bytes));
    }

    /**
     * Returns an unpadded URL-safe Base64 token.
     */
    String nextUrlSafe(int bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(next(bytes));
    }

    private byte[] next(int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("bytes must be positive: " + bytes);
        }
        int sequenceBytes = Math.min(bytes, SEQUENCE_BYTES);
        int bits = sequenceBytes * Byte.SIZE;
        long mask = bits == Long.SIZE ? -1L : (1L << bits) - 1;

        long seq = sequence.getAndIncrement();
        if (Long.compareUnsigned(seq, mask) > 0) {
            throw new IllegalStateException("Session tokens of " + bytes + " bytes are exhausted for this generator");
        }

        byte[] buffer = new byte[bytes];
        if (bytes > sequenceBytes) {
            byte[] prefix = new byte[bytes - sequenceBytes];
            random.nextBytes(prefix);
            System.arraycopy(prefix, 0, buffer, 0, prefix.length);
        }
        long value = permute(seq, bits, mask);
        for (int i = bytes - 1; i >= bytes - sequenceBytes; i--) {
            buffer[i] = (byte) value;
            value >>>= Byte.SIZE;
        }
        return buffer;
    }

    // odd multiplier and xor-shift are both bijections modulo 2^bits
    private long permute(long seq, int bits, long mask) {
        int shift = bits / 2;
        long x = (seq * multiplier1 + increment1) & mask;
        x ^= x >>> shift;
        x = (x * multiplier2 + increment2) & mask;
        x ^= x >>> shift;
        return x;
    }
}
