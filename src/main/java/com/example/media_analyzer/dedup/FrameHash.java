package com.example.media_analyzer.dedup;

import com.example.media_analyzer.exception.HashShapeMismatchException;

import java.util.BitSet;

/**
 * Fixed-length difference hash. Compared by Hamming distance; lower means more similar.
 */
public final class FrameHash {
    private final BitSet bits;
    private final int length;

    FrameHash(BitSet bits, int length) {
        this.bits = (BitSet) bits.clone();
        this.length = length;
    }

    public int length() {
        return length;
    }

    public boolean bit(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(index);
        }
        return bits.get(index);
    }

    /**
     * Number of positions at which the two hashes differ.
     *
     * @throws HashShapeMismatchException when the hashes were computed with different hash sizes.
     */
    public int distance(FrameHash other) {
        if (other.length != length) {
            throw new HashShapeMismatchException(length, other.length);
        }
        BitSet xor = (BitSet) bits.clone();
        xor.xor(other.bits);
        return xor.cardinality();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameHash other)) return false;
        return length == other.length && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * bits.hashCode() + length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(length / 4 + 1);
        for (int i = 0; i < length; i += 4) {
            int nibble = 0;
            for (int j = 0; j < 4 && i + j < length; j++) {
                nibble = (nibble << 1) | (bits.get(i + j) ? 1 : 0);
            }
            sb.append(Character.forDigit(nibble, 16));
        }
        return sb.toString();
    }
}
