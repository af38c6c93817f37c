/*
 * The MIT License
 *
 * Copyright (c) 2024 The Broad Institute
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package bamdedup.sam.markduplicates.util;

import java.util.Objects;

/**
 * Identity of a read pair: the keys of both ends, stored smaller first so that the order in which the mates were
 * read does not matter.
 *
 * Pairs are ordered by their larger key first.  A pair is completed when its later end is read, so ordering on the
 * larger key makes "all pairs that can no longer be matched" a prefix of the paired map.
 */
public final class PairKey implements Comparable<PairKey> {
    private final ReadKey low;
    private final ReadKey high;

    private PairKey(final ReadKey low, final ReadKey high) {
        this.low = low;
        this.high = high;
    }

    public static PairKey of(final ReadKey key1, final ReadKey key2) {
        if (key2.compareTo(key1) < 0) {
            return new PairKey(key2, key1);
        }
        return new PairKey(key1, key2);
    }

    /** The smallest pair key whose larger end is {@code cutoff}. */
    public static PairKey cleanupKey(final ReadKey cutoff) {
        return new PairKey(ReadKey.MIN_KEY, cutoff);
    }

    public ReadKey getLow() { return low; }

    public ReadKey getHigh() { return high; }

    @Override
    public int compareTo(final PairKey that) {
        final int retval = this.high.compareTo(that.high);
        if (retval != 0) return retval;
        return this.low.compareTo(that.low);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof PairKey)) return false;
        final PairKey that = (PairKey) o;
        return low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        return "(" + low + ", " + high + ")";
    }
}
