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

/**
 * The best pair seen so far at a {@link PairKey}.  Owns the records of both mates.
 *
 * Record 1 is the mate that completed the pair (read later), record 2 the mate that waited for it.
 */
public final class PairData {
    private final int sumBaseQuality;
    private final long record1Index;
    private final long record2Index;
    private final RecordHandle record1;
    private final RecordHandle record2;

    public PairData(final int sumBaseQuality,
                    final long record1Index, final RecordHandle record1,
                    final long record2Index, final RecordHandle record2) {
        this.sumBaseQuality = sumBaseQuality;
        this.record1Index = record1Index;
        this.record1 = record1;
        this.record2Index = record2Index;
        this.record2 = record2;
    }

    public int getSumBaseQuality() { return sumBaseQuality; }

    public long getRecord1Index() { return record1Index; }

    public long getRecord2Index() { return record2Index; }

    public RecordHandle getRecord1() { return record1; }

    public RecordHandle getRecord2() { return record2; }

    /**
     * True if this pair should replace {@code stored} at the same key: strictly higher quality, or equal quality and
     * an earlier first-read mate.
     */
    public boolean isBetterThan(final PairData stored) {
        if (this.sumBaseQuality != stored.sumBaseQuality) {
            return this.sumBaseQuality > stored.sumBaseQuality;
        }
        return this.record2Index < stored.record2Index;
    }
}
