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

import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import htsjdk.samtools.SAMRecord;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a single read end for duplicate detection: the reference, the unclipped 5' position, the strand and
 * the library.  Two reads from the same molecule collide on this key even when their clipping differs.
 *
 * Keys are ordered by reference, position, strand (forward first) and library, which is the order in which they
 * become final as a coordinate-sorted file is streamed.
 */
public final class ReadKey implements Comparable<ReadKey> {

    /**
     * Upper bound on how far before its alignment start a read's 5' key position may lie.  Cleanup never evicts keys
     * within this distance of the current record.
     */
    public static final int CLIP_OFFSET = 1000;

    /** Sorts before every key produced for a mapped read. */
    public static final ReadKey MIN_KEY = new ReadKey(Integer.MIN_VALUE, Integer.MIN_VALUE, false, 0);

    private final int referenceIndex;
    private final int position;
    private final boolean reverseStrand;
    private final int libraryId;

    public ReadKey(final int referenceIndex, final int position, final boolean reverseStrand, final int libraryId) {
        this.referenceIndex = referenceIndex;
        this.position = position;
        this.reverseStrand = reverseStrand;
        this.libraryId = libraryId;
    }

    /** Builds the key of a mapped record. */
    public static ReadKey of(final SAMRecord record, final int libraryId) {
        final boolean reverse = record.getReadNegativeStrandFlag();
        final int position;
        if (reverse) {
            position = record.getAlignmentEnd() - 1 + getClippedLength(record.getCigar().getCigarElements(), true);
        } else {
            position = record.getAlignmentStart() - 1 - getClippedLength(record.getCigar().getCigarElements(), false);
        }
        return new ReadKey(record.getReferenceIndex(), position, reverse, libraryId);
    }

    /**
     * The smallest key that a record starting at the given 0-based position could still produce.  Everything
     * strictly below it is final.
     */
    public static ReadKey cleanupKey(final int referenceIndex, final int zeroBasedPosition) {
        return new ReadKey(referenceIndex, zeroBasedPosition - CLIP_OFFSET, false, 0);
    }

    /**
     * Sums the bases at one end of the alignment that do not consume the reference: clips and insertions before the
     * first aligned base (or after the last one when {@code fromEnd}).
     */
    static int getClippedLength(final List<CigarElement> elements, final boolean fromEnd) {
        int clipped = 0;
        for (int i = 0; i < elements.size(); i++) {
            final CigarElement element = elements.get(fromEnd ? elements.size() - 1 - i : i);
            final CigarOperator operator = element.getOperator();
            if (operator.consumesReferenceBases()) break;
            if (operator == CigarOperator.S || operator == CigarOperator.H || operator == CigarOperator.I) {
                clipped += element.getLength();
            }
        }
        return clipped;
    }

    public int getReferenceIndex() { return referenceIndex; }

    public int getPosition() { return position; }

    public boolean isReverseStrand() { return reverseStrand; }

    public int getLibraryId() { return libraryId; }

    @Override
    public int compareTo(final ReadKey that) {
        int retval = Integer.compare(this.referenceIndex, that.referenceIndex);
        if (retval == 0) retval = Integer.compare(this.position, that.position);
        if (retval == 0) retval = Boolean.compare(this.reverseStrand, that.reverseStrand);
        if (retval == 0) retval = Integer.compare(this.libraryId, that.libraryId);
        return retval;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadKey)) return false;
        final ReadKey that = (ReadKey) o;
        return referenceIndex == that.referenceIndex &&
                position == that.position &&
                reverseStrand == that.reverseStrand &&
                libraryId == that.libraryId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(referenceIndex, position, reverseStrand, libraryId);
    }

    @Override
    public String toString() {
        return referenceIndex + ":" + position + (reverseStrand ? "R" : "F") + "/" + libraryId;
    }
}
