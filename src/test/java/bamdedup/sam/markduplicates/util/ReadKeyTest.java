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

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.TextCigarCodec;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

public class ReadKeyTest {

    private static final SAMFileHeader HEADER = new SAMFileHeader(new SAMSequenceDictionary(
            Arrays.asList(new SAMSequenceRecord("chr1", 100000), new SAMSequenceRecord("chr2", 100000))));

    private static SAMRecord makeRecord(final int referenceIndex, final int alignmentStart, final String cigar,
                                        final boolean reverse) {
        final SAMRecord record = new SAMRecord(HEADER);
        record.setReadName("read");
        record.setReferenceIndex(referenceIndex);
        record.setAlignmentStart(alignmentStart);
        record.setCigarString(cigar);
        record.setReadNegativeStrandFlag(reverse);
        return record;
    }

    @DataProvider(name = "fivePrimePositions")
    public Object[][] fivePrimePositions() {
        return new Object[][]{
                // alignment start, cigar, reverse, expected 0-based position
                {101, "50M", false, 100},
                {101, "5S45M", false, 95},
                {101, "3H5S42M", false, 92},
                {101, "2S3I45M", false, 95},
                {101, "2M3I45M", false, 100},
                {101, "50M", true, 149},
                {101, "45M5S", true, 149},
                {101, "40M5S5H", true, 149},
                {101, "20M10D30M", true, 159},
                {101, "45M2I3S", true, 149},
        };
    }

    @Test(dataProvider = "fivePrimePositions")
    public void testUnclippedFivePrimePosition(final int alignmentStart, final String cigar, final boolean reverse,
                                               final int expectedPosition) {
        final ReadKey key = ReadKey.of(makeRecord(0, alignmentStart, cigar, reverse), 3);
        Assert.assertEquals(key.getPosition(), expectedPosition);
        Assert.assertEquals(key.getReferenceIndex(), 0);
        Assert.assertEquals(key.isReverseStrand(), reverse);
        Assert.assertEquals(key.getLibraryId(), 3);
    }

    @Test
    public void testClippedLengthStopsAtFirstAlignedBase() {
        Assert.assertEquals(ReadKey.getClippedLength(TextCigarCodec.decode("4H3S2I10M7S").getCigarElements(), false), 9);
        Assert.assertEquals(ReadKey.getClippedLength(TextCigarCodec.decode("4H3S2I10M7S").getCigarElements(), true), 7);
        Assert.assertEquals(ReadKey.getClippedLength(TextCigarCodec.decode("10M").getCigarElements(), false), 0);
    }

    @Test
    public void testOrdering() {
        final ReadKey forward = new ReadKey(0, 100, false, 1);
        final ReadKey reverse = new ReadKey(0, 100, true, 0);
        final ReadKey otherLibrary = new ReadKey(0, 100, false, 2);
        final ReadKey later = new ReadKey(0, 101, false, 0);
        final ReadKey nextReference = new ReadKey(1, 0, false, 0);

        Assert.assertTrue(forward.compareTo(otherLibrary) < 0);
        Assert.assertTrue(otherLibrary.compareTo(reverse) < 0);
        Assert.assertTrue(reverse.compareTo(later) < 0);
        Assert.assertTrue(later.compareTo(nextReference) < 0);
        Assert.assertTrue(ReadKey.MIN_KEY.compareTo(forward) < 0);
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(new ReadKey(0, 100, true, 1), new ReadKey(0, 100, true, 1));
        Assert.assertEquals(new ReadKey(0, 100, true, 1).hashCode(), new ReadKey(0, 100, true, 1).hashCode());
        Assert.assertNotEquals(new ReadKey(0, 100, true, 1), new ReadKey(0, 100, false, 1));
        Assert.assertNotEquals(new ReadKey(0, 100, true, 1), new ReadKey(0, 100, true, 2));
    }

    @Test
    public void testCleanupKeyLiesClipOffsetBeforeThePosition() {
        final ReadKey cutoff = ReadKey.cleanupKey(1, 5000);
        Assert.assertEquals(cutoff, new ReadKey(1, 5000 - ReadKey.CLIP_OFFSET, false, 0));
        Assert.assertTrue(new ReadKey(1, 3999, true, 7).compareTo(cutoff) < 0);
        Assert.assertTrue(new ReadKey(1, 4000, false, 0).compareTo(cutoff) >= 0);
    }
}
