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
package bamdedup.sam.markduplicates;

import bamdedup.BamDedupException;
import bamdedup.cmdline.CommandLineProgramTest;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMFileWriter;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordSetBuilder;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Inputs that {@link Dedup} must refuse.
 */
public class DedupExceptionTest extends CommandLineProgramTest {

    @Override
    public String getCommandLineProgramName() {
        return Dedup.class.getSimpleName();
    }

    @Test(expectedExceptions = BamDedupException.class,
            expectedExceptionsMessageRegExp = ".*is already marked as a duplicate.*")
    public void testAlreadyMarkedInputWithoutForce() {
        final DedupTester tester = new DedupTester();
        tester.addMappedFragment(0, 1, false, 50);
        tester.addMappedFragment(0, 1, true, 30);
        tester.flagAllInputRecordsAsDuplicates();
        tester.runTest();
    }

    @Test(expectedExceptions = BamDedupException.class,
            expectedExceptionsMessageRegExp = "This program requires coordinate-sorted input.*")
    public void testUnsortedHeaderIsRejected() {
        final File input = writeInput(SAMFileHeader.SortOrder.unsorted, false);
        runDedup(input);
    }

    @Test
    public void testUnsortedHeaderIsAcceptedWhenAssumedSorted() {
        final File input = writeInput(SAMFileHeader.SortOrder.unsorted, false);
        Assert.assertEquals(runDedup(input, "ASSUME_SORTED=true"), 0);
    }

    @Test(expectedExceptions = BamDedupException.class,
            expectedExceptionsMessageRegExp = "Input is not coordinate sorted.*")
    public void testOutOfOrderRecordsAreRejected() {
        final File input = writeInput(SAMFileHeader.SortOrder.unsorted, true);
        runDedup(input, "ASSUME_SORTED=true");
    }

    @Test
    public void testNegativeMinQualIsRejected() {
        final File input = writeInput(SAMFileHeader.SortOrder.coordinate, false);
        Assert.assertEquals(runDedup(input, "MIN_QUAL=-1"), 1);
    }

    @Test
    public void testEmptyRecordPoolIsRejected() {
        final File input = writeInput(SAMFileHeader.SortOrder.coordinate, false);
        Assert.assertEquals(runDedup(input, "MAX_RECORDS_IN_POOL=0"), 1);
    }

    @Test(expectedExceptions = BamDedupException.class,
            expectedExceptionsMessageRegExp = "Failed to allocate enough records.*")
    public void testRecordPoolExhaustion() {
        final File input = writeInput(SAMFileHeader.SortOrder.coordinate, false);
        runDedup(input, "MAX_RECORDS_IN_POOL=1");
    }

    /**
     * Writes a pair at positions 1 and 100 and a fragment at 50, either in coordinate order or with the fragment
     * moved to the end.
     */
    private File writeInput(final SAMFileHeader.SortOrder sortOrder, final boolean outOfOrder) {
        final SAMRecordSetBuilder builder = new SAMRecordSetBuilder(false, SAMFileHeader.SortOrder.unsorted);
        builder.setReadLength(50);
        final List<SAMRecord> pair = builder.addPair("pair", 0, 0, 1, 100, false, false, "50M", "50M", false, true,
                false, false, 30);
        final SAMRecord fragment = builder.addFrag("fragment", 0, 50, false);

        final List<SAMRecord> records = new ArrayList<>();
        records.add(pair.get(0));
        if (outOfOrder) {
            records.add(pair.get(1));
            records.add(fragment);
        } else {
            records.add(fragment);
            records.add(pair.get(1));
        }

        final SAMFileHeader header = builder.getHeader().clone();
        header.setSortOrder(sortOrder);
        final File input = new File(getTempOutputDir(), "input." + sortOrder + (outOfOrder ? ".outOfOrder" : "") + ".sam");
        try (SAMFileWriter writer = new SAMFileWriterFactory().makeSAMWriter(header, true, input)) {
            records.forEach(writer::addAlignment);
        }
        return input;
    }

    private int runDedup(final File input, final String... extraArgs) {
        final List<String> args = new ArrayList<>();
        args.add("INPUT=" + input.getAbsolutePath());
        args.add("OUTPUT=" + new File(getTempOutputDir(), input.getName() + ".out.sam").getAbsolutePath());
        for (final String arg : extraArgs) {
            args.add(arg);
        }
        return runBamDedupCommandLine(args);
    }
}
