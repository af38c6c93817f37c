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

import bamdedup.sam.testers.SamFileTester;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import org.testng.Assert;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.List;

/**
 * Runs {@link Dedup} on records added on the fly and checks the duplicate flag of every output record against the
 * flag expected when the record was added, along with the duplicate counts of the metrics file.
 */
public class DedupTester extends SamFileTester {

    private final File metricsFile;
    private boolean removeDuplicates = false;
    private DedupMetrics metrics;

    public DedupTester() {
        super(50, true);
        metricsFile = new File(getOutputDir(), "metrics.txt");
        addArg("METRICS_FILE=" + metricsFile);
    }

    public void setRemoveDuplicates() {
        removeDuplicates = true;
        addArg("REMOVE_DUPLICATES=true");
    }

    /** Sets the duplicate flag on every input record added so far. */
    public void flagAllInputRecordsAsDuplicates() {
        for (final SAMRecord record : getSamRecordSetBuilder().getRecords()) {
            record.setDuplicateReadFlag(true);
        }
    }

    @Override
    public String getCommandLineProgramName() {
        return Dedup.class.getSimpleName();
    }

    public DedupMetrics getMetrics() {
        return metrics;
    }

    @Override
    public void test() throws IOException {
        long expectedDuplicates = 0;
        long expectedUnpairedDuplicates = 0;
        long expectedPairedDuplicates = 0;
        try (final CloseableIterator<SAMRecord> inputRecords = getRecordIterator()) {
            while (inputRecords.hasNext()) {
                final SAMRecord record = inputRecords.next();
                if (!duplicateFlags.get(samRecordToDuplicatesFlagsKey(record))) continue;
                expectedDuplicates++;
                if (!record.getReadPairedFlag() || record.getMateUnmappedFlag()) {
                    expectedUnpairedDuplicates++;
                } else {
                    expectedPairedDuplicates++;
                }
            }
        }

        final SamReader reader = SamReaderFactory.makeDefault().open(getOutput());
        long outputRecords = 0;
        try {
            for (final SAMRecord record : reader) {
                outputRecords++;
                final String key = samRecordToDuplicatesFlagsKey(record);
                Assert.assertTrue(duplicateFlags.containsKey(key), "Unexpected record " + key);
                if (removeDuplicates) {
                    Assert.assertFalse(duplicateFlags.get(key), "Duplicate " + key + " was not removed");
                    Assert.assertFalse(record.getDuplicateReadFlag(), "Record " + key + " is flagged as a duplicate");
                } else {
                    Assert.assertEquals(record.getDuplicateReadFlag(), (boolean) duplicateFlags.get(key),
                            "Unexpected duplicate flag on " + key);
                }
            }
        } finally {
            CloserUtil.close(reader);
        }
        Assert.assertEquals(outputRecords,
                removeDuplicates ? getNumberOfRecords() - expectedDuplicates : getNumberOfRecords());

        final MetricsFile<DedupMetrics, Comparable<?>> metricsOutput = new MetricsFile<>();
        try (final FileReader metricsReader = new FileReader(metricsFile)) {
            metricsOutput.read(metricsReader);
        }
        final List<DedupMetrics> metricsList = metricsOutput.getMetrics();
        Assert.assertEquals(metricsList.size(), 1);
        metrics = metricsList.get(0);
        Assert.assertEquals(metrics.TOTAL_READS, getNumberOfRecords());
        Assert.assertEquals(metrics.UNPAIRED_READ_DUPLICATES, expectedUnpairedDuplicates);
        Assert.assertEquals(metrics.READ_PAIR_DUPLICATES, expectedPairedDuplicates / 2);
    }
}
