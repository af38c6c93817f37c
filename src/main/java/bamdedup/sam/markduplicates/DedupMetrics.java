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

import htsjdk.samtools.metrics.MetricBase;

/**
 * Statistics gathered while marking duplicates in a single input file.
 */
public class DedupMetrics extends MetricBase {
    /** The number of records read. */
    public long TOTAL_READS;

    /** The number of records flagged as paired. */
    public long PAIRED_READS;

    /** The number of records flagged as properly paired. */
    public long PROPERLY_PAIRED_READS;

    /** The number of unmapped records; these are never examined for duplication. */
    public long UNMAPPED_READS;

    /** The number of records mapped to the reverse strand. */
    public long REVERSE_STRAND_READS;

    /** The number of records flagged as failing platform/vendor quality checks. */
    public long QC_FAILED_READS;

    /** The number of secondary or supplementary alignments.  They are examined like primary alignments. */
    public long SECONDARY_OR_SUPPLEMENTARY_RDS;

    /** The number of paired reads whose mate was never found; these are treated as non-duplicates. */
    public long MISSING_MATES;

    /** The number of reads marked as duplicates of a single-end or mate-unmapped read. */
    public long UNPAIRED_READ_DUPLICATES;

    /** The number of read pairs marked as duplicates. */
    public long READ_PAIR_DUPLICATES;

    /** The largest number of records held in memory at once. */
    public long PEAK_TRACKED_RECORDS;

    /** The fraction of examined reads that were marked as duplicates. */
    public Double PERCENT_DUPLICATION;

    public void calculateDerivedFields() {
        final long examined = TOTAL_READS - UNMAPPED_READS;
        if (examined > 0) {
            PERCENT_DUPLICATION = (UNPAIRED_READ_DUPLICATES + READ_PAIR_DUPLICATES * 2) / (double) examined;
        } else {
            PERCENT_DUPLICATION = (double) 0;
        }
    }
}
