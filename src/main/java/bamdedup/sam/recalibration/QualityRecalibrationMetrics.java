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
package bamdedup.sam.recalibration;

import htsjdk.samtools.metrics.MetricBase;

/**
 * One cell of the empirical quality model: the observations of bases reported at one quality in one read group.
 */
public class QualityRecalibrationMetrics extends MetricBase {
    /** The read group the bases came from; empty for reads without one. */
    public String READ_GROUP;

    /** The base quality reported by the sequencer. */
    public int REPORTED_QUALITY;

    /** The number of aligned, non-N bases observed at this quality. */
    public long OBSERVATIONS;

    /** The number of those bases that differ from the reference. */
    public long MISMATCHES;

    /** The quality that bases reported at REPORTED_QUALITY are rewritten to. */
    public int EMPIRICAL_QUALITY;
}
