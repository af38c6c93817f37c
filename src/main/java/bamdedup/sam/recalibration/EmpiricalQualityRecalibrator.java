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

import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMTag;
import htsjdk.samtools.SAMUtils;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.QualityUtil;
import htsjdk.samtools.util.SequenceUtil;

import java.io.File;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Recalibrates base qualities from the observed mismatch rate of each (read group, reported quality) cell.
 *
 * Mismatches are counted against the reference reconstructed from the read's MD tag, so reads without one are not
 * used to build the table.  Soft clipped and inserted bases and no-calls are ignored.  The empirical error rate of a
 * cell is smoothed with one pseudo-mismatch in two pseudo-observations, so that sparse cells stay close to Q3.
 */
public class EmpiricalQualityRecalibrator implements ReadRecalibrator {
    /** Appended to the output file name to name the model file. */
    public static final String MODEL_EXTENSION = ".qemp";

    private static final int SMOOTHING_CONSTANT = 1;
    private static final int NUM_QUALITIES = SAMUtils.MAX_PHRED_SCORE + 1;

    /** Markers written by {@link SequenceUtil#makeReferenceFromAlignment} for bases without a reference base. */
    private static final byte SOFT_CLIPPED = '0';
    private static final byte INSERTED = '-';

    private static final Log log = Log.getInstance(EmpiricalQualityRecalibrator.class);

    private final RecalibrationArgumentCollection args;
    private final MetricsFile<QualityRecalibrationMetrics, Integer> modelFile;
    private final Map<String, QualityCounts> table = new TreeMap<>();
    private Map<String, byte[]> model = null;

    private static class QualityCounts {
        final long[] observations = new long[NUM_QUALITIES];
        final long[] mismatches = new long[NUM_QUALITIES];
    }

    /**
     * @param modelFile receives one {@link QualityRecalibrationMetrics} per observed cell when the model is emitted
     */
    public EmpiricalQualityRecalibrator(final RecalibrationArgumentCollection args,
                                        final MetricsFile<QualityRecalibrationMetrics, Integer> modelFile) {
        this.args = args;
        this.modelFile = modelFile;
    }

    @Override
    public void buildTable(final SAMRecord record) {
        if (model != null) {
            throw new IllegalStateException("Cannot add reads to the recalibration table after the model was emitted");
        }
        final byte[] qualities = record.getBaseQualities();
        if (record.getReadUnmappedFlag() || qualities.length == 0 ||
                record.getStringAttribute(SAMTag.MD.name()) == null) {
            return;
        }

        final byte[] reference = SequenceUtil.makeReferenceFromAlignment(record, false);
        final byte[] bases = record.getReadBases();
        final QualityCounts counts = table.computeIfAbsent(getReadGroup(record), k -> new QualityCounts());
        final int length = Math.min(bases.length, reference.length);
        for (int i = 0; i < length; i++) {
            if (reference[i] == SOFT_CLIPPED || reference[i] == INSERTED || SequenceUtil.isNoCall(bases[i])) continue;
            final int quality = Math.min(qualities[i], NUM_QUALITIES - 1);
            counts.observations[quality]++;
            if (!SequenceUtil.basesEqual(bases[i], reference[i])) {
                counts.mismatches[quality]++;
            }
        }
    }

    @Override
    public void emitModel(final File output) {
        model = new TreeMap<>();
        for (final Map.Entry<String, QualityCounts> entry : table.entrySet()) {
            final QualityCounts counts = entry.getValue();
            final byte[] empirical = new byte[NUM_QUALITIES];
            for (int quality = 0; quality < NUM_QUALITIES; quality++) {
                final long observations = counts.observations[quality];
                if (observations == 0) {
                    empirical[quality] = (byte) quality;
                    continue;
                }
                final long mismatches = counts.mismatches[quality];
                final double errorRate = (mismatches + SMOOTHING_CONSTANT) /
                        (double) (observations + SMOOTHING_CONSTANT + SMOOTHING_CONSTANT);
                empirical[quality] = (byte) Math.min(QualityUtil.getPhredScoreFromErrorProbability(errorRate),
                        args.MAX_RECALIBRATED_QUALITY);

                final QualityRecalibrationMetrics metric = new QualityRecalibrationMetrics();
                metric.READ_GROUP = entry.getKey();
                metric.REPORTED_QUALITY = quality;
                metric.OBSERVATIONS = observations;
                metric.MISMATCHES = mismatches;
                metric.EMPIRICAL_QUALITY = empirical[quality];
                modelFile.addMetric(metric);
            }
            model.put(entry.getKey(), empirical);
        }

        final File modelOutput = new File(output.getPath() + MODEL_EXTENSION);
        modelFile.write(modelOutput);
        log.info("Wrote the recalibration model of " + model.size() + " read group(s) to " + modelOutput);
    }

    @Override
    public void applyTable(final SAMRecord record) {
        if (model == null) {
            throw new IllegalStateException("The recalibration model must be emitted before it is applied");
        }
        final byte[] qualities = record.getBaseQualities();
        final byte[] empirical = model.get(getReadGroup(record));
        if (qualities.length == 0 || empirical == null) return;

        if (args.STORE_ORIGINAL_QUALITIES && record.getOriginalBaseQualities() == null) {
            record.setOriginalBaseQualities(qualities);
        }
        final byte[] recalibrated = Arrays.copyOf(qualities, qualities.length);
        for (int i = 0; i < recalibrated.length; i++) {
            if (recalibrated[i] >= 0 && recalibrated[i] < NUM_QUALITIES) {
                recalibrated[i] = empirical[recalibrated[i]];
            }
        }
        record.setBaseQualities(recalibrated);
    }

    /**
     * The quality that bases of the read group reported at {@code reportedQuality} are rewritten to, or the reported
     * quality itself if the cell was never observed or lies outside the phred range.
     */
    public int getEmpiricalQuality(final String readGroup, final int reportedQuality) {
        if (model == null) {
            throw new IllegalStateException("The recalibration model has not been emitted");
        }
        final byte[] empirical = model.get(readGroup);
        if (empirical == null || reportedQuality < 0 || reportedQuality >= NUM_QUALITIES) {
            return reportedQuality;
        }
        return empirical[reportedQuality];
    }

    private static String getReadGroup(final SAMRecord record) {
        final Object readGroup = record.getAttribute(SAMTag.RG.name());
        return readGroup == null ? "" : readGroup.toString();
    }
}
