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
import bamdedup.cmdline.CommandLineProgram;
import bamdedup.cmdline.StandardOptionDefinitions;
import bamdedup.cmdline.programgroups.ReadDataManipulationProgramGroup;
import bamdedup.sam.markduplicates.util.DuplicateDetector;
import bamdedup.sam.markduplicates.util.LibraryIdResolver;
import bamdedup.sam.markduplicates.util.RecordPool;
import bamdedup.sam.recalibration.EmpiricalQualityRecalibrator;
import bamdedup.sam.recalibration.RecalibrationArgumentCollection;
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMFileWriter;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SAMProgramRecord;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.ProgressLogger;
import htsjdk.samtools.util.SortingLongCollection;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Marks or removes duplicate reads in a coordinate-sorted SAM or BAM file in two streaming passes: the first finds the
 * duplicates while holding only the reads of the currently open window in memory, the second copies the input to the
 * output with the duplicate flag set on the records found.
 */
@CommandLineProgramProperties(
        summary = Dedup.USAGE_SUMMARY + Dedup.USAGE_DETAILS,
        oneLineSummary = Dedup.USAGE_SUMMARY,
        programGroup = ReadDataManipulationProgramGroup.class)
public class Dedup extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Marks duplicate reads in a coordinate-sorted file in a single streaming pass.  ";
    static final String USAGE_DETAILS = "<p>Reads are considered duplicates of each other when the unclipped 5' ends of " +
            "their alignments fall on the same position and strand and they come from the same library.  Read pairs are " +
            "duplicates when both ends match.  Of each set of duplicates the read (or pair) with the highest sum of base " +
            "qualities is kept; a read whose mate is mapped is always kept over single-end reads at the same position.  " +
            "Only bases with a quality of at least MIN_QUAL count toward the sum.</p>" +
            "<p>Unlike tools that sort read ends, this tool keeps only the reads of a sliding window in memory, so the " +
            "input must be sorted by coordinate.  Secondary and supplementary alignments compete like primary ones; " +
            "unmapped reads are never marked.</p>" +
            "<p>Optionally, the reads that are not duplicates are used to build a base quality recalibration model, " +
            "which is then applied to every read written out.</p>" +
            "<h4>Usage example:</h4>" +
            "<pre>" +
            "java -jar bamdedup.jar Dedup \\<br />" +
            "      I=input.bam \\<br />" +
            "      O=marked_duplicates.bam \\<br />" +
            "      M=marked_dup_metrics.txt" +
            "</pre>" +
            "<hr />";

    private static final Log log = Log.getInstance(Dedup.class);

    private static final long NO_SUCH_INDEX = Long.MAX_VALUE;

    public static final int DEFAULT_MIN_QUAL = 15;
    public static final int DEFAULT_MAX_RECORDS_IN_POOL = 5000000;

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME,
            doc = "The coordinate-sorted SAM or BAM file to mark duplicates in.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME,
            doc = "The output file to write marked records to.")
    public File OUTPUT;

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME,
            doc = "File to write duplication metrics to.", optional = true)
    public File METRICS_FILE;

    @Argument(doc = "File to write log output to. If not given, log output goes to standard error.", optional = true)
    public File LOG;

    @Argument(doc = "Only bases with at least this quality count toward the base quality sum of a read.")
    public int MIN_QUAL = DEFAULT_MIN_QUAL;

    @Argument(doc = "Treat reads whose mate maps to a different reference as single-ended.  Useful when processing " +
            "a single reference at a time.")
    public boolean ONE_CHROM = false;

    @Argument(doc = "If true do not write duplicates to the output file instead of writing them with appropriate flags set.")
    public boolean REMOVE_DUPLICATES = false;

    @Argument(doc = "Accept input that already has reads flagged as duplicates.  Flags on reads not found to be " +
            "duplicates are cleared.")
    public boolean FORCE = false;

    @Argument(doc = "Build a base quality recalibration model from the reads that are not duplicates and apply it to " +
            "every read written out.  The model is written next to OUTPUT with the extension " +
            EmpiricalQualityRecalibrator.MODEL_EXTENSION + ".")
    public boolean RECALIBRATE = false;

    @Argument(shortName = StandardOptionDefinitions.ASSUME_SORTED_SHORT_NAME,
            doc = "If true, assume that the input file is coordinate sorted even if the header says otherwise.")
    public boolean ASSUME_SORTED = false;

    @Argument(doc = "The largest number of records that may be held in memory at once.  The run fails if the open " +
            "window of reads grows beyond it.")
    public int MAX_RECORDS_IN_POOL = DEFAULT_MAX_RECORDS_IN_POOL;

    @Argument(shortName = StandardOptionDefinitions.PROGRAM_RECORD_ID_SHORT_NAME,
            doc = "The program record ID for the @PG record created by this program. Set to null to disable " +
                    "PG record creation.  This string may have a suffix appended to avoid collision with other " +
                    "program record IDs.",
            optional = true)
    public String PROGRAM_RECORD_ID = "Dedup";

    @ArgumentCollection
    public RecalibrationArgumentCollection RECALIBRATION_ARGUMENTS = new RecalibrationArgumentCollection();

    /** Stock main method. */
    public static void main(final String[] args) {
        new Dedup().instanceMainWithExit(args);
    }

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (MIN_QUAL < 0) {
            errors.add("MIN_QUAL must not be negative: " + MIN_QUAL);
        }
        if (MAX_RECORDS_IN_POOL < 1) {
            errors.add("MAX_RECORDS_IN_POOL must be at least 1: " + MAX_RECORDS_IN_POOL);
        }
        if (RECALIBRATE && RECALIBRATION_ARGUMENTS.MAX_RECALIBRATED_QUALITY < 1) {
            errors.add("MAX_RECALIBRATED_QUALITY must be at least 1: " + RECALIBRATION_ARGUMENTS.MAX_RECALIBRATED_QUALITY);
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected int doWork() {
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertFileIsWritable(OUTPUT);
        if (METRICS_FILE != null) IOUtil.assertFileIsWritable(METRICS_FILE);
        if (LOG != null) IOUtil.assertFileIsWritable(LOG);

        final PrintStream originalLogStream = Log.getGlobalPrintStream();
        PrintStream logStream = null;
        if (LOG != null) {
            logStream = new PrintStream(IOUtil.openFileForWriting(LOG), true);
            Log.setGlobalPrintStream(logStream);
        }
        try {
            markDuplicates();
        } finally {
            if (logStream != null) {
                Log.setGlobalPrintStream(originalLogStream);
                logStream.close();
            }
        }
        return 0;
    }

    private void markDuplicates() {
        reportMemoryStats("Start of doWork");

        final EmpiricalQualityRecalibrator recalibrator = RECALIBRATE ?
                new EmpiricalQualityRecalibrator(RECALIBRATION_ARGUMENTS, getMetricsFile()) : null;
        final int maxInMemory = (int) Math.min((Runtime.getRuntime().maxMemory() * 0.25) / SortingLongCollection.SIZEOF,
                (double) (Integer.MAX_VALUE - 5));
        log.info("Will retain up to " + maxInMemory + " duplicate indices before spilling to disk.");
        final SortingLongCollection duplicateIndexes = new SortingLongCollection(maxInMemory, TMP_DIR.toArray(new File[0]));

        try {
            final DuplicateDetector detector = findDuplicates(duplicateIndexes, recalibrator);
            reportMemoryStats("After finding duplicates");

            if (recalibrator != null) {
                recalibrator.emitModel(OUTPUT);
            }

            final DedupMetrics metrics = detector.getMetrics();
            writeOutput(duplicateIndexes, recalibrator, metrics);
            reportMemoryStats("After output close");

            if (METRICS_FILE != null) {
                final MetricsFile<DedupMetrics, Integer> file = getMetricsFile();
                metrics.calculateDerivedFields();
                file.addMetric(metrics);
                file.write(METRICS_FILE);
            }
        } finally {
            duplicateIndexes.cleanup();
        }
    }

    /** First pass: runs every record through the detector and sorts the duplicate indices it finds. */
    private DuplicateDetector findDuplicates(final SortingLongCollection duplicateIndexes,
                                             final EmpiricalQualityRecalibrator recalibrator) {
        final SamReader in = SamReaderFactory.makeDefault().open(INPUT);
        final DuplicateDetector detector;
        try {
            final SAMFileHeader header = in.getFileHeader();
            if (!ASSUME_SORTED && header.getSortOrder() != SAMFileHeader.SortOrder.coordinate) {
                throw new BamDedupException("This program requires coordinate-sorted input, but the header of " + INPUT +
                        " declares sort order " + header.getSortOrder() + ".  Use ASSUME_SORTED=true if the records " +
                        "are in fact coordinate sorted.");
            }

            detector = new DuplicateDetector(new LibraryIdResolver(header), new RecordPool(MAX_RECORDS_IN_POOL),
                    duplicateIndexes, recalibrator, MIN_QUAL, ONE_CHROM, FORCE);

            log.info("Reading input file and finding duplicates.");
            final ProgressLogger progress = new ProgressLogger(log, (int) 1e6, "Read");
            long recordIndex = 0;
            for (final SAMRecord rec : in) {
                detector.processRecord(rec, ++recordIndex);
                if (progress.record(rec)) {
                    log.info("Tracking " + detector.getFragmentMapSize() + " fragments, " +
                            detector.getPairedMapSize() + " pairs and " +
                            detector.getMateWaitMapSize() + " reads waiting for their mate.");
                }
            }
        } finally {
            CloserUtil.close(in);
        }

        detector.finish();
        logSummary(detector);
        return detector;
    }

    private void logSummary(final DuplicateDetector detector) {
        final DedupMetrics metrics = detector.getMetrics();
        log.info("--------------------------------------------------------------------------");
        log.info("SUMMARY STATISTICS OF THE READS");
        log.info("Total number of reads: " + metrics.TOTAL_READS);
        log.info("Total number of paired-end reads: " + metrics.PAIRED_READS);
        log.info("Total number of properly paired reads: " + metrics.PROPERLY_PAIRED_READS);
        log.info("Total number of unmapped reads: " + metrics.UNMAPPED_READS);
        log.info("Total number of reverse strand mapped reads: " + metrics.REVERSE_STRAND_READS);
        log.info("Total number of QC-failed reads: " + metrics.QC_FAILED_READS);
        log.info("Total number of secondary or supplementary reads: " + metrics.SECONDARY_OR_SUPPLEMENTARY_RDS);
        log.info("Size of fragment map (must be zero): " + detector.getFragmentMapSize());
        log.info("Size of paired map (must be zero): " + detector.getPairedMapSize());
        log.info("Total number of missing mates: " + metrics.MISSING_MATES);
        log.info("Peak number of records held in memory: " + metrics.PEAK_TRACKED_RECORDS);
        log.info("--------------------------------------------------------------------------");
        log.info("Sorted the indices of " + detector.getNumDuplicateIndexes() + " duplicate records");
    }

    /** Second pass: copies the input to OUTPUT, flagging (or dropping) the records at the sorted duplicate indices. */
    private void writeOutput(final SortingLongCollection duplicateIndexes,
                             final EmpiricalQualityRecalibrator recalibrator,
                             final DedupMetrics metrics) {
        final SamReader in = SamReaderFactory.makeDefault().open(INPUT);
        long singleDuplicates = 0;
        long pairedDuplicates = 0;
        try {
            final SAMFileHeader outputHeader = in.getFileHeader().clone();
            addProgramRecord(outputHeader);

            log.info("Writing " + OUTPUT);
            try (SAMFileWriter out = new SAMFileWriterFactory().makeSAMOrBAMWriter(outputHeader, true, OUTPUT)) {
                final ProgressLogger progress = new ProgressLogger(log, (int) 1e7, "Written");
                long nextDuplicateIndex = duplicateIndexes.hasNext() ? duplicateIndexes.next() : NO_SUCH_INDEX;
                long recordIndex = 0;

                for (final SAMRecord rec : in) {
                    final boolean isDuplicate = ++recordIndex == nextDuplicateIndex;
                    if (isDuplicate) {
                        rec.setDuplicateReadFlag(true);
                        if (!rec.getReadPairedFlag() || rec.getMateUnmappedFlag()) {
                            ++singleDuplicates;
                        } else {
                            ++pairedDuplicates;
                        }
                        nextDuplicateIndex = duplicateIndexes.hasNext() ? duplicateIndexes.next() : NO_SUCH_INDEX;
                        if (REMOVE_DUPLICATES) continue;
                    } else if (FORCE) {
                        rec.setDuplicateReadFlag(false);
                    }

                    if (recalibrator != null) {
                        recalibrator.applyTable(rec);
                    }
                    out.addAlignment(rec);
                    progress.record(rec);
                }

                if (nextDuplicateIndex != NO_SUCH_INDEX) {
                    throw new BamDedupException("Duplicate index " + nextDuplicateIndex + " is past the last of the " +
                            recordIndex + " records of " + INPUT + ".  Was the input modified while running?");
                }
            }
        } finally {
            CloserUtil.close(in);
        }

        metrics.UNPAIRED_READ_DUPLICATES = singleDuplicates;
        metrics.READ_PAIR_DUPLICATES = pairedDuplicates / 2;
        log.info("Successfully " + (REMOVE_DUPLICATES ? "removed " : "marked ") + singleDuplicates + " unpaired and " +
                (pairedDuplicates / 2) + " paired duplicate reads");
    }

    private void addProgramRecord(final SAMFileHeader outputHeader) {
        if (PROGRAM_RECORD_ID == null) return;

        final SAMFileHeader.PgIdGenerator pgIdGenerator = new SAMFileHeader.PgIdGenerator(outputHeader);
        final SAMProgramRecord programRecord = new SAMProgramRecord(pgIdGenerator.getNonCollidingId(PROGRAM_RECORD_ID));
        programRecord.setProgramName(getClass().getSimpleName());
        programRecord.setProgramVersion(getVersion());
        programRecord.setCommandLine(getCommandLine());
        final List<SAMProgramRecord> existing = outputHeader.getProgramRecords();
        if (!existing.isEmpty()) {
            programRecord.setPreviousProgramGroupId(existing.get(existing.size() - 1).getId());
        }
        outputHeader.addProgramRecord(programRecord);
    }

    /** Print out some quick JVM memory stats. */
    private static void reportMemoryStats(final String stage) {
        System.gc();
        final Runtime runtime = Runtime.getRuntime();
        log.info(stage + " freeMemory: " + runtime.freeMemory() + "; totalMemory: " + runtime.totalMemory() +
                "; maxMemory: " + runtime.maxMemory());
    }
}
