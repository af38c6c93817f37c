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

import bamdedup.BamDedupException;
import bamdedup.sam.markduplicates.DedupMetrics;
import bamdedup.sam.recalibration.ReadRecalibrator;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.SortingLongCollection;

/**
 * Finds duplicates in a single coordinate-sorted pass over the input.
 *
 * Every mapped primary record is keyed by the unclipped position of its 5' end, its strand and its library.  Of all
 * single-end reads sharing a key only the one with the highest base quality sum survives; a paired read at the same
 * key always wins over single-end reads.  Pairs are keyed by the keys of both ends and compete on the summed quality
 * of both mates.  Once the input has moved far enough past a key that no later record can produce it, the key's
 * survivors are final and their records are released.
 *
 * Indices of duplicate records are collected in the {@link SortingLongCollection} given at construction; it is sorted
 * by {@link #finish()}.
 */
public class DuplicateDetector {
    private static final Log log = Log.getInstance(DuplicateDetector.class);

    /** Reference index before the first record. */
    private static final int NO_REFERENCE_SEEN = Integer.MIN_VALUE;

    private final LibraryIdResolver libraryIdResolver;
    private final RecordPool recordPool;
    private final SortingLongCollection duplicateIndexes;
    private final ReadRecalibrator recalibrator;
    private final int minBaseQuality;
    private final boolean oneChromosome;
    private final boolean force;

    private final TrackingMap<ReadKey, ReadData> fragmentMap = new TrackingMap<>();
    private final TrackingMap<PairKey, PairData> pairedMap = new TrackingMap<>();
    private final MateWaitMap mateWaitMap = new MateWaitMap();

    private final DedupMetrics metrics = new DedupMetrics();

    private int lastReference = NO_REFERENCE_SEEN;
    private int lastCoordinate = -1;
    private long numDuplicateIndexes = 0;
    private boolean warnedMissingMateOtherReference = false;
    private boolean warnedMissingMateSameReference = false;
    private boolean finished = false;

    /**
     * @param recalibrator if not null, every record found not to be a duplicate is added to its table
     * @param minBaseQuality only bases of at least this quality count toward a read's quality sum
     * @param oneChromosome treat reads whose mate maps to another reference as single-ended
     * @param force accept records that are already flagged as duplicates
     */
    public DuplicateDetector(final LibraryIdResolver libraryIdResolver,
                             final RecordPool recordPool,
                             final SortingLongCollection duplicateIndexes,
                             final ReadRecalibrator recalibrator,
                             final int minBaseQuality,
                             final boolean oneChromosome,
                             final boolean force) {
        this.libraryIdResolver = libraryIdResolver;
        this.recordPool = recordPool;
        this.duplicateIndexes = duplicateIndexes;
        this.recalibrator = recalibrator;
        this.minBaseQuality = minBaseQuality;
        this.oneChromosome = oneChromosome;
        this.force = force;
    }

    /**
     * Examines the next record of the input.
     *
     * @param recordIndex the 1-based index of the record in the input; indices must increase from call to call
     * @throws BamDedupException if the record is out of coordinate order, or already flagged as a duplicate and
     * {@code force} is not set
     */
    public void processRecord(final SAMRecord record, final long recordIndex) {
        if (finished) {
            throw new IllegalStateException("processRecord called after finish");
        }
        countFlags(record);
        if (record.getDuplicateReadFlag() && !force) {
            throw new BamDedupException("Record " + recordIndex + " (" + record.getReadName() + ") is already marked " +
                    "as a duplicate. Use FORCE=true to clear the duplicate flags and mark duplicates again.");
        }

        final RecordHandle handle = recordPool.acquire(record);

        if (hasPositionChanged(record) && record.getReferenceIndex() != SAMRecord.NO_ALIGNMENT_REFERENCE_INDEX) {
            cleanupPriorReads(record);
        }

        if (record.getReadUnmappedFlag()) {
            metrics.UNMAPPED_READS++;
            recordPool.release(handle);
        } else {
            checkDuplicates(handle, recordIndex);
        }
    }

    private void countFlags(final SAMRecord record) {
        metrics.TOTAL_READS++;
        if (record.getReadPairedFlag()) {
            metrics.PAIRED_READS++;
            if (record.getProperPairFlag()) metrics.PROPERLY_PAIRED_READS++;
        }
        if (record.getReadNegativeStrandFlag()) metrics.REVERSE_STRAND_READS++;
        if (record.getReadFailsVendorQualityCheckFlag()) metrics.QC_FAILED_READS++;
        if (record.isSecondaryOrSupplementary()) metrics.SECONDARY_OR_SUPPLEMENTARY_RDS++;
    }

    /**
     * Returns true if the record is on a new reference or at a greater coordinate than the previous record, and
     * records its position as the latest one seen.
     *
     * @throws BamDedupException if the record sorts before the previous one
     */
    boolean hasPositionChanged(final SAMRecord record) {
        final int reference = record.getReferenceIndex();
        final int coordinate = record.getAlignmentStart() - 1;

        if (reference == lastReference) {
            if (coordinate < lastCoordinate) {
                throw outOfOrder(record);
            }
            if (coordinate == lastCoordinate) return false;
            lastCoordinate = coordinate;
            return true;
        }

        // Unplaced records (no reference) sort after every placed record.
        if (lastReference != NO_REFERENCE_SEEN &&
                (lastReference == SAMRecord.NO_ALIGNMENT_REFERENCE_INDEX ||
                        (reference != SAMRecord.NO_ALIGNMENT_REFERENCE_INDEX && reference < lastReference))) {
            throw outOfOrder(record);
        }
        lastReference = reference;
        lastCoordinate = coordinate;
        log.info("Reading reference index " + reference);
        return true;
    }

    private BamDedupException outOfOrder(final SAMRecord record) {
        return new BamDedupException("Input is not coordinate sorted: record " + record.getReadName() + " at " +
                record.getReferenceName() + ":" + record.getAlignmentStart() + " follows a record at reference index " +
                lastReference + ", 0-based position " + lastCoordinate);
    }

    /** Decides the fate of a mapped primary record, or parks it until that can be decided. */
    private void checkDuplicates(final RecordHandle handle, final long recordIndex) {
        final SAMRecord record = handle.getRecord();
        final ReadKey key = ReadKey.of(record, libraryIdResolver.getLibraryId(record));
        final int referenceIndex = record.getReferenceIndex();
        final int mateReferenceIndex = record.getMateReferenceIndex();
        final int sumBaseQuality = getBaseQuality(record);

        boolean paired = record.getReadPairedFlag() && !record.getMateUnmappedFlag();
        if (oneChromosome && referenceIndex != mateReferenceIndex) {
            paired = false;
        }

        // A paired read at a key always beats single-end reads there; among single-end reads the best quality wins.
        final TrackingMap<ReadKey, ReadData>.Slot fragment = fragmentMap.upsert(key);
        final ReadData stored = fragment.get();
        if (fragment.isNew() || (!stored.isPaired() && (paired || sumBaseQuality > stored.getSumBaseQuality()))) {
            if (!fragment.isNew()) {
                addDuplicate(stored.getRecordIndex());
                recordPool.release(stored.getHandle());
            }
            fragment.set(new ReadData(sumBaseQuality, recordIndex, paired, paired ? null : handle));
        } else if (!paired) {
            addDuplicate(recordIndex);
            recordPool.release(handle);
        }

        if (!paired) return;

        final long readPosition = MateWaitMap.linearize(referenceIndex, record.getAlignmentStart() - 1);
        final long matePosition = MateWaitMap.linearize(mateReferenceIndex, record.getMateAlignmentStart() - 1);

        ReadData mate = null;
        if (matePosition <= readPosition) {
            mate = mateWaitMap.removeMate(readPosition, record.getReadName());
        }
        if (mate == null) {
            if (matePosition >= readPosition) {
                mateWaitMap.put(matePosition, new ReadData(sumBaseQuality, recordIndex, true, handle));
            } else {
                handleMissingMate(handle);
            }
            return;
        }

        final SAMRecord mateRecord = mate.getHandle().getRecord();
        final ReadKey mateKey = ReadKey.of(mateRecord, libraryIdResolver.getLibraryId(mateRecord));
        final PairData pair = new PairData(sumBaseQuality + mate.getSumBaseQuality(),
                recordIndex, handle, mate.getRecordIndex(), mate.getHandle());

        final TrackingMap<PairKey, PairData>.Slot pairSlot = pairedMap.upsert(PairKey.of(key, mateKey));
        if (pairSlot.isNew()) {
            pairSlot.set(pair);
        } else if (pair.isBetterThan(pairSlot.get())) {
            markPairDuplicate(pairSlot.get());
            pairSlot.set(pair);
        } else {
            markPairDuplicate(pair);
        }
    }

    private void markPairDuplicate(final PairData pair) {
        addDuplicate(pair.getRecord1Index());
        addDuplicate(pair.getRecord2Index());
        recordPool.release(pair.getRecord1());
        recordPool.release(pair.getRecord2());
    }

    private void addDuplicate(final long recordIndex) {
        duplicateIndexes.add(recordIndex);
        numDuplicateIndexes++;
    }

    /**
     * Finalizes every tracked key that no record at or after {@code boundary} can produce.  With a null boundary
     * everything still tracked is finalized and reads still waiting for a mate are counted as missing mates.
     */
    public void cleanupPriorReads(final SAMRecord boundary) {
        if (boundary == null) {
            fragmentMap.evictAll(this::finalizeFragment);
            pairedMap.evictAll(this::finalizePair);
            mateWaitMap.evictAll(waiting -> handleMissingMate(waiting.getHandle()));
            return;
        }

        final int reference = boundary.getReferenceIndex();
        final int coordinate = boundary.getAlignmentStart() - 1;
        final ReadKey cutoff = ReadKey.cleanupKey(reference, coordinate);

        fragmentMap.evictBefore(cutoff, this::finalizeFragment);
        pairedMap.evictBefore(PairKey.cleanupKey(cutoff), this::finalizePair);
        mateWaitMap.evictBefore(MateWaitMap.linearize(reference, coordinate),
                waiting -> handleMissingMate(waiting.getHandle()));
    }

    private void finalizeFragment(final ReadData readData) {
        // Paired entries own no record; their reads are finalized through the pair.
        if (!readData.isPaired()) {
            handleNonDuplicate(readData.getHandle());
        }
    }

    private void finalizePair(final PairData pair) {
        handleNonDuplicate(pair.getRecord1());
        handleNonDuplicate(pair.getRecord2());
    }

    private void handleNonDuplicate(final RecordHandle handle) {
        if (recalibrator != null) {
            final SAMRecord record = handle.getRecord();
            if (force && record.getDuplicateReadFlag()) {
                record.setDuplicateReadFlag(false);
            }
            recalibrator.buildTable(record);
        }
        recordPool.release(handle);
    }

    private void handleMissingMate(final RecordHandle handle) {
        final SAMRecord record = handle.getRecord();
        if (!record.getMateReferenceIndex().equals(record.getReferenceIndex())) {
            if (!warnedMissingMateOtherReference) {
                log.warn("Mate on a different reference was not found (first seen for read " + record.getReadName() +
                        "). If you are running a single reference, consider ONE_CHROM=true to treat reads with mates " +
                        "on other references as single-ended.");
                warnedMissingMateOtherReference = true;
            }
        } else if (!warnedMissingMateSameReference) {
            log.warn("Records with missing mates can't be checked for duplicates (first seen for read " +
                    record.getReadName() + ").");
            warnedMissingMateSameReference = true;
        }
        metrics.MISSING_MATES++;
        handleNonDuplicate(handle);
    }

    /**
     * Finalizes everything still tracked and sorts the duplicate indices for iteration.  No record may be processed
     * afterwards.
     */
    public void finish() {
        cleanupPriorReads(null);
        if (!fragmentMap.isEmpty() || !pairedMap.isEmpty()) {
            log.error("Tracking maps are not empty after the final cleanup: " + fragmentMap.size() +
                    " fragments and " + pairedMap.size() + " pairs remain.");
        }
        metrics.PEAK_TRACKED_RECORDS = recordPool.getPeakLive();
        duplicateIndexes.doneAddingStartIteration();
        finished = true;
    }

    /** Sums the base qualities of the read that are at least the minimum base quality.  Reads without qualities sum to 0. */
    public int getBaseQuality(final SAMRecord record) {
        int quality = 0;
        for (final byte q : record.getBaseQualities()) {
            if (q >= minBaseQuality) quality += q;
        }
        return quality;
    }

    public int getFragmentMapSize() { return fragmentMap.size(); }

    public int getPairedMapSize() { return pairedMap.size(); }

    public int getMateWaitMapSize() { return mateWaitMap.size(); }

    /** The number of record indices added to the duplicate collection so far. */
    public long getNumDuplicateIndexes() { return numDuplicateIndexes; }

    public long getNumMissingMates() { return metrics.MISSING_MATES; }

    /** Statistics counted so far; duplicate counts are left for the caller to fill in. */
    public DedupMetrics getMetrics() { return metrics; }
}
