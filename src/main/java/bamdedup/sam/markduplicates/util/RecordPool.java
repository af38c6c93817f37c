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
import htsjdk.samtools.SAMRecord;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded pool of {@link RecordHandle}s.  Every record the duplicate detector looks at is held through a handle from
 * this pool until the detector has no further use for it, so the number of live handles is the number of records
 * currently held open by the tracking window.  Released handles are recycled.
 *
 * Running out of handles is fatal: it means the open window grew past the configured capacity.
 */
public class RecordPool {
    private final int maxRecords;
    private final Deque<RecordHandle> free = new ArrayDeque<>();
    private int numAllocated = 0;
    private int numLive = 0;
    private int peakLive = 0;

    public RecordPool(final int maxRecords) {
        if (maxRecords < 1) {
            throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        }
        this.maxRecords = maxRecords;
    }

    /**
     * Takes ownership of the given record through a handle.
     *
     * @throws BamDedupException if {@code maxRecords} handles are already live
     */
    public RecordHandle acquire(final SAMRecord record) {
        RecordHandle handle = free.poll();
        if (handle == null) {
            if (numAllocated >= maxRecords) {
                throw new BamDedupException("Failed to allocate enough records: " + numLive + " records are being tracked " +
                        "and the pool holds at most " + maxRecords + ". Increase MAX_RECORDS_IN_POOL.");
            }
            handle = new RecordHandle();
            numAllocated++;
        }
        handle.attach(record);
        numLive++;
        peakLive = Math.max(peakLive, numLive);
        return handle;
    }

    /** Returns a handle to the pool.  The handle must not be used afterwards. */
    public void release(final RecordHandle handle) {
        handle.detach();
        numLive--;
        free.push(handle);
    }

    public int getMaxRecords() { return maxRecords; }

    /** The number of handles currently owned outside the pool. */
    public int getNumLive() { return numLive; }

    /** The largest number of handles that were live at the same time. */
    public int getPeakLive() { return peakLive; }
}
