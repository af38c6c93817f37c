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

/**
 * What the duplicate detector remembers about a single read: its quality score, its 1-based index in the input and,
 * when this entry owns it, the read's record.  An entry for a paired read in the fragment map owns nothing, since
 * the mate-wait map or the paired map holds that record.
 */
public final class ReadData {
    private final int sumBaseQuality;
    private final long recordIndex;
    private final boolean paired;
    private final RecordHandle handle;

    public ReadData(final int sumBaseQuality, final long recordIndex, final boolean paired, final RecordHandle handle) {
        this.sumBaseQuality = sumBaseQuality;
        this.recordIndex = recordIndex;
        this.paired = paired;
        this.handle = handle;
    }

    public int getSumBaseQuality() { return sumBaseQuality; }

    public long getRecordIndex() { return recordIndex; }

    public boolean isPaired() { return paired; }

    /** The owned record, or null. */
    public RecordHandle getHandle() { return handle; }
}
