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
import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

public class RecordPoolTest {

    private final SAMFileHeader header = new SAMFileHeader();

    private SAMRecord record(final String name) {
        final SAMRecord record = new SAMRecord(header);
        record.setReadName(name);
        return record;
    }

    @Test
    public void testAcquireAndRelease() {
        final RecordPool pool = new RecordPool(2);
        final SAMRecord first = record("first");
        final RecordHandle handle = pool.acquire(first);
        Assert.assertTrue(handle.isLive());
        Assert.assertSame(handle.getRecord(), first);
        Assert.assertEquals(pool.getNumLive(), 1);

        pool.release(handle);
        Assert.assertFalse(handle.isLive());
        Assert.assertEquals(pool.getNumLive(), 0);
        Assert.assertEquals(pool.getPeakLive(), 1);
    }

    @Test
    public void testReleasedHandlesAreRecycled() {
        final RecordPool pool = new RecordPool(1);
        pool.release(pool.acquire(record("first")));
        final RecordHandle handle = pool.acquire(record("second"));
        Assert.assertEquals(handle.getRecord().getReadName(), "second");
        Assert.assertEquals(pool.getPeakLive(), 1);
    }

    @Test(expectedExceptions = BamDedupException.class)
    public void testExhaustion() {
        final RecordPool pool = new RecordPool(2);
        pool.acquire(record("first"));
        pool.acquire(record("second"));
        pool.acquire(record("third"));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testDoubleRelease() {
        final RecordPool pool = new RecordPool(2);
        final RecordHandle handle = pool.acquire(record("first"));
        pool.release(handle);
        pool.release(handle);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testReadAfterRelease() {
        final RecordPool pool = new RecordPool(2);
        final RecordHandle handle = pool.acquire(record("first"));
        pool.release(handle);
        handle.getRecord();
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCapacityMustBePositive() {
        new RecordPool(0);
    }
}
