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
package bamdedup.cmdline;

import bamdedup.sam.markduplicates.Dedup;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BamDedupCommandLineTest {

    @Test
    public void testEveryProgramIsAnnotated() {
        final List<Class<CommandLineProgram>> programs = new ArrayList<>();
        BamDedupCommandLine.processAllCommandLinePrograms(Collections.singletonList("bamdedup"), (clazz, properties) -> {
            Assert.assertNotNull(properties, clazz.getSimpleName() + " is missing @CommandLineProgramProperties");
            programs.add(clazz);
        });
        Assert.assertTrue(programs.contains(Dedup.class));
    }

    @Test
    public void testUnknownProgram() {
        Assert.assertEquals(new BamDedupCommandLine().instanceMain(new String[]{"Dedupe"}), 1);
    }

    @Test
    public void testNoProgram() {
        Assert.assertEquals(new BamDedupCommandLine().instanceMain(new String[0]), 1);
    }

    @Test
    public void testSortingOptionsAreNotAccepted() {
        // Output is written in input order, so there is no sort buffer to size.
        Assert.assertEquals(new BamDedupCommandLine().instanceMain(
                new String[]{"Dedup", "I=in.bam", "O=out.bam", "MAX_RECORDS_IN_RAM=1000"}), 1);
    }
}
