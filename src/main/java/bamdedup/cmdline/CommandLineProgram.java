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

import com.intel.gkl.compression.IntelDeflaterFactory;
import com.intel.gkl.compression.IntelInflaterFactory;
import htsjdk.samtools.Defaults;
import htsjdk.samtools.SAMFileWriterFactory;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.metrics.Header;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import htsjdk.samtools.util.BlockCompressedOutputStream;
import htsjdk.samtools.util.BlockGunzipper;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineParserOptions;
import org.broadinstitute.barclay.argparser.LegacyCommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;

import java.io.File;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashSet;
import java.util.List;

/**
 * Base class of the programs run through {@link BamDedupCommandLine}.
 *
 * A subclass is annotated with @CommandLineProgramProperties, declares its options as @Argument fields and
 * implements {@link #doWork()}.  This class parses the command line into those fields, runs
 * {@link #customCommandLineValidation()}, applies the options shared by all programs (temporary directories,
 * logging, SAM/BAM I/O settings) and then calls doWork(), whose return value is the exit status.
 */
public abstract class CommandLineProgram {
    private static final String PROPERTY_USE_LEGACY_PARSER = "bamdedup.useLegacyParser";
    private static Boolean useLegacyParser;

    @Argument(doc = "One or more directories with space available to be used by this program for temporary storage " +
            "of working files, such as spilled duplicate indices.", common = true, optional = true)
    public List<File> TMP_DIR = new ArrayList<>();

    @Argument(doc = "Control verbosity of logging.", common = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(doc = "Whether to suppress the start and finish messages on System.err.", common = true)
    public Boolean QUIET = false;

    @Argument(doc = "Validation stringency for all SAM/BAM files read by this program.", common = true)
    public ValidationStringency VALIDATION_STRINGENCY = ValidationStringency.DEFAULT_STRINGENCY;

    @Argument(doc = "Compression level for BAM output.", common = true)
    public int COMPRESSION_LEVEL = Defaults.COMPRESSION_LEVEL;

    @Argument(doc = "Whether to create a BAM index when writing a coordinate-sorted BAM file.", common = true)
    public Boolean CREATE_INDEX = Defaults.CREATE_INDEX;

    @Argument(doc = "Whether to create an MD5 digest for any BAM files created.", common = true)
    public boolean CREATE_MD5_FILE = Defaults.CREATE_MD5;

    @Argument(shortName = "use_jdk_deflater", doc = "Use the JDK Deflater instead of the Intel Deflater for writing compressed output", common = true)
    public Boolean USE_JDK_DEFLATER = false;

    @Argument(shortName = "use_jdk_inflater", doc = "Use the JDK Inflater instead of the Intel Inflater for reading compressed input", common = true)
    public Boolean USE_JDK_INFLATER = false;

    // Only the posix-style parser needs these (--help, --version, --arguments_file).
    @ArgumentCollection(doc = "Special arguments that have meaning to the argument parsing system.")
    public Object specialArgumentsCollection = useLegacyParser() ? new Object() : new SpecialArgumentsCollection();

    private CommandLineParser commandLineParser;

    /** Written at the top of every metrics file. */
    private final List<Header> metricsHeaders = new ArrayList<>();

    private String commandLine;

    /**
     * Does the work after the command line has been parsed and validated.  Failures are reported by throwing.
     *
     * @return the exit status
     */
    protected abstract int doWork();

    public void instanceMainWithExit(final String[] argv) {
        System.exit(instanceMain(argv));
    }

    /** Parses {@code argv}, applies the common options and runs the program.  Returns 1 if the arguments are invalid. */
    public int instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 1;
        }

        final Date startDate = new Date();
        metricsHeaders.add(new StringHeader(commandLine));
        metricsHeaders.add(new StringHeader("Started on: " + startDate));

        applyCommonOptions();
        if (!QUIET) {
            System.err.println("[" + startDate + "] " + commandLine);
            System.err.println(describeEnvironment());
        }

        try {
            return doWork();
        } finally {
            if (!QUIET) {
                final double elapsedMinutes = (System.currentTimeMillis() - startDate.getTime()) / (1000d * 60d);
                System.err.println("[" + new Date() + "] " + getClass().getName() + " done. Elapsed time: " +
                        new DecimalFormat("#,##0.00").format(elapsedMinutes) + " minutes.");
            }
        }
    }

    private void applyCommonOptions() {
        if (TMP_DIR == null) TMP_DIR = new ArrayList<>();
        if (TMP_DIR.isEmpty()) TMP_DIR.add(IOUtil.getDefaultTmpDir());
        for (final File dir : TMP_DIR) {
            // A directory that cannot be created shows up as an I/O error once the program spills to it.
            if (!dir.exists() && !dir.mkdirs()) {
                Log.getInstance(getClass()).warn("Could not create temporary directory " + dir);
            }
        }

        Log.setGlobalLogLevel(VERBOSITY);
        SamReaderFactory.setDefaultValidationStringency(VALIDATION_STRINGENCY);
        BlockCompressedOutputStream.setDefaultCompressionLevel(COMPRESSION_LEVEL);
        SAMFileWriterFactory.setDefaultCreateIndexWhileWriting(CREATE_INDEX);
        SAMFileWriterFactory.setDefaultCreateMd5File(CREATE_MD5_FILE);

        if (!USE_JDK_DEFLATER) {
            BlockCompressedOutputStream.setDefaultDeflaterFactory(new IntelDeflaterFactory());
        }
        if (!USE_JDK_INFLATER) {
            BlockGunzipper.setDefaultInflaterFactory(new IntelInflaterFactory());
        }
    }

    /** One line about who and where is running which version, and whether the Intel codecs are in use. */
    private String describeEnvironment() {
        final boolean intelDeflater = BlockCompressedOutputStream.getDefaultDeflaterFactory() instanceof IntelDeflaterFactory &&
                ((IntelDeflaterFactory) BlockCompressedOutputStream.getDefaultDeflaterFactory()).usingIntelDeflater();
        final boolean intelInflater = BlockGunzipper.getDefaultInflaterFactory() instanceof IntelInflaterFactory &&
                ((IntelInflaterFactory) BlockGunzipper.getDefaultInflaterFactory()).usingIntelInflater();
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (final UnknownHostException e) {
            host = "unknown host";
        }
        return String.format("[%s] Executing as %s@%s on %s %s; %s %s; Deflater: %s; Inflater: %s; BamDedup version: %s",
                new Date(), System.getProperty("user.name"), host,
                System.getProperty("os.name"), System.getProperty("os.arch"),
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version"),
                intelDeflater ? "Intel" : "Jdk", intelInflater ? "Intel" : "Jdk", getVersion());
    }

    /**
     * Override to validate combinations or ranges of options after parsing.
     *
     * @return null if the command line is valid, otherwise the messages to print
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /** @return true if the command line was parsed and is valid */
    protected boolean parseArgs(final String[] argv) {
        final CommandLineParser parser = getCommandLineParser();
        boolean valid;
        try {
            valid = parser.parseArguments(System.err, argv);
        } catch (final CommandLineException e) {
            System.err.println(parser.usage(false, false));
            System.err.println(e.getMessage());
            valid = false;
        }
        commandLine = parser.getCommandLine();
        if (!valid) {
            return false;
        }

        final String[] errors = customCommandLineValidation();
        if (errors != null) {
            System.err.print(parser.usage(false, false));
            for (final String msg : errors) {
                System.err.println(msg);
            }
            return false;
        }
        return true;
    }

    /** Gets a MetricsFile with the command line and start time already written into its headers. */
    protected <A extends MetricBase, B extends Comparable<?>> MetricsFile<A, B> getMetricsFile() {
        final MetricsFile<A, B> file = new MetricsFile<>();
        for (final Header header : metricsHeaders) {
            file.addHeader(header);
        }
        return file;
    }

    public CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = useLegacyParser() ?
                    new LegacyCommandLineArgumentParser(this) :
                    new CommandLineArgumentParser(this,
                            Collections.emptyList(),
                            new HashSet<>(Collections.singleton(CommandLineParserOptions.APPEND_TO_COLLECTIONS)));
        }
        return commandLineParser;
    }

    /**
     * True if the legacy NAME=value syntax is used rather than the posix-style one.  Controlled by the system
     * property "bamdedup.useLegacyParser", true when unset.
     */
    public static boolean useLegacyParser() {
        if (useLegacyParser == null) {
            final String value = System.getProperty(PROPERTY_USE_LEGACY_PARSER);
            useLegacyParser = value == null || Boolean.parseBoolean(value);
        }
        return useLegacyParser;
    }

    /** The implementation version from the jar manifest. */
    public String getVersion() {
        return getCommandLineParser().getVersion();
    }

    /** The command line as reconstructed by the parser, recorded in @PG records and metrics headers. */
    public String getCommandLine() {
        return commandLine;
    }
}
