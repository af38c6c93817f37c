package bamdedup.cmdline;

import bamdedup.BamDedupException;
import org.apache.commons.io.FileUtils;
import org.testng.annotations.AfterClass;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Utility base class for tests that run a command line program through {@link BamDedupCommandLine}.
 */
public abstract class CommandLineProgramTest {

    // A per-test-class directory that will be deleted after the tests are complete.
    private File tempOutputDir;

    /**
     * returns an directory designated for output which will be deleted after the test class is tested
     */
    public File getTempOutputDir() {
        if (tempOutputDir == null) {
            try {
                tempOutputDir = Files.createTempDirectory(this.getClass().getName()).toFile();
            } catch (IOException e) {
                throw new BamDedupException("Couldn't create temp directory", e);
            }
        }
        return tempOutputDir;
    }

    /**
     * returns an file designated for output which will be deleted (together with the entire subdirectory)
     * after the test class is tested
     * @throws IOException when there's a problem creating the file
     */
    public File getTempOutputFile(final String prefix, final String extension) throws IOException {
        return File.createTempFile(prefix, extension, getTempOutputDir());
    }

    @AfterClass
    final void cleanup_temp_dir() throws IOException {
        if (tempOutputDir != null) {
            FileUtils.deleteDirectory(tempOutputDir);
        }
    }

    public abstract String getCommandLineProgramName();

    /**
     * Given the name of a CommandLineProgram and its arguments, builds the arguments appropriate for calling the
     * program through BamDedupCommandLine.
     */
    public String[] makeCommandLineArgs(final String programName, final List<String> args) {
        final String[] commandLineArgs = new String[args.size() + 1];
        commandLineArgs[0] = programName;
        int i = 1;
        for (final String arg : args) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    public String[] makeCommandLineArgs(final List<String> args) {
        return makeCommandLineArgs(getCommandLineProgramName(), args);
    }

    public String[] makeCommandLineArgs(final Map<String, String> kwargs) {
        final List<String> args = new ArrayList<>();
        for (final String key : kwargs.keySet()) {
            args.add(key + "=" + kwargs.get(key));
        }
        return makeCommandLineArgs(args);
    }

    public int runBamDedupCommandLine(final List<String> args) {
        return new BamDedupCommandLine().instanceMain(makeCommandLineArgs(args));
    }

    public int runBamDedupCommandLine(final String[] args) {
        return new BamDedupCommandLine().instanceMain(makeCommandLineArgs(Arrays.asList(args)));
    }

    public int runBamDedupCommandLine(final Map<String, String> kwargs) {
        return new BamDedupCommandLine().instanceMain(makeCommandLineArgs(kwargs));
    }
}
