package bamdedup.cmdline.programgroups;

import bamdedup.util.help.HelpConstants;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that manipulate read data in SAM or BAM format
 */
public class ReadDataManipulationProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_READ_DATA_MANIPULATION; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_READ_DATA_MANIPULATION_SUMMARY; }
}
