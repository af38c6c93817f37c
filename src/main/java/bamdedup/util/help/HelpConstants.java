package bamdedup.util.help;

public final class HelpConstants {

    private HelpConstants() {}

    /**
     * Definition of the group names / descriptions for documentation/help purposes.
     */
    public final static String DOC_CAT_READ_DATA_MANIPULATION = "Read Data Manipulation";
    public final static String DOC_CAT_READ_DATA_MANIPULATION_SUMMARY = "Tools that manipulate read data in SAM or BAM format";
}
