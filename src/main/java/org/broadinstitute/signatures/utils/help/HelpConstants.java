package org.broadinstitute.signatures.utils.help;

/**
 * Names and summaries of the program groups, as displayed in the tool listing.
 */
public final class HelpConstants {

    private HelpConstants() {}

    public final static String DOC_CAT_MUTATIONAL_SIGNATURES = "Mutational Signatures";
    public final static String DOC_CAT_MUTATIONAL_SIGNATURES_SUMMARY = "Tools that summarize somatic variants into mutational signature inputs";
}
