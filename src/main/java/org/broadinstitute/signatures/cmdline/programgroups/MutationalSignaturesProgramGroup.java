package org.broadinstitute.signatures.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.signatures.utils.help.HelpConstants;

/**
 * Tools that derive trinucleotide mutation matrices and APOBEC enrichment from somatic variants
 */
public final class MutationalSignaturesProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return HelpConstants.DOC_CAT_MUTATIONAL_SIGNATURES; }

    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_MUTATIONAL_SIGNATURES_SUMMARY; }
}
