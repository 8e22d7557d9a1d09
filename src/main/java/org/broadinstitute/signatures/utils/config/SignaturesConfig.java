package org.broadinstitute.signatures.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration file for the mutational signature tools.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + SignaturesConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:SignaturesConfig.properties",
 *        3)   "classpath:org/broadinstitute/signatures/utils/config/SignaturesConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + SignaturesConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "file:SignaturesConfig.properties",
        "classpath:org/broadinstitute/signatures/utils/config/SignaturesConfig.properties"
})
public interface SignaturesConfig extends Mutable, Accessible {

    /**
     * Name of the variable, looked up in the system properties, holding the path of a configuration file
     * that takes precedence over all other sources.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "SignaturesConfig.pathToConfig";

    @Key("stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // Trinucleotide context options:
    // ----------------------------------------------------------

    /**
     * Number of bases on each side of a variant that make up its background composition window.
     */
    @Key("background_flank_size")
    @DefaultValue("20")
    int background_flank_size();

    /**
     * A sample is called APOBEC enriched when its enrichment ratio is strictly above this value.
     */
    @Key("apobec_enrichment_threshold")
    @DefaultValue("2.0")
    double apobec_enrichment_threshold();

    @Key("fisher_confidence_level")
    @DefaultValue("0.95")
    double fisher_confidence_level();
}
