package org.broadinstitute.signatures.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.LoggingUtils;
import org.broadinstitute.signatures.utils.Utils;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Path variables in the {@link Config.Sources} annotation that are not defined anywhere are
 * resolved to an empty location, so that loading falls through to the next source.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Sets every path variable that is neither a system nor an environment property to {@link #NO_PATH_VARIABLE_VALUE}.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property));
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property));
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property));
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * @return the names of the {@code ${...}} variables in the {@link Config.Sources} of the given class.
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    /**
     * Quick way to get the configuration of the signature tools.
     */
    public SignaturesConfig getSignaturesConfig() {
        return getOrCreate( SignaturesConfig.class );
    }

    /**
     * Creates a new, uncached configuration instance.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets the cached configuration instance for the class, creating it on first use.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Loads the given config class, reading the file named in {@code configFileName} first when it is not {@code null}.
     */
    @VisibleForTesting
    synchronized <T extends Config> T createConfigFromFile(final String configFileName, final Class<? extends T> configClass) {
        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( SignaturesConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }
        return create(configClass);
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Loads the configuration, using the file given after {@code configFileOption} in the arguments if there is one.
     * Must be called before any class reads configuration values in its initializers.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList, final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);
        final String configFileName = getConfigFilenameFromArgs(argList, configFileOption);
        if ( configFileName != null ) {
            org.aeonbits.owner.ConfigFactory.setProperty( SignaturesConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
            // a cached instance was loaded without this file
            ConfigCache.remove(SignaturesConfig.class);
        }
        logConfigFields(getSignaturesConfig());
    }

    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given level.
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        if ( config instanceof org.aeonbits.owner.Accessible ) {
            final org.aeonbits.owner.Accessible accessible = (org.aeonbits.owner.Accessible) config;
            for ( final String propertyName : new TreeSet<>(accessible.propertyNames()) ) {
                logger.log(level, "\t" + propertyName + " = " + accessible.getProperty(propertyName));
            }
        }
    }
}
