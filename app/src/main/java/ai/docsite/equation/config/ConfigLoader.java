package ai.docsite.equation.config;

import ai.docsite.equation.cli.CliArguments;
import ai.docsite.equation.omml.OmmlWriter;
import ai.docsite.equation.parse.EquationParser;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MAX_NESTING_DEPTH = "EQUATION_MAX_NESTING_DEPTH";
    static final String ENV_MATH_FONT = "OMML_MATH_FONT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "EQUATION_VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        int maxNestingDepth = resolveMaxNestingDepth(arguments);
        String mathFont = firstNonBlank(arguments.mathFont(), ENV_MATH_FONT, OmmlWriter.DEFAULT_MATH_FONT);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);
        Optional<Path> inputFile = Optional.ofNullable(arguments.inputFile());
        Optional<Path> outputFile = Optional.ofNullable(arguments.outputFile());
        return new Config(arguments.formulas(), inputFile, outputFile, maxNestingDepth, mathFont, logFormat, verbose);
    }

    private int resolveMaxNestingDepth(CliArguments arguments) {
        Integer cliDepth = arguments.maxNestingDepth();
        if (cliDepth != null) {
            if (cliDepth < 1) {
                throw new IllegalArgumentException("--max-depth must be at least 1");
            }
            return cliDepth;
        }
        return environmentReader.get(ENV_MAX_NESTING_DEPTH)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(EquationParser.DEFAULT_MAX_NESTING_DEPTH);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.get(ENV_VERBOSE)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_MAX_NESTING_DEPTH + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_NESTING_DEPTH + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
