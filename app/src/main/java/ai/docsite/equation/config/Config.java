package ai.docsite.equation.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        List<String> formulas,
        Optional<Path> inputFile,
        Optional<Path> outputFile,
        int maxNestingDepth,
        String mathFont,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        formulas = formulas == null ? List.of() : List.copyOf(formulas);
        inputFile = inputFile == null ? Optional.empty() : inputFile;
        outputFile = outputFile == null ? Optional.empty() : outputFile;
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1");
        }
        if (mathFont == null || mathFont.isBlank()) {
            throw new IllegalArgumentException("mathFont must not be blank");
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (formulas.isEmpty() && inputFile.isEmpty()) {
            throw new IllegalArgumentException("At least one formula or --input must be provided");
        }
    }
}
