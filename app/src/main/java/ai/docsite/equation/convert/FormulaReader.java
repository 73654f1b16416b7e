package ai.docsite.equation.convert;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a formula from a file. The whole file is one formula, so environments may span several lines.
 */
public class FormulaReader {

    public String read(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("source must be provided");
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read formula: " + source, ex);
        }
    }
}
