package ai.docsite.equation.convert;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes converted OMML fragments to a file, one fragment per line.
 */
public class OmmlFileWriter {

    public void write(Path target, List<String> fragments) {
        if (target == null || fragments == null) {
            throw new IllegalArgumentException("target and fragments must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, fragments, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write OMML output: " + target, ex);
        }
    }
}
