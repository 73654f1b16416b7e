package ai.docsite.equation.math;

import java.util.List;
import java.util.Objects;

/**
 * One matrix entry. A cell may be empty but still carries its control-properties marker.
 */
public record MatrixCell(List<MathNode> content) {

    public MatrixCell {
        content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    public boolean hasControlProperties() {
        return true;
    }
}
