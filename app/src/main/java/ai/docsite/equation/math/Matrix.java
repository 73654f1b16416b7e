package ai.docsite.equation.math;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Row-major matrix. Serialized with a single center-justified column definition whatever the row width.
 */
public record Matrix(List<List<MatrixCell>> rows) implements MathNode {

    public Matrix {
        Objects.requireNonNull(rows, "rows");
        rows = rows.stream()
                .map(List::copyOf)
                .collect(Collectors.toUnmodifiableList());
    }

    public int rowCount() {
        return rows.size();
    }
}
