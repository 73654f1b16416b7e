package ai.docsite.equation.parse;

import ai.docsite.equation.math.Delimited;
import ai.docsite.equation.math.Matrix;
import ai.docsite.equation.math.MatrixCell;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code bmatrix} environment, emitted as a bracket-delimited matrix.
 */
final class MatrixRecognizer implements Recognizer {

    @Override
    public String name() {
        return "bmatrix";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        return EnvironmentBlock.match(input, "bmatrix").map(block -> {
            List<List<MatrixCell>> rows = new ArrayList<>();
            for (String row : block.rows()) {
                List<MatrixCell> cells = new ArrayList<>();
                for (String cell : EnvironmentBlock.cells(row)) {
                    cells.add(new MatrixCell(context.parseNested(cell)));
                }
                rows.add(cells);
            }
            return Recognition.of(Delimited.brackets(List.of(new Matrix(rows))), block.end());
        });
    }
}
