package ai.docsite.equation.parse;

import ai.docsite.equation.math.Delimited;
import ai.docsite.equation.math.MathNode;
import ai.docsite.equation.math.MathRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code cases} environment, emitted as a single sequence behind an open brace. Rows are separated by a space run.
 * Only the text before a row's first column separator is kept; condition text after it is discarded.
 */
final class CasesRecognizer implements Recognizer {

    @Override
    public String name() {
        return "cases";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        return EnvironmentBlock.match(input, "cases").map(block -> {
            List<MathNode> inner = new ArrayList<>();
            List<String> rows = block.rows();
            for (int i = 0; i < rows.size(); i++) {
                if (i > 0) {
                    inner.add(MathRun.of(" "));
                }
                inner.addAll(context.parseNested(leftColumn(rows.get(i))));
            }
            return Recognition.of(Delimited.openBrace(inner), block.end());
        });
    }

    private static String leftColumn(String row) {
        int separator = row.indexOf(EnvironmentBlock.COLUMN_SEPARATOR);
        return separator < 0 ? row : LatexScanner.trim(row.substring(0, separator));
    }
}
