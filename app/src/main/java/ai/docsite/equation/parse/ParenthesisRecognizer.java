package ai.docsite.equation.parse;

import ai.docsite.equation.math.Delimited;
import ai.docsite.equation.math.MathNode;
import ai.docsite.equation.math.MathRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bare parenthesized group. Only groups containing a macro become a delimited node; plain groups are flattened into
 * literal parenthesis runs around the inner nodes, matching what the reference authoring tool produces.
 */
final class ParenthesisRecognizer implements Recognizer {

    @Override
    public String name() {
        return "parenthesis";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        int end = LatexScanner.parenthesizedEnd(input, 0);
        if (end == LatexScanner.NO_MATCH) {
            return Optional.empty();
        }
        String inner = input.substring(1, end - 1);
        List<MathNode> innerNodes = context.parseNested(inner);
        if (inner.indexOf('\\') >= 0) {
            return Optional.of(Recognition.of(Delimited.parentheses(innerNodes), end));
        }
        List<MathNode> flattened = new ArrayList<>(innerNodes.size() + 2);
        flattened.add(MathRun.of("("));
        flattened.addAll(innerNodes);
        flattened.add(MathRun.of(")"));
        return Optional.of(new Recognition(flattened, end));
    }
}
