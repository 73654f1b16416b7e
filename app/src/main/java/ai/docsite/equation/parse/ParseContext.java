package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathNode;
import java.util.List;
import java.util.Objects;

/**
 * Gives recognizers access to recursive parsing at the current nesting depth.
 */
public final class ParseContext {

    private final EquationParser parser;
    private final int depth;

    ParseContext(EquationParser parser, int depth) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }

    public List<MathNode> parseNested(String expression) {
        return parser.parseSequence(expression, depth + 1);
    }
}
