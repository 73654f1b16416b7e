package ai.docsite.equation.parse;

/**
 * Raised when an expression nests deeper than the configured limit.
 */
public class EquationNestingException extends RuntimeException {

    private final int maxNestingDepth;

    public EquationNestingException(int maxNestingDepth) {
        super("Expression too deeply nested (limit " + maxNestingDepth + ")");
        this.maxNestingDepth = maxNestingDepth;
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }
}
