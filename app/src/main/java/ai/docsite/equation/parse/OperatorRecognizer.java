package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathRun;
import java.util.Optional;

final class OperatorRecognizer implements Recognizer {

    static final String OPERATORS = "=+-*/()[]{},;: ";

    @Override
    public String name() {
        return "operator";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        if (input.isEmpty() || OPERATORS.indexOf(input.charAt(0)) < 0) {
            return Optional.empty();
        }
        return Optional.of(Recognition.of(MathRun.of(input.substring(0, 1)), 1));
    }
}
