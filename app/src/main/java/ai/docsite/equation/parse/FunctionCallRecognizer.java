package ai.docsite.equation.parse;

import ai.docsite.equation.math.Delimited;
import ai.docsite.equation.math.MathNode;
import ai.docsite.equation.math.MathRun;
import java.util.List;
import java.util.Optional;

/**
 * Elementary function applied to a parenthesized argument, with or without a leading backslash:
 * {@code \cos(x)} or {@code cos(x)}. Emits the function name followed by a delimited argument.
 */
final class FunctionCallRecognizer implements Recognizer {

    static final List<String> FUNCTION_NAMES = List.of("cos", "sin", "tan", "log", "ln", "exp");

    @Override
    public String name() {
        return "function-call";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        int position = input.startsWith("\\") ? 1 : 0;
        String function = null;
        for (String candidate : FUNCTION_NAMES) {
            if (input.startsWith(candidate, position)) {
                function = candidate;
                break;
            }
        }
        if (function == null) {
            return Optional.empty();
        }
        int open = LatexScanner.skipWhitespace(input, position + function.length());
        int end = LatexScanner.parenthesizedEnd(input, open);
        if (end == LatexScanner.NO_MATCH) {
            return Optional.empty();
        }
        List<MathNode> argument = context.parseNested(input.substring(open + 1, end - 1));
        return Optional.of(new Recognition(List.of(MathRun.of(function), Delimited.parentheses(argument)), end));
    }
}
