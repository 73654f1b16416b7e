package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathRun;
import java.util.Optional;

/**
 * Longest run of ASCII letters, digits and periods.
 */
final class LiteralRunRecognizer implements Recognizer {

    @Override
    public String name() {
        return "literal-run";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        int end = 0;
        while (end < input.length() && isRunCharacter(input.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return Optional.empty();
        }
        return Optional.of(Recognition.of(MathRun.of(input.substring(0, end)), end));
    }

    private static boolean isRunCharacter(char ch) {
        return LatexScanner.isAsciiAlphanumeric(ch) || ch == '.';
    }
}
