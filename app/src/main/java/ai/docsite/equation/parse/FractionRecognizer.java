package ai.docsite.equation.parse;

import ai.docsite.equation.math.Fraction;
import java.util.Optional;

/**
 * {@code \frac{A}{B}}. Neither argument may contain a closing brace.
 */
final class FractionRecognizer implements Recognizer {

    private static final String COMMAND = "\\frac";

    @Override
    public String name() {
        return "fraction";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        if (!input.startsWith(COMMAND)) {
            return Optional.empty();
        }
        int numeratorStart = COMMAND.length();
        int numeratorEnd = LatexScanner.bracedEnd(input, numeratorStart);
        if (numeratorEnd == LatexScanner.NO_MATCH) {
            return Optional.empty();
        }
        int denominatorEnd = LatexScanner.bracedEnd(input, numeratorEnd);
        if (denominatorEnd == LatexScanner.NO_MATCH) {
            return Optional.empty();
        }
        Fraction fraction = new Fraction(
                context.parseNested(input.substring(numeratorStart + 1, numeratorEnd - 1)),
                context.parseNested(input.substring(numeratorEnd + 1, denominatorEnd - 1)));
        return Optional.of(Recognition.of(fraction, denominatorEnd));
    }
}
