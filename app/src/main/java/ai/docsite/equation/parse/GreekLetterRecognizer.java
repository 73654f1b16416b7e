package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathRun;
import java.util.Optional;

/**
 * Stand-alone Greek macro. Macros missing from the table are declined and fall through to the literal rules.
 */
final class GreekLetterRecognizer implements Recognizer {

    @Override
    public String name() {
        return "greek-letter";
    }

    @Override
    public Optional<Recognition> recognize(String input, ParseContext context) {
        int end = LatexScanner.macroEnd(input, 0);
        if (end == LatexScanner.NO_MATCH) {
            return Optional.empty();
        }
        return GreekSymbolTable.lookup(input.substring(1, end))
                .map(glyph -> Recognition.of(MathRun.eastAsian(glyph), end));
    }
}
