package ai.docsite.equation.parse;

import java.util.List;

/**
 * The fixed recognizer priority order. The first recognizer that matches wins, so the order decides how overlapping
 * prefixes are read; it is not a longest-match search.
 */
public final class Recognizers {

    private Recognizers() {
    }

    public static List<Recognizer> standard() {
        return List.of(
                new FunctionCallRecognizer(),
                new ParenthesisRecognizer(),
                new MatrixRecognizer(),
                new CasesRecognizer(),
                new FractionRecognizer(),
                ScriptRecognizer.subSup(),
                ScriptRecognizer.sub(),
                ScriptRecognizer.sup(),
                new GreekLetterRecognizer(),
                new OperatorRecognizer(),
                new LiteralRunRecognizer(),
                new SkipCharacterRecognizer());
    }
}
