package ai.docsite.equation.math;

import java.util.List;
import java.util.Objects;

/**
 * Sub-expression wrapped in an opening and a closing glyph. Either glyph may be the empty string, as for the
 * unterminated brace of a cases block.
 */
public record Delimited(String openGlyph, String closeGlyph, List<MathNode> inner) implements MathNode {

    public Delimited {
        Objects.requireNonNull(openGlyph, "openGlyph");
        Objects.requireNonNull(closeGlyph, "closeGlyph");
        inner = List.copyOf(Objects.requireNonNull(inner, "inner"));
    }

    public static Delimited parentheses(List<MathNode> inner) {
        return new Delimited("(", ")", inner);
    }

    public static Delimited brackets(List<MathNode> inner) {
        return new Delimited("[", "]", inner);
    }

    public static Delimited openBrace(List<MathNode> inner) {
        return new Delimited("{", "", inner);
    }
}
