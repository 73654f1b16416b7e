package ai.docsite.equation.math;

import java.util.List;
import java.util.Objects;

/**
 * Stacked fraction.
 */
public record Fraction(List<MathNode> numerator, List<MathNode> denominator) implements MathNode {

    public Fraction {
        numerator = List.copyOf(Objects.requireNonNull(numerator, "numerator"));
        denominator = List.copyOf(Objects.requireNonNull(denominator, "denominator"));
    }
}
