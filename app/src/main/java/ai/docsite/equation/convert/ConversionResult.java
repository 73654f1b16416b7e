package ai.docsite.equation.convert;

import ai.docsite.equation.math.Equation;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of converting one formula. Both the tree and the markup are absent when the formula was blank.
 */
public record ConversionResult(String source, Optional<Equation> equation, Optional<String> omml) {

    public ConversionResult {
        Objects.requireNonNull(source, "source");
        equation = equation == null ? Optional.empty() : equation;
        omml = omml == null ? Optional.empty() : omml;
    }

    public static ConversionResult blank(String source) {
        return new ConversionResult(source, Optional.empty(), Optional.empty());
    }

    public boolean isBlank() {
        return equation.isEmpty();
    }
}
