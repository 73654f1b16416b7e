package ai.docsite.equation.math;

import java.util.Objects;

/**
 * Literal text leaf.
 */
public record MathRun(String text, FontHint hint) implements MathNode {

    public MathRun {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(hint, "hint");
    }

    public static MathRun of(String text) {
        return new MathRun(text, FontHint.DEFAULT);
    }

    public static MathRun eastAsian(String text) {
        return new MathRun(text, FontHint.EAST_ASIAN);
    }

    @Override
    public boolean hasControlProperties() {
        return false;
    }
}
