package ai.docsite.equation.math;

import java.util.Objects;

/**
 * Base with a subscript.
 */
public record Sub(MathNode base, MathNode sub) implements MathNode {

    public Sub {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(sub, "sub");
    }
}
