package ai.docsite.equation.math;

import java.util.Objects;

/**
 * Base carrying both a subscript and a superscript. Kept apart from {@link Sub} and {@link Sup} because the target
 * format serializes it as a different element kind.
 */
public record SubSup(MathNode base, MathNode sub, MathNode sup) implements MathNode {

    public SubSup {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(sub, "sub");
        Objects.requireNonNull(sup, "sup");
    }
}
