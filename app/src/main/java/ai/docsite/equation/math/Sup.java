package ai.docsite.equation.math;

import java.util.Objects;

/**
 * Base with a superscript.
 */
public record Sup(MathNode base, MathNode sup) implements MathNode {

    public Sup {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(sup, "sup");
    }
}
