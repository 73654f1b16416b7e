package ai.docsite.equation.math;

import java.util.List;
import java.util.Objects;

/**
 * Top-level node sequence of one parsed formula.
 */
public record Equation(List<MathNode> nodes) {

    public Equation {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
