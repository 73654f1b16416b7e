package ai.docsite.equation.parse;

import ai.docsite.equation.math.MathNode;
import java.util.List;
import java.util.Objects;

/**
 * Nodes emitted by a recognizer together with the number of input characters it consumed.
 */
public record Recognition(List<MathNode> nodes, int consumed) {

    public Recognition {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        if (consumed < 1) {
            throw new IllegalArgumentException("A recognition must consume at least one character");
        }
    }

    public static Recognition of(MathNode node, int consumed) {
        return new Recognition(List.of(node), consumed);
    }

    public static Recognition skip(int consumed) {
        return new Recognition(List.of(), consumed);
    }
}
