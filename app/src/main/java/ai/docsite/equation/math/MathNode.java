package ai.docsite.equation.math;

/**
 * Node of a parsed equation tree.
 */
public interface MathNode {

    /**
     * Whether the node carries a control-properties marker when serialized. Every composite node does; literal runs
     * do not.
     */
    default boolean hasControlProperties() {
        return true;
    }
}
