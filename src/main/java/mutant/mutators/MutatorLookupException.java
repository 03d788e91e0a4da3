package mutant.mutators;

import mutant.ast.NodeType;

/**
 * No mutator is registered for a node type. Signals a missing mutator
 * implementation, never a runtime condition worth retrying.
 */
public class MutatorLookupException extends MutationException {

    private final NodeType nodeType;

    public MutatorLookupException(NodeType nodeType) {
        super("No mutator registered for node type " + nodeType);
        this.nodeType = nodeType;
    }

    public NodeType nodeType() {
        return nodeType;
    }
}
