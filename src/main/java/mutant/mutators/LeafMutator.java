package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Mutator for nodes that have no mutations of their own: {@code null} and source
 * fragments carried verbatim.
 */
final class LeafMutator extends Mutator {

    LeafMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        // nothing to mutate
    }
}
