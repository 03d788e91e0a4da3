package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;
import mutant.ast.NodeType;

/**
 * Loops: the loop that never runs, condition mutations, body mutations.
 */
final class WhileMutator extends Mutator {

    WhileMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitSafe(duplicate().set("condition", build(NodeType.BOOLEAN_LITERAL, false)).build());
        emitChildMutations("condition");
        emitBodyMutations();
    }
}
