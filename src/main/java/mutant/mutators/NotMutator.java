package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Drops the negation, then mutates the operand.
 */
final class NotMutator extends Mutator {

    NotMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitSafe(node().node("operand"));
        emitChildMutations("operand");
    }
}
