package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Calls without arguments: the receiver alone, receiver mutations, {@code null}.
 */
final class CallMutator extends Mutator {

    CallMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        Node receiver = node().node("receiver");
        if (receiver != null) {
            emitSafe(receiver);
            emitChildMutations("receiver");
        }
        emitNil();
    }
}
