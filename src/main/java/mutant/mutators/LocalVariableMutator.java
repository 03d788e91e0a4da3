package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Initializer mutations. Declarations without an initializer have none.
 */
final class LocalVariableMutator extends Mutator {

    LocalVariableMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitChildMutations("value");
    }
}
