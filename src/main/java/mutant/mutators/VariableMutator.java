package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

final class VariableMutator extends Mutator {

    VariableMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitNil();
    }
}
