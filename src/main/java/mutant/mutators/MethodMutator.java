package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

final class MethodMutator extends Mutator {

    MethodMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitBodyMutations();
    }
}
