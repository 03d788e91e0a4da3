package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

final class ReturnMutator extends Mutator {

    ReturnMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        emitChildMutations("value");
    }
}
