package mutant.mutators;

import java.util.List;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * {@code true} becomes {@code false} and vice versa; either becomes {@code null}.
 */
final class BooleanLiteralMutator extends Mutator {

    BooleanLiteralMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        boolean value = node().bool("value");
        emitValues(List.of(List.of(!value)));
        emitNil();
    }
}
