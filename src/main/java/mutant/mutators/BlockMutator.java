package mutant.mutators;

import java.util.List;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Statement removal, one statement at a time, then statement mutations.
 */
final class BlockMutator extends Mutator {

    BlockMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        List<Node> statements = node().nodes("statements");
        emitElementPresence(statements);
        emitElements(statements);
    }
}
