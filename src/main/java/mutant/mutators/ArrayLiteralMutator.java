package mutant.mutators;

import java.util.List;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Array initializers: {@code null}, element mutations, single element removal and
 * the empty array.
 */
final class ArrayLiteralMutator extends Mutator {

    ArrayLiteralMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        List<Node> elements = node().nodes("elements");
        emitNil();
        emitElements(elements);
        emitElementPresence(elements);
        // removing the only element already yields the empty array
        if (elements.size() > 1) {
            emitSelf(node().string("elementType"), List.of());
        }
    }
}
