package mutant.mutators;

import java.util.List;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Calls with arguments: the receiver alone, one argument dropped, argument
 * mutations, receiver mutations and {@code null}. Dropping the only argument
 * produces a call without an argument list.
 */
final class CallWithArgumentsMutator extends Mutator {

    CallWithArgumentsMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        Node receiver = node().node("receiver");
        String name = node().string("name");
        List<Node> arguments = node().nodes("arguments");

        if (receiver != null) {
            emitSafe(receiver);
        }
        if (arguments.size() == 1) {
            emitSafe(buildCall(receiver, name));
        } else {
            emitElementPresence(arguments);
        }
        emitElements(arguments);
        emitChildMutations("receiver");
        emitNil();
    }
}
