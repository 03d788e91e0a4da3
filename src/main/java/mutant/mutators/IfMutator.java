package mutant.mutators;

import java.util.List;
import java.util.function.Consumer;

import mutant.ast.Node;
import mutant.ast.NodeType;

/**
 * Conditionals: negated condition, then-branch only, else-branch only, then the
 * mutations of the condition and of each branch.
 */
final class IfMutator extends Mutator {

    IfMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        Node condition = node().node("condition");
        Node thenBranch = node().node("then");
        Node elseBranch = node().node("else");

        emitSelf(negate(condition), thenBranch, elseBranch);
        // dropped when there is no else branch to remove
        emitSelf(condition, thenBranch, null);
        if (elseBranch != null) {
            emitSelf(condition, build(NodeType.BLOCK, List.of()), elseBranch);
        }
        emitChildMutations("condition");
        emitChildMutations("then");
        emitChildMutations("else");
    }

    private Node negate(Node condition) {
        if (condition.type() == NodeType.NOT) {
            return condition.node("operand");
        }
        return build(NodeType.NOT, condition);
    }
}
