package mutant.analysis;

import java.util.List;
import java.util.Objects;

import mutant.ast.Node;

/**
 * Finds the subtree of an original node that a mutant replaced, so a mutant can be
 * reported at the line it changes rather than at the line of the enclosing method.
 */
public final class MutationLocator {

    private record Divergence(Node original, Node mutant) {}

    private MutationLocator() {}

    /**
     * Deepest node of {@code original} that contains every difference to
     * {@code mutant}. Returns {@code original} itself when the roots already differ
     * in type or shape, and {@code null} when the trees are equal.
     */
    public static Node locate(Node original, Node mutant) {
        if (original.equals(mutant)) {
            return null;
        }
        Divergence current = new Divergence(original, mutant);
        Divergence next = descend(current);
        while (next != null) {
            current = next;
            next = descend(current);
        }
        return current.original();
    }

    // the only differing child pair, when both nodes agree on everything else
    private static Divergence descend(Divergence divergence) {
        Node original = divergence.original();
        Node mutant = divergence.mutant();
        if (original.type() != mutant.type()) {
            return null;
        }
        Divergence found = null;
        for (int i = 0; i < original.children().size(); i++) {
            Object left = original.child(i);
            Object right = mutant.child(i);
            if (Objects.equals(left, right)) {
                continue;
            }
            if (found != null) {
                return null;
            }
            if (left instanceof Node leftNode && right instanceof Node rightNode) {
                found = new Divergence(leftNode, rightNode);
            } else if (left instanceof List<?> leftList && right instanceof List<?> rightList) {
                found = descendList(leftList, rightList);
                if (found == null) {
                    return null;
                }
            } else {
                return null;
            }
        }
        return found;
    }

    private static Divergence descendList(List<?> left, List<?> right) {
        if (left.size() != right.size()) {
            return null;
        }
        Divergence found = null;
        for (int i = 0; i < left.size(); i++) {
            if (left.get(i).equals(right.get(i))) {
                continue;
            }
            if (found != null) {
                return null;
            }
            found = new Divergence((Node) left.get(i), (Node) right.get(i));
        }
        return found;
    }
}
