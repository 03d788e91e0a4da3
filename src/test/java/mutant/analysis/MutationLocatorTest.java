package mutant.analysis;

import static mutant.ast.TestNodes.binary;
import static mutant.ast.TestNodes.block;
import static mutant.ast.TestNodes.integer;
import static mutant.ast.TestNodes.method;
import static mutant.ast.TestNodes.nil;
import static mutant.ast.TestNodes.ret;
import static mutant.ast.TestNodes.var;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

import mutant.ast.Node;

class MutationLocatorTest {

    private final Node sum = binary("+", var("a", 3), integer(1, 3), 3);
    private final Node original = method("int", "inc", block(1, var("a", 2), ret(sum, 3)), 1);

    @Test
    void equalTreesHaveNoLocation() {
        assertNull(MutationLocator.locate(original, original.deepCopy()));
    }

    @Test
    void findsDeepestChangedNode() {
        Node mutant = method("int", "inc",
                block(1, var("a", 2), ret(binary("+", var("a", 3), integer(0, 3), 3), 3)), 1);

        Node located = MutationLocator.locate(original, mutant);

        assertSame(sum.node("right"), located);
    }

    @Test
    void replacedSubtreeIsLocatedAtItsRoot() {
        Node mutant = method("int", "inc", block(1, var("a", 2), ret(nil(3), 3)), 1);

        assertSame(sum, MutationLocator.locate(original, mutant));
    }

    @Test
    void removedStatementLocatesTheEnclosingBlock() {
        Node mutant = method("int", "inc", block(1, ret(sum, 3)), 1);

        assertSame(original.node("body"), MutationLocator.locate(original, mutant));
    }

    @Test
    void changedOperatorLocatesTheBinary() {
        Node mutant = method("int", "inc", block(1, var("a", 2), ret(binary("-", var("a", 3), integer(1, 3), 3), 3)), 1);

        assertSame(sum, MutationLocator.locate(original, mutant));
    }
}
