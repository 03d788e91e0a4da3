package mutant.mutators;

import static mutant.ast.TestNodes.at;
import static mutant.ast.TestNodes.binary;
import static mutant.ast.TestNodes.block;
import static mutant.ast.TestNodes.bool;
import static mutant.ast.TestNodes.call;
import static mutant.ast.TestNodes.ifNode;
import static mutant.ast.TestNodes.integer;
import static mutant.ast.TestNodes.method;
import static mutant.ast.TestNodes.not;
import static mutant.ast.TestNodes.ret;
import static mutant.ast.TestNodes.string;
import static mutant.ast.TestNodes.var;
import static mutant.ast.TestNodes.whileNode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import mutant.ast.Node;
import mutant.ast.NodeType;

class MutationEngineTest {

    private static Node sampleMethod() {
        Node guard = ifNode(
                binary("<", var("n", 2), integer(0, 2), 2),
                block(2, ret(string("negative", 3), 3)),
                null,
                2);
        Node countdown = whileNode(
                not(bool(false, 5), 5),
                block(5,
                        Node.of(NodeType.ASSIGNMENT, at(6), var("n", 6), binary("-", var("n", 6), integer(1, 6), 6)),
                        call(var("log", 7), "info", 7, string("tick", 7))),
                5);
        Node array = Node.of(NodeType.LOCAL_VARIABLE, at(9), "int[]", "xs",
                Node.of(NodeType.ARRAY_LITERAL, at(9), "int", List.of(integer(1, 9), integer(2, 9))));
        return method("String", "describe", block(1, guard, countdown, array, ret(var("n", 10), 10)), 1);
    }

    private static Set<Node> identities(Node root) {
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(root, seen);
        return seen;
    }

    private static void collect(Node node, Set<Node> seen) {
        seen.add(node);
        for (Object child : node.children()) {
            if (child instanceof Node childNode) {
                collect(childNode, seen);
            } else if (child instanceof List<?> list) {
                for (Object element : list) {
                    collect((Node) element, seen);
                }
            }
        }
    }

    @Test
    void everyMutantDiffersFromItsInput() {
        Node input = sampleMethod();

        List<Node> mutants = MutationEngine.standard(1L).mutations(input);

        assertFalse(mutants.isEmpty());
        for (Node mutant : mutants) {
            assertNotEquals(input.canonicalForm(), mutant.canonicalForm());
        }
    }

    @Test
    void mutantsShareNoNodeWithTheInput() {
        Node input = sampleMethod();
        Set<Node> inputNodes = identities(input);

        for (Node mutant : MutationEngine.standard(1L).mutations(input)) {
            for (Node part : identities(mutant)) {
                assertFalse(inputNodes.contains(part), "mutant reuses input node " + part);
            }
        }
    }

    @Test
    void enumerationLeavesTheInputUntouched() {
        Node input = sampleMethod();
        Node snapshot = input.deepCopy();

        MutationEngine.standard(1L).mutations(input);

        assertEquals(snapshot, input);
    }

    @Test
    void sameSeedSameMutants() {
        Node input = sampleMethod();

        assertEquals(MutationEngine.standard(7L).mutations(input), MutationEngine.standard(7L).mutations(input));
    }

    @Test
    void repeatedEnumerationYieldsTheSameCount() {
        MutationEngine engine = MutationEngine.standard(7L);
        Node input = sampleMethod();

        int first = engine.mutations(input).size();
        int second = engine.mutations(input).size();

        assertEquals(first, second);
    }

    @Test
    void sinkSeesMutantsInGenerationOrder() {
        MutationEngine engine = MutationEngine.standard(3L);
        Node input = block(1, var("a", 2), var("b", 3));
        List<Node> viaSink = new ArrayList<>();

        engine.enumerate(input, viaSink::add);

        assertEquals(engine.mutations(input), viaSink);
    }

    @Test
    void mutationsListIsUnmodifiable() {
        List<Node> mutants = MutationEngine.standard(3L).mutations(var("a", 1));

        assertThrows(UnsupportedOperationException.class, () -> mutants.add(var("b", 1)));
    }

    @Test
    void parameterIsNeverEnumerated() {
        Node parameter = Node.of(NodeType.PARAMETER, at(1), "int", "n");

        assertThrows(MutatorLookupException.class, () -> MutationEngine.standard(3L).mutations(parameter));
    }

    @Test
    void independentCallsMayRunConcurrently() throws Exception {
        MutationEngine engine = MutationEngine.standard(11L);
        Node input = sampleMethod();
        int expected = engine.mutations(input).size();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> counts = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                counts.add(executor.submit(() -> engine.mutations(sampleMethod()).size()));
            }
            for (Future<Integer> count : counts) {
                assertEquals(expected, count.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertTrue(expected > 20);
    }
}
