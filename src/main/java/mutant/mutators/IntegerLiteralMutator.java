package mutant.mutators;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Replaces an integer literal with the boundary values {@code 0} and {@code 1},
 * its successor, its negation and one random int. A literal within the int range
 * only gets replacements within that range, since it may sit in an int context.
 */
final class IntegerLiteralMutator extends Mutator {

    IntegerLiteralMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        long value = node().number("value");
        boolean intWidth = fitsInt(value);
        Set<Long> candidates = new LinkedHashSet<>(List.of(0L, 1L, value + 1, -value));
        List<List<Long>> values = new ArrayList<>();
        for (Long candidate : candidates) {
            if (intWidth && !fitsInt(candidate)) {
                continue;
            }
            values.add(List.of(candidate));
        }
        emitValues(values);
        emitNew(() -> buildSelf((long) random().nextInt()));
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
