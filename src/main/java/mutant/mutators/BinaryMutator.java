package mutant.mutators;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Operator replacement, operand promotion for arithmetic and logical operators,
 * then operand mutations.
 */
final class BinaryMutator extends Mutator {

    private static final Map<String, List<String>> REPLACEMENTS = Map.ofEntries(
            Map.entry("+", List.of("-")),
            Map.entry("-", List.of("+")),
            Map.entry("*", List.of("/")),
            Map.entry("/", List.of("*")),
            Map.entry("%", List.of("*")),
            Map.entry("<", List.of("<=", ">")),
            Map.entry("<=", List.of("<", ">")),
            Map.entry(">", List.of(">=", "<")),
            Map.entry(">=", List.of(">", "<")),
            Map.entry("==", List.of("!=")),
            Map.entry("!=", List.of("==")),
            Map.entry("&&", List.of("||")),
            Map.entry("||", List.of("&&")),
            Map.entry("&", List.of("|")),
            Map.entry("|", List.of("&")),
            Map.entry("^", List.of("&")),
            Map.entry("<<", List.of(">>")),
            Map.entry(">>", List.of("<<")),
            Map.entry(">>>", List.of(">>")));

    // operators whose operands have the type of the whole expression
    private static final Set<String> PROMOTABLE = Set.of("+", "-", "*", "/", "%", "&&", "||", "&", "|", "^");

    BinaryMutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        super(engine, node, sink);
    }

    @Override
    protected void dispatch() {
        String operator = node().string("operator");
        Node left = node().node("left");
        Node right = node().node("right");

        for (String replacement : REPLACEMENTS.getOrDefault(operator, List.of())) {
            emitSelf(replacement, left, right);
        }
        if (PROMOTABLE.contains(operator)) {
            emitSafe(left);
            emitSafe(right);
        }
        emitChildMutations("left");
        emitChildMutations("right");
    }
}
