package mutant.runtime;

import java.util.List;

import mutant.ast.Node;

/**
 * Mutants of one method, in generation order.
 */
public record MethodMutants(String subject, Node method, List<Node> mutants) {

    public MethodMutants {
        mutants = List.copyOf(mutants);
    }
}
