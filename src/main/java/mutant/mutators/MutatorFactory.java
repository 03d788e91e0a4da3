package mutant.mutators;

import java.util.function.Consumer;

import mutant.ast.Node;

/**
 * Creates the mutator instance for one enumeration of one node.
 */
@FunctionalInterface
public interface MutatorFactory {
    Mutator create(MutationEngine engine, Node node, Consumer<Node> sink);
}
