package mutant.mutators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;
import java.util.logging.Logger;

import mutant.ast.Node;
import mutant.logging.LoggingConfig;

/**
 * Entry point for enumerating the mutants of a node.
 *
 * <p>Enumeration is synchronous: the sink is called on the caller's thread, once
 * per mutant and in generation order, before {@link #enumerate} returns. Calls on
 * disjoint inputs may run concurrently.
 */
public final class MutationEngine {

    private static final Logger LOGGER = LoggingConfig.getLogger(MutationEngine.class);

    private final MutatorRegistry registry;
    private final Random random;

    public MutationEngine(MutatorRegistry registry, Random random) {
        this.registry = Objects.requireNonNull(registry, "registry").seal();
        this.random = Objects.requireNonNull(random, "random");
    }

    public static MutationEngine standard(long seed) {
        return new MutationEngine(MutatorRegistry.standard(), new Random(seed));
    }

    public MutatorRegistry registry() {
        return registry;
    }

    /** Source of randomness for mutators generating arbitrary replacements. */
    public Random random() {
        return random;
    }

    /**
     * Emits every mutant of {@code node} to {@code sink}.
     *
     * @throws MutatorLookupException when no mutator handles the node's type; the
     *         sink is not called in that case
     */
    public void enumerate(Node node, Consumer<Node> sink) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(sink, "sink");
        MutatorFactory factory = registry.lookup(node.type());
        LOGGER.finest(() -> "Enumerating mutations of " + node.type() + " at " + node.position());
        factory.create(this, node, sink).run();
    }

    /**
     * Mutants of {@code node} in generation order.
     */
    public List<Node> mutations(Node node) {
        List<Node> mutants = new ArrayList<>();
        enumerate(node, mutants::add);
        return Collections.unmodifiableList(mutants);
    }
}
