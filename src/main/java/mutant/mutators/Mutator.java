package mutant.mutators;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

import mutant.ast.Node;
import mutant.ast.NodeType;
import mutant.logging.LoggingConfig;

/**
 * Generator of the single-edit mutants of one node.
 *
 * <p>A mutator is created per enumeration request by {@link MutationEngine}. It
 * works on a deep copy of the node it was handed, so no mutant it emits shares
 * identity with the caller's tree. Subclasses implement {@link #dispatch()} with
 * the emission primitives, node builders and composition helpers below; every
 * mutant reaches the sink synchronously and in generation order.
 */
public abstract class Mutator {

    /** Maximum number of calls to an {@link #emitNew} generator. */
    public static final int MAX_TRIES = 3;

    private static final Logger LOGGER = LoggingConfig.getLogger(Mutator.class);

    private final MutationEngine engine;
    private final Node node;
    private final Consumer<Node> sink;
    private List<Object> canonicalForm;

    protected Mutator(MutationEngine engine, Node node, Consumer<Node> sink) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.node = Objects.requireNonNull(node, "node").deepCopy();
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Emits the mutants of {@link #node()}.
     */
    protected abstract void dispatch();

    final void run() {
        dispatch();
    }

    /** The snapshot this mutator works on. */
    protected final Node node() {
        return node;
    }

    protected final MutationEngine engine() {
        return engine;
    }

    protected final Random random() {
        return engine.random();
    }

    // ---------------------------------------------------------------- emission

    /**
     * Forwards {@code mutant} to the sink without checking it against the original.
     */
    protected final void emitUnsafe(Node mutant) {
        sink.accept(Objects.requireNonNull(mutant, "mutant"));
    }

    /**
     * Forwards {@code mutant} unless it is structurally identical to the original.
     */
    protected final void emitSafe(Node mutant) {
        if (!isNew(mutant)) {
            LOGGER.finer(() -> "Dropping mutant identical to original " + node);
            return;
        }
        emitUnsafe(mutant);
    }

    /**
     * Calls {@code generator} until it produces a node different from the original
     * and emits that node. Intended for randomly generated replacements that may
     * accidentally reproduce the original.
     *
     * @throws GenerationExhaustedException when {@link #MAX_TRIES} candidates all equal the original
     */
    protected final void emitNew(Supplier<Node> generator) {
        for (int attempt = 1; attempt <= MAX_TRIES; attempt++) {
            Node candidate = generator.get();
            if (isNew(candidate)) {
                emitUnsafe(candidate);
                return;
            }
            final int failed = attempt;
            LOGGER.fine(() -> String.format("Attempt %d/%d reproduced %s", failed, MAX_TRIES, node));
        }
        throw new GenerationExhaustedException(MAX_TRIES);
    }

    protected final void emit(NodeType type, Object... children) {
        emitSafe(build(type, children));
    }

    protected final void emitSelf(Object... children) {
        emitSafe(buildSelf(children));
    }

    protected final void emitNil() {
        emitSafe(buildNil());
    }

    /**
     * Whether {@code candidate} differs from the original node.
     */
    protected final boolean isNew(Node candidate) {
        return !canonicalForm().equals(candidate.canonicalForm());
    }

    private List<Object> canonicalForm() {
        if (canonicalForm == null) {
            canonicalForm = node.canonicalForm();
        }
        return canonicalForm;
    }

    // ---------------------------------------------------------------- builders

    /**
     * New node of {@code type} at the original's source position.
     */
    protected final Node build(NodeType type, Object... children) {
        return Node.of(type, node.position(), children);
    }

    protected final Node buildSelf(Object... children) {
        return build(node.type(), children);
    }

    protected final Node buildNil() {
        return build(NodeType.NULL_LITERAL);
    }

    protected final Node buildCall(Node receiver, String name) {
        return build(NodeType.CALL, receiver, name);
    }

    protected final Node buildCall(Node receiver, String name, List<Node> arguments) {
        return build(NodeType.CALL_WITH_ARGUMENTS, receiver, name, arguments);
    }

    /**
     * Mutable shallow copy of the original for single-slot edits.
     */
    protected final Node.Builder duplicate() {
        return node.toBuilder();
    }

    // ---------------------------------------------------------------- composition

    /**
     * Emits a node of the original's type for each candidate set of children.
     */
    protected final void emitValues(List<? extends List<?>> values) {
        for (List<?> value : values) {
            emitSelf(value.toArray());
        }
    }

    /**
     * Emits one mutant per element with that element removed, the others kept in
     * order.
     */
    protected final void emitElementPresence(List<Node> elements) {
        for (int index = 0; index < elements.size(); index++) {
            List<Node> remaining = new ArrayList<>(elements);
            remaining.remove(index);
            emitSafe(withElements(remaining));
        }
    }

    /**
     * Emits, for each element and each of its mutants, the original with only that
     * element replaced.
     */
    protected final void emitElements(List<Node> elements) {
        for (int index = 0; index < elements.size(); index++) {
            final int position = index;
            engine.enumerate(elements.get(index), mutation -> {
                List<Node> replaced = new ArrayList<>(elements);
                replaced.set(position, mutation);
                emitSafe(withElements(replaced));
            });
        }
    }

    /**
     * Emits the original with its {@code body} child replaced by each mutant of
     * that child.
     */
    protected final void emitBodyMutations() {
        if (!node.type().hasSlot(NodeType.BODY) || node.get(NodeType.BODY) == null) {
            throw new IllegalStateException(node.type() + " has no body to mutate");
        }
        emitChildMutations(NodeType.BODY);
    }

    /**
     * Emits the original with the node in {@code slotName} replaced by each of its
     * mutants. Absent optional children have no mutants.
     */
    protected final void emitChildMutations(String slotName) {
        Node child = node.node(slotName);
        if (child == null) {
            return;
        }
        engine.enumerate(child, mutation -> emitUnsafe(duplicate().set(slotName, mutation).build()));
    }

    private Node withElements(List<Node> elements) {
        int index = node.type().listSlotIndex();
        if (index == -1) {
            throw new IllegalStateException(node.type() + " has no element list");
        }
        return duplicate().set(index, elements).build();
    }
}
