package mutant.mutators;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import mutant.ast.NodeType;
import mutant.logging.LoggingConfig;

/**
 * Maps each node type to the factory of its mutator. Types are matched exactly.
 * Registration is append-only and ends with {@link #seal()}; a sealed registry is
 * read-only and safe to share between threads.
 */
public final class MutatorRegistry {

    private static final Logger LOGGER = LoggingConfig.getLogger(MutatorRegistry.class);
    private static final MutatorRegistry STANDARD = buildStandard();

    private final Map<NodeType, MutatorFactory> pending = new EnumMap<>(NodeType.class);
    private volatile Map<NodeType, MutatorFactory> factories;

    /**
     * Registry holding the built-in mutators, already sealed.
     */
    public static MutatorRegistry standard() {
        return STANDARD;
    }

    public synchronized MutatorRegistry register(NodeType type, MutatorFactory factory) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(factory, "factory");
        if (factories != null) {
            throw new IllegalStateException("Registry is sealed; cannot register " + type);
        }
        if (pending.containsKey(type)) {
            throw new IllegalStateException("Mutator for " + type + " already registered");
        }
        pending.put(type, factory);
        return this;
    }

    public synchronized MutatorRegistry seal() {
        if (factories == null) {
            factories = Collections.unmodifiableMap(new EnumMap<>(pending));
            LOGGER.fine(() -> "Sealed mutator registry with " + factories.size() + " node types");
        }
        return this;
    }

    public boolean isSealed() {
        return factories != null;
    }

    /**
     * @throws MutatorLookupException when {@code type} has no registered mutator
     */
    public MutatorFactory lookup(NodeType type) {
        MutatorFactory factory = view().get(type);
        if (factory == null) {
            throw new MutatorLookupException(type);
        }
        return factory;
    }

    public boolean isRegistered(NodeType type) {
        return view().containsKey(type);
    }

    public Set<NodeType> registeredTypes() {
        return Collections.unmodifiableSet(view().keySet());
    }

    private Map<NodeType, MutatorFactory> view() {
        Map<NodeType, MutatorFactory> sealed = factories;
        if (sealed != null) {
            return sealed;
        }
        synchronized (this) {
            return new EnumMap<>(pending);
        }
    }

    private static MutatorRegistry buildStandard() {
        return new MutatorRegistry()
                .register(NodeType.NULL_LITERAL, LeafMutator::new)
                .register(NodeType.BOOLEAN_LITERAL, BooleanLiteralMutator::new)
                .register(NodeType.INTEGER_LITERAL, IntegerLiteralMutator::new)
                .register(NodeType.STRING_LITERAL, StringLiteralMutator::new)
                .register(NodeType.ARRAY_LITERAL, ArrayLiteralMutator::new)
                .register(NodeType.VARIABLE, VariableMutator::new)
                .register(NodeType.NOT, NotMutator::new)
                .register(NodeType.BINARY, BinaryMutator::new)
                .register(NodeType.CALL, CallMutator::new)
                .register(NodeType.CALL_WITH_ARGUMENTS, CallWithArgumentsMutator::new)
                .register(NodeType.ASSIGNMENT, AssignmentMutator::new)
                .register(NodeType.LOCAL_VARIABLE, LocalVariableMutator::new)
                .register(NodeType.RETURN, ReturnMutator::new)
                .register(NodeType.IF, IfMutator::new)
                .register(NodeType.WHILE, WhileMutator::new)
                .register(NodeType.BLOCK, BlockMutator::new)
                .register(NodeType.METHOD, MethodMutator::new)
                .register(NodeType.OPAQUE, LeafMutator::new)
                .seal();
    }
}
