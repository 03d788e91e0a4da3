package mutant.mutators;

/**
 * A random generator passed to {@link Mutator#emitNew} kept reproducing the
 * original node.
 */
public class GenerationExhaustedException extends MutationException {

    private final int attempts;

    public GenerationExhaustedException(int attempts) {
        super("New AST could not be generated after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
