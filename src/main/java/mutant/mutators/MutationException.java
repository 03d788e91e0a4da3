package mutant.mutators;

/**
 * Base of the failures raised by the mutation engine itself. Exceptions thrown by
 * a concrete mutator's own logic are not wrapped.
 */
public class MutationException extends RuntimeException {

    public MutationException(String message) {
        super(message);
    }
}
