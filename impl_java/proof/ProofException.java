package proof;

/**
 * Base class for a proof step or goal tactic that cannot be carried out. A failed operation leaves the
 * {@link Proof} exactly as it was.
 */
public class ProofException extends RuntimeException {
    public ProofException(String message) {
        super(message);
    }

    public ProofException(String message, Throwable cause) {
        super(message, cause);
    }
}
