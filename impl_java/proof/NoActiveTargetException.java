package proof;

public class NoActiveTargetException extends ProofException {
    public NoActiveTargetException(String operation) {
        super(operation + ": no targets left, the proof is complete");
    }
}
