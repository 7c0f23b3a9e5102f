package fol;

public class MalformedTermException extends FolException {
    private final Language.Violation violation;

    public MalformedTermException(Language.Violation violation) {
        super("Malformed term: " + violation);
        this.violation = violation;
    }

    public Language.Violation getViolation() {
        return violation;
    }
}
