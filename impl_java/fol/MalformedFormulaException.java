package fol;

public class MalformedFormulaException extends FolException {
    private final Language.Violation violation;

    public MalformedFormulaException(Language.Violation violation) {
        super("Malformed formula: " + violation);
        this.violation = violation;
    }

    public Language.Violation getViolation() {
        return violation;
    }
}
