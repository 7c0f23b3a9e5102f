package proof;

import fol.formula.Formula;

public class NotAnEqualityException extends ProofException {
    private final int lineIndex;
    private final Formula statement;

    public NotAnEqualityException(int lineIndex, Formula statement) {
        super("Line " + lineIndex + " is not an equality: " + statement);
        this.lineIndex = lineIndex;
        this.statement = statement;
    }

    public int getLineIndex() {
        return lineIndex;
    }

    public Formula getStatement() {
        return statement;
    }
}
