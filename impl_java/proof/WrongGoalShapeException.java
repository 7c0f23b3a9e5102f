package proof;

import fol.formula.Formula;

public class WrongGoalShapeException extends ProofException {
    private final String tactic;
    private final Formula target;

    public WrongGoalShapeException(String tactic, String expectedShape, Formula target) {
        super(String.format("%s: active target is not %s: %s", tactic, expectedShape, target));
        this.tactic = tactic;
        this.target = target;
    }

    public String getTactic() {
        return tactic;
    }

    public Formula getTarget() {
        return target;
    }
}
