package proof.rules;

import fol.formula.Formula;
import proof.RuleViolationException;

import java.util.List;
import java.util.function.Supplier;

public class AssumptionRule implements RuleVerifier {
    private final Supplier<List<Formula>> assumptions;

    public AssumptionRule(Supplier<List<Formula>> assumptions) {
        this.assumptions = assumptions;
    }

    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (!assumptions.get().contains(claimed)) {
            throw new RuleViolationException("Invalid assumption: " + claimed);
        }
        return claimed;
    }
}
