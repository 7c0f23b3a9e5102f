package proof.rules;

import fol.formula.And;
import fol.formula.Formula;
import proof.RuleViolationException;

import java.util.List;

public class AndRule implements RuleVerifier {
    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (dependencies.size() != 2) {
            throw new RuleViolationException("AND rule needs 2 inputs, got " + dependencies.size());
        }
        Formula expected = new And(dependencies.get(0), dependencies.get(1));
        if (!expected.equals(claimed)) {
            throw new RuleViolationException("Claimed does not match AND result", expected);
        }
        return claimed;
    }
}
