package proof.rules;

import fol.formula.Formula;
import fol.formula.Not;
import fol.formula.Or;
import proof.RuleViolationException;

import java.util.List;

public class ExcludedMiddleRule implements RuleVerifier {
    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (!dependencies.isEmpty()) {
            throw new RuleViolationException("LEM requires no inputs");
        }
        if (!(claimed instanceof Or or)) {
            throw new RuleViolationException("LEM: claimed formula is not an OR");
        }
        if (!(or.right() instanceof Not not)) {
            throw new RuleViolationException("LEM: right-hand side is not a NOT");
        }
        if (!or.left().equals(not.formula())) {
            throw new RuleViolationException("LEM: must be of the form (P ∨ ¬P)");
        }
        return claimed;
    }
}
