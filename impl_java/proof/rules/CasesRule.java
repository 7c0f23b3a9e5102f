package proof.rules;

import fol.formula.Formula;
import fol.formula.Implies;
import fol.formula.Not;
import proof.RuleViolationException;

import java.util.List;

/**
 * Proof by cases: from {@code f → t} and {@code ¬f → t} conclude {@code t}. The negated case may be cited
 * first or second.
 */
public class CasesRule implements RuleVerifier {
    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (dependencies.size() != 2) {
            throw new RuleViolationException("CASES requires 2 inputs: (f -> t) and (¬f -> t)");
        }
        if (!(dependencies.get(0) instanceof Implies first)) {
            throw new RuleViolationException("CASES: first input must be an implication");
        }
        if (!(dependencies.get(1) instanceof Implies second)) {
            throw new RuleViolationException("CASES: second input must be an implication");
        }
        if (!first.right().equals(claimed) || !second.right().equals(claimed)) {
            throw new RuleViolationException("CASES: both implications must derive the claimed formula");
        }

        boolean complementary = second.left().equals(new Not(first.left()))
                || first.left().equals(new Not(second.left()));
        if (!complementary) {
            throw new RuleViolationException("CASES: mismatched f and ¬f assumptions: "
                    + first.left() + " and " + second.left());
        }
        return claimed;
    }
}
