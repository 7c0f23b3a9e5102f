package proof.rules;

import fol.formula.Equals;
import fol.formula.Formula;
import proof.RuleViolationException;

import java.util.List;

public class EqRule implements RuleVerifier {
    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (!dependencies.isEmpty()) {
            throw new RuleViolationException("EQ rule takes no inputs");
        }
        if (!(claimed instanceof Equals eq)) {
            throw new RuleViolationException("Claimed formula is not an equality");
        }
        if (!eq.left().equals(eq.right())) {
            throw new RuleViolationException("Left and right sides of equality are not equal");
        }
        return claimed;
    }
}
