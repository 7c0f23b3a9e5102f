package proof.rules;

import fol.Language;
import fol.VariableCaptureException;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Predicate;
import fol.term.Term;
import proof.RuleViolationException;

import java.util.List;

/**
 * Universal elimination: from {@code (∀x ∈ D)(φ)} and {@code e ∈ D} conclude {@code φ[x := e]}.
 */
public class ForallRule implements RuleVerifier {
    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (dependencies.size() != 2) {
            throw new RuleViolationException("FORALL rule requires 2 inputs: a forall and a term membership fact");
        }
        if (!(dependencies.get(0) instanceof Forall forall)) {
            throw new RuleViolationException("First input must be a forall formula");
        }
        if (!(dependencies.get(1) instanceof Predicate membership)
                || !membership.symbol().equals(Language.Predicates.memberPSym)) {
            throw new RuleViolationException("Second input must be a membership relation (element ∈ domain)");
        }

        Term element = membership.args().get(0);
        Term factDomain = membership.args().get(1);
        if (!forall.domain().equals(factDomain)) {
            throw new RuleViolationException(
                    "Element's domain " + factDomain + " does not match forall domain " + forall.domain());
        }

        Formula instantiated;
        try {
            instantiated = forall.apply(element);
        } catch (VariableCaptureException e) {
            throw new RuleViolationException(e.getMessage(), e);
        }
        if (!instantiated.equals(claimed)) {
            throw new RuleViolationException("Claimed formula does not match derived formula", instantiated);
        }
        return claimed;
    }
}
