package proof.rules;

import fol.Language;
import fol.Substitution;
import fol.VariableCaptureException;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.term.Term;
import fol.term.Variable;
import proof.RuleViolationException;

import java.util.List;

/**
 * Induction over the naturals. From the base {@code P(0)} and the step
 * {@code (∀k ∈ D)(P(k) → P(k + 1))} conclude {@code (∀n ∈ D)(P(n))}.
 * <p>
 * The schema {@code P} is read off the antecedent of the step; the base and the consequent must be its
 * instances at {@code 0} and {@code k + 1}, where {@code k + 1} is the function application {@code +(k, 1)}.
 */
public class InductionRule implements RuleVerifier {
    private final String inductionVariable;

    public InductionRule(String inductionVariable) {
        this.inductionVariable = inductionVariable;
    }

    @Override
    public Formula verify(List<Formula> dependencies, Formula claimed) {
        if (dependencies.size() != 2) {
            throw new RuleViolationException("INDUCTION requires 2 inputs: base P(0) and step ∀k(P(k) → P(k+1))");
        }
        Formula base = dependencies.get(0);
        if (!(dependencies.get(1) instanceof Forall step)) {
            throw new RuleViolationException("Step must be a forall formula");
        }
        if (!(step.formula() instanceof Implies implies)) {
            throw new RuleViolationException("Step must be an implication (P(k) → P(k+1))");
        }

        Variable k = step.var();
        Formula pk = implies.left();

        Formula p0 = substitute(pk, k, Language.Constants.ZERO);
        if (!p0.equals(base)) {
            throw new RuleViolationException(String.format(
                    "Base mismatch: expected %s but got %s when substituting %s := 0 in %s", base, p0, k, pk), p0);
        }

        Formula pSucc = substitute(pk, k, Language.Functions.plus(k, Language.Constants.ONE));
        if (!implies.right().equals(pSucc)) {
            throw new RuleViolationException(String.format(
                    "Step conclusion mismatch: expected %s but got %s", pSucc, implies.right()), pSucc);
        }

        Variable n = new Variable(inductionVariable);
        if (!n.equals(k) && pk.isFree(n)) {
            throw new RuleViolationException(n + " is already free in " + pk);
        }
        Formula result = new Forall(n, step.domain(), substitute(pk, k, n));
        if (!result.equals(claimed)) {
            throw new RuleViolationException(
                    "Claimed " + claimed + " does not match derived " + result, result);
        }
        return claimed;
    }

    private static Formula substitute(Formula formula, Variable var, Term term) {
        try {
            return Substitution.of(var, term).apply(formula);
        } catch (VariableCaptureException e) {
            throw new RuleViolationException(e.getMessage(), e);
        }
    }
}
