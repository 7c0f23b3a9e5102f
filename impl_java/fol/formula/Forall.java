package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Optional;
import java.util.Set;

/**
 * {@code (∀var ∈ domain)(formula)}. The domain is opaque to substitution and variable analysis.
 */
public record Forall(Variable var, Term domain, Formula formula) implements Formula {

    @Override
    public Formula applySub(Substitution substitution) {
        // Avoid substituting the bound variable
        Substitution pruned = substitution.without(var);
        if (pruned.isEmpty()) return this;
        pruned.checkCapture(var, formula);
        return new Forall(var, domain, formula.applySub(pruned));
    }

    /**
     * Instantiate the body with {@code t} in place of the bound variable.
     */
    public Formula apply(Term t) {
        return Substitution.of(var, t).apply(formula);
    }

    @Override
    public Formula replace(Term pattern, Term replacement) {
        return new Forall(var, domain, formula.replace(pattern, replacement));
    }

    @Override
    public String toString() {
        return "(∀" + var + " ∈ " + domain + ")(" + formula + ")";
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = formula.vars();
        out.add(var);
        return out;
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = formula.freeVars();
        out.remove(var);
        return out;
    }

    @Override
    public boolean isFree(Variable v) {
        return !var.equals(v) && formula.isFree(v);
    }

    @Override
    public boolean isSubstitutable(Variable v, Term term) {
        if (!isFree(v)) return true;
        return !term.contains(var) && formula.isSubstitutable(v, term);
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        if (!language.isVariable(var.name())) {
            return Optional.of(new Language.Violation("bad forall var", this));
        }
        return formula.checkWellFormed(language);
    }
}
