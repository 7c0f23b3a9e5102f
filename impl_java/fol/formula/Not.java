package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Optional;
import java.util.Set;

public record Not(Formula formula) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new Not(formula.applySub(substitution));
    }

    @Override
    public Formula replace(Term pattern, Term replacement) {
        return new Not(formula.replace(pattern, replacement));
    }

    @Override
    public String toString() {
        return "(¬" + formula + ")";
    }

    @Override
    public Set<Variable> vars() {
        return formula.vars();
    }

    @Override
    public Set<Variable> freeVars() {
        return formula.freeVars();
    }

    @Override
    public boolean isFree(Variable var) {
        return formula.isFree(var);
    }

    @Override
    public boolean isSubstitutable(Variable var, Term term) {
        return formula.isSubstitutable(var, term);
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        return formula.checkWellFormed(language);
    }
}
