package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Optional;
import java.util.Set;

public record And(Formula left, Formula right) implements Formula {
    @Override
    public Formula applySub(Substitution substitution) {
        return new And(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public Formula replace(Term pattern, Term replacement) {
        return new And(left.replace(pattern, replacement), right.replace(pattern, replacement));
    }

    @Override
    public String toString() {
        return "(" + left + " ∧ " + right + ")";
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = left.vars();
        out.addAll(right.vars());
        return out;
    }

    @Override
    public Set<Variable> freeVars() {
        Set<Variable> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }

    @Override
    public boolean isFree(Variable var) {
        return left.isFree(var) || right.isFree(var);
    }

    @Override
    public boolean isSubstitutable(Variable var, Term term) {
        return left.isSubstitutable(var, term) && right.isSubstitutable(var, term);
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        return left.checkWellFormed(language).or(() -> right.checkWellFormed(language));
    }
}
