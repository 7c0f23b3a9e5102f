package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Optional;
import java.util.Set;

/**
 * {@code left = right}. Not commutative: {@code a = b} and {@code b = a} are different formulas.
 */
public record Equals(Term left, Term right) implements Formula {
    public Equals {
        if (left == null || right == null) {
            throw new IllegalArgumentException("Both sides of an equality are required");
        }
    }

    @Override
    public Formula applySub(Substitution substitution) {
        return new Equals(left.applySub(substitution), right.applySub(substitution));
    }

    @Override
    public Formula replace(Term pattern, Term replacement) {
        return new Equals(left.replace(pattern, replacement), right.replace(pattern, replacement));
    }

    @Override
    public String toString() {
        return "(" + left + " = " + right + ")";
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = left.vars();
        out.addAll(right.vars());
        return out;
    }

    @Override
    public Set<Variable> freeVars() {
        return vars();
    }

    @Override
    public boolean isFree(Variable var) {
        return left.contains(var) || right.contains(var);
    }

    @Override
    public boolean isSubstitutable(Variable var, Term term) {
        return true;
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        return left.checkWellFormed(language).or(() -> right.checkWellFormed(language));
    }
}
