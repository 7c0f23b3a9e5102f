package fol.term;

import fol.Language;
import fol.Substitution;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

public record Variable(String name) implements Term {

    public Variable {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name must not be empty");
        }
    }

    /**
     * Pick a variable named {@code base}, or {@code base1}, {@code base2}, ... if the plain name is taken.
     *
     * @param base  preferred name
     * @param taken variables the result must differ from
     * @return a variable not contained in {@code taken}
     */
    public static Variable fresh(String base, Set<Variable> taken) {
        Variable candidate = new Variable(base);
        int num = 0;
        while (taken.contains(candidate)) {
            ++num;
            candidate = new Variable(base + num);
        }
        return candidate;
    }

    @Override
    public Term applySub(Substitution substitution) {
        return substitution.getOrDefault(this, this);
    }

    @Override
    public Term replace(Term pattern, Term replacement) {
        return equals(pattern) ? replacement : this;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public Set<Variable> vars() {
        return new HashSet<>(Set.of(this));
    }

    @Override
    public boolean contains(Variable var) {
        return equals(var);
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        if (!language.isVariable(name)) {
            return Optional.of(new Language.Violation("bad variable name", this));
        }
        return Optional.empty();
    }
}
