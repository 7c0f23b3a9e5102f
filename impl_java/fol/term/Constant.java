package fol.term;

import fol.Language;
import fol.Substitution;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

public record Constant(String name) implements Term {

    public Constant {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Constant name must not be empty");
        }
    }

    @Override
    public Term applySub(Substitution substitution) {
        return this;
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
        return new HashSet<>();
    }

    @Override
    public boolean contains(Variable var) {
        return false;
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        if (!language.isConstant(name)) {
            return Optional.of(new Language.Violation("bad constant", this));
        }
        return Optional.empty();
    }
}
