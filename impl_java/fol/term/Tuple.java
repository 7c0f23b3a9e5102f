package fol.term;

import fol.Language;
import fol.Substitution;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered sequence of terms, shaped like a function application without a symbol.
 */
public record Tuple(List<Term> elements) implements Term {

    public Tuple {
        elements = List.copyOf(elements);
    }

    @Override
    public Term applySub(Substitution substitution) {
        return new Tuple(elements.stream().map(t -> t.applySub(substitution)).toList());
    }

    @Override
    public Term replace(Term pattern, Term replacement) {
        if (equals(pattern)) return replacement;
        return new Tuple(elements.stream().map(t -> t.replace(pattern, replacement)).toList());
    }

    @Override
    public String toString() {
        return "(" + String.join(", ", elements.stream().map(Object::toString).toArray(String[]::new)) + ")";
    }

    @Override
    public Set<Variable> vars() {
        Set<Variable> out = new HashSet<>();
        for (Term t : elements) out.addAll(t.vars());
        return out;
    }

    @Override
    public boolean contains(Variable var) {
        return elements.stream().anyMatch(t -> t.contains(var));
    }

    @Override
    public Optional<Language.Violation> checkWellFormed(Language language) {
        for (Term element : elements) {
            var violation = element.checkWellFormed(language);
            if (violation.isPresent()) return violation;
        }
        return Optional.empty();
    }
}
