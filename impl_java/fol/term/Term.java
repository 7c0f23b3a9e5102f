package fol.term;

import fol.Language;
import fol.Substitution;

import java.util.Optional;
import java.util.Set;

public sealed interface Term permits Constant, Function, Tuple, Variable {
    Term applySub(Substitution substitution);

    /**
     * Replace every subterm structurally equal to {@code pattern} by {@code replacement}.
     * A matching node is replaced wholesale, its children are not visited.
     *
     * @param pattern     the subterm to look for
     * @param replacement the term put in its place
     * @return the rewritten term
     */
    Term replace(Term pattern, Term replacement);

    Set<Variable> vars();

    boolean contains(Variable var);

    /**
     * Check the term against the symbols and variable naming rule of a language.
     *
     * @param language the language to check against
     * @return the first violation found, or empty if the term is well formed
     */
    Optional<Language.Violation> checkWellFormed(Language language);
}
