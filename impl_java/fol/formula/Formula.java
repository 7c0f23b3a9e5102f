package fol.formula;

import fol.Language;
import fol.Substitution;
import fol.term.Term;
import fol.term.Variable;

import java.util.Optional;
import java.util.Set;

public sealed interface Formula permits Equals, Predicate, Not, Or, And, Implies, Forall, Exists {

    /**
     * Replace the free occurrences of the substitution's variables.
     *
     * @throws fol.VariableCaptureException if a substituted term would be captured by a quantifier
     */
    Formula applySub(Substitution substitution);

    /**
     * Rewrite every subterm structurally equal to {@code pattern} into {@code replacement}.
     * Quantifier binders and domains are left alone and no capture check is made.
     */
    Formula replace(Term pattern, Term replacement);

    /**
     * Get every variable of the formula, bound or free, including quantifier binders.
     * @return set of all variables in the current formula
     */
    Set<Variable> vars();

    /**
     * Get a set of the current free variables inside the formula
     * @return set of free variables in the current formula
     */
    Set<Variable> freeVars();

    boolean isFree(Variable var);

    /**
     * Whether {@code term} can replace the free occurrences of {@code var} without one of its variables
     * becoming bound by a quantifier of this formula.
     */
    boolean isSubstitutable(Variable var, Term term);

    Optional<Language.Violation> checkWellFormed(Language language);

    default boolean isSentence() {
        return vars().stream().noneMatch(this::isFree);
    }
}
