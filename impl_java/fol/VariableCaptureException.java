package fol;

import fol.term.Term;
import fol.term.Variable;

/**
 * Raised when substituting {@code term} for {@code var} would bind a variable of {@code term}
 * under the quantifier of {@code binder}.
 */
public class VariableCaptureException extends FolException {
    private final Variable var;
    private final Term term;
    private final Variable binder;

    public VariableCaptureException(Variable var, Term term, Variable binder) {
        super(String.format("Substituting %s for %s would capture %s under its quantifier", term, var, binder));
        this.var = var;
        this.term = term;
        this.binder = binder;
    }

    public Variable getVar() {
        return var;
    }

    public Term getTerm() {
        return term;
    }

    public Variable getBinder() {
        return binder;
    }
}
