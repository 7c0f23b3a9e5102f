package proof.rules;

import fol.formula.Formula;

import java.util.List;

@FunctionalInterface
public interface RuleVerifier {

    /**
     * Returns the derived statement; the line is accepted only if it equals {@code claimed}.
     * Verifiers never change the proof they are registered on.
     */
    Formula verify(List<Formula> dependencies, Formula claimed);
}
