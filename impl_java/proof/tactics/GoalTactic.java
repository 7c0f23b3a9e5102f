package proof.tactics;

import fol.term.Term;
import proof.Proof;

import java.util.List;

/**
 * A modification rule: restructures the targets of a proof instead of adding a verified line.
 * <p>
 * Tactics run through {@link Proof#applyModificationRule}, which records the goal state beforehand and
 * restores it if the tactic throws. Inside a tactic the proof's goal mutators
 * ({@link Proof#addAssumption}, {@link Proof#addTarget}, {@link Proof#replaceActiveTarget}) may be used.
 */
@FunctionalInterface
public interface GoalTactic {
    void apply(Proof proof, List<Term> arguments);
}
