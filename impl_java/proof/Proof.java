package proof;

import fol.Language;
import fol.formula.Equals;
import fol.formula.Forall;
import fol.formula.Formula;
import fol.formula.Implies;
import fol.term.Term;
import fol.term.Variable;
import proof.rules.RuleVerifier;
import proof.rules.Rules;
import proof.tactics.GoalTactic;
import proof.tactics.Tactics;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * An interactive proof of one target from a list of assumptions.
 * <p>
 * Lines are added with {@link #addLine}; each is checked by the rule it cites against the statements of
 * the lines it depends on. A line equal to an outstanding target discharges it. Goal tactics such as
 * {@link #instantiateForall} or {@link #instantiateInduction} reshape the active target instead, possibly
 * adding assumptions and further targets. The proof is valid once no targets remain.
 * <p>
 * Not thread safe: a proof is meant to be written by one caller, step by step.
 */
public class Proof {

    private static final Logger LOGGER = Logger.getLogger(Proof.class.getName());

    private final List<ProofLine> lines;
    private final List<Formula> assumptions;

    // things that have to be proven during the course of this proof
    private final List<Formula> targets;
    private int activeTargetIdx = 0;

    // goal states before each tactic, oldest first
    private final List<GoalSnapshot> targetHistory;

    private final Map<String, RuleVerifier> rules;
    private final Map<String, GoalTactic> targetRules;
    private final ProofOptions options;

    private int tacticDepth = 0;

    public Proof(List<Formula> assumptions, Formula target) {
        this(assumptions, target, ProofOptions.defaults());
    }

    public Proof(List<Formula> assumptions, Formula target, ProofOptions options) {
        Objects.requireNonNull(target, "target");
        this.options = Objects.requireNonNull(options, "options");
        options.enforcedLanguage().ifPresent(language -> {
            assumptions.forEach(language::requireWellFormed);
            language.requireWellFormed(target);
        });

        this.lines = new ArrayList<>();
        this.assumptions = new ArrayList<>(assumptions);
        this.targets = new ArrayList<>(List.of(target));
        this.targetHistory = new ArrayList<>();
        this.rules = new HashMap<>();
        this.targetRules = new HashMap<>();

        if (options.builtinRules()) {
            Rules.registerDefaults(this);
        }
        Tactics.registerDefaults(this);
        LOGGER.fine(() -> "New proof of " + target + " from " + this.assumptions.size() + " assumptions");
    }

    public void registerRule(String name, RuleVerifier rule) {
        rules.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(rule, "rule"));
    }

    public void registerModificationRule(String name, GoalTactic tactic) {
        targetRules.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(tactic, "tactic"));
    }

    public boolean hasRule(String name) {
        return rules.containsKey(name);
    }

    public boolean hasModificationRule(String name) {
        return targetRules.containsKey(name);
    }

    public int addLine(Formula claimed, String ruleName, int... deps) {
        return addLine(claimed, ruleName, Arrays.stream(deps).boxed().toList());
    }

    /**
     * Add a line justified by {@code ruleName} applied to the statements of the lines in {@code deps}.
     * If the statement equals an outstanding target, the first such target is discharged.
     *
     * @param claimed  the statement of the new line
     * @param ruleName name of a registered rule
     * @param deps     indexes of earlier lines, in the order the rule expects them
     * @return the index of the new line
     * @throws UnknownRuleException        if no rule is registered under {@code ruleName}
     * @throws InvalidDependencyException  if an index does not refer to an existing line
     * @throws RuleViolationException      if the rule does not derive {@code claimed}
     */
    public int addLine(Formula claimed, String ruleName, List<Integer> deps) {
        Objects.requireNonNull(claimed, "claimed");
        RuleVerifier rule = rules.get(ruleName);
        if (rule == null) {
            throw new UnknownRuleException(ruleName);
        }

        // Gather dependency statements
        List<Formula> depStatements = new ArrayList<>(deps.size());
        for (int idx : deps) {
            if (idx < 0 || idx >= lines.size()) {
                throw new InvalidDependencyException(idx, lines.size());
            }
            depStatements.add(lines.get(idx).statement());
        }
        options.enforcedLanguage().ifPresent(language -> language.requireWellFormed(claimed));

        LOGGER.finest(() -> "Checking " + claimed + " with " + ruleName + " on " + depStatements);
        Formula derived;
        try {
            derived = rule.verify(depStatements, claimed);
        } catch (RuleViolationException e) {
            throw e.attribute(ruleName, claimed);
        }
        if (!claimed.equals(derived)) {
            throw new RuleViolationException(ruleName, claimed, derived,
                    "Claimed statement does not match derived statement", null);
        }

        lines.add(new ProofLine(claimed, ruleName, deps));
        int index = lines.size() - 1;
        LOGGER.fine(() -> "Line (" + index + ") " + lines.get(index));

        dischargeTarget(claimed);
        return index;
    }

    private void dischargeTarget(Formula statement) {
        int i = targets.indexOf(statement);
        if (i < 0) return;
        targets.remove(i);
        if (activeTargetIdx >= i && activeTargetIdx > 0) {
            --activeTargetIdx;
        }
        LOGGER.fine(() -> "Target " + statement + " completed, " + targets.size() + " remaining");
        if (targets.isEmpty()) {
            LOGGER.info("All targets completed, the proof is valid");
        }
    }

    public void instantiateForall() {
        instantiateForall(null);
    }

    /**
     * Specialise an active target {@code (∀v ∈ D)(φ)} to {@code φ[v := witness]} and assume
     * {@code witness ∈ D}.
     *
     * @param witness the term to instantiate with, or null for a fresh variable named after the bound one
     * @throws fol.VariableCaptureException if {@code witness} would be captured inside {@code φ}
     */
    public void instantiateForall(Term witness) {
        transformGoal("instantiate forall", () -> {
            Forall forall = activeTargetAs(Forall.class, "instantiate forall", "a forall formula");
            Term chosen = witness != null ? witness : freshWitness(forall);
            Formula newGoal = forall.apply(chosen);
            addAssumption(Language.Predicates.member(chosen, forall.domain()));
            replaceActiveTarget(newGoal);
        });
    }

    private Variable freshWitness(Forall forall) {
        Set<Variable> taken = new HashSet<>(forall.formula().vars());
        taken.remove(forall.var());
        assumptions.forEach(a -> taken.addAll(a.freeVars()));
        targets.forEach(t -> taken.addAll(t.freeVars()));
        return Variable.fresh(forall.var().name(), taken);
    }

    public void instantiateImplication() {
        transformGoal("instantiate implication", () -> {
            Implies implies = activeTargetAs(Implies.class, "instantiate implication", "an implication");
            addAssumption(implies.left());
            replaceActiveTarget(implies.right());
        });
    }

    /**
     * Split an active target {@code (∀v ∈ D)(P(v))} into the base case {@code P(0)}, which stays active, and
     * the step case {@code (∀k ∈ D)(P(k) → P(k + 1))}, appended as a new target.
     */
    public void instantiateInduction() {
        transformGoal("instantiate induction", () -> {
            Forall forall = activeTargetAs(Forall.class, "instantiate induction", "a forall formula");
            Set<Variable> taken = new HashSet<>(forall.formula().vars());
            taken.remove(forall.var());
            Variable k = Variable.fresh(options.stepVariable(), taken);

            Formula base = forall.apply(Language.Constants.ZERO);
            Formula pk = forall.apply(k);
            Formula pSucc = forall.apply(Language.Functions.plus(k, Language.Constants.ONE));
            Formula step = new Forall(k, forall.domain(), new Implies(pk, pSucc));

            replaceActiveTarget(base);
            addTarget(step);
        });
    }

    /**
     * Rewrite the active target with the equality proved on line {@code equalityLine}: every occurrence of
     * its left-hand side becomes its right-hand side.
     *
     * @throws InvalidDependencyException if there is no such line
     * @throws NotAnEqualityException     if the line does not state an equality
     */
    public void rewriteTargetUsingEquality(int equalityLine) {
        transformGoal("rewrite target", () -> {
            if (equalityLine < 0 || equalityLine >= lines.size()) {
                throw new InvalidDependencyException(equalityLine, lines.size());
            }
            Formula statement = lines.get(equalityLine).statement();
            if (!(statement instanceof Equals eq)) {
                throw new NotAnEqualityException(equalityLine, statement);
            }
            replaceActiveTarget(getActiveTarget().replace(eq.left(), eq.right()));
        });
    }

    public void applyModificationRule(String name, Term... arguments) {
        applyModificationRule(name, List.of(arguments));
    }

    /**
     * Run a registered tactic on this proof.
     *
     * @throws UnknownRuleException if no tactic is registered under {@code name}
     */
    public void applyModificationRule(String name, List<Term> arguments) {
        GoalTactic tactic = targetRules.get(name);
        if (tactic == null) {
            throw new UnknownRuleException(name);
        }
        List<Term> args = List.copyOf(arguments);
        transformGoal(name, () -> tactic.apply(this, args));
    }

    /**
     * Restore the goal state from before the most recent tactic. Proof lines are kept.
     *
     * @return false if no tactic has been applied
     */
    public boolean undoTactic() {
        if (targetHistory.isEmpty()) return false;
        GoalSnapshot snapshot = targetHistory.remove(targetHistory.size() - 1);
        restore(snapshot);
        LOGGER.fine(() -> "Undid tactic, " + targets.size() + " targets outstanding");
        return true;
    }

    public void focusTarget(int index) {
        if (targets.isEmpty()) {
            throw new NoActiveTargetException("focus target");
        }
        Objects.checkIndex(index, targets.size());
        activeTargetIdx = index;
    }

    // ---------- goal mutators for tactics ----------

    public void addAssumption(Formula assumption) {
        requireInsideTactic("addAssumption");
        assumptions.add(Objects.requireNonNull(assumption, "assumption"));
    }

    public void addTarget(Formula target) {
        requireInsideTactic("addTarget");
        targets.add(Objects.requireNonNull(target, "target"));
    }

    public void replaceActiveTarget(Formula target) {
        requireInsideTactic("replaceActiveTarget");
        if (targets.isEmpty()) {
            throw new NoActiveTargetException("replaceActiveTarget");
        }
        targets.set(activeTargetIdx, Objects.requireNonNull(target, "target"));
    }

    private void requireInsideTactic(String operation) {
        if (tacticDepth == 0) {
            throw new IllegalStateException(operation + " may only be called from a goal tactic");
        }
    }

    private <T extends Formula> T activeTargetAs(Class<T> shape, String tactic, String expected) {
        Formula target = getActiveTarget();
        if (!shape.isInstance(target)) {
            throw new WrongGoalShapeException(tactic, expected, target);
        }
        return shape.cast(target);
    }

    private void transformGoal(String tactic, Runnable transformation) {
        if (targets.isEmpty()) {
            throw new NoActiveTargetException(tactic);
        }
        GoalSnapshot before = snapshot();
        tacticDepth++;
        try {
            transformation.run();
        } catch (RuntimeException e) {
            restore(before);
            throw e;
        } finally {
            tacticDepth--;
        }
        if (tacticDepth == 0) {
            targetHistory.add(before);
            LOGGER.fine(() -> tactic + ": active target is now " + targets.get(activeTargetIdx)
                    + ", " + targets.size() + " targets outstanding");
        }
    }

    private GoalSnapshot snapshot() {
        return new GoalSnapshot(targets, activeTargetIdx, assumptions.size());
    }

    private void restore(GoalSnapshot snapshot) {
        targets.clear();
        targets.addAll(snapshot.targets());
        activeTargetIdx = snapshot.activeTargetIndex();
        assumptions.subList(snapshot.assumptionCount(), assumptions.size()).clear();
    }

    // ---------- inspection ----------

    public Formula getActiveTarget() {
        if (targets.isEmpty()) {
            throw new NoActiveTargetException("active target");
        }
        return targets.get(activeTargetIdx);
    }

    public int getActiveTargetIndex() {
        return activeTargetIdx;
    }

    public List<Formula> getTargets() {
        return List.copyOf(targets);
    }

    public List<Formula> getAssumptions() {
        return List.copyOf(assumptions);
    }

    public List<ProofLine> getLines() {
        return List.copyOf(lines);
    }

    public List<GoalSnapshot> getTargetHistory() {
        return List.copyOf(targetHistory);
    }

    public ProofOptions getOptions() {
        return options;
    }

    public boolean isValid() {
        return targets.isEmpty();
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("===== Proof State =====\n");

        sb.append("Assumptions:\n");
        for (int i = 0; i < assumptions.size(); ++i) {
            sb.append("  [").append(i).append("] ").append(assumptions.get(i)).append('\n');
        }

        sb.append("Proof Lines:\n");
        for (int i = 0; i < lines.size(); ++i) {
            sb.append("  (").append(i).append(") ").append(lines.get(i)).append('\n');
        }

        sb.append("Targets (").append(targets.size()).append(" remaining):\n");
        for (int i = 0; i < targets.size(); ++i) {
            sb.append("  [").append(i).append("] ").append(targets.get(i));
            if (i == activeTargetIdx) {
                sb.append("   <-- active goal");
            }
            sb.append('\n');
        }
        if (targets.isEmpty()) {
            sb.append("  <all targets completed>\n");
        }

        sb.append("=======================\n");
        return sb.toString();
    }

    public void print(PrintStream out) {
        out.print(describe());
    }

    @Override
    public String toString() {
        return describe();
    }
}
