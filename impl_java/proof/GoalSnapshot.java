package proof;

import fol.formula.Formula;

import java.util.List;

public record GoalSnapshot(List<Formula> targets, int activeTargetIndex, int assumptionCount) {
    public GoalSnapshot {
        targets = List.copyOf(targets);
    }
}
