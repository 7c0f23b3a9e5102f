package proof;

import fol.formula.Formula;

import java.util.List;

public record ProofLine(Formula statement, String justification, List<Integer> dependencies) {
    public ProofLine {
        dependencies = List.copyOf(dependencies);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(statement).append("    [").append(justification);
        if (!dependencies.isEmpty()) {
            sb.append(" deps:");
            for (int d : dependencies) sb.append(' ').append(d);
        }
        return sb.append(']').toString();
    }
}
