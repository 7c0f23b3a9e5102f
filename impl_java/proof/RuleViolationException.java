package proof;

import fol.formula.Formula;

/**
 * A rule refused a claimed statement. Rules raise it with a detail message and, where they got that far,
 * the formula they derived; the proof attributes it to the cited rule name and the claim.
 */
public class RuleViolationException extends ProofException {
    private final String ruleName;
    private final Formula claimed;
    private final Formula derived;
    private final String detail;

    public RuleViolationException(String detail) {
        this(null, null, null, detail, null);
    }

    public RuleViolationException(String detail, Formula derived) {
        this(null, null, derived, detail, null);
    }

    public RuleViolationException(String detail, Throwable cause) {
        this(null, null, null, detail, cause);
    }

    public RuleViolationException(String ruleName, Formula claimed, Formula derived, String detail, Throwable cause) {
        super(buildMessage(ruleName, claimed, derived, detail), cause);
        this.ruleName = ruleName;
        this.claimed = claimed;
        this.derived = derived;
        this.detail = detail;
    }

    public RuleViolationException attribute(String ruleName, Formula claimed) {
        return new RuleViolationException(ruleName, claimed, derived, detail, this);
    }

    private static String buildMessage(String ruleName, Formula claimed, Formula derived, String detail) {
        StringBuilder sb = new StringBuilder();
        if (ruleName != null) {
            sb.append(ruleName).append(" rejected ").append(claimed).append(": ");
        }
        sb.append(detail);
        if (derived != null) {
            sb.append(" (derived ").append(derived).append(")");
        }
        return sb.toString();
    }

    public String getRuleName() {
        return ruleName;
    }

    public Formula getClaimed() {
        return claimed;
    }

    public Formula getDerived() {
        return derived;
    }

    public String getDetail() {
        return detail;
    }
}
