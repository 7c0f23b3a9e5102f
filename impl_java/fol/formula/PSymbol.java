package fol.formula;

public record PSymbol(String name, int arity) {
    public PSymbol {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Predicate symbol must have a name");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("Negative arity for " + name + ": " + arity);
        }
    }

    public String toString() {
        return name + "\\" + arity;
    }
}
