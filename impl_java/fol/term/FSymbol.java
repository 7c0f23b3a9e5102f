package fol.term;

public record FSymbol(String name, int arity) {
    public FSymbol {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function symbol must have a name");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("Negative arity for " + name + ": " + arity);
        }
    }

    public String toString() {
        return name + "\\" + arity;
    }
}
