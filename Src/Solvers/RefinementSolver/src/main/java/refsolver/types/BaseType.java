package refsolver.types;

/**
 * Unrefined base types, ordered by widening: {@code BOOL <: INT <: REAL}.
 */
public enum BaseType implements Type {
    BOOL,
    INT,
    REAL;

    public boolean widensTo(BaseType wider) {
        return this.compareTo(wider) < 0;
    }

    public boolean compatibleWith(BaseType wider) {
        return this == wider || widensTo(wider);
    }

    public boolean isIntegral() {
        return this != REAL;
    }

    @Override
    public String toString() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
