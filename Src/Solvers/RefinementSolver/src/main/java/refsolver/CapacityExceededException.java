package refsolver;

import lombok.Getter;

/**
 * Thrown when a formula does not fit in the configured size envelope.
 */
public class CapacityExceededException extends SolverException {

    public enum Limit {
        VARIABLES,
        INEQUALITIES,
        CLAUSES,
        TERMS_PER_INEQUALITY,
        CONSTRAINTS
    }

    @Getter
    private final Limit limit;
    @Getter
    private final int capacity;

    public CapacityExceededException(Limit limit, int capacity, String message) {
        super(message + " (" + limit + " capacity " + capacity + ")");
        this.limit = limit;
        this.capacity = capacity;
    }
}
