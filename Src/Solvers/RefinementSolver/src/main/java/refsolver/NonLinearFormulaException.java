package refsolver;

import lombok.Getter;

/**
 * Thrown when a predicate cannot be represented in the linear fragment.
 */
public class NonLinearFormulaException extends SolverException {

    public enum Kind {
        NON_LINEAR_MULTIPLICATION,
        NON_LINEAR_DIVISION,
        DIVISION_BY_ZERO
    }

    @Getter
    private final Kind kind;

    public NonLinearFormulaException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
