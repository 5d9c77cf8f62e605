package refsolver;

public class SolverException extends RuntimeException {

    public SolverException(String message) {
        super(message);
    }
}
