package refsolver.parser;

import lombok.Getter;
import refsolver.CapacityExceededException;
import refsolver.linear.InequalitySystem;
import refsolver.linear.VarInfo;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A formula in disjunctive normal form: the OR of its clauses, each clause
 * a conjunctive {@link InequalitySystem}. An empty result denotes {@code false}.
 */
public class ParseResult {

    public static final int DEFAULT_MAX_CLAUSES = 8;

    @Getter
    private final List<InequalitySystem> clauses;
    @Getter
    private final int capacity;

    public ParseResult() {
        this(DEFAULT_MAX_CLAUSES);
    }

    public ParseResult(int capacity) {
        this(Collections.emptyList(), capacity);
    }

    public ParseResult(List<InequalitySystem> clauses, int capacity) {
        if (clauses.size() > capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.CLAUSES, capacity,
                    "DNF clause limit exceeded with " + clauses.size() + " clauses");
        }
        this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
        this.capacity = capacity;
    }

    public static ParseResult single(InequalitySystem system) {
        return single(system, DEFAULT_MAX_CLAUSES);
    }

    public static ParseResult single(InequalitySystem system, int capacity) {
        return new ParseResult(Collections.singletonList(system), capacity);
    }

    public ParseResult addClause(InequalitySystem system) {
        if (clauses.size() >= capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.CLAUSES, capacity,
                    "DNF clause limit exceeded");
        }
        List<InequalitySystem> newClauses = new ArrayList<>(clauses);
        newClauses.add(system);
        return new ParseResult(newClauses, capacity);
    }

    public int clauseCount() {
        return clauses.size();
    }

    public InequalitySystem clause(int idx) {
        return clauses.get(idx);
    }

    public boolean isConjunctive() {
        return clauses.size() == 1;
    }

    /**
     * The single clause of a conjunctive formula.
     * @throws IllegalStateException if the formula has zero or several clauses
     */
    public InequalitySystem system() {
        if (!isConjunctive()) {
            throw new IllegalStateException("not a conjunctive formula: " + clauses.size() + " clauses");
        }
        return clauses.get(0);
    }

    public ParseResult withVars(VarInfo vars) {
        return new ParseResult(clauses.stream().map(c -> c.withVars(vars)).collect(Collectors.toList()), capacity);
    }

    @Override
    public String toString() {
        return "Disjunctive of " + clauses;
    }
}
