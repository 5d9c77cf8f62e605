package refsolver.types;

import lombok.Getter;
import refsolver.CapacityExceededException;
import refsolver.formula.Formula;
import refsolver.solver.Solver;

import java.util.*;
import java.util.stream.Collectors;

public class ConstraintSet {

    public static final int DEFAULT_MAX_CONSTRAINTS = 32;

    @Getter
    private final List<Constraint> constraints;
    @Getter
    private final int capacity;

    public ConstraintSet() {
        this(DEFAULT_MAX_CONSTRAINTS);
    }

    public ConstraintSet(int capacity) {
        this(Collections.emptyList(), capacity);
    }

    private ConstraintSet(List<Constraint> constraints, int capacity) {
        this.constraints = Collections.unmodifiableList(constraints);
        this.capacity = capacity;
    }

    public ConstraintSet add(Formula formula, String origin) {
        if (constraints.size() >= capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.CONSTRAINTS, capacity,
                    "ConstraintSet capacity exceeded");
        }
        List<Constraint> result = new ArrayList<>(constraints);
        result.add(new Constraint(formula, origin));
        return new ConstraintSet(result, capacity);
    }

    public ConstraintSet merge(ConstraintSet other) {
        if (constraints.size() + other.size() > capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.CONSTRAINTS, capacity,
                    "ConstraintSet capacity exceeded on merge");
        }
        List<Constraint> result = new ArrayList<>(constraints);
        result.addAll(other.constraints);
        return new ConstraintSet(result, capacity);
    }

    public int size() {
        return constraints.size();
    }

    public List<Constraint> violated(Solver solver) {
        return constraints.stream().filter(c -> !solver.isValid(c.getFormula())).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return constraints.toString();
    }
}
