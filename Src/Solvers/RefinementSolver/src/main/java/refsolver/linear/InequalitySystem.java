package refsolver.linear;

import lombok.Getter;
import refsolver.CapacityExceededException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An immutable conjunction of linear inequalities over one variable registry.
 *
 * {@link #add(LinearInequality)} returns a new system; the receiver is never modified.
 * The registry is snapshotted on construction, so register every variable before
 * building the system.
 */
public class InequalitySystem {

    public static final int DEFAULT_MAX_INEQS = 64;

    @Getter
    private final List<LinearInequality> inequalities;
    private final VarInfo vars;
    @Getter
    private final int capacity;

    public InequalitySystem() {
        this(new VarInfo());
    }

    public InequalitySystem(VarInfo vars) {
        this(vars, DEFAULT_MAX_INEQS);
    }

    public InequalitySystem(VarInfo vars, int capacity) {
        this(vars, Collections.emptyList(), capacity);
    }

    public InequalitySystem(VarInfo vars, List<LinearInequality> inequalities, int capacity) {
        if (inequalities.size() > capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.INEQUALITIES, capacity,
                    "inequality system holds " + inequalities.size() + " inequalities");
        }
        this.vars = vars.copy();
        this.inequalities = Collections.unmodifiableList(new ArrayList<>(inequalities));
        this.capacity = capacity;
    }

    public InequalitySystem add(LinearInequality ineq) {
        if (inequalities.size() >= capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.INEQUALITIES, capacity,
                    "cannot add inequality " + ineq);
        }
        List<LinearInequality> newIneqs = new ArrayList<>(inequalities);
        newIneqs.add(ineq);
        return new InequalitySystem(vars, newIneqs, capacity);
    }

    public InequalitySystem withVars(VarInfo newVars) {
        return new InequalitySystem(newVars, inequalities, capacity);
    }

    // copy, so callers cannot register into this system
    public VarInfo getVars() {
        return vars.copy();
    }

    public int size() {
        return inequalities.size();
    }

    public int varCount() {
        return vars.size();
    }

    public boolean isIntegerVar(int varId) {
        return vars.isInteger(varId);
    }

    public String varName(int varId) {
        return vars.getName(varId);
    }

    public Optional<Integer> findVar(String name) {
        return vars.find(name);
    }

    @Override
    public String toString() {
        return inequalities.stream().map(i -> i.toString(vars)).collect(Collectors.joining(" && ", "{", "}"));
    }
}
