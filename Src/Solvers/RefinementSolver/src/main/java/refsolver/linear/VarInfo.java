package refsolver.linear;

import lombok.Getter;
import refsolver.CapacityExceededException;

import java.util.*;

/**
 * Registry mapping variable names to dense ids, with an integer/real flag per variable.
 *
 * Ids are positions in registration order. A registry belongs to one parse; use
 * {@link #copy()} before handing it to anything that may register more names.
 */
public class VarInfo {

    public static final int DEFAULT_MAX_VARS = 16;

    private final List<String> names;
    private final List<Boolean> integer;
    @Getter
    private final int capacity;

    public VarInfo() {
        this(DEFAULT_MAX_VARS);
    }

    public VarInfo(int capacity) {
        this.names = new ArrayList<>();
        this.integer = new ArrayList<>();
        this.capacity = capacity;
    }

    private VarInfo(VarInfo old) {
        this.names = new ArrayList<>(old.names);
        this.integer = new ArrayList<>(old.integer);
        this.capacity = old.capacity;
    }

    public VarInfo copy() {
        return new VarInfo(this);
    }

    public int findOrAdd(String name) {
        return findOrAdd(name, true);
    }

    // an existing registration keeps its first domain
    public int findOrAdd(String name, boolean isInteger) {
        Optional<Integer> existing = find(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (names.size() >= capacity) {
            throw new CapacityExceededException(CapacityExceededException.Limit.VARIABLES, capacity,
                    "cannot register variable " + name);
        }
        names.add(name);
        integer.add(isInteger);
        return names.size() - 1;
    }

    public Optional<Integer> find(String name) {
        int idx = names.indexOf(name);
        return idx < 0 ? Optional.empty() : Optional.of(idx);
    }

    public int size() {
        return names.size();
    }

    public String getName(int id) {
        return names.get(id);
    }

    public boolean isInteger(int id) {
        return integer.get(id);
    }

    public List<String> getNames() {
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("VarInfo[");
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(names.get(i)).append(integer.get(i) ? ":int" : ":real");
        }
        return sb.append(']').toString();
    }
}
