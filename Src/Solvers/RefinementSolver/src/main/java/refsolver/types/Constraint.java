package refsolver.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import refsolver.formula.Formula;

@EqualsAndHashCode
public class Constraint {

    @Getter
    private final Formula formula;
    @Getter
    private final String origin;

    public Constraint(Formula formula, String origin) {
        this.formula = formula;
        this.origin = origin;
    }

    @Override
    public String toString() {
        return origin + ": " + formula;
    }
}
