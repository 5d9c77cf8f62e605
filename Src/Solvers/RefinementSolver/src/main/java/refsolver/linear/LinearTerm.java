package refsolver.linear;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode
public class LinearTerm {

    @Getter
    private final int varId;
    @Getter
    private final double coeff;

    public LinearTerm(int varId, double coeff) {
        this.varId = varId;
        this.coeff = coeff;
    }

    public LinearTerm scale(double factor) {
        return new LinearTerm(varId, coeff * factor);
    }

    @Override
    public String toString() {
        return coeff + "*x" + varId;
    }
}
