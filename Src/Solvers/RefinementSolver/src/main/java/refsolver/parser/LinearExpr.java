package refsolver.parser;

import lombok.Getter;

import java.util.*;

/**
 * Intermediate linear expression {@code sum(coeff[id] * x[id]) + constant}
 * produced while linearizing an arithmetic subtree.
 */
public class LinearExpr {

    // no zero entries
    private final SortedMap<Integer, Double> coeffs;
    @Getter
    private final double constant;

    private LinearExpr(SortedMap<Integer, Double> coeffs, double constant) {
        this.coeffs = coeffs;
        this.constant = constant;
    }

    public static LinearExpr constant(double value) {
        return new LinearExpr(new TreeMap<>(), value);
    }

    public static LinearExpr variable(int varId) {
        SortedMap<Integer, Double> coeffs = new TreeMap<>();
        coeffs.put(varId, 1.0);
        return new LinearExpr(coeffs, 0.0);
    }

    public double coeffOf(int varId) {
        return coeffs.getOrDefault(varId, 0.0);
    }

    public SortedMap<Integer, Double> getCoeffs() {
        return Collections.unmodifiableSortedMap(coeffs);
    }

    public boolean isConstant() {
        return coeffs.isEmpty();
    }

    public LinearExpr add(LinearExpr other) {
        SortedMap<Integer, Double> result = new TreeMap<>(coeffs);
        for (Map.Entry<Integer, Double> entry : other.coeffs.entrySet()) {
            double sum = result.getOrDefault(entry.getKey(), 0.0) + entry.getValue();
            if (sum == 0.0) {
                result.remove(entry.getKey());
            } else {
                result.put(entry.getKey(), sum);
            }
        }
        return new LinearExpr(result, constant + other.constant);
    }

    public LinearExpr negate() {
        return scale(-1.0);
    }

    public LinearExpr subtract(LinearExpr other) {
        return add(other.negate());
    }

    public LinearExpr scale(double factor) {
        SortedMap<Integer, Double> result = new TreeMap<>();
        for (Map.Entry<Integer, Double> entry : coeffs.entrySet()) {
            double scaled = entry.getValue() * factor;
            if (scaled != 0.0) {
                result.put(entry.getKey(), scaled);
            }
        }
        return new LinearExpr(result, constant * factor);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        coeffs.forEach((id, c) -> sb.append(c).append("*x").append(id).append(" + "));
        return sb.append(constant).toString();
    }
}
