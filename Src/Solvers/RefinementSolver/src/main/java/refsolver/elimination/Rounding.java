package refsolver.elimination;

import refsolver.linear.LinearInequality;
import refsolver.linear.LinearTerm;

import java.util.function.IntPredicate;

/**
 * Integer bound tightening applied before a variable is eliminated.
 */
public final class Rounding {

    private static final double LONG_MIN = (double) Long.MIN_VALUE;
    private static final double LONG_MAX = (double) Long.MAX_VALUE;

    private Rounding() {}

    private static void checkRange(double x, String fn) {
        if (Double.isNaN(x) || x < LONG_MIN || x > LONG_MAX) {
            throw new ArithmeticException(fn + ": input out of range for long: " + x);
        }
    }

    public static double ceilValue(double x) {
        checkRange(x, "ceilValue");
        return Math.ceil(x);
    }

    public static double floorValue(double x) {
        checkRange(x, "floorValue");
        return Math.floor(x);
    }

    public static boolean isIntegerValue(double x) {
        checkRange(x, "isIntegerValue");
        return x == Math.rint(x);
    }

    /**
     * Tighten a bound on an integer variable, leaving it unchanged when any of its
     * variables is real. The rounded sum is only integral over integer variables.
     */
    public static LinearInequality roundIntegerBound(LinearInequality ineq, boolean isLower, double targetCoeff,
                                                     IntPredicate isIntegerVar) {
        for (LinearTerm term : ineq.getTerms()) {
            if (!isIntegerVar.test(term.getVarId())) {
                return ineq;
            }
        }
        return roundIntegerBound(ineq, isLower, targetCoeff);
    }

    // single-term bounds are normalized by targetCoeff, so 2x - 3 >= 0 becomes 2x - 4 >= 0.
    // multi-term bounds are rounded with coefficient 1 and only when every coefficient is
    // integral, so divisibility across several variables goes undetected.
    public static LinearInequality roundIntegerBound(LinearInequality ineq, boolean isLower, double targetCoeff) {
        if (ineq.termCount() > 1) {
            for (LinearTerm term : ineq.getTerms()) {
                if (!isIntegerValue(term.getCoeff())) {
                    return ineq;
                }
            }
        }
        double coeff = ineq.termCount() == 1 ? targetCoeff : 1.0;

        double constant;
        if (isLower) {
            // a*x + c >= 0  ->  x >= -c/a
            double bound = -ineq.getConstant() / coeff;
            if (ineq.isStrict() && isIntegerValue(bound)) {
                constant = -(bound + 1.0) * coeff;
            } else {
                constant = -ceilValue(bound) * coeff;
            }
        } else {
            // -a*x + c >= 0  ->  x <= c/a
            double bound = ineq.getConstant() / coeff;
            if (ineq.isStrict() && isIntegerValue(bound)) {
                constant = (bound - 1.0) * coeff;
            } else {
                constant = floorValue(bound) * coeff;
            }
        }
        return ineq.withConstant(constant, false);
    }
}
