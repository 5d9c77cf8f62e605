package refsolver.elimination;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import refsolver.CapacityExceededException;
import refsolver.SolverConfiguration;
import refsolver.linear.InequalitySystem;
import refsolver.linear.LinearInequality;
import refsolver.linear.LinearTerm;

import java.util.*;

/**
 * Fourier-Motzkin elimination over one conjunctive system.
 *
 * Sound for real variables. Integer variables get their bounds tightened by
 * {@link Rounding} before elimination, which is not complete for divisibility.
 */
public class Eliminate {

    private static final Logger log = LogManager.getLogger(Eliminate.class);

    private final int maxTermsPerIneq;

    public Eliminate() {
        this(SolverConfiguration.load());
    }

    public Eliminate(SolverConfiguration config) {
        this.maxTermsPerIneq = config.getMaxTermsPerIneq();
    }

    /**
     * Combine a lower bound (positive coefficient on {@code varId}) and an upper bound
     * (negative coefficient) into an inequality without {@code varId}.
     */
    public LinearInequality combineBounds(LinearInequality lower, double lowerCoeff,
                                          LinearInequality upper, double upperAbsCoeff, int varId) {
        Map<Integer, Double> merged = new LinkedHashMap<>();
        for (LinearTerm term : lower.getTerms()) {
            if (term.getVarId() != varId) {
                merged.merge(term.getVarId(), term.getCoeff() * upperAbsCoeff, Double::sum);
            }
        }
        for (LinearTerm term : upper.getTerms()) {
            if (term.getVarId() != varId) {
                merged.merge(term.getVarId(), term.getCoeff() * lowerCoeff, Double::sum);
            }
        }

        List<LinearTerm> terms = new ArrayList<>();
        for (Map.Entry<Integer, Double> entry : merged.entrySet()) {
            if (entry.getValue() != 0.0) {
                terms.add(new LinearTerm(entry.getKey(), entry.getValue()));
            }
        }
        if (terms.size() > maxTermsPerIneq) {
            throw new CapacityExceededException(CapacityExceededException.Limit.TERMS_PER_INEQUALITY,
                    maxTermsPerIneq, "combined bound has " + terms.size() + " terms");
        }
        double constant = lower.getConstant() * upperAbsCoeff + upper.getConstant() * lowerCoeff;
        return new LinearInequality(terms, constant, lower.isStrict() || upper.isStrict());
    }

    /**
     * Remove one variable from the system, preserving satisfiability.
     */
    public InequalitySystem eliminateVariable(InequalitySystem sys, int varId) {
        if (varId < 0 || varId >= sys.varCount()) {
            throw new IllegalArgumentException("eliminateVariable: var id " + varId + " out of range");
        }

        List<LinearInequality> result = new ArrayList<>();
        List<LinearInequality> lowers = new ArrayList<>();
        List<Double> lowerCoeffs = new ArrayList<>();
        List<LinearInequality> uppers = new ArrayList<>();
        List<Double> upperAbsCoeffs = new ArrayList<>();

        for (LinearInequality ineq : sys.getInequalities()) {
            double coeff = ineq.coeffOf(varId);
            if (coeff > 0.0) {
                lowers.add(ineq);
                lowerCoeffs.add(coeff);
            } else if (coeff < 0.0) {
                uppers.add(ineq);
                upperAbsCoeffs.add(-coeff);
            } else {
                result.add(ineq);
            }
        }

        if (sys.isIntegerVar(varId)) {
            for (int i = 0; i < lowers.size(); i++) {
                lowers.set(i, Rounding.roundIntegerBound(lowers.get(i), true, lowerCoeffs.get(i), sys::isIntegerVar));
            }
            for (int i = 0; i < uppers.size(); i++) {
                uppers.set(i, Rounding.roundIntegerBound(uppers.get(i), false, upperAbsCoeffs.get(i), sys::isIntegerVar));
            }
        }

        for (int li = 0; li < lowers.size(); li++) {
            for (int ui = 0; ui < uppers.size(); ui++) {
                result.add(combineBounds(lowers.get(li), lowerCoeffs.get(li),
                        uppers.get(ui), upperAbsCoeffs.get(ui), varId));
            }
        }

        log.trace("eliminated {}: {} lower, {} upper, {} -> {} inequalities", sys.varName(varId),
                lowers.size(), uppers.size(), sys.size(), result.size());
        return new InequalitySystem(sys.getVars(), result, sys.getCapacity());
    }

    /**
     * Check a constant-only system for a false inequality.
     * @throws IllegalStateException if some inequality still has variable terms
     */
    public boolean hasContradiction(InequalitySystem sys) {
        for (LinearInequality ineq : sys.getInequalities()) {
            if (ineq.termCount() != 0) {
                throw new IllegalStateException("hasContradiction: system still has variable terms: " + ineq);
            }
            if (ineq.isStrict() && ineq.getConstant() <= 0.0) return true;
            if (!ineq.isStrict() && ineq.getConstant() < 0.0) return true;
        }
        return false;
    }

    /**
     * Eliminate every registered variable, then look for a contradiction.
     * @return true if the system has no solution
     * @throws CapacityExceededException if an input inequality has more than the configured terms
     */
    public boolean fmIsUnsat(InequalitySystem sys) {
        for (LinearInequality ineq : sys.getInequalities()) {
            if (ineq.termCount() > maxTermsPerIneq) {
                throw new CapacityExceededException(CapacityExceededException.Limit.TERMS_PER_INEQUALITY,
                        maxTermsPerIneq, "inequality has " + ineq.termCount() + " terms: " + ineq);
            }
        }
        for (int v = 0; v < sys.varCount(); v++) {
            sys = eliminateVariable(sys, v);
        }
        return hasContradiction(sys);
    }
}
