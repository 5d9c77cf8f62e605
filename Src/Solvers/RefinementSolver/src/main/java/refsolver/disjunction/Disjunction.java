package refsolver.disjunction;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import refsolver.elimination.Eliminate;
import refsolver.linear.InequalitySystem;
import refsolver.linear.LinearInequality;
import refsolver.linear.LinearTerm;
import refsolver.parser.ParseResult;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Operations on formulas in disjunctive normal form.
 */
public class Disjunction {

    private static final Logger log = LogManager.getLogger(Disjunction.class);

    private final Eliminate eliminate;

    public Disjunction() {
        this(new Eliminate());
    }

    public Disjunction(Eliminate eliminate) {
        this.eliminate = eliminate;
    }

    /**
     * {@code e >= 0} becomes {@code -e > 0} and {@code e > 0} becomes {@code -e >= 0}.
     */
    public static LinearInequality negateInequality(LinearInequality ineq) {
        List<LinearTerm> terms = ineq.getTerms().stream().map(t -> t.scale(-1.0)).collect(Collectors.toList());
        return new LinearInequality(terms, -ineq.getConstant(), !ineq.isStrict());
    }

    /**
     * Check whether every solution of {@code a} satisfies {@code b}, testing
     * {@code a && !b_i} for each inequality of {@code b} rather than negating {@code b} whole.
     *
     * @throws IllegalStateException if the registries disagree on a shared variable's id
     */
    public boolean clauseImplies(InequalitySystem a, InequalitySystem b) {
        InequalitySystem smaller = a.varCount() <= b.varCount() ? a : b;
        InequalitySystem larger = smaller == a ? b : a;
        for (int i = 0; i < smaller.varCount(); i++) {
            Optional<Integer> found = larger.findVar(smaller.varName(i));
            if (!found.isPresent() || found.get() != i) {
                throw new IllegalStateException("clauseImplies: incompatible variable orderings: "
                        + a.getVars() + " vs " + b.getVars());
            }
        }

        // the larger registry covers the ids of both sides
        InequalitySystem base = larger == a ? a : a.withVars(b.getVars());
        for (LinearInequality ineq : b.getInequalities()) {
            if (!eliminate.fmIsUnsat(base.add(negateInequality(ineq)))) {
                return false;
            }
        }
        return true;
    }

    public ParseResult removeUnsatClauses(ParseResult dnf) {
        List<InequalitySystem> kept = new ArrayList<>();
        for (InequalitySystem clause : dnf.getClauses()) {
            if (!eliminate.fmIsUnsat(clause)) {
                kept.add(clause);
            }
        }
        if (kept.size() != dnf.clauseCount()) {
            log.debug("removed {} unsat clauses", dnf.clauseCount() - kept.size());
        }
        return new ParseResult(kept, dnf.getCapacity());
    }

    /**
     * Drop every clause whose solutions are contained in another kept clause.
     * Quadratic in the number of clauses.
     */
    public ParseResult removeSubsumedClauses(ParseResult dnf) {
        int n = dnf.clauseCount();
        boolean[] subsumed = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (subsumed[i]) continue;
            for (int j = 0; j < n; j++) {
                if (i == j || subsumed[j]) continue;
                if (clauseImplies(dnf.clause(j), dnf.clause(i))) {
                    subsumed[j] = true;
                }
            }
        }

        List<InequalitySystem> kept = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!subsumed[i]) {
                kept.add(dnf.clause(i));
            }
        }
        if (kept.size() != n) {
            log.debug("removed {} subsumed clauses", n - kept.size());
        }
        return new ParseResult(kept, dnf.getCapacity());
    }

    public ParseResult simplifyDnf(ParseResult dnf) {
        return removeSubsumedClauses(removeUnsatClauses(dnf));
    }
}
