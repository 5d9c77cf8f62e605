package refsolver.solver;

import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import refsolver.SolverConfiguration;
import refsolver.disjunction.Disjunction;
import refsolver.elimination.Eliminate;
import refsolver.formula.Formula;
import refsolver.linear.InequalitySystem;
import refsolver.linear.VarInfo;
import refsolver.parser.FormulaParser;
import refsolver.parser.ParseResult;

/**
 * Decision procedure for linear arithmetic over integer and real variables.
 *
 * Every variable is integer unless the caller pre-registers it as real in a
 * {@link VarInfo} passed to one of the overloads.
 */
public class Solver {

    private static final Logger log = LogManager.getLogger(Solver.class);

    @Getter
    private final SolverConfiguration config;
    @Getter
    private final FormulaParser parser;
    @Getter
    private final Eliminate eliminate;
    @Getter
    private final Disjunction disjunction;

    public Solver() {
        this(SolverConfiguration.load());
    }

    public Solver(SolverConfiguration config) {
        this.config = config;
        this.parser = new FormulaParser(config);
        this.eliminate = new Eliminate(config);
        this.disjunction = new Disjunction(eliminate);
    }

    public VarInfo newVarInfo() {
        return new VarInfo(config.getMaxVars());
    }

    public boolean isUnsat(InequalitySystem sys) {
        return eliminate.fmIsUnsat(sys);
    }

    public boolean isSat(InequalitySystem sys) {
        return !isUnsat(sys);
    }

    /**
     * A DNF is unsatisfiable iff every clause is; no clauses at all means {@code false}.
     */
    public boolean isUnsat(ParseResult dnf) {
        for (InequalitySystem clause : dnf.getClauses()) {
            if (!eliminate.fmIsUnsat(clause)) {
                return false;
            }
        }
        return true;
    }

    public boolean isSat(ParseResult dnf) {
        return !isUnsat(dnf);
    }

    public boolean isUnsat(Formula formula) {
        return isUnsat(formula, newVarInfo());
    }

    public boolean isUnsat(Formula formula, VarInfo vars) {
        boolean unsat = isUnsat(parser.parseToSystem(formula, vars));
        log.debug("{} is {}", formula, unsat ? "unsat" : "sat");
        return unsat;
    }

    // valid when the negation has no solution
    public boolean isValid(Formula formula) {
        return isValid(formula, newVarInfo());
    }

    public boolean isValid(Formula formula, VarInfo vars) {
        boolean valid = isUnsat(parser.parseToSystem(formula.not(), vars));
        log.debug("{} is {}", formula, valid ? "valid" : "not valid");
        return valid;
    }

    public boolean isValidImplication(Formula premise, Formula conclusion) {
        return isValidImplication(premise, conclusion, newVarInfo());
    }

    /**
     * Check that {@code premise => conclusion} holds for every assignment, with the
     * domains of pre-registered variables taken from {@code vars}. The caller's registry
     * is not modified.
     *
     * <p>A conjunctive conclusion is checked clause by clause from the premise, which
     * never negates the conclusion. A disjunctive one falls back to proving
     * {@code premise && !conclusion} unsatisfiable.
     */
    public boolean isValidImplication(Formula premise, Formula conclusion, VarInfo vars) {
        VarInfo shared = vars.copy();
        ParseResult premiseDnf = parser.parseFormula(premise, shared);
        ParseResult conclusionDnf = parser.parseFormula(conclusion, shared);
        premiseDnf = premiseDnf.withVars(shared);
        conclusionDnf = conclusionDnf.withVars(shared);

        boolean valid;
        if (conclusionDnf.isConjunctive()) {
            valid = true;
            for (InequalitySystem clause : premiseDnf.getClauses()) {
                if (!disjunction.clauseImplies(clause, conclusionDnf.system())) {
                    valid = false;
                    break;
                }
            }
        } else {
            log.debug("disjunctive conclusion {}, checking premise && !conclusion", conclusion);
            valid = isUnsat(parser.parseToSystem(premise.and(conclusion.not()), vars));
        }
        log.debug("{} => {} is {}", premise, conclusion, valid ? "valid" : "not valid");
        return valid;
    }
}
