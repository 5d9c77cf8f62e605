package refsolver.parser;

import refsolver.CapacityExceededException;
import refsolver.NonLinearFormulaException;
import refsolver.SolverConfiguration;
import refsolver.formula.Formula;
import refsolver.linear.InequalitySystem;
import refsolver.linear.LinearInequality;
import refsolver.linear.LinearTerm;
import refsolver.linear.VarInfo;

import java.util.*;

/**
 * Converts a predicate tree into an equivalent DNF of inequality systems.
 *
 * Negation is pushed down to the comparisons with De Morgan's laws, so the
 * positive and negated walks recurse into each other.
 */
public class FormulaParser {

    private final SolverConfiguration config;

    public FormulaParser() {
        this(SolverConfiguration.load());
    }

    public FormulaParser(SolverConfiguration config) {
        this.config = config;
    }

    public ParseResult parseToSystem(Formula formula) {
        return parseToSystem(formula, new VarInfo(config.getMaxVars()));
    }

    /**
     * Parse a formula on top of a caller-supplied registry, which is not modified.
     * Variables already registered keep their domain; new ones are integer.
     */
    public ParseResult parseToSystem(Formula formula, VarInfo vars) {
        VarInfo working = vars.copy();
        ParseResult result = parseFormula(formula, working);
        // clauses built before the last variable was discovered carry an older registry
        return result.withVars(working);
    }

    public LinearExpr parseArith(Formula node, VarInfo vars) {
        switch (node.getKind()) {
            case LIT:
                return LinearExpr.constant(node.getValue());
            case VAR:
                return LinearExpr.variable(vars.findOrAdd(node.getName()));
            case ADD:
                return parseArith(node.child(0), vars).add(parseArith(node.child(1), vars));
            case SUB:
                return parseArith(node.child(0), vars).subtract(parseArith(node.child(1), vars));
            case NEG:
                return parseArith(node.child(0), vars).negate();
            case MUL: {
                LinearExpr a = parseArith(node.child(0), vars);
                LinearExpr b = parseArith(node.child(1), vars);
                if (a.isConstant()) return b.scale(a.getConstant());
                if (b.isConstant()) return a.scale(b.getConstant());
                throw new NonLinearFormulaException(NonLinearFormulaException.Kind.NON_LINEAR_MULTIPLICATION,
                        "non-linear: variable * variable in " + node);
            }
            case DIV: {
                LinearExpr a = parseArith(node.child(0), vars);
                LinearExpr b = parseArith(node.child(1), vars);
                if (!b.isConstant()) {
                    throw new NonLinearFormulaException(NonLinearFormulaException.Kind.NON_LINEAR_DIVISION,
                            "non-linear: division by variable in " + node);
                }
                if (b.getConstant() == 0.0) {
                    throw new NonLinearFormulaException(NonLinearFormulaException.Kind.DIVISION_BY_ZERO,
                            "division by zero in " + node);
                }
                return a.scale(1.0 / b.getConstant());
            }
            default:
                throw new IllegalArgumentException("unsupported node in arithmetic expression: " + node);
        }
    }

    public ParseResult parseComparison(Formula node, VarInfo vars, boolean negate) {
        Formula.Kind kind = node.getKind();
        if (!kind.isComparison()) {
            throw new IllegalArgumentException("unsupported comparison: " + node);
        }
        LinearExpr lhs = parseArith(node.child(0), vars);
        LinearExpr rhs = parseArith(node.child(1), vars);

        if (kind == Formula.Kind.EQ && !negate) {
            // a == b  ->  a - b >= 0 && b - a >= 0
            InequalitySystem sys = emptySystem(vars)
                    .add(toInequality(lhs, rhs, false))
                    .add(toInequality(rhs, lhs, false));
            return ParseResult.single(sys, config.getMaxClauses());
        }
        if (kind == Formula.Kind.EQ) {
            // !(a == b)  ->  a < b || a > b
            return new ParseResult(config.getMaxClauses())
                    .addClause(emptySystem(vars).add(toInequality(rhs, lhs, true)))
                    .addClause(emptySystem(vars).add(toInequality(lhs, rhs, true)));
        }

        LinearInequality ineq;
        if ((kind == Formula.Kind.GT && !negate) || (kind == Formula.Kind.LE && negate)) {
            ineq = toInequality(lhs, rhs, true);
        } else if ((kind == Formula.Kind.GE && !negate) || (kind == Formula.Kind.LT && negate)) {
            ineq = toInequality(lhs, rhs, false);
        } else if ((kind == Formula.Kind.LT && !negate) || (kind == Formula.Kind.GE && negate)) {
            ineq = toInequality(rhs, lhs, true);
        } else {
            ineq = toInequality(rhs, lhs, false);
        }
        return ParseResult.single(emptySystem(vars).add(ineq), config.getMaxClauses());
    }

    public ParseResult parseFormula(Formula node, VarInfo vars) {
        switch (node.getKind()) {
            case EQ:
            case LT:
            case GT:
            case LE:
            case GE:
                return parseComparison(node, vars, false);
            case LAND:
                return conjoin(parseFormula(node.child(0), vars), parseFormula(node.child(1), vars));
            case LOR:
                return disjoin(parseFormula(node.child(0), vars), parseFormula(node.child(1), vars));
            case LNOT:
                return parseNegated(node.child(0), vars);
            default:
                throw new IllegalArgumentException("unsupported node in refinement predicate: " + node);
        }
    }

    public ParseResult parseNegated(Formula node, VarInfo vars) {
        switch (node.getKind()) {
            case EQ:
            case LT:
            case GT:
            case LE:
            case GE:
                return parseComparison(node, vars, true);
            case LAND:
                return disjoin(parseNegated(node.child(0), vars), parseNegated(node.child(1), vars));
            case LOR:
                return conjoin(parseNegated(node.child(0), vars), parseNegated(node.child(1), vars));
            case LNOT:
                return parseFormula(node.child(0), vars);
            default:
                throw new IllegalArgumentException("unsupported node in negated formula: " + node);
        }
    }

    // cross product of the clauses
    public ParseResult conjoin(ParseResult left, ParseResult right) {
        List<InequalitySystem> clauses = new ArrayList<>();
        for (InequalitySystem l : left.getClauses()) {
            for (InequalitySystem r : right.getClauses()) {
                if (clauses.size() >= config.getMaxClauses()) {
                    throw new CapacityExceededException(CapacityExceededException.Limit.CLAUSES,
                            config.getMaxClauses(), "DNF clause limit exceeded");
                }
                clauses.add(mergeSystems(l, r));
            }
        }
        return new ParseResult(clauses, config.getMaxClauses());
    }

    public ParseResult disjoin(ParseResult left, ParseResult right) {
        List<InequalitySystem> clauses = new ArrayList<>(left.getClauses());
        clauses.addAll(right.getClauses());
        return new ParseResult(clauses, config.getMaxClauses());
    }

    // registries only grow during a parse, so the larger one covers the smaller
    InequalitySystem mergeSystems(InequalitySystem a, InequalitySystem b) {
        InequalitySystem merged = b.varCount() > a.varCount() ? a.withVars(b.getVars()) : a;
        for (LinearInequality ineq : b.getInequalities()) {
            merged = merged.add(ineq);
        }
        return merged;
    }

    LinearInequality toInequality(LinearExpr lhs, LinearExpr rhs, boolean strict) {
        LinearExpr diff = lhs.subtract(rhs);
        if (diff.getCoeffs().size() > config.getMaxTermsPerIneq()) {
            throw new CapacityExceededException(CapacityExceededException.Limit.TERMS_PER_INEQUALITY,
                    config.getMaxTermsPerIneq(), "too many variable terms in inequality");
        }
        List<LinearTerm> terms = new ArrayList<>();
        diff.getCoeffs().forEach((id, coeff) -> terms.add(new LinearTerm(id, coeff)));
        return new LinearInequality(terms, diff.getConstant(), strict);
    }

    private InequalitySystem emptySystem(VarInfo vars) {
        return new InequalitySystem(vars, config.getMaxIneqs());
    }
}
