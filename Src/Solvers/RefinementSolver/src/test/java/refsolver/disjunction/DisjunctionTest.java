package refsolver.disjunction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import refsolver.formula.Formula;
import refsolver.linear.InequalitySystem;
import refsolver.linear.LinearInequality;
import refsolver.linear.LinearTerm;
import refsolver.linear.VarInfo;
import refsolver.parser.FormulaParser;
import refsolver.parser.ParseResult;

import static org.junit.jupiter.api.Assertions.*;

public class DisjunctionTest {

    private static final double EPS = 1e-9;

    private final Formula x = Formula.var("x");
    private final Formula y = Formula.var("y");

    private FormulaParser parser;
    private Disjunction disjunction;

    @BeforeEach
    public void initialize() {
        parser = new FormulaParser();
        disjunction = new Disjunction();
    }

    private InequalitySystem clause(Formula f) {
        return parser.parseToSystem(f).system();
    }

    @Test
    public void negateFlipsEverything() {
        // x - 3 >= 0  ->  -x + 3 > 0
        LinearInequality negated = Disjunction.negateInequality(
                LinearInequality.make(-3.0, false, new LinearTerm(0, 1.0)));
        assertEquals(-1.0, negated.coeffOf(0), EPS);
        assertEquals(3.0, negated.getConstant(), EPS);
        assertTrue(negated.isStrict());
    }

    @Test
    public void negateTwiceIsIdentity() {
        LinearInequality[] samples = {
                LinearInequality.make(-3.0, false, new LinearTerm(0, 1.0)),
                LinearInequality.make(2.5, true, new LinearTerm(0, -0.5), new LinearTerm(3, 4.0)),
                LinearInequality.make(0.0, true),
        };
        for (LinearInequality ineq : samples) {
            assertEquals(ineq, Disjunction.negateInequality(Disjunction.negateInequality(ineq)));
        }
    }

    @Test
    public void narrowRangeImpliesWideRange() {
        InequalitySystem narrow = clause(x.ge(1).and(x.le(3)));
        InequalitySystem wide = clause(x.ge(0).and(x.le(5)));
        assertTrue(disjunction.clauseImplies(narrow, wide));
        assertFalse(disjunction.clauseImplies(wide, narrow));
    }

    @Test
    public void emptyConclusionAlwaysImplied() {
        assertTrue(disjunction.clauseImplies(clause(x.gt(0)), new InequalitySystem()));
    }

    @Test
    public void premiseWithFewerVariables() {
        VarInfo vars = new VarInfo();
        vars.findOrAdd("x");
        InequalitySystem a = parser.parseToSystem(x.gt(5), vars).system();
        InequalitySystem bounded = parser.parseToSystem(x.gt(0).and(y.ge(0)), vars).system();
        // y - y >= 0 registers y but constrains nothing
        InequalitySystem trivial = parser.parseToSystem(x.gt(0).and(y.minus(y).ge(0)), vars).system();
        assertEquals(1, a.varCount());
        assertEquals(2, bounded.varCount());
        assertEquals(2, trivial.varCount());
        assertFalse(disjunction.clauseImplies(a, bounded));
        assertTrue(disjunction.clauseImplies(a, trivial));
    }

    @Test
    public void mismatchedRegistriesRejected() {
        VarInfo xy = new VarInfo();
        xy.findOrAdd("x");
        xy.findOrAdd("y");
        VarInfo yx = new VarInfo();
        yx.findOrAdd("y");
        yx.findOrAdd("x");
        InequalitySystem a = parser.parseToSystem(x.gt(0), xy).system();
        InequalitySystem b = parser.parseToSystem(x.gt(0), yx).system();
        assertThrows(IllegalStateException.class, () -> disjunction.clauseImplies(a, b));
    }

    @Test
    public void unsatClausesDropped() {
        ParseResult dnf = parser.parseToSystem(x.gt(0).and(x.lt(0)).or(x.ge(0)));
        assertEquals(2, dnf.clauseCount());
        ParseResult cleaned = disjunction.removeUnsatClauses(dnf);
        assertEquals(1, cleaned.clauseCount());
        assertEquals(1, cleaned.system().size());
    }

    @Test
    public void allUnsatLeavesEmptyDnf() {
        ParseResult dnf = parser.parseToSystem(x.gt(5).and(x.lt(3)).or(x.gt(10).and(x.lt(8))));
        assertEquals(0, disjunction.removeUnsatClauses(dnf).clauseCount());
    }

    @Test
    public void narrowerClauseSubsumed() {
        ParseResult dnf = parser.parseToSystem(x.gt(0).and(x.lt(10)).or(x.gt(0).and(x.lt(5))));
        ParseResult simplified = disjunction.simplifyDnf(dnf);
        assertEquals(1, simplified.clauseCount());
        // the wider clause survives
        assertEquals(10.0, simplified.system().getInequalities().get(1).getConstant(), EPS);
    }

    @Test
    public void duplicateClausesKeepOne() {
        ParseResult dnf = parser.parseToSystem(x.gt(0).or(x.gt(0)));
        assertEquals(1, disjunction.removeSubsumedClauses(dnf).clauseCount());
    }

    @Test
    public void independentClausesKept() {
        ParseResult dnf = parser.parseToSystem(x.gt(5).or(x.lt(-5)));
        assertEquals(2, disjunction.simplifyDnf(dnf).clauseCount());
    }

    @Test
    public void emptyDnfStaysEmpty() {
        assertEquals(0, disjunction.simplifyDnf(new ParseResult()).clauseCount());
    }
}
