package refsolver.types;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import refsolver.formula.Formula;

import static org.junit.jupiter.api.Assertions.*;
import static refsolver.types.Types.*;

public class SubtypingTest {

    private final Formula v = RefinedType.valueVar();

    private Subtyping subtyping;

    @BeforeEach
    public void initialize() {
        subtyping = new Subtyping();
    }

    @Test
    public void baseWidening() {
        assertTrue(subtyping.isSubtype(BaseType.BOOL, BaseType.INT));
        assertTrue(subtyping.isSubtype(BaseType.INT, BaseType.REAL));
        assertTrue(subtyping.isSubtype(BaseType.BOOL, BaseType.REAL));
        assertTrue(subtyping.isSubtype(BaseType.INT, BaseType.INT));
        assertFalse(subtyping.isSubtype(BaseType.REAL, BaseType.INT));
        assertFalse(subtyping.isSubtype(BaseType.INT, BaseType.BOOL));
    }

    @Test
    public void refinedIntervals() {
        assertTrue(subtyping.isSubtype(posInt(), natInt()));
        assertFalse(subtyping.isSubtype(natInt(), posInt()));
        assertTrue(subtyping.isSubtype(
                refine(BaseType.INT, v.ge(1).and(v.le(3))),
                refine(BaseType.INT, v.ge(0).and(v.le(5)))));
    }

    @Test
    public void refinedIntoUnrefined() {
        assertTrue(subtyping.isSubtype(posInt(), BaseType.INT));
        assertTrue(subtyping.isSubtype(posInt(), BaseType.REAL));
        assertFalse(subtyping.isSubtype(refine(BaseType.REAL, v.gt(0)), BaseType.INT));
    }

    @Test
    public void unrefinedIntoRefinedNeedsValidPredicate() {
        assertFalse(subtyping.isSubtype(BaseType.INT, natInt()));
        assertTrue(subtyping.isSubtype(BaseType.INT, refine(BaseType.INT, v.ge(0).or(v.lt(0)))));
        assertFalse(subtyping.isSubtype(BaseType.REAL, refine(BaseType.INT, v.ge(0).or(v.lt(0)))));
    }

    @Test
    public void valueVariableDomainFollowsBase() {
        assertTrue(subtyping.isSubtype(posInt(), refine(BaseType.INT, v.ge(1))));
        assertFalse(subtyping.isSubtype(refine(BaseType.REAL, v.gt(0)), refine(BaseType.REAL, v.ge(1))));
        assertTrue(subtyping.isSubtype(posInt(), refine(BaseType.REAL, v.gt(0))));
    }

    @Test
    public void disjunctiveRefinement() {
        Type nonZero = refine(BaseType.INT, v.gt(0).or(v.lt(0)));
        Type farFromZero = refine(BaseType.INT, v.gt(5).or(v.lt(-5)));
        assertTrue(subtyping.isSubtype(farFromZero, nonZero));
        assertFalse(subtyping.isSubtype(nonZero, farFromZero));
        assertTrue(subtyping.isSubtype(nonZero, refine(BaseType.INT, v.eq(0).not())));
    }

    @Test
    public void arrowVariance() {
        Type narrowing = arrow("x", natInt(), posInt());
        Type widening = arrow("x", posInt(), natInt());
        assertTrue(subtyping.isSubtype(narrowing, widening));
        assertFalse(subtyping.isSubtype(widening, narrowing));
        assertFalse(subtyping.isSubtype(narrowing, BaseType.INT));
    }

    @Test
    public void joinOfBases() {
        assertEquals(BaseType.REAL, subtyping.join(BaseType.INT, BaseType.REAL));
        assertEquals(BaseType.INT, subtyping.join(BaseType.BOOL, BaseType.INT));
        assertEquals(BaseType.BOOL, subtyping.join(BaseType.BOOL, BaseType.BOOL));
    }

    @Test
    public void joinOfRefinementsIsDisjunction() {
        Type negInt = refine(BaseType.INT, v.lt(0));
        Type joined = subtyping.join(posInt(), negInt);
        assertEquals(refine(BaseType.INT, v.gt(0).or(v.lt(0))), joined);
        assertTrue(subtyping.isSubtype(posInt(), joined));
        assertTrue(subtyping.isSubtype(negInt, joined));
        assertFalse(subtyping.isSubtype(refine(BaseType.INT, v.eq(0)), joined));
    }

    @Test
    public void joinDropsRefinementAgainstBase() {
        assertEquals(BaseType.REAL, subtyping.join(posInt(), BaseType.REAL));
        assertEquals(BaseType.INT, subtyping.join(BaseType.BOOL, posInt()));
    }

    @Test
    public void joinWithArrowRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> subtyping.join(arrow("x", BaseType.INT, BaseType.INT), BaseType.INT));
        Type f = arrow("x", BaseType.INT, BaseType.INT);
        assertSame(f, subtyping.join(f, f));
    }

    @Test
    public void printsTypes() {
        assertEquals("{#v : Int | (#v > 0)}", posInt().toString());
        assertEquals("(x : Int) -> Real", arrow("x", BaseType.INT, BaseType.REAL).toString());
    }
}
