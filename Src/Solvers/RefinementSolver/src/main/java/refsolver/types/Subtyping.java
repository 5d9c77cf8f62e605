package refsolver.types;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import refsolver.linear.VarInfo;
import refsolver.solver.Solver;

/**
 * Subtyping and join over refinement types. Refinement obligations are
 * discharged by the linear arithmetic {@link Solver}.
 */
public class Subtyping {

    private static final Logger log = LogManager.getLogger(Subtyping.class);

    private final Solver solver;

    public Subtyping() {
        this(new Solver());
    }

    public Subtyping(Solver solver) {
        this.solver = solver;
    }

    public boolean isSubtype(Type sub, Type sup) {
        if (sub.equals(sup)) {
            return true;
        }

        if (sub instanceof BaseType && sup instanceof BaseType) {
            return ((BaseType) sub).widensTo((BaseType) sup);
        }

        // unrefined <: refined: the refinement must always hold
        if (sub instanceof BaseType && sup instanceof RefinedType) {
            RefinedType refined = (RefinedType) sup;
            if (!((BaseType) sub).compatibleWith(refined.getBase())) {
                return false;
            }
            return solver.isValid(refined.getPredicate(), valueVarInfo(refined.getBase()));
        }

        if (sub instanceof RefinedType && sup instanceof BaseType) {
            return ((RefinedType) sub).getBase().compatibleWith((BaseType) sup);
        }

        if (sub instanceof RefinedType && sup instanceof RefinedType) {
            RefinedType p = (RefinedType) sub;
            RefinedType q = (RefinedType) sup;
            if (!p.getBase().compatibleWith(q.getBase())) {
                return false;
            }
            // #v ranges over the narrower type
            boolean result = solver.isValidImplication(p.getPredicate(), q.getPredicate(), valueVarInfo(p.getBase()));
            log.debug("{} <: {} is {}", sub, sup, result);
            return result;
        }

        if (sub instanceof ArrowType && sup instanceof ArrowType) {
            ArrowType f = (ArrowType) sub;
            ArrowType g = (ArrowType) sup;
            return isSubtype(g.getInput(), f.getInput()) && isSubtype(f.getOutput(), g.getOutput());
        }

        return false;
    }

    /**
     * Least upper bound of two types. Refined types join to the disjunction of their predicates.
     * @throws IllegalArgumentException if the types have no join
     */
    public Type join(Type t1, Type t2) {
        if (t1.equals(t2)) {
            return t1;
        }
        if (t1 instanceof BaseType && t2 instanceof BaseType) {
            return widerBase((BaseType) t1, (BaseType) t2);
        }
        if (t1 instanceof RefinedType && t2 instanceof RefinedType) {
            RefinedType r1 = (RefinedType) t1;
            RefinedType r2 = (RefinedType) t2;
            return new RefinedType(widerBase(r1.getBase(), r2.getBase()), r1.getPredicate().or(r2.getPredicate()));
        }
        if (t1 instanceof RefinedType && t2 instanceof BaseType) {
            return widerBase(((RefinedType) t1).getBase(), (BaseType) t2);
        }
        if (t1 instanceof BaseType && t2 instanceof RefinedType) {
            return widerBase((BaseType) t1, ((RefinedType) t2).getBase());
        }
        throw new IllegalArgumentException("type error: incompatible types for join: " + t1 + ", " + t2);
    }

    public static BaseType widerBase(BaseType b1, BaseType b2) {
        return b1.compareTo(b2) >= 0 ? b1 : b2;
    }

    private VarInfo valueVarInfo(BaseType base) {
        VarInfo vars = solver.newVarInfo();
        vars.findOrAdd(RefinedType.VALUE_VAR, base.isIntegral());
        return vars;
    }
}
