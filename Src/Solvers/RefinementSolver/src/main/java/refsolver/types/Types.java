package refsolver.types;

import refsolver.formula.Formula;

public final class Types {

    private Types() {}

    public static RefinedType refine(BaseType base, Formula predicate) {
        return new RefinedType(base, predicate);
    }

    /** {@code {#v : Int | #v > 0}} */
    public static RefinedType posInt() {
        return refine(BaseType.INT, RefinedType.valueVar().gt(0));
    }

    /** {@code {#v : Int | #v >= 0}} */
    public static RefinedType natInt() {
        return refine(BaseType.INT, RefinedType.valueVar().ge(0));
    }

    public static ArrowType arrow(String param, Type input, Type output) {
        return new ArrowType(param, input, output);
    }
}
