package refsolver.formula;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.*;

/**
 * An immutable predicate tree over linear arithmetic.
 *
 * Arithmetic nodes ({@code LIT, VAR, ADD, SUB, NEG, MUL, DIV}) build terms; comparison
 * nodes ({@code EQ, LT, GT, LE, GE}) turn two terms into an atom; {@code LAND, LOR, LNOT}
 * combine atoms.
 */
@EqualsAndHashCode
public class Formula {

    public enum Kind {
        LIT("lit"), VAR("var"),
        ADD("+"), SUB("-"), NEG("-"), MUL("*"), DIV("/"),
        EQ("=="), LT("<"), GT(">"), LE("<="), GE(">="),
        LAND("&&"), LOR("||"), LNOT("!");

        @Getter
        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }

        public boolean isComparison() {
            return this == EQ || this == LT || this == GT || this == LE || this == GE;
        }

        public boolean isArithmetic() {
            return ordinal() <= DIV.ordinal();
        }
    }

    @Getter
    private final Kind kind;
    @Getter
    private final double value;
    @Getter
    private final String name;
    @Getter
    private final List<Formula> children;

    private Formula(Kind kind, double value, String name, List<Formula> children) {
        this.kind = kind;
        this.value = value;
        this.name = name;
        this.children = children;
    }

    public static Formula lit(double value) {
        return new Formula(Kind.LIT, value, null, Collections.emptyList());
    }

    public static Formula var(String name) {
        return new Formula(Kind.VAR, 0.0, Objects.requireNonNull(name), Collections.emptyList());
    }

    public static Formula unary(Kind kind, Formula child) {
        return new Formula(kind, 0.0, null, Collections.singletonList(child));
    }

    public static Formula binary(Kind kind, Formula left, Formula right) {
        return new Formula(kind, 0.0, null, Collections.unmodifiableList(Arrays.asList(left, right)));
    }

    public Formula child(int idx) {
        return children.get(idx);
    }

    public Formula plus(Formula other) { return binary(Kind.ADD, this, other); }
    public Formula plus(double other) { return plus(lit(other)); }
    public Formula minus(Formula other) { return binary(Kind.SUB, this, other); }
    public Formula minus(double other) { return minus(lit(other)); }
    public Formula times(Formula other) { return binary(Kind.MUL, this, other); }
    public Formula times(double other) { return times(lit(other)); }
    public Formula div(Formula other) { return binary(Kind.DIV, this, other); }
    public Formula div(double other) { return div(lit(other)); }
    public Formula negate() { return unary(Kind.NEG, this); }

    public Formula eq(Formula other) { return binary(Kind.EQ, this, other); }
    public Formula eq(double other) { return eq(lit(other)); }
    public Formula lt(Formula other) { return binary(Kind.LT, this, other); }
    public Formula lt(double other) { return lt(lit(other)); }
    public Formula gt(Formula other) { return binary(Kind.GT, this, other); }
    public Formula gt(double other) { return gt(lit(other)); }
    public Formula le(Formula other) { return binary(Kind.LE, this, other); }
    public Formula le(double other) { return le(lit(other)); }
    public Formula ge(Formula other) { return binary(Kind.GE, this, other); }
    public Formula ge(double other) { return ge(lit(other)); }

    public Formula and(Formula other) { return binary(Kind.LAND, this, other); }
    public Formula or(Formula other) { return binary(Kind.LOR, this, other); }
    public Formula not() { return unary(Kind.LNOT, this); }

    @Override
    public String toString() {
        switch (kind) {
            case LIT:
                return value == Math.rint(value) && !Double.isInfinite(value)
                        ? Long.toString((long) value) : Double.toString(value);
            case VAR:
                return name;
            case NEG:
            case LNOT:
                return kind.getSymbol() + "(" + child(0) + ")";
            default:
                return "(" + child(0) + " " + kind.getSymbol() + " " + child(1) + ")";
        }
    }
}
