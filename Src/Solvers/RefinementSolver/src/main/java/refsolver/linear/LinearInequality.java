package refsolver.linear;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A linear inequality in the normalized form {@code sum(terms) + constant >= 0},
 * or {@code > 0} when strict.
 *
 * <p>{@code <=} and {@code <} are expressed by negating terms and constant, and
 * {@code a = b} by the pair {@code a - b >= 0}, {@code b - a >= 0}.
 */
@EqualsAndHashCode
public class LinearInequality {

    @Getter
    private final List<LinearTerm> terms;
    @Getter
    private final double constant;
    @Getter
    private final boolean strict;

    public LinearInequality(List<LinearTerm> terms, double constant, boolean strict) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
        this.constant = constant;
        this.strict = strict;
    }

    public static LinearInequality make(double constant, boolean strict, LinearTerm... terms) {
        return new LinearInequality(Arrays.asList(terms), constant, strict);
    }

    public int termCount() {
        return terms.size();
    }

    // 0 if the variable does not occur
    public double coeffOf(int varId) {
        for (LinearTerm term : terms) {
            if (term.getVarId() == varId) {
                return term.getCoeff();
            }
        }
        return 0.0;
    }

    public LinearInequality withConstant(double newConstant, boolean newStrict) {
        return new LinearInequality(terms, newConstant, newStrict);
    }

    public String toString(VarInfo vars) {
        StringBuilder sb = new StringBuilder();
        for (LinearTerm term : terms) {
            if (sb.length() > 0) sb.append(" + ");
            String name = term.getVarId() < vars.size() ? vars.getName(term.getVarId()) : "x" + term.getVarId();
            sb.append(term.getCoeff()).append('*').append(name);
        }
        if (sb.length() > 0) sb.append(" + ");
        sb.append(constant).append(strict ? " > 0" : " >= 0");
        return sb.toString();
    }

    @Override
    public String toString() {
        String lhs = terms.stream().map(LinearTerm::toString).collect(Collectors.joining(" + "));
        return (lhs.isEmpty() ? "" : lhs + " + ") + constant + (strict ? " > 0" : " >= 0");
    }
}
