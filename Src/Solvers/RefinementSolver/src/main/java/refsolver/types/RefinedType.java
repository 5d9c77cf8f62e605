package refsolver.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import refsolver.formula.Formula;

/**
 * {@code {#v : base | predicate}}: the values of {@code base} that satisfy {@code predicate}.
 */
@EqualsAndHashCode
public class RefinedType implements Type {

    public static final String VALUE_VAR = "#v";

    @Getter
    private final BaseType base;
    @Getter
    private final Formula predicate;

    public RefinedType(BaseType base, Formula predicate) {
        this.base = base;
        this.predicate = predicate;
    }

    public static Formula valueVar() {
        return Formula.var(VALUE_VAR);
    }

    @Override
    public String toString() {
        return "{" + VALUE_VAR + " : " + base + " | " + predicate + "}";
    }
}
