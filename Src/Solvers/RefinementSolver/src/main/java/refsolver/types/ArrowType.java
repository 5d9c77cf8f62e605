package refsolver.types;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@EqualsAndHashCode
public class ArrowType implements Type {

    @Getter
    private final String param;
    @Getter
    private final Type input;
    @Getter
    private final Type output;

    public ArrowType(String param, Type input, Type output) {
        this.param = param;
        this.input = input;
        this.output = output;
    }

    @Override
    public String toString() {
        return "(" + param + " : " + input + ") -> " + output;
    }
}
