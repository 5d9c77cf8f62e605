package refsolver.types;

public interface Type {
}
