package refsolver;

import lombok.Getter;
import lombok.Setter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Size envelope of a decision query. Bounds memory and worst-case running time.
 */
public class SolverConfiguration {

    public static final String RESOURCE = "/refsolver.properties";

    // max variables in one registry
    @Getter @Setter
    int maxVars = 16;

    // max inequalities in one conjunctive system
    @Getter @Setter
    int maxIneqs = 64;

    // max clauses in one DNF
    @Getter @Setter
    int maxClauses = 8;

    // max variable terms in one inequality
    @Getter @Setter
    int maxTermsPerIneq = 8;

    public SolverConfiguration() {}

    public SolverConfiguration(int maxVars, int maxIneqs, int maxClauses, int maxTermsPerIneq) {
        this.maxVars = maxVars;
        this.maxIneqs = maxIneqs;
        this.maxClauses = maxClauses;
        this.maxTermsPerIneq = maxTermsPerIneq;
    }

    /**
     * Read capacities from {@code refsolver.*} keys; missing keys keep their defaults.
     */
    public static SolverConfiguration fromProperties(Properties props) {
        SolverConfiguration config = new SolverConfiguration();
        config.maxVars = readPositive(props, "refsolver.maxVars", config.maxVars);
        config.maxIneqs = readPositive(props, "refsolver.maxIneqs", config.maxIneqs);
        config.maxClauses = readPositive(props, "refsolver.maxClauses", config.maxClauses);
        config.maxTermsPerIneq = readPositive(props, "refsolver.maxTermsPerIneq", config.maxTermsPerIneq);
        return config;
    }

    /**
     * Configuration from {@value #RESOURCE} on the classpath, or the defaults if there is none.
     */
    public static SolverConfiguration load() {
        try (InputStream in = SolverConfiguration.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return new SolverConfiguration();
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + RESOURCE, e);
        }
    }

    private static int readPositive(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "SolverConfiguration{maxVars=" + maxVars + ", maxIneqs=" + maxIneqs
                + ", maxClauses=" + maxClauses + ", maxTermsPerIneq=" + maxTermsPerIneq + "}";
    }
}
