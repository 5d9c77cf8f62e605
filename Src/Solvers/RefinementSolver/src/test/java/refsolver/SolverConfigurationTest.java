package refsolver;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class SolverConfigurationTest {

    @Test
    public void defaults() {
        SolverConfiguration config = new SolverConfiguration();
        assertEquals(16, config.getMaxVars());
        assertEquals(64, config.getMaxIneqs());
        assertEquals(8, config.getMaxClauses());
        assertEquals(8, config.getMaxTermsPerIneq());
    }

    @Test
    public void readsProperties() {
        Properties props = new Properties();
        props.setProperty("refsolver.maxClauses", " 32 ");
        props.setProperty("refsolver.maxVars", "4");
        SolverConfiguration config = SolverConfiguration.fromProperties(props);
        assertEquals(32, config.getMaxClauses());
        assertEquals(4, config.getMaxVars());
        assertEquals(64, config.getMaxIneqs());
    }

    @Test
    public void rejectsBadValues() {
        Properties negative = new Properties();
        negative.setProperty("refsolver.maxIneqs", "0");
        assertThrows(IllegalArgumentException.class, () -> SolverConfiguration.fromProperties(negative));

        Properties garbage = new Properties();
        garbage.setProperty("refsolver.maxTermsPerIneq", "many");
        assertThrows(IllegalArgumentException.class, () -> SolverConfiguration.fromProperties(garbage));
    }

    @Test
    public void loadsBundledResource() {
        SolverConfiguration config = SolverConfiguration.load();
        assertEquals(16, config.getMaxVars());
        assertEquals(8, config.getMaxClauses());
    }

    @Test
    public void settersAdjustLimits() {
        SolverConfiguration config = new SolverConfiguration();
        config.setMaxIneqs(128);
        assertEquals(128, config.getMaxIneqs());
    }
}
