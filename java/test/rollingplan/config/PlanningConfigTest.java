package rollingplan.config;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PlanningConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        PlanningConfig config = PlanningConfig.fromProperties(new Properties());

        assertEquals(0.85, config.getCompletionPolicy().getQualityThreshold(), 1e-12);
        assertEquals(Duration.ofSeconds(450), config.getMonitor().computeMaxWait());
        assertEquals(100, config.getCycle().getMaxPlanningCycles());
        assertEquals(Duration.ZERO, config.getCycle().getPlanningInterval());
    }

    @Test
    void loadsFromClasspathResource() throws Exception {
        PlanningConfig config;
        try (InputStream in = getClass().getResourceAsStream("/rolling-planning.properties")) {
            assertNotNull(in);
            config = PlanningConfig.load(in);
        }

        assertEquals(2000.0, config.getDistribution().getVisibilityThresholdKm(), 1e-12);
        assertFalse(config.getDistribution().isUseParallel());
        assertEquals(0.9, config.getCompletionPolicy().getQualityThreshold(), 1e-12);
        assertEquals(Duration.ofSeconds(300), config.getCompletionPolicy().getSoftTimeout());
        assertEquals(Duration.ofMillis(2500), config.getMonitor().getPollInterval());
        assertEquals(Duration.ofSeconds(30), config.getCycle().getPlanningInterval());
        assertEquals(10, config.getCycle().getMaxPlanningCycles());
        assertEquals("demo", config.getCycle().getReportSessionName());
        assertFalse(config.getCycle().isGenerateReports());
    }

    @Test
    void invalidValuesAreRejected() {
        Properties properties = new Properties();
        properties.setProperty("rolling.cycle.maxPlanningCycles", "many");
        assertThrows(IllegalArgumentException.class, () -> PlanningConfig.fromProperties(properties));

        Properties flags = new Properties();
        flags.setProperty("rolling.cycle.generateReports", "yes");
        assertThrows(IllegalArgumentException.class, () -> PlanningConfig.fromProperties(flags));
    }
}
