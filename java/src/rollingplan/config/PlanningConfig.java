package rollingplan.config;

import rollingplan.cycle.CycleConfig;
import rollingplan.discussion.CompletionPolicy;
import rollingplan.discussion.MonitorConfig;
import rollingplan.distribution.DistributionConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * 滚动规划配置
 *
 * 汇总各组件的配置。可从 Properties 读取，键以 {@code rolling.} 开头，未出现的键保持默认值：
 * <pre>
 * rolling.distribution.visibilityThresholdKm   rolling.discussion.qualityThreshold
 * rolling.distribution.earthRadiusKm           rolling.discussion.softTimeoutSeconds
 * rolling.distribution.useParallel             rolling.discussion.softTimeoutMinIterations
 * rolling.distribution.parallelism             rolling.discussion.hardTimeoutSeconds
 * rolling.distribution.maxBatchSize            rolling.monitor.baseTimePerIterationSeconds
 * rolling.distribution.trackPlatformMotion     rolling.monitor.maxIterations
 * rolling.cycle.planningIntervalSeconds        rolling.monitor.safetyMargin
 * rolling.cycle.maxPlanningCycles              rolling.monitor.absoluteCapSeconds
 * rolling.cycle.generateReports                rolling.monitor.pollIntervalSeconds
 * rolling.cycle.reportSessionName
 * rolling.cycle.computeGdop
 * </pre>
 */
public class PlanningConfig {

    private static final Logger logger = Logger.getLogger(PlanningConfig.class.getName());

    public static final String PREFIX = "rolling.";

    private DistributionConfig distribution = new DistributionConfig();
    private CompletionPolicy completionPolicy = new CompletionPolicy();
    private MonitorConfig monitor = new MonitorConfig();
    private CycleConfig cycle = new CycleConfig();

    public PlanningConfig() {
    }

    /**
     * 从 Properties 读取配置
     *
     * @throws IllegalArgumentException 取值无法解析
     */
    public static PlanningConfig fromProperties(Properties properties) {
        PlanningConfig config = new PlanningConfig();
        PropertyReader reader = new PropertyReader(properties);

        DistributionConfig d = config.distribution;
        d.setVisibilityThresholdKm(reader.getDouble("distribution.visibilityThresholdKm", d.getVisibilityThresholdKm()));
        d.setEarthRadiusKm(reader.getDouble("distribution.earthRadiusKm", d.getEarthRadiusKm()));
        d.setUseParallel(reader.getBoolean("distribution.useParallel", d.isUseParallel()));
        d.setParallelism(reader.getInt("distribution.parallelism", d.getParallelism()));
        d.setMaxBatchSize(reader.getInt("distribution.maxBatchSize", d.getMaxBatchSize()));
        d.setTrackPlatformMotion(reader.getBoolean("distribution.trackPlatformMotion", d.isTrackPlatformMotion()));

        CompletionPolicy p = config.completionPolicy;
        p.setQualityThreshold(reader.getDouble("discussion.qualityThreshold", p.getQualityThreshold()));
        p.setSoftTimeout(reader.getSeconds("discussion.softTimeoutSeconds", p.getSoftTimeout()));
        p.setSoftTimeoutMinIterations(reader.getInt("discussion.softTimeoutMinIterations",
            p.getSoftTimeoutMinIterations()));
        p.setHardTimeout(reader.getSeconds("discussion.hardTimeoutSeconds", p.getHardTimeout()));

        MonitorConfig m = config.monitor;
        m.setBaseTimePerIteration(reader.getSeconds("monitor.baseTimePerIterationSeconds", m.getBaseTimePerIteration()));
        m.setMaxIterations(reader.getInt("monitor.maxIterations", m.getMaxIterations()));
        m.setSafetyMargin(reader.getDouble("monitor.safetyMargin", m.getSafetyMargin()));
        m.setAbsoluteCap(reader.getSeconds("monitor.absoluteCapSeconds", m.getAbsoluteCap()));
        m.setPollInterval(reader.getSeconds("monitor.pollIntervalSeconds", m.getPollInterval()));

        CycleConfig c = config.cycle;
        c.setPlanningInterval(reader.getSeconds("cycle.planningIntervalSeconds", c.getPlanningInterval()));
        c.setMaxPlanningCycles(reader.getInt("cycle.maxPlanningCycles", c.getMaxPlanningCycles()));
        c.setGenerateReports(reader.getBoolean("cycle.generateReports", c.isGenerateReports()));
        c.setReportSessionName(reader.getString("cycle.reportSessionName", c.getReportSessionName()));
        c.setComputeGdop(reader.getBoolean("cycle.computeGdop", c.isComputeGdop()));

        logger.info("加载规划配置: " + config);
        return config;
    }

    /**
     * 从 properties 格式的输入流读取配置（UTF-8）
     */
    public static PlanningConfig load(InputStream in) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    public DistributionConfig getDistribution() {
        return distribution;
    }

    public void setDistribution(DistributionConfig distribution) {
        this.distribution = distribution;
    }

    public CompletionPolicy getCompletionPolicy() {
        return completionPolicy;
    }

    public void setCompletionPolicy(CompletionPolicy completionPolicy) {
        this.completionPolicy = completionPolicy;
    }

    public MonitorConfig getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorConfig monitor) {
        this.monitor = monitor;
    }

    public CycleConfig getCycle() {
        return cycle;
    }

    public void setCycle(CycleConfig cycle) {
        this.cycle = cycle;
    }

    @Override
    public String toString() {
        return "PlanningConfig{" +
                "distribution=" + distribution +
                ", completionPolicy=" + completionPolicy +
                ", monitor=" + monitor +
                ", cycle=" + cycle +
                '}';
    }

    /**
     * 带前缀的属性读取
     */
    private static final class PropertyReader {

        private final Properties properties;

        PropertyReader(Properties properties) {
            this.properties = properties;
        }

        String getString(String key, String defaultValue) {
            String value = properties.getProperty(PREFIX + key);
            return value == null ? defaultValue : value.trim();
        }

        double getDouble(String key, double defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
            }
        }

        int getInt(String key, int defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw new IllegalArgumentException("Invalid boolean for " + PREFIX + key + ": " + value);
            }
            return Boolean.parseBoolean(value);
        }

        Duration getSeconds(String key, Duration defaultValue) {
            String value = getString(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000.0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid seconds for " + PREFIX + key + ": " + value, e);
            }
        }
    }
}
