package org.oran.slicing.runner;

import org.oran.slicing.config.SlicingConfig;
import org.oran.slicing.config.SlicingConfigLoader;
import org.oran.slicing.engine.SlicingEngine;
import org.oran.slicing.engine.SlicingStatistics;
import org.oran.slicing.engine.SlicingStatusReport;
import org.oran.slicing.mechanism.QosMonitor;
import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Executes slicing scenarios described in YAML.
 *
 * A scenario directory holds a {@code scenario.yaml}:
 * <pre>
 * name: preemption
 * description: URLLC slice preempts an eMBB slice
 * engine:                       # overrides layered over the defaults
 *   totalBandwidthMbps: 100
 * steps:
 *   - action: create
 *     ref: video                  # name later steps use for the slice
 *     type: eMBB
 *     bandwidthMbps: 80
 *   - action: create
 *     ref: control
 *     type: URLLC
 *     bandwidthMbps: 30
 * </pre>
 *
 * Supported actions: create, modify, delete, suspend, resume, metrics, resize,
 * associate, dynamic. A step that the engine refuses is recorded as failed and the
 * run continues with the next step.
 *
 * Usage:
 * <pre>
 * ScenarioRunner runner = new ScenarioRunner();
 * ScenarioResult result = runner.run(Paths.get("scenarios/preemption"));
 * </pre>
 */
public class ScenarioRunner {

    private static final Logger log = LoggerFactory.getLogger(ScenarioRunner.class);

    public static final String SCENARIO_FILE = "scenario.yaml";

    private final SlicingConfigLoader configLoader;
    private final Yaml yaml;

    public ScenarioRunner() {
        this.configLoader = new SlicingConfigLoader();
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run the scenario in {@code scenarioDir}/scenario.yaml.
     */
    public ScenarioResult run(Path scenarioDir) throws IOException {
        Path file = scenarioDir.resolve(SCENARIO_FILE);
        if (!Files.exists(file)) {
            throw new IOException("Scenario file not found: " + file);
        }
        log.info("Loading scenario from {}", file);
        try (InputStream is = Files.newInputStream(file)) {
            return run(is);
        }
    }

    /**
     * Run a scenario read from a stream.
     */
    @SuppressWarnings("unchecked")
    public ScenarioResult run(InputStream is) throws IOException {
        Map<String, Object> raw = yaml.load(is);
        if (raw == null) {
            throw new IllegalArgumentException("Empty scenario");
        }
        String name = getString(raw, "name", "unnamed");
        log.info("Scenario: {} ({})", name, getString(raw, "description", "no description"));

        SlicingConfig config = configLoader.loadDefaults();
        Map<String, Object> overrides = (Map<String, Object>) raw.get("engine");
        if (overrides != null) {
            config = configLoader.applyOverrides(config, overrides);
        }
        SlicingEngine engine = new SlicingEngine(config);

        List<Map<String, Object>> steps = (List<Map<String, Object>>) raw.get("steps");
        if (steps == null) {
            steps = Collections.emptyList();
        }

        Map<String, SliceId> refs = new LinkedHashMap<>();
        List<StepResult> results = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            StepResult result = execute(engine, i + 1, steps.get(i), refs);
            results.add(result);
            log.info("  {}", result);
        }

        SlicingStatusReport report = engine.statusReport();
        log.info("\n{}", report.format());
        return new ScenarioResult(name, results, refs, report, engine.statistics());
    }

    // ========================================================================
    // STEPS
    // ========================================================================

    private StepResult execute(SlicingEngine engine, int index, Map<String, Object> step,
                               Map<String, SliceId> refs) {
        String action = getString(step, "action", "");
        String ref = getString(step, "ref", null);
        try {
            switch (action) {
                case "create": {
                    SliceType type = SliceType.fromLabel(getString(step, "type", ""));
                    SliceId id = engine.createSlice(type, requirementsOf(step));
                    if (ref != null) {
                        refs.put(ref, id);
                    }
                    return StepResult.ok(index, action, ref, "created " + id);
                }
                case "modify": {
                    boolean granted = engine.modifySlice(resolve(refs, ref), requirementsOf(step));
                    return granted
                        ? StepResult.ok(index, action, ref, "modified")
                        : StepResult.failed(index, action, ref, "not enough bandwidth");
                }
                case "delete":
                    engine.deleteSlice(resolve(refs, ref));
                    return StepResult.ok(index, action, ref, "deleted");
                case "suspend":
                    engine.suspendSlice(resolve(refs, ref));
                    return StepResult.ok(index, action, ref, "suspended");
                case "resume": {
                    boolean resumed = engine.resumeSlice(resolve(refs, ref));
                    return resumed
                        ? StepResult.ok(index, action, ref, "resumed")
                        : StepResult.failed(index, action, ref, "not enough bandwidth");
                }
                case "metrics": {
                    SliceMetrics metrics = new SliceMetrics(
                        getDouble(step, "throughput", 0.0),
                        getDouble(step, "latency", 0.0),
                        getDouble(step, "packetLoss", 0.0),
                        getDouble(step, "reliability", 1.0));
                    Set<QosMonitor.ViolationType> violations =
                        engine.updateSliceMetrics(resolve(refs, ref), metrics);
                    return StepResult.ok(index, action, ref,
                        violations.isEmpty() ? "within contract" : "violations " + violations);
                }
                case "resize": {
                    double shortfall = engine.setTotalBandwidth(getDouble(step, "totalBandwidthMbps", 0.0));
                    return StepResult.ok(index, action, ref,
                        String.format("shortfall %.2f Mbps", shortfall));
                }
                case "associate": {
                    long ueId = getLong(step, "ueId");
                    boolean changed = engine.associateUe(resolve(refs, ref), ueId);
                    return StepResult.ok(index, action, ref,
                        changed ? "UE " + ueId + " associated" : "UE " + ueId + " already associated");
                }
                case "dynamic": {
                    boolean enabled = getBoolean(step, "enabled", true);
                    engine.enableDynamicAllocation(enabled);
                    return StepResult.ok(index, action, ref, enabled ? "enabled" : "disabled");
                }
                default:
                    return StepResult.failed(index, action, ref, "unknown action");
            }
        } catch (SlicingException e) {
            return StepResult.failed(index, action, ref, e.getType() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return StepResult.failed(index, action, ref, e.getMessage());
        }
    }

    private SliceRequirements requirementsOf(Map<String, Object> step) {
        SliceRequirements req = new SliceRequirements(
            getDouble(step, "bandwidthMbps", 0.0),
            getDouble(step, "latencyMs", 0.0),
            getDouble(step, "reliability", 0.0),
            null);
        return req.withPriority((int) getLong(step, "priority", 0));
    }

    private SliceId resolve(Map<String, SliceId> refs, String ref) {
        SliceId id = ref == null ? null : refs.get(ref);
        if (id == null) {
            throw new IllegalArgumentException("Unknown slice reference: " + ref);
        }
        return id;
    }

    // ========================================================================
    // RESULT CLASSES
    // ========================================================================

    /**
     * Outcome of one scenario step.
     */
    public static class StepResult {
        public final int index;
        public final String action;
        public final String ref;
        public final boolean success;
        public final String detail;

        public StepResult(int index, String action, String ref, boolean success, String detail) {
            this.index = index;
            this.action = action;
            this.ref = ref;
            this.success = success;
            this.detail = detail;
        }

        static StepResult ok(int index, String action, String ref, String detail) {
            return new StepResult(index, action, ref, true, detail);
        }

        static StepResult failed(int index, String action, String ref, String detail) {
            return new StepResult(index, action, ref, false, detail);
        }

        @Override
        public String toString() {
            return String.format("#%d %s %s: %s (%s)", index, action,
                ref != null ? ref : "-", success ? "OK" : "FAILED", detail);
        }
    }

    /**
     * Complete result for a scenario.
     */
    public static class ScenarioResult {
        public final String scenarioName;
        public final List<StepResult> steps;
        public final Map<String, SliceId> slices;
        public final SlicingStatusReport report;
        public final SlicingStatistics statistics;

        public ScenarioResult(String scenarioName, List<StepResult> steps, Map<String, SliceId> slices,
                              SlicingStatusReport report, SlicingStatistics statistics) {
            this.scenarioName = scenarioName;
            this.steps = List.copyOf(steps);
            this.slices = Collections.unmodifiableMap(new LinkedHashMap<>(slices));
            this.report = report;
            this.statistics = statistics;
        }

        public long getFailedSteps() {
            return steps.stream().filter(s -> !s.success).count();
        }

        /**
         * Final snapshot of the slice created under {@code ref}, if it still exists.
         */
        public Optional<SliceInfo> slice(String ref) {
            SliceId id = slices.get(ref);
            if (id == null) {
                return Optional.empty();
            }
            return report.slices().stream().filter(s -> s.id().equals(id)).findFirst();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ScenarioResult[").append(scenarioName).append("]\n");
            sb.append("  Steps: ").append(steps.size())
                .append(" (").append(getFailedSteps()).append(" failed)\n");
            sb.append("  Slices: ").append(report.slices().size()).append("\n");
            sb.append(String.format("  Available: %.2f / %.2f Mbps%n",
                report.availableBandwidthMbps(), report.totalBandwidthMbps()));
            return sb.toString();
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Missing numeric field '" + key + "'");
        }
        return ((Number) value).longValue();
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: ScenarioRunner <scenario-directory>");
            System.exit(2);
        }
        ScenarioResult result = new ScenarioRunner().run(Paths.get(args[0]));
        System.out.print(result);
        System.exit(result.getFailedSteps() == 0 ? 0 : 1);
    }
}
