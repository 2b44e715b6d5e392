package org.oran.slicing.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.oran.slicing.model.SliceInfo;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioRunnerTest {

    private final ScenarioRunner runner = new ScenarioRunner();

    private static Path scenario(String name) throws URISyntaxException {
        return Paths.get(ScenarioRunnerTest.class.getResource("/scenarios/" + name).toURI());
    }

    @Test
    void shouldRunPreemptionScenario() throws Exception {
        ScenarioRunner.ScenarioResult result = runner.run(scenario("preemption"));

        assertEquals("preemption", result.scenarioName);
        assertEquals(4, result.steps.size());
        assertEquals(1, result.getFailedSteps());
        assertFalse(result.steps.get(2).success);
        assertTrue(result.steps.get(2).detail.startsWith("INSUFFICIENT_RESOURCES"));

        SliceInfo video = result.slice("video").orElseThrow();
        SliceInfo control = result.slice("control").orElseThrow();
        assertEquals(50, video.allocatedBandwidthMbps(), 1e-9);
        assertEquals(30, control.allocatedBandwidthMbps(), 1e-9);
        assertTrue(control.associatedUes().contains(7L));
        assertEquals(20, result.report.availableBandwidthMbps(), 1e-9);
    }

    @Test
    void shouldRunRemediationScenario() throws Exception {
        ScenarioRunner.ScenarioResult result = runner.run(scenario("remediation"));

        SliceInfo car = result.slice("car").orElseThrow();
        assertEquals(150, car.allocatedBandwidthMbps(), 1e-9);
        assertEquals(112, car.computeUnits());
        assertEquals(0, result.report.availableBandwidthMbps(), 1e-9);
        assertEquals(120, result.report.totalBandwidthMbps(), 1e-9);

        ScenarioRunner.StepResult delete = result.steps.get(3);
        assertFalse(delete.success);
        assertTrue(delete.detail.contains("ghost"));
        assertEquals(2, result.statistics.remediationsApplied());
    }

    @Test
    void shouldReportUnknownActionAsFailedStep() throws IOException {
        String yaml = "name: odd\nsteps:\n  - action: teleport\n";

        ScenarioRunner.ScenarioResult result =
            runner.run(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, result.getFailedSteps());
        assertEquals("unknown action", result.steps.get(0).detail);
    }

    @Test
    void shouldFailWhenScenarioFileIsMissing(@TempDir Path dir) {
        assertThrows(IOException.class, () -> runner.run(dir));
    }
}
