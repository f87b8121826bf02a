package com.automl.trial;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.automl.cancellation.CancellationTokenSource;
import com.automl.cancellation.TrialCancelledException;
import com.automl.event.ExperimentEventChannel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessTrialRunnerTest {

    private final CancellationTokenSource source = new CancellationTokenSource();

    @Test
    void shouldParseLastMetricLineAndPassParameters() throws Exception {
        RecordingStarter starter = new RecordingStarter(new FakeProcess(0, "epoch 1\nmetric=0.5\nmetric=0.875\n", "", null));
        ProcessTrialRunner runner = runner(starter);

        TrialResult result = runner.run(new TrialSettings(4, Map.of("learning-rate", 0.01, "leaves", 8)));

        assertEquals(0.875, result.metric());
        assertEquals("4", starter.environment.get("AUTOML_TRIAL_ID"));
        assertEquals("0.01", starter.environment.get("AUTOML_PARAM_LEARNING_RATE"));
        assertEquals("8", starter.environment.get("AUTOML_PARAM_LEAVES"));
        assertEquals("data.csv", starter.environment.get("AUTOML_DATASET"));
        assertEquals("pipeline-a", starter.environment.get("AUTOML_PIPELINE"));
        assertEquals(List.of("python3", "train.py"), starter.command);
    }

    @Test
    void shouldFailOnNonZeroExit() {
        ProcessTrialRunner runner = runner(new RecordingStarter(new FakeProcess(1, "", "out of memory", null)));

        IOException error = assertThrows(IOException.class, () -> runner.run(TrialSettings.of(0)));

        assertTrue(error.getMessage().contains("out of memory"));
    }

    @Test
    void shouldFailWhenNoMetricPrinted() {
        ProcessTrialRunner runner = runner(new RecordingStarter(new FakeProcess(0, "done\n", "", null)));

        assertThrows(IOException.class, () -> runner.run(TrialSettings.of(0)));
    }

    @Test
    void shouldDestroyProcessWhenCancelled() {
        FakeProcess process = new FakeProcess(0, "", "", source);
        ProcessTrialRunner runner = runner(new RecordingStarter(process));

        assertThrows(TrialCancelledException.class, () -> runner.run(TrialSettings.of(0)));

        assertTrue(process.destroyForciblyCalled);
    }

    @Test
    void parseMetricShouldRejectGarbage() {
        assertThrows(IOException.class, () -> ProcessTrialRunner.parseMetric("metric=abc"));
        assertEquals(-1.5, assertDoesNotThrowParse("noise\n  metric = -1.5  "));
    }

    private static double assertDoesNotThrowParse(String stdout) {
        try {
            return ProcessTrialRunner.parseMetric(stdout);
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    private ProcessTrialRunner runner(RecordingStarter starter) {
        return new ProcessTrialRunner(
                SimulatedTrialRunnerTest.context(source, new ExperimentEventChannel()),
                List.of("python3", "train.py"),
                Path.of("."),
                starter);
    }

    private static class RecordingStarter implements ProcessTrialRunner.ProcessStarter {
        private final FakeProcess process;
        private Map<String, String> environment;
        private List<String> command;

        private RecordingStarter(FakeProcess process) {
            this.process = process;
        }

        @Override
        public Process start(Path workingDirectory, Map<String, String> environment, List<String> command) {
            this.environment = environment;
            this.command = command;
            return process;
        }
    }

    private static class FakeProcess extends Process {
        private final int exitCode;
        private final InputStream stdout;
        private final InputStream stderr;
        private final CancellationTokenSource cancelOnWait;

        private boolean destroyForciblyCalled;

        private FakeProcess(int exitCode, String stdout, String stderr, CancellationTokenSource cancelOnWait) {
            this.exitCode = exitCode;
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
            this.stderr = new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
            this.cancelOnWait = cancelOnWait;
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) {
            if (cancelOnWait != null) {
                cancelOnWait.cancel();
                return false;
            }
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            // no-op
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return !destroyForciblyCalled && cancelOnWait != null;
        }
    }
}
