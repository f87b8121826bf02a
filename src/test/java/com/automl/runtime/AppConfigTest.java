package com.automl.runtime;

import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.automl.experiment.MetricDirection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    @Test
    void shouldProvideDefaults() {
        AppConfig config = new AppConfig();

        assertEquals(60, config.getExperiment().getTrainingTimeInSeconds());
        assertEquals(MetricDirection.MAXIMIZE, config.getExperiment().getMetricDirection());
        assertEquals(0, config.getExperiment().getMaxTrials());
        assertEquals("random", config.getExperiment().getTuner());
        assertEquals("simulated", config.getRunner().getType());
        assertTrue(config.getSearchSpace().isEmpty());
    }

    @Test
    void shouldReadExampleConfig() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config;
        try (InputStream in = AppConfigTest.class.getResourceAsStream("/automl-example.yml")) {
            assertNotNull(in);
            config = mapper.readValue(in, AppConfig.class);
        }

        assertEquals(30, config.getExperiment().getTrainingTimeInSeconds());
        assertEquals(3, config.getSearchSpace().size());
        assertTrue(config.getSearchSpace().get("learningRate").isLogScale());
        assertEquals("choice", config.getSearchSpace().get("featurizer").getType());
        assertEquals(1000, config.getRunner().getSimulated().getTrialDurationMs());
    }

    @Test
    void shouldIgnoreUnknownKeysAndNullSections() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue("experiment:\n  colour: blue\nrunner: null\n", AppConfig.class);

        assertEquals(60, config.getExperiment().getTrainingTimeInSeconds());
        assertNotNull(config.getRunner());
    }
}
