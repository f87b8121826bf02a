package com.automl.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.automl.experiment.MetricDirection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ExperimentConfig experiment = new ExperimentConfig();
    private Map<String, ParameterConfig> searchSpace = new LinkedHashMap<>();
    private RunnerConfig runner = new RunnerConfig();

    public ExperimentConfig getExperiment() {
        return experiment;
    }

    public void setExperiment(ExperimentConfig experiment) {
        this.experiment = experiment == null ? new ExperimentConfig() : experiment;
    }

    public Map<String, ParameterConfig> getSearchSpace() {
        return searchSpace;
    }

    public void setSearchSpace(Map<String, ParameterConfig> searchSpace) {
        this.searchSpace = searchSpace == null ? new LinkedHashMap<>() : searchSpace;
    }

    public RunnerConfig getRunner() {
        return runner;
    }

    public void setRunner(RunnerConfig runner) {
        this.runner = runner == null ? new RunnerConfig() : runner;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExperimentConfig {
        private int trainingTimeInSeconds = 60;
        private MetricDirection metricDirection = MetricDirection.MAXIMIZE;
        private int maxTrials = 0;
        private String tuner = "random";
        private long seed = 0;
        private int gridSteps = 3;
        private String dataset;
        private String pipeline;
        private String artifactDir = ".automl/runs";

        public int getTrainingTimeInSeconds() {
            return trainingTimeInSeconds;
        }

        public void setTrainingTimeInSeconds(int trainingTimeInSeconds) {
            this.trainingTimeInSeconds = trainingTimeInSeconds;
        }

        public MetricDirection getMetricDirection() {
            return metricDirection;
        }

        public void setMetricDirection(MetricDirection metricDirection) {
            this.metricDirection = metricDirection == null ? MetricDirection.MAXIMIZE : metricDirection;
        }

        public int getMaxTrials() {
            return maxTrials;
        }

        public void setMaxTrials(int maxTrials) {
            this.maxTrials = maxTrials;
        }

        public String getTuner() {
            return tuner;
        }

        public void setTuner(String tuner) {
            this.tuner = tuner;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public int getGridSteps() {
            return gridSteps;
        }

        public void setGridSteps(int gridSteps) {
            this.gridSteps = gridSteps;
        }

        public String getDataset() {
            return dataset;
        }

        public void setDataset(String dataset) {
            this.dataset = dataset;
        }

        public String getPipeline() {
            return pipeline;
        }

        public void setPipeline(String pipeline) {
            this.pipeline = pipeline;
        }

        public String getArtifactDir() {
            return artifactDir;
        }

        public void setArtifactDir(String artifactDir) {
            this.artifactDir = artifactDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParameterConfig {
        private String type = "double";
        private Double min;
        private Double max;
        private boolean logScale = false;
        private List<Object> values = new ArrayList<>();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public boolean isLogScale() {
            return logScale;
        }

        public void setLogScale(boolean logScale) {
            this.logScale = logScale;
        }

        public List<Object> getValues() {
            return values;
        }

        public void setValues(List<Object> values) {
            this.values = values == null ? new ArrayList<>() : values;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RunnerConfig {
        private String type = "simulated";
        private SimulatedRunnerConfig simulated = new SimulatedRunnerConfig();
        private ProcessRunnerConfig process = new ProcessRunnerConfig();
        private HttpRunnerConfig http = new HttpRunnerConfig();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public SimulatedRunnerConfig getSimulated() {
            return simulated;
        }

        public void setSimulated(SimulatedRunnerConfig simulated) {
            this.simulated = simulated == null ? new SimulatedRunnerConfig() : simulated;
        }

        public ProcessRunnerConfig getProcess() {
            return process;
        }

        public void setProcess(ProcessRunnerConfig process) {
            this.process = process == null ? new ProcessRunnerConfig() : process;
        }

        public HttpRunnerConfig getHttp() {
            return http;
        }

        public void setHttp(HttpRunnerConfig http) {
            this.http = http == null ? new HttpRunnerConfig() : http;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SimulatedRunnerConfig {
        private long trialDurationMs = 1000;

        public long getTrialDurationMs() {
            return trialDurationMs;
        }

        public void setTrialDurationMs(long trialDurationMs) {
            this.trialDurationMs = trialDurationMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProcessRunnerConfig {
        private List<String> command = new ArrayList<>();
        private String workingDirectory;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command == null ? new ArrayList<>() : command;
        }

        public String getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HttpRunnerConfig {
        private String endpoint;
        private String apiKeyEnv = "AUTOML_RUNNER_API_KEY";
        private long readTimeoutMs = 0;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }
}
