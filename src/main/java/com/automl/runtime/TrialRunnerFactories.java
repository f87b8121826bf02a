package com.automl.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import com.automl.trial.HttpTrialRunner;
import com.automl.trial.ProcessTrialRunner;
import com.automl.trial.SimulatedTrialRunner;
import com.automl.trial.TrialRunnerFactory;

import okhttp3.OkHttpClient;

public final class TrialRunnerFactories {
    private TrialRunnerFactories() {
    }

    public static TrialRunnerFactory fromConfig(AppConfig.RunnerConfig runner, OkHttpClient httpClient) {
        String type = runner.getType() == null ? "simulated" : runner.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "simulated" -> simulated(runner.getSimulated());
            case "process" -> process(runner.getProcess());
            case "http" -> http(runner.getHttp(), httpClient);
            default -> throw new IllegalArgumentException("Unknown runner type '" + runner.getType()
                    + "' (expected simulated, process or http)");
        };
    }

    private static TrialRunnerFactory simulated(AppConfig.SimulatedRunnerConfig simulated) {
        if (simulated.getTrialDurationMs() < 0) {
            throw new IllegalArgumentException("runner.simulated.trialDurationMs must be >= 0");
        }
        Duration trialDuration = Duration.ofMillis(simulated.getTrialDurationMs());
        return context -> new SimulatedTrialRunner(context, trialDuration);
    }

    private static TrialRunnerFactory process(AppConfig.ProcessRunnerConfig process) {
        if (process.getCommand().isEmpty()) {
            throw new IllegalArgumentException("runner.process.command must not be empty");
        }
        Path workingDirectory = process.getWorkingDirectory() == null ? null : Path.of(process.getWorkingDirectory());
        return context -> new ProcessTrialRunner(context, process.getCommand(), workingDirectory);
    }

    private static TrialRunnerFactory http(AppConfig.HttpRunnerConfig http, OkHttpClient httpClient) {
        if (http.getEndpoint() == null || http.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("runner.http.endpoint must be set");
        }
        // trials may legitimately run for minutes; 0 disables the read timeout
        OkHttpClient client = httpClient.newBuilder()
                .readTimeout(Duration.ofMillis(Math.max(0, http.getReadTimeoutMs())))
                .build();
        String apiKey = http.getApiKeyEnv() == null ? null : System.getenv(http.getApiKeyEnv());
        return context -> new HttpTrialRunner(context, client, http.getEndpoint(), apiKey);
    }
}
