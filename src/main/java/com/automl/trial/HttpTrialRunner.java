package com.automl.trial;

import java.io.IOException;
import java.util.Map;

import com.automl.cancellation.CancellationToken;
import com.automl.cancellation.TrialCancelledException;
import com.automl.event.ExperimentEventChannel;
import com.automl.experiment.AutoMLExperimentSettings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Delegates each trial to a remote training service. The request is cancelled as soon as the
 * experiment's token fires.
 */
public class HttpTrialRunner implements TrialRunner {
    static final String SOURCE = "HttpTrialRunner";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String apiKey;
    private final AutoMLExperimentSettings settings;
    private final CancellationToken cancellationToken;
    private final ExperimentEventChannel channel;

    public HttpTrialRunner(TrialRunnerContext context, OkHttpClient httpClient, String endpoint, String apiKey) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("http runner requires an endpoint");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.settings = context.settings();
        this.cancellationToken = context.cancellationToken();
        this.channel = context.channel();
    }

    @Override
    public TrialResult run(TrialSettings trial) throws IOException {
        cancellationToken.throwIfCancellationRequested();
        String payload = mapper.writeValueAsString(new TrialRequest(
                trial.trialId(),
                trial.parameters(),
                settings.datasetReference(),
                settings.pipelineReference()));
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        long start = System.nanoTime();
        Call call = httpClient.newCall(requestBuilder.build());
        channel.info(SOURCE, trial.trialId(), "Posted trial to " + endpoint);
        try (CancellationToken.Registration ignored = cancellationToken.register(call::cancel);
                Response response = call.execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("trial endpoint returned HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(response.body().string());
            JsonNode metricNode = root.path("metric");
            if (!metricNode.isNumber()) {
                throw new IOException("trial endpoint response has no numeric metric");
            }
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            long duration = root.path("durationInMilliseconds").asLong(elapsedMs);
            return new TrialResult(trial, duration, metricNode.asDouble());
        } catch (IOException e) {
            if (call.isCanceled() || cancellationToken.isCancellationRequested()) {
                throw new TrialCancelledException("trial " + trial.trialId() + " cancelled");
            }
            throw e;
        }
    }

    record TrialRequest(int trialId, Map<String, Object> parameters, String dataset, String pipeline) {
    }
}
