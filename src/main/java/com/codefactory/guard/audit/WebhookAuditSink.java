package com.codefactory.guard.audit;

import java.io.IOException;

import com.codefactory.guard.model.AuditRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class WebhookAuditSink implements AuditSink {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final String endpoint;
    private final String apiKey;

    public WebhookAuditSink(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public void append(AuditRecord record) throws IOException {
        String payload = mapper.writeValueAsString(record);
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .header("X-Request-Id", record.requestId())
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Audit webhook " + endpoint + " rejected record " + record.requestId()
                        + " with HTTP " + response.code());
            }
        }
    }

    @Override
    public String name() {
        return "webhook:" + endpoint;
    }
}
