package com.tidewatch.app.alert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tidewatch.common.alert.AlertSink;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;

/**
 * Posts alerts as JSON {@code {"text": ..., "channel": ...}} to a webhook.
 * Any non-2xx response is reported as an {@link IOException}.
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final String url;
    private final String channel;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    public WebhookAlertSink(String url, String channel, Duration timeout, ObjectMapper objectMapper) {
        this.url = url;
        this.channel = channel == null ? "" : channel;
        this.objectMapper = objectMapper;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Override
    public void notify(String message) throws IOException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("text", message);
        if (!channel.isEmpty()) {
            body.put("channel", channel);
        }
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Webhook returned HTTP " + response.code());
            }
        }
        log.debug("Alert posted ({} chars)", message.length());
    }
}
