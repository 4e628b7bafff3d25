package com.tidewatch.app.alert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebhookAlertSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void notify_postsTextAndChannel() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(204));
            server.start();
            var sink = new WebhookAlertSink(server.url("/hook").toString(), "ops", Duration.ofSeconds(5), mapper);

            sink.notify("❌ Cron \"brief\" failed (1.2s): boom");

            RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
            assertNotNull(request);
            assertEquals("POST", request.getMethod());
            assertEquals("/hook", request.getPath());
            assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
            JsonNode body = mapper.readTree(request.getBody().readUtf8());
            assertEquals("❌ Cron \"brief\" failed (1.2s): boom", body.get("text").asText());
            assertEquals("ops", body.get("channel").asText());
        }
    }

    @Test
    void notify_emptyChannel_omitsField() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(200));
            server.start();

            new WebhookAlertSink(server.url("/hook").toString(), "", Duration.ofSeconds(5), mapper).notify("hi");

            JsonNode body = mapper.readTree(server.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8());
            assertFalse(body.has("channel"));
        }
    }

    @Test
    void notify_serverError_throws() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse().setResponseCode(500).setBody("down"));
            server.start();
            var sink = new WebhookAlertSink(server.url("/hook").toString(), null, Duration.ofSeconds(5), mapper);

            var e = assertThrows(IOException.class, () -> sink.notify("hi"));
            assertEquals("Webhook returned HTTP 500", e.getMessage());
        }
    }
}
