package com.tidewatch.heartbeat.check;

import com.tidewatch.common.config.TidewatchConfig;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Liveness probe for one external dependency.
 */
public interface DependencyProbe {

    String name();

    /** True when the dependency answered within the probe's timeout. */
    boolean isUp();

    static DependencyProbe from(TidewatchConfig.DependencyConfig config, Duration timeout) {
        String type = config.getType() == null ? "tcp" : config.getType().toLowerCase();
        if (type.equals("http")) {
            return new Http(config.getName(), URI.create(config.getUrl()), timeout);
        }
        return new Tcp(config.getName(), config.getHost(), config.getPort(), timeout);
    }

    /** Up when a TCP connection can be opened. */
    record Tcp(String name, String host, int port, Duration timeout) implements DependencyProbe {

        @Override
        public boolean isUp() {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
                return true;
            } catch (IOException e) {
                return false;
            }
        }
    }

    /** Up when a GET returns any status below 500. The client is reused across beats. */
    record Http(String name, URI uri, Duration timeout, HttpClient client) implements DependencyProbe {

        public Http(String name, URI uri, Duration timeout) {
            this(name, uri, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
        }

        @Override
        public boolean isUp() {
            HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
            try {
                return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() < 500;
            } catch (IOException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
