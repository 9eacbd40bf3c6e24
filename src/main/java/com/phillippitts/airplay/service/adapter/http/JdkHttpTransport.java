package com.phillippitts.airplay.service.adapter.http;

import com.phillippitts.airplay.exception.AdapterExceptionBuilder;
import com.phillippitts.airplay.exception.AdapterTimeoutException;
import com.phillippitts.airplay.util.LogSanitizer;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link HttpTransport} on {@link HttpClient}. The per-call timeout is the request's own
 * {@link HttpRequest#timeout()}.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger LOG = LogManager.getLogger(JdkHttpTransport.class);

    private final HttpClient client;

    public JdkHttpTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    JdkHttpTransport(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public HttpReply send(HttpRequest request, String adapterName) {
        long start = System.nanoTime();
        String target = LogSanitizer.redactUrl(request.uri().toString());
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debug("{} {} -> {} in {}ms", request.method(), target, response.statusCode(),
                    TimeUtils.elapsedMillis(start));
            return new HttpReply(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            long timeoutMs = request.timeout().map(Duration::toMillis).orElse(-1L);
            throw new AdapterTimeoutException(adapterName, timeoutMs, e);
        } catch (IOException e) {
            throw AdapterExceptionBuilder.create("HTTP call failed: " + e.getMessage())
                    .adapter(adapterName)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("endpoint", target)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw AdapterExceptionBuilder.create("HTTP call interrupted")
                    .adapter(adapterName)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("endpoint", target)
                    .build();
        }
    }
}
