package vkgraph.core;

import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

public class Http {
    private static final Logger log = LoggerFactory.getLogger(Http.class);
    private final OkHttpClient client;

    public Http(Config cfg) {
        this.client = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(cfg.httpCallTimeoutSeconds()))
                .connectTimeout(Duration.ofSeconds(cfg.httpConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(cfg.httpReadTimeoutSeconds()))
                .build();
    }

    /**
     * Single GET attempt. Returns the body of a 2xx response; anything else is a
     * {@link TransientRequestException}. Retrying is the caller's business.
     */
    public String get(HttpUrl url) throws TransientRequestException {
        Request req = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response resp = client.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                log.debug("GET {} -> HTTP {}", url.encodedPath(), resp.code());
                throw new TransientRequestException("HTTP " + resp.code() + " for " + url.encodedPath(), resp.code());
            }
            ResponseBody body = resp.body();
            return body == null ? "" : body.string();
        } catch (IOException e) {
            throw new TransientRequestException("Request to " + url.encodedPath() + " failed: " + e.getMessage(), e);
        }
    }
}
