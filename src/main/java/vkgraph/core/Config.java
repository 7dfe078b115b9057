package vkgraph.core;

import java.io.InputStream;
import java.util.Properties;

public record Config(
        String apiBaseUrl,
        String apiVersion,
        String accessToken,
        String serviceToken,
        int retryAttempts,
        long retryDelayMs,
        int httpCallTimeoutSeconds,
        int httpConnectTimeoutSeconds,
        int httpReadTimeoutSeconds,
        String neo4jUri,
        String neo4jUser,
        String neo4jPassword
) {
    public static Config load() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("application.properties")) {
            Properties props = new Properties();
            if (in != null) props.load(in);

            var cfg = new Config(
                    props.getProperty("vk.api.baseUrl", "https://api.vk.com/method"),
                    props.getProperty("vk.api.version", "5.131"),
                    setting(props, "VK_TOKEN", "vk.token", ""),
                    setting(props, "VK_SERVICE_TOKEN", "vk.serviceToken", ""),
                    Integer.parseInt(props.getProperty("api.retry.attempts", "3")),
                    Long.parseLong(props.getProperty("api.retry.delay.ms", "2000")),
                    Integer.parseInt(props.getProperty("http.call.timeout", "60")),
                    Integer.parseInt(props.getProperty("http.connect.timeout", "20")),
                    Integer.parseInt(props.getProperty("http.read.timeout", "60")),
                    setting(props, "NEO4J_URI", "neo4j.uri", "bolt://localhost:7687"),
                    setting(props, "NEO4J_USER", "neo4j.user", "neo4j"),
                    setting(props, "NEO4J_PASSWORD", "neo4j.password", "")
            );
            if (cfg.retryAttempts() < 1) {
                throw new IllegalStateException("api.retry.attempts must be at least 1");
            }
            return cfg;
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to load application.properties", e);
        }
    }

    public Config withTokens(String accessToken, String serviceToken) {
        return new Config(apiBaseUrl, apiVersion, accessToken, serviceToken, retryAttempts, retryDelayMs,
                httpCallTimeoutSeconds, httpConnectTimeoutSeconds, httpReadTimeoutSeconds,
                neo4jUri, neo4jUser, neo4jPassword);
    }

    public Config withNeo4j(String uri, String user, String password) {
        return new Config(apiBaseUrl, apiVersion, accessToken, serviceToken, retryAttempts, retryDelayMs,
                httpCallTimeoutSeconds, httpConnectTimeoutSeconds, httpReadTimeoutSeconds,
                uri, user, password);
    }

    // env wins over the properties file
    private static String setting(Properties props, String env, String key, String def) {
        var fromEnv = System.getenv(env);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
        return props.getProperty(key, def);
    }
}
