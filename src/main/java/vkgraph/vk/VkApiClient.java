package vkgraph.vk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vkgraph.core.Config;
import vkgraph.core.Http;
import vkgraph.core.Sleeper;
import vkgraph.core.TransientRequestException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class VkApiClient {
    private static final Logger log = LoggerFactory.getLogger(VkApiClient.class);

    /** VK error code for "this profile is private". */
    public static final int PRIVATE_PROFILE_ERROR = 30;

    static final String PROFILE_FIELDS = "screen_name,sex,home_town,city,first_name,last_name";

    private final Config cfg;
    private final Http http;
    private final Sleeper sleeper;
    private final ObjectMapper om = new ObjectMapper();

    public VkApiClient(Config cfg, Http http) {
        this(cfg, http, Sleeper.THREAD);
    }

    public VkApiClient(Config cfg, Http http, Sleeper sleeper) {
        this.cfg = cfg; this.http = http; this.sleeper = sleeper;
    }

    /**
     * Calls {@code method} with the token selected by {@code mode}. Transport failures and
     * API errors other than {@link #PRIVATE_PROFILE_ERROR} are retried with a fixed delay
     * between attempts; when the budget is spent a {@link FatalApiException} is thrown.
     */
    public ApiResult call(String method, Map<String, String> params, CredentialMode mode) throws FatalApiException {
        HttpUrl url = buildUrl(method, params, mode);
        int attempts = cfg.retryAttempts();
        Exception last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return parseEnvelope(method, params, http.get(url));
            } catch (TransientRequestException e) {
                last = e;
                log.error("Request {} failed (attempt {}/{}): {}", method, attempt, attempts, e.getMessage());
            }

            if (attempt < attempts) {
                log.info("Retrying {} in {} ms...", method, cfg.retryDelayMs());
                try {
                    sleeper.sleep(cfg.retryDelayMs());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FatalApiException(method, "interrupted while waiting to retry", ie);
                }
            }
        }
        throw new FatalApiException(method, "no successful response after " + attempts + " attempts", last);
    }

    public ApiResult usersGet(String userIds) throws FatalApiException {
        var params = new LinkedHashMap<String, String>();
        params.put("user_ids", userIds);
        params.put("fields", PROFILE_FIELDS);
        return call("users.get", params, CredentialMode.PRIMARY);
    }

    public ApiResult friendsGet(long userId, int count) throws FatalApiException {
        var params = new LinkedHashMap<String, String>();
        params.put("user_id", String.valueOf(userId));
        params.put("fields", PROFILE_FIELDS);
        params.put("count", String.valueOf(count));
        return call("friends.get", params, CredentialMode.PRIMARY);
    }

    public ApiResult getSubscriptions(long userId, int offset, int count) throws FatalApiException {
        var params = new LinkedHashMap<String, String>();
        params.put("user_id", String.valueOf(userId));
        params.put("extended", "1");
        params.put("offset", String.valueOf(offset));
        params.put("count", String.valueOf(count));
        params.put("filter", "groups");
        return call("users.getSubscriptions", params, CredentialMode.PRIMARY);
    }

    /** Batched group lookup; made with the service token since it needs no user permissions. */
    public ApiResult groupsGetById(List<Long> groupIds) throws FatalApiException {
        var params = new LinkedHashMap<String, String>();
        params.put("group_ids", groupIds.stream().map(String::valueOf).collect(Collectors.joining(",")));
        params.put("fields", "members_count");
        return call("groups.getById", params, CredentialMode.SERVICE);
    }

    private ApiResult parseEnvelope(String method, Map<String, String> params, String body) throws TransientRequestException {
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientRequestException("Malformed response body for " + method, e);
        }
        if (root == null || !root.isObject()) {
            throw new TransientRequestException("Malformed response body for " + method);
        }

        JsonNode error = root.get("error");
        if (error != null) {
            int code = error.path("error_code").asInt(-1);
            if (code == PRIVATE_PROFILE_ERROR) {
                log.warn("Profile {} is private ({})", subject(params), method);
                return ApiResult.privateSentinel();
            }
            throw new TransientRequestException("API error " + code + ": " + error.path("error_msg").asText(""));
        }

        JsonNode response = root.get("response");
        if (response == null) {
            throw new TransientRequestException("Response envelope for " + method + " has neither response nor error");
        }
        return ApiResult.ok(response);
    }

    private HttpUrl buildUrl(String method, Map<String, String> params, CredentialMode mode) {
        HttpUrl base = HttpUrl.parse(cfg.apiBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid VK API base URL: " + cfg.apiBaseUrl());
        }
        HttpUrl.Builder b = base.newBuilder().addPathSegment(method);
        params.forEach(b::addQueryParameter);
        b.addQueryParameter("access_token", mode == CredentialMode.SERVICE ? cfg.serviceToken() : cfg.accessToken());
        b.addQueryParameter("v", cfg.apiVersion());
        return b.build();
    }

    private static String subject(Map<String, String> params) {
        String id = params.get("user_id");
        return id != null ? id : params.getOrDefault("user_ids", "?");
    }
}
