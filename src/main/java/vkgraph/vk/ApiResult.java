package vkgraph.vk;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a successful VK API call: either the {@code response} payload, or the
 * private-profile sentinel (error code 30). The sentinel is data, callers branch on it.
 */
public record ApiResult(JsonNode payload, boolean privateProfile) {

    public static ApiResult ok(JsonNode payload) {
        return new ApiResult(payload, false);
    }

    public static ApiResult privateSentinel() {
        return new ApiResult(null, true);
    }

    public boolean isPrivateProfile() {
        return privateProfile;
    }

    public JsonNode object(String method) throws UnexpectedShapeException {
        if (privateProfile || payload == null || !payload.isObject()) {
            throw new UnexpectedShapeException("Unexpected response structure for " + method + ": expected an object, got " + describe());
        }
        return payload;
    }

    public JsonNode array(String method) throws UnexpectedShapeException {
        if (privateProfile || payload == null || !payload.isArray()) {
            throw new UnexpectedShapeException("Unexpected response structure for " + method + ": expected an array, got " + describe());
        }
        return payload;
    }

    private String describe() {
        if (privateProfile) return "private-profile sentinel";
        return payload == null ? "nothing" : payload.getNodeType().toString().toLowerCase();
    }
}
