package vkgraph.logic;

import com.fasterxml.jackson.databind.JsonNode;
import vkgraph.model.User;

public class ProfileNormalizer {
    private ProfileNormalizer() {}

    /** Maps a raw {@code users.get} / {@code friends.get} item to a {@link User} without counts. */
    public static User normalize(JsonNode profile) {
        var name = (profile.path("first_name").asText("") + " " + profile.path("last_name").asText("")).trim();
        return new User(
                profile.path("id").asLong(),
                profile.path("screen_name").asText(""),
                name,
                profile.path("sex").asInt(0),
                homeTown(profile),
                null,
                null,
                isPrivate(profile)
        );
    }

    public static String homeTown(JsonNode profile) {
        var homeTown = profile.path("home_town").asText("");
        if (homeTown.isEmpty()) {
            homeTown = profile.path("city").path("title").asText("");
        }
        return homeTown;
    }

    /** Deactivated, or closed without the viewer having access to closed profiles. */
    public static boolean isPrivate(JsonNode profile) {
        if (profile.has("deactivated")) return true;
        return profile.path("is_closed").asBoolean(false)
                && !profile.path("can_access_closed").asBoolean(false);
    }
}
