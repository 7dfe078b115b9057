package vkgraph.model;

/**
 * Canonical VK user. {@code friendsCount}/{@code subscriptionsCount} are null for a user
 * known only from someone else's friend list; the store keeps existing counts then.
 * {@code privateProfile} is derived and never persisted.
 */
public record User(
        long id,
        String screenName,
        String name,
        int sex,
        String homeTown,
        Integer friendsCount,
        Integer subscriptionsCount,
        boolean privateProfile
) {
    public User withCounts(int friendsCount, int subscriptionsCount) {
        return new User(id, screenName, name, sex, homeTown, friendsCount, subscriptionsCount, privateProfile);
    }
}
