package vkgraph.graph;

import vkgraph.model.Group;
import vkgraph.model.User;

import java.util.List;
import java.util.Map;

/**
 * Property-graph sink for crawled data. Every upsert merges by identity and then sets
 * the mutable properties, so repeating a write is harmless. Upserts run in their own
 * transaction and report failure through {@link WriteResult} instead of throwing.
 */
public interface GraphStore extends AutoCloseable {

    WriteResult upsertUser(User user);

    WriteResult upsertGroup(Group group);

    /** Directed FRIEND edge; both users must already exist. */
    WriteResult upsertFriendEdge(long fromUserId, long toUserId);

    /** Directed SUBSCRIBED_TO edge; user and group must already exist. */
    WriteResult upsertSubscriptionEdge(long userId, long groupId);

    List<Map<String, Object>> runQuery(String query, Map<String, Object> params);

    /** Deletes every node and relationship. */
    void wipe();

    @Override
    void close();
}
