package vkgraph.graph;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vkgraph.model.Group;
import vkgraph.model.User;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Neo4jGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(Neo4jGraphStore.class);

    static final String UPSERT_USER = """
            MERGE (u:User {id: $id})
            SET u.screen_name = $screen_name,
                u.name = $name,
                u.sex = $sex,
                u.home_town = $home_town,
                u.friends_count = coalesce($friends_count, u.friends_count, 0),
                u.subscriptions_count = coalesce($subscriptions_count, u.subscriptions_count, 0)
            """;

    static final String UPSERT_GROUP = """
            MERGE (g:Group {id: $id})
            SET g.name = $name,
                g.members_count = $members_count
            """;

    static final String UPSERT_FRIEND = """
            MATCH (u1:User {id: $user_id1}), (u2:User {id: $user_id2})
            MERGE (u1)-[:FRIEND]->(u2)
            """;

    static final String UPSERT_SUBSCRIPTION = """
            MATCH (u:User {id: $user_id}), (g:Group {id: $group_id})
            MERGE (u)-[:SUBSCRIBED_TO]->(g)
            """;

    static final String WIPE = "MATCH (n) DETACH DELETE n";

    private final Driver driver;

    public Neo4jGraphStore(Driver driver) {
        this.driver = driver;
    }

    public static Neo4jGraphStore connect(String uri, String user, String password) {
        Driver driver = GraphDatabase.driver(uri, AuthTokens.basic(user, password));
        try {
            driver.verifyConnectivity();
        } catch (RuntimeException e) {
            driver.close();
            throw e;
        }
        log.info("Connected to Neo4j at {}", uri);
        return new Neo4jGraphStore(driver);
    }

    @Override
    public WriteResult upsertUser(User user) {
        var params = new HashMap<String, Object>();
        params.put("id", user.id());
        params.put("screen_name", user.screenName());
        params.put("name", user.name());
        params.put("sex", user.sex());
        params.put("home_town", user.homeTown());
        params.put("friends_count", user.friendsCount());
        params.put("subscriptions_count", user.subscriptionsCount());
        return write("user node " + user.id(), UPSERT_USER, params);
    }

    @Override
    public WriteResult upsertGroup(Group group) {
        var params = new HashMap<String, Object>();
        params.put("id", group.id());
        params.put("name", group.name());
        params.put("members_count", group.membersCount());
        return write("group node " + group.id(), UPSERT_GROUP, params);
    }

    @Override
    public WriteResult upsertFriendEdge(long fromUserId, long toUserId) {
        return write("FRIEND edge " + fromUserId + " -> " + toUserId, UPSERT_FRIEND,
                Map.of("user_id1", fromUserId, "user_id2", toUserId));
    }

    @Override
    public WriteResult upsertSubscriptionEdge(long userId, long groupId) {
        return write("SUBSCRIBED_TO edge " + userId + " -> group " + groupId, UPSERT_SUBSCRIPTION,
                Map.of("user_id", userId, "group_id", groupId));
    }

    @Override
    public List<Map<String, Object>> runQuery(String query, Map<String, Object> params) {
        Map<String, Object> args = params == null ? Map.of() : params;
        try (Session session = driver.session()) {
            return session.run(query, args).list(r -> r.asMap());
        } catch (Exception e) {
            log.error("Query failed: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public void wipe() {
        try (Session session = driver.session()) {
            session.run(WIPE).consume();
        }
        log.info("Neo4j database wiped");
    }

    @Override
    public void close() {
        driver.close();
        log.info("Neo4j connection closed");
    }

    private WriteResult write(String what, String cypher, Map<String, Object> params) {
        try (Session session = driver.session()) {
            session.executeWrite(tx -> tx.run(cypher, params).consume());
            return WriteResult.ok();
        } catch (Exception e) {
            log.error("Failed to write {}: {}", what, e.getMessage());
            return WriteResult.failed(e);
        }
    }
}
