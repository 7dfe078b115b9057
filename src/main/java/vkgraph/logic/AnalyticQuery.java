package vkgraph.logic;

import vkgraph.graph.GraphStore;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

/** The fixed read queries run against a crawled graph, with their printed form. */
public enum AnalyticQuery {

    TOTAL_USERS("MATCH (u:User) RETURN count(u) AS total_users") {
        @Override
        void print(List<Map<String, Object>> rows, PrintWriter out) {
            if (!rows.isEmpty()) out.printf("Total users: %s%n", rows.get(0).get("total_users"));
        }
    },

    TOTAL_GROUPS("MATCH (g:Group) RETURN count(DISTINCT g) AS total_groups") {
        @Override
        void print(List<Map<String, Object>> rows, PrintWriter out) {
            if (!rows.isEmpty()) out.printf("Total groups: %s%n", rows.get(0).get("total_groups"));
        }
    },

    TOP_GROUPS("""
            MATCH (g:Group)
            WHERE g.members_count IS NOT NULL
            RETURN g.id AS group_id, g.name AS name, g.members_count AS members_count
            ORDER BY g.members_count DESC
            LIMIT 5
            """) {
        @Override
        void print(List<Map<String, Object>> rows, PrintWriter out) {
            out.println();
            out.println("Top 5 groups by number of members:");
            for (var r : rows) {
                out.printf("ID: %s, Name: %s, Members: %s%n", r.get("group_id"), r.get("name"), r.get("members_count"));
            }
        }
    },

    TOP_USERS("""
            MATCH (u:User)-[:FRIEND]->(f:User)
            RETURN u.id AS user_id, u.name AS name, count(f) AS friends_count
            ORDER BY friends_count DESC
            LIMIT 5
            """) {
        @Override
        void print(List<Map<String, Object>> rows, PrintWriter out) {
            out.println();
            out.println("Top 5 users by number of friends:");
            for (var r : rows) {
                out.printf("ID: %s, Name: %s, Friends: %s%n", r.get("user_id"), r.get("name"), r.get("friends_count"));
            }
        }
    },

    MUTUAL_FRIENDS("""
            MATCH (u1:User)-[:FRIEND]->(u2:User)
            WHERE (u2)-[:FRIEND]->(u1) AND u1.id < u2.id
            RETURN u1.id AS user1_id, u1.name AS user1_name, u2.id AS user2_id, u2.name AS user2_name
            """) {
        @Override
        void print(List<Map<String, Object>> rows, PrintWriter out) {
            out.println();
            out.println("Pairs of users who list each other as friends:");
            for (var r : rows) {
                out.printf("%s (ID: %s) and %s (ID: %s)%n",
                        r.get("user1_name"), r.get("user1_id"), r.get("user2_name"), r.get("user2_id"));
            }
        }
    };

    private final String cypher;

    AnalyticQuery(String cypher) {
        this.cypher = cypher;
    }

    public String cypher() {
        return cypher;
    }

    abstract void print(List<Map<String, Object>> rows, PrintWriter out);

    public void run(GraphStore store, PrintWriter out) {
        print(store.runQuery(cypher, Map.of()), out);
        out.flush();
    }

    public static void runAll(GraphStore store, PrintWriter out) {
        for (AnalyticQuery q : values()) {
            q.run(store, out);
        }
    }
}
