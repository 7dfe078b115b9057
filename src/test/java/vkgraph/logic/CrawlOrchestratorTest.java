package vkgraph.logic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vkgraph.graph.InMemoryGraphStore;
import vkgraph.graph.InMemoryGraphStore.Edge;
import vkgraph.model.CrawlLimits;
import vkgraph.model.CrawlStats;
import vkgraph.vk.FatalApiException;
import vkgraph.vk.VkApiClient;

import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorTest {

    @Mock
    private VkApiClient vk;

    private FakeVkNetwork network;
    private InMemoryGraphStore store;
    private CrawlOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        network = new FakeVkNetwork();
        store = new InMemoryGraphStore();
        orchestrator = new CrawlOrchestrator(vk, new SubscriptionCollector(vk), store);
    }

    private static CrawlLimits depth(int depthLimit) {
        return new CrawlLimits(depthLimit, 100, 300);
    }

    @Test
    void shouldSkipPrivateFriendOfRoot() throws Exception {
        // Given - root with three friends, one of them closed
        network.user(1, "Root", "User");
        network.user(2, "Anna", "A");
        network.user(3, "Boris", "B");
        network.user(4, "Closed", "C");
        network.closed(4).friends(1, 2L, 3L, 4L);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(1));

        // Then
        assertThat(store.users).containsOnlyKeys(1L, 2L, 3L);
        assertThat(store.friendEdges).containsExactly(new Edge(1, 2), new Edge(1, 3));
        assertThat(store.users.get(1L).friendsCount()).isEqualTo(3);
        assertThat(stats.privateSkipped()).isEqualTo(1);
        assertThat(stats.friendEdges()).isEqualTo(2);
        assertThat(stats.usersExpanded()).isEqualTo(1);
    }

    @Test
    void shouldNotCreateFriendOfFriendNodesAtDepthOne() throws Exception {
        // Given
        network.user(1, "Root", "User");
        network.user(2, "Anna", "A");
        network.user(5, "Far", "Away");
        network.friends(1, 2L).friends(2, 5L);
        network.install(vk);

        // When
        orchestrator.crawl("1", depth(1));

        // Then
        assertThat(store.users).containsOnlyKeys(1L, 2L);
        assertThat(store.friendEdges).containsExactly(new Edge(1, 2));
        verify(vk).usersGet("1");
        verify(vk, never()).usersGet("2");
        verify(vk, never()).friendsGet(eq(2L), anyInt());
    }

    @Test
    void shouldExpandEachUserOnceInFriendshipCycle() throws Exception {
        // Given - 1 -> 2 -> 3 -> 1 and back
        network.user(1, "A", "");
        network.user(2, "B", "");
        network.user(3, "C", "");
        network.friends(1, 2L, 3L).friends(2, 1L, 3L).friends(3, 1L, 2L);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(10));

        // Then
        assertThat(stats.usersExpanded()).isEqualTo(3);
        verify(vk, times(1)).usersGet("1");
        verify(vk, times(1)).usersGet("2");
        verify(vk, times(1)).usersGet("3");
        verify(vk, times(1)).friendsGet(eq(1L), anyInt());
        verify(vk, times(1)).friendsGet(eq(2L), anyInt());
        verify(vk, times(1)).friendsGet(eq(3L), anyInt());
        assertThat(store.friendEdges).hasSize(6);
    }

    @Test
    void shouldTraverseDepthFirstInApiOrder() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.user(2, "Left", "");
        network.user(3, "Right", "");
        network.user(4, "LeftChild", "");
        network.friends(1, 2L, 3L).friends(2, 4L);
        network.install(vk);

        // When
        orchestrator.crawl("1", depth(3));

        // Then
        InOrder order = inOrder(vk);
        order.verify(vk).usersGet("1");
        order.verify(vk).usersGet("2");
        order.verify(vk).usersGet("4");
        order.verify(vk).usersGet("3");
    }

    @Test
    void shouldStopExpandingAtDepthLimit() throws Exception {
        // Given - a chain 1 - 2 - 3 - 4
        network.user(1, "One", "");
        network.user(2, "Two", "");
        network.user(3, "Three", "");
        network.user(4, "Four", "");
        network.friends(1, 2L).friends(2, 3L).friends(3, 4L);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(2));

        // Then - user 2 is expanded at depth 2 and still gets its FRIEND edge to 3
        assertThat(stats.usersExpanded()).isEqualTo(2);
        assertThat(store.users).containsOnlyKeys(1L, 2L, 3L);
        assertThat(store.friendEdges).containsExactly(new Edge(1, 2), new Edge(2, 3));
        verify(vk, never()).usersGet("3");
    }

    @Test
    void shouldProduceSameGraphWhenCrawledTwice() throws Exception {
        // Given
        network.user(1, "A", "");
        network.user(2, "B", "");
        network.user(3, "C", "");
        network.friends(1, 2L, 3L).friends(2, 1L).friends(3, 2L);
        network.subscriptions(1, 10L, 11L).subscriptions(2, 11L);
        network.install(vk);

        // When
        orchestrator.crawl("1", depth(3));
        int users = store.users.size();
        int groups = store.groups.size();
        int friendEdges = store.friendEdges.size();
        int subEdges = store.subscriptionEdges.size();
        orchestrator.crawl("1", depth(3));

        // Then
        assertThat(store.users).hasSize(users);
        assertThat(store.groups).hasSize(groups).containsOnlyKeys(10L, 11L);
        assertThat(store.friendEdges).hasSize(friendEdges);
        assertThat(store.subscriptionEdges).hasSize(subEdges).hasSize(3);
    }

    @Test
    void shouldStoreSubscriptionsAndReportedCount() throws Exception {
        // Given
        network.user(1, "A", "");
        network.subscriptions(1, 10L, 20L, 30L);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(1));

        // Then
        assertThat(store.groups).containsOnlyKeys(10L, 20L, 30L);
        assertThat(store.groups.get(20L).membersCount()).isEqualTo(2000);
        assertThat(store.subscriptionEdges).containsExactly(new Edge(1, 10), new Edge(1, 20), new Edge(1, 30));
        assertThat(store.users.get(1L).subscriptionsCount()).isEqualTo(3);
        assertThat(stats.subscriptionEdges()).isEqualTo(3);
        verify(vk).groupsGetById(List.of(10L, 20L, 30L));
    }

    @Test
    void shouldResolveRootScreenNameAndNotRevisitIt() throws Exception {
        // Given
        network.user(1, "Pavel", "Durov");
        network.user(2, "Friend", "");
        network.screenName(1, "durov").friends(1, 2L).friends(2, 1L);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("durov", depth(3));

        // Then
        assertThat(stats.usersExpanded()).isEqualTo(2);
        verify(vk).usersGet("durov");
        verify(vk, never()).usersGet("1");
        assertThat(store.users.get(1L).screenName()).isEqualTo("durov");
        assertThat(store.friendEdges).containsExactlyInAnyOrder(new Edge(1, 2), new Edge(2, 1));
    }

    @Test
    void shouldAbortWhenRootProfileCannotBeFetched() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.failingProfile(1);
        network.install(vk);

        // When & Then
        assertThatThrownBy(() -> orchestrator.crawl("1", depth(3)))
                .isInstanceOf(FatalApiException.class)
                .hasMessageContaining("users.get");
        assertThat(store.users).isEmpty();
    }

    @Test
    void shouldAbortWhenRootIsUnknown() throws Exception {
        // Given - users.get answers with an empty array
        network.install(vk);

        // When & Then
        assertThatThrownBy(() -> orchestrator.crawl("999", depth(3)))
                .isInstanceOf(FatalApiException.class)
                .hasMessageContaining("999");
    }

    @Test
    void shouldReturnEmptyStatsForPrivateRoot() throws Exception {
        // Given
        network.user(1, "Hidden", "");
        network.privateOnLookup(1);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(3));

        // Then
        assertThat(stats).isEqualTo(CrawlStats.empty());
        assertThat(store.users).isEmpty();
        verify(vk, never()).friendsGet(anyLong(), anyInt());
    }

    @Test
    void shouldContainFriendFetchFailureToOneUser() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.user(2, "Broken", "");
        network.user(3, "Fine", "");
        network.user(4, "Leaf", "");
        network.friends(1, 2L, 3L).friends(2, 4L).friends(3, 4L);
        network.failingFriends(2);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(3));

        // Then
        assertThat(stats.fetchFailures()).isEqualTo(1);
        assertThat(stats.usersExpanded()).isEqualTo(4);
        assertThat(store.users.get(2L).friendsCount()).isZero();
        assertThat(store.friendEdges).contains(new Edge(3, 4)).doesNotContain(new Edge(2, 4));
    }

    @Test
    void shouldSkipNonRootUserWhoseProfileFails() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.user(2, "Flaky", "");
        network.user(3, "Fine", "");
        network.friends(1, 2L, 3L).friends(2, 3L);
        network.failingProfile(2);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(3));

        // Then - 2 stays as a friend node of the root but is not expanded
        assertThat(stats.fetchFailures()).isEqualTo(1);
        assertThat(stats.usersExpanded()).isEqualTo(2);
        assertThat(store.users).containsKeys(1L, 2L, 3L);
        verify(vk, never()).friendsGet(eq(2L), anyInt());
    }

    @Test
    void shouldCarryOnWhenStoreWritesFail() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.user(2, "Ok", "");
        network.user(3, "Refused", "");
        network.friends(1, 2L, 3L);
        network.install(vk);
        store.failUserWritesFor(id -> id == 3L);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(2));

        // Then
        assertThat(stats.storeFailures()).isGreaterThanOrEqualTo(1);
        assertThat(stats.usersExpanded()).isEqualTo(3);
        assertThat(store.users).containsOnlyKeys(1L, 2L);
        assertThat(store.friendEdges).containsExactly(new Edge(1, 2));
    }

    @Test
    void shouldKeepCountsOfExpandedUserWhenSeenAgainAsFriend() throws Exception {
        // Given
        network.user(1, "Root", "");
        network.user(2, "Popular", "");
        network.user(3, "Late", "");
        network.friends(1, 2L, 3L).friends(2, 1L, 3L).friends(3, 2L);
        network.install(vk);

        // When
        orchestrator.crawl("1", depth(3));

        // Then - 3 is expanded after 2 and lists 2 as friend again
        assertThat(store.users.get(2L).friendsCount()).isEqualTo(2);
        assertThat(store.users.get(3L).friendsCount()).isEqualTo(1);
    }

    @Test
    void shouldTreatPrivateFriendListAsEmpty() throws Exception {
        // Given - root profile itself is closed, so its friend list answers with the private sentinel
        network.user(1, "Closed", "Root");
        network.closed(1).friends(1, 2L);
        network.user(2, "Hidden", "");
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", depth(3));

        // Then - the root node is still written
        assertThat(store.users).containsOnlyKeys(1L);
        assertThat(store.users.get(1L).friendsCount()).isZero();
        assertThat(stats.usersExpanded()).isEqualTo(1);
    }

    @Test
    void shouldKeepGroupsResolvedBeforeLookupFailure() throws Exception {
        // Given - 600 subscriptions, the second lookup batch fails
        network.user(1, "Root", "");
        Long[] groupIds = LongStream.rangeClosed(1, 600).boxed().toArray(Long[]::new);
        network.subscriptions(1, groupIds).failingGroup(600);
        network.install(vk);

        // When
        CrawlStats stats = orchestrator.crawl("1", new CrawlLimits(1, 100, 600));

        // Then
        assertThat(store.groups).hasSize(500).containsKeys(1L, 500L).doesNotContainKey(501L);
        assertThat(store.subscriptionEdges).hasSize(500);
        assertThat(stats.subscriptionEdges()).isEqualTo(500);
        assertThat(stats.fetchFailures()).isEqualTo(1);
        assertThat(store.users.get(1L).subscriptionsCount()).isZero();
    }
}
