package org.opentimeline.resolve;

import org.junit.jupiter.api.Test;
import org.opentimeline.model.Timeline;
import org.opentimeline.store.InMemoryTimelineStore;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineGraphResolverTest {

    private static InMemoryTimelineStore.Builder timelines(String... ids) {
        InMemoryTimelineStore.Builder b = InMemoryTimelineStore.builder();
        for (String id : ids) {
            b.timeline(new Timeline(id, "Timeline " + id, null));
        }
        return b;
    }

    @Test
    void singleTimelineContributesItself() {
        TimelineGraphResolver resolver = new TimelineGraphResolver(timelines("t").build());
        TimelineGraphResolver.ContributingTimelines result = resolver.resolveContributing("t");
        assertEquals(List.of("t"), List.copyOf(result.ids()));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void rootFirstThenDepthFirstDiscoveryOrder() {
        InMemoryTimelineStore store = timelines("root", "a", "b", "a1")
                .subtimeline("root", "a")
                .subtimeline("root", "b")
                .subtimeline("a", "a1")
                .build();
        TimelineGraphResolver.ContributingTimelines result = new TimelineGraphResolver(store).resolveContributing("root");
        assertEquals(List.of("root", "a", "a1", "b"), List.copyOf(result.ids()));
    }

    @Test
    void diamondIsVisitedOnce() {
        InMemoryTimelineStore store = timelines("root", "left", "right", "shared")
                .subtimeline("root", "left")
                .subtimeline("root", "right")
                .subtimeline("left", "shared")
                .subtimeline("right", "shared")
                .build();
        TimelineGraphResolver.ContributingTimelines result = new TimelineGraphResolver(store).resolveContributing("root");
        assertEquals(List.of("root", "left", "shared", "right"), List.copyOf(result.ids()));
    }

    @Test
    void cycleFailsWithFullPath() {
        InMemoryTimelineStore store = timelines("root", "a", "b")
                .subtimeline("root", "a")
                .subtimeline("a", "b")
                .subtimeline("b", "a")
                .build();
        TimelineCycleException e = assertThrows(TimelineCycleException.class,
                () -> new TimelineGraphResolver(store).resolveContributing("root"));
        assertEquals(List.of("root", "a", "b", "a"), e.path());
        assertEquals("root", e.timelineId());
        assertTrue(e.getMessage().contains("root -> a -> b -> a"));
    }

    @Test
    void selfLoopIsACycle() {
        InMemoryTimelineStore store = timelines("t").subtimeline("t", "t").build();
        TimelineCycleException e = assertThrows(TimelineCycleException.class,
                () -> new TimelineGraphResolver(store).resolveContributing("t"));
        assertEquals(List.of("t", "t"), e.path());
    }

    @Test
    void cycleElsewhereInStoreDoesNotAffectUnrelatedRoot() {
        InMemoryTimelineStore store = timelines("ok", "x", "y")
                .subtimeline("x", "y")
                .subtimeline("y", "x")
                .build();
        TimelineGraphResolver resolver = new TimelineGraphResolver(store);
        assertEquals(List.of("ok"), List.copyOf(resolver.resolveContributing("ok").ids()));
        assertThrows(TimelineCycleException.class, () -> resolver.resolveContributing("x"));
    }

    @Test
    void danglingChildIsSkippedWithWarning() {
        InMemoryTimelineStore store = timelines("root", "a")
                .subtimeline("root", "ghost")
                .subtimeline("root", "a")
                .build();
        TimelineGraphResolver.ContributingTimelines result = new TimelineGraphResolver(store).resolveContributing("root");
        assertEquals(List.of("root", "a"), List.copyOf(result.ids()));
        assertEquals(List.of("timeline 'root': sub-timeline 'ghost' does not exist"), result.warnings());
    }

    @Test
    void missingRootFails() {
        TimelineNotFoundException e = assertThrows(TimelineNotFoundException.class,
                () -> new TimelineGraphResolver(timelines("t").build()).resolveContributing("nope"));
        assertEquals("nope", e.timelineId());
        assertEquals("Timeline not found: nope", e.getMessage());
    }

    @Test
    void longChainResolvesWithoutRecursion() {
        InMemoryTimelineStore.Builder b = InMemoryTimelineStore.builder();
        int length = 50_000;
        for (int i = 0; i < length; i++) {
            b.timeline(new Timeline("t" + i, "Timeline " + i, null));
            if (i > 0) b.subtimeline("t" + (i - 1), "t" + i);
        }
        TimelineGraphResolver.ContributingTimelines result = new TimelineGraphResolver(b.build()).resolveContributing("t0");
        assertEquals(length, result.ids().size());
        assertEquals("t" + (length - 1), List.copyOf(result.ids()).get(length - 1));
    }

    @Test
    void capturesTimelineRecordsDuringWalk() {
        InMemoryTimelineStore store = timelines("root", "a").subtimeline("root", "a").build();
        TimelineGraphResolver.ContributingTimelines result = new TimelineGraphResolver(store).resolveContributing("root");
        assertEquals("Timeline a", result.timelines().get("a").name());
    }
}
