package com.orderguard.consumer.failurestate;

import com.orderguard.common.codec.Codec;
import com.orderguard.common.codec.JacksonTypedJsonCodec;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StreamStateTest {

    @Test
    void json_keeps_topic_order_and_a_missing_next_retry() {
        Map<String, TopicState> topics = new LinkedHashMap<>();
        topics.put("zeta", new TopicState("zeta", 10, 1_000, 2, 9_000L, false));
        topics.put("alpha", new TopicState("alpha", 3, 900, 0, null, true));
        StreamState state = new StreamState("acct-1", topics);

        Codec<StreamState, String> codec = new JacksonTypedJsonCodec<>(StreamState.class);
        String json = codec.encode(state).valueOrThrow(IllegalStateException::new);
        StreamState back = codec.decode(json).valueOrThrow(IllegalStateException::new);

        assertEquals(state, back);
        assertEquals(List.of("zeta", "alpha"), List.copyOf(back.topics().keySet()));
        assertNull(back.topics().get("alpha").nextRetry());
        assertFalse(json.contains("tracksNothing"));
    }

    @Test
    void tombstone_tracks_nothing() {
        assertTrue(StreamState.tombstone("acct-1").tracksNothing());
        assertTrue(new StreamState("acct-1", null).topics().isEmpty());
    }

    @Test
    void with_and_without_topics_leave_the_original_untouched() {
        StreamState empty = StreamState.tombstone("acct-1");
        StreamState one = empty.withTopic(TopicState.initial("accounts", 1, 100));
        StreamState none = one.withoutTopics(List.of("accounts"));

        assertTrue(empty.tracksNothing());
        assertEquals(1, one.topics().size());
        assertTrue(none.tracksNothing());
        assertThrows(UnsupportedOperationException.class, () -> one.topics().clear());
    }

    @Test
    void replay_starts_at_the_failed_message_while_its_failure_is_pending() {
        TopicState failed = TopicState.initial("accounts", 7, 100).withFailure(0, 5_100);
        assertEquals(7, failed.replayFrom());
        assertEquals(8, failed.withSuccess().replayFrom());
        assertFalse(failed.isDueForRetry(5_099));
        assertTrue(failed.isDueForRetry(5_100));
        assertFalse(failed.withSuccess().withUpToDate(true).isDueForRetry(Long.MAX_VALUE));
    }
}
