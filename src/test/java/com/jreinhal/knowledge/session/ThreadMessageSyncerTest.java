package com.jreinhal.knowledge.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import com.jreinhal.knowledge.model.TranscriptMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ThreadMessageSyncerTest {
    private static final SessionKey KEY = new SessionKey("knowledge-agent", "C1", "thread-C1-T1");

    private InMemorySessionStore store;
    private ThreadMessageSyncer syncer;
    private Session session;

    @BeforeEach
    void setUp() {
        this.store = new InMemorySessionStore();
        this.syncer = new ThreadMessageSyncer(this.store);
        this.session = this.store.create(KEY, Map.of());
    }

    private static List<TranscriptMessage> deployThread() {
        return List.of(
                new TranscriptMessage("alice", "how do we deploy?", "1.0"),
                new TranscriptMessage("bot:asst", "via script X", "2.0"),
                new TranscriptMessage("alice", "thanks", "3.0"));
    }

    @Test
    @DisplayName("Syncs history but not the live message, and advances the watermark")
    void syncsHistoryExcludingLiveMessage() {
        int appended = this.syncer.sync(this.session, deployThread());

        List<Event> events = this.store.events(KEY);
        assertThat(appended).isEqualTo(2);
        assertThat(events).hasSize(2);
        assertThat(events.get(0).role()).isEqualTo(Event.ROLE_USER);
        assertThat(events.get(0).text()).isEqualTo("[alice]: how do we deploy?");
        assertThat(events.get(0).author()).isEqualTo(ThreadMessageSyncer.AUTHOR);
        assertThat(events.get(1).role()).isEqualTo(Event.ROLE_MODEL);
        assertThat(events.get(1).text()).isEqualTo("via script X");
        assertThat(this.store.get(KEY).orElseThrow().stateString(Session.STATE_LAST_SYNCED_TS)).isEqualTo("2.0");
    }

    @Test
    @DisplayName("Syncing the same transcript twice appends nothing the second time")
    void syncIsIdempotent() {
        this.syncer.sync(this.session, deployThread());
        Session reloaded = this.store.get(KEY).orElseThrow();

        int second = this.syncer.sync(reloaded, deployThread());

        assertThat(second).isZero();
        assertThat(this.store.events(KEY)).hasSize(2);
    }

    @Test
    @DisplayName("Only messages newer than the watermark are appended")
    void appendsOnlyNewerMessages() {
        this.syncer.sync(this.session, deployThread());
        Session reloaded = this.store.get(KEY).orElseThrow();
        List<TranscriptMessage> longer = List.of(
                new TranscriptMessage("alice", "how do we deploy?", "1.0"),
                new TranscriptMessage("bot:asst", "via script X", "2.0"),
                new TranscriptMessage("alice", "thanks", "3.0"),
                new TranscriptMessage("bob", "what about rollback?", "4.0"),
                new TranscriptMessage("bob", "still there?", "5.0"));

        int appended = this.syncer.sync(reloaded, longer);

        List<Event> events = this.store.events(KEY);
        assertThat(appended).isEqualTo(1);
        assertThat(events).hasSize(3);
        assertThat(events.get(2).text()).isEqualTo("[alice]: thanks\n[bob]: what about rollback?");
        assertThat(this.store.get(KEY).orElseThrow().stateString(Session.STATE_LAST_SYNCED_TS)).isEqualTo("4.0");
    }

    @Test
    @DisplayName("Messages without timestamp or text are skipped")
    void skipsIncompleteMessages() {
        List<TranscriptMessage> transcript = List.of(
                new TranscriptMessage("alice", "no timestamp", null),
                new TranscriptMessage("alice", "", "1.0"),
                new TranscriptMessage("carol", "kept", "2.0"),
                new TranscriptMessage("alice", "live", "3.0"));

        this.syncer.sync(this.session, transcript);

        assertThat(this.store.events(KEY)).extracting(Event::text).containsExactly("[carol]: kept");
    }

    @Test
    @DisplayName("A transcript holding only the live message syncs nothing")
    void singleMessageTranscript() {
        assertThat(this.syncer.sync(this.session, List.of(new TranscriptMessage("alice", "hi", "1.0")))).isZero();
        assertThat(this.syncer.sync(this.session, null)).isZero();
        assertThat(this.store.get(KEY).orElseThrow().stateString(Session.STATE_LAST_SYNCED_TS)).isEmpty();
    }
}
