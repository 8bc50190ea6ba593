package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SessionRepairService {
    private static final Logger log = LoggerFactory.getLogger(SessionRepairService.class);

    private final SessionRebuilder sessionRebuilder;
    private final SessionCompactor sessionCompactor;

    public SessionRepairService(SessionRebuilder sessionRebuilder, SessionCompactor sessionCompactor) {
        this.sessionRebuilder = sessionRebuilder;
        this.sessionCompactor = sessionCompactor;
    }

    /**
     * Discards a session whose log holds a tool call without a result. State, including the
     * sync watermark, is reset so the next sync replays the thread.
     */
    public Session discardCorrupted(SessionKey key) {
        log.warn("Discarding corrupted session {} (orphaned tool call)", key);
        return this.sessionRebuilder.rebuildSession(key, Map.of(), List.of());
    }

    public CompactionResult recoverFromOverflow(SessionKey key) {
        log.warn("Context overflow in session {}, forcing compaction", key);
        return this.sessionCompactor.compact(key);
    }
}
