package com.jreinhal.knowledge.dto;

import com.jreinhal.knowledge.model.TranscriptMessage;
import java.util.List;

public record IngestRequest(String sessionId, String channelId, String threadTs, String slackUserId,
                            List<TranscriptMessage> transcript) {

    public IngestRequest {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }
}
