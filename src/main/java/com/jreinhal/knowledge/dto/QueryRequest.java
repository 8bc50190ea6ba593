package com.jreinhal.knowledge.dto;

import com.jreinhal.knowledge.model.QueryIntent;
import com.jreinhal.knowledge.model.TranscriptMessage;
import java.util.List;

/**
 * Inbound question. {@code transcript} is the thread history, oldest first, ending with the live message.
 */
public record QueryRequest(String question, String sessionId, String channelId, String threadTs,
                           String slackUserId, List<TranscriptMessage> transcript, QueryIntent intent) {

    public QueryRequest {
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        intent = intent == null ? QueryIntent.QUERY : intent;
    }

    public static QueryRequest simple(String question) {
        return new QueryRequest(question, null, null, null, null, List.of(), QueryIntent.QUERY);
    }
}
