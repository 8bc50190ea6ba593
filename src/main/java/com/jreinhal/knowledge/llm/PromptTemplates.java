package com.jreinhal.knowledge.llm;

/**
 * Fixed prompt texts. Templates taking input use a single {@code %s} placeholder.
 */
public final class PromptTemplates {

    public static final String DEFAULT_AGENT_INTRO = "You are a Knowledge Management Assistant";

    public static final String SYSTEM_PROMPT = """
            You are a Knowledge Management Assistant that helps teams build and maintain their institutional knowledge base.

            You help teams by answering questions using information from past conversations, and by storing valuable \
            information from current conversations for future reference.

            Tools:
            - search_memory: search the knowledge base. Results include an id usable with update_memory and delete_memory.
            - save_to_memory: store important information for future retrieval.
            - update_memory: replace the content of an existing entry by id. Search first to find the id.
            - delete_memory: delete an entry permanently by id. Search first to find the id.
            - async_invoke_agent: hand a long-running task to a sub-agent; its result is posted back later.

            Search when the user asks about past events, decisions, processes or solutions.
            Save decisions, solutions, technical details, procedures and key facts as they emerge. Always include \
            the actual date when the user says "today", "this week" and similar; the current date is provided.
            Do not save greetings, small talk, time-sensitive noise, duplicates or questions without answers.

            If save_to_memory, update_memory or delete_memory returns an error, especially a permission error, \
            tell the user. Never claim a write succeeded when the tool reported a failure.

            Respond in the same language the user writes in. Use the user's name once if it is provided.
            Use Slack formatting: *bold* with single asterisks, bullet lists, backticks for code, no # headers.
            Be clear, concise and honest when the knowledge base has nothing relevant.
            """;

    public static final String COMPACTION_PROMPT = """
            Summarize this conversation history concisely while preserving critical information.

            PRESERVE (keep exactly as written):
            - Decisions and conclusions reached
            - Technical details: configs, IPs, ports, service names, versions
            - Error messages and their resolutions
            - Numerical data, metrics, and statistics
            - Code snippets, commands, and file paths
            - Names, dates, and deadlines mentioned
            - Action items and commitments
            - Key questions asked and answers given

            REMOVE:
            - Repetitive greetings and pleasantries
            - Redundant back-and-forth exchanges
            - Filler text and conversational padding
            - Duplicate information

            IMPORTANT:
            - Output ONLY the summary, no explanations or meta-commentary
            - Maintain the original language
            - Keep the chronological flow of events
            - Use bullet points for clarity

            Conversation to summarize:
            %s""";

    public static final String CONTEXT_COMPRESSION_PROMPT = """
            Compress this conversation context while preserving critical information.

            PRESERVE (keep exactly as written):
            - Decisions and conclusions reached
            - Technical details: configs, IPs, ports, service names, versions
            - Error messages and their resolutions
            - Numerical data, metrics, and statistics
            - Code snippets, commands, and file paths
            - Names, dates, and deadlines mentioned
            - Action items and commitments

            REMOVE:
            - Repetitive greetings and pleasantries
            - Redundant back-and-forth exchanges
            - Filler text and conversational padding
            - Duplicate information
            - Meta-discussion about the conversation itself

            IMPORTANT:
            - Output ONLY the compressed context, no explanations
            - Maintain the original language
            - Target approximately 50%% of the original size
            - Keep the chronological flow of events

            Context to compress:
            %s""";

    public static final String RESPONSE_CLEANUP_PROMPT = """
            Clean up this AI agent response by removing unnecessary narration about its internal process.

            REMOVE:
            - Talk about handing off between agents ("I'll transfer you", "the metrics agent says", "let me ask")
            - Redundant or repeated greetings
            - Explanations of which tool is about to be used
            - Repetitions of the same information
            - Meta-commentary on the process ("let me search", "I'll check")

            KEEP INTACT:
            - All substantive information, data and figures
            - Context needed to understand the answer
            - Important technical details
            - Follow-up questions to the user, if any

            IMPORTANT:
            - Reply ONLY with the cleaned text
            - Do NOT explain what you removed
            - Keep the same language as the original response
            - If the response is already clean, return it unchanged

            Response to clean:
            %s""";

    public static final String SUMMARY_HEADER = "[Conversation Summary]\n";
    public static final String SUMMARY_ACK = "Understood, I have the context from the conversation summary.";
    public static final String NO_MEMORY_RESULTS = "No relevant information found in memory.";

    private PromptTemplates() {
    }
}
