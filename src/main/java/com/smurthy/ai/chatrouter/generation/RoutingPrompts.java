package com.smurthy.ai.chatrouter.generation;

/**
 * System instructions and message templates, one set per routing path.
 */
public final class RoutingPrompts {

    private RoutingPrompts() {
    }

    public static final String KNOWLEDGE_BASE_SYSTEM = """
            You are a helpful payment support assistant.
            Answer questions based ONLY on the provided context from the knowledge base.
            If the context doesn't contain the answer to the user's question, politely say that you don't have that information available.
            Be concise, accurate, and friendly in your responses.
            """;

    public static final String GREETING_SYSTEM = """
            You are a friendly payment support assistant.
            Respond to greetings warmly and offer to help with payment-related questions.
            Keep responses brief and welcoming.
            """;

    public static final String DIRECT_ANSWER_SYSTEM = """
            You are a helpful assistant.
            Answer general questions directly and concisely.
            If asked about payment-specific topics, suggest the user ask specific payment questions.
            """;

    public static final String CLARIFICATION_SYSTEM = """
            You are a payment support assistant.
            The user's message was too short or vague to act on.
            Briefly ask what they need help with, and mention that you can answer questions about payments, cards and accounts.
            """;

    /**
     * Wraps the formatted knowledge-base context. {@code %s} is the context block.
     */
    public static final String CONTEXT_TEMPLATE = """
            Context from knowledge base:

            %s

            ---

            Answer the next question based on the context above. If the context doesn't contain the answer, say "I don't have that information in my knowledge base."
            """;

    public static final String QUESTION_TEMPLATE = "Question: %s";
}
