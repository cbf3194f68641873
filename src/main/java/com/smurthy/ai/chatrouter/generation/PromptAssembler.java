package com.smurthy.ai.chatrouter.generation;

import com.smurthy.ai.chatrouter.classifier.QueryLabel;
import com.smurthy.ai.chatrouter.conversation.Turn;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message sequence sent to the chat model.
 *
 * Order is fixed: system instruction, context message (knowledge-base path only), prior turns oldest
 * first, current utterance.
 */
@Component
public class PromptAssembler {

    public List<Message> forKnowledgeBase(String utterance, String context, List<Turn> history) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(RoutingPrompts.KNOWLEDGE_BASE_SYSTEM));
        messages.add(new UserMessage(RoutingPrompts.CONTEXT_TEMPLATE.formatted(context)));
        appendHistory(messages, history);
        messages.add(new UserMessage(RoutingPrompts.QUESTION_TEMPLATE.formatted(utterance)));
        return messages;
    }

    public List<Message> forDirectAnswer(QueryLabel label, String utterance, List<Turn> history) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPromptFor(label)));
        appendHistory(messages, history);
        messages.add(new UserMessage(utterance));
        return messages;
    }

    static String systemPromptFor(QueryLabel label) {
        return switch (label) {
            case GREETING -> RoutingPrompts.GREETING_SYSTEM;
            case DIRECT_ANSWER -> RoutingPrompts.DIRECT_ANSWER_SYSTEM;
            case UNCLEAR -> RoutingPrompts.CLARIFICATION_SYSTEM;
            case RAG_REQUIRED -> RoutingPrompts.KNOWLEDGE_BASE_SYSTEM;
        };
    }

    private static void appendHistory(List<Message> messages, List<Turn> history) {
        if (history == null) {
            return;
        }
        for (Turn turn : history) {
            switch (turn.role()) {
                case USER -> messages.add(new UserMessage(turn.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(turn.content()));
            }
        }
    }
}
