package com.smurthy.ai.chatrouter.controllers;

import com.smurthy.ai.chatrouter.service.ChatRouterService;
import jakarta.servlet.http.HttpSessionEvent;
import jakarta.servlet.http.HttpSessionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ends the conversation an {@code HttpSession} carried when the container invalidates or times out that session.
 */
@Component
public class ConversationSessionCleanup implements HttpSessionListener {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionCleanup.class);

    private final ChatRouterService chatRouterService;

    public ConversationSessionCleanup(ChatRouterService chatRouterService) {
        this.chatRouterService = chatRouterService;
    }

    @Override
    public void sessionDestroyed(HttpSessionEvent event) {
        Object attribute = event.getSession().getAttribute(ChatController.SESSION_ATTRIBUTE);
        if (!(attribute instanceof String) || ((String) attribute).isBlank()) {
            return;
        }
        String conversationId = (String) attribute;
        boolean removed = chatRouterService.end(conversationId);
        log.debug("HTTP session {} destroyed, conversation {} removed={}",
                event.getSession().getId(), conversationId, removed);
    }
}
