package com.smurthy.ai.chatrouter.controllers;

import com.smurthy.ai.chatrouter.conversation.Turn;
import com.smurthy.ai.chatrouter.orchestration.CycleResult;
import com.smurthy.ai.chatrouter.service.ChatRouterService;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Chat API
 *
 * - POST   /chat          : route one message and answer it
 * - POST   /chat/reset    : clear the conversation history
 * - GET    /chat/history  : read the conversation history back
 * - DELETE /chat/session  : forget the session
 *
 * Clients may pass their own sessionId; otherwise one is kept in the HTTP session.
 */
@RestController
@RequestMapping("/chat")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final String SESSION_ATTRIBUTE = "conversationId";

    private final ChatRouterService chatRouterService;

    public ChatController(ChatRouterService chatRouterService) {
        this.chatRouterService = chatRouterService;
    }

    /**
     * Example:
     * curl -X POST -H "Content-Type: application/json" \
     *      -b cookies.txt -c cookies.txt \
     *      -d '{"message":"How do I block my card?"}' \
     *      http://localhost:8080/chat
     */
    @PostMapping
    public ChatReply chat(@RequestBody ChatRequest request, HttpSession session) {
        String sessionId = resolveSessionId(request.sessionId(), session);

        if (request.resetHistory()) {
            chatRouterService.reset(sessionId);
        }

        long startTime = System.currentTimeMillis();
        CycleResult result = chatRouterService.handle(sessionId, request.message());
        log.debug("Session {} answered in {}ms", sessionId, System.currentTimeMillis() - startTime);

        return new ChatReply(result.sessionId(), result.response(), result.diagnostics());
    }

    @PostMapping("/reset")
    public ResetReply reset(@RequestParam(required = false) String sessionId, HttpSession session) {
        String resolved = resolveSessionId(sessionId, session);
        chatRouterService.reset(resolved);
        return new ResetReply(resolved, true);
    }

    @GetMapping("/history")
    public HistoryReply history(@RequestParam(required = false) String sessionId, HttpSession session) {
        String resolved = resolveSessionId(sessionId, session);
        List<Turn> turns = chatRouterService.history(resolved);
        return new HistoryReply(resolved, turns, turns.size());
    }

    @DeleteMapping("/session")
    public EndReply end(@RequestParam(required = false) String sessionId, HttpSession session) {
        String resolved = resolveSessionId(sessionId, session);
        boolean ended = chatRouterService.end(resolved);
        if (!StringUtils.hasText(sessionId)) {
            session.removeAttribute(SESSION_ATTRIBUTE);
        }
        return new EndReply(resolved, ended);
    }

    // Session-based id: auto-generated and persisted across requests unless the client names one
    private static String resolveSessionId(String requested, HttpSession session) {
        if (StringUtils.hasText(requested)) {
            return requested.trim();
        }
        String sessionId = (String) session.getAttribute(SESSION_ATTRIBUTE);
        if (sessionId == null) {
            sessionId = UUID.randomUUID().toString();
            session.setAttribute(SESSION_ATTRIBUTE, sessionId);
            log.debug("Created new conversation: {}", sessionId);
        }
        return sessionId;
    }

    public record ChatRequest(
            String message,
            String sessionId,
            boolean resetHistory
    ) {}

    public record ChatReply(
            String sessionId,
            String response,
            Map<String, Object> diagnostics
    ) {}

    public record ResetReply(String sessionId, boolean cleared) {}

    public record HistoryReply(String sessionId, List<Turn> messages, int count) {}

    public record EndReply(String sessionId, boolean ended) {}
}
