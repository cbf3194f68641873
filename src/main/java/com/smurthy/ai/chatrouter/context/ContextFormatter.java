package com.smurthy.ai.chatrouter.context;

import com.smurthy.ai.chatrouter.config.ContextConfig;
import com.smurthy.ai.chatrouter.retrieval.RetrievedDocument;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders retrieved passages into the context block of the knowledge-base prompt.
 *
 * <pre>
 * [1] Category: Cards
 * To block your card, open the app...
 *
 * [2] Fees overview
 * ...
 * </pre>
 *
 * Output never exceeds the configured maximum length. Blocks are dropped whole from the end; only a
 * first block that cannot fit on its own is clipped.
 */
@Component
public class ContextFormatter {

    public static final String NO_CONTEXT = "No relevant information found in the knowledge base.";

    private static final String BLOCK_SEPARATOR = "\n\n";
    private static final String ELLIPSIS = "...";

    private final int maxLength;

    public ContextFormatter(ContextConfig config) {
        if (config.maxLength() < NO_CONTEXT.length()) {
            throw new IllegalArgumentException(
                    "app.context.max-length must be at least " + NO_CONTEXT.length() + ", was " + config.maxLength());
        }
        this.maxLength = config.maxLength();
    }

    public String format(List<RetrievedDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return NO_CONTEXT;
        }

        StringBuilder context = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            String block = renderBlock(i + 1, documents.get(i));
            if (context.length() == 0) {
                if (block.length() > maxLength) {
                    return block.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
                }
                context.append(block);
                continue;
            }
            if (context.length() + BLOCK_SEPARATOR.length() + block.length() > maxLength) {
                break;
            }
            context.append(BLOCK_SEPARATOR).append(block);
        }
        return context.toString();
    }

    private static String renderBlock(int index, RetrievedDocument document) {
        return "[" + index + "] " + label(document) + "\n" + document.text().trim();
    }

    private static String label(RetrievedDocument document) {
        String category = document.metadataText("category");
        if (category != null) {
            return "Category: " + category;
        }
        String title = document.metadataText("title");
        if (title != null) {
            return title;
        }
        String source = document.metadataText("source");
        if (source != null) {
            return source;
        }
        return "Document " + document.id();
    }
}
