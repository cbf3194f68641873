package com.smurthy.ai.chatrouter.retrieval;

import com.smurthy.ai.chatrouter.config.RetrievalConfig;
import com.smurthy.ai.chatrouter.service.BackendCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Similarity search over the knowledge base.
 *
 * One search per call, retried on transient errors through the shared {@link RetryTemplate}, all
 * bounded by the retrieval deadline. Results are filtered to the similarity floor, sorted by
 * descending score and limited to {@code topK}.
 */
@Component
public class RetrievalClient {

    private static final Logger log = LoggerFactory.getLogger(RetrievalClient.class);

    // Chroma reports cosine distance alongside the score
    private static final String DISTANCE_METADATA_KEY = "distance";

    private final VectorStore vectorStore;
    private final RetryTemplate retryTemplate;
    private final BackendCallExecutor backendCalls;
    private final RetrievalConfig config;

    public RetrievalClient(VectorStore vectorStore,
                           RetryTemplate retryTemplate,
                           BackendCallExecutor backendCalls,
                           RetrievalConfig config) {
        this.vectorStore = vectorStore;
        this.retryTemplate = retryTemplate;
        this.backendCalls = backendCalls;
        this.config = config;
    }

    /**
     * Search with the configured top-k, similarity floor and filter expression.
     */
    public List<RetrievedDocument> retrieve(String query) {
        return retrieve(query, config.topK(), config.similarityThreshold(), config.filterExpression());
    }

    public List<RetrievedDocument> retrieve(String query, int topK, double similarityFloor) {
        return retrieve(query, topK, similarityFloor, null);
    }

    /**
     * @param filterExpression portable Spring AI filter expression, e.g. {@code category == 'cards'}; ignored when blank
     * @throws RetrievalUnavailableException when the vector store fails or misses the deadline
     */
    public List<RetrievedDocument> retrieve(String query, int topK, double similarityFloor, String filterExpression) {
        if (!StringUtils.hasText(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive, was " + topK);
        }
        if (similarityFloor < 0.0 || similarityFloor > 1.0) {
            throw new IllegalArgumentException("similarityFloor must be within [0, 1], was " + similarityFloor);
        }

        SearchRequest.Builder builder = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .similarityThreshold(similarityFloor);
        if (StringUtils.hasText(filterExpression)) {
            builder.filterExpression(filterExpression);
        }
        SearchRequest request = builder.build();

        long start = System.currentTimeMillis();
        List<Document> candidates = search(request);
        long elapsed = System.currentTimeMillis() - start;

        List<RetrievedDocument> documents = (candidates == null ? List.<Document>of() : candidates).stream()
                .map(RetrievalClient::toRetrievedDocument)
                .filter(document -> document.score() >= similarityFloor)
                .sorted(Comparator.comparingDouble(RetrievedDocument::score).reversed())
                .limit(topK)
                .toList();

        log.debug("Vector search returned {} candidates, kept {} (topK={}, floor={}) in {}ms",
                candidates == null ? 0 : candidates.size(), documents.size(), topK, similarityFloor, elapsed);
        return documents;
    }

    private List<Document> search(SearchRequest request) {
        try {
            return backendCalls.call("retrieval",
                    () -> retryTemplate.execute(context -> vectorStore.similaritySearch(request)),
                    config.timeout());
        } catch (TimeoutException e) {
            throw new RetrievalUnavailableException(
                    "Vector store " + config.backendName() + " timed out after " + config.timeout().toMillis() + "ms",
                    e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RetrievalUnavailableException(
                    "Vector store " + config.backendName() + " unavailable: " + cause.getMessage(), cause, false);
        }
    }

    static RetrievedDocument toRetrievedDocument(Document document) {
        String text = document.getText() != null ? document.getText() : "";
        return new RetrievedDocument(document.getId(), text, document.getMetadata(), scoreOf(document));
    }

    private static double scoreOf(Document document) {
        Double score = document.getScore();
        if (score == null) {
            Object distance = document.getMetadata().get(DISTANCE_METADATA_KEY);
            score = distance instanceof Number ? 1.0 - ((Number) distance).doubleValue() : 0.0;
        }
        if (score.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
