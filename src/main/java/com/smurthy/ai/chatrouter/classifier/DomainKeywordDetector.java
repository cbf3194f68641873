package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;

public class DomainKeywordDetector implements SignalDetector {

    public static final String NAME = "domain_keyword";

    private final DomainVocabulary vocabulary;

    public DomainKeywordDetector(DomainVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        return vocabulary.matches(utterance)
                ? Optional.of(vote(QueryLabel.RAG_REQUIRED, STRONG))
                : Optional.empty();
    }
}
