package com.smurthy.ai.chatrouter.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Terms the payment-support knowledge base is known to cover.
 *
 * Single words match whole tokens (a trailing plural "s" is tolerated); phrases match on word boundaries.
 */
public class DomainVocabulary {

    private static final Set<String> DEFAULT_TERMS = Set.of(
            // limits and account tiers
            "transaction", "limit", "daily", "weekly", "monthly", "spending",
            "account", "tier", "basic", "premium", "metal",
            // cards
            "card", "block", "blocked", "freeze", "unfreeze", "frozen", "lost", "stolen", "pin", "atm",
            // transfers
            "transfer", "international", "sepa", "wire", "remittance", "iban", "swift",
            // pricing
            "fee", "charge", "cost", "rate", "exchange", "refund", "chargeback", "withdrawal",
            // statements
            "balance", "statement", "payment", "history",
            // support
            "policy", "rule", "procedure", "process", "support", "help", "assistance", "contact"
    );

    private static final Set<String> DEFAULT_PHRASES = Set.of(
            "exchange rate", "direct debit", "top up", "bank transfer", "customer service"
    );

    private final Set<String> terms;
    private final Set<String> phrases;

    public DomainVocabulary() {
        this(DEFAULT_TERMS, DEFAULT_PHRASES);
    }

    public DomainVocabulary(Set<String> terms, Set<String> phrases) {
        this.terms = Set.copyOf(terms);
        this.phrases = Set.copyOf(phrases);
    }

    public boolean matches(NormalizedUtterance utterance) {
        return !matchedTerms(utterance).isEmpty();
    }

    public List<String> matchedTerms(NormalizedUtterance utterance) {
        List<String> matched = new ArrayList<>();
        for (String token : utterance.tokens()) {
            if (terms.contains(token)) {
                matched.add(token);
            } else if (token.length() > 3 && token.endsWith("s") && terms.contains(token.substring(0, token.length() - 1))) {
                matched.add(token.substring(0, token.length() - 1));
            }
        }
        for (String phrase : phrases) {
            if (utterance.containsPhrase(phrase)) {
                matched.add(phrase);
            }
        }
        return matched;
    }
}
