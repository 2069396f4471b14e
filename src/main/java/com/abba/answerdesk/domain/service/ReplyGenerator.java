package com.abba.answerdesk.domain.service;

// Implementations never propagate failures: they fall back to FALLBACK_REPLY or the original text.
public interface ReplyGenerator {

    String FALLBACK_REPLY = "I apologize, but I'm having trouble generating a response right now. "
            + "Please try again or respond manually.";

    String draft(String systemPrompt, String userPrompt, int maxTokens);

    String revise(String originalText, String feedback);
}
