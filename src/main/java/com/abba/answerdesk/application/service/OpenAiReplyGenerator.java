package com.abba.answerdesk.application.service;

import com.abba.answerdesk.domain.service.ReplyGenerator;
import com.abba.answerdesk.infrastructure.config.GenerationProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class OpenAiReplyGenerator implements ReplyGenerator {

    private static final String REVISE_SYSTEM_PROMPT = """
            You are an AI assistant that improves responses based on user feedback.
            Make the requested changes while maintaining the core message and tone.
            """;

    private final OpenAiChatModel openAiChatModel;
    private final GenerationProperties properties;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "reply-generator");
        thread.setDaemon(true);
        return thread;
    });

    public OpenAiReplyGenerator(OpenAiChatModel openAiChatModel, GenerationProperties properties) {
        this.openAiChatModel = openAiChatModel;
        this.properties = properties;
    }

    @Override
    public String draft(String systemPrompt, String userPrompt, int maxTokens) {
        try {
            return complete(systemPrompt, userPrompt, maxTokens);
        } catch (Exception e) {
            log.error("Error generating AI response: {}", e.getMessage());
            return FALLBACK_REPLY;
        }
    }

    @Override
    public String revise(String originalText, String feedback) {
        String userPrompt = String.format("""
                Original response: %s

                User feedback: %s

                Please provide an improved version of the response based on the feedback.
                """, originalText, feedback);
        try {
            return complete(REVISE_SYSTEM_PROMPT, userPrompt, properties.getMaxTokens());
        } catch (Exception e) {
            log.error("Error improving response: {}", e.getMessage());
            return originalText;
        }
    }

    private String complete(String systemPrompt, String userPrompt, int maxTokens)
            throws InterruptedException, ExecutionException, TimeoutException {

        log.debug("Sending prompt to OpenAI: {}", userPrompt);

        List<Message> messages = List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt));
        var prompt = new Prompt(messages, OpenAiChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(0.7)
                .build());

        CompletableFuture<ChatResponse> call = CompletableFuture.supplyAsync(() -> openAiChatModel.call(prompt), executor);
        ChatResponse response;
        try {
            response = call.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }

        String text = response == null || response.getResult() == null ? null : response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Empty completion");
        }

        log.debug("Response: {}", text);

        return text.strip();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
