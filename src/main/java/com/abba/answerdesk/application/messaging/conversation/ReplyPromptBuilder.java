package com.abba.answerdesk.application.messaging.conversation;

import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.OperatorPreference;
import com.abba.answerdesk.domain.service.OperatorPreferenceService;
import com.abba.answerdesk.infrastructure.config.GenerationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class ReplyPromptBuilder {

    private final OperatorPreferenceService operatorPreferenceService;
    private final GenerationProperties generationProperties;

    public String systemPrompt(String platform) {
        StringBuilder prompt = new StringBuilder(String.format("""
                You are a helpful AI assistant that generates responses for %s messages.

                Your responses should be:
                - Professional and appropriate for the platform
                - Concise and to the point
                - Friendly but not overly casual
                - Maximum %d characters

                Platform-specific guidelines:
                - LinkedIn: Professional networking tone
                - Telegram: Conversational and friendly
                - Facebook: Social and engaging
                - Instagram: Visual and trendy
                - Gmail: Professional email tone
                """, platform, generationProperties.getMaxTokens()));

        Optional<OperatorPreference> preferences = loadPreferences();
        String style = preferences.map(OperatorPreference::getWritingStyle)
                .filter(value -> !value.isBlank())
                .orElse(generationProperties.getDefaultWritingStyle());
        prompt.append("\nWriting style: ").append(style);

        preferences.ifPresent(preference -> {
            appendList(prompt, "Personality traits: ", preference.getPersonalityTraits(), ", ");
            appendList(prompt, "Interests: ", preference.getInterests(), ", ");
            appendList(prompt, "Response rules:\n", bullets(preference.getResponseRules()), "\n");
        });
        return prompt.toString();
    }

    public String userPrompt(Message message) {
        return String.format("""
                Please generate a response to this %s message:

                Sender: %s
                Message: %s

                Generate a natural, contextual response that would be appropriate for this conversation.
                """, message.getPlatform(), message.getSender(), message.getContent());
    }

    private Optional<OperatorPreference> loadPreferences() {
        try {
            return operatorPreferenceService.getPreferences();
        } catch (PersistenceException e) {
            log.warn("Drafting without operator preferences: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void appendList(StringBuilder prompt, String label, List<String> values, String separator) {
        if (values == null || values.isEmpty()) {
            return;
        }
        prompt.append('\n').append(label).append(String.join(separator, values));
    }

    private List<String> bullets(List<String> rules) {
        if (rules == null) {
            return List.of();
        }
        return rules.stream().map(rule -> "- " + rule).collect(Collectors.toList());
    }
}
