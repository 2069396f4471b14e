package com.abba.answerdesk.application.messaging.conversation;

import com.abba.answerdesk.application.connector.PlatformConnectorRegistry;
import com.abba.answerdesk.application.messaging.command.CommandType;
import com.abba.answerdesk.application.messaging.command.OperatorCommand;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply.SuggestedAction;
import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.MessageCategory;
import com.abba.answerdesk.domain.model.MessageStatus;
import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.model.ResponseType;
import com.abba.answerdesk.domain.service.MessageService;
import com.abba.answerdesk.domain.service.ReplyGenerator;
import com.abba.answerdesk.domain.service.ResponseService;
import com.abba.answerdesk.infrastructure.config.GenerationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationController {

    static final String HELP_TEXT = """
            Welcome to AnswerDesk!

            Commands:
            next - Process next message in queue
            generate:<message id> - Draft a reply with AI
            manual:<message id> - Type the reply yourself
            ignore:<message id> - Skip the message
            edit:<response id> - Describe changes to a draft
            send:<response id> - Send a draft
            """;

    private final OperatorSessionStore sessionStore;
    private final MessageService messageService;
    private final ResponseService responseService;
    private final ReplyGenerator replyGenerator;
    private final ReplyPromptBuilder replyPromptBuilder;
    private final PlatformConnectorRegistry connectorRegistry;
    private final GenerationProperties generationProperties;

    public OperatorReply handle(String operatorId, String input) {
        OperatorCommand command = OperatorCommand.parse(input);
        log.debug("Operator {} issued {}", operatorId, command.type());
        try {
            if (command.type().isTargeted() && !sessionOf(operatorId).isIdle() && !targetExists(command)) {
                log.debug("Operator {} input names no known target, completing the pending request with it", operatorId);
                return freeText(operatorId, input.trim());
            }
            return switch (command.type()) {
                case HELP -> OperatorReply.text(HELP_TEXT);
                case NEXT -> next();
                case GENERATE -> generate(operatorId, command.argument());
                case IGNORE -> ignore(operatorId, command.argument());
                case MANUAL -> manual(operatorId, command.argument());
                case EDIT -> edit(operatorId, command.argument());
                case SEND -> send(operatorId, command.argument());
                case TEXT -> freeText(operatorId, command.argument());
            };
        } catch (PersistenceException e) {
            log.error("Operator {} command {} failed: {}", operatorId, command.type(), e.getMessage());
            return OperatorReply.text("Storage is unavailable right now, nothing was changed. Please try again.");
        }
    }

    public OperatorSession sessionOf(String operatorId) {
        return sessionStore.get(operatorId);
    }

    private boolean targetExists(OperatorCommand command) {
        return switch (command.type()) {
            case GENERATE, IGNORE, MANUAL -> messageService.findById(command.argument()).isPresent();
            case EDIT, SEND -> responseService.findById(command.argument()).isPresent();
            default -> true;
        };
    }

    private OperatorReply next() {
        Optional<Message> next = messageService.getNextPendingMessage();
        if (next.isEmpty()) {
            return OperatorReply.text("No pending messages in queue!");
        }
        Message message = next.get();
        messageService.markAsProcessing(message.getId());
        String text = String.format("""
                New Message from %s

                From: %s
                Category: %s
                Content: %s

                What would you like to do?
                """, message.getPlatform(), message.getSender(), categoryOf(message), message.getContent());
        return OperatorReply.withActions(text,
                action("Generate Response", CommandType.GENERATE, message.getId()),
                action("Ignore", CommandType.IGNORE, message.getId()),
                action("Answer Manually", CommandType.MANUAL, message.getId()));
    }

    private OperatorReply generate(String operatorId, String messageId) {
        Optional<Message> found = messageService.findById(messageId);
        if (found.isEmpty()) {
            return OperatorReply.text("Message " + messageId + " not found.");
        }
        sessionStore.reset(operatorId);
        Message message = found.get();
        if (message.getStatus().isTerminal()) {
            return OperatorReply.text("Message " + messageId + " is already "
                    + message.getStatus().name().toLowerCase(Locale.ROOT) + ".");
        }
        if (message.getStatus() == MessageStatus.PENDING) {
            messageService.markAsProcessing(messageId);
        }

        String draft = draftFor(message);
        Response response = responseService.saveResponse(messageId, draft, ResponseType.GENERATED);
        return reviewReply("Generated Response", response, true);
    }

    private OperatorReply manual(String operatorId, String messageId) {
        Optional<Message> found = messageService.findById(messageId);
        if (found.isEmpty()) {
            return OperatorReply.text("Message " + messageId + " not found.");
        }
        sessionStore.put(operatorId, OperatorSession.awaitingManualResponse(messageId));
        return OperatorReply.text("Please type your manual response:");
    }

    private OperatorReply ignore(String operatorId, String messageId) {
        if (messageService.findById(messageId).isEmpty()) {
            return OperatorReply.text("Message " + messageId + " not found.");
        }
        sessionStore.reset(operatorId);
        if (!messageService.markAsIgnored(messageId)) {
            return OperatorReply.text("Message " + messageId + " could not be ignored.");
        }
        return OperatorReply.text("Message ignored. Use next for next message.");
    }

    private OperatorReply edit(String operatorId, String responseId) {
        Optional<Response> found = responseService.findById(responseId);
        if (found.isEmpty()) {
            return OperatorReply.text("Response " + responseId + " not found.");
        }
        if (found.get().isSent()) {
            sessionStore.reset(operatorId);
            return OperatorReply.text("Response " + responseId + " was already sent and can no longer be edited.");
        }
        sessionStore.put(operatorId, OperatorSession.awaitingEditFeedback(responseId));
        return OperatorReply.text("Describe how to edit the response:");
    }

    private OperatorReply send(String operatorId, String responseId) {
        Optional<Response> found = responseService.findById(responseId);
        if (found.isEmpty()) {
            return OperatorReply.text("Response " + responseId + " not found.");
        }
        sessionStore.reset(operatorId);
        Response response = found.get();
        if (response.isSent()) {
            return OperatorReply.text("Response " + responseId + " was already sent.");
        }
        Optional<Message> message = messageService.findById(response.getMessageId());
        if (message.isEmpty()) {
            return OperatorReply.text("Message " + response.getMessageId() + " for this response no longer exists.");
        }
        if (responseService.markAsSent(responseId).isEmpty()) {
            return OperatorReply.text("Response " + responseId + " was already sent.");
        }

        Message target = message.get();
        boolean delivered = connectorRegistry.sendMessage(target.getPlatform(), target.getReplyTo(), response.getContent());
        if (!delivered) {
            log.warn("Response {} marked as sent but delivery to {} failed", responseId, target.getPlatform());
            return OperatorReply.text("Response marked as sent, but delivery to " + target.getPlatform()
                    + " failed. Please reply there directly.");
        }
        messageService.markAsAnswered(target.getId());
        return OperatorReply.text("Response sent! Use next for next message.");
    }

    private OperatorReply freeText(String operatorId, String text) {
        OperatorSession session = sessionStore.get(operatorId);
        return switch (session.state()) {
            case AWAITING_MANUAL_RESPONSE -> completeManualResponse(operatorId, session.targetId(), text);
            case AWAITING_EDIT_FEEDBACK -> completeEdit(operatorId, session.targetId(), text);
            case IDLE -> OperatorReply.text("Nothing is waiting for your input. Use next to process the next message.");
        };
    }

    private OperatorReply completeManualResponse(String operatorId, String messageId, String text) {
        if (text == null || text.isBlank()) {
            return OperatorReply.text("The response cannot be empty. Please type your manual response:");
        }
        try {
            Response response = responseService.saveResponse(messageId, text, ResponseType.MANUAL);
            sessionStore.reset(operatorId);
            return reviewReply("Manual Response", response, false);
        } catch (IllegalArgumentException e) {
            sessionStore.reset(operatorId);
            return OperatorReply.text("Message " + messageId + " no longer exists.");
        }
    }

    private OperatorReply completeEdit(String operatorId, String responseId, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            return OperatorReply.text("Describe how to edit the response:");
        }
        Optional<Response> found = responseService.findById(responseId);
        if (found.isEmpty()) {
            sessionStore.reset(operatorId);
            return OperatorReply.text("Response " + responseId + " no longer exists.");
        }
        String revised = reviseSafely(found.get().getContent(), feedback);
        Optional<Response> updated = responseService.updateContent(responseId, revised);
        sessionStore.reset(operatorId);
        return updated
                .map(response -> reviewReply("Improved Response", response, true))
                .orElseGet(() -> OperatorReply.text("Response " + responseId + " no longer exists."));
    }

    private String draftFor(Message message) {
        try {
            return replyGenerator.draft(
                    replyPromptBuilder.systemPrompt(message.getPlatform()),
                    replyPromptBuilder.userPrompt(message),
                    generationProperties.getMaxTokens());
        } catch (RuntimeException e) {
            log.error("Reply generation failed for message {}: {}", message.getId(), e.getMessage());
            return ReplyGenerator.FALLBACK_REPLY;
        }
    }

    private String reviseSafely(String original, String feedback) {
        try {
            return replyGenerator.revise(original, feedback);
        } catch (RuntimeException e) {
            log.error("Reply revision failed: {}", e.getMessage());
            return original;
        }
    }

    private OperatorReply reviewReply(String title, Response response, boolean editable) {
        String text = title + ":\n\n" + response.getContent() + "\n\nWhat would you like to do?";
        SuggestedAction sendAction = action("Send", CommandType.SEND, response.getId());
        if (!editable) {
            return OperatorReply.withActions(text, sendAction);
        }
        return OperatorReply.withActions(text, sendAction, action("Edit", CommandType.EDIT, response.getId()));
    }

    private String categoryOf(Message message) {
        return message.getCategory() == null ? MessageCategory.GENERAL.key() : message.getCategory().key();
    }

    private SuggestedAction action(String label, CommandType type, String target) {
        return new SuggestedAction(label, OperatorCommand.format(type, target));
    }
}
