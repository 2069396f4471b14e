package com.abba.answerdesk.infrastructure.web;

import com.abba.answerdesk.application.messaging.conversation.ConversationController;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.OperatorPreference;
import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.service.MessageService;
import com.abba.answerdesk.domain.service.OperatorPreferenceService;
import com.abba.answerdesk.domain.service.ResponseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/operator")
public class OperatorCommandController {

    private static final Logger log = LoggerFactory.getLogger(OperatorCommandController.class);

    private final ConversationController conversationController;
    private final OperatorPreferenceService operatorPreferenceService;
    private final MessageService messageService;
    private final ResponseService responseService;

    public OperatorCommandController(ConversationController conversationController,
                                     OperatorPreferenceService operatorPreferenceService,
                                     MessageService messageService,
                                     ResponseService responseService) {
        this.conversationController = conversationController;
        this.operatorPreferenceService = operatorPreferenceService;
        this.messageService = messageService;
        this.responseService = responseService;
    }

    @PostMapping(path = "/commands", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OperatorReply> command(@RequestBody OperatorCommandRequest request) {
        if (request == null || request.operatorId() == null || request.operatorId().isBlank()) {
            throw new IllegalArgumentException("operatorId is required");
        }
        log.debug("Command from operator {} length={}", request.operatorId(),
                request.text() == null ? 0 : request.text().length());
        return ResponseEntity.ok(conversationController.handle(request.operatorId(), request.text()));
    }

    @GetMapping("/messages/pending")
    public List<Message> pendingMessages() {
        return messageService.getPendingMessages();
    }

    @GetMapping("/messages/{messageId}/responses")
    public ResponseEntity<List<Response>> responses(@PathVariable String messageId) {
        if (messageService.findById(messageId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(responseService.findByMessageId(messageId));
    }

    @GetMapping("/preferences")
    public ResponseEntity<OperatorPreference> preferences() {
        return operatorPreferenceService.getPreferences()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping(path = "/preferences", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OperatorPreference> updatePreferences(@RequestBody OperatorPreference preference) {
        OperatorPreference saved = operatorPreferenceService.savePreferences(preference);
        log.info("Operator preferences updated, writing style={}", saved.getWritingStyle());
        return ResponseEntity.ok(saved);
    }
}
