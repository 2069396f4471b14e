package com.abba.answerdesk.infrastructure.web;

import com.abba.answerdesk.application.messaging.conversation.ConversationController;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply;
import com.abba.answerdesk.application.messaging.conversation.OperatorReply.SuggestedAction;
import com.abba.answerdesk.domain.exception.PersistenceException;
import com.abba.answerdesk.domain.model.Message;
import com.abba.answerdesk.domain.model.OperatorPreference;
import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.model.ResponseType;
import com.abba.answerdesk.domain.service.MessageService;
import com.abba.answerdesk.domain.service.OperatorPreferenceService;
import com.abba.answerdesk.domain.service.ResponseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class OperatorCommandControllerTest {

    private ConversationController conversationController;
    private OperatorPreferenceService preferenceService;
    private MessageService messageService;
    private ResponseService responseService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        conversationController = mock(ConversationController.class);
        preferenceService = mock(OperatorPreferenceService.class);
        messageService = mock(MessageService.class);
        responseService = mock(ResponseService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new OperatorCommandController(conversationController, preferenceService,
                        messageService, responseService))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void commandsAreForwardedToTheConversation() throws Exception {
        when(conversationController.handle("op-1", "next")).thenReturn(OperatorReply.withActions("New Message from telegram",
                new SuggestedAction("Generate Response", "generate:m1")));

        mockMvc.perform(post("/api/operator/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operatorId\":\"op-1\",\"text\":\"next\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("New Message from telegram"))
                .andExpect(jsonPath("$.actions[0].command").value("generate:m1"));
    }

    @Test
    void commandsWithoutOperatorAreRejected() throws Exception {
        mockMvc.perform(post("/api/operator/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"next\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("operatorId is required"));
        verifyNoInteractions(conversationController);
    }

    @Test
    void missingPreferencesAreNotFound() throws Exception {
        when(preferenceService.getPreferences()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/operator/preferences"))
                .andExpect(status().isNotFound());
    }

    @Test
    void preferencesCanBeUpdated() throws Exception {
        when(preferenceService.savePreferences(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(put("/api/operator/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"writingStyle\":\"casual\",\"interests\":[\"sailing\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.writingStyle").value("casual"))
                .andExpect(jsonPath("$.interests[0]").value("sailing"));
    }

    @Test
    void storageFailuresMapToServiceUnavailable() throws Exception {
        when(preferenceService.savePreferences(any(OperatorPreference.class)))
                .thenThrow(new PersistenceException("Failed to save operator preferences", new RuntimeException("down")));

        mockMvc.perform(put("/api/operator/preferences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"writingStyle\":\"casual\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Failed to save operator preferences"));
    }

    @Test
    void listsPendingMessages() throws Exception {
        Message message = new Message();
        message.setId("m1");
        message.setSender("alice");
        when(messageService.getPendingMessages()).thenReturn(List.of(message));

        mockMvc.perform(get("/api/operator/messages/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("m1"))
                .andExpect(jsonPath("$[0].status").value("PENDING"));
    }

    @Test
    void listsResponsesOfAKnownMessage() throws Exception {
        when(messageService.findById("m1")).thenReturn(Optional.of(new Message()));
        when(responseService.findByMessageId("m1")).thenReturn(List.of(Response.of("m1", "Sure!", ResponseType.GENERATED)));

        mockMvc.perform(get("/api/operator/messages/m1/responses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("Sure!"))
                .andExpect(jsonPath("$[0].sent").value(false));

        when(messageService.findById("m404")).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/operator/messages/m404/responses"))
                .andExpect(status().isNotFound());
    }
}
