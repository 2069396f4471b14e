package com.abba.answerdesk.application.service;

import com.abba.answerdesk.domain.model.Response;
import com.abba.answerdesk.domain.model.ResponseType;
import com.abba.answerdesk.domain.repository.MessageRepository;
import com.abba.answerdesk.domain.repository.ResponseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResponseServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ResponseRepository responseRepository;
    private MessageRepository messageRepository;
    private ResponseServiceImpl service;

    @BeforeEach
    void setUp() {
        responseRepository = mock(ResponseRepository.class);
        messageRepository = mock(MessageRepository.class);
        when(responseRepository.save(any(Response.class))).thenAnswer(invocation -> invocation.getArgument(0));
        service = new ResponseServiceImpl(responseRepository, messageRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void responsesRequireAnExistingMessage() {
        when(messageRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> service.saveResponse("missing", "hi", ResponseType.MANUAL))
                .isInstanceOf(IllegalArgumentException.class);
        verify(responseRepository, never()).save(any());
    }

    @Test
    void savedResponsesStartUnsent() {
        when(messageRepository.existsById("m1")).thenReturn(true);

        Response response = service.saveResponse("m1", "Thanks!", ResponseType.GENERATED);

        assertThat(response.isSent()).isFalse();
        assertThat(response.getSentAt()).isNull();
        assertThat(response.getGeneratedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void responsesAreMarkedAsSentOnce() {
        Response response = Response.of("m1", "Thanks!", ResponseType.MANUAL);
        response.setId("r1");
        when(responseRepository.findById("r1")).thenReturn(Optional.of(response));

        Optional<Response> first = service.markAsSent("r1");
        Optional<Response> second = service.markAsSent("r1");

        assertThat(first).hasValueSatisfying(sent -> {
            assertThat(sent.isSent()).isTrue();
            assertThat(sent.getSentAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        });
        assertThat(second).isEmpty();
    }

    @Test
    void updatingAMissingResponseChangesNothing() {
        when(responseRepository.findById("r404")).thenReturn(Optional.empty());

        assertThat(service.updateContent("r404", "new text")).isEmpty();
        verify(responseRepository, never()).save(any());
    }
}
