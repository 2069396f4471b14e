package com.abba.answerdesk.infrastructure.web;

import com.abba.answerdesk.application.connector.ConnectorStatus;
import com.abba.answerdesk.application.connector.PlatformConnectorRegistry;
import com.abba.answerdesk.infrastructure.config.AnswerDeskProperties;
import com.abba.answerdesk.infrastructure.scheduler.MessageDispatchJob;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/status")
public class StatusController {

    public record StatusView(boolean running, String mode, Map<String, ConnectorStatus> platforms) {
    }

    private final PlatformConnectorRegistry connectorRegistry;
    private final AnswerDeskProperties answerDeskProperties;
    private final ObjectProvider<MessageDispatchJob> dispatchJob;

    public StatusController(PlatformConnectorRegistry connectorRegistry,
                            AnswerDeskProperties answerDeskProperties,
                            ObjectProvider<MessageDispatchJob> dispatchJob) {
        this.connectorRegistry = connectorRegistry;
        this.answerDeskProperties = answerDeskProperties;
        this.dispatchJob = dispatchJob;
    }

    @GetMapping
    public StatusView status() {
        MessageDispatchJob job = dispatchJob.getIfAvailable();
        boolean running = job != null && job.isRunning();
        return new StatusView(running, answerDeskProperties.getMode(), connectorRegistry.getConnectionStatus());
    }
}
