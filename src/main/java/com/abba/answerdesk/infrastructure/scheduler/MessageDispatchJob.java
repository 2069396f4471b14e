package com.abba.answerdesk.infrastructure.scheduler;

import com.abba.answerdesk.application.service.MessageDispatcher;
import com.abba.answerdesk.infrastructure.config.DispatcherProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "answerdesk.dispatcher", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessageDispatchJob implements SchedulingConfigurer {

    private final MessageDispatcher messageDispatcher;
    private final DispatcherProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private volatile boolean lastCycleFailed;

    public MessageDispatchJob(MessageDispatcher messageDispatcher, DispatcherProperties properties) {
        this.messageDispatcher = messageDispatcher;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        log.info("Starting message polling every {}", properties.getInterval());
        taskRegistrar.addTriggerTask(this::runCycle, this::nextExecution);
    }

    public void runCycle() {
        if (!running.get()) {
            log.debug("Dispatcher stopped, skipping cycle");
            return;
        }
        try {
            messageDispatcher.dispatchOnce();
            lastCycleFailed = false;
        } catch (RuntimeException e) {
            lastCycleFailed = true;
            log.error("Error in message polling, retrying in {}: {}", properties.getErrorBackoff(), e.getMessage(), e);
        }
    }

    Instant nextExecution(TriggerContext context) {
        if (!running.get()) {
            return null;
        }
        Instant lastCompletion = context.lastCompletion();
        Instant base = lastCompletion != null ? lastCompletion : context.getClock().instant();
        return base.plus(nextDelay());
    }

    Duration nextDelay() {
        return lastCycleFailed ? properties.getErrorBackoff() : properties.getInterval();
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Message polling stopped");
        }
    }
}
