package com.volunteermedia.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.volunteermedia.model.OutboxEvent;
import com.volunteermedia.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes notification events to the outbox table.
 *
 * Must run inside the caller's transaction: the event row commits or rolls back
 * together with the announcement/update that produced it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent enqueue(Object event, String eventId, String topic, String messageKey) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for outbox: {}", eventId, e);
            throw new IllegalStateException("Failed to save event to outbox", e);
        }

        OutboxEvent outboxEvent = new OutboxEvent();
        outboxEvent.setEventId(eventId);
        outboxEvent.setEventType(event.getClass().getSimpleName());
        outboxEvent.setPayload(payload);
        outboxEvent.setTopic(topic);
        outboxEvent.setMessageKey(messageKey);

        OutboxEvent saved = outboxEventRepository.save(outboxEvent);
        log.info("Saved {} event to outbox: {}", outboxEvent.getEventType(), eventId);
        return saved;
    }
}
