package com.menuassist.chat.service.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.persistence.entity.InteractionAnalyticsEntity;
import com.menuassist.chat.persistence.repository.InteractionAnalyticsRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class JpaAnalyticsRecorder implements AnalyticsRecorder {

    private static final Logger log = LoggerFactory.getLogger(JpaAnalyticsRecorder.class);
    private static final String RESPONSES_METRIC = "chat.responses";

    private final InteractionAnalyticsRepository repository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public JpaAnalyticsRecorder(InteractionAnalyticsRepository repository,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void record(AnalyticsEvent event) {
        meterRegistry.counter(RESPONSES_METRIC,
                        "tier", event.tier().tag(),
                        "streaming", Boolean.toString(event.streaming()))
                .increment();
        try {
            repository.save(new InteractionAnalyticsEntity(
                    event.restaurantId(),
                    event.conversationId(),
                    AnalyticsEvent.EVENT_TYPE,
                    toJson(event)
            ));
        } catch (DataAccessException | JsonProcessingException ex) {
            log.warn("Failed to record analytics for restaurant {}: {}", event.restaurantId(), ex.getMessage());
        }
    }

    private String toJson(AnalyticsEvent event) throws JsonProcessingException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tier", event.tier().tag());
        data.put("from_cache", event.fromCache());
        if (event.cacheKey() != null) {
            data.put("cache_key", event.cacheKey());
        }
        data.put("streaming", event.streaming());
        if (event.questionType() != null) {
            data.put("question_type", event.questionType().name());
        }
        if (event.intent() != null) {
            data.put("intent", event.intent().name());
        }
        data.put("latency_ms", event.latencyMillis());
        return objectMapper.writeValueAsString(data);
    }
}
