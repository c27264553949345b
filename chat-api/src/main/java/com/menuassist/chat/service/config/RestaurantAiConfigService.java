package com.menuassist.chat.service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.config.AssistantProperties;
import com.menuassist.chat.persistence.entity.RestaurantAiConfigEntity;
import com.menuassist.chat.persistence.repository.RestaurantAiConfigRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Loads and updates {@link RestaurantAiConfig}. Reads never fail: a missing or unreadable stored
 * configuration yields the defaults. Updates are validated before anything is written.
 */
@Service
@Transactional
public class RestaurantAiConfigService {

    private static final Logger log = LoggerFactory.getLogger(RestaurantAiConfigService.class);

    private final RestaurantAiConfigRepository repository;
    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final AssistantProperties properties;

    public RestaurantAiConfigService(RestaurantAiConfigRepository repository,
                                     Validator validator,
                                     ObjectMapper objectMapper,
                                     AssistantProperties properties) {
        this.repository = repository;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public RestaurantAiConfig defaultConfig() {
        AssistantProperties.Provider provider = properties.getProvider();
        int timeoutSeconds = (int) Math.min(120, Math.max(1, provider.getTimeout().toSeconds()));
        return RestaurantAiConfig.defaults(provider.getDefaultName(), provider.getDefaultModel(), timeoutSeconds);
    }

    @Transactional(readOnly = true)
    public RestaurantAiConfig getConfig(String restaurantId) {
        return repository.findById(restaurantId)
                .map(entity -> fromJson(restaurantId, entity.getConfigJson()))
                .orElseGet(this::defaultConfig);
    }

    public RestaurantAiConfig updateConfig(String restaurantId, RestaurantAiConfig config) {
        if (config == null) {
            throw new InvalidConfigException(List.of("configuration: must not be null"));
        }
        RestaurantAiConfig candidate = config.provider() == null || config.provider().isBlank()
                ? config.withProvider(properties.getProvider().getDefaultName())
                : config;
        Set<ConstraintViolation<RestaurantAiConfig>> violations = validator.validate(candidate);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .toList();
            log.info("Rejected assistant configuration for restaurant {}: {}", restaurantId, messages);
            throw new InvalidConfigException(messages);
        }
        String json = toJson(candidate);
        RestaurantAiConfigEntity entity = repository.findById(restaurantId)
                .orElseGet(() -> new RestaurantAiConfigEntity(restaurantId, json));
        entity.setConfigJson(json);
        repository.save(entity);
        log.debug("Updated assistant configuration for restaurant {}", restaurantId);
        return candidate;
    }

    private RestaurantAiConfig fromJson(String restaurantId, String json) {
        try {
            RestaurantAiConfig config = objectMapper.readValue(json, RestaurantAiConfig.class);
            if (config == null || !validator.validate(config).isEmpty()) {
                log.warn("Stored assistant configuration for restaurant {} is invalid, using defaults", restaurantId);
                return defaultConfig();
            }
            return config;
        } catch (JsonProcessingException ex) {
            log.warn("Stored assistant configuration for restaurant {} is unreadable, using defaults: {}",
                    restaurantId, ex.getOriginalMessage());
            return defaultConfig();
        }
    }

    private String toJson(RestaurantAiConfig config) {
        try {
            return objectMapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize assistant configuration", e);
        }
    }
}
