package com.menuassist.chat.controller;

import com.menuassist.chat.service.RestaurantNotFoundException;
import com.menuassist.chat.service.config.RestaurantAiConfig;
import com.menuassist.chat.service.config.RestaurantAiConfigService;
import com.menuassist.chat.service.menu.MenuCatalog;
import com.menuassist.chat.service.speech.SpeechService;
import com.menuassist.chat.service.speech.VoiceCatalog;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Assistant configuration for the config-management collaborator. Bodies are validated by
 * {@link RestaurantAiConfigService#updateConfig}, which reports every violation at once.
 */
@RestController
@RequestMapping(path = "/api/restaurants/{restaurantId}/ai", produces = MediaType.APPLICATION_JSON_VALUE)
public class AiConfigController {

    private final RestaurantAiConfigService configService;
    private final SpeechService speechService;
    private final MenuCatalog menuCatalog;

    public AiConfigController(RestaurantAiConfigService configService, SpeechService speechService, MenuCatalog menuCatalog) {
        this.configService = configService;
        this.speechService = speechService;
        this.menuCatalog = menuCatalog;
    }

    @GetMapping("/config")
    public Mono<RestaurantAiConfig> getConfig(@PathVariable String restaurantId) {
        return Mono.fromCallable(() -> {
                    requireRestaurant(restaurantId);
                    return configService.getConfig(restaurantId);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping(path = "/config", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RestaurantAiConfig> updateConfig(@PathVariable String restaurantId, @RequestBody RestaurantAiConfig config) {
        return Mono.fromCallable(() -> {
                    requireRestaurant(restaurantId);
                    return configService.updateConfig(restaurantId, config);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/voices")
    public Mono<VoiceCatalog> voices(@PathVariable String restaurantId) {
        return Mono.fromRunnable(() -> requireRestaurant(restaurantId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.defer(() -> speechService.voices(restaurantId)));
    }

    private void requireRestaurant(String restaurantId) {
        if (menuCatalog.findRestaurant(restaurantId).isEmpty()) {
            throw new RestaurantNotFoundException(restaurantId);
        }
    }
}
