package com.menuassist.chat.controller;

import com.menuassist.chat.service.knowledge.MenuCacheInvalidator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Invalidation hooks called by the menu service after item edits and deletions.
 */
@RestController
@RequestMapping("/api/restaurants/{restaurantId}/cache")
public class CacheInvalidationController {

    private final MenuCacheInvalidator invalidator;

    public CacheInvalidationController(MenuCacheInvalidator invalidator) {
        this.invalidator = invalidator;
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> invalidateRestaurant(@PathVariable String restaurantId) {
        return Mono.fromRunnable(() -> invalidator.invalidateRestaurant(restaurantId))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @DeleteMapping("/items/{itemId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> invalidateItem(@PathVariable String restaurantId, @PathVariable String itemId) {
        return Mono.fromRunnable(() -> invalidator.invalidateItem(restaurantId, itemId))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
