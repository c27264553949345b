package com.menuassist.chat.controller;

import com.menuassist.chat.model.ChatFeedback;
import com.menuassist.chat.model.ChatReply;
import com.menuassist.chat.model.ChatRequestFactory;
import com.menuassist.chat.model.ChatSubmission;
import com.menuassist.chat.model.StreamEnvelope;
import com.menuassist.chat.service.ChatService;
import com.menuassist.chat.service.analytics.ChatAnalyticsService;
import com.menuassist.chat.service.analytics.ChatAnalyticsSummary;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/restaurants/{restaurantId}/chat")
public class ChatController {

    private final ChatService chatService;
    private final ChatAnalyticsService analyticsService;

    public ChatController(ChatService chatService, ChatAnalyticsService analyticsService) {
        this.chatService = chatService;
        this.analyticsService = analyticsService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatReply> chat(@PathVariable String restaurantId, @Valid @RequestBody ChatSubmission submission) {
        return chatService.chat(ChatRequestFactory.fromSubmission(restaurantId, submission));
    }

    @PostMapping(path = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<StreamEnvelope> stream(@PathVariable String restaurantId, @Valid @RequestBody ChatSubmission submission) {
        return chatService.streamChat(ChatRequestFactory.fromSubmission(restaurantId, submission));
    }

    @PostMapping(path = "/feedback", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Void>> feedback(@PathVariable String restaurantId, @Valid @RequestBody ChatFeedback feedback) {
        return Mono.fromRunnable(() -> analyticsService.recordFeedback(restaurantId, feedback))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping(path = "/analytics", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatAnalyticsSummary> analytics(@PathVariable String restaurantId,
                                                @RequestParam(defaultValue = "7") int days) {
        return Mono.fromCallable(() -> analyticsService.summarize(restaurantId, days))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
