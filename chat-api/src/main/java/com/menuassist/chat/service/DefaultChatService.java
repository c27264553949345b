package com.menuassist.chat.service;

import com.menuassist.chat.cache.CacheKeys;
import com.menuassist.chat.model.ChatMessage;
import com.menuassist.chat.model.ChatReply;
import com.menuassist.chat.model.ChatRequest;
import com.menuassist.chat.model.Recommendation;
import com.menuassist.chat.model.StreamEnvelope;
import com.menuassist.chat.service.analytics.AnalyticsEvent;
import com.menuassist.chat.service.analytics.AnalyticsRecorder;
import com.menuassist.chat.service.config.RestaurantAiConfig;
import com.menuassist.chat.service.config.RestaurantAiConfigService;
import com.menuassist.chat.service.context.AssembledContext;
import com.menuassist.chat.service.context.ContextAssembler;
import com.menuassist.chat.service.context.CustomerIntent;
import com.menuassist.chat.service.conversation.ConversationSession;
import com.menuassist.chat.service.conversation.ConversationStore;
import com.menuassist.chat.service.conversation.RecordedTurn;
import com.menuassist.chat.service.conversation.TurnSlot;
import com.menuassist.chat.service.generation.FallbackMessages;
import com.menuassist.chat.service.generation.GeneratedAnswer;
import com.menuassist.chat.service.generation.GenerationEvent;
import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.GenerationRequest;
import com.menuassist.chat.service.generation.ResponseGenerator;
import com.menuassist.chat.service.instant.InstantReply;
import com.menuassist.chat.service.instant.InstantResponseTable;
import com.menuassist.chat.service.knowledge.DeterministicKnowledgeCache;
import com.menuassist.chat.service.knowledge.KnowledgeAnswer;
import com.menuassist.chat.service.knowledge.QuestionClassifier;
import com.menuassist.chat.service.knowledge.QuestionType;
import com.menuassist.chat.service.menu.MenuCatalog;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import com.menuassist.chat.service.menu.RestaurantProfile;
import com.menuassist.chat.service.semantic.SemanticResponseCache;
import com.menuassist.chat.service.suggestion.SuggestionGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Answers a customer message through the response ladder: instant reply, templated knowledge
 * answer, cached generated answer, then generation. The first step that produces an answer wins.
 * <p>
 * A turn takes its place in the conversation when it arrives and is persisted, cached and recorded
 * only once its answer is complete. A streaming client that disconnects early leaves no trace.
 * Once the restaurant is known, any failure is answered with its fallback message.
 */
@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String TTFT_METRIC = "chat.ttft";
    static final String GENERIC_FAILURE_MESSAGE = "Sorry, something went wrong on our side. Please try again.";

    private final MenuCatalog menuCatalog;
    private final RestaurantAiConfigService configService;
    private final ConversationStore conversationStore;
    private final InstantResponseTable instantResponses;
    private final QuestionClassifier questionClassifier;
    private final DeterministicKnowledgeCache knowledgeCache;
    private final SemanticResponseCache semanticCache;
    private final ContextAssembler contextAssembler;
    private final ResponseGenerator responseGenerator;
    private final SuggestionGenerator suggestionGenerator;
    private final AnalyticsRecorder analyticsRecorder;
    private final MeterRegistry meterRegistry;

    public DefaultChatService(MenuCatalog menuCatalog,
                              RestaurantAiConfigService configService,
                              ConversationStore conversationStore,
                              InstantResponseTable instantResponses,
                              QuestionClassifier questionClassifier,
                              DeterministicKnowledgeCache knowledgeCache,
                              SemanticResponseCache semanticCache,
                              ContextAssembler contextAssembler,
                              ResponseGenerator responseGenerator,
                              SuggestionGenerator suggestionGenerator,
                              AnalyticsRecorder analyticsRecorder,
                              MeterRegistry meterRegistry) {
        this.menuCatalog = menuCatalog;
        this.configService = configService;
        this.conversationStore = conversationStore;
        this.instantResponses = instantResponses;
        this.questionClassifier = questionClassifier;
        this.knowledgeCache = knowledgeCache;
        this.semanticCache = semanticCache;
        this.contextAssembler = contextAssembler;
        this.responseGenerator = responseGenerator;
        this.suggestionGenerator = suggestionGenerator;
        this.analyticsRecorder = analyticsRecorder;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Mono<ChatReply> chat(ChatRequest request) {
        return blocking(() -> findRestaurant(request))
                .flatMap(restaurant -> blocking(() -> openTurn(request, restaurant, false))
                        .flatMap(turn -> blocking(() -> lookupCached(turn))
                                .flatMap(lookup -> lookup.hit()
                                        .map(Mono::just)
                                        .orElseGet(() -> generate(turn, lookup.menu())))
                                .flatMap(resolution -> blocking(() -> complete(turn, resolution))))
                        .onErrorResume(error -> {
                            log.error("Chat turn failed for restaurant {}", request.restaurantId(), error);
                            return Mono.just(failureReply(request, FallbackMessages.forRestaurant(restaurant)));
                        }))
                .onErrorResume(error -> !(error instanceof RestaurantNotFoundException), error -> {
                    log.error("Could not load restaurant {}", request.restaurantId(), error);
                    return Mono.just(failureReply(request, GENERIC_FAILURE_MESSAGE));
                });
    }

    @Override
    public Flux<StreamEnvelope> streamChat(ChatRequest request) {
        Timer.Sample ttft = Timer.start(meterRegistry);
        AtomicBoolean firstEmitted = new AtomicBoolean();
        return blocking(() -> findRestaurant(request))
                .flatMapMany(restaurant -> blocking(() -> openTurn(request, restaurant, true))
                        .flatMapMany(turn -> blocking(() -> lookupCached(turn))
                                .flatMapMany(lookup -> lookup.hit()
                                        .map(hit -> Flux.concat(Flux.just(StreamEnvelope.token(hit.text())), finish(turn, hit)))
                                        .orElseGet(() -> streamGenerated(turn, lookup.menu()))))
                        .onErrorResume(error -> {
                            log.error("Streaming turn failed for restaurant {}", request.restaurantId(), error);
                            return Flux.just(StreamEnvelope.error(FallbackMessages.forRestaurant(restaurant)));
                        }))
                .onErrorResume(error -> !(error instanceof RestaurantNotFoundException), error -> {
                    log.error("Could not load restaurant {}", request.restaurantId(), error);
                    return Flux.just(StreamEnvelope.error(GENERIC_FAILURE_MESSAGE));
                })
                .doOnNext(envelope -> {
                    if (firstEmitted.compareAndSet(false, true)) {
                        ttft.stop(meterRegistry.timer(TTFT_METRIC, "restaurant", request.restaurantId()));
                    }
                });
    }

    private Flux<StreamEnvelope> streamGenerated(Turn turn, List<MenuItemKnowledge> menu) {
        return blocking(() -> prepareGeneration(turn, menu))
                .flatMapMany(prepared -> {
                    if (!turn.config().performance().streamingEnabled()) {
                        return responseGenerator.generate(prepared.request())
                                .flatMapMany(answer -> {
                                    Resolution resolution = generatedResolution(answer, menu, prepared.intent());
                                    return Flux.concat(Flux.just(StreamEnvelope.token(answer.text())), finish(turn, resolution));
                                });
                    }
                    return responseGenerator.stream(prepared.request())
                            .concatMap(event -> {
                                if (event.isToken()) {
                                    return Flux.just(StreamEnvelope.token(event.text()));
                                }
                                Resolution resolution = generatedResolution(event.text(), event.fallback(), event.cacheable(),
                                        menu, prepared.intent());
                                if (event.interrupted()) {
                                    return blocking(() -> complete(turn, resolution))
                                            .thenReturn(StreamEnvelope.error(event.text()))
                                            .flux();
                                }
                                return finish(turn, resolution);
                            });
                });
    }

    private Flux<StreamEnvelope> finish(Turn turn, Resolution resolution) {
        return blocking(() -> complete(turn, resolution))
                .thenReturn(StreamEnvelope.done())
                .flux();
    }

    private Mono<Resolution> generate(Turn turn, List<MenuItemKnowledge> menu) {
        return blocking(() -> prepareGeneration(turn, menu))
                .flatMap(prepared -> responseGenerator.generate(prepared.request())
                        .map(answer -> generatedResolution(answer, menu, prepared.intent())));
    }

    private RestaurantProfile findRestaurant(ChatRequest request) {
        return menuCatalog.findRestaurant(request.restaurantId())
                .orElseThrow(() -> new RestaurantNotFoundException(request.restaurantId()));
    }

    private Turn openTurn(ChatRequest request, RestaurantProfile restaurant, boolean streaming) {
        RestaurantAiConfig config = configService.getConfig(request.restaurantId());
        ConversationSession session = conversationStore.openSession(request.restaurantId(), request.sessionId());
        TurnSlot slot = conversationStore.reserveTurn(session);
        return new Turn(request, restaurant, config, slot, ChatMessage.customer(request.message()), streaming, System.nanoTime());
    }

    private CachedLookup lookupCached(Turn turn) {
        String restaurantId = turn.request().restaurantId();
        String message = turn.request().message();

        Optional<InstantReply> instant = instantResponses.match(message);
        if (instant.isPresent()) {
            InstantReply reply = instant.get();
            log.debug("Instant reply {} for restaurant {}", reply.cacheKey(), restaurantId);
            return CachedLookup.hit(new Resolution(ResponseTier.INSTANT, reply.text(), true, false, reply.cacheKey(),
                    null, null, List.of()), List.of());
        }

        List<MenuItemKnowledge> menu = menuCatalog.availableItems(restaurantId);
        Optional<KnowledgeAnswer> knowledge = questionClassifier.classify(message)
                .flatMap(question -> knowledgeCache.lookup(restaurantId, menu, question));
        if (knowledge.isPresent()) {
            KnowledgeAnswer answer = knowledge.get();
            String key = CacheKeys.knowledge(restaurantId, answer.type(), answer.item().id());
            return CachedLookup.hit(new Resolution(ResponseTier.KNOWLEDGE, answer.text(), answer.fromCache(), false, key,
                    answer.type(), null, menu), menu);
        }

        Optional<String> cached = semanticCache.get(restaurantId, message, turn.config());
        if (cached.isPresent()) {
            String key = CacheKeys.semantic(restaurantId, SemanticResponseCache.stableHash(message));
            return CachedLookup.hit(new Resolution(ResponseTier.SEMANTIC, cached.get(), true, false, key, null, null, menu), menu);
        }
        return CachedLookup.miss(menu);
    }

    private PreparedGeneration prepareGeneration(Turn turn, List<MenuItemKnowledge> menu) {
        int historyLimit = contextAssembler.historyLimit(turn.config(), turn.streaming());
        List<ChatMessage> history = conversationStore.recentMessages(turn.session().conversationId(), historyLimit);
        AssembledContext context = contextAssembler.assemble(turn.restaurant(), menu, turn.config(), history, turn.request().message());
        GenerationRequest request = new GenerationRequest(
                turn.request().restaurantId(),
                context.messages(),
                GenerationParameters.from(turn.config()),
                FallbackMessages.forRestaurant(turn.restaurant())
        );
        return new PreparedGeneration(request, context.intent());
    }

    private Resolution generatedResolution(GeneratedAnswer answer, List<MenuItemKnowledge> menu, CustomerIntent intent) {
        return generatedResolution(answer.text(), answer.fallback(), answer.cacheable(), menu, intent);
    }

    private Resolution generatedResolution(String text, boolean fallback, boolean cacheable,
                                           List<MenuItemKnowledge> menu, CustomerIntent intent) {
        ResponseTier tier = fallback ? ResponseTier.FALLBACK : ResponseTier.GENERATED;
        return new Resolution(tier, text, false, cacheable && !fallback, null, null, intent, menu);
    }

    private ChatReply complete(Turn turn, Resolution resolution) {
        ChatRequest request = turn.request();
        List<String> suggestions = suggestionGenerator.suggestions(request.message());
        List<Recommendation> recommendations = resolution.tier() == ResponseTier.FALLBACK
                ? List.of()
                : suggestionGenerator.recommendations(resolution.text(), resolution.menu());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from_cache", resolution.fromCache());
        metadata.put("tier", resolution.tier().tag());
        if (resolution.cacheKey() != null) {
            metadata.put("cache_key", resolution.cacheKey());
        }
        metadata.put("suggestions", suggestions);
        metadata.put("recommendations", recommendations);
        if (resolution.questionType() != null) {
            metadata.put("question_type", resolution.questionType().name());
        }
        if (resolution.intent() != null) {
            metadata.put("intent", resolution.intent().name());
        }
        ChatMessage assistantMessage = ChatMessage.assistant(resolution.text(), metadata);

        String conversationId = turn.session().conversationId();
        try {
            RecordedTurn recorded = conversationStore.recordTurn(turn.slot(), turn.customerMessage(), assistantMessage);
            conversationId = recorded.conversationId();
        } catch (DataAccessException ex) {
            log.error("Failed to persist turn for conversation {}", conversationId, ex);
        }

        if (resolution.tier() == ResponseTier.GENERATED && resolution.cacheable()) {
            semanticCache.put(request.restaurantId(), request.message(), resolution.text(), turn.config());
        }

        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - turn.startedNanos());
        analyticsRecorder.record(new AnalyticsEvent(
                request.restaurantId(),
                conversationId,
                resolution.tier(),
                resolution.fromCache(),
                resolution.cacheKey(),
                turn.streaming(),
                resolution.questionType(),
                resolution.intent(),
                latencyMillis
        ));
        log.debug("Answered restaurant {} session {} from tier {} in {} ms",
                request.restaurantId(), request.sessionId(), resolution.tier(), latencyMillis);

        return new ChatReply(resolution.text(), suggestions, recommendations, conversationId, assistantMessage.id().toString());
    }

    private ChatReply failureReply(ChatRequest request, String text) {
        return new ChatReply(text, suggestionGenerator.suggestions(request.message()), List.of(), null,
                UUID.randomUUID().toString());
    }

    private static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    private record Turn(ChatRequest request,
                        RestaurantProfile restaurant,
                        RestaurantAiConfig config,
                        TurnSlot slot,
                        ChatMessage customerMessage,
                        boolean streaming,
                        long startedNanos) {

        ConversationSession session() {
            return slot.session();
        }
    }

    private record Resolution(ResponseTier tier,
                              String text,
                              boolean fromCache,
                              boolean cacheable,
                              String cacheKey,
                              QuestionType questionType,
                              CustomerIntent intent,
                              List<MenuItemKnowledge> menu) {
    }

    private record CachedLookup(Optional<Resolution> hit, List<MenuItemKnowledge> menu) {

        static CachedLookup hit(Resolution resolution, List<MenuItemKnowledge> menu) {
            return new CachedLookup(Optional.of(resolution), menu);
        }

        static CachedLookup miss(List<MenuItemKnowledge> menu) {
            return new CachedLookup(Optional.empty(), menu);
        }
    }

    private record PreparedGeneration(GenerationRequest request, CustomerIntent intent) {
    }
}
