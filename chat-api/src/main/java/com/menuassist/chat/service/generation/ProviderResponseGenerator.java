package com.menuassist.chat.service.generation;

import com.menuassist.chat.service.generation.provider.AiProvider;
import com.menuassist.chat.service.generation.provider.AiProviderRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs generation against the provider selected for the restaurant and turns every failure
 * (error, timeout, malformed output) into the request's fallback message.
 * <p>
 * The timeout bounds the whole non-streaming call and, when streaming, the wait for each next
 * fragment.
 */
@Component
public class ProviderResponseGenerator implements ResponseGenerator {

    private static final Logger log = LoggerFactory.getLogger(ProviderResponseGenerator.class);

    private final AiProviderRegistry providerRegistry;
    private final Map<ProviderFailure, Counter> failureCounters = new EnumMap<>(ProviderFailure.class);

    public ProviderResponseGenerator(AiProviderRegistry providerRegistry, MeterRegistry meterRegistry) {
        this.providerRegistry = providerRegistry;
        for (ProviderFailure failure : ProviderFailure.values()) {
            failureCounters.put(failure, Counter.builder("chat.provider.failures")
                    .description("Provider calls that ended in the fallback message")
                    .tag("kind", failure.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    @Override
    public Mono<GeneratedAnswer> generate(GenerationRequest request) {
        AiProvider provider = providerRegistry.resolve(request.parameters().provider());
        return Mono.defer(() -> provider.generateText(request.messages(), request.parameters()))
                .timeout(request.parameters().timeout())
                .filter(text -> !text.isBlank())
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderFailure.MALFORMED_RESPONSE, "Provider returned an empty answer")))
                .map(text -> GeneratedAnswer.success(text, provider.answersCacheable()))
                .onErrorResume(error -> Mono.just(GeneratedAnswer.fallback(request.fallbackMessage(), recordFailure(provider, request, error))));
    }

    @Override
    public Flux<GenerationEvent> stream(GenerationRequest request) {
        AiProvider provider = providerRegistry.resolve(request.parameters().provider());
        return Flux.defer(() -> {
            StringBuilder content = new StringBuilder();
            AtomicBoolean emitted = new AtomicBoolean();
            return Flux.defer(() -> provider.streamText(request.messages(), request.parameters()))
                    .timeout(request.parameters().timeout())
                    .filter(fragment -> !fragment.isEmpty())
                    .map(fragment -> {
                        content.append(fragment);
                        emitted.set(true);
                        return GenerationEvent.token(fragment);
                    })
                    .concatWith(Flux.defer(() -> {
                        if (content.toString().isBlank()) {
                            return Flux.error(new ProviderException(ProviderFailure.MALFORMED_RESPONSE, "Provider stream produced no content"));
                        }
                        return Flux.just(GenerationEvent.done(content.toString(), provider.answersCacheable()));
                    }))
                    .onErrorResume(error -> {
                        recordFailure(provider, request, error);
                        String fallback = request.fallbackMessage();
                        if (emitted.get()) {
                            return Flux.just(GenerationEvent.fallbackDone(fallback, true));
                        }
                        return Flux.just(GenerationEvent.token(fallback), GenerationEvent.fallbackDone(fallback, false));
                    });
        });
    }

    private ProviderFailure recordFailure(AiProvider provider, GenerationRequest request, Throwable error) {
        ProviderFailure failure = ProviderFailure.classify(error);
        failureCounters.get(failure).increment();
        if (failure == ProviderFailure.ERROR && !(error instanceof ProviderException)) {
            log.error("Unexpected error from provider {} for restaurant {}", provider.name(), request.restaurantId(), error);
        } else {
            log.warn("Provider {} failed for restaurant {} ({}): {}", provider.name(), request.restaurantId(), failure, error.getMessage());
        }
        return failure;
    }
}
