package com.menuassist.chat.service.generation;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Produces an assistant answer from a prompt. Implementations never signal an error: provider
 * failures surface as a fallback answer.
 */
public interface ResponseGenerator {

    Mono<GeneratedAnswer> generate(GenerationRequest request);

    Flux<GenerationEvent> stream(GenerationRequest request);
}
