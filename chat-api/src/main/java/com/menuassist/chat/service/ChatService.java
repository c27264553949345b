package com.menuassist.chat.service;

import com.menuassist.chat.model.ChatReply;
import com.menuassist.chat.model.ChatRequest;
import com.menuassist.chat.model.StreamEnvelope;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ChatService {

    Mono<ChatReply> chat(ChatRequest request);

    /**
     * Token envelopes followed by a single {@code done}, or by an {@code error} envelope when
     * generation failed after tokens had already been sent.
     */
    Flux<StreamEnvelope> streamChat(ChatRequest request);
}
