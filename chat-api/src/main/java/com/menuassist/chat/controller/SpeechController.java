package com.menuassist.chat.controller;

import com.menuassist.chat.model.SpeechRequest;
import com.menuassist.chat.service.speech.SpeechService;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/restaurants/{restaurantId}/speech")
public class SpeechController {

    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");

    private final SpeechService speechService;

    public SpeechController(SpeechService speechService) {
        this.speechService = speechService;
    }

    @PostMapping(path = "/synthesize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<byte[]>> synthesize(@PathVariable String restaurantId,
                                                   @Valid @RequestBody SpeechRequest request) {
        return speechService.synthesize(restaurantId, request.text(), request.voice())
                .map(audio -> ResponseEntity.ok().contentType(AUDIO_MPEG).body(audio));
    }

    @PostMapping(path = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, String>> transcribe(@PathVariable String restaurantId,
                                                @RequestPart("audio") FilePart audio) {
        return DataBufferUtils.join(audio.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .flatMap(bytes -> speechService.transcribe(restaurantId, bytes, audio.filename()))
                .map(text -> Map.of("text", text));
    }
}
