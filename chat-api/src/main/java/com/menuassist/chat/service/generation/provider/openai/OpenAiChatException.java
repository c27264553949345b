package com.menuassist.chat.service.generation.provider.openai;

import com.menuassist.chat.service.generation.ProviderException;
import com.menuassist.chat.service.generation.ProviderFailure;

public class OpenAiChatException extends ProviderException {

    public OpenAiChatException(String message, Throwable cause) {
        super(ProviderFailure.ERROR, message, cause);
    }
}
