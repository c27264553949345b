package com.menuassist.chat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "chat.assistant")
public class AssistantProperties {

    private final Cache cache = new Cache();
    private final History history = new History();
    private final Provider provider = new Provider();

    public Cache getCache() {
        return cache;
    }

    public History getHistory() {
        return history;
    }

    public Provider getProvider() {
        return provider;
    }

    public static class Cache {

        /**
         * Lifetime of templated per-item answers.
         */
        private Duration knowledgeTtl = Duration.ofHours(24);

        /**
         * Lifetime of cached generated answers.
         */
        private Duration semanticTtl = Duration.ofHours(1);

        public Duration getKnowledgeTtl() {
            return knowledgeTtl;
        }

        public void setKnowledgeTtl(Duration knowledgeTtl) {
            this.knowledgeTtl = knowledgeTtl;
        }

        public Duration getSemanticTtl() {
            return semanticTtl;
        }

        public void setSemanticTtl(Duration semanticTtl) {
            this.semanticTtl = semanticTtl;
        }
    }

    public static class History {

        /**
         * Upper bound on history messages fetched for the streaming path, applied on top of the
         * restaurant's configured context window.
         */
        private int fastStreamLimit = 3;

        public int getFastStreamLimit() {
            return fastStreamLimit;
        }

        public void setFastStreamLimit(int fastStreamLimit) {
            this.fastStreamLimit = fastStreamLimit;
        }
    }

    public static class Provider {

        /**
         * Provider used when a restaurant config does not name one, or names an unknown one.
         */
        private String defaultName = "openai";

        private String defaultModel = "gpt-4o-mini";

        private Duration timeout = Duration.ofSeconds(30);

        public String getDefaultName() {
            return defaultName;
        }

        public void setDefaultName(String defaultName) {
            this.defaultName = defaultName;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
