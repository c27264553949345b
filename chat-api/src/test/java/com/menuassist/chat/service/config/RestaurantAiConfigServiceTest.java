package com.menuassist.chat.service.config;

import com.menuassist.chat.persistence.entity.RestaurantAiConfigEntity;
import com.menuassist.chat.persistence.repository.RestaurantAiConfigRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class RestaurantAiConfigServiceTest {

    @Autowired
    private RestaurantAiConfigService configService;

    @Autowired
    private RestaurantAiConfigRepository repository;

    @Test
    void missingConfigYieldsDefaults() {
        RestaurantAiConfig config = configService.getConfig("rest-cfg-none");

        assertThat(config.mode()).isEqualTo(AiMode.TEXT_ONLY);
        assertThat(config.provider()).isEqualTo("openai");
        assertThat(config.model().model()).isEqualTo("gpt-4o-mini");
        assertThat(config.model().maxTokens()).isEqualTo(150);
        assertThat(config.model().temperature()).isEqualTo(0.7);
        assertThat(config.model().contextMessages()).isEqualTo(10);
        assertThat(config.model().timeoutSeconds()).isEqualTo(30);
        assertThat(config.performance().cacheResponses()).isTrue();
        assertThat(config.speech().defaultVoice()).isEqualTo("nova");
    }

    @Test
    void validUpdateIsStoredAndReadBack() {
        RestaurantAiConfig defaults = configService.defaultConfig();
        RestaurantAiConfig updated = new RestaurantAiConfig(
                AiMode.HYBRID,
                " ",
                new RestaurantAiConfig.ModelSettings("gpt-4o", 300, 0.3, 6, "You are a pirate baker.", 20),
                defaults.performance(),
                new RestaurantAiConfig.SpeechSettings(true, true, "alloy", true, false));

        RestaurantAiConfig saved = configService.updateConfig("rest-cfg-1", updated);
        RestaurantAiConfig loaded = configService.getConfig("rest-cfg-1");

        assertThat(saved.provider()).isEqualTo("openai");
        assertThat(loaded).isEqualTo(saved);
        assertThat(loaded.synthesisAllowed()).isTrue();
    }

    @Test
    void invalidUpdateReportsEveryViolationAndKeepsPreviousConfig() {
        RestaurantAiConfig defaults = configService.defaultConfig();
        configService.updateConfig("rest-cfg-2", defaults);
        RestaurantAiConfig invalid = new RestaurantAiConfig(
                AiMode.TEXT_ONLY,
                "openai",
                new RestaurantAiConfig.ModelSettings("gpt-4o-mini", 5000, 3.5, 10, null, 30),
                defaults.performance(),
                defaults.speech());

        assertThatThrownBy(() -> configService.updateConfig("rest-cfg-2", invalid))
                .isInstanceOfSatisfying(InvalidConfigException.class, ex -> assertThat(ex.getViolations())
                        .hasSize(2)
                        .anySatisfy(violation -> assertThat(violation).startsWith("model.maxTokens:"))
                        .anySatisfy(violation -> assertThat(violation).startsWith("model.temperature:")));

        assertThat(configService.getConfig("rest-cfg-2")).isEqualTo(defaults);
    }

    @Test
    void unreadableStoredConfigFallsBackToDefaults() {
        repository.save(new RestaurantAiConfigEntity("rest-cfg-3", "{not json"));

        assertThat(configService.getConfig("rest-cfg-3")).isEqualTo(configService.defaultConfig());
    }
}
