package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.cache.CacheKeys;
import com.menuassist.chat.cache.CacheStore;
import com.menuassist.chat.cache.CacheUnavailableException;
import com.menuassist.chat.cache.CaffeineCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeterministicKnowledgeCacheTest {

    private static final String RESTAURANT = "rest-1";

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineCacheStore store;
    private DeterministicKnowledgeCache cache;

    @BeforeEach
    void setUp() {
        store = new CaffeineCacheStore(1000, nanos::get);
        cache = new DeterministicKnowledgeCache(store, new ItemResolver(), Duration.ofHours(24));
    }

    @Test
    void answersDescriptionQuestionFromMenuData() {
        Optional<KnowledgeAnswer> answer = cache.lookup(RESTAURANT, MenuFixtures.MENU,
                new ClassifiedQuestion(QuestionType.DESCRIPTION, "boneless?"));

        assertThat(answer).isPresent();
        assertThat(answer.get().text()).isEqualTo("Boneless - Our original signature warm gourmet cookie with a "
                + "perfectly balanced buttery flavor. This delicious item is priced at $3.99.");
        assertThat(answer.get().fromCache()).isFalse();
        assertThat(answer.get().item()).isEqualTo(MenuFixtures.BONELESS);
    }

    @Test
    void secondLookupIsServedFromCacheWithIdenticalText() {
        ClassifiedQuestion question = new ClassifiedQuestion(QuestionType.PRICE, "og");

        KnowledgeAnswer first = cache.lookup(RESTAURANT, MenuFixtures.MENU, question).orElseThrow();
        KnowledgeAnswer second = cache.lookup(RESTAURANT, MenuFixtures.MENU, question).orElseThrow();

        assertThat(first.text()).isEqualTo("The OG costs $4.49.");
        assertThat(second.text()).isEqualTo(first.text());
        assertThat(second.fromCache()).isTrue();
        assertThat(store.get(CacheKeys.knowledge(RESTAURANT, QuestionType.PRICE, "item-og")))
                .contains("The OG costs $4.49.");
    }

    @Test
    void entriesExpireAfterTtl() {
        cache.answer(RESTAURANT, QuestionType.PRICE, MenuFixtures.OG);
        nanos.addAndGet(Duration.ofHours(24).plusSeconds(1).toNanos());

        KnowledgeAnswer answer = cache.answer(RESTAURANT, QuestionType.PRICE, MenuFixtures.OG);

        assertThat(answer.fromCache()).isFalse();
    }

    @Test
    void unresolvedItemFallsThrough() {
        assertThat(cache.lookup(RESTAURANT, MenuFixtures.MENU,
                new ClassifiedQuestion(QuestionType.PRICE, "lasagna"))).isEmpty();
    }

    @Test
    void invalidateItemRemovesEveryQuestionTypeForThatItemOnly() {
        for (QuestionType type : QuestionType.values()) {
            cache.answer(RESTAURANT, type, MenuFixtures.OG);
        }
        cache.answer(RESTAURANT, QuestionType.PRICE, MenuFixtures.BONELESS);

        cache.invalidateItem(RESTAURANT, "item-og");

        for (QuestionType type : QuestionType.values()) {
            assertThat(store.get(CacheKeys.knowledge(RESTAURANT, type, "item-og"))).isEmpty();
        }
        assertThat(store.get(CacheKeys.knowledge(RESTAURANT, QuestionType.PRICE, "item-boneless"))).isPresent();
    }

    @Test
    void invalidateRestaurantLeavesOtherRestaurantsAlone() {
        cache.answer(RESTAURANT, QuestionType.PRICE, MenuFixtures.OG);
        cache.answer(RESTAURANT, QuestionType.INGREDIENTS, MenuFixtures.OG);
        cache.answer("rest-2", QuestionType.PRICE, MenuFixtures.OG);

        long removed = cache.invalidateRestaurant(RESTAURANT);

        assertThat(removed).isEqualTo(2);
        assertThat(store.get(CacheKeys.knowledge("rest-2", QuestionType.PRICE, "item-og"))).isPresent();
    }

    @Test
    void unavailableStoreStillAnswersFromTemplates() {
        CacheStore broken = mock(CacheStore.class);
        when(broken.get(anyString())).thenThrow(new CacheUnavailableException("down", null));
        doThrow(new CacheUnavailableException("down", null)).when(broken).set(anyString(), anyString(), any());
        DeterministicKnowledgeCache degraded = new DeterministicKnowledgeCache(broken, new ItemResolver(), Duration.ofHours(1));

        KnowledgeAnswer answer = degraded.answer(RESTAURANT, QuestionType.PRICE, MenuFixtures.OG);

        assertThat(answer.text()).isEqualTo("The OG costs $4.49.");
        assertThat(answer.fromCache()).isFalse();
    }
}
