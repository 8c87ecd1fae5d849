package net.findmymedia.service.pipeline;

import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.WikidataResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WikidataStageTest {

    @Test
    void canonicalUrl_followsPreferredIdOrder() {
        WikidataResult result = new WikidataResult("Q83495", "The Matrix", null, null,
            "https://en.wikipedia.org/wiki/The_Matrix",
            Map.of(ExternalIdType.TMDB_MOVIE, "603", ExternalIdType.IMDB, "tt0133093"), 95);

        assertThat(WikidataStage.canonicalUrl(result, EntityType.MOVIE)).isEqualTo("https://www.imdb.com/title/tt0133093/");
    }

    @Test
    void canonicalUrl_skipsIdsWithoutTemplate() {
        WikidataResult result = new WikidataResult("Q1", "Some Show", null, null,
            "https://en.wikipedia.org/wiki/Some_Show", Map.of(ExternalIdType.NETFLIX, "80100172"), 10);

        assertThat(WikidataStage.canonicalUrl(result, EntityType.TV_SHOW)).isEqualTo("https://en.wikipedia.org/wiki/Some_Show");
    }

    @Test
    void canonicalUrl_fallsBackToWikidataItemPage() {
        WikidataResult result = new WikidataResult("Q7", "Some Play", null, "https://commons.example/img.jpg", null, Map.of(), 2);

        assertThat(WikidataStage.canonicalUrl(result, EntityType.PLAY)).isEqualTo("https://www.wikidata.org/wiki/Q7");
    }

    @Test
    void isAcceptable_requiresImageArticleOrIds() {
        assertThat(WikidataStage.isAcceptable(new WikidataResult("Q1", "x", null, null, null, Map.of(), 3))).isFalse();
        assertThat(WikidataStage.isAcceptable(new WikidataResult("Q1", "x", null, "https://img", null, Map.of(), 3))).isTrue();
        assertThat(WikidataStage.isAcceptable(new WikidataResult("Q1", "x", null, null, null,
            Map.of(ExternalIdType.BGG, "1"), 3))).isTrue();
    }
}
