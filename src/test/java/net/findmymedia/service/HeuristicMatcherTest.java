package net.findmymedia.service;

import net.findmymedia.model.DeferredItem;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.GoogleSearchResult;
import net.findmymedia.model.HeuristicMatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicMatcherTest {

    private final HeuristicMatcher matcher = new HeuristicMatcher(
        List.of("film", "book", "movie", "tv", "series", "game", "album", "song"));

    @Test
    void should_MatchCanonicalImdbUrl_When_SingleImdbItemMatchesTitle() {
        List<GoogleSearchResult> results = List.of(
            result("The Matrix (1999) - IMDb", "https://m.imdb.com/title/tt0133093/?ref_=nv_sr_1"),
            result("The Matrix - Wikipedia", "https://en.wikipedia.org/wiki/The_Matrix"),
            result("The Matrix (1999) - IMDb", "https://www.imdb.com/title/tt0133093/")
        );

        Optional<HeuristicMatch> match = matcher.match("The Matrix", EntityType.MOVIE, results);

        assertThat(match).isPresent();
        assertThat(match.get().url()).isEqualTo("https://www.imdb.com/title/tt0133093/");
        assertThat(match.get().source()).isEqualTo("imdb");
        assertThat(match.get().matchedTitle()).isEqualTo("The Matrix (1999) - IMDb");
    }

    @Test
    void should_Defer_When_PrioritySourceHasTwoDistinctItems() {
        List<GoogleSearchResult> results = List.of(
            result("Dune by Frank Herbert | Goodreads", "https://www.goodreads.com/book/show/44767458-dune"),
            result("Dune (Dune, #1) by Frank Herbert | Goodreads", "https://www.goodreads.com/book/show/234225.Dune"),
            result("Dune: Amazon.com: Books", "https://www.amazon.com/Dune-Frank-Herbert/dp/0441172717")
        );

        assertThat(matcher.match("Dune", EntityType.BOOK, results)).isEmpty();
    }

    @Test
    void should_FallThroughToNextSource_When_HigherSourceHasNoMatchingTitle() {
        List<GoogleSearchResult> results = List.of(
            result("Arrival (2016) - IMDb", "https://www.imdb.com/title/tt2543164/"),
            result("Blade Runner 2049 - Wikipedia", "https://en.wikipedia.org/wiki/Blade_Runner_2049")
        );

        Optional<HeuristicMatch> match = matcher.match("Blade Runner 2049 film", EntityType.MOVIE, results);

        assertThat(match).map(HeuristicMatch::url).contains("https://en.wikipedia.org/wiki/Blade_Runner_2049");
    }

    @Test
    void should_IgnoreUncuratedSourcesAndCategories() {
        List<GoogleSearchResult> results = List.of(
            result("The Matrix discussion", "https://www.reddit.com/r/movies/the_matrix"));

        assertThat(matcher.match("The Matrix", EntityType.MOVIE, results)).isEmpty();
        assertThat(matcher.match("Serial", EntityType.PODCAST,
            List.of(result("Serial - Wikipedia", "https://en.wikipedia.org/wiki/Serial_(podcast)")))).isEmpty();
        assertThat(matcher.match("The Matrix", EntityType.MOVIE, List.of())).isEmpty();
    }

    @Test
    void should_Defer_When_OnlyLetterboxdOrRottenTomatoesMatchesMovie() {
        assertThat(matcher.match("The Matrix", EntityType.MOVIE,
            List.of(result("The Matrix (1999) - Letterboxd", "https://letterboxd.com/film/the-matrix/")))).isEmpty();
        assertThat(matcher.match("The Matrix", EntityType.MOVIE,
            List.of(result("The Matrix | Rotten Tomatoes", "https://www.rottentomatoes.com/m/matrix")))).isEmpty();
    }

    @Test
    void should_SkipUnlistedAmazonStore_When_MatchingBooks() {
        List<GoogleSearchResult> results = List.of(
            result("Dune | Amazon.co.jp", "https://www.amazon.co.jp/-/en/dp/0441172717"),
            result("Dune: Amazon.co.uk: Frank Herbert", "https://www.amazon.co.uk/Dune-Frank-Herbert/dp/0340960191"));

        Optional<HeuristicMatch> match = matcher.match("Dune", EntityType.BOOK, results);

        assertThat(match).map(HeuristicMatch::url).contains("https://www.amazon.co.uk/Dune-Frank-Herbert/dp/0340960191");
    }

    @Test
    void should_Defer_When_OnlyWikipediaMatchesSong() {
        List<GoogleSearchResult> results = List.of(
            result("Bohemian Rhapsody - Wikipedia", "https://en.wikipedia.org/wiki/Bohemian_Rhapsody"));

        assertThat(matcher.match("Bohemian Rhapsody", EntityType.SONG, results)).isEmpty();
        assertThat(matcher.match("Bohemian Rhapsody", EntityType.ALBUM, results)).isPresent();
    }

    @Test
    void should_RequireEveryContentWord_When_ComparingTitles() {
        List<GoogleSearchResult> results = List.of(
            result("The Matrix Reloaded (2003) - IMDb", "https://www.imdb.com/title/tt0234215/"));

        assertThat(matcher.match("The Matrix Revolutions", EntityType.MOVIE, results)).isEmpty();
    }

    @Test
    void applyHeuristics_splitsBatchPreservingOrder() {
        DeferredItem matrix = new DeferredItem("The Matrix", EntityType.MOVIE,
            List.of(result("The Matrix (1999) - IMDb", "https://www.imdb.com/title/tt0133093/")));
        DeferredItem dune = new DeferredItem("Dune", EntityType.BOOK, List.of(
            result("Dune | Goodreads", "https://www.goodreads.com/book/show/44767458-dune"),
            result("Dune | Goodreads", "https://www.goodreads.com/book/show/234225.Dune")));
        DeferredItem catan = new DeferredItem("Catan", EntityType.PHYSICAL_GAME,
            List.of(result("CATAN | Board Game | BoardGameGeek", "https://boardgamegeek.com/boardgame/13/catan")));

        HeuristicBatchResult batch = matcher.applyHeuristics(List.of(matrix, dune, catan));

        assertThat(batch.found()).extracting(HeuristicMatch::url)
            .containsExactly("https://www.imdb.com/title/tt0133093/", "https://boardgamegeek.com/boardgame/13");
        assertThat(batch.deferred()).containsExactly(dune);
    }

    private static GoogleSearchResult result(String title, String url) {
        return new GoogleSearchResult(title, url, null);
    }
}
