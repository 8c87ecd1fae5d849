package net.findmymedia.service;

import lombok.extern.slf4j.Slf4j;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.DeferredItem;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.GoogleSearchResult;
import net.findmymedia.model.HeuristicMatch;
import net.findmymedia.util.SourceClassifier;
import net.findmymedia.util.TitleNormalizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves web search results without AI when the answer is unambiguous.
 * <p>
 * A result counts only if it comes from a domain curated for the category and its
 * title contains every content word of the query. Sources are then checked in priority
 * order: the first source with exactly one distinct item wins, and a source with several
 * distinct items (for example two different Goodreads books) defers the whole query.
 */
@Component
@Slf4j
public class HeuristicMatcher {

    private final Set<String> categoryHintWords;

    @Autowired
    public HeuristicMatcher(EntityResolutionProperties properties) {
        this(properties.getHeuristics().getCategoryHintWords());
    }

    HeuristicMatcher(Collection<String> categoryHintWords) {
        Set<String> hints = new HashSet<>();
        for (String word : categoryHintWords) {
            hints.add(word.trim().toLowerCase(Locale.ROOT));
        }
        this.categoryHintWords = Set.copyOf(hints);
    }

    /**
     * Tries to pick the single correct result for a query.
     *
     * @param title query title
     * @param category entity type of the query
     * @param results web search results in ranking order
     * @return the match, or empty when the query must be deferred
     */
    public Optional<HeuristicMatch> match(String title, EntityType category, List<GoogleSearchResult> results) {
        List<String> priority = SourceClassifier.sourcePriority(category);
        if (priority.isEmpty() || results == null || results.isEmpty()) {
            return Optional.empty();
        }
        Set<String> queryWords = new HashSet<>(TitleNormalizer.contentWords(title));
        queryWords.removeAll(categoryHintWords);

        Map<String, Map<String, Candidate>> bySource = new LinkedHashMap<>();
        for (GoogleSearchResult result : results) {
            Optional<String> source = SourceClassifier.classify(result.url());
            if (source.isEmpty() || !SourceClassifier.isAcceptedSource(result.url(), category)) {
                continue;
            }
            Set<String> titleWords = new HashSet<>(TitleNormalizer.contentWords(result.title()));
            if (!titleWords.containsAll(queryWords)) {
                continue;
            }
            String itemId = SourceClassifier.extractItemId(source.get(), result.url());
            bySource.computeIfAbsent(source.get(), key -> new LinkedHashMap<>())
                .putIfAbsent(itemId, new Candidate(SourceClassifier.canonicalize(source.get(), result.url()), result.title()));
        }

        for (String source : priority) {
            Map<String, Candidate> items = bySource.get(source);
            if (items == null || items.isEmpty()) {
                continue;
            }
            if (items.size() > 1) {
                log.debug("Deferring '{}' ({}): {} distinct {} results", title, category, items.size(), source);
                return Optional.empty();
            }
            Candidate only = items.values().iterator().next();
            return Optional.of(new HeuristicMatch(title, category, only.url(), source, only.title()));
        }
        return Optional.empty();
    }

    /**
     * Runs {@link #match} over a batch, keeping input order in both outputs.
     */
    public HeuristicBatchResult applyHeuristics(List<DeferredItem> items) {
        List<HeuristicMatch> found = new ArrayList<>();
        List<DeferredItem> deferred = new ArrayList<>();
        for (DeferredItem item : items) {
            match(item.title(), item.category(), item.searchResults())
                .ifPresentOrElse(found::add, () -> deferred.add(item));
        }
        return new HeuristicBatchResult(found, deferred);
    }

    private record Candidate(String url, String title) {
    }
}
