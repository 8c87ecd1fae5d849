package net.findmymedia.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of AI ranking over search results.
 *
 * @param urlIndexes 1-based indexes into the candidate list, best first
 * @param rankedUrls URLs for {@code urlIndexes}, same order
 * @param explanation model explanation, or a failure note
 */
public record ClassificationResult(
    String title,
    EntityType category,
    List<Integer> urlIndexes,
    List<String> rankedUrls,
    String explanation
) {
    public static final String FAILURE_EXPLANATION = "AI classification failed";

    public ClassificationResult {
        urlIndexes = urlIndexes == null ? List.of() : List.copyOf(urlIndexes);
        rankedUrls = rankedUrls == null ? List.of() : List.copyOf(rankedUrls);
        explanation = explanation == null ? "" : explanation;
    }

    public static ClassificationResult failed(String title, EntityType category) {
        return new ClassificationResult(title, category, List.of(), List.of(), FAILURE_EXPLANATION);
    }

    public Optional<String> bestUrl() {
        return rankedUrls.isEmpty() ? Optional.empty() : Optional.of(rankedUrls.get(0));
    }
}
