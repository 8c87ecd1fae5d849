package net.findmymedia.model;

/**
 * Search result chosen by the rule-based matcher.
 *
 * @param title query title
 * @param category entity type of the query
 * @param url canonicalized result URL
 * @param source source name from the domain table (e.g. {@code imdb})
 * @param matchedTitle title of the accepted search result
 */
public record HeuristicMatch(String title, EntityType category, String url, String source, String matchedTitle) {
}
