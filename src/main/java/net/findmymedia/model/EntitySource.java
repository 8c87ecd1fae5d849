package net.findmymedia.model;

/**
 * Pipeline stage that produced a {@link ResolvedEntity}.
 */
public enum EntitySource {
    WIKIDATA,
    OPENLIBRARY,
    GOOGLE,
    HEURISTIC,
    AI
}
