package net.findmymedia.model;

import jakarta.annotation.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * External catalog identifiers that Wikidata links to an item.
 * <p>
 * Each constant carries the Wikidata property that stores the identifier, the
 * pattern a value must match before it is accepted, and an optional template used
 * to build a canonical URL ({@code {id}} is replaced by the identifier).
 */
public enum ExternalIdType {
    IMDB("P345", "tt\\d+", "https://www.imdb.com/title/{id}/"),
    TMDB_MOVIE("P4947", "\\d+", "https://www.themoviedb.org/movie/{id}"),
    TMDB_TV("P4983", "\\d+", "https://www.themoviedb.org/tv/{id}"),
    LETTERBOXD("P6127", "[a-z0-9][a-z0-9-]*", "https://letterboxd.com/film/{id}/"),
    NETFLIX("P1874", "\\d+", null),
    BGG("P2339", "\\d+", "https://boardgamegeek.com/boardgame/{id}"),
    STEAM("P1733", "\\d+", "https://store.steampowered.com/app/{id}"),
    IGDB("P5794", "[a-z0-9][a-z0-9-]*", null),
    GOG("P2725", "[a-z0-9_/-]+", null),
    MUSICBRAINZ_ARTIST("P434", Patterns.UUID, null),
    MUSICBRAINZ_RELEASE_GROUP("P436", Patterns.UUID, null),
    MUSICBRAINZ_RELEASE("P5813", Patterns.UUID, null),
    SPOTIFY_ARTIST("P1902", "[0-9A-Za-z]{22}", "https://open.spotify.com/artist/{id}"),
    SPOTIFY_ALBUM("P2205", "[0-9A-Za-z]{22}", "https://open.spotify.com/album/{id}"),
    SPOTIFY_SHOW("P5916", "[0-9A-Za-z]{22}", null),
    DISCOGS_ARTIST("P1953", "\\d+", null),
    DISCOGS_RELEASE("P2206", "\\d+", null),
    GOODREADS("P2969", "\\d+", "https://www.goodreads.com/book/show/{id}"),
    OPENLIBRARY("P648", "OL\\d+[WMA]", "https://openlibrary.org/works/{id}"),
    GOOGLE_BOOKS("P675", "[0-9A-Za-z_-]{12}", null),
    ISBN13("P212", "97[89][0-9-]{10,14}", null),
    ISBN10("P957", "[0-9-]{9,12}[0-9Xx]", null),
    APPLE_PODCASTS("P5842", "\\d+", "https://podcasts.apple.com/podcast/id{id}"),
    OFFICIAL_WEBSITE("P856", "https?://\\S+", null);

    private final String wikidataProperty;
    private final Pattern idPattern;
    private final String urlTemplate;

    ExternalIdType(String wikidataProperty, String idPattern, @Nullable String urlTemplate) {
        this.wikidataProperty = wikidataProperty;
        this.idPattern = Pattern.compile(idPattern);
        this.urlTemplate = urlTemplate;
    }

    public String getWikidataProperty() {
        return wikidataProperty;
    }

    /**
     * Lowercase name used for SPARQL variables and logs (e.g. {@code spotify_album}).
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether a raw identifier value is well formed for this type.
     */
    public boolean accepts(@Nullable String value) {
        return value != null && idPattern.matcher(value.trim()).matches();
    }

    /**
     * Builds the canonical catalog URL for an identifier.
     *
     * @param id identifier value
     * @return the URL, or empty when this type has no template or the id is blank
     */
    public Optional<String> buildUrl(@Nullable String id) {
        if (urlTemplate == null || id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(urlTemplate.replace("{id}", id.trim()));
    }

    public static Optional<ExternalIdType> fromKey(@Nullable String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT);
        for (ExternalIdType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static final class Patterns {
        private static final String UUID = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";
    }
}
