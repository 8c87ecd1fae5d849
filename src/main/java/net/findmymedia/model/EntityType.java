package net.findmymedia.model;

import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static net.findmymedia.model.ExternalIdType.*;

/**
 * Kinds of cultural entities the resolver can look up.
 * <p>
 * Each constant holds its lookup tables:
 * - wire name used in requests and cache keys
 * - words appended to web search queries
 * - Wikidata classes an item must be an instance (or subclass) of
 * - external identifiers in preference order for picking the canonical URL
 */
public enum EntityType {
    MOVIE("movie", "film",
        List.of("Q11424", "Q506240", "Q24862", "Q93204", "Q202866"),
        List.of(IMDB, TMDB_MOVIE, LETTERBOXD, NETFLIX)),
    TV_SHOW("tv_show", "tv series",
        List.of("Q5398426", "Q1259759", "Q3464665", "Q526877", "Q21191270"),
        List.of(IMDB, TMDB_TV, NETFLIX)),
    WEB_SERIES("web_series", "web series",
        List.of(),
        List.of(IMDB, TMDB_TV)),
    VIDEO_GAME("video_game", "video game",
        List.of("Q7889"),
        List.of(STEAM, IGDB, GOG)),
    PHYSICAL_GAME("physical_game", "board game",
        List.of("Q131436", "Q11410", "Q142714"),
        List.of(BGG)),
    BOOK("book", "book",
        List.of("Q571", "Q7725634", "Q8261", "Q49084", "Q277759", "Q747381"),
        List.of(GOODREADS, OPENLIBRARY, GOOGLE_BOOKS, ISBN13, ISBN10)),
    COMIC("comic", "comic",
        List.of(),
        List.of(GOODREADS, OPENLIBRARY)),
    PLAY("play", "play theatre",
        List.of(),
        List.of()),
    ALBUM("album", "album music",
        List.of("Q482994", "Q169930"),
        List.of(SPOTIFY_ALBUM, MUSICBRAINZ_RELEASE_GROUP, DISCOGS_RELEASE)),
    SONG("song", "song music",
        List.of("Q7366", "Q134556"),
        List.of(MUSICBRAINZ_RELEASE, SPOTIFY_ALBUM)),
    PODCAST("podcast", "podcast",
        List.of(),
        List.of(APPLE_PODCASTS, SPOTIFY_SHOW)),
    ARTIST("artist", "musician artist",
        List.of(),
        List.of(SPOTIFY_ARTIST, MUSICBRAINZ_ARTIST, DISCOGS_ARTIST, IMDB));

    private final String wireName;
    private final String searchHint;
    private final List<String> wikidataTypeQids;
    private final List<ExternalIdType> preferredIdTypes;

    EntityType(String wireName, String searchHint, List<String> wikidataTypeQids, List<ExternalIdType> preferredIdTypes) {
        this.wireName = wireName;
        this.searchHint = searchHint;
        this.wikidataTypeQids = wikidataTypeQids;
        this.preferredIdTypes = preferredIdTypes;
    }

    public String getWireName() {
        return wireName;
    }

    public String getSearchHint() {
        return searchHint;
    }

    /**
     * Wikidata class QIDs used to restrict the SPARQL search; empty means untyped search.
     */
    public List<String> getWikidataTypeQids() {
        return wikidataTypeQids;
    }

    /**
     * External id types in the order they are tried when building a canonical URL.
     */
    public List<ExternalIdType> getPreferredIdTypes() {
        return preferredIdTypes;
    }

    /**
     * Id types requested from Wikidata for this kind of entity; every id type when
     * no preference list exists.
     */
    public List<ExternalIdType> getRelevantIdTypes() {
        return preferredIdTypes.isEmpty() ? List.of(ExternalIdType.values()) : preferredIdTypes;
    }

    /**
     * Parses either the wire name ({@code tv_show}) or the constant name ({@code TV_SHOW}).
     */
    public static Optional<EntityType> fromValue(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EntityType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
