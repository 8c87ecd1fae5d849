package net.findmymedia.util;

import jakarta.annotation.Nullable;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps result URLs to known catalog sources and extracts their identifiers.
 */
public final class SourceClassifier {

    public static final String IMDB = "imdb";
    public static final String GOODREADS = "goodreads";
    public static final String AMAZON = "amazon";
    public static final String WIKIPEDIA = "wikipedia";
    public static final String ROTTEN_TOMATOES = "rottentomatoes";
    public static final String PENGUIN = "penguin";
    public static final String STEAM = "steam";
    public static final String BGG = "bgg";
    public static final String SPOTIFY = "spotify";
    public static final String MUSICBRAINZ = "musicbrainz";
    public static final String IGDB = "igdb";
    public static final String LETTERBOXD = "letterboxd";

    // Insertion order matters: the first matching fragment wins.
    private static final Map<String, String> DOMAIN_SOURCES = new LinkedHashMap<>();
    static {
        DOMAIN_SOURCES.put("imdb.com", IMDB);
        DOMAIN_SOURCES.put("goodreads.com", GOODREADS);
        DOMAIN_SOURCES.put("amazon.com", AMAZON);
        DOMAIN_SOURCES.put("amazon.co.", AMAZON);
        DOMAIN_SOURCES.put("wikipedia.org", WIKIPEDIA);
        DOMAIN_SOURCES.put("rottentomatoes.com", ROTTEN_TOMATOES);
        DOMAIN_SOURCES.put("penguin.", PENGUIN);
        DOMAIN_SOURCES.put("store.steampowered.com", STEAM);
        DOMAIN_SOURCES.put("boardgamegeek.com", BGG);
        DOMAIN_SOURCES.put("open.spotify.com", SPOTIFY);
        DOMAIN_SOURCES.put("musicbrainz.org", MUSICBRAINZ);
        DOMAIN_SOURCES.put("igdb.com", IGDB);
        DOMAIN_SOURCES.put("letterboxd.com", LETTERBOXD);
    }

    private static final Map<EntityType, List<String>> SOURCE_PRIORITY = new EnumMap<>(EntityType.class);
    static {
        SOURCE_PRIORITY.put(EntityType.MOVIE, List.of(IMDB, WIKIPEDIA, ROTTEN_TOMATOES, LETTERBOXD));
        SOURCE_PRIORITY.put(EntityType.TV_SHOW, List.of(IMDB, WIKIPEDIA, ROTTEN_TOMATOES, LETTERBOXD));
        SOURCE_PRIORITY.put(EntityType.BOOK, List.of(GOODREADS, AMAZON, PENGUIN));
        SOURCE_PRIORITY.put(EntityType.VIDEO_GAME, List.of(STEAM, IGDB, WIKIPEDIA));
        SOURCE_PRIORITY.put(EntityType.PHYSICAL_GAME, List.of(BGG, WIKIPEDIA));
        SOURCE_PRIORITY.put(EntityType.ALBUM, List.of(SPOTIFY, MUSICBRAINZ, WIKIPEDIA));
        SOURCE_PRIORITY.put(EntityType.SONG, List.of(SPOTIFY, MUSICBRAINZ, WIKIPEDIA));
    }

    // Domains a heuristic match may come from; narrower than the priority walk above.
    private static final Map<EntityType, List<String>> ACCEPTED_DOMAINS = new EnumMap<>(EntityType.class);
    static {
        ACCEPTED_DOMAINS.put(EntityType.MOVIE, List.of("imdb.com", "wikipedia.org"));
        ACCEPTED_DOMAINS.put(EntityType.TV_SHOW, List.of("imdb.com", "wikipedia.org"));
        ACCEPTED_DOMAINS.put(EntityType.BOOK, List.of("goodreads.com", "amazon.com", "amazon.co.uk", "amazon.co.nz"));
        ACCEPTED_DOMAINS.put(EntityType.VIDEO_GAME, List.of("store.steampowered.com", "igdb.com", "wikipedia.org"));
        ACCEPTED_DOMAINS.put(EntityType.PHYSICAL_GAME, List.of("boardgamegeek.com", "wikipedia.org"));
        ACCEPTED_DOMAINS.put(EntityType.ALBUM, List.of("open.spotify.com", "musicbrainz.org", "wikipedia.org"));
        ACCEPTED_DOMAINS.put(EntityType.SONG, List.of("open.spotify.com", "musicbrainz.org"));
    }

    private static final Pattern IMDB_ID = Pattern.compile("/title/(tt\\d+)");
    private static final Pattern GOODREADS_ID = Pattern.compile("/book/show/(\\d+)");
    private static final Pattern BGG_ID = Pattern.compile("/boardgame/(\\d+)");
    private static final Pattern STEAM_ID = Pattern.compile("/app/(\\d+)");
    private static final Pattern SPOTIFY_ID = Pattern.compile("/(album|artist|track)/([A-Za-z0-9]+)");

    private SourceClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Detects the catalog source of a URL by domain fragment.
     *
     * @param url the URL to analyze
     * @return source name such as {@code imdb}, or empty if the domain is unknown
     */
    public static Optional<String> classify(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : DOMAIN_SOURCES.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Order in which sources are checked for a category, most authoritative first. Empty
     * for categories without a curated list.
     */
    public static List<String> sourcePriority(EntityType category) {
        return SOURCE_PRIORITY.getOrDefault(category, List.of());
    }

    /**
     * Checks whether a URL is on a domain curated for the category, e.g. only IMDb and
     * Wikipedia for movies.
     */
    public static boolean isAcceptedSource(@Nullable String url, EntityType category) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return ACCEPTED_DOMAINS.getOrDefault(category, List.of()).stream().anyMatch(lower::contains);
    }

    /**
     * Identifier that tells mirrors of the same item apart, e.g. {@code tt0133093} for
     * IMDb. Falls back to the raw URL when the source has no id pattern or it does not match.
     */
    public static String extractItemId(String source, String url) {
        Matcher matcher = idMatcher(source, url);
        if (matcher == null) {
            return url;
        }
        return SPOTIFY.equals(source) ? matcher.group(1) + ":" + matcher.group(2) : matcher.group(1);
    }

    /**
     * Rewrites a result URL to its canonical root (no locale paths, query strings or fragments).
     */
    public static String canonicalize(String source, String url) {
        Matcher matcher = idMatcher(source, url);
        if (matcher != null) {
            switch (source) {
                case IMDB:
                    return "https://www.imdb.com/title/" + matcher.group(1) + "/";
                case GOODREADS:
                    return "https://www.goodreads.com/book/show/" + matcher.group(1);
                case BGG:
                    return "https://boardgamegeek.com/boardgame/" + matcher.group(1);
                case STEAM:
                    return "https://store.steampowered.com/app/" + matcher.group(1);
                case SPOTIFY:
                    return "https://open.spotify.com/" + matcher.group(1) + "/" + matcher.group(2);
                default:
                    break;
            }
        }
        return stripQueryAndFragment(url);
    }

    /**
     * Extracts the external ids a resolved URL carries. Only ids that pass their
     * {@link ExternalIdType#accepts(String)} check are returned.
     */
    public static Map<ExternalIdType, String> extractExternalIds(@Nullable String url) {
        Map<ExternalIdType, String> ids = new EnumMap<>(ExternalIdType.class);
        Optional<String> source = classify(url);
        if (source.isEmpty()) {
            return ids;
        }
        Matcher matcher = idMatcher(source.get(), url);
        if (matcher == null) {
            return ids;
        }
        switch (source.get()) {
            case IMDB -> putIfValid(ids, ExternalIdType.IMDB, matcher.group(1));
            case GOODREADS -> putIfValid(ids, ExternalIdType.GOODREADS, matcher.group(1));
            case BGG -> putIfValid(ids, ExternalIdType.BGG, matcher.group(1));
            case STEAM -> putIfValid(ids, ExternalIdType.STEAM, matcher.group(1));
            case SPOTIFY -> {
                if ("album".equals(matcher.group(1))) {
                    putIfValid(ids, ExternalIdType.SPOTIFY_ALBUM, matcher.group(2));
                } else if ("artist".equals(matcher.group(1))) {
                    putIfValid(ids, ExternalIdType.SPOTIFY_ARTIST, matcher.group(2));
                }
            }
            default -> {
            }
        }
        return ids;
    }

    @Nullable
    private static Matcher idMatcher(String source, String url) {
        Pattern pattern = switch (source) {
            case IMDB -> IMDB_ID;
            case GOODREADS -> GOODREADS_ID;
            case BGG -> BGG_ID;
            case STEAM -> STEAM_ID;
            case SPOTIFY -> SPOTIFY_ID;
            default -> null;
        };
        if (pattern == null || url == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(url);
        return matcher.find() ? matcher : null;
    }

    private static void putIfValid(Map<ExternalIdType, String> ids, ExternalIdType type, String value) {
        if (type.accepts(value)) {
            ids.put(type, value);
        }
    }

    private static String stripQueryAndFragment(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return url.substring(0, cut);
    }
}
