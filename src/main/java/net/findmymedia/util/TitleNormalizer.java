package net.findmymedia.util;

import jakarta.annotation.Nullable;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String normalization shared by the title matching stages.
 */
public final class TitleNormalizer {

    public static final Set<String> FILLER_WORDS = Set.of(
        "the", "a", "an", "and", "or", "of", "in", "on", "at", "to", "for", "is", "by"
    );

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WORD_PUNCTUATION = Pattern.compile("[&\\-?!:,.'\"\\[\\]«»()]");
    private static final Pattern BOOK_TITLE_PUNCTUATION = Pattern.compile("[.:,;!?()\\[\\]{}\"'\\-—–]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("&| and |,");

    private TitleNormalizer() {
    }

    /**
     * Lowercases, strips diacritics and punctuation, then drops filler words and
     * single character tokens.
     *
     * @param text raw title
     * @return content words in their original order
     */
    public static List<String> contentWords(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String folded = COMBINING_MARKS.matcher(Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD))
            .replaceAll("");
        String spaced = WORD_PUNCTUATION.matcher(folded).replaceAll(" ");
        List<String> words = new ArrayList<>();
        for (String token : WHITESPACE.split(spaced.trim())) {
            if (token.length() > 1 && !FILLER_WORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    /**
     * Title form used for Open Library comparisons: punctuation to spaces,
     * lowercase, whitespace collapsed.
     */
    public static String normalizeBookTitle(@Nullable String title) {
        if (title == null) {
            return "";
        }
        String spaced = BOOK_TITLE_PUNCTUATION.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /**
     * First author of a credit line such as {@code "Neil Gaiman & Terry Pratchett"}.
     *
     * @return trimmed first name, or {@code null} for blank input
     */
    @Nullable
    public static String firstAuthor(@Nullable String author) {
        if (author == null || author.isBlank()) {
            return null;
        }
        String first = AUTHOR_SEPARATOR.split(author, 2)[0].trim();
        return first.isEmpty() ? null : first;
    }
}
