package net.findmymedia.application.ai;

import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationJsonParserTest {

    private final ClassificationJsonParser parser = new ClassificationJsonParser(new ObjectMapper());

    @Test
    void should_ParseIndexesAndExplanation_When_ReplyIsPlainJson() {
        ClassificationJsonParser.ParsedClassification parsed =
            parser.parse("{\"url_indexes\": [2, 5], \"explanation\": \" Result 2 is IMDB \"}");

        assertThat(parsed.urlIndexes()).containsExactly(2, 5);
        assertThat(parsed.explanation()).isEqualTo("Result 2 is IMDB");
    }

    @Test
    void should_StripMarkdownFences_When_ModelWrapsJson() {
        ClassificationJsonParser.ParsedClassification parsed =
            parser.parse("```json\n{\"url_indexes\": [1]}\n```");

        assertThat(parsed.urlIndexes()).containsExactly(1);
        assertThat(parsed.explanation()).isEmpty();
    }

    @Test
    void should_ExtractBracedObject_When_ReplyHasSurroundingProse() {
        ClassificationJsonParser.ParsedClassification parsed =
            parser.parse("Here you go: {\"urlIndexes\": [3], \"explanation\": \"Goodreads\"} Hope that helps.");

        assertThat(parsed.urlIndexes()).containsExactly(3);
        assertThat(parsed.explanation()).isEqualTo("Goodreads");
    }

    @Test
    void should_DropNonIntegerIndexes() {
        ClassificationJsonParser.ParsedClassification parsed =
            parser.parse("{\"url_indexes\": [1, \"2\", 2.5, null, 4]}");

        assertThat(parsed.urlIndexes()).containsExactly(1, 4);
    }

    @Test
    void should_ThrowInvalidResponse_When_NoJsonObjectPresent() {
        assertThatThrownBy(() -> parser.parse("I could not find a match."))
            .isInstanceOfSatisfying(EntityClassificationException.class, exception ->
                assertThat(exception.errorCode()).isEqualTo(EntityClassificationException.ErrorCode.INVALID_RESPONSE));
        assertThatThrownBy(() -> parser.parse("[1, 2]"))
            .isInstanceOfSatisfying(EntityClassificationException.class, exception ->
                assertThat(exception.errorCode()).isEqualTo(EntityClassificationException.ErrorCode.INVALID_RESPONSE));
    }

    @Test
    void should_ThrowEmptyResponse_When_ReplyIsBlank() {
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOfSatisfying(EntityClassificationException.class, exception ->
                assertThat(exception.errorCode()).isEqualTo(EntityClassificationException.ErrorCode.EMPTY_RESPONSE));
    }
}
