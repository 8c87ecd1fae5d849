package net.findmymedia.application.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the classifier's reply, {@code {"url_indexes": [2, 5], "explanation": "..."}},
 * tolerating markdown fences and prose around the JSON object.
 */
class ClassificationJsonParser {

    private static final Logger log = LoggerFactory.getLogger(ClassificationJsonParser.class);

    private final ObjectMapper objectMapper;

    ClassificationJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param responseText raw model output
     * @return integral indexes in reply order (range is not checked here) and the explanation
     * @throws EntityClassificationException if the text holds no JSON object
     */
    ParsedClassification parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new EntityClassificationException(EntityClassificationException.ErrorCode.EMPTY_RESPONSE,
                "Classifier response was empty");
        }
        JsonNode payload = parseJsonPayload(responseText);
        if (!payload.isObject()) {
            throw new EntityClassificationException(EntityClassificationException.ErrorCode.INVALID_RESPONSE,
                "Classifier response was not a JSON object");
        }

        List<Integer> indexes = new ArrayList<>();
        JsonNode indexNode = payload.path("url_indexes");
        if (indexNode.isMissingNode() || indexNode.isNull()) {
            indexNode = payload.path("urlIndexes");
        }
        for (JsonNode element : indexNode) {
            if (element.isIntegralNumber() && element.canConvertToInt()) {
                indexes.add(element.asInt());
            } else {
                log.debug("Dropping non-integer url index {}", element);
            }
        }
        String explanation = payload.path("explanation").isString() ? payload.path("explanation").asString().trim() : "";
        return new ParsedClassification(indexes, explanation);
    }

    private JsonNode parseJsonPayload(String responseText) {
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw new EntityClassificationException(EntityClassificationException.ErrorCode.INVALID_RESPONSE,
                    "Classifier response did not include a JSON object", initialParseException);
            }
            log.warn("Classifier response required brace extraction (initial parse failed: {})", initialParseException.getMessage());
            try {
                return objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1));
            } catch (JacksonException exception) {
                throw new EntityClassificationException(EntityClassificationException.ErrorCode.INVALID_RESPONSE,
                    "Classifier response JSON parsing failed", exception);
            }
        }
    }

    record ParsedClassification(List<Integer> urlIndexes, String explanation) {
    }
}
