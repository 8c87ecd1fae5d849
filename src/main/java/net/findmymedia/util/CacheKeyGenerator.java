package net.findmymedia.util;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys for upstream API lookups.
 * <p>
 * A key is the SHA-256 hex digest of {@code service:model:payloadJson}, where the payload
 * is serialized with object keys sorted at every depth. Array order is kept, so
 * {@code ["a","b"]} and {@code ["b","a"]} produce different keys.
 */
public final class CacheKeyGenerator {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private CacheKeyGenerator() {
    }

    /**
     * @param service upstream name (e.g. {@code wikidata}, {@code google})
     * @param model operation or model name within the service
     * @param payload request parameters; maps, records and JSON nodes are accepted
     * @return 64 character hex key
     */
    public static String generate(String service, String model, Object payload) {
        JsonNode tree = MAPPER.valueToTree(payload);
        String canonical = MAPPER.writeValueAsString(sortKeys(tree));
        return HashUtils.sha256Hex(service + ":" + model + ":" + canonical);
    }

    static JsonNode sortKeys(JsonNode node) {
        if (node == null) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            for (Map.Entry<String, JsonNode> entry : node.properties()) {
                sorted.put(entry.getKey(), sortKeys(entry.getValue()));
            }
            ObjectNode result = MAPPER.createObjectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = MAPPER.createArrayNode();
            for (JsonNode element : node) {
                result.add(sortKeys(element));
            }
            return result;
        }
        return node;
    }
}
