package br.edu.ifba.mindgraph.understanding;

import br.edu.ifba.mindgraph.core.EntityCandidate;
import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.RelationCandidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses and validates raw text-understanding output.
 *
 * <p>Expected shape:</p>
 * <pre>
 * {"entities":  [{"type": "Person", "name": "Sarah", "span": "Sarah", "confidence": 0.9, "properties": {}}],
 *  "relations": [{"source": "work", "target": "stress", "type": "causes", "confidence": 0.8}]}
 * </pre>
 *
 * <p>Markdown code fences and prose around the JSON object are tolerated. A body that
 * is not a JSON object, or whose {@code entities}/{@code relations} are not arrays,
 * is rejected as a whole; individual unusable items are dropped and reported.</p>
 */
@ApplicationScoped
public class UnderstandingResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(UnderstandingResponseParser.class);

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @throws MalformedUnderstandingException when the overall shape is invalid
     */
    @NotNull
    public UnderstandingResult parse(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedUnderstandingException("Empty understanding response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(raw));
        } catch (JsonProcessingException e) {
            throw new MalformedUnderstandingException("Understanding response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedUnderstandingException("Understanding response is not a JSON object");
        }

        List<ExtractionIssue> dropped = new ArrayList<>();
        List<EntityCandidate> entities = new ArrayList<>();
        for (JsonNode item : arrayField(root, "entities")) {
            parseEntity(item).ifPresentOrElse(entities::add,
                () -> dropped.add(ExtractionIssue.ambiguous("Dropped unusable entity item: " + abbreviate(item))));
        }
        List<RelationCandidate> relations = new ArrayList<>();
        for (JsonNode item : arrayField(root, "relations")) {
            parseRelation(item).ifPresentOrElse(relations::add,
                () -> dropped.add(ExtractionIssue.invalidRelation("Dropped unusable relation item: " + abbreviate(item))));
        }
        if (!dropped.isEmpty()) {
            logger.debug("Dropped {} unusable understanding items", dropped.size());
        }
        return new UnderstandingResult(entities, relations, dropped);
    }

    /**
     * Removes markdown fences and any text around the outermost JSON object.
     */
    static String extractJson(String raw) {
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
            text = text.trim();
        }
        if (!text.startsWith("{")) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                text = text.substring(start, end + 1);
            }
        }
        return text;
    }

    private static List<JsonNode> arrayField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedUnderstandingException("Field '" + field + "' must be an array");
        }
        List<JsonNode> items = new ArrayList<>(node.size());
        node.forEach(items::add);
        return items;
    }

    private Optional<EntityCandidate> parseEntity(JsonNode item) {
        if (!item.isObject()) {
            return Optional.empty();
        }
        Optional<EntityType> type = EntityType.fromLabel(text(item, "type"));
        String name = text(item, "name");
        if (type.isEmpty() || name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new EntityCandidate(type.get(), name, text(item, "span"), confidence(item),
            properties(item.get("properties"))));
    }

    private Optional<RelationCandidate> parseRelation(JsonNode item) {
        if (!item.isObject()) {
            return Optional.empty();
        }
        String source = text(item, "source");
        String target = text(item, "target");
        String type = text(item, "type");
        if (isBlank(source) || isBlank(target) || isBlank(type)) {
            return Optional.empty();
        }
        EntityType sourceType = EntityType.fromLabel(firstText(item, "sourceType", "source_type")).orElse(null);
        EntityType targetType = EntityType.fromLabel(firstText(item, "targetType", "target_type")).orElse(null);
        return Optional.of(new RelationCandidate(source, target, type, confidence(item), sourceType, targetType));
    }

    private static double confidence(JsonNode item) {
        JsonNode value = item.get("confidence");
        if (value == null || !value.isNumber()) {
            return DEFAULT_CONFIDENCE;
        }
        double confidence = value.asDouble();
        return Double.isNaN(confidence) ? DEFAULT_CONFIDENCE : Math.max(0.0, Math.min(1.0, confidence));
    }

    private Map<String, Object> properties(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                values.put(field.getKey(), value.asText());
            } else if (value.isNumber()) {
                values.put(field.getKey(), value.numberValue());
            } else if (value.isBoolean()) {
                values.put(field.getKey(), value.asBoolean());
            }
        }
        return values;
    }

    @Nullable
    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    @Nullable
    private static String firstText(JsonNode item, String... fields) {
        for (String field : fields) {
            String value = text(item, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(JsonNode item) {
        String text = item.toString();
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
