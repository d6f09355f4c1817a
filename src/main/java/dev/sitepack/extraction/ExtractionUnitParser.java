package dev.sitepack.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.sitepack.llm.ExtractionException;
import dev.sitepack.ranking.RankedEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an extraction reply onto an {@link ExtractionUnit}. Lenient about optional parts.
 *
 * <p>Dimension keys are compared case-insensitively; when two keys collide the first one in the
 * reply wins.
 */
final class ExtractionUnitParser {

  private static final Logger log = LoggerFactory.getLogger(ExtractionUnitParser.class);

  private ExtractionUnitParser() {}

  static ExtractionUnit parse(RankedEntry page, ObjectNode reply, Instant extractedAt) {
    JsonNode fieldsNode = reply.path("fields");
    if (!fieldsNode.isMissingNode() && !fieldsNode.isObject()) {
      throw new ExtractionException("\"fields\" must be an object");
    }

    Map<String, ExtractedField> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = fieldsNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> field = it.next();
      String dimension = field.getKey().trim().toLowerCase(Locale.ROOT);
      String value = valueOf(field.getValue());
      if (dimension.isEmpty() || value.isBlank()) {
        continue;
      }
      ExtractedField previous =
          fields.putIfAbsent(dimension, new ExtractedField(value, evidenceRefs(field.getValue())));
      if (previous != null) {
        log.warn(
            "Duplicate dimension '{}' in extraction of {}, keeping the first value",
            field.getKey(),
            page.entry().url());
      }
    }

    Map<String, String> evidence = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> ev = reply.path("evidence").fields();
    while (ev.hasNext()) {
      Map.Entry<String, JsonNode> item = ev.next();
      JsonNode excerptNode = item.getValue().isTextual() ? item.getValue() : item.getValue().path("excerpt");
      String excerpt = excerptNode.asText("").trim();
      if (!excerpt.isEmpty()) {
        evidence.put(item.getKey().trim(), excerpt);
      }
    }

    return new ExtractionUnit(
        page.entry().url(),
        page.entry().title(),
        page.rank(),
        reply.path("summary").asText("").trim(),
        fields,
        evidence,
        extractedAt,
        false,
        null);
  }

  private static String valueOf(JsonNode field) {
    JsonNode value = field.isObject() ? field.path("value") : field;
    if (value.isMissingNode() || value.isNull()) {
      return "";
    }
    return value.isValueNode() ? value.asText().trim() : value.toString();
  }

  private static List<String> evidenceRefs(JsonNode field) {
    List<String> refs = new ArrayList<>();
    JsonNode node = field.path("evidence");
    if (node.isTextual()) {
      refs.add(node.asText().trim());
    } else if (node.isArray()) {
      for (JsonNode ref : node) {
        if (ref.isTextual() && !ref.asText().isBlank()) {
          refs.add(ref.asText().trim());
        }
      }
    }
    return refs;
  }
}
