package io.inpdeck.shell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.inpdeck.parser.api.Document;
import io.inpdeck.parser.api.Keyword;
import io.inpdeck.parser.api.Node;
import io.inpdeck.parser.api.NodeContainer;
import io.inpdeck.parser.api.Section;
import io.inpdeck.utils.Names;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a document to nested JSON objects.
 *
 * <ul>
 *   <li>sections are keyed {@code +NAME}, keywords {@code NAME}, names upper-cased
 *   <li>a section parameter is stored under {@code _}
 *   <li>a single-valued keyword maps to a string, otherwise to an array of strings
 *   <li>a name used more than once in the same container maps to an array of its occurrences; a
 *       keyword named {@code _} counts as another occurrence of the parameter, which comes first
 * </ul>
 */
public final class JsonTreeMapper {
  static final String SECTION_PREFIX = "+";
  static final String PARAMETER_KEY = "_";

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public ObjectNode toJson(Document document) {
    return container(document);
  }

  public String render(Document document) throws JsonProcessingException {
    return MAPPER.writeValueAsString(toJson(document));
  }

  private ObjectNode container(NodeContainer container) {
    Map<String, List<JsonNode>> grouped = new LinkedHashMap<>();
    if (container instanceof Section s && s.parameter().isPresent()) {
      List<JsonNode> parameter = new ArrayList<>();
      parameter.add(MAPPER.getNodeFactory().textNode(s.parameter().get()));
      grouped.put(PARAMETER_KEY, parameter);
    }
    for (Node n : container.children()) {
      String key = Names.key(n.name());
      if (n instanceof Section) {
        key = SECTION_PREFIX + key;
      }
      grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(node(n));
    }
    ObjectNode obj = MAPPER.createObjectNode();
    grouped.forEach(
        (key, values) -> {
          if (values.size() == 1) {
            obj.set(key, values.get(0));
          } else {
            obj.putArray(key).addAll(values);
          }
        });
    return obj;
  }

  private JsonNode node(Node node) {
    if (node instanceof Section s) {
      return container(s);
    }
    Keyword k = (Keyword) node;
    if (k.values().size() == 1) {
      return MAPPER.getNodeFactory().textNode(k.values().get(0));
    }
    ArrayNode values = MAPPER.createArrayNode();
    k.values().forEach(values::add);
    return values;
  }
}
