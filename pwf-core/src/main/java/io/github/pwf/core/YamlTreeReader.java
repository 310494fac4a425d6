package io.github.pwf.core;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/// Builds a tree from a single YAML document, resolving `&anchor` / `*alias` pairs.
///
/// Jackson's own tree reader surfaces an alias as the anchor's name and stops after the
/// first document, so the token stream is walked here instead.
final class YamlTreeReader {

  /// Same ceiling SnakeYAML applies to aliased collections
  static final int MAX_COLLECTION_ALIASES = 50;

  private final YAMLParser parser;
  private final JsonNodeFactory nodes = JsonNodeFactory.instance;
  private final Map<String, JsonNode> anchors = new HashMap<>();
  private int collectionAliases;

  YamlTreeReader(YAMLParser parser) {
    this.parser = parser;
  }

  /// Reads the whole stream. Empty input is YAML null.
  /// @throws JsonParseException on a second document, an unknown alias or too many aliases
  JsonNode readDocument() throws IOException {
    JsonToken first = parser.nextToken();
    if (first == null) {
      return NullNode.getInstance();
    }
    JsonNode root = readValue(first);
    if (parser.nextToken() != null) {
      throw new JsonParseException(parser, "Expected a single document in the stream");
    }
    return root;
  }

  private JsonNode readValue(JsonToken token) throws IOException {
    if (parser.isCurrentAlias()) {
      return resolveAlias(parser.getText());
    }
    String anchor = parser.getObjectId();
    JsonNode value = switch (token) {
      case START_OBJECT -> readObject();
      case START_ARRAY -> readArray();
      case VALUE_STRING -> nodes.textNode(parser.getText());
      case VALUE_NUMBER_INT -> switch (parser.getNumberType()) {
        case INT -> nodes.numberNode(parser.getIntValue());
        case LONG -> nodes.numberNode(parser.getLongValue());
        default -> nodes.numberNode(parser.getBigIntegerValue());
      };
      case VALUE_NUMBER_FLOAT -> nodes.numberNode(parser.getDoubleValue());
      case VALUE_TRUE -> nodes.booleanNode(true);
      case VALUE_FALSE -> nodes.booleanNode(false);
      case VALUE_NULL -> nodes.nullNode();
      // !!binary
      case VALUE_EMBEDDED_OBJECT -> parser.getEmbeddedObject() instanceof byte[] bytes
          ? nodes.binaryNode(bytes)
          : nodes.pojoNode(parser.getEmbeddedObject());
      default -> throw new JsonParseException(parser, "Unexpected token " + token);
    };
    if (anchor != null) {
      anchors.put(anchor, value);
    }
    return value;
  }

  private ObjectNode readObject() throws IOException {
    ObjectNode object = nodes.objectNode();
    JsonToken token;
    while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
      String name = parser.currentName();
      if (object.has(name)) {
        throw new JsonParseException(parser, "Duplicate field '" + name + "'");
      }
      object.set(name, readValue(parser.nextToken()));
    }
    if (token != JsonToken.END_OBJECT) {
      throw new JsonParseException(parser, "Unterminated mapping");
    }
    return object;
  }

  private ArrayNode readArray() throws IOException {
    ArrayNode array = nodes.arrayNode();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      if (token == null) {
        throw new JsonParseException(parser, "Unterminated sequence");
      }
      array.add(readValue(token));
    }
    return array;
  }

  private JsonNode resolveAlias(String name) throws IOException {
    JsonNode target = anchors.get(name);
    if (target == null) {
      throw new JsonParseException(parser, "Unknown alias '" + name + "'");
    }
    if (target.isContainerNode()) {
      if (++collectionAliases > MAX_COLLECTION_ALIASES) {
        throw new JsonParseException(parser, "Too many aliases for collections (limit " + MAX_COLLECTION_ALIASES + ")");
      }
      return target.deepCopy();
    }
    return target;
  }
}
