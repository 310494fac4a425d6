package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.pwf.schema.SchemaLogging.LOG;

/// Internal schema compiler.
///
/// Compiles a single self-contained schema document. Only local `$ref`s are
/// supported; they are resolved lazily at validation time through the pointer index,
/// so recursive definitions compile without special handling.
final class SchemaCompiler {

  static final String POINTER_ROOT = "#";
  static final String DEFS_SEGMENT = "/$defs/";

  private SchemaCompiler() {}

  /// Per-compilation session state (no static mutable fields).
  private static final class Session {
    final JsonNode rawRoot;
    final JsonSchema.JsonSchemaOptions options;
    final Map<String, JsonSchema> pointerIndex = new LinkedHashMap<>();
    final Deque<String> pendingRefs = new ArrayDeque<>();
    final JsonSchema.ResolverContext resolverContext = new JsonSchema.ResolverContext(pointerIndex);

    Session(JsonNode rawRoot, JsonSchema.JsonSchemaOptions options) {
      this.rawRoot = rawRoot;
      this.options = options;
    }
  }

  private static void trace(String stage, JsonNode fragment) {
    if (LOG.isLoggable(Level.FINER)) {
      LOG.finer(() -> String.format("[%s] %s", stage, fragment));
    }
  }

  static JsonSchema compile(JsonNode schemaJson, JsonSchema.JsonSchemaOptions options) {
    Session session = new Session(schemaJson, options);
    JsonSchema root = compileInternal(session, schemaJson, POINTER_ROOT);
    session.pointerIndex.put(POINTER_ROOT, root);

    // Refs that point outside $defs are compiled from the raw document on demand
    while (!session.pendingRefs.isEmpty()) {
      String pointer = session.pendingRefs.pop();
      if (session.pointerIndex.containsKey(pointer)) {
        continue;
      }
      JsonNode target = navigatePointer(session.rawRoot, pointer)
          .orElseThrow(() -> new IllegalArgumentException("Unresolved $ref: " + pointer));
      session.pointerIndex.put(pointer, compileInternal(session, target, pointer));
    }

    LOG.fine(() -> "compile: indexed pointers=" + session.pointerIndex.keySet());
    return root;
  }

  /// JSON Pointer utility for RFC-6901 fragment navigation
  static Optional<JsonNode> navigatePointer(JsonNode root, String pointer) {
    LOG.fine(() -> "pointer.navigate pointer=" + pointer);

    String path = pointer.startsWith(POINTER_ROOT) ? pointer.substring(1) : pointer;
    if (path.isEmpty()) {
      return Optional.of(root);
    }
    if (!path.startsWith("/")) {
      return Optional.empty();
    }

    JsonNode current = root;
    for (String token : path.substring(1).split("/", -1)) {
      // Unescape ~1 -> / and ~0 -> ~
      String unescaped = token.replace("~1", "/").replace("~0", "~");
      if (current.isObject()) {
        current = current.get(unescaped);
        if (current == null) {
          LOG.finer(() -> "Property not found: " + unescaped);
          return Optional.empty();
        }
      } else if (current.isArray()) {
        try {
          int index = Integer.parseInt(unescaped);
          if (index < 0 || index >= current.size()) {
            return Optional.empty();
          }
          current = current.get(index);
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      } else {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  private static JsonSchema compileInternal(Session session, JsonNode schemaJson, String pointer) {
    if (schemaJson.isBoolean()) {
      return schemaJson.booleanValue() ? BooleanSchema.TRUE : BooleanSchema.FALSE;
    }
    if (!schemaJson.isObject()) {
      throw new IllegalArgumentException("Schema must be an object or boolean at " + pointer + " but was " + schemaJson.getNodeType());
    }
    trace("compile", schemaJson);

    // Compile $defs first so that refs into them share the compiled instance
    JsonNode defs = schemaJson.get("$defs");
    if (defs != null && defs.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = defs.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> entry = it.next();
        String defPointer = pointer + DEFS_SEGMENT + escapePointerToken(entry.getKey());
        if (!session.pointerIndex.containsKey(defPointer)) {
          JsonSchema compiled = compileInternal(session, entry.getValue(), defPointer);
          session.pointerIndex.put(defPointer, compiled);
          LOG.finest(() -> "Indexed $defs entry as " + defPointer);
        }
      }
    }

    List<JsonSchema> parts = new ArrayList<>();

    JsonNode refValue = schemaJson.get("$ref");
    if (refValue != null) {
      if (!refValue.isTextual()) {
        throw new IllegalArgumentException("$ref must be a string at " + pointer);
      }
      String ref = refValue.textValue();
      if (!ref.startsWith(POINTER_ROOT)) {
        throw new IllegalArgumentException("Only local $ref values are supported: " + ref);
      }
      session.pendingRefs.push(ref.equals(POINTER_ROOT) ? POINTER_ROOT : ref);
      parts.add(new RefSchema(ref, session.resolverContext));
    }

    JsonSchema base = compileTypedSchema(session, schemaJson, pointer);

    // Handle enum (wraps the base schema so type errors win over enum errors)
    JsonNode enumValue = schemaJson.get("enum");
    if (enumValue != null) {
      if (!enumValue.isArray()) {
        throw new IllegalArgumentException("enum must be an array at " + pointer);
      }
      List<JsonNode> allowedValues = new ArrayList<>();
      enumValue.forEach(allowedValues::add);
      base = new EnumSchema(base == null ? AnySchema.INSTANCE : base, allowedValues);
    }
    if (base != null) {
      parts.add(base);
    }

    JsonNode constValue = schemaJson.get("const");
    if (constValue != null) {
      parts.add(new ConstSchema(constValue));
    }

    JsonNode allOfValue = schemaJson.get("allOf");
    if (allOfValue != null) {
      trace("compile-allof", allOfValue);
      parts.add(new AllOfSchema(compileList(session, allOfValue, pointer + "/allOf")));
    }

    JsonNode anyOfValue = schemaJson.get("anyOf");
    if (anyOfValue != null) {
      trace("compile-anyof", anyOfValue);
      parts.add(new AnyOfSchema(compileList(session, anyOfValue, pointer + "/anyOf")));
    }

    JsonNode oneOfValue = schemaJson.get("oneOf");
    if (oneOfValue != null) {
      trace("compile-oneof", oneOfValue);
      parts.add(new OneOfSchema(compileList(session, oneOfValue, pointer + "/oneOf")));
    }

    JsonNode notValue = schemaJson.get("not");
    if (notValue != null) {
      parts.add(new NotSchema(compileInternal(session, notValue, pointer + "/not")));
    }

    // Handle if/then/else
    JsonNode ifValue = schemaJson.get("if");
    if (ifValue != null) {
      trace("compile-conditional", schemaJson);
      JsonSchema ifSchema = compileInternal(session, ifValue, pointer + "/if");
      JsonNode thenValue = schemaJson.get("then");
      JsonNode elseValue = schemaJson.get("else");
      JsonSchema thenSchema = thenValue == null ? null : compileInternal(session, thenValue, pointer + "/then");
      JsonSchema elseSchema = elseValue == null ? null : compileInternal(session, elseValue, pointer + "/else");
      parts.add(new ConditionalSchema(ifSchema, thenSchema, elseSchema));
    }

    if (parts.isEmpty()) {
      return AnySchema.INSTANCE;
    }
    return parts.size() == 1 ? parts.get(0) : new AllOfSchema(parts);
  }

  private static List<JsonSchema> compileList(Session session, JsonNode array, String pointer) {
    if (!array.isArray() || array.isEmpty()) {
      throw new IllegalArgumentException("Expected a non-empty array of schemas at " + pointer);
    }
    List<JsonSchema> schemas = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      schemas.add(compileInternal(session, array.get(i), pointer + "/" + i));
    }
    return schemas;
  }

  /// Type based schema from `type`, or inferred from the keywords present; null when unconstrained
  private static JsonSchema compileTypedSchema(Session session, JsonNode obj, String pointer) {
    JsonNode typeValue = obj.get("type");
    if (typeValue != null && typeValue.isTextual()) {
      return compileForType(session, obj, typeValue.textValue(), pointer);
    }
    if (typeValue != null && typeValue.isArray()) {
      // Type arrays such as ["string", "null"] behave as anyOf
      List<JsonSchema> typeSchemas = new ArrayList<>();
      for (JsonNode item : typeValue) {
        if (!item.isTextual()) {
          throw new IllegalArgumentException("Type array must contain only strings");
        }
        typeSchemas.add(compileForType(session, obj, item.textValue(), pointer));
      }
      if (typeSchemas.isEmpty()) {
        return null;
      }
      return typeSchemas.size() == 1 ? typeSchemas.get(0) : new AnyOfSchema(typeSchemas);
    }
    if (typeValue != null) {
      throw new IllegalArgumentException("type must be a string or array at " + pointer);
    }

    if (hasAny(obj, "properties", "required", "additionalProperties", "minProperties", "maxProperties",
        "patternProperties", "propertyNames", "dependentRequired")) {
      return compileObjectSchema(session, obj, pointer);
    }
    if (hasAny(obj, "items", "minItems", "maxItems", "uniqueItems")) {
      return compileArraySchema(session, obj, pointer);
    }
    if (hasAny(obj, "pattern", "minLength", "maxLength", "format")) {
      return compileStringSchema(session, obj);
    }
    if (hasAny(obj, "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf")) {
      return compileNumberSchema(obj, false);
    }
    return null;
  }

  private static JsonSchema compileForType(Session session, JsonNode obj, String type, String pointer) {
    return switch (type) {
      case "object" -> compileObjectSchema(session, obj, pointer);
      case "array" -> compileArraySchema(session, obj, pointer);
      case "string" -> compileStringSchema(session, obj);
      case "number" -> compileNumberSchema(obj, false);
      case "integer" -> compileNumberSchema(obj, true);
      case "boolean" -> new BooleanSchema();
      case "null" -> new NullSchema();
      default -> throw new IllegalArgumentException("Unknown type '" + type + "' at " + pointer);
    };
  }

  private static boolean hasAny(JsonNode obj, String... keywords) {
    for (String keyword : keywords) {
      if (obj.has(keyword)) return true;
    }
    return false;
  }

  private static JsonSchema compileObjectSchema(Session session, JsonNode obj, String pointer) {
    LOG.finest(() -> "compileObjectSchema: " + pointer);
    Map<String, JsonSchema> properties = new LinkedHashMap<>();
    JsonNode propsValue = obj.get("properties");
    if (propsValue != null && propsValue.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = propsValue.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> entry = it.next();
        String propPointer = pointer + "/properties/" + escapePointerToken(entry.getKey());
        JsonSchema propertySchema = compileInternal(session, entry.getValue(), propPointer);
        properties.put(entry.getKey(), propertySchema);
        session.pointerIndex.putIfAbsent(propPointer, propertySchema);
      }
    }

    Set<String> required = new LinkedHashSet<>();
    JsonNode reqValue = obj.get("required");
    if (reqValue != null && reqValue.isArray()) {
      for (JsonNode item : reqValue) {
        if (!item.isTextual()) {
          throw new IllegalArgumentException("required must contain only strings at " + pointer);
        }
        required.add(item.textValue());
      }
    }

    JsonSchema additionalProperties = null;
    JsonNode addPropsValue = obj.get("additionalProperties");
    if (addPropsValue != null) {
      additionalProperties = compileInternal(session, addPropsValue, pointer + "/additionalProperties");
    }

    // Handle patternProperties
    Map<Pattern, JsonSchema> patternProperties = null;
    JsonNode patternPropsValue = obj.get("patternProperties");
    if (patternPropsValue != null && patternPropsValue.isObject()) {
      patternProperties = new LinkedHashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = patternPropsValue.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> entry = it.next();
        patternProperties.put(compilePattern(entry.getKey(), pointer),
            compileInternal(session, entry.getValue(), pointer + "/patternProperties/" + escapePointerToken(entry.getKey())));
      }
    }

    JsonSchema propertyNames = null;
    JsonNode propNamesValue = obj.get("propertyNames");
    if (propNamesValue != null) {
      propertyNames = compileInternal(session, propNamesValue, pointer + "/propertyNames");
    }

    // Handle dependentRequired
    Map<String, Set<String>> dependentRequired = null;
    JsonNode depReqValue = obj.get("dependentRequired");
    if (depReqValue != null && depReqValue.isObject()) {
      dependentRequired = new LinkedHashMap<>();
      for (Iterator<Map.Entry<String, JsonNode>> it = depReqValue.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> entry = it.next();
        if (!entry.getValue().isArray()) {
          throw new IllegalArgumentException("dependentRequired values must be arrays");
        }
        Set<String> requiredProps = new LinkedHashSet<>();
        for (JsonNode depItem : entry.getValue()) {
          if (!depItem.isTextual()) {
            throw new IllegalArgumentException("dependentRequired values must be arrays of strings");
          }
          requiredProps.add(depItem.textValue());
        }
        dependentRequired.put(entry.getKey(), requiredProps);
      }
    }

    return new ObjectSchema(properties, required, additionalProperties,
        getInteger(obj, "minProperties"), getInteger(obj, "maxProperties"),
        patternProperties, propertyNames, dependentRequired);
  }

  private static JsonSchema compileArraySchema(Session session, JsonNode obj, String pointer) {
    JsonSchema items = null;
    JsonNode itemsValue = obj.get("items");
    if (itemsValue != null) {
      items = compileInternal(session, itemsValue, pointer + "/items");
    }
    return new ArraySchema(items, getInteger(obj, "minItems"), getInteger(obj, "maxItems"), getBoolean(obj, "uniqueItems"));
  }

  private static JsonSchema compileStringSchema(Session session, JsonNode obj) {
    Pattern pattern = null;
    JsonNode patternValue = obj.get("pattern");
    if (patternValue != null && patternValue.isTextual()) {
      pattern = compilePattern(patternValue.textValue(), "pattern");
    }

    Format format = null;
    boolean assertFormats = session.options.assertFormats();
    JsonNode formatValue = obj.get("format");
    if (assertFormats && formatValue != null && formatValue.isTextual()) {
      String formatName = formatValue.textValue();
      format = Format.byName(formatName);
      if (format == null) {
        LOG.fine(() -> "Unknown format: " + formatName);
      }
    }

    return new StringSchema(getInteger(obj, "minLength"), getInteger(obj, "maxLength"), pattern, format, assertFormats);
  }

  private static JsonSchema compileNumberSchema(JsonNode obj, boolean integer) {
    return new NumberSchema(
        getBigDecimal(obj, "minimum"),
        getBigDecimal(obj, "maximum"),
        getBigDecimal(obj, "exclusiveMinimum"),
        getBigDecimal(obj, "exclusiveMaximum"),
        getBigDecimal(obj, "multipleOf"),
        integer);
  }

  private static Pattern compilePattern(String regex, String pointer) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid pattern at " + pointer + ": " + regex, e);
    }
  }

  private static String escapePointerToken(String key) {
    return key.replace("~", "~0").replace("/", "~1");
  }

  private static Integer getInteger(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    return value != null && value.canConvertToInt() ? value.intValue() : null;
  }

  private static Boolean getBoolean(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    return value != null && value.isBoolean() ? value.booleanValue() : null;
  }

  private static BigDecimal getBigDecimal(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    return value != null && value.isNumber() ? value.decimalValue() : null;
  }
}
