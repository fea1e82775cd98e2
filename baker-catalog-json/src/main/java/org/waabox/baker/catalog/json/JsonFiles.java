package org.waabox.baker.catalog.json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.baker.BakerException;

/**
 * Reads JSON files into Jackson trees.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class JsonFiles {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private JsonFiles() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Reads a file whose root must be a JSON object.
   *
   * @param file the file, never null
   *
   * @return the root object, never null
   *
   * @throws BakerException if the file cannot be read, is not JSON, or its
   *                        root is not an object
   */
  static JsonNode readObject(final Path file) {
    Objects.requireNonNull(file, "file must not be null");
    final JsonNode root;
    try {
      root = MAPPER.readTree(Files.readAllBytes(file));
    } catch (final IOException e) {
      throw new BakerException("Failed to read JSON file: " + file, e);
    }
    if (root == null || !root.isObject()) {
      throw new BakerException("Expected a JSON object in file: " + file);
    }
    return root;
  }

  /**
   * Returns the object field of a node.
   *
   * @param node  the parent node, never null
   * @param field the field name, never null
   * @param file  the file being parsed, for error messages
   *
   * @return the field value, never null
   *
   * @throws BakerException if the field is missing or not an object
   */
  static JsonNode requireObject(final JsonNode node, final String field,
      final Path file) {
    final JsonNode value = requireField(node, field, file);
    if (!value.isObject()) {
      throw new BakerException("Field '" + field + "' is not an object in"
          + " file: " + file);
    }
    return value;
  }

  /**
   * Returns the text of a required field.
   *
   * @param node  the parent node, never null
   * @param field the field name, never null
   * @param file  the file being parsed, for error messages
   *
   * @return the text, never null
   *
   * @throws BakerException if the field is missing
   */
  static String requireText(final JsonNode node, final String field,
      final Path file) {
    return requireField(node, field, file).asText();
  }

  /**
   * Returns the text of an optional field.
   *
   * @param node  the parent node, never null
   * @param field the field name, never null
   *
   * @return the text, or an empty string if the field is missing
   */
  static String optionalText(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return "";
    }
    return value.asText();
  }

  /**
   * Returns the elements of an optional array of strings.
   *
   * @param node  the parent node, never null
   * @param field the field name, never null
   *
   * @return the texts, never null, empty if the field is missing
   */
  static List<String> optionalTexts(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || !value.isArray()) {
      return Collections.emptyList();
    }
    final List<String> texts = new ArrayList<>(value.size());
    value.forEach(element -> texts.add(element.asText()));
    return texts;
  }

  /**
   * Returns the field node for the given key or throws if missing.
   *
   * @param node  the parent node, never null
   * @param field the field name, never null
   * @param file  the file being parsed, for error messages
   *
   * @return the field node, never null
   *
   * @throws BakerException if the field is missing
   */
  private static JsonNode requireField(final JsonNode node,
      final String field, final Path file) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new BakerException("Missing field '" + field + "' in " + node
          + " of file: " + file);
    }
    return value;
  }
}
