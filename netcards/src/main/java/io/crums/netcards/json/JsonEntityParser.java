/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.json;


import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.json.simple.JSONValue;

/**
 * Emergent pattern for parsing and generating JSON, abstracted into an
 * interface. The JSON tree is made of ordered maps, lists, strings and
 * numbers.
 *
 * @param <T> the entity type
 */
public interface JsonEntityParser<T> {

  /**
   * Returns the given entity as a JSON tree (an ordered map or a list).
   */
  Object toJson(T entity);


  /**
   * Returns the given JSON tree as the typed entity.
   *
   * @throws JsonParsingException if the tree breaks the entity's grammar
   */
  T toEntity(Object json) throws JsonParsingException;


  /**
   * Returns the given entity as (compact) JSON text.
   */
  default String toJsonString(T entity) {
    return JSONValue.toJSONString(toJson(entity));
  }


  /**
   * Parses the given JSON text as a typed entity.
   */
  default T toEntity(String json) throws JsonParsingException {
    return toEntity(JsonUtils.parse(json));
  }


  default T toEntity(Reader reader) throws JsonParsingException, UncheckedIOException {
    return toEntity(JsonUtils.parse(reader));
  }


  default T toEntity(File file) throws JsonParsingException, UncheckedIOException {
    try (var reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return toEntity(reader);
    } catch (IOException iox) {
      throw new UncheckedIOException("on toEntity(file=" + file + "): " + iox, iox);
    }
  }


  /**
   * Writes the given entity as compact JSON.
   */
  default void write(T entity, Writer out) throws IOException {
    JSONValue.writeJSONString(toJson(entity), out);
    out.flush();
  }


  /**
   * Writes the given entity as pretty JSON to the given file (UTF-8),
   * overwriting it if it exists.
   */
  default void write(T entity, File file) throws IOException {
    try (var out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      out.write(JsonPrinter.toPrettyString(toJson(entity)));
      out.write('\n');
    }
  }

}
