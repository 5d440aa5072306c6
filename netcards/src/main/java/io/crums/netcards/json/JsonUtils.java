/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.json;


import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON helpers. Objects are parsed into insertion-ordered maps (rather than
 * {@code JSONObject}s) since field order is significant.
 */
public class JsonUtils {

  private JsonUtils() {  }


  /**
   * Creates {@code LinkedHashMap}s and {@code ArrayList}s.
   */
  public final static ContainerFactory ORDERED = new ContainerFactory() {
    @Override
    public Map<?, ?> createObjectContainer() {
      return new LinkedHashMap<>();
    }
    @Override
    public List<?> creatArrayContainer() {
      return new ArrayList<>();
    }
  };


  /**
   * Parses the given JSON text. Objects are returned as ordered maps.
   *
   * @throws JsonParsingException if malformed
   */
  public static Object parse(String json) throws JsonParsingException {
    try {
      return new JSONParser().parse(json, ORDERED);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + px, px);
    }
  }


  /**
   * Parses the given JSON input. Objects are returned as ordered maps.
   *
   * @throws JsonParsingException if malformed
   * @throws UncheckedIOException on I/O error
   */
  public static Object parse(Reader reader) throws JsonParsingException, UncheckedIOException {
    try {
      return new JSONParser().parse(reader, ORDERED);
    } catch (ParseException px) {
      throw new JsonParsingException("malformed json: " + px, px);
    } catch (IOException iox) {
      throw new UncheckedIOException(iox);
    }
  }


  /**
   * Casts the given value to a JSON object (map).
   *
   * @param what  description used in the error message
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value, String what) throws JsonParsingException {
    if (value instanceof Map)
      return (Map<String, Object>) value;
    throw new JsonParsingException(what + " expects a JSON object: " + value);
  }


  /**
   * Casts the given value to a JSON array (list).
   *
   * @param what  description used in the error message
   */
  public static List<?> asArray(Object value, String what) throws JsonParsingException {
    if (value instanceof List<?> list)
      return list;
    throw new JsonParsingException(what + " expects a JSON array: " + value);
  }


  public static String getString(Map<String, ?> jObj, String name, boolean require)
      throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }


  public static Map<String, Object> getJsonObject(Map<String, ?> jObj, String name, boolean require)
      throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON object '" + name + "' missing");
      return null;
    }
    return asObject(value, "'" + name + "'");
  }


  public static List<?> getJsonArray(Map<String, ?> jObj, String name, boolean require)
      throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected JSON array '" + name + "' missing");
      return null;
    }
    return asArray(value, "'" + name + "'");
  }


  /**
   * Returns the given entry value (a string or number), checking its type.
   *
   * @param field the field name (for the error message)
   */
  public static Object getEntryValue(Object value, String field) throws JsonParsingException {
    if (value instanceof String || value instanceof Number)
      return value;
    throw new JsonParsingException(
        "field '" + field + "' expects a string or number: " + value);
  }

}
