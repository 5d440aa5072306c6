/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.netcards.json;


import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.json.simple.JSONValue;

/**
 * Pretty-prints a JSON tree (maps, lists, and scalars), 2 spaces per
 * indentation level. Map entries are printed in iteration order.
 */
public class JsonPrinter {

  private final static String INDENT = "  ";


  /**
   * Returns the given JSON tree as a pretty string.
   */
  public static String toPrettyString(Object json) {
    var out = new StringBuilder();
    append(json, 0, out);
    return out.toString();
  }


  private final PrintStream out;

  public JsonPrinter(PrintStream out) {
    this.out = Objects.requireNonNull(out, "null out");
  }


  /** Prints the given JSON tree followed by a new line. */
  public void print(Object json) {
    out.println(toPrettyString(json));
  }



  private static void append(Object json, int depth, StringBuilder out) {
    if (json instanceof Map<?, ?> map) {
      if (map.isEmpty()) {
        out.append("{}");
        return;
      }
      out.append('{');
      boolean first = true;
      for (var e : map.entrySet()) {
        if (!first)
          out.append(',');
        first = false;
        newLine(depth + 1, out);
        out.append(JSONValue.toJSONString(String.valueOf(e.getKey()))).append(": ");
        append(e.getValue(), depth + 1, out);
      }
      newLine(depth, out);
      out.append('}');

    } else if (json instanceof List<?> list) {
      if (list.isEmpty()) {
        out.append("[]");
        return;
      }
      out.append('[');
      for (int index = 0; index < list.size(); ++index) {
        if (index > 0)
          out.append(',');
        newLine(depth + 1, out);
        append(list.get(index), depth + 1, out);
      }
      newLine(depth, out);
      out.append(']');

    } else
      out.append(JSONValue.toJSONString(json));
  }


  private static void newLine(int depth, StringBuilder out) {
    out.append('\n');
    for (int count = depth; count-- > 0; )
      out.append(INDENT);
  }

}
