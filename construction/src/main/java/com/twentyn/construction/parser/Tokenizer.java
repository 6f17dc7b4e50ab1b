/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.construction.parser;

import org.apache.commons.lang3.StringUtils;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns heterogeneous construction file input into lines of tokens.  Nothing here knows what an operation is; that is
 * left to {@link ConstructionFileParser}.
 */
public class Tokenizer {
  public static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,()/]+");
  private static final Pattern LINE_SEPARATORS = Pattern.compile("\\r?\\n|\\r");
  private static final Set<String> FILLER_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("on", "with")));

  private Tokenizer() {
  }

  /**
   * Flattens one blob into a single block of text.  2-D tables become one tab-joined row per line, 1-D lists one
   * tab-joined line, and scalars (including multi-line strings) are used as-is.
   */
  public static String normalize(Object blob) {
    if (blob == null) {
      return "";
    }
    List<Object> outer = asList(blob);
    if (outer == null) {
      return cellToString(blob);
    }

    List<String> lines = new ArrayList<>(outer.size());
    boolean isTable = false;
    for (Object row : outer) {
      if (asList(row) != null) {
        isTable = true;
        break;
      }
    }

    if (!isTable) {
      return joinCells(outer);
    }
    for (Object row : outer) {
      List<Object> cells = asList(row);
      lines.add(cells == null ? cellToString(row) : joinCells(cells));
    }
    return StringUtils.join(lines, "\n");
  }

  /**
   * Normalizes all blobs and splits the result into lines.
   */
  public static List<String> toLines(Object... blobs) {
    List<String> lines = new ArrayList<>();
    for (Object blob : blobs) {
      String text = normalize(blob);
      lines.addAll(Arrays.asList(LINE_SEPARATORS.split(text, -1)));
    }
    return lines;
  }

  /**
   * Splits one line on whitespace, commas, parentheses and slashes, dropping the filler words "on" and "with".
   */
  public static List<String> tokenize(String line) {
    List<String> tokens = new ArrayList<>();
    if (line == null) {
      return tokens;
    }
    for (String token : TOKEN_SEPARATORS.split(line)) {
      if (token.isEmpty() || FILLER_WORDS.contains(token.toLowerCase())) {
        continue;
      }
      tokens.add(token);
    }
    return tokens;
  }

  /**
   * Renders a spreadsheet-like cell.  Integral numbers lose their decimal part, since spreadsheets hand product sizes
   * and fragment indices over as doubles.
   */
  public static String cellToString(Object cell) {
    if (cell == null) {
      return "";
    }
    if (cell instanceof Double || cell instanceof Float) {
      double d = ((Number) cell).doubleValue();
      if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)) {
        return Long.toString((long) d);
      }
      return new BigDecimal(cell.toString()).toPlainString();
    }
    return cell.toString();
  }

  private static String joinCells(List<Object> cells) {
    List<String> out = new ArrayList<>(cells.size());
    for (Object cell : cells) {
      out.add(cellToString(cell));
    }
    return StringUtils.join(out, "\t");
  }

  // Lists, other collections and arrays (but not strings) are all treated as sequences of cells.
  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object value) {
    if (value instanceof List) {
      return (List<Object>) value;
    }
    if (value instanceof Collection) {
      return new ArrayList<>((Collection<Object>) value);
    }
    if (value != null && value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> out = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        out.add(Array.get(value, i));
      }
      return out;
    }
    return null;
  }
}
