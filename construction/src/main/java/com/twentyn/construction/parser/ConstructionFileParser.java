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

import com.twentyn.construction.exceptions.ConstructionFileParseException;
import com.twentyn.construction.model.AssembleStep;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.model.ConstructionStep;
import com.twentyn.construction.model.DigestStep;
import com.twentyn.construction.model.LigateStep;
import com.twentyn.construction.model.PcrStep;
import com.twentyn.construction.model.TransformStep;
import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses loosely formatted construction files.  Each line is either an operation, e.g.
 * <pre>
 *   PCR ca4238F/ca4238R on pSB1A2 (1032 bp, pcrpdt)
 *   Digest pcrpdt (EcoRI/BamHI, 1, pcrdig)
 *   Gibson pcrA pcrB (pAssembled)
 * </pre>
 * or a sequence definition, i.e. a name followed by nucleotides.  Anything else is dropped with a warning, or rejected
 * when the parser is strict.
 */
public class ConstructionFileParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileParser.class);

  private static final Pattern DIGITS = Pattern.compile("^(\\d+)");
  private static final Pattern TEMPERATURE = Pattern.compile("^\\d+(\\.\\d+)?([cC]|°[cC])?$");
  private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");

  private enum Keyword {
    PCR, DIGEST, LIGATE, BLUNT, ASSEMBLE, GOLDENGATE, GIBSON, TRANSFORM
  }

  private static final Map<String, Keyword> KEYWORDS = new HashMap<String, Keyword>() {{
    for (Keyword keyword : Keyword.values()) {
      put(keyword.name().toLowerCase(), keyword);
    }
  }};

  private final boolean strict;

  public ConstructionFileParser() {
    this(false);
  }

  public ConstructionFileParser(boolean strict) {
    this.strict = strict;
  }

  public static boolean isOperation(String token) {
    return token != null && KEYWORDS.containsKey(token.toLowerCase());
  }

  /**
   * Parses any mix of scalars, rows, tables and multi-line text into one construction file.
   * @param blobs The input blobs, concatenated in order.
   * @return The parsed construction file.
   * @throws ConstructionFileParseException if an operation line is malformed, or (when strict) a line is unparseable.
   */
  public ConstructionFile parse(Object... blobs) throws ConstructionFileParseException {
    List<ConstructionStep> steps = new ArrayList<>();
    Map<String, String> sequences = new LinkedHashMap<>();

    for (String line : Tokenizer.toLines(blobs)) {
      List<String> tokens = Tokenizer.tokenize(line);
      if (tokens.isEmpty()) {
        continue;
      }

      if (isOperation(tokens.get(0))) {
        steps.add(parseStep(tokens, line));
      } else if (isSequenceDefinition(tokens)) {
        String name = tokens.get(0);
        String seq = StringUtils.join(tokens.subList(1, tokens.size()), "").toUpperCase();
        if (sequences.containsKey(name)) {
          LOGGER.warn("Sequence %s is defined more than once; keeping the last definition", name);
        }
        sequences.put(name, seq);
      } else if (strict) {
        throw new ConstructionFileParseException("Line is neither an operation nor a sequence", line);
      } else {
        LOGGER.warn("Dropping unrecognized construction file line: '%s'", line.trim());
      }
    }

    LOGGER.debug("Parsed %d steps and %d sequences", steps.size(), sequences.size());
    return new ConstructionFile(steps, sequences);
  }

  /**
   * A sequence definition is a name followed by one or more tokens that, joined, are made of nucleotide or degeneracy
   * letters.
   */
  public static boolean isSequenceDefinition(List<String> tokens) {
    if (tokens.size() < 2) {
      return false;
    }
    return SequenceUtils.isSequence(StringUtils.join(tokens.subList(1, tokens.size()), ""));
  }

  /**
   * Builds a step from an operation line's tokens.  The first token must be an operation keyword.
   */
  public static ConstructionStep parseStep(List<String> tokens, String line) throws ConstructionFileParseException {
    Keyword keyword = KEYWORDS.get(tokens.get(0).toLowerCase());
    int n = tokens.size();
    String output = tokens.get(n - 1);

    switch (keyword) {
      case PCR: {
        requireTokens(tokens, 5, "PCR needs forward oligo, reverse oligo, template and output", line);
        Integer size = null;
        if (n > 5) {
          Matcher m = DIGITS.matcher(tokens.get(4));
          if (!m.find()) {
            throw new ConstructionFileParseException("PCR product size is not a number", line);
          }
          size = Integer.valueOf(m.group(1));
        }
        return new PcrStep(output, tokens.get(1), tokens.get(2), tokens.get(3), size);
      }
      case DIGEST: {
        requireTokens(tokens, 5, "Digest needs dna, at least one enzyme, fragment index and output", line);
        String index = tokens.get(n - 2);
        if (!INTEGER.matcher(index).matches()) {
          throw new ConstructionFileParseException("Digest fragment index is not an integer", line);
        }
        return new DigestStep(output, tokens.get(1), new ArrayList<>(tokens.subList(2, n - 2)), Integer.parseInt(index));
      }
      case LIGATE:
      case BLUNT:
        requireTokens(tokens, 3, "Ligation needs at least one dna and an output", line);
        return new LigateStep(output, new ArrayList<>(tokens.subList(1, n - 1)), keyword == Keyword.BLUNT);
      case ASSEMBLE:
      case GOLDENGATE:
        requireTokens(tokens, 4, "Assembly needs at least one dna, an enzyme and an output", line);
        return new AssembleStep(output, new ArrayList<>(tokens.subList(1, n - 2)), tokens.get(n - 2));
      case GIBSON:
        requireTokens(tokens, 3, "Gibson needs at least one dna and an output", line);
        return new AssembleStep(output, new ArrayList<>(tokens.subList(1, n - 1)), AssembleStep.GIBSON);
      case TRANSFORM:
        return parseTransform(tokens, line);
      default:
        // Every keyword is handled above.
        throw new ConstructionFileParseException("Unhandled operation " + keyword, line);
    }
  }

  private static TransformStep parseTransform(List<String> tokens, String line) throws ConstructionFileParseException {
    requireTokens(tokens, 5, "Transform needs dna, strain, antibiotic and output", line);
    int n = tokens.size();
    if (n == 5) {
      return new TransformStep(tokens.get(4), tokens.get(1), tokens.get(2),
          Collections.singletonList(tokens.get(3)), null);
    }

    List<String> middle = new ArrayList<>(tokens.subList(3, n - 1));
    String temperature = null;
    if (middle.size() > 1 && TEMPERATURE.matcher(middle.get(middle.size() - 1)).matches()) {
      temperature = middle.remove(middle.size() - 1);
    }
    return new TransformStep(tokens.get(n - 1), tokens.get(1), tokens.get(2), middle, temperature);
  }

  private static void requireTokens(List<String> tokens, int minimum, String msg, String line)
      throws ConstructionFileParseException {
    if (tokens.size() < minimum) {
      throw new ConstructionFileParseException(msg, line);
    }
  }
}
