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

package com.twentyn.construction.sequence;

import com.twentyn.construction.exceptions.UnrecognizedSequenceException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Utility methods for common molecular biology operations on plain-string sequences.
 */
public class SequenceUtils {

  // DNA nucleotides plus the IUPAC degeneracy codes, either case; no uracil.
  public static final Pattern NUCLEOTIDE_PATTERN = Pattern.compile("^[ACGTRYKMSWBDHVNacgtrykmswbdhvn]+$");

  private static final Map<Character, Character> COMPLEMENTS = new HashMap<Character, Character>() {{
    put('A', 'T');
    put('T', 'A');
    put('C', 'G');
    put('G', 'C');
    //BDHKMNRSVWY
    //VHDMKNYSBWR
    put('B', 'V');
    put('D', 'H');
    put('H', 'D');
    put('K', 'M');
    put('M', 'K');
    put('N', 'N');
    put('R', 'Y');
    put('S', 'S');
    put('V', 'B');
    put('W', 'W');
    put('Y', 'R');
  }};

  private SequenceUtils() {
  }

  public static boolean isSequence(String value) {
    return value != null && NUCLEOTIDE_PATTERN.matcher(value).matches();
  }

  /**
   * Turns a loosely typed cell value into a canonical upper-case sequence.  Whitespace inside the value is ignored,
   * so sequences pasted across several lines still resolve.
   * @param value A String, or anything whose toString() is a sequence.
   * @return The upper-cased sequence.
   * @throws UnrecognizedSequenceException if the value contains anything but nucleotide or degeneracy letters.
   */
  public static String resolveSequence(Object value) throws UnrecognizedSequenceException {
    if (value == null) {
      throw new UnrecognizedSequenceException("null");
    }
    String seq = value.toString().replaceAll("\\s+", "");
    if (!isSequence(seq)) {
      throw new UnrecognizedSequenceException(value.toString());
    }
    return seq.toUpperCase();
  }

  public static String complement(String seq) throws UnrecognizedSequenceException {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = 0; i < seq.length(); i++) {
      sb.append(complementBase(seq, seq.charAt(i)));
    }
    return sb.toString();
  }

  /**
   * Reverse-complements a sequence, honoring degeneracy codes and preserving case.
   */
  public static String reverseComplement(String seq) throws UnrecognizedSequenceException {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = seq.length() - 1; i >= 0; i--) {
      sb.append(complementBase(seq, seq.charAt(i)));
    }
    return sb.toString();
  }

  /**
   * A sequence is palindromic (in the molecular biology sense) when it equals its own reverse complement.
   */
  public static boolean isPalindromic(String seq) throws UnrecognizedSequenceException {
    return seq.equalsIgnoreCase(reverseComplement(seq));
  }

  /**
   * @return The start of every occurrence of site in seq, overlapping occurrences included.
   */
  public static List<Integer> findAll(String seq, String site) {
    List<Integer> hits = new ArrayList<>();
    int idx = seq.indexOf(site);
    while (idx >= 0) {
      hits.add(idx);
      idx = seq.indexOf(site, idx + 1);
    }
    return hits;
  }

  public static double calcGC(String inseq) {
    String seq = inseq.toUpperCase();
    int gcs = 0;
    for (int i = 0; i < seq.length(); i++) {
      char achar = seq.charAt(i);
      if (achar == 'C' || achar == 'G') {
        gcs++;
      }
    }
    return seq.isEmpty() ? 0.0 : 1.0 * gcs / seq.length();
  }

  private static char complementBase(String seq, char base) throws UnrecognizedSequenceException {
    Character comp = COMPLEMENTS.get(Character.toUpperCase(base));
    if (comp == null) {
      throw new UnrecognizedSequenceException(seq);
    }
    return Character.isLowerCase(base) ? Character.toLowerCase(comp) : comp;
  }
}
