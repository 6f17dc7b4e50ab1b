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

package com.twentyn.construction.test.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic random DNA for tests.  Generated sequences never contain the forbidden words (in either orientation),
 * so enzyme sites only appear where a test puts them.
 */
public class TestSequences {
  private static final char[] BASES = {'A', 'C', 'G', 'T'};

  private final Random random;
  private final List<String> forbidden = new ArrayList<>();

  public TestSequences(long seed, String... forbiddenWords) {
    this.random = new Random(seed);
    for (String word : forbiddenWords) {
      forbidden.add(word);
      forbidden.add(reverseComplement(word));
    }
  }

  public String next(int length) {
    StringBuilder sb = new StringBuilder(length);
    while (sb.length() < length) {
      int offset = random.nextInt(BASES.length);
      boolean appended = false;
      for (int k = 0; k < BASES.length && !appended; k++) {
        sb.append(BASES[(offset + k) % BASES.length]);
        if (endsWithForbidden(sb)) {
          sb.setLength(sb.length() - 1);
        } else {
          appended = true;
        }
      }
      if (!appended) {
        throw new IllegalStateException("Forbidden words leave no base to append");
      }
    }
    return sb.toString();
  }

  private boolean endsWithForbidden(StringBuilder sb) {
    for (String word : forbidden) {
      int start = sb.length() - word.length();
      if (start >= 0 && sb.indexOf(word, start) == start) {
        return true;
      }
    }
    return false;
  }

  public static String repeat(String unit, int times) {
    StringBuilder sb = new StringBuilder(unit.length() * times);
    for (int i = 0; i < times; i++) {
      sb.append(unit);
    }
    return sb.toString();
  }

  public static String reverseComplement(String seq) {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = seq.length() - 1; i >= 0; i--) {
      switch (seq.charAt(i)) {
        case 'A': sb.append('T'); break;
        case 'T': sb.append('A'); break;
        case 'C': sb.append('G'); break;
        case 'G': sb.append('C'); break;
        default: throw new IllegalArgumentException("Not a base: " + seq.charAt(i));
      }
    }
    return sb.toString();
  }
}
