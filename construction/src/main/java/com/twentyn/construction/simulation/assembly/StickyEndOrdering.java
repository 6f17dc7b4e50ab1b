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

package com.twentyn.construction.simulation.assembly;

import com.twentyn.construction.exceptions.AmbiguousAssemblyException;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.StickyEndException;
import com.twentyn.construction.exceptions.StickyEndMismatchException;
import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Puts sticky-ended fragments into the one circular order their overhangs allow, and joins them.
 *
 * Every sticky end may open at most one fragment and close at most one fragment, so each fragment has exactly one
 * possible successor.  The walk starts at the fragment with the lexicographically smallest 5' end, which makes the
 * result independent of input order.
 */
public class StickyEndOrdering {

  private StickyEndOrdering() {
  }

  public static List<DigestionFragment> order(List<DigestionFragment> fragments, boolean rejectPalindromes)
      throws ConstructionException {
    if (fragments.isEmpty()) {
      throw new IllegalArgumentException("Nothing to order");
    }
    if (rejectPalindromes) {
      for (DigestionFragment f : fragments) {
        checkNotPalindromic(f.getStickyEnd5());
        checkNotPalindromic(f.getStickyEnd3());
      }
    }

    Map<String, Integer> byEnd5 = new HashMap<>();
    Set<String> end3s = new HashSet<>();
    for (int i = 0; i < fragments.size(); i++) {
      DigestionFragment f = fragments.get(i);
      if (byEnd5.put(f.getStickyEnd5(), i) != null) {
        throw new AmbiguousAssemblyException(f.getStickyEnd5(),
            String.format("Sticky end %s opens more than one fragment", f.getStickyEnd5()));
      }
      if (!end3s.add(f.getStickyEnd3())) {
        throw new AmbiguousAssemblyException(f.getStickyEnd3(),
            String.format("Sticky end %s closes more than one fragment", f.getStickyEnd3()));
      }
    }

    int start = 0;
    for (int i = 1; i < fragments.size(); i++) {
      if (fragments.get(i).getStickyEnd5().compareTo(fragments.get(start).getStickyEnd5()) < 0) {
        start = i;
      }
    }

    List<Integer> walk = new ArrayList<>(fragments.size());
    Set<Integer> visited = new HashSet<>();
    int current = start;
    while (true) {
      walk.add(current);
      visited.add(current);
      String end3 = fragments.get(current).getStickyEnd3();
      Integer next = byEnd5.get(end3);
      if (next == null) {
        throw new StickyEndMismatchException(current, -1,
            String.format("Fragment %d ends in %s but no fragment starts with it", current, end3));
      }
      if (next == start) {
        break;
      }
      if (visited.contains(next)) {
        throw new StickyEndMismatchException(current, next,
            String.format("Fragments %d and %d form a loop that skips the rest", current, next));
      }
      current = next;
    }

    if (walk.size() != fragments.size()) {
      List<Integer> unused = new ArrayList<>();
      for (int i = 0; i < fragments.size(); i++) {
        if (!visited.contains(i)) {
          unused.add(i);
        }
      }
      throw new StickyEndMismatchException(walk.get(walk.size() - 1), start,
          String.format("Fragments %s close into a circle without fragment(s) %s",
              StringUtils.join(walk, ","), StringUtils.join(unused, ",")));
    }

    List<DigestionFragment> ordered = new ArrayList<>(walk.size());
    for (Integer idx : walk) {
      ordered.add(fragments.get(idx));
    }

    for (int i = 0; i < ordered.size(); i++) {
      int j = (i + 1) % ordered.size();
      if (!ordered.get(i).getStickyEnd3().equals(ordered.get(j).getStickyEnd5())) {
        throw new StickyEndMismatchException(walk.get(i), walk.get(j),
            String.format("Fragment %d ends in %s but fragment %d starts with %s", walk.get(i),
                ordered.get(i).getStickyEnd3(), walk.get(j), ordered.get(j).getStickyEnd5()));
      }
    }
    return Collections.unmodifiableList(ordered);
  }

  /**
   * Joins ordered fragments into a circular sequence written from the first fragment's 5' sticky end; each closing
   * overhang is supplied by the next fragment.
   */
  public static String join(List<DigestionFragment> ordered) {
    StringBuilder sb = new StringBuilder();
    for (DigestionFragment f : ordered) {
      sb.append(f.getStickyEnd5()).append(f.getFragment());
    }
    return sb.toString();
  }

  private static void checkNotPalindromic(String stickyEnd) throws ConstructionException {
    if (SequenceUtils.isPalindromic(stickyEnd)) {
      throw new StickyEndException(stickyEnd,
          String.format("Sticky end %s is palindromic and could ligate in either orientation", stickyEnd));
    }
  }
}
