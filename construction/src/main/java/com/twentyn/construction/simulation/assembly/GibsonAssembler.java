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

import com.twentyn.construction.config.SimulatorConfig;
import com.twentyn.construction.exceptions.CircularityException;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.NonConvergenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Homology assembly by exact terminal overlap.
 *
 * Each round merges every fragment A with every other fragment B that contains A's terminal homology, giving
 * A + (B after the overlap).  The working list must shrink every round:
 * <ul>
 *   <li>fewer merges than fragments: the chain is still converging;</li>
 *   <li>as many merges as fragments: every fragment found a partner, so the fragments form a ring.  The last merge is
 *   dropped so the ring is not closed twice;</li>
 *   <li>more merges than fragments: some junction is ambiguous and the assembly fails.</li>
 * </ul>
 * Merges that are contained in another merge of the same round carry no new sequence and are discarded before
 * counting.
 */
public class GibsonAssembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GibsonAssembler.class);

  private final int homologyLength;

  public GibsonAssembler() {
    this(SimulatorConfig.DEFAULT_HOMOLOGY_LENGTH);
  }

  public GibsonAssembler(int homologyLength) {
    if (homologyLength <= 0) {
      throw new IllegalArgumentException("Homology length must be positive, got " + homologyLength);
    }
    this.homologyLength = homologyLength;
  }

  public int getHomologyLength() {
    return homologyLength;
  }

  /**
   * @param checkCircularity When true, a ring is closed into a non-redundant circular sequence and a linear result is
   *   an error.  When false, the converged sequence is returned as-is.
   * @throws NonConvergenceException if a round produces more merges than fragments, or none at all.
   * @throws CircularityException if circularity is required and the product is linear.
   */
  public AssemblyProduct assemble(List<String> dnas, boolean checkCircularity) throws ConstructionException {
    if (dnas.isEmpty()) {
      throw new IllegalArgumentException("Nothing to assemble");
    }

    List<String> current = new ArrayList<>(dnas.size());
    for (String dna : dnas) {
      current.add(dna.toUpperCase());
    }

    boolean circular = false;
    int round = 0;
    while (current.size() > 1) {
      round++;
      List<String> merged = prune(mergeRound(current));
      LOGGER.debug("Homology round %d: %d fragments, %d merges", round, current.size(), merged.size());

      if (merged.isEmpty() || merged.size() > current.size()) {
        throw new NonConvergenceException(round, current.size(), merged.size());
      }
      if (merged.size() == current.size()) {
        circular = true;
        merged.remove(merged.size() - 1);
      }
      current = merged;
    }

    String product = current.get(0);
    String closed = close(product);
    if (round == 0) {
      // A lone fragment is circular only if its own ends overlap.
      circular = closed != null;
    } else if (circular && closed == null) {
      LOGGER.warn("Fragments formed a ring but the %d bp product does not overlap itself", product.length());
      circular = false;
    }

    if (!checkCircularity) {
      return new AssemblyProduct(product, circular);
    }
    if (!circular) {
      throw new CircularityException(product.length());
    }
    return new AssemblyProduct(closed, true);
  }

  private List<String> mergeRound(List<String> fragments) {
    List<String> merges = new ArrayList<>();
    for (int i = 0; i < fragments.size(); i++) {
      String a = fragments.get(i);
      if (a.length() < homologyLength) {
        continue;
      }
      String overlap = a.substring(a.length() - homologyLength);
      for (int j = 0; j < fragments.size(); j++) {
        if (i == j) {
          continue;
        }
        String b = fragments.get(j);
        int idx = b.indexOf(overlap);
        while (idx >= 0) {
          merges.add(a + b.substring(idx + homologyLength));
          idx = b.indexOf(overlap, idx + 1);
        }
      }
    }
    return merges;
  }

  // Drops exact duplicates and merges wholly contained in a longer merge, keeping the original order.
  private static List<String> prune(List<String> merges) {
    List<String> out = new ArrayList<>();
    for (int i = 0; i < merges.size(); i++) {
      String candidate = merges.get(i);
      boolean redundant = false;
      for (int j = 0; j < merges.size() && !redundant; j++) {
        if (i == j) {
          continue;
        }
        String other = merges.get(j);
        if (other.length() > candidate.length()) {
          redundant = other.contains(candidate);
        } else if (other.equals(candidate)) {
          redundant = j < i;
        }
      }
      if (!redundant) {
        out.add(candidate);
      }
    }
    return out;
  }

  /**
   * Collapses a sequence that runs around a ring, possibly more than once, into one copy of the ring.  The ring is
   * read starting just past the first occurrence of the terminal homology and spans one period, i.e. the distance to
   * the next occurrence.
   * @return The circular sequence, or null if the terminal homology does not occur earlier in the sequence.
   */
  String close(String seq) {
    if (seq.length() < 2 * homologyLength) {
      return null;
    }
    String overlap = seq.substring(seq.length() - homologyLength);
    int first = seq.indexOf(overlap);
    int next = seq.indexOf(overlap, first + 1);
    if (next < 0) {
      return null;
    }
    int period = next - first;
    return seq.substring(first + homologyLength, first + homologyLength + period);
  }
}
