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

package com.twentyn.construction.simulation;

import com.twentyn.construction.enzyme.EnzymeRegistry;
import com.twentyn.construction.enzyme.RestrictionEnzyme;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.DigestException;
import com.twentyn.construction.exceptions.EnzymeSiteException;
import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Cuts a linear DNA with one or more enzymes.  Fragments are reported in order of position and keep the overhang
 * bases at their ends, so neighbouring fragments share the bases of the cut between them.
 */
public class DigestSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DigestSimulator.class);

  private final EnzymeRegistry registry;

  public DigestSimulator(EnzymeRegistry registry) {
    this.registry = registry;
  }

  /**
   * @param fragSelect Zero-based index of the fragment to keep.
   * @throws EnzymeSiteException if an enzyme name is not in the registry.
   * @throws DigestException if fragSelect is out of range.
   */
  public String digest(String dna, List<String> enzymeNames, int fragSelect) throws ConstructionException {
    List<RestrictionEnzyme> enzymes = new ArrayList<>(enzymeNames.size());
    for (String name : enzymeNames) {
      RestrictionEnzyme enzyme = registry.get(name);
      if (enzyme == null) {
        throw new EnzymeSiteException(name, "not a known restriction enzyme");
      }
      enzymes.add(enzyme);
    }

    List<String> fragments = cut(dna, enzymes);
    if (fragments.size() == 1) {
      LOGGER.warn("None of %s cut the %d bp input", enzymeNames, dna.length());
    }
    if (fragSelect < 0 || fragSelect >= fragments.size()) {
      throw new DigestException(fragSelect, fragments.size());
    }
    return fragments.get(fragSelect);
  }

  public List<String> cut(String dna, List<RestrictionEnzyme> enzymes) {
    String seq = dna.toUpperCase();
    List<int[]> regions = new ArrayList<>();
    for (RestrictionEnzyme enzyme : enzymes) {
      for (int site : SequenceUtils.findAll(seq, enzyme.getRecognitionSequence())) {
        addRegion(regions, enzyme.forwardCutRegion(site), seq.length());
      }
      if (!enzyme.isPalindromicSite()) {
        for (int site : SequenceUtils.findAll(seq, enzyme.getRecognitionRC())) {
          addRegion(regions, enzyme.reverseCutRegion(site), seq.length());
        }
      }
    }
    regions.sort(Comparator.<int[]>comparingInt(r -> r[0]).thenComparingInt(r -> r[1]));

    List<String> fragments = new ArrayList<>(regions.size() + 1);
    int start = 0;
    for (int[] region : regions) {
      fragments.add(seq.substring(start, region[1]));
      start = region[0];
    }
    fragments.add(seq.substring(start));
    return Collections.unmodifiableList(fragments);
  }

  // Cuts that fall off either end of the DNA are ignored; a cut found twice (palindromic sites) is kept once.
  private static void addRegion(List<int[]> regions, int[] region, int length) {
    if (region[0] < 0 || region[1] > length) {
      return;
    }
    for (int[] existing : regions) {
      if (existing[0] == region[0] && existing[1] == region[1]) {
        return;
      }
    }
    regions.add(region);
  }

}
