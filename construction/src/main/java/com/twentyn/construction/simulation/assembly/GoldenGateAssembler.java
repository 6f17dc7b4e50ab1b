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

import com.twentyn.construction.enzyme.RestrictionEnzyme;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.EnzymeSiteException;
import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Type IIS assembly.  Each part carries one forward and one reverse site flanking the region to keep; cutting both
 * releases the part with two sticky ends, and the sticky ends then fix the order of the circular product.
 */
public class GoldenGateAssembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GoldenGateAssembler.class);

  public String assemble(List<String> dnas, RestrictionEnzyme enzyme) throws ConstructionException {
    if (enzyme.isPalindromicSite() || enzyme.isBlunt()) {
      throw new EnzymeSiteException(enzyme.getName(),
          "Golden Gate needs a Type IIS enzyme with a non-palindromic site and a sticky cut");
    }

    List<DigestionFragment> fragments = new ArrayList<>(dnas.size());
    for (String dna : dnas) {
      fragments.add(excise(dna, enzyme));
    }

    List<DigestionFragment> ordered = StickyEndOrdering.order(fragments, true);
    String product = StickyEndOrdering.join(ordered);
    LOGGER.debug("Golden Gate with %s joined %d fragments into %d bp", enzyme.getName(), ordered.size(),
        product.length());
    return product;
  }

  /**
   * Cuts a part at its single forward and single reverse site.
   * @throws EnzymeSiteException unless there is exactly one site of each orientation, forward first, far enough apart
   *   to leave an insert.
   */
  public DigestionFragment excise(String dna, RestrictionEnzyme enzyme) throws EnzymeSiteException {
    String seq = dna.toUpperCase();
    List<Integer> forward = SequenceUtils.findAll(seq, enzyme.getRecognitionSequence());
    List<Integer> reverse = SequenceUtils.findAll(seq, enzyme.getRecognitionRC());

    if (forward.size() != 1 || reverse.size() != 1) {
      throw new EnzymeSiteException(enzyme.getName(), String.format(
          "expected exactly one forward and one reverse site but found %d and %d in %s",
          forward.size(), reverse.size(), abbreviate(seq)));
    }
    int fwdSite = forward.get(0);
    int revSite = reverse.get(0);
    if (revSite < fwdSite) {
      throw new EnzymeSiteException(enzyme.getName(),
          String.format("reverse site at %d precedes forward site at %d in %s", revSite, fwdSite, abbreviate(seq)));
    }

    int[] left = enzyme.forwardCutRegion(fwdSite);
    int[] right = enzyme.reverseCutRegion(revSite);
    if (left[0] < 0 || right[1] > seq.length() || left[1] > right[0]) {
      throw new EnzymeSiteException(enzyme.getName(),
          String.format("sites at %d and %d leave no fragment between the cuts in %s", fwdSite, revSite,
              abbreviate(seq)));
    }

    DigestionFragment out = new DigestionFragment(seq.substring(left[1], right[0]),
        seq.substring(left[0], left[1]), seq.substring(right[0], right[1]));
    LOGGER.debug("Excised %s with %s", out, enzyme.getName());
    return out;
  }

  private static String abbreviate(String seq) {
    return seq.length() <= 40 ? seq : seq.substring(0, 37) + "...";
  }
}
