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

import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.StickyEndException;
import com.twentyn.construction.simulation.assembly.DigestionFragment;
import com.twentyn.construction.simulation.assembly.StickyEndOrdering;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Ligates fragments that already carry their overhangs, e.g. digest products.  The first and last
 * {@link #OVERHANG_LENGTH} bases of each input are taken as its sticky ends and the fragments are closed into a circle
 * in the order the sticky ends dictate.  Unlike Golden Gate, palindromic overhangs such as EcoRI's AATT are accepted.
 */
public class LigationSimulator {
  public static final int OVERHANG_LENGTH = 4;

  public String ligate(List<String> dnas) throws ConstructionException {
    List<DigestionFragment> fragments = new ArrayList<>(dnas.size());
    for (String dna : dnas) {
      String seq = dna.toUpperCase();
      if (seq.length() < 2 * OVERHANG_LENGTH) {
        throw new StickyEndException(seq,
            String.format("%d bp is too short to carry two %d bp overhangs", seq.length(), OVERHANG_LENGTH));
      }
      fragments.add(new DigestionFragment(
          seq.substring(OVERHANG_LENGTH, seq.length() - OVERHANG_LENGTH),
          seq.substring(0, OVERHANG_LENGTH),
          seq.substring(seq.length() - OVERHANG_LENGTH)));
    }
    return StickyEndOrdering.join(StickyEndOrdering.order(fragments, false));
  }

  /**
   * Blunt ligation has nothing to order by; the inputs are joined as given.
   */
  public String bluntLigate(List<String> dnas) {
    List<String> upper = new ArrayList<>(dnas.size());
    for (String dna : dnas) {
      upper.add(dna.toUpperCase());
    }
    return StringUtils.join(upper, "");
  }
}
