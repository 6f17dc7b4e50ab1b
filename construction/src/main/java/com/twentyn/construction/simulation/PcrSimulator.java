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

import com.twentyn.construction.config.SimulatorConfig;
import com.twentyn.construction.exceptions.AnnealMismatchException;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Predicts a PCR product by exact matching of each oligo's 3' anneal region against the template.  Oligo 5' tails
 * (restriction sites, homology arms) are carried into the product as-is.
 */
public class PcrSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PcrSimulator.class);

  private final int annealLength;

  public PcrSimulator() {
    this(SimulatorConfig.DEFAULT_ANNEAL_LENGTH);
  }

  public PcrSimulator(int annealLength) {
    if (annealLength <= 0) {
      throw new IllegalArgumentException("Anneal length must be positive, got " + annealLength);
    }
    this.annealLength = annealLength;
  }

  public int getAnnealLength() {
    return annealLength;
  }

  /**
   * @return forwardOligo + the template between the two anneal regions + revcomp(reverseOligo).
   * @throws AnnealMismatchException if either oligo's anneal region has no exact match.
   */
  public String pcr(String forwardOligo, String reverseOligo, String template) throws ConstructionException {
    String fwd = forwardOligo.toUpperCase();
    String revRC = SequenceUtils.reverseComplement(reverseOligo.toUpperCase());
    String tmpl = template.toUpperCase();

    String fwdAnneal = fwd.substring(Math.max(0, fwd.length() - annealLength));
    int fwdIdx = tmpl.indexOf(fwdAnneal);
    if (fwdIdx < 0) {
      tmpl = SequenceUtils.reverseComplement(tmpl);
      fwdIdx = tmpl.indexOf(fwdAnneal);
      if (fwdIdx < 0) {
        throw new AnnealMismatchException("forward", forwardOligo, fwdAnneal);
      }
      LOGGER.debug("Forward oligo anneals to the reverse strand of the template");
    }

    // Rotate so the amplicon can run across the origin of a circular template.
    String rotated = tmpl.substring(fwdIdx) + tmpl.substring(0, fwdIdx);

    String revAnneal = revRC.substring(0, Math.min(annealLength, revRC.length()));
    int revIdx = rotated.indexOf(revAnneal, fwdAnneal.length());
    if (revIdx < 0) {
      throw new AnnealMismatchException("reverse", reverseOligo, revAnneal);
    }

    return fwd + rotated.substring(fwdAnneal.length(), revIdx) + revRC;
  }
}
