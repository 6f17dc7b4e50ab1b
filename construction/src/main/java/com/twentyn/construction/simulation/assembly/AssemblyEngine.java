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

import com.twentyn.construction.enzyme.EnzymeRegistry;
import com.twentyn.construction.enzyme.RestrictionEnzyme;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.model.AssembleStep;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Routes an assembly to Golden Gate when the named enzyme is a known restriction enzyme, and to homology assembly
 * otherwise (normally for the "gibson" marker).
 */
public class AssemblyEngine {
  private static final Logger LOGGER = LogManager.getFormatterLogger(AssemblyEngine.class);

  private final EnzymeRegistry registry;
  private final GoldenGateAssembler goldenGate;
  private final GibsonAssembler gibson;
  private final boolean checkCircularity;

  public AssemblyEngine(EnzymeRegistry registry, GoldenGateAssembler goldenGate, GibsonAssembler gibson,
                        boolean checkCircularity) {
    this.registry = registry;
    this.goldenGate = goldenGate;
    this.gibson = gibson;
    this.checkCircularity = checkCircularity;
  }

  public String assemble(List<String> dnas, String enzymeOrMarker) throws ConstructionException {
    RestrictionEnzyme enzyme = registry.get(enzymeOrMarker);
    if (enzyme != null) {
      return goldenGate.assemble(dnas, enzyme);
    }
    if (!AssembleStep.GIBSON.equalsIgnoreCase(enzymeOrMarker)) {
      LOGGER.warn("%s is not a known enzyme; assembling by homology instead", enzymeOrMarker);
    }

    AssemblyProduct product = gibson.assemble(dnas, checkCircularity);
    LOGGER.debug("Homology assembly of %d fragments gave a %s product", dnas.size(), product);
    return product.getSequence();
  }
}
