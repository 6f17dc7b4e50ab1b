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

package com.twentyn.construction.enzyme;

import com.twentyn.construction.config.EnzymeDefinition;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class EnzymeRegistryTest {

  @Test
  public void testLookupIsCaseInsensitive() {
    EnzymeRegistry registry = EnzymeRegistry.defaultRegistry();
    assertTrue("bsai should find BsaI", registry.contains("bsai"));
    assertEquals("Lookup should return the canonical entry", "BsaI", registry.get(" BSAI ").getName());
    assertNull("Unknown names resolve to null", registry.get("gibson"));
    assertFalse("Unknown names are not contained", registry.contains("NotAnEnzyme"));
  }

  @Test
  public void testEnzymeGeometry() {
    EnzymeRegistry registry = EnzymeRegistry.defaultRegistry();

    RestrictionEnzyme bsaI = registry.get("BsaI");
    assertTrue("BsaI leaves a 5' overhang", bsaI.isFivePrime());
    assertFalse("BsaI's site is not palindromic", bsaI.isPalindromicSite());
    assertEquals("BsaI site reverse complement", "GAGACC", bsaI.getRecognitionRC());
    assertEquals("BsaI overhangs are 4 bp", 4, bsaI.getOverhangLength());

    RestrictionEnzyme pstI = registry.get("PstI");
    assertFalse("PstI leaves a 3' overhang", pstI.isFivePrime());
    assertTrue("PstI's site is palindromic", pstI.isPalindromicSite());

    assertTrue("EcoRV cuts blunt", registry.get("EcoRV").isBlunt());
  }

  @Test
  public void testCutRegions() {
    RestrictionEnzyme bsaI = EnzymeRegistry.defaultRegistry().get("BsaI");
    // GGTCTC at 10: the top strand is cut 1 nt past the site and the bottom strand 5 nt past it.
    assertArrayEquals("Forward BsaI overhang", new int[] {17, 21}, bsaI.forwardCutRegion(10));
    // GAGACC at 30: mirror image, upstream of the site.
    assertArrayEquals("Reverse BsaI overhang", new int[] {25, 29}, bsaI.reverseCutRegion(30));

    RestrictionEnzyme ecoRI = EnzymeRegistry.defaultRegistry().get("EcoRI");
    assertArrayEquals("EcoRI overhang is the AATT inside its site", new int[] {1, 5}, ecoRI.forwardCutRegion(0));
  }

  @Test
  public void testAdditionalEnzymes() throws Exception {
    EnzymeRegistry registry = EnzymeRegistry.withAdditionalEnzymes(Arrays.asList(
        new EnzymeDefinition("PaqCI", "caccTGC", 4, 8),
        new EnzymeDefinition("BsaI", "GGTCTC", 2, 6)));

    assertEquals("New enzymes are added with upper-cased sites", "CACCTGC",
        registry.get("paqci").getRecognitionSequence());
    assertEquals("Definitions replace built-ins of the same name", 2, registry.get("BsaI").getCut5());
    assertTrue("Other built-ins are kept", registry.contains("EcoRI"));
    assertEquals("Replacing does not duplicate", EnzymeRegistry.defaultRegistry().getEnzymes().size() + 1,
        registry.getEnzymes().size());
  }
}
