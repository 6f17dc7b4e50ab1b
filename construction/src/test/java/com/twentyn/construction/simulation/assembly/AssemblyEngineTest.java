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
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class AssemblyEngineTest {

  final List<String> DNAS = Arrays.asList("AAAA", "CCCC");

  EnzymeRegistry registry;
  GoldenGateAssembler mockGoldenGate;
  GibsonAssembler mockGibson;

  @Before
  public void setup() throws Exception {
    registry = EnzymeRegistry.defaultRegistry();

    mockGoldenGate = Mockito.mock(GoldenGateAssembler.class);
    Mockito.when(mockGoldenGate.assemble(DNAS, registry.get("BsaI"))).thenReturn("GOLDENGATE");

    mockGibson = Mockito.mock(GibsonAssembler.class);
    Mockito.when(mockGibson.assemble(DNAS, true)).thenReturn(new AssemblyProduct("GIBSON", true));
  }

  @Test
  public void testKnownEnzymeGoesToGoldenGate() throws Exception {
    AssemblyEngine engine = new AssemblyEngine(registry, mockGoldenGate, mockGibson, true);

    assertEquals("BsaI is a restriction enzyme", "GOLDENGATE", engine.assemble(DNAS, "bsai"));
    Mockito.verifyNoInteractions(mockGibson);
  }

  @Test
  public void testGibsonMarkerGoesToHomologyAssembly() throws Exception {
    AssemblyEngine engine = new AssemblyEngine(registry, mockGoldenGate, mockGibson, true);

    assertEquals("gibson is not an enzyme", "GIBSON", engine.assemble(DNAS, "Gibson"));
    Mockito.verifyNoInteractions(mockGoldenGate);
  }

  @Test
  public void testUnknownEnzymeFallsBackToHomologyAssembly() throws Exception {
    AssemblyEngine engine = new AssemblyEngine(registry, mockGoldenGate, mockGibson, true);

    assertEquals("Unknown names are assembled by homology", "GIBSON", engine.assemble(DNAS, "NotAnEnzyme"));
  }

  @Test
  public void testCircularityFlagIsPassedThrough() throws Exception {
    Mockito.when(mockGibson.assemble(DNAS, false)).thenReturn(new AssemblyProduct("LINEAR", false));
    AssemblyEngine engine = new AssemblyEngine(registry, mockGoldenGate, mockGibson, false);

    assertEquals("The engine's circularity setting reaches the assembler", "LINEAR", engine.assemble(DNAS, "gibson"));
    Mockito.verify(mockGibson).assemble(DNAS, false);
  }
}
