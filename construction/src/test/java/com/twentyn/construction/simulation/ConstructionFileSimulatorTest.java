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

import com.twentyn.construction.exceptions.AnnealMismatchException;
import com.twentyn.construction.exceptions.UnresolvedReferenceException;
import com.twentyn.construction.model.AssembleStep;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.model.ConstructionStep;
import com.twentyn.construction.model.DigestStep;
import com.twentyn.construction.model.LigateStep;
import com.twentyn.construction.model.PcrStep;
import com.twentyn.construction.model.TransformStep;
import com.twentyn.construction.parser.ConstructionFileParser;
import com.twentyn.construction.simulation.assembly.AssemblyEngine;
import com.twentyn.construction.test.util.TestSequences;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class ConstructionFileSimulatorTest {

  String template;
  String fwd;
  String rev;

  @Before
  public void setup() {
    TestSequences sequences = new TestSequences(99L, "GAATTC", "GGATCC");
    template = sequences.next(400);
    fwd = "CCATAGAATTC" + template.substring(100, 120);
    rev = "CAGTTGGATCC" + TestSequences.reverseComplement(template.substring(280, 300));
  }

  @Test
  public void testCloningWorkflow() throws Exception {
    // Arrange: amplify an insert with EcoRI/BamHI tails, cut it and ligate it into a cut vector.
    String vector = "GATCCAAACCCGAATT";
    String text =
        "PCR oF/oR on tmpl (pcrpdt)\n" +
        "Digest pcrpdt (EcoRI/BamHI, 1, pcrdig)\n" +
        "Ligate pcrdig vec (lig)\n" +
        "Transform lig (Mach1, Amp, 37C, pdt)\n" +
        "oF " + fwd + "\n" +
        "oR " + rev + "\n" +
        "tmpl " + template.toLowerCase() + "\n" +
        "vec " + vector + "\n";
    ConstructionFile cf = new ConstructionFileParser().parse(text);

    // Act
    List<Pair<String, String>> products = ConstructionFileSimulator.withDefaults().simulate(cf);

    // Assert
    String pcrProduct = "CCATAGAATTC" + template.substring(100, 300) + "GGATCCAACTG";
    String insert = "AATTC" + template.substring(100, 300) + "GGATC";
    String ligated = "AATT" + "C" + template.substring(100, 300) + "G" + "GATC" + "CAAACCCG";

    assertEquals("One product per step", 4, products.size());
    assertEquals("Products are named after step outputs",
        Arrays.asList("pcrpdt", "pcrdig", "lig", "pdt"),
        Arrays.asList(products.get(0).getLeft(), products.get(1).getLeft(), products.get(2).getLeft(),
            products.get(3).getLeft()));
    assertEquals("PCR product", pcrProduct, products.get(0).getRight());
    assertEquals("Digest keeps the overhangs", insert, products.get(1).getRight());
    assertEquals("Ligation closes insert and vector", ligated, products.get(2).getRight());
    assertEquals("Transformation does not change the DNA", ligated, products.get(3).getRight());
  }

  @Test
  public void testProductsShadowSequencesOfTheSameName() throws Exception {
    Map<String, String> sequences = new HashMap<>();
    sequences.put("x", "AAAAAAAA");
    sequences.put("y", "CCCC");
    ConstructionFile cf = new ConstructionFile(Arrays.<ConstructionStep>asList(
        new LigateStep("x", Arrays.asList("y", "y"), true),
        new LigateStep("z", Arrays.asList("x", "y"), true)), sequences);

    List<Pair<String, String>> products = ConstructionFileSimulator.withDefaults().simulate(cf);

    assertEquals("The second step sees the product x, not the sequence x", "CCCCCCCCCCCC",
        products.get(1).getRight());
  }

  @Test
  public void testUnresolvedReference() throws Exception {
    ConstructionFile cf = new ConstructionFile(Collections.<ConstructionStep>singletonList(
        new TransformStep("pdt", "missing", "Mach1", Collections.singletonList("Amp"), null)),
        Collections.<String, String>emptyMap());
    try {
      ConstructionFileSimulator.withDefaults().simulate(cf);
      fail("An undefined name should not resolve");
    } catch (UnresolvedReferenceException e) {
      assertEquals("The missing name is reported", "missing", e.getName());
    }
  }

  @Test
  public void testStepsRunInDocumentOrder() throws Exception {
    Map<String, String> sequences = new HashMap<>();
    sequences.put("a", "ACGT");
    ConstructionFile cf = new ConstructionFile(Arrays.<ConstructionStep>asList(
        new LigateStep("early", Arrays.asList("a", "late"), true),
        new LigateStep("late", Arrays.asList("a", "a"), true)), sequences);
    try {
      ConstructionFileSimulator.withDefaults().simulate(cf);
      fail("A product cannot be used before the step that makes it");
    } catch (UnresolvedReferenceException e) {
      assertEquals("The forward reference is reported", "late", e.getName());
    }
  }

  @Test
  public void testFailingStepStopsTheRun() throws Exception {
    Map<String, String> sequences = new HashMap<>();
    sequences.put("tmpl", template);
    sequences.put("oF", "TTTTTTTTTTTTTTTTTTTTTTTT");
    sequences.put("oR", rev);
    ConstructionFile cf = new ConstructionFile(Arrays.<ConstructionStep>asList(
        new PcrStep("pdt", "oF", "oR", "tmpl", null),
        new TransformStep("cells", "pdt", "Mach1", Collections.singletonList("Amp"), null)), sequences);
    try {
      ConstructionFileSimulator.withDefaults().simulate(cf);
      fail("A PCR with a non-annealing oligo should fail");
    } catch (AnnealMismatchException e) {
      assertEquals("The original error is propagated", "forward", e.getRole());
    }
  }

  @Test
  public void testStepsAreDispatchedToTheirSimulators() throws Exception {
    // Arrange
    PcrSimulator mockPcr = Mockito.mock(PcrSimulator.class);
    DigestSimulator mockDigest = Mockito.mock(DigestSimulator.class);
    LigationSimulator mockLigation = Mockito.mock(LigationSimulator.class);
    AssemblyEngine mockAssembly = Mockito.mock(AssemblyEngine.class);

    Mockito.when(mockPcr.pcr("AAAA", "CCCC", "GGGG")).thenReturn("PCRPRODUCT");
    Mockito.when(mockDigest.digest("PCRPRODUCT", Collections.singletonList("EcoRI"), 0)).thenReturn("DIGESTED");
    Mockito.when(mockLigation.ligate(Arrays.asList("DIGESTED", "GGGG"))).thenReturn("LIGATED");
    Mockito.when(mockAssembly.assemble(Arrays.asList("LIGATED", "AAAA"), "gibson")).thenReturn("ASSEMBLED");

    Map<String, String> sequences = new HashMap<>();
    sequences.put("f", "aaaa");
    sequences.put("r", "CCCC");
    sequences.put("t", "GGGG");
    ConstructionFile cf = new ConstructionFile(Arrays.<ConstructionStep>asList(
        new PcrStep("p", "f", "r", "t", null),
        new DigestStep("d", "p", Collections.singletonList("EcoRI"), 0),
        new LigateStep("l", Arrays.asList("d", "t")),
        new AssembleStep("a", Arrays.asList("l", "f"), AssembleStep.GIBSON)), sequences);

    ConstructionFileSimulator simulator = new ConstructionFileSimulator(mockPcr, mockDigest, mockLigation,
        mockAssembly);

    // Act
    List<Pair<String, String>> products = simulator.simulate(cf);

    // Assert
    assertEquals("Final product comes from the assembly engine", Pair.of("a", "ASSEMBLED"), products.get(3));
    Mockito.verify(mockPcr).pcr("AAAA", "CCCC", "GGGG");
    Mockito.verify(mockLigation, Mockito.never()).bluntLigate(Mockito.<String>anyList());
    Mockito.verify(mockAssembly).assemble(Arrays.asList("LIGATED", "AAAA"), "gibson");
  }
}
