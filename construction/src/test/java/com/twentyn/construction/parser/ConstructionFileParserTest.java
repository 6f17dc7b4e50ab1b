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

package com.twentyn.construction.parser;

import com.twentyn.construction.exceptions.ConstructionFileParseException;
import com.twentyn.construction.model.AssembleStep;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.model.DigestStep;
import com.twentyn.construction.model.LigateStep;
import com.twentyn.construction.model.Operation;
import com.twentyn.construction.model.PcrStep;
import com.twentyn.construction.model.TransformStep;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConstructionFileParserTest {

  static final String EXAMPLE_FILE =
      "PCR ca4238F/ca4238R on pSB1A2 (1032 bp, pcrpdt)\n" +
      "Digest pcrpdt (EcoRI/BamHI, 1, pcrdig)\n" +
      "Ligate pcrdig vecdig (lig)\n" +
      "Transform lig (Mach1, Amp, 37C, pdt)\n" +
      "\n" +
      "ca4238F ccataGAATTCatgagaaagttgaacgg\n" +
      "ca4238R cagttGGATCCttagcgtttcaggtcg\n" +
      "pSB1A2  ACGTACGTAC\n";

  @Test
  public void testParseExampleFile() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(EXAMPLE_FILE);

    assertEquals("Four steps should be parsed", 4, cf.getSteps().size());
    assertEquals("PCR step fields",
        new PcrStep("pcrpdt", "ca4238F", "ca4238R", "pSB1A2", 1032), cf.getSteps().get(0));
    assertEquals("Digest step fields",
        new DigestStep("pcrdig", "pcrpdt", Arrays.asList("EcoRI", "BamHI"), 1), cf.getSteps().get(1));
    assertEquals("Ligate step fields",
        new LigateStep("lig", Arrays.asList("pcrdig", "vecdig")), cf.getSteps().get(2));
    assertEquals("Transform step fields",
        new TransformStep("pdt", "lig", "Mach1", Collections.singletonList("Amp"), "37C"), cf.getSteps().get(3));

    assertEquals("Three sequences should be parsed", 3, cf.getSequences().size());
    assertEquals("Sequences are stored upper-case", "CCATAGAATTCATGAGAAAGTTGAACGG",
        cf.getSequences().get("ca4238F"));
  }

  @Test
  public void testAssemblySynonyms() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(
        "Gibson pcrA pcrB pcrC (gib)\n" +
        "GoldenGate partA partB BsaI gg\n" +
        "Assemble partA partB BsmBI (asm)\n" +
        "blunt pcrA pcrB (bl)");

    AssembleStep gibson = (AssembleStep) cf.getSteps().get(0);
    assertTrue("Gibson lines use the gibson marker", gibson.isGibson());
    assertEquals("Gibson inputs", Arrays.asList("pcrA", "pcrB", "pcrC"), gibson.getDnas());

    assertEquals("GoldenGate is an Assemble step",
        new AssembleStep("gg", Arrays.asList("partA", "partB"), "BsaI"), cf.getSteps().get(1));
    assertEquals("Assemble names its enzyme second to last",
        new AssembleStep("asm", Arrays.asList("partA", "partB"), "BsmBI"), cf.getSteps().get(2));

    LigateStep blunt = (LigateStep) cf.getSteps().get(3);
    assertEquals("Blunt is a ligation", Operation.LIGATE, blunt.getOperation());
    assertTrue("Blunt ligations are flagged", blunt.isBlunt());
  }

  @Test
  public void testPcrWithoutProductSizeAndTransformWithoutTemperature() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(
        "PCR oF oR on tmpl (pdt)\nTransform lig Mach1 Amp Kan out");

    PcrStep pcr = (PcrStep) cf.getSteps().get(0);
    assertNull("No product size was given", pcr.getProductSize());
    assertEquals("Template is the fourth token", "tmpl", pcr.getTemplate());

    TransformStep transform = (TransformStep) cf.getSteps().get(1);
    assertEquals("Both antibiotics are kept", Arrays.asList("Amp", "Kan"), transform.getAntibiotics());
    assertNull("Kan is not a temperature", transform.getTemperature());
  }

  @Test
  public void testSpreadsheetTable() throws Exception {
    List<List<Object>> table = Arrays.asList(
        Arrays.<Object>asList("PCR", "oF", "oR", "tmpl", 1032.0, "pdt"),
        Arrays.<Object>asList("Digest", "pdt", "EcoRI", 0.0, "dig"),
        Arrays.<Object>asList("oF", "acgtacgt"));

    ConstructionFile cf = new ConstructionFileParser().parse(table);

    assertEquals("Numeric cells are read as integers", Integer.valueOf(1032),
        ((PcrStep) cf.getSteps().get(0)).getProductSize());
    assertEquals("Fragment index from a numeric cell", 0, ((DigestStep) cf.getSteps().get(1)).getFragSelect());
    assertEquals("Sequence rows are read", "ACGTACGT", cf.getSequences().get("oF"));
  }

  @Test
  public void testPermissiveParsingDropsUnknownLines() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(
        "Some notes about this construct\nPCR oF oR tmpl pdt\n");
    assertEquals("The note is skipped and the step is kept", 1, cf.getSteps().size());
    assertTrue("The note is not a sequence", cf.getSequences().isEmpty());
  }

  @Test
  public void testStrictParsingRejectsUnknownLines() {
    try {
      new ConstructionFileParser(true).parse("PCR oF oR tmpl pdt\nSome notes about this construct\n");
      fail("Strict parsing should reject the note");
    } catch (ConstructionFileParseException e) {
      assertEquals("The offending line is reported", "Some notes about this construct", e.getLine());
    }
  }

  @Test
  public void testMalformedOperationsAlwaysFail() {
    List<String> malformed = Arrays.asList(
        "PCR oF oR pdt",
        "Digest pdt EcoRI dig",
        "Digest pdt EcoRI first dig",
        "PCR oF oR tmpl big bp pdt",
        "Ligate lig",
        "Assemble a BsaI",
        "Gibson gib",
        "Transform lig Mach1 pdt");
    for (String line : malformed) {
      try {
        new ConstructionFileParser().parse(line);
        fail("Expected a parse failure for: " + line);
      } catch (ConstructionFileParseException e) {
        assertEquals("The offending line is reported", line, e.getLine());
      }
    }
  }

  @Test
  public void testDuplicateSequenceKeepsLastDefinition() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse("seqA AAAA\nseqA CCCC");
    assertEquals("The later definition wins", "CCCC", cf.getSequences().get("seqA"));
  }

  @Test
  public void testMultipleBlobsFormOneFile() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(
        "Gibson a b (gib)", Arrays.asList("a", "ACGT"), Arrays.asList(Arrays.asList("b", "TTGG")));
    assertEquals("One step from the first blob", 1, cf.getSteps().size());
    assertEquals("Sequences from both list blobs", 2, cf.getSequences().size());
    assertFalse("Gibson inputs are steps, not sequences", cf.getSequences().containsKey("Gibson"));
  }

  @Test
  public void testStepInputsAreListedInLineOrder() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(ConstructionFileParserTest.EXAMPLE_FILE);
    assertEquals("PCR consumes both oligos and the template", Arrays.asList("ca4238F", "ca4238R", "pSB1A2"),
        cf.getSteps().get(0).getInputs());
    assertEquals("Digest consumes one dna", Collections.singletonList("pcrpdt"), cf.getSteps().get(1).getInputs());
    assertEquals("Transform consumes one dna", Collections.singletonList("lig"), cf.getSteps().get(3).getInputs());
  }

  @Test
  public void testIsOperation() {
    assertTrue("Keywords are case-insensitive", ConstructionFileParser.isOperation("goldengate"));
    assertFalse("Sequence names are not operations", ConstructionFileParser.isOperation("pSB1A2"));
  }
}
