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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.construction.exceptions.UnsupportedStepException;
import com.twentyn.construction.model.ConstructionFile;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class ConstructionFileJsonTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testRoundTripThroughFile() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse(ConstructionFileParserTest.EXAMPLE_FILE);
    File jsonFile = tempFolder.newFile("cf.json");

    ConstructionFileJson.write(cf, jsonFile);

    assertEquals("JSON round trip should preserve every step and sequence", cf, ConstructionFileJson.read(jsonFile));
  }

  @Test
  public void testStepsAreTaggedWithTheirOperation() throws Exception {
    ConstructionFile cf = new ConstructionFileParser().parse("Gibson a b (gib)\nPCR oF oR tmpl pdt");
    JsonNode tree = new ObjectMapper().readTree(ConstructionFileJson.write(cf));

    assertEquals("Gibson is written as an assembly", "assemble", tree.get("steps").get(0).get("operation").asText());
    assertEquals("The gibson marker is the enzyme", "gibson", tree.get("steps").get(0).get("enzyme").asText());
    assertEquals("PCR tag", "pcr", tree.get("steps").get(1).get("operation").asText());
    assertEquals("Missing product sizes are not written", null, tree.get("steps").get(1).get("product_size"));
  }

  @Test
  public void testUnknownOperationIsUnsupported() throws Exception {
    String json = "{\"steps\": [{\"operation\": \"electroporate\", \"output\": \"x\"}], \"sequences\": {}}";
    try {
      ConstructionFileJson.read(json);
      fail("An unknown operation should be rejected");
    } catch (UnsupportedStepException e) {
      assertEquals("The unknown operation is reported", "electroporate", e.getOperation());
    }
  }
}
