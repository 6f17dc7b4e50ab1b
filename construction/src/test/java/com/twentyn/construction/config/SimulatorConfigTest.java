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

package com.twentyn.construction.config;

import com.twentyn.construction.enzyme.EnzymeRegistry;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SimulatorConfigTest {

  @Test
  public void testReadConfigResource() throws Exception {
    SimulatorConfig config;
    try (InputStream in = getClass().getResourceAsStream("/simulator_config.json")) {
      config = SimulatorConfig.readFromStream(in);
    }

    assertEquals("Anneal length from file", 20, config.getAnnealLength());
    assertEquals("Homology length from file", 25, config.getHomologyLength());
    assertFalse("Circularity check disabled in file", config.isCheckCircularity());
    assertTrue("Strict parsing enabled in file", config.isStrictParsing());
    assertEquals("Two enzyme definitions", 2, config.getEnzymes().size());

    EnzymeRegistry registry = EnzymeRegistry.withAdditionalEnzymes(config.getEnzymes());
    assertEquals("PaqCI should be registered", 8, registry.get("PaqCI").getCut3());
  }

  @Test
  public void testEmptyConfigUsesDefaults() throws Exception {
    SimulatorConfig config = SimulatorConfig.readFromStream(
        new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)));

    assertEquals("Default anneal length", SimulatorConfig.DEFAULT_ANNEAL_LENGTH, config.getAnnealLength());
    assertEquals("Default homology length", SimulatorConfig.DEFAULT_HOMOLOGY_LENGTH, config.getHomologyLength());
    assertTrue("Circularity is checked by default", config.isCheckCircularity());
    assertFalse("Parsing is permissive by default", config.isStrictParsing());
    assertTrue("No extra enzymes by default", config.getEnzymes().isEmpty());
  }
}
