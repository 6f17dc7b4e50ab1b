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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * A simple container for the tunable simulation parameters, loaded from a JSON file.  Every field has a default, so
 * an empty JSON object is a valid config.
 */
public class SimulatorConfig {
  public static final int DEFAULT_ANNEAL_LENGTH = 18;
  public static final int DEFAULT_HOMOLOGY_LENGTH = 20;

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  // Length of the 3' oligo region that must match the PCR template exactly.
  @JsonProperty("anneal_length")
  private int annealLength = DEFAULT_ANNEAL_LENGTH;

  // Length of the terminal overlap that joins two fragments in a homology (Gibson) assembly.
  @JsonProperty("homology_length")
  private int homologyLength = DEFAULT_HOMOLOGY_LENGTH;

  // Reject homology assemblies that do not close into a circle.
  @JsonProperty("check_circularity")
  private boolean checkCircularity = true;

  // Raise on lines that are neither an operation nor a sequence instead of dropping them.
  @JsonProperty("strict_parsing")
  private boolean strictParsing = false;

  @JsonProperty("enzymes")
  private List<EnzymeDefinition> enzymes = new ArrayList<>();

  public SimulatorConfig() {
  }

  public static SimulatorConfig defaults() {
    return new SimulatorConfig();
  }

  public static SimulatorConfig readFromFile(File configFile) throws IOException {
    return OBJECT_MAPPER.readValue(configFile, SimulatorConfig.class);
  }

  public static SimulatorConfig readFromStream(InputStream in) throws IOException {
    return OBJECT_MAPPER.readValue(in, SimulatorConfig.class);
  }

  public int getAnnealLength() {
    return annealLength;
  }

  public void setAnnealLength(int annealLength) {
    this.annealLength = annealLength;
  }

  public int getHomologyLength() {
    return homologyLength;
  }

  public void setHomologyLength(int homologyLength) {
    this.homologyLength = homologyLength;
  }

  public boolean isCheckCircularity() {
    return checkCircularity;
  }

  public void setCheckCircularity(boolean checkCircularity) {
    this.checkCircularity = checkCircularity;
  }

  public boolean isStrictParsing() {
    return strictParsing;
  }

  public void setStrictParsing(boolean strictParsing) {
    this.strictParsing = strictParsing;
  }

  public List<EnzymeDefinition> getEnzymes() {
    return enzymes;
  }

  public void setEnzymes(List<EnzymeDefinition> enzymes) {
    this.enzymes = enzymes;
  }
}
