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
import com.twentyn.construction.enzyme.RestrictionEnzyme;
import com.twentyn.construction.exceptions.UnrecognizedSequenceException;

/**
 * A user-supplied restriction enzyme, as written in the simulator config file.
 */
public class EnzymeDefinition {
  @JsonProperty(value = "name", required = true)
  private String name;

  @JsonProperty(value = "recognition_sequence", required = true)
  private String recognitionSequence;

  // Offsets from the 3' end of the recognition site to the top/bottom strand cuts.
  @JsonProperty(value = "cut5", required = true)
  private int cut5;

  @JsonProperty(value = "cut3", required = true)
  private int cut3;

  public EnzymeDefinition() {
  }

  public EnzymeDefinition(String name, String recognitionSequence, int cut5, int cut3) {
    this.name = name;
    this.recognitionSequence = recognitionSequence;
    this.cut5 = cut5;
    this.cut3 = cut3;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getRecognitionSequence() {
    return recognitionSequence;
  }

  public void setRecognitionSequence(String recognitionSequence) {
    this.recognitionSequence = recognitionSequence;
  }

  public int getCut5() {
    return cut5;
  }

  public void setCut5(int cut5) {
    this.cut5 = cut5;
  }

  public int getCut3() {
    return cut3;
  }

  public void setCut3(int cut3) {
    this.cut3 = cut3;
  }

  public RestrictionEnzyme toEnzyme() throws UnrecognizedSequenceException {
    return new RestrictionEnzyme(name, recognitionSequence, cut5, cut3);
  }
}
