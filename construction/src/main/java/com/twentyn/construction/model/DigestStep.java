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

package com.twentyn.construction.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.construction.exceptions.ConstructionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class DigestStep extends ConstructionStep {
  @JsonProperty("dna")
  private final String dna;

  @JsonProperty("enzymes")
  private final List<String> enzymes;

  // Zero-based index into the digest fragments, ordered by position on the input.
  @JsonProperty("frag_select")
  private final int fragSelect;

  @JsonCreator
  public DigestStep(@JsonProperty("output") String output,
                    @JsonProperty("dna") String dna,
                    @JsonProperty("enzymes") List<String> enzymes,
                    @JsonProperty("frag_select") int fragSelect) {
    super(output);
    this.dna = dna;
    this.enzymes = Collections.unmodifiableList(new ArrayList<>(enzymes));
    this.fragSelect = fragSelect;
  }

  public String getDna() {
    return dna;
  }

  public List<String> getEnzymes() {
    return enzymes;
  }

  public int getFragSelect() {
    return fragSelect;
  }

  @Override
  public Operation getOperation() {
    return Operation.DIGEST;
  }

  @Override
  public List<String> getInputs() {
    return Collections.singletonList(dna);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) throws ConstructionException {
    return visitor.visitDigest(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    DigestStep that = (DigestStep) o;
    return fragSelect == that.fragSelect &&
        Objects.equals(getOutput(), that.getOutput()) &&
        Objects.equals(dna, that.dna) &&
        Objects.equals(enzymes, that.enzymes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getOutput(), dna, enzymes, fragSelect);
  }

  @Override
  public String toString() {
    return String.format("Digest %s with %s, fragment %d -> %s", dna, enzymes, fragSelect, getOutput());
  }
}
