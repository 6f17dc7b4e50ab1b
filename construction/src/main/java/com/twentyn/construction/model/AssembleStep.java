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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.construction.exceptions.ConstructionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class AssembleStep extends ConstructionStep {
  // Stands in for an enzyme name when fragments are joined by homology instead of sticky ends.
  public static final String GIBSON = "gibson";

  @JsonProperty("dnas")
  private final List<String> dnas;

  @JsonProperty("enzyme")
  private final String enzyme;

  @JsonCreator
  public AssembleStep(@JsonProperty("output") String output,
                      @JsonProperty("dnas") List<String> dnas,
                      @JsonProperty("enzyme") String enzyme) {
    super(output);
    this.dnas = Collections.unmodifiableList(new ArrayList<>(dnas));
    this.enzyme = enzyme;
  }

  public List<String> getDnas() {
    return dnas;
  }

  public String getEnzyme() {
    return enzyme;
  }

  @JsonIgnore
  public boolean isGibson() {
    return GIBSON.equalsIgnoreCase(enzyme);
  }

  @Override
  public Operation getOperation() {
    return Operation.ASSEMBLE;
  }

  @Override
  public List<String> getInputs() {
    return dnas;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) throws ConstructionException {
    return visitor.visitAssemble(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AssembleStep that = (AssembleStep) o;
    return Objects.equals(getOutput(), that.getOutput()) &&
        Objects.equals(dnas, that.dnas) &&
        Objects.equals(enzyme, that.enzyme);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getOutput(), dnas, enzyme);
  }

  @Override
  public String toString() {
    return String.format("Assemble %s with %s -> %s", dnas, enzyme, getOutput());
  }
}
