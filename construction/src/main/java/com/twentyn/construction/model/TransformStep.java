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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.construction.exceptions.ConstructionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Moving DNA into a host strain.  The sequence is unchanged; the strain, selection and temperature are bookkeeping.
 */
public class TransformStep extends ConstructionStep {
  @JsonProperty("dna")
  private final String dna;

  @JsonProperty("strain")
  private final String strain;

  @JsonProperty("antibiotics")
  private final List<String> antibiotics;

  @JsonProperty("temperature")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private final String temperature;

  @JsonCreator
  public TransformStep(@JsonProperty("output") String output,
                       @JsonProperty("dna") String dna,
                       @JsonProperty("strain") String strain,
                       @JsonProperty("antibiotics") List<String> antibiotics,
                       @JsonProperty("temperature") String temperature) {
    super(output);
    this.dna = dna;
    this.strain = strain;
    this.antibiotics = Collections.unmodifiableList(new ArrayList<>(antibiotics));
    this.temperature = temperature;
  }

  public String getDna() {
    return dna;
  }

  public String getStrain() {
    return strain;
  }

  public List<String> getAntibiotics() {
    return antibiotics;
  }

  public String getTemperature() {
    return temperature;
  }

  @Override
  public Operation getOperation() {
    return Operation.TRANSFORM;
  }

  @Override
  public List<String> getInputs() {
    return Collections.singletonList(dna);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) throws ConstructionException {
    return visitor.visitTransform(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    TransformStep that = (TransformStep) o;
    return Objects.equals(getOutput(), that.getOutput()) &&
        Objects.equals(dna, that.dna) &&
        Objects.equals(strain, that.strain) &&
        Objects.equals(antibiotics, that.antibiotics) &&
        Objects.equals(temperature, that.temperature);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getOutput(), dna, strain, antibiotics, temperature);
  }

  @Override
  public String toString() {
    return String.format("Transform %s into %s (%s) -> %s", dna, strain, antibiotics, getOutput());
  }
}
