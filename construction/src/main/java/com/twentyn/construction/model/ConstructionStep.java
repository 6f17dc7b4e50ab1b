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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.twentyn.construction.exceptions.ConstructionException;

import java.util.List;

/**
 * One line of a construction file.  Every step produces a single named sequence; the name is available to all later
 * steps.  Subclasses are immutable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "operation")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PcrStep.class, name = "pcr"),
    @JsonSubTypes.Type(value = DigestStep.class, name = "digest"),
    @JsonSubTypes.Type(value = LigateStep.class, name = "ligate"),
    @JsonSubTypes.Type(value = AssembleStep.class, name = "assemble"),
    @JsonSubTypes.Type(value = TransformStep.class, name = "transform"),
})
public abstract class ConstructionStep {

  /**
   * Exhaustive dispatch over the step kinds; adding a new kind breaks every visitor until it handles it.
   */
  public interface Visitor<T> {
    T visitPcr(PcrStep step) throws ConstructionException;
    T visitDigest(DigestStep step) throws ConstructionException;
    T visitLigate(LigateStep step) throws ConstructionException;
    T visitAssemble(AssembleStep step) throws ConstructionException;
    T visitTransform(TransformStep step) throws ConstructionException;
  }

  @JsonProperty("output")
  private final String output;

  protected ConstructionStep(String output) {
    if (output == null || output.isEmpty()) {
      throw new IllegalArgumentException("A construction step needs an output name");
    }
    this.output = output;
  }

  public String getOutput() {
    return output;
  }

  @JsonIgnore
  public abstract Operation getOperation();

  /**
   * @return The names this step consumes, in the order they appear on its line.
   */
  @JsonIgnore
  public abstract List<String> getInputs();

  public abstract <T> T accept(Visitor<T> visitor) throws ConstructionException;
}
