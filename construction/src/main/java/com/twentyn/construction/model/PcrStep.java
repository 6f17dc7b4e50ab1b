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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public class PcrStep extends ConstructionStep {
  @JsonProperty("forward_oligo")
  private final String forwardOligo;

  @JsonProperty("reverse_oligo")
  private final String reverseOligo;

  @JsonProperty("template")
  private final String template;

  // Declared product size in bp, if the construction file states one.
  @JsonProperty("product_size")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private final Integer productSize;

  @JsonCreator
  public PcrStep(@JsonProperty("output") String output,
                 @JsonProperty("forward_oligo") String forwardOligo,
                 @JsonProperty("reverse_oligo") String reverseOligo,
                 @JsonProperty("template") String template,
                 @JsonProperty("product_size") Integer productSize) {
    super(output);
    this.forwardOligo = forwardOligo;
    this.reverseOligo = reverseOligo;
    this.template = template;
    this.productSize = productSize;
  }

  public String getForwardOligo() {
    return forwardOligo;
  }

  public String getReverseOligo() {
    return reverseOligo;
  }

  public String getTemplate() {
    return template;
  }

  public Integer getProductSize() {
    return productSize;
  }

  @Override
  public Operation getOperation() {
    return Operation.PCR;
  }

  @Override
  public List<String> getInputs() {
    return Arrays.asList(forwardOligo, reverseOligo, template);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) throws ConstructionException {
    return visitor.visitPcr(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    PcrStep that = (PcrStep) o;
    return Objects.equals(getOutput(), that.getOutput()) &&
        Objects.equals(forwardOligo, that.forwardOligo) &&
        Objects.equals(reverseOligo, that.reverseOligo) &&
        Objects.equals(template, that.template) &&
        Objects.equals(productSize, that.productSize);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getOutput(), forwardOligo, reverseOligo, template, productSize);
  }

  @Override
  public String toString() {
    return String.format("PCR %s/%s on %s -> %s", forwardOligo, reverseOligo, template, getOutput());
  }
}
