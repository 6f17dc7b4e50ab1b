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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed construction file: the ordered steps and the named input sequences they draw on.  Step outputs do not
 * need to appear in the sequence map; they are produced during simulation.
 */
public class ConstructionFile {
  @JsonProperty("steps")
  private final List<ConstructionStep> steps;

  @JsonProperty("sequences")
  private final Map<String, String> sequences;

  @JsonCreator
  public ConstructionFile(@JsonProperty("steps") List<ConstructionStep> steps,
                          @JsonProperty("sequences") Map<String, String> sequences) {
    this.steps = Collections.unmodifiableList(steps == null ? new ArrayList<>() : new ArrayList<>(steps));
    this.sequences = Collections.unmodifiableMap(
        sequences == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sequences));
  }

  public List<ConstructionStep> getSteps() {
    return steps;
  }

  public Map<String, String> getSequences() {
    return sequences;
  }

  // Order of the sequence map is irrelevant to equality; order of the steps is not.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ConstructionFile that = (ConstructionFile) o;
    return Objects.equals(steps, that.steps) &&
        Objects.equals(sequences, that.sequences);
  }

  @Override
  public int hashCode() {
    return Objects.hash(steps, sequences);
  }

  @Override
  public String toString() {
    return String.format("ConstructionFile{%d steps, %d sequences}", steps.size(), sequences.size());
  }
}
