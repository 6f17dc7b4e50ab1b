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

import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.model.AssembleStep;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.model.ConstructionStep;
import com.twentyn.construction.model.DigestStep;
import com.twentyn.construction.model.LigateStep;
import com.twentyn.construction.model.Operation;
import com.twentyn.construction.model.PcrStep;
import com.twentyn.construction.model.TransformStep;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a construction file back out in the canonical tab-separated text form that {@link ConstructionFileParser}
 * reads: steps first, in order, then one line per sequence.
 */
public class ConstructionFileWriter implements ConstructionStep.Visitor<String> {

  public static String serialize(ConstructionFile cf) {
    ConstructionFileWriter writer = new ConstructionFileWriter();
    List<String> lines = new ArrayList<>();
    for (ConstructionStep step : cf.getSteps()) {
      try {
        lines.add(step.accept(writer));
      } catch (ConstructionException e) {
        // Rendering a step never fails; the visitor signature just allows it.
        throw new IllegalStateException("Unable to serialize step " + step, e);
      }
    }
    for (Map.Entry<String, String> entry : cf.getSequences().entrySet()) {
      lines.add(entry.getKey() + "\t" + entry.getValue());
    }
    return StringUtils.join(lines, "\n") + "\n";
  }

  @Override
  public String visitPcr(PcrStep step) {
    List<Object> fields = new ArrayList<>();
    fields.add(Operation.PCR.getKeyword());
    fields.add(step.getForwardOligo());
    fields.add(step.getReverseOligo());
    fields.add(step.getTemplate());
    if (step.getProductSize() != null) {
      fields.add(step.getProductSize());
    }
    fields.add(step.getOutput());
    return StringUtils.join(fields, "\t");
  }

  @Override
  public String visitDigest(DigestStep step) {
    List<Object> fields = new ArrayList<>();
    fields.add(Operation.DIGEST.getKeyword());
    fields.add(step.getDna());
    fields.addAll(step.getEnzymes());
    fields.add(step.getFragSelect());
    fields.add(step.getOutput());
    return StringUtils.join(fields, "\t");
  }

  @Override
  public String visitLigate(LigateStep step) {
    List<Object> fields = new ArrayList<>();
    fields.add(step.isBlunt() ? "Blunt" : Operation.LIGATE.getKeyword());
    fields.addAll(step.getDnas());
    fields.add(step.getOutput());
    return StringUtils.join(fields, "\t");
  }

  @Override
  public String visitAssemble(AssembleStep step) {
    List<Object> fields = new ArrayList<>();
    fields.add(Operation.ASSEMBLE.getKeyword());
    fields.addAll(step.getDnas());
    fields.add(step.getEnzyme());
    fields.add(step.getOutput());
    return StringUtils.join(fields, "\t");
  }

  @Override
  public String visitTransform(TransformStep step) {
    List<Object> fields = new ArrayList<>();
    fields.add(Operation.TRANSFORM.getKeyword());
    fields.add(step.getDna());
    fields.add(step.getStrain());
    fields.addAll(step.getAntibiotics());
    if (step.getTemperature() != null) {
      fields.add(step.getTemperature());
    }
    fields.add(step.getOutput());
    return StringUtils.join(fields, "\t");
  }
}
