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

package com.twentyn.construction.simulation;

import com.twentyn.construction.config.SimulatorConfig;
import com.twentyn.construction.enzyme.EnzymeRegistry;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.exceptions.UnresolvedReferenceException;
import com.twentyn.construction.model.AssembleStep;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.model.ConstructionStep;
import com.twentyn.construction.model.DigestStep;
import com.twentyn.construction.model.LigateStep;
import com.twentyn.construction.model.PcrStep;
import com.twentyn.construction.model.TransformStep;
import com.twentyn.construction.sequence.SequenceUtils;
import com.twentyn.construction.simulation.assembly.AssemblyEngine;
import com.twentyn.construction.simulation.assembly.GibsonAssembler;
import com.twentyn.construction.simulation.assembly.GoldenGateAssembler;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the steps of a construction file in document order and collects the named product of each one.
 *
 * Names are resolved against earlier products first and the file's sequences second, so a product may shadow an
 * input sequence of the same name.  Steps are never reordered: referring to an output produced further down the file
 * is an error.  Every simulate() call keeps its own products, so one simulator can serve concurrent callers.
 */
public class ConstructionFileSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileSimulator.class);

  private final PcrSimulator pcrSimulator;
  private final DigestSimulator digestSimulator;
  private final LigationSimulator ligationSimulator;
  private final AssemblyEngine assemblyEngine;

  public ConstructionFileSimulator(PcrSimulator pcrSimulator, DigestSimulator digestSimulator,
                                   LigationSimulator ligationSimulator, AssemblyEngine assemblyEngine) {
    this.pcrSimulator = pcrSimulator;
    this.digestSimulator = digestSimulator;
    this.ligationSimulator = ligationSimulator;
    this.assemblyEngine = assemblyEngine;
  }

  public static ConstructionFileSimulator fromConfig(SimulatorConfig config, EnzymeRegistry registry) {
    return new ConstructionFileSimulator(
        new PcrSimulator(config.getAnnealLength()),
        new DigestSimulator(registry),
        new LigationSimulator(),
        new AssemblyEngine(registry, new GoldenGateAssembler(), new GibsonAssembler(config.getHomologyLength()),
            config.isCheckCircularity()));
  }

  public static ConstructionFileSimulator withDefaults() {
    return fromConfig(SimulatorConfig.defaults(), EnzymeRegistry.defaultRegistry());
  }

  /**
   * @return (product name, product sequence) for every step, in step order.
   * @throws ConstructionException from the first step that fails; no partial results are returned.
   */
  public List<Pair<String, String>> simulate(ConstructionFile cf) throws ConstructionException {
    StepRunner runner = new StepRunner(cf.getSequences());
    List<Pair<String, String>> products = new ArrayList<>(cf.getSteps().size());

    for (ConstructionStep step : cf.getSteps()) {
      LOGGER.info("Simulating %s", step);
      String product;
      try {
        product = step.accept(runner);
      } catch (ConstructionException e) {
        LOGGER.error("%s step producing %s failed: %s", step.getOperation().getKeyword(), step.getOutput(),
            e.getMessage());
        throw e;
      }
      runner.products.put(step.getOutput(), product);
      products.add(Pair.of(step.getOutput(), product));
    }
    return Collections.unmodifiableList(products);
  }

  // Holds the product registry of a single run.
  private class StepRunner implements ConstructionStep.Visitor<String> {
    private final Map<String, String> sequences;
    private final Map<String, String> products = new HashMap<>();

    StepRunner(Map<String, String> sequences) {
      this.sequences = sequences;
    }

    String resolve(String name) throws ConstructionException {
      String product = products.get(name);
      if (product != null) {
        return product;
      }
      String raw = sequences.get(name);
      if (raw == null) {
        throw new UnresolvedReferenceException(name);
      }
      return SequenceUtils.resolveSequence(raw);
    }

    List<String> resolveAll(List<String> names) throws ConstructionException {
      List<String> out = new ArrayList<>(names.size());
      for (String name : names) {
        out.add(resolve(name));
      }
      return out;
    }

    @Override
    public String visitPcr(PcrStep step) throws ConstructionException {
      String product = pcrSimulator.pcr(resolve(step.getForwardOligo()), resolve(step.getReverseOligo()),
          resolve(step.getTemplate()));
      if (step.getProductSize() != null && step.getProductSize() != product.length()) {
        LOGGER.warn("PCR product %s is %d bp but the construction file expects %d bp", step.getOutput(),
            product.length(), step.getProductSize());
      }
      return product;
    }

    @Override
    public String visitDigest(DigestStep step) throws ConstructionException {
      return digestSimulator.digest(resolve(step.getDna()), step.getEnzymes(), step.getFragSelect());
    }

    @Override
    public String visitLigate(LigateStep step) throws ConstructionException {
      List<String> dnas = resolveAll(step.getDnas());
      return step.isBlunt() ? ligationSimulator.bluntLigate(dnas) : ligationSimulator.ligate(dnas);
    }

    @Override
    public String visitAssemble(AssembleStep step) throws ConstructionException {
      return assemblyEngine.assemble(resolveAll(step.getDnas()), step.getEnzyme());
    }

    @Override
    public String visitTransform(TransformStep step) throws ConstructionException {
      LOGGER.info("Transforming %s into %s, selecting on %s%s", step.getDna(), step.getStrain(),
          step.getAntibiotics(), step.getTemperature() == null ? "" : " at " + step.getTemperature());
      return resolve(step.getDna());
    }
  }
}
