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

package com.twentyn.construction;

import com.twentyn.construction.config.SimulatorConfig;
import com.twentyn.construction.enzyme.EnzymeRegistry;
import com.twentyn.construction.exceptions.ConstructionException;
import com.twentyn.construction.model.ConstructionFile;
import com.twentyn.construction.parser.ConstructionFileJson;
import com.twentyn.construction.parser.ConstructionFileParser;
import com.twentyn.construction.simulation.ConstructionFileSimulator;
import com.twentyn.construction.util.CLIUtil;
import com.twentyn.construction.util.ProductTableWriter;
import com.twentyn.construction.util.TSVReader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class ConstructionFileDriver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileDriver.class);

  private static final String OPTION_INPUT = "i";
  private static final String OPTION_OUTPUT = "o";
  private static final String OPTION_CONFIG = "c";
  private static final String OPTION_JSON = "j";
  private static final String OPTION_ALLOW_LINEAR = "l";
  private static final String OPTION_STRICT = "s";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input-files")
        .desc("Construction file(s) to simulate: plain text, or .tsv tables exported from a spreadsheet.  " +
            "Multiple files are read in order as one construction file")
        .hasArgs()
        .valueSeparator(',')
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output-file")
        .desc("Write the products to this TSV file (default: log them)")
        .hasArg()
        .longOpt("output")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config-file")
        .desc("A JSON simulator config file (anneal/homology lengths, extra enzymes, ...)")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_JSON)
        .argName("json-file")
        .desc("Also write the parsed construction file as JSON to this file")
        .hasArg()
        .longOpt("json")
    );
    add(Option.builder(OPTION_ALLOW_LINEAR)
        .desc("Accept homology assemblies that do not close into a circle")
        .longOpt("allow-linear")
    );
    add(Option.builder(OPTION_STRICT)
        .desc("Fail on lines that are neither an operation nor a sequence instead of skipping them")
        .longOpt("strict")
    );
  }};

  public static final String HELP_MESSAGE =
      "Parses a construction file (PCR, Digest, Ligate, Assemble/Gibson/GoldenGate, Transform steps plus named " +
      "sequences), simulates every step in order and reports the predicted sequence of each product.";

  private static final CLIUtil CLI_UTIL = new CLIUtil(ConstructionFileDriver.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * @return The process exit code.
   */
  public static int run(String[] args) {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);
    if (cl == null) {
      return CLI_UTIL.getExitCode();
    }
    if (!cl.hasOption(OPTION_INPUT)) {
      LOGGER.error("At least one input construction file is required");
      CLI_UTIL.printHelp();
      return 1;
    }

    try {
      SimulatorConfig config = cl.hasOption(OPTION_CONFIG) ?
          SimulatorConfig.readFromFile(new File(cl.getOptionValue(OPTION_CONFIG))) : SimulatorConfig.defaults();
      if (cl.hasOption(OPTION_ALLOW_LINEAR)) {
        config.setCheckCircularity(false);
      }
      if (cl.hasOption(OPTION_STRICT)) {
        config.setStrictParsing(true);
      }

      List<Object> blobs = new ArrayList<>();
      for (String path : cl.getOptionValues(OPTION_INPUT)) {
        blobs.add(readInput(new File(path)));
      }

      ConstructionFile cf = new ConstructionFileParser(config.isStrictParsing()).parse(blobs.toArray());
      LOGGER.info("Read %d steps and %d sequences", cf.getSteps().size(), cf.getSequences().size());

      if (cl.hasOption(OPTION_JSON)) {
        File jsonFile = new File(cl.getOptionValue(OPTION_JSON));
        ConstructionFileJson.write(cf, jsonFile);
        LOGGER.info("Wrote parsed construction file to %s", jsonFile.getAbsolutePath());
      }

      EnzymeRegistry registry = EnzymeRegistry.withAdditionalEnzymes(config.getEnzymes());
      List<Pair<String, String>> products = ConstructionFileSimulator.fromConfig(config, registry).simulate(cf);

      if (cl.hasOption(OPTION_OUTPUT)) {
        File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
        writeProducts(products, outputFile);
        LOGGER.info("Wrote %d products to %s", products.size(), outputFile.getAbsolutePath());
      } else {
        for (Pair<String, String> product : products) {
          LOGGER.info("%s\t%d bp\t%s", product.getLeft(), product.getRight().length(), product.getRight());
        }
      }
    } catch (ConstructionException e) {
      LOGGER.error("Construction file simulation failed: %s", e.getMessage());
      return 1;
    } catch (IOException e) {
      LOGGER.error("Unable to read or write a file: %s", e.getMessage());
      return 2;
    }
    return 0;
  }

  // Spreadsheet exports are read as tables, everything else as plain text.
  static Object readInput(File file) throws IOException {
    String name = file.getName().toLowerCase();
    if (name.endsWith(".tsv") || name.endsWith(".tab")) {
      return TSVReader.read(file);
    }
    return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
  }

  static void writeProducts(List<Pair<String, String>> products, File outputFile) throws IOException {
    try (ProductTableWriter writer = ProductTableWriter.open(outputFile)) {
      writer.append(products);
    }
  }
}
