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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.twentyn.construction.exceptions.UnsupportedStepException;
import com.twentyn.construction.model.ConstructionFile;

import java.io.File;
import java.io.IOException;

/**
 * JSON form of a parsed construction file: the hand-off format between parsing and simulation.  Steps are tagged with
 * an "operation" property.
 */
public class ConstructionFileJson {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  private ConstructionFileJson() {
  }

  public static String write(ConstructionFile cf) throws IOException {
    return OBJECT_MAPPER.writeValueAsString(cf);
  }

  public static void write(ConstructionFile cf, File outputFile) throws IOException {
    OBJECT_MAPPER.writeValue(outputFile, cf);
  }

  /**
   * @throws UnsupportedStepException if a step carries an operation this version does not know.
   */
  public static ConstructionFile read(String json) throws IOException, UnsupportedStepException {
    try {
      return OBJECT_MAPPER.readValue(json, ConstructionFile.class);
    } catch (InvalidTypeIdException e) {
      throw new UnsupportedStepException(e.getTypeId());
    }
  }

  public static ConstructionFile read(File jsonFile) throws IOException, UnsupportedStepException {
    try {
      return OBJECT_MAPPER.readValue(jsonFile, ConstructionFile.class);
    } catch (InvalidTypeIdException e) {
      throw new UnsupportedStepException(e.getTypeId());
    }
  }
}
