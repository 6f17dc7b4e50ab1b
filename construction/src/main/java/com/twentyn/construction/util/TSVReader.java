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

package com.twentyn.construction.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a header-less tab-separated file into a table of cells, the shape a spreadsheet export has.
 */
public class TSVReader {
  public static final CSVFormat TSV_FORMAT = CSVFormat.Builder.create(CSVFormat.newFormat('\t'))
      .setRecordSeparator('\n')
      .setQuote('"')
      .setIgnoreEmptyLines(true)
      .build();

  public static List<List<String>> read(File file) throws IOException {
    try (InputStream in = Files.newInputStream(file.toPath())) {
      return read(in);
    }
  }

  public static List<List<String>> read(InputStream inStream) throws IOException {
    List<List<String>> rows = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      for (CSVRecord record : parser) {
        List<String> cells = new ArrayList<>(record.size());
        for (String cell : record) {
          cells.add(cell);
        }
        rows.add(cells);
      }
    }
    return rows;
  }
}
