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

import com.twentyn.construction.sequence.SequenceUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.lang3.tuple.Pair;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Writes simulated products as a tab-separated table: one row per product with its name, sequence, length in bp
 * and GC fraction to three decimals.
 */
public class ProductTableWriter implements AutoCloseable {
  public static final String COLUMN_NAME = "name";
  public static final String COLUMN_SEQUENCE = "sequence";
  public static final String COLUMN_LENGTH = "length";
  public static final String COLUMN_GC = "gc_content";
  public static final List<String> HEADER = Collections.unmodifiableList(
      Arrays.asList(COLUMN_NAME, COLUMN_SEQUENCE, COLUMN_LENGTH, COLUMN_GC));

  private static final CSVFormat PRODUCT_FORMAT = CSVFormat.Builder.create(CSVFormat.newFormat('\t'))
      .setRecordSeparator('\n')
      .setHeader(HEADER.toArray(new String[HEADER.size()]))
      .build();

  private final CSVPrinter printer;

  private ProductTableWriter(Writer writer) throws IOException {
    this.printer = new CSVPrinter(writer, PRODUCT_FORMAT);
  }

  public static ProductTableWriter open(File f) throws IOException {
    return open(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8));
  }

  public static ProductTableWriter open(Writer writer) throws IOException {
    return new ProductTableWriter(writer);
  }

  public void append(String name, String sequence) throws IOException {
    printer.printRecord(name, sequence, Integer.toString(sequence.length()),
        String.format(Locale.US, "%.3f", SequenceUtils.calcGC(sequence)));
  }

  public void append(List<Pair<String, String>> products) throws IOException {
    for (Pair<String, String> product : products) {
      append(product.getLeft(), product.getRight());
    }
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    printer.close();
  }
}
