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

package com.twentyn.spectrum.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes spectra as tab separated files with a `channel` and a `counts` column.  The channel column is
 * optional on input; when present it must count up from 0 without gaps.
 */
public class SpectrumTSV {
  public static final String CHANNEL_COLUMN = "channel";
  public static final String COUNTS_COLUMN = "counts";

  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();

  public double[] parse(File file) throws IOException {
    try (InputStream is = new FileInputStream(file)) {
      return parse(is);
    }
  }

  public double[] parse(InputStream inStream) throws IOException {
    List<Double> counts = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      Map<String, Integer> headerMap = parser.getHeaderMap();
      if (headerMap == null || !headerMap.containsKey(COUNTS_COLUMN)) {
        throw new IOException(String.format("Spectrum file has no '%s' column", COUNTS_COLUMN));
      }
      boolean hasChannels = headerMap.containsKey(CHANNEL_COLUMN);

      for (CSVRecord r : parser) {
        int index = counts.size();
        try {
          if (hasChannels && Integer.parseInt(r.get(CHANNEL_COLUMN).trim()) != index) {
            throw new IOException(String.format("Expected channel %d on line %d, found %s",
                index, r.getRecordNumber() + 1, r.get(CHANNEL_COLUMN)));
          }
          counts.add(Double.valueOf(r.get(COUNTS_COLUMN).trim()));
        } catch (NumberFormatException e) {
          throw new IOException(String.format("Unparseable number on line %d: %s", r.getRecordNumber() + 1,
              e.getMessage()), e);
        }
      }
    }

    double[] result = new double[counts.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = counts.get(i);
    }
    return result;
  }

  public void write(File file, double[] counts) throws IOException {
    CSVFormat format = CSVFormat.newFormat('\t').withRecordSeparator('\n').withQuote('"').
        withHeader(CHANNEL_COLUMN, COUNTS_COLUMN);
    try (CSVPrinter printer = new CSVPrinter(
        new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8), format)) {
      for (int i = 0; i < counts.length; i++) {
        printer.printRecord(i, counts[i]);
      }
      printer.flush();
    }
  }
}
