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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;

public class SpectrumTSVTest {
  private static final double TOLERANCE = 1e-12;

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private SpectrumTSV tsv = new SpectrumTSV();

  @Test
  public void testParseSpectrum() throws Exception {
    try (InputStream is = getClass().getResourceAsStream("short_spectrum.tsv")) {
      assertArrayEquals(new double[]{1.5, 2.0, 10.25, 0.0}, tsv.parse(is), TOLERANCE);
    }
  }

  @Test
  public void testChannelColumnIsOptional() throws Exception {
    String text = "counts\n3\n4.5\n";
    double[] counts = tsv.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    assertArrayEquals(new double[]{3.0, 4.5}, counts, TOLERANCE);
  }

  @Test
  public void testWrittenSpectrumCanBeReadBack() throws Exception {
    double[] counts = new double[]{0.0, 12.5, 1e-3, 4096.0};
    File file = folder.newFile("background.tsv");
    tsv.write(file, counts);
    assertArrayEquals(counts, tsv.parse(file), 0.0);
  }

  @Test(expected = IOException.class)
  public void testMissingChannelIsRejected() throws Exception {
    try (InputStream is = getClass().getResourceAsStream("gap_spectrum.tsv")) {
      tsv.parse(is);
    }
  }

  @Test(expected = IOException.class)
  public void testMissingCountsColumnIsRejected() throws Exception {
    tsv.parse(new ByteArrayInputStream("channel\tvalue\n0\t1\n".getBytes(StandardCharsets.UTF_8)));
  }

  @Test(expected = IOException.class)
  public void testBadNumberIsRejected() throws Exception {
    tsv.parse(new ByteArrayInputStream("channel\tcounts\n0\tlots\n".getBytes(StandardCharsets.UTF_8)));
  }
}
