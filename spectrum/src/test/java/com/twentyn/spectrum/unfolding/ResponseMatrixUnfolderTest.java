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

package com.twentyn.spectrum.unfolding;

import com.twentyn.spectrum.DegenerateResponseException;
import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.SpectrumTestUtils;
import com.twentyn.spectrum.deconvolution.DeconvolutionParameters;
import com.twentyn.spectrum.deconvolution.DeconvolutionResult;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ResponseMatrixUnfolderTest {

  private ResponseMatrixUnfolder unfolder = new ResponseMatrixUnfolder();

  @Test
  public void testBinnedResponseIsInvertedExactly() throws Exception {
    // Every true channel lands in two adjacent observed channels.
    double[][] response = new double[20][40];
    for (int j = 0; j < 20; j++) {
      response[j][2 * j] = 1.0;
      response[j][2 * j + 1] = 1.0;
    }
    double[] observed = new double[40];
    observed[14] = 50.0;
    observed[15] = 50.0;

    DeconvolutionResult result = unfolder.unfold(observed, response, DeconvolutionParameters.of(10));
    double[] values = result.getValues();
    assertEquals("One value per true channel", 20, values.length);
    for (int j = 0; j < values.length; j++) {
      assertEquals(String.format("True channel %d", j), j == 7 ? 100.0 : 0.0, values[j], 1e-9);
    }
    assertFalse(result.hasDegenerateUpdates());
  }

  @Test
  public void testGaussianResponseIsSharpened() throws Exception {
    double[][] response = new double[40][];
    for (int j = 0; j < 40; j++) {
      response[j] = SpectrumTestUtils.gaussianSpectrum(40, 0.0, new double[]{j, 1.0, 2.0});
    }
    double[] observed = new double[40];
    double rowArea = SpectrumTestUtils.sum(response[20]);
    for (int i = 0; i < 40; i++) {
      observed[i] = 1000.0 * response[20][i] / rowArea;
    }

    double[] values = unfolder.unfold(observed, response, DeconvolutionParameters.of(500)).getValues();
    assertEquals("Line is unfolded in place", 20, SpectrumTestUtils.argMax(values));
    assertTrue("Unfolded line is much taller than the observed one",
        values[20] > 1.5 * observed[SpectrumTestUtils.argMax(observed)]);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testRowLengthMustMatchSpectrum() throws Exception {
    unfolder.unfold(new double[5], new double[][]{{1, 1, 1, 1}}, DeconvolutionParameters.of(3));
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testMoreTrueThanObservedChannelsIsRejected() throws Exception {
    unfolder.unfold(new double[2], new double[][]{{1, 0}, {0, 1}, {1, 1}}, DeconvolutionParameters.of(3));
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testNegativeResponseIsRejected() throws Exception {
    unfolder.unfold(new double[2], new double[][]{{1, -1}, {0, 1}}, DeconvolutionParameters.of(3));
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testNegativeObservedCountsAreRejected() throws Exception {
    unfolder.unfold(new double[]{4, -1}, new double[][]{{1, 0}, {0, 1}}, DeconvolutionParameters.of(3));
  }

  @Test(expected = DegenerateResponseException.class)
  public void testZeroRowIsDegenerate() throws Exception {
    unfolder.unfold(new double[]{1, 1, 1}, new double[][]{{1, 1, 0}, {0, 0, 0}}, DeconvolutionParameters.of(3));
  }
}
