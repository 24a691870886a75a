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

package com.twentyn.spectrum.deconvolution;

import com.twentyn.spectrum.DegenerateResponseException;
import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.SpectrumTestUtils;
import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ResponseKernelTest {
  private static final double TOLERANCE = 1e-12;

  @Test
  public void testKernelIsNormalisedAndCentredOnItsMaximum() throws Exception {
    ResponseKernel kernel = new ResponseKernel(new double[]{1, 3, 2, 2});
    assertEquals("Centre defaults to the first maximum", 1, kernel.getCenter());
    assertEquals("Original area is kept", 8.0, kernel.getArea(), TOLERANCE);
    assertArrayEquals("Values are scaled to unit area",
        new double[]{0.125, 0.375, 0.25, 0.25}, kernel.getValues(), TOLERANCE);
  }

  @Test
  public void testConvolvingAPointGivesTheResponse() throws Exception {
    ResponseKernel kernel = new ResponseKernel(new double[]{1, 2, 1});
    double[] point = new double[21];
    point[10] = 4.0;
    double[] expected = new double[21];
    expected[9] = 1.0;
    expected[10] = 2.0;
    expected[11] = 1.0;
    assertArrayEquals(expected, kernel.convolve(point), TOLERANCE);

    ResponseKernel shifted = new ResponseKernel(new double[]{0, 1, 3});
    double[] response = shifted.convolve(point);
    assertEquals("Response spreads towards lower channels", 1.0, response[9], TOLERANCE);
    assertEquals(3.0, response[10], TOLERANCE);
    assertEquals(0.0, response[11], TOLERANCE);
  }

  @Test
  public void testCorrelationIsTheAdjointOfConvolution() throws Exception {
    ResponseKernel kernel = new ResponseKernel(new double[]{1, 3, 2, 0.5}, 1);
    Random random = new Random(11L);
    double[] x = new double[20];
    double[] r = new double[20];
    for (int i = 0; i < x.length; i++) {
      x[i] = random.nextDouble();
      r[i] = random.nextDouble();
    }
    double[] hx = kernel.convolve(x);
    double[] htr = kernel.correlate(r);
    double left = 0.0;
    double right = 0.0;
    for (int i = 0; i < x.length; i++) {
      left += hx[i] * r[i];
      right += x[i] * htr[i];
    }
    assertEquals("<Hx, r> == <x, H'r>", left, right, 1e-9);
  }

  @Test
  public void testGaussianKernel() throws Exception {
    ResponseKernel kernel = ResponseKernel.gaussian(2.0);
    assertEquals("Half width is four sigma", 17, kernel.size());
    assertEquals(8, kernel.getCenter());
    double[] values = kernel.getValues();
    assertEquals(1.0, SpectrumTestUtils.sum(values), TOLERANCE);
    for (int k = 1; k <= 8; k++) {
      assertEquals("Gaussian kernel is symmetric", values[8 - k], values[8 + k], 0.0);
    }
    assertEquals("Area of the unnormalised Gaussian", Math.sqrt(2 * Math.PI) * 2.0, kernel.getArea(), 1e-3);
  }

  @Test(expected = DegenerateResponseException.class)
  public void testZeroKernelIsDegenerate() throws Exception {
    new ResponseKernel(new double[]{0, 0, 0});
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testNegativeValueIsRejected() throws Exception {
    new ResponseKernel(new double[]{1, -1, 2});
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testCentreOutsideKernelIsRejected() throws Exception {
    new ResponseKernel(new double[]{1, 2}, 2);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testSigmaTooWideForAnArrayIsRejected() throws Exception {
    ResponseKernel.gaussian(1e9);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testNonPositiveSigmaIsRejected() throws Exception {
    ResponseKernel.gaussian(0.0);
  }
}
