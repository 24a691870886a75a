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

package com.twentyn.spectrum.background;

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.SpectrumTestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BackgroundEstimatorTest {
  private static final double TOLERANCE = 1e-9;

  private BackgroundEstimator estimator = new BackgroundEstimator();

  private static double[] peakOnFlatBackground() {
    return SpectrumTestUtils.gaussianSpectrum(100, 10.0, new double[]{50, 100, 3});
  }

  @Test
  public void testPeakIsClippedAndFlatBackgroundKept() throws Exception {
    double[] source = peakOnFlatBackground();
    double[] background = estimator.estimate(source, BackgroundParameters.defaults(6));

    assertEquals("Background has the source length", source.length, background.length);
    for (int i = 0; i < source.length; i++) {
      if (i < 35 || i > 65) {
        assertEquals(String.format("Background away from the peak is flat at channel %d", i),
            10.0, background[i], 0.01);
      }
    }
    assertTrue("Background at the peak is well below the peak top", background[50] < 50.0);
    assertTrue("Background at the peak does not drop below the baseline", background[50] >= 10.0 - TOLERANCE);
  }

  @Test
  public void testDecreasingWindowsAlsoClipThePeak() throws Exception {
    double[] source = peakOnFlatBackground();
    BackgroundParameters params = new BackgroundParameters(6, WindowDirection.DECREASING, FilterOrder.ORDER_2,
        false, BackgroundParameters.DEFAULT_SMOOTH_WINDOW, false);
    double[] background = estimator.estimate(source, params);
    assertTrue("Background at the peak is well below the peak top", background[50] < source[50] / 2);
  }

  @Test
  public void testBackgroundNeverExceedsSource() throws Exception {
    Random random = new Random(42L);
    for (int trial = 0; trial < 5; trial++) {
      double[] source = SpectrumTestUtils.gaussianSpectrum(200, 50.0,
          new double[]{40, 400, 2}, new double[]{90, 150, 5}, new double[]{150, 800, 3});
      for (int i = 0; i < source.length; i++) {
        // Rough counting noise plus a step, so the Compton handling has something to work on.
        source[i] += Math.sqrt(source[i]) * random.nextGaussian() + (i < 120 ? 30.0 : 0.0);
        source[i] = Math.max(source[i], 0.0);
      }

      for (FilterOrder order : FilterOrder.values()) {
        for (WindowDirection direction : WindowDirection.values()) {
          for (int smoothWindow : new int[]{0, 3, 7, 15}) {
            for (boolean compton : new boolean[]{false, true}) {
              BackgroundParameters params = new BackgroundParameters(20, direction, order, smoothWindow > 0,
                  smoothWindow > 0 ? smoothWindow : BackgroundParameters.DEFAULT_SMOOTH_WINDOW, compton);
              double[] background = estimator.estimate(source, params);
              for (int i = 0; i < source.length; i++) {
                assertTrue(String.format("Background <= source at channel %d with %s", i, params),
                    background[i] <= source[i]);
              }
            }
          }
        }
      }
    }
  }

  @Test
  public void testFlatSpectrumIsItsOwnBackground() throws Exception {
    double[] source = new double[64];
    Arrays.fill(source, 5.0);
    for (FilterOrder order : FilterOrder.values()) {
      BackgroundParameters params = new BackgroundParameters(8, WindowDirection.INCREASING, order,
          false, BackgroundParameters.DEFAULT_SMOOTH_WINDOW, false);
      assertArrayEquals("Flat spectrum is unchanged with order " + order.getPoints(),
          source, estimator.estimate(source, params), TOLERANCE);
    }
  }

  @Test
  public void testLinearBackgroundIsFollowed() throws Exception {
    double[] source = new double[80];
    for (int i = 0; i < source.length; i++) {
      source[i] = 2.0 * i + 1.0;
    }
    assertArrayEquals("A straight line is not clipped", source,
        estimator.estimate(source, BackgroundParameters.defaults(10)), TOLERANCE);
  }

  @Test
  public void testSourceIsNotModified() throws Exception {
    double[] source = peakOnFlatBackground();
    double[] copy = source.clone();
    estimator.estimate(source, BackgroundParameters.defaults(6));
    assertArrayEquals("Caller's array is left alone", copy, source, 0.0);
  }

  @Test
  public void testSubtractRemovesBackground() throws Exception {
    double[] source = peakOnFlatBackground();
    BackgroundParameters params = BackgroundParameters.defaults(6);
    double[] background = estimator.estimate(source, params);
    double[] peaks = estimator.subtract(source, params);
    for (int i = 0; i < source.length; i++) {
      assertEquals("Subtracted spectrum is source minus background", source[i] - background[i], peaks[i], TOLERANCE);
      assertTrue("Subtracted spectrum is non-negative", peaks[i] >= 0);
    }
  }

  @Test
  public void testComptonStepIsFollowed() throws Exception {
    // A Compton-like plateau that drops by 80 counts at channel 60, with a peak on the plateau.
    double[] source = SpectrumTestUtils.gaussianSpectrum(120, 20.0, new double[]{30, 200, 2});
    for (int i = 0; i < 60; i++) {
      source[i] += 80.0;
    }
    BackgroundParameters params = new BackgroundParameters(10, WindowDirection.INCREASING, FilterOrder.ORDER_2,
        false, BackgroundParameters.DEFAULT_SMOOTH_WINDOW, true);
    double[] background = estimator.estimate(source, params);

    for (int i = 0; i < source.length; i++) {
      assertTrue("Background is finite", Double.isFinite(background[i]));
      assertTrue("Background <= source", background[i] <= source[i]);
    }
    assertTrue("Peak is still clipped", background[30] < source[30] / 2);
    assertEquals("Plateau far from peak and edge is kept", 100.0, background[10], 0.01);
    assertEquals("Low side far from the edge is kept", 20.0, background[100], 0.01);
  }

  @Test
  public void testSmoothingKeepsBackgroundBelowSource() throws Exception {
    double[] source = peakOnFlatBackground();
    BackgroundParameters params = new BackgroundParameters(6, WindowDirection.INCREASING, FilterOrder.ORDER_4,
        true, 5, false);
    double[] background = estimator.estimate(source, params);
    assertTrue("Background at the peak is well below the peak top", background[50] < 60.0);
    for (int i = 0; i < source.length; i++) {
      assertTrue("Background <= source", background[i] <= source[i]);
    }
  }

  @Test
  public void testReferenceFormulas() throws Exception {
    double[] v = new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9};
    // Every symmetric formula reproduces a straight line.
    for (FilterOrder order : FilterOrder.values()) {
      assertEquals(5.0, BackgroundEstimator.reference(v, 4, 4, order), TOLERANCE);
    }
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testNonPositiveWindowIsRejected() throws Exception {
    BackgroundParameters.defaults(0);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testEvenSmoothingWindowIsRejected() throws Exception {
    new BackgroundParameters(5, WindowDirection.INCREASING, FilterOrder.ORDER_2, true, 4, false);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testOutOfRangeSmoothingWindowIsRejected() throws Exception {
    new BackgroundParameters(5, WindowDirection.INCREASING, FilterOrder.ORDER_2, true, 17, false);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testUnsupportedFilterOrderIsRejected() throws Exception {
    FilterOrder.fromPoints(3);
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testTooLargeWindowIsRejected() throws Exception {
    estimator.estimate(new double[10], BackgroundParameters.defaults(5));
  }

  @Test(expected = SpectrumConfigurationException.class)
  public void testEmptySpectrumIsRejected() throws Exception {
    estimator.estimate(new double[0], BackgroundParameters.defaults(1));
  }
}
