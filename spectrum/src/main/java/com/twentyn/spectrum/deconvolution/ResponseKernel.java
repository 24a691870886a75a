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
import org.apache.commons.math3.analysis.function.Gaussian;

/**
 * A one-dimensional detector response (point-spread function).
 *
 * The kernel is stored normalized to unit area so that convolving with it moves counts around without changing
 * their total.  `center` is the kernel index that lines up with the channel being computed: a true signal at
 * channel t contributes values[j] to observed channel t + j - center.
 */
public class ResponseKernel {
  // Gaussian kernels are cut off this many standard deviations from their centre.
  public static final double GAUSSIAN_CUTOFF_SIGMAS = 4.0;

  // Largest half width whose kernel length 2 * halfWidth + 1 still fits in an int.
  public static final int MAX_HALF_WIDTH = (Integer.MAX_VALUE - 1) / 2;

  private double[] values;
  private int center;
  private double area;

  /**
   * Builds a kernel centred on its largest value (the first one, if several are equal).
   */
  public ResponseKernel(double[] values) {
    this(values, indexOfMax(values));
  }

  public ResponseKernel(double[] values, int center) {
    if (values == null || values.length == 0) {
      throw new SpectrumConfigurationException("Response kernel must hold at least one value");
    }
    if (center < 0 || center >= values.length) {
      throw new SpectrumConfigurationException("Response kernel centre %d is outside [0, %d)", center, values.length);
    }
    double total = 0.0;
    for (int i = 0; i < values.length; i++) {
      if (!Double.isFinite(values[i]) || values[i] < 0) {
        throw new SpectrumConfigurationException("Response kernel value at %d must be finite and non-negative, got %f",
            i, values[i]);
      }
      total += values[i];
    }
    if (total == 0) {
      throw new DegenerateResponseException("Response kernel sums to zero");
    }

    this.values = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      this.values[i] = values[i] / total;
    }
    this.center = center;
    this.area = total;
  }

  /**
   * A sampled Gaussian with the given standard deviation (in channels), truncated at
   * {@link #GAUSSIAN_CUTOFF_SIGMAS} standard deviations on each side.
   */
  public static ResponseKernel gaussian(double sigma) {
    if (!(sigma > 0) || Double.isInfinite(sigma)) {
      throw new SpectrumConfigurationException("Gaussian response needs a positive sigma, got %f", sigma);
    }
    double halfWidth = Math.ceil(GAUSSIAN_CUTOFF_SIGMAS * sigma);
    if (halfWidth > MAX_HALF_WIDTH) {
      throw new SpectrumConfigurationException("Gaussian sigma %f needs a kernel wider than %d channels",
          sigma, 2 * MAX_HALF_WIDTH + 1);
    }
    return gaussian(sigma, (int) halfWidth);
  }

  public static ResponseKernel gaussian(double sigma, int halfWidth) {
    if (!(sigma > 0) || Double.isInfinite(sigma)) {
      throw new SpectrumConfigurationException("Gaussian response needs a positive sigma, got %f", sigma);
    }
    if (halfWidth < 0 || halfWidth > MAX_HALF_WIDTH) {
      throw new SpectrumConfigurationException("Gaussian half width must be in [0, %d], got %d",
          MAX_HALF_WIDTH, halfWidth);
    }
    Gaussian shape = new Gaussian(1.0, 0.0, sigma);
    double[] values = new double[2 * halfWidth + 1];
    for (int i = 0; i < values.length; i++) {
      values[i] = shape.value(i - halfWidth);
    }
    return new ResponseKernel(values, halfWidth);
  }

  /**
   * Smears a true spectrum with this response: result[i] = sum_j values[j] * x[i - j + center].  Channels outside the
   * spectrum contribute nothing.
   */
  public double[] convolve(double[] x) {
    double[] result = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      double sum = 0.0;
      for (int j = 0; j < values.length; j++) {
        int t = i - j + center;
        if (t >= 0 && t < x.length) {
          sum += values[j] * x[t];
        }
      }
      result[i] = sum;
    }
    return result;
  }

  /**
   * The adjoint of {@link #convolve}, i.e. convolution with the flipped kernel:
   * result[t] = sum_j values[j] * r[t + j - center].
   */
  public double[] correlate(double[] r) {
    double[] result = new double[r.length];
    for (int t = 0; t < r.length; t++) {
      double sum = 0.0;
      for (int j = 0; j < values.length; j++) {
        int i = t + j - center;
        if (i >= 0 && i < r.length) {
          sum += values[j] * r[i];
        }
      }
      result[t] = sum;
    }
    return result;
  }

  public int size() {
    return values.length;
  }

  public int getCenter() {
    return center;
  }

  /**
   * The sum of the values the kernel was built from, before normalization.
   */
  public double getArea() {
    return area;
  }

  public double[] getValues() {
    return values.clone();
  }

  private static int indexOfMax(double[] values) {
    if (values == null || values.length == 0) {
      throw new SpectrumConfigurationException("Response kernel must hold at least one value");
    }
    int best = 0;
    for (int i = 1; i < values.length; i++) {
      if (values[i] > values[best]) {
        best = i;
      }
    }
    return best;
  }
}
