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
import com.twentyn.spectrum.deconvolution.ResponseKernel;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.commons.math3.analysis.function.Gaussian;

/**
 * Two-dimensional detector response.  A true count in cell (x, y) is observed in cell
 * (x + a - centerX, y + b - centerY) with weight values[a][b].  Values are normalized to unit volume.
 */
public class ResponseMatrix {
  private double[][] values;
  private int centerX;
  private int centerY;

  /**
   * Builds a response centred on its largest cell (first in row-major order on ties).
   */
  public ResponseMatrix(double[][] values) {
    this(values, argMax(values)[0], argMax(values)[1]);
  }

  public ResponseMatrix(double[][] values, int centerX, int centerY) {
    int columns = SpectrumArrays.checkMatrix(values, "Response matrix");
    if (centerX < 0 || centerX >= values.length || centerY < 0 || centerY >= columns) {
      throw new SpectrumConfigurationException("Response matrix centre (%d, %d) is outside the %dx%d matrix",
          centerX, centerY, values.length, columns);
    }
    double total = 0.0;
    for (int a = 0; a < values.length; a++) {
      for (int b = 0; b < columns; b++) {
        if (values[a][b] < 0) {
          throw new SpectrumConfigurationException("Response matrix value at [%d][%d] must not be negative", a, b);
        }
        total += values[a][b];
      }
    }
    if (total == 0) {
      throw new DegenerateResponseException("Response matrix sums to zero");
    }

    this.values = new double[values.length][columns];
    for (int a = 0; a < values.length; a++) {
      for (int b = 0; b < columns; b++) {
        this.values[a][b] = values[a][b] / total;
      }
    }
    this.centerX = centerX;
    this.centerY = centerY;
  }

  /**
   * A separable Gaussian response truncated at four standard deviations along each axis.
   */
  public static ResponseMatrix gaussian(double sigmaX, double sigmaY) {
    if (!(sigmaX > 0) || !(sigmaY > 0) || Double.isInfinite(sigmaX) || Double.isInfinite(sigmaY)) {
      throw new SpectrumConfigurationException("Gaussian response needs positive sigmas, got %f and %f",
          sigmaX, sigmaY);
    }
    double widthX = Math.ceil(ResponseKernel.GAUSSIAN_CUTOFF_SIGMAS * sigmaX);
    double widthY = Math.ceil(ResponseKernel.GAUSSIAN_CUTOFF_SIGMAS * sigmaY);
    if (widthX > ResponseKernel.MAX_HALF_WIDTH || widthY > ResponseKernel.MAX_HALF_WIDTH) {
      throw new SpectrumConfigurationException("Gaussian sigmas %f and %f need a response wider than %d cells",
          sigmaX, sigmaY, 2 * ResponseKernel.MAX_HALF_WIDTH + 1);
    }
    int halfX = (int) widthX;
    int halfY = (int) widthY;
    Gaussian shapeX = new Gaussian(1.0, 0.0, sigmaX);
    Gaussian shapeY = new Gaussian(1.0, 0.0, sigmaY);
    double[][] values = new double[2 * halfX + 1][2 * halfY + 1];
    for (int a = 0; a < values.length; a++) {
      for (int b = 0; b < values[a].length; b++) {
        values[a][b] = shapeX.value(a - halfX) * shapeY.value(b - halfY);
      }
    }
    return new ResponseMatrix(values, halfX, halfY);
  }

  public double[][] convolve(double[][] x) {
    int sizeX = x.length;
    int sizeY = x[0].length;
    double[][] result = new double[sizeX][sizeY];
    for (int i = 0; i < sizeX; i++) {
      for (int k = 0; k < sizeY; k++) {
        double sum = 0.0;
        for (int a = 0; a < values.length; a++) {
          int t = i - a + centerX;
          if (t < 0 || t >= sizeX) {
            continue;
          }
          for (int b = 0; b < values[a].length; b++) {
            int u = k - b + centerY;
            if (u >= 0 && u < sizeY) {
              sum += values[a][b] * x[t][u];
            }
          }
        }
        result[i][k] = sum;
      }
    }
    return result;
  }

  /**
   * Adjoint of {@link #convolve}: correlation with the response, i.e. convolution with the response flipped along
   * both axes.
   */
  public double[][] correlate(double[][] r) {
    int sizeX = r.length;
    int sizeY = r[0].length;
    double[][] result = new double[sizeX][sizeY];
    for (int t = 0; t < sizeX; t++) {
      for (int u = 0; u < sizeY; u++) {
        double sum = 0.0;
        for (int a = 0; a < values.length; a++) {
          int i = t + a - centerX;
          if (i < 0 || i >= sizeX) {
            continue;
          }
          for (int b = 0; b < values[a].length; b++) {
            int k = u + b - centerY;
            if (k >= 0 && k < sizeY) {
              sum += values[a][b] * r[i][k];
            }
          }
        }
        result[t][u] = sum;
      }
    }
    return result;
  }

  public int getCenterX() {
    return centerX;
  }

  public int getCenterY() {
    return centerY;
  }

  public double[][] getValues() {
    return SpectrumArrays.copy(values);
  }

  private static int[] argMax(double[][] values) {
    SpectrumArrays.checkMatrix(values, "Response matrix");
    int[] best = new int[]{0, 0};
    for (int a = 0; a < values.length; a++) {
      for (int b = 0; b < values[a].length; b++) {
        if (values[a][b] > values[best[0]][best[1]]) {
          best[0] = a;
          best[1] = b;
        }
      }
    }
    return best;
  }
}
