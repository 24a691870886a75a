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

import com.twentyn.spectrum.SpectrumConfigurationException;

/**
 * Small helpers shared by the kernels for checking and summarizing plain sample arrays.
 */
public class SpectrumArrays {
  private SpectrumArrays() {
  }

  /**
   * Rejects null or empty spectra and spectra holding NaN/infinite channels.
   * @param source The spectrum to check.
   * @param what A short name for the array, used in the error message.
   */
  public static void checkSpectrum(double[] source, String what) {
    if (source == null) {
      throw new SpectrumConfigurationException("%s must not be null", what);
    }
    if (source.length == 0) {
      throw new SpectrumConfigurationException("%s must hold at least one channel", what);
    }
    for (int i = 0; i < source.length; i++) {
      if (!Double.isFinite(source[i])) {
        throw new SpectrumConfigurationException("%s holds a non-finite value at channel %d", what, i);
      }
    }
  }

  /**
   * Rejects null, empty or ragged matrices and matrices holding NaN/infinite cells.
   * @return The number of columns shared by every row.
   */
  public static int checkMatrix(double[][] source, String what) {
    if (source == null || source.length == 0) {
      throw new SpectrumConfigurationException("%s must hold at least one row", what);
    }
    if (source[0] == null || source[0].length == 0) {
      throw new SpectrumConfigurationException("%s must hold at least one column", what);
    }
    int columns = source[0].length;
    for (int i = 0; i < source.length; i++) {
      if (source[i] == null || source[i].length != columns) {
        throw new SpectrumConfigurationException("%s row %d has a different length than row 0 (%d)", what, i, columns);
      }
      for (int j = 0; j < columns; j++) {
        if (!Double.isFinite(source[i][j])) {
          throw new SpectrumConfigurationException("%s holds a non-finite value at [%d][%d]", what, i, j);
        }
      }
    }
    return columns;
  }

  public static double sum(double[] values) {
    double total = 0.0;
    for (double v : values) {
      total += v;
    }
    return total;
  }

  public static double max(double[] values) {
    double max = -Double.MAX_VALUE;
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  public static double[][] copy(double[][] matrix) {
    double[][] result = new double[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      result[i] = matrix[i].clone();
    }
    return result;
  }
}
