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

import com.twentyn.spectrum.SpectrumConfigurationException;

/**
 * Iteration settings shared by the iterative deconvolution and unfolding kernels.
 *
 * The estimate is refined `numberIterations` times inside each of `numberRepetitions` blocks; every block after the
 * first starts by raising the max-normalized estimate to the power `boost`, which narrows peaks when boost > 1.
 */
public class DeconvolutionParameters {
  public static final double NO_BOOST = 1.0;

  private int numberIterations;
  private int numberRepetitions;
  private double boost;

  public DeconvolutionParameters(int numberIterations, int numberRepetitions, double boost) {
    if (numberIterations <= 0) {
      throw new SpectrumConfigurationException("Number of iterations must be positive, got %d", numberIterations);
    }
    if (numberRepetitions <= 0) {
      throw new SpectrumConfigurationException("Number of repetitions must be positive, got %d", numberRepetitions);
    }
    if (!(boost > 0) || Double.isInfinite(boost)) {
      throw new SpectrumConfigurationException("Boost coefficient must be a positive number, got %f", boost);
    }
    this.numberIterations = numberIterations;
    this.numberRepetitions = numberRepetitions;
    this.boost = boost;
  }

  /**
   * A single repetition block without boosting.
   */
  public static DeconvolutionParameters of(int numberIterations) {
    return new DeconvolutionParameters(numberIterations, 1, NO_BOOST);
  }

  public int getNumberIterations() {
    return numberIterations;
  }

  public int getNumberRepetitions() {
    return numberRepetitions;
  }

  public double getBoost() {
    return boost;
  }

  @Override
  public String toString() {
    return String.format("DeconvolutionParameters{iterations=%d, repetitions=%d, boost=%.3f}",
        numberIterations, numberRepetitions, boost);
  }
}
