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

import com.twentyn.spectrum.SpectrumConfigurationException;
import com.twentyn.spectrum.deconvolution.DeconvolutionParameters;
import com.twentyn.spectrum.deconvolution.DegeneracyCounter;
import com.twentyn.spectrum.deconvolution.IterativeDeconvolver;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Two-dimensional counterpart of the Gold and Richardson-Lucy deconvolvers: sharpens a matrix of counts (e.g. a
 * coincidence spectrum) against a two-dimensional response.
 *
 * Cost grows with sizeX * sizeY * response cells * iterations * repetitions, so keep responses tight.
 */
public class Unfolder2D {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Unfolder2D.class);

  public enum Algorithm {
    GOLD,
    RICHARDSON_LUCY,
  }

  private Algorithm algorithm;

  public Unfolder2D() {
    this(Algorithm.GOLD);
  }

  public Unfolder2D(Algorithm algorithm) {
    if (algorithm == null) {
      throw new SpectrumConfigurationException("Unfolding algorithm must be specified");
    }
    this.algorithm = algorithm;
  }

  public Algorithm getAlgorithm() {
    return algorithm;
  }

  /**
   * @param source Rectangular matrix of non-negative counts, indexed [x][y]; it is not modified.
   * @param response The detector response.
   * @param params Iteration, repetition and boost settings.
   * @return The unfolded matrix, same dimensions as the source.
   */
  public Unfolding2DResult unfold(double[][] source, ResponseMatrix response, DeconvolutionParameters params) {
    if (response == null) {
      throw new SpectrumConfigurationException("Response matrix must not be null");
    }
    if (params == null) {
      throw new SpectrumConfigurationException("Deconvolution parameters must not be null");
    }
    int sizeY = SpectrumArrays.checkMatrix(source, "Source matrix");
    int sizeX = source.length;
    for (int i = 0; i < sizeX; i++) {
      for (int k = 0; k < sizeY; k++) {
        if (source[i][k] < 0) {
          throw new SpectrumConfigurationException("Source matrix must not hold negative counts ([%d][%d]: %f)",
              i, k, source[i][k]);
        }
      }
    }

    DegeneracyCounter counter = new DegeneracyCounter();
    double[][] estimate = SpectrumArrays.copy(source);
    for (int repetition = 0; repetition < params.getNumberRepetitions(); repetition++) {
      if (repetition != 0) {
        double max = 0.0;
        for (double[] row : estimate) {
          max = Math.max(max, SpectrumArrays.max(row));
        }
        for (double[] row : estimate) {
          IterativeDeconvolver.applyBoost(row, max, params.getBoost());
        }
      }
      for (int iteration = 0; iteration < params.getNumberIterations(); iteration++) {
        if (algorithm == Algorithm.GOLD) {
          goldUpdate(source, estimate, response, counter);
        } else {
          richardsonLucyUpdate(source, estimate, response, counter);
        }
      }
    }

    counter.report(LOGGER, "2D unfolding");
    LOGGER.debug("Unfolded a %dx%d matrix with %s (%s)", sizeX, sizeY, algorithm, params);
    return new Unfolding2DResult(estimate, counter.getAttempted(), counter.getSkipped());
  }

  private static void goldUpdate(double[][] source, double[][] estimate, ResponseMatrix response,
                                 DegeneracyCounter counter) {
    double[][] reconstructed = response.convolve(estimate);
    for (int i = 0; i < source.length; i++) {
      for (int k = 0; k < source[i].length; k++) {
        if (source[i][k] > 0) {
          counter.attempt();
        }
        if (!DegeneracyCounter.isUsableDenominator(reconstructed[i][k])) {
          if (source[i][k] > 0) {
            counter.skip();
          }
          continue;
        }
        estimate[i][k] *= source[i][k] / reconstructed[i][k];
      }
    }
  }

  private static void richardsonLucyUpdate(double[][] source, double[][] estimate, ResponseMatrix response,
                                           DegeneracyCounter counter) {
    double[][] reconstructed = response.convolve(estimate);
    double[][] ratio = new double[source.length][source[0].length];
    for (int i = 0; i < source.length; i++) {
      for (int k = 0; k < source[i].length; k++) {
        if (source[i][k] > 0) {
          counter.attempt();
        }
        if (DegeneracyCounter.isUsableDenominator(reconstructed[i][k])) {
          ratio[i][k] = source[i][k] / reconstructed[i][k];
        } else if (source[i][k] > 0) {
          counter.skip();
        }
      }
    }
    double[][] correction = response.correlate(ratio);
    for (int i = 0; i < source.length; i++) {
      for (int k = 0; k < source[i].length; k++) {
        estimate[i][k] *= correction[i][k];
      }
    }
  }
}
