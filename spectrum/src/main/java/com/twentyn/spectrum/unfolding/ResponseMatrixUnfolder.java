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
import com.twentyn.spectrum.deconvolution.DeconvolutionParameters;
import com.twentyn.spectrum.deconvolution.DeconvolutionResult;
import com.twentyn.spectrum.deconvolution.DegeneracyCounter;
import com.twentyn.spectrum.deconvolution.IterativeDeconvolver;
import com.twentyn.spectrum.utils.SpectrumArrays;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Unfolds a one-dimensional spectrum measured through an arbitrary (not shift invariant) response, e.g. a detector
 * whose resolution changes with energy.
 *
 * `response[j]` is what a single count in true channel j looks like in the observed spectrum; every row must have
 * the length of the observed spectrum and there can be no more true channels than observed ones.  Each row is
 * normalized to unit area.  The system A x = y is solved through its normal equations AᵀA x = Aᵀy with the Gold
 * ratio iteration, starting from a flat estimate.
 */
public class ResponseMatrixUnfolder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ResponseMatrixUnfolder.class);

  /**
   * @param observed The measured spectrum; it is not modified.
   * @param response One row per true channel, one column per observed channel.
   * @param params Iteration, repetition and boost settings.
   * @return The unfolded spectrum with one value per true channel.
   */
  public DeconvolutionResult unfold(double[] observed, double[][] response, DeconvolutionParameters params) {
    if (params == null) {
      throw new SpectrumConfigurationException("Deconvolution parameters must not be null");
    }
    SpectrumArrays.checkSpectrum(observed, "Observed spectrum");
    for (int i = 0; i < observed.length; i++) {
      if (observed[i] < 0) {
        throw new SpectrumConfigurationException("Observed spectrum must not hold negative counts (channel %d: %f)",
            i, observed[i]);
      }
    }
    int observedChannels = SpectrumArrays.checkMatrix(response, "Response matrix");
    int trueChannels = response.length;
    if (observedChannels != observed.length) {
      throw new SpectrumConfigurationException("Response rows have %d columns but the spectrum has %d channels",
          observedChannels, observed.length);
    }
    if (observedChannels < trueChannels) {
      throw new SpectrumConfigurationException(
          "Response matrix maps %d true channels onto only %d observed channels", trueChannels, observedChannels);
    }

    // A[i][j]: contribution of true channel j to observed channel i.
    RealMatrix a = MatrixUtils.createRealMatrix(observedChannels, trueChannels);
    for (int j = 0; j < trueChannels; j++) {
      double area = 0.0;
      for (int i = 0; i < observedChannels; i++) {
        if (response[j][i] < 0) {
          throw new SpectrumConfigurationException("Response matrix value at [%d][%d] must not be negative", j, i);
        }
        area += response[j][i];
      }
      if (area == 0) {
        throw new DegenerateResponseException(String.format("Zero row %d in response matrix", j));
      }
      for (int i = 0; i < observedChannels; i++) {
        a.setEntry(i, j, response[j][i] / area);
      }
    }

    RealMatrix at = a.transpose();
    RealMatrix ata = at.multiply(a);
    RealVector aty = at.operate(MatrixUtils.createRealVector(observed));

    DegeneracyCounter counter = new DegeneracyCounter();
    double[] estimate = new double[trueChannels];
    Arrays.fill(estimate, 1.0);
    for (int repetition = 0; repetition < params.getNumberRepetitions(); repetition++) {
      if (repetition != 0) {
        IterativeDeconvolver.applyBoost(estimate, SpectrumArrays.max(estimate), params.getBoost());
      }
      for (int iteration = 0; iteration < params.getNumberIterations(); iteration++) {
        double[] reconstructed = ata.operate(estimate);
        for (int j = 0; j < trueChannels; j++) {
          double numerator = aty.getEntry(j);
          if (numerator > 0) {
            counter.attempt();
          }
          if (!DegeneracyCounter.isUsableDenominator(reconstructed[j])) {
            if (numerator > 0) {
              counter.skip();
            }
            continue;
          }
          estimate[j] *= numerator / reconstructed[j];
        }
      }
    }

    counter.report(LOGGER, "Response matrix unfolding");
    return new DeconvolutionResult(estimate, counter.getAttempted(), counter.getSkipped());
  }
}
