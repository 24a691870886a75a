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

/**
 * The sharpened spectrum produced by a deconvolution, along with how many channel updates had to be skipped.
 */
public class DeconvolutionResult {
  private double[] values;
  private long attemptedUpdates;
  private long skippedUpdates;

  public DeconvolutionResult(double[] values, long attemptedUpdates, long skippedUpdates) {
    this.values = values;
    this.attemptedUpdates = attemptedUpdates;
    this.skippedUpdates = skippedUpdates;
  }

  DeconvolutionResult(double[] values, DegeneracyCounter counter) {
    this(values, counter.getAttempted(), counter.getSkipped());
  }

  /**
   * The result array; it belongs to the caller.
   */
  public double[] getValues() {
    return values;
  }

  public long getAttemptedUpdates() {
    return attemptedUpdates;
  }

  public long getSkippedUpdates() {
    return skippedUpdates;
  }

  public boolean hasDegenerateUpdates() {
    return skippedUpdates > 0;
  }
}
