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

import org.apache.logging.log4j.Logger;

/**
 * Counts channel updates that had to be skipped because their denominator was zero or not finite.  Only channels
 * that carry signal are counted: an empty channel with an empty neighbourhood is not a degeneracy.
 */
public class DegeneracyCounter {
  // Skipping more than this share of updates is worth a warning.
  public static final double WARNING_FRACTION = 0.01;

  private long attempted = 0L;
  private long skipped = 0L;

  public void attempt() {
    attempted++;
  }

  public void skip() {
    skipped++;
  }

  public long getAttempted() {
    return attempted;
  }

  public long getSkipped() {
    return skipped;
  }

  public boolean isFrequent() {
    return skipped > 0 && skipped > WARNING_FRACTION * attempted;
  }

  public static boolean isUsableDenominator(double denominator) {
    return denominator > 0 && Double.isFinite(denominator);
  }

  /**
   * Emits one warning for the whole call if degenerate updates were frequent.
   */
  public void report(Logger logger, String operation) {
    if (isFrequent()) {
      logger.warn("%s skipped %d of %d channel updates with a zero or non-finite denominator",
          operation, skipped, attempted);
    }
  }
}
