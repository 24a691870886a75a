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

/**
 * Immutable settings for one background estimation.
 */
public class BackgroundParameters {
  public static final int MIN_SMOOTH_WINDOW = 3;
  public static final int MAX_SMOOTH_WINDOW = 15;
  public static final int DEFAULT_SMOOTH_WINDOW = MIN_SMOOTH_WINDOW;

  // Half-width of the widest clipping window, i.e. the number of clipping passes.
  private int numberIterations;
  private WindowDirection direction;
  private FilterOrder filterOrder;
  private boolean smoothing;
  // Full (odd) width of the moving average applied when smoothing is on.
  private int smoothWindow;
  private boolean compton;

  public BackgroundParameters(int numberIterations, WindowDirection direction, FilterOrder filterOrder,
                              boolean smoothing, int smoothWindow, boolean compton) {
    if (numberIterations <= 0) {
      throw new SpectrumConfigurationException("Width of clipping window must be positive, got %d", numberIterations);
    }
    if (direction == null) {
      throw new SpectrumConfigurationException("Window direction must be specified");
    }
    if (filterOrder == null) {
      throw new SpectrumConfigurationException("Filter order must be specified");
    }
    if (smoothing && (smoothWindow % 2 == 0 || smoothWindow < MIN_SMOOTH_WINDOW || smoothWindow > MAX_SMOOTH_WINDOW)) {
      throw new SpectrumConfigurationException("Incorrect width of smoothing window %d, expected an odd value in [%d, %d]",
          smoothWindow, MIN_SMOOTH_WINDOW, MAX_SMOOTH_WINDOW);
    }
    this.numberIterations = numberIterations;
    this.direction = direction;
    this.filterOrder = filterOrder;
    this.smoothing = smoothing;
    this.smoothWindow = smoothWindow;
    this.compton = compton;
  }

  /**
   * Second order filter, increasing windows, no smoothing and no Compton edge handling.
   */
  public static BackgroundParameters defaults(int numberIterations) {
    return new BackgroundParameters(numberIterations, WindowDirection.INCREASING, FilterOrder.ORDER_2,
        false, DEFAULT_SMOOTH_WINDOW, false);
  }

  public int getNumberIterations() {
    return numberIterations;
  }

  public WindowDirection getDirection() {
    return direction;
  }

  public FilterOrder getFilterOrder() {
    return filterOrder;
  }

  public boolean isSmoothing() {
    return smoothing;
  }

  public int getSmoothWindow() {
    return smoothWindow;
  }

  public boolean isCompton() {
    return compton;
  }

  @Override
  public String toString() {
    return String.format("BackgroundParameters{iterations=%d, direction=%s, order=%d, smoothing=%s/%d, compton=%s}",
        numberIterations, direction, filterOrder.getPoints(), smoothing, smoothWindow, compton);
  }
}
