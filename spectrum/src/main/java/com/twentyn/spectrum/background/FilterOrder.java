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
 * The symmetric finite-difference formula used to compute the clipping reference for a channel.  Higher orders
 * follow curved backgrounds more closely.
 */
public enum FilterOrder {
  ORDER_2(2),
  ORDER_4(4),
  ORDER_6(6),
  ORDER_8(8),
  ;

  private int points;

  FilterOrder(int points) {
    this.points = points;
  }

  public int getPoints() {
    return points;
  }

  public static FilterOrder fromPoints(int points) {
    for (FilterOrder order : values()) {
      if (order.points == points) {
        return order;
      }
    }
    throw new SpectrumConfigurationException("Unsupported background filter order %d, expected one of 2, 4, 6, 8",
        points);
  }
}
