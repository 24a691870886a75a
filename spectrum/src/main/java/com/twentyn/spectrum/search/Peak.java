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

package com.twentyn.spectrum.search;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A located peak: its position in channels (with sub-channel precision) and the source height at the channel it was
 * found in.
 */
public class Peak implements Serializable {
  private static final long serialVersionUID = 3921087245616320094L;

  @JsonProperty("position")
  private Double position;

  @JsonProperty("height")
  private Double height;

  public Peak(Double position, Double height) {
    this.position = position;
    this.height = height;
  }

  public Peak() {}

  public Double getPosition() {
    return position;
  }

  public Double getHeight() {
    return height;
  }

  public void setPosition(Double position) {
    this.position = position;
  }

  public void setHeight(Double height) {
    this.height = height;
  }

  @Override
  public String toString() {
    return String.format("Peak{position=%.3f, height=%.3f}", position, height);
  }
}
