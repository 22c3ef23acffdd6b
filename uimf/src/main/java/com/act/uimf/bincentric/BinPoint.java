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

package com.act.uimf.bincentric;

/**
 * One non-zero intensity of an m/z bin, located by physical frame number and drift scan.
 */
public class BinPoint {
  private final int frameNum;
  private final int scanNum;
  private final int intensity;

  public BinPoint(int frameNum, int scanNum, int intensity) {
    this.frameNum = frameNum;
    this.scanNum = scanNum;
    this.intensity = intensity;
  }

  public int getFrameNum() {
    return frameNum;
  }

  public int getScanNum() {
    return scanNum;
  }

  public int getIntensity() {
    return intensity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    BinPoint that = (BinPoint) o;

    if (frameNum != that.frameNum) return false;
    if (scanNum != that.scanNum) return false;
    return intensity == that.intensity;
  }

  @Override
  public int hashCode() {
    int result = frameNum;
    result = 31 * result + scanNum;
    result = 31 * result + intensity;
    return result;
  }

  @Override
  public String toString() {
    return String.format("BinPoint{frame=%d, scan=%d, intensity=%d}", frameNum, scanNum, intensity);
  }
}
