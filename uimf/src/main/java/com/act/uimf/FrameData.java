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

package com.act.uimf;

/**
 * Every stored point of one frame, flattened.  The points of scan scanNumbers[i] are the next spectrumCounts[i]
 * entries of bins and intensities; scans with no stored points are left out.
 */
public class FrameData {
  private final int[] scanNumbers;
  private final int[] spectrumCounts;
  private final int[] bins;
  private final int[] intensities;

  public FrameData(int[] scanNumbers, int[] spectrumCounts, int[] bins, int[] intensities) {
    if (scanNumbers.length != spectrumCounts.length || bins.length != intensities.length) {
      throw new IllegalArgumentException(String.format(
          "Mismatched frame data: %d scans with %d counts, %d bins with %d intensities",
          scanNumbers.length, spectrumCounts.length, bins.length, intensities.length));
    }
    this.scanNumbers = scanNumbers;
    this.spectrumCounts = spectrumCounts;
    this.bins = bins;
    this.intensities = intensities;
  }

  public int[] getScanNumbers() {
    return scanNumbers;
  }

  public int[] getSpectrumCounts() {
    return spectrumCounts;
  }

  public int[] getBins() {
    return bins;
  }

  public int[] getIntensities() {
    return intensities;
  }

  public int getNumScans() {
    return scanNumbers.length;
  }

  public int getNumPoints() {
    return bins.length;
  }
}
