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

package com.act.uimf.codec;

import java.util.Arrays;

public class DecodedSpectrum {
  public static final DecodedSpectrum EMPTY = new DecodedSpectrum(new int[0], new int[0]);

  private final int[] bins;
  private final int[] intensities;

  public DecodedSpectrum(int[] bins, int[] intensities) {
    if (bins.length != intensities.length) {
      throw new IllegalArgumentException(String.format(
          "Bin and intensity arrays must be the same length: %d vs. %d", bins.length, intensities.length));
    }
    this.bins = bins;
    this.intensities = intensities;
  }

  public int[] getBins() {
    return bins;
  }

  public int[] getIntensities() {
    return intensities;
  }

  public int size() {
    return bins.length;
  }

  /**
   * Expand the sparse points into a dense array.  Points at or beyond the requested length are dropped.
   * @param length The number of bins in the dense result.
   * @return An array with intensities at their bin positions and zeros everywhere else.
   */
  public int[] toDense(int length) {
    int[] dense = new int[length];
    for (int i = 0; i < bins.length; i++) {
      if (bins[i] < length) {
        dense[bins[i]] = intensities[i];
      }
    }
    return dense;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    DecodedSpectrum that = (DecodedSpectrum) o;
    return Arrays.equals(bins, that.bins) && Arrays.equals(intensities, that.intensities);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(bins) + Arrays.hashCode(intensities);
  }
}
