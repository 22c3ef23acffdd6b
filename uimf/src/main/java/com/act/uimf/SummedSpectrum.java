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
 * The result of summing many scans into one spectrum.  Intensities accumulate as longs so that large sums never wrap;
 * the narrowing views refuse to silently truncate.
 */
public class SummedSpectrum {
  private final double[] mzs;
  private final long[] intensities;
  private final int length;

  public SummedSpectrum(double[] mzs, long[] intensities, int length) {
    if (mzs.length != intensities.length) {
      throw new IllegalArgumentException(String.format(
          "m/z and intensity arrays must be the same length: %d vs. %d", mzs.length, intensities.length));
    }
    this.mzs = mzs;
    this.intensities = intensities;
    this.length = length;
  }

  /**
   * @return One more than the highest bin that received a non-zero intensity, or 0 if nothing was summed.
   */
  public int getLength() {
    return length;
  }

  // m/z of each bin that received an intensity, zero elsewhere.
  public double[] getMzs() {
    return mzs;
  }

  public long[] getIntensities() {
    return intensities;
  }

  public int[] getIntensitiesAsInt() {
    int[] results = new int[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      results[i] = Math.toIntExact(intensities[i]);
    }
    return results;
  }

  public double[] getIntensitiesAsDouble() {
    double[] results = new double[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      results[i] = intensities[i];
    }
    return results;
  }

  public float[] getIntensitiesAsFloat() {
    float[] results = new float[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      results[i] = intensities[i];
    }
    return results;
  }

  public short[] getIntensitiesAsShort() {
    short[] results = new short[intensities.length];
    for (int i = 0; i < intensities.length; i++) {
      if (intensities[i] > Short.MAX_VALUE) {
        throw new ArithmeticException(String.format(
            "Summed intensity %d at bin %d does not fit in a short", intensities[i], i));
      }
      results[i] = (short) intensities[i];
    }
    return results;
  }
}
