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

/**
 * The compressed form of one spectrum along with the summary values computed while encoding it.
 */
public class EncodedSpectrum {
  // Null when every intensity was zero.
  private final byte[] payload;
  private final double totalIonCurrent;
  private final double basePeakIntensity;
  private final int basePeakBin;
  private final int nonZeroCount;

  public EncodedSpectrum(byte[] payload, double totalIonCurrent, double basePeakIntensity,
                         int basePeakBin, int nonZeroCount) {
    this.payload = payload;
    this.totalIonCurrent = totalIonCurrent;
    this.basePeakIntensity = basePeakIntensity;
    this.basePeakBin = basePeakBin;
    this.nonZeroCount = nonZeroCount;
  }

  public byte[] getPayload() {
    return payload;
  }

  public boolean isEmpty() {
    return payload == null;
  }

  public double getTotalIonCurrent() {
    return totalIonCurrent;
  }

  public double getBasePeakIntensity() {
    return basePeakIntensity;
  }

  public int getBasePeakBin() {
    return basePeakBin;
  }

  public int getNonZeroCount() {
    return nonZeroCount;
  }
}
