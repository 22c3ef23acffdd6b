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

package com.act.uimf.calibration;

/**
 * Converts between TOF bins and m/z using one frame's calibration:
 * <pre>
 *   mz = (slope * (t - correctionTime / 1000 - intercept))^2
 * </pre>
 * where t = bin * binWidth / 1000.  Slope and intercept are stored in units that make t come out in microseconds; the
 * raw TOF forms use k = slope / 10000 and t0 = intercept * 10000 so they can work directly in 0.1ns TOF ticks.
 */
public class MzCalibrator {
  public static final double SCALE_FACTOR = 10000.0;

  private final double slope;
  private final double intercept;
  private final double k;
  private final double t0;

  public MzCalibrator(double slope, double intercept) {
    this.slope = slope;
    this.intercept = intercept;
    this.k = slope / SCALE_FACTOR;
    this.t0 = intercept * SCALE_FACTOR;
  }

  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }

  public double getK() {
    return k;
  }

  public double getT0() {
    return t0;
  }

  public double tofToMz(double tof) {
    double r = k * (tof - t0);
    return r * r;
  }

  public int mzToTof(double mz) {
    double r = Math.sqrt(mz);
    return (int) ((r / k) + t0 + 0.5); // Round to the nearest tick.
  }

  /**
   * Compute the m/z at the center of a bin.
   * @param bin The bin, possibly fractional.
   * @param binWidth The bin width in nanoseconds.
   * @param correctionTime The dataset's TOF correction time in nanoseconds.
   * @param residual Residual error terms; only applied if non-zero.
   * @return The calibrated m/z.
   */
  public double binToMz(double bin, double binWidth, double correctionTime, ResidualPolynomial residual) {
    double t = bin * binWidth / 1000.0;
    double term = slope * (t - correctionTime / 1000.0 - intercept);
    double mz = term * term;
    if (residual != null && !residual.isZero()) {
      mz += residual.evaluate(t);
    }
    return mz;
  }

  /**
   * Invert the quadratic calibration to find the (fractional) bin for an m/z value.
   * @param mz The m/z to look up.
   * @param binWidth The bin width in nanoseconds.
   * @param correctionTime The dataset's TOF correction time in nanoseconds.
   * @param residual Residual error terms for the frame.
   * @return The fractional bin whose center maps to mz.
   * @throws UnsupportedCalibrationException If any residual term is non-zero.
   */
  public double mzToBin(double mz, double binWidth, double correctionTime, ResidualPolynomial residual)
      throws UnsupportedCalibrationException {
    if (residual != null && !residual.isZero()) {
      throw new UnsupportedCalibrationException(String.format(
          "Cannot compute a bin for m/z %f: frame uses polynomial calibration (%s)", mz, residual));
    }
    double binCorrection = (correctionTime / 1000.0) / binWidth;
    double bin = (Math.sqrt(mz) / slope + intercept) / binWidth * 1000.0;
    return bin + binCorrection;
  }
}
