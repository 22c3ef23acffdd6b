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

import java.util.Arrays;

/**
 * Residual mass error correction terms applied after the quadratic TOF calibration:
 * <pre>
 *   a2 * t + b2 * t^3 + c2 * t^5 + d2 * t^7 + e2 * t^9 + f2 * t^11
 * </pre>
 * where t is the flight time in microseconds.
 */
public class ResidualPolynomial {
  public static final ResidualPolynomial ZERO = new ResidualPolynomial(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);

  private final double a2;
  private final double b2;
  private final double c2;
  private final double d2;
  private final double e2;
  private final double f2;

  public ResidualPolynomial(double a2, double b2, double c2, double d2, double e2, double f2) {
    this.a2 = a2;
    this.b2 = b2;
    this.c2 = c2;
    this.d2 = d2;
    this.e2 = e2;
    this.f2 = f2;
  }

  public double getA2() {
    return a2;
  }

  public double getB2() {
    return b2;
  }

  public double getC2() {
    return c2;
  }

  public double getD2() {
    return d2;
  }

  public double getE2() {
    return e2;
  }

  public double getF2() {
    return f2;
  }

  public boolean isZero() {
    return a2 == 0.0 && b2 == 0.0 && c2 == 0.0 && d2 == 0.0 && e2 == 0.0 && f2 == 0.0;
  }

  public double evaluate(double t) {
    return a2 * t + b2 * Math.pow(t, 3) + c2 * Math.pow(t, 5) + d2 * Math.pow(t, 7) +
        e2 * Math.pow(t, 9) + f2 * Math.pow(t, 11);
  }

  public double[] toArray() {
    return new double[] {a2, b2, c2, d2, e2, f2};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ResidualPolynomial that = (ResidualPolynomial) o;
    return Arrays.equals(toArray(), that.toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(toArray());
  }

  @Override
  public String toString() {
    return String.format("a2=%g b2=%g c2=%g d2=%g e2=%g f2=%g", a2, b2, c2, d2, e2, f2);
  }
}
