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

import com.act.uimf.calibration.MzCalibrator;
import com.act.uimf.calibration.ResidualPolynomial;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-frame acquisition settings, one row of Frame_Parameters.  The fields that drive calibration and scan layout are
 * typed; instrument voltages, pressures and temperatures are carried as named readings that this library never
 * interprets.  Readers hand out copies of their cached instances.
 */
public class FrameParameters {
  private int frameNum;
  private double startTime;
  private double duration;
  private int accumulations;
  private FrameType frameType = FrameType.MS;
  private int scans;
  private String imfProfile;
  private double tofLosses;
  private double averageTofLength;
  private double calibrationSlope;
  private double calibrationIntercept;
  private ResidualPolynomial residualPolynomial = ResidualPolynomial.ZERO;
  private double[] fragmentationProfile = new double[0];
  private int mpBitOrder;
  private int calibrationDone;
  private Map<String, Double> auxiliaryReadings = new LinkedHashMap<>();

  public FrameParameters() {
  }

  public FrameParameters(FrameParameters other) {
    this.frameNum = other.frameNum;
    this.startTime = other.startTime;
    this.duration = other.duration;
    this.accumulations = other.accumulations;
    this.frameType = other.frameType;
    this.scans = other.scans;
    this.imfProfile = other.imfProfile;
    this.tofLosses = other.tofLosses;
    this.averageTofLength = other.averageTofLength;
    this.calibrationSlope = other.calibrationSlope;
    this.calibrationIntercept = other.calibrationIntercept;
    this.residualPolynomial = other.residualPolynomial;
    this.fragmentationProfile = other.fragmentationProfile.clone();
    this.mpBitOrder = other.mpBitOrder;
    this.calibrationDone = other.calibrationDone;
    this.auxiliaryReadings = new LinkedHashMap<>(other.auxiliaryReadings);
  }

  public FrameParameters(int frameNum, FrameType frameType, int scans,
                         double calibrationSlope, double calibrationIntercept) {
    this.frameNum = frameNum;
    this.frameType = frameType;
    setScans(scans);
    this.calibrationSlope = calibrationSlope;
    this.calibrationIntercept = calibrationIntercept;
  }

  public int getFrameNum() {
    return frameNum;
  }

  public void setFrameNum(int frameNum) {
    this.frameNum = frameNum;
  }

  public double getStartTime() {
    return startTime;
  }

  public void setStartTime(double startTime) {
    this.startTime = startTime;
  }

  public double getDuration() {
    return duration;
  }

  public void setDuration(double duration) {
    this.duration = duration;
  }

  public int getAccumulations() {
    return accumulations;
  }

  public void setAccumulations(int accumulations) {
    this.accumulations = accumulations;
  }

  public FrameType getFrameType() {
    return frameType;
  }

  public void setFrameType(FrameType frameType) {
    this.frameType = frameType;
  }

  public int getScans() {
    return scans;
  }

  public void setScans(int scans) {
    if (scans < 0) {
      throw new IllegalArgumentException(String.format("Scan count must be non-negative, got %d", scans));
    }
    this.scans = scans;
  }

  public String getImfProfile() {
    return imfProfile;
  }

  public void setImfProfile(String imfProfile) {
    this.imfProfile = imfProfile;
  }

  public double getTofLosses() {
    return tofLosses;
  }

  public void setTofLosses(double tofLosses) {
    this.tofLosses = tofLosses;
  }

  public double getAverageTofLength() {
    return averageTofLength;
  }

  public void setAverageTofLength(double averageTofLength) {
    this.averageTofLength = averageTofLength;
  }

  public double getCalibrationSlope() {
    return calibrationSlope;
  }

  public void setCalibrationSlope(double calibrationSlope) {
    this.calibrationSlope = calibrationSlope;
  }

  public double getCalibrationIntercept() {
    return calibrationIntercept;
  }

  public void setCalibrationIntercept(double calibrationIntercept) {
    this.calibrationIntercept = calibrationIntercept;
  }

  public ResidualPolynomial getResidualPolynomial() {
    return residualPolynomial;
  }

  public void setResidualPolynomial(ResidualPolynomial residualPolynomial) {
    this.residualPolynomial = residualPolynomial == null ? ResidualPolynomial.ZERO : residualPolynomial;
  }

  public boolean usesPolynomialCalibration() {
    return !residualPolynomial.isZero();
  }

  public double[] getFragmentationProfile() {
    return fragmentationProfile.clone();
  }

  public void setFragmentationProfile(double[] fragmentationProfile) {
    this.fragmentationProfile = fragmentationProfile == null ? new double[0] : fragmentationProfile.clone();
  }

  public int getMpBitOrder() {
    return mpBitOrder;
  }

  public void setMpBitOrder(int mpBitOrder) {
    this.mpBitOrder = mpBitOrder;
  }

  public int getCalibrationDone() {
    return calibrationDone;
  }

  public void setCalibrationDone(int calibrationDone) {
    this.calibrationDone = calibrationDone;
  }

  public Map<String, Double> getAuxiliaryReadings() {
    return Collections.unmodifiableMap(auxiliaryReadings);
  }

  public Double getAuxiliaryReading(String name) {
    return auxiliaryReadings.getOrDefault(name, 0.0);
  }

  public void setAuxiliaryReading(String name, Double value) {
    auxiliaryReadings.put(name, value);
  }

  public MzCalibrator makeCalibrator() {
    return new MzCalibrator(calibrationSlope, calibrationIntercept);
  }
}
