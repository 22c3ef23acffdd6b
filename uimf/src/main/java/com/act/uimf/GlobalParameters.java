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

import com.act.uimf.codec.ElementWidth;

/**
 * Dataset-wide acquisition settings, stored as the single row of Global_Parameters.  Readers hand out copies, so
 * changing an instance obtained from a reader never affects what the reader decodes.
 */
public class GlobalParameters {
  private String dateStarted;
  private int numFrames;
  private int timeOffset;
  // Nanoseconds per TOF bin.
  private double binWidth;
  private int bins;
  // Nanoseconds; older files lack this column and get 0.
  private double tofCorrectionTime;
  private double frameDataBlobVersion;
  private double scanDataBlobVersion;
  private String tofIntensityType;
  private String datasetType;
  private int prescanTofPulses;
  private int prescanAccumulations;
  private int prescanTicThreshold;
  private boolean prescanContinuous;
  private String prescanProfile;
  private String instrumentName;
  // Null for files that predate the IntensityElementWidth column.
  private ElementWidth elementWidth;

  public GlobalParameters() {
  }

  public GlobalParameters(GlobalParameters other) {
    this.dateStarted = other.dateStarted;
    this.numFrames = other.numFrames;
    this.timeOffset = other.timeOffset;
    this.binWidth = other.binWidth;
    this.bins = other.bins;
    this.tofCorrectionTime = other.tofCorrectionTime;
    this.frameDataBlobVersion = other.frameDataBlobVersion;
    this.scanDataBlobVersion = other.scanDataBlobVersion;
    this.tofIntensityType = other.tofIntensityType;
    this.datasetType = other.datasetType;
    this.prescanTofPulses = other.prescanTofPulses;
    this.prescanAccumulations = other.prescanAccumulations;
    this.prescanTicThreshold = other.prescanTicThreshold;
    this.prescanContinuous = other.prescanContinuous;
    this.prescanProfile = other.prescanProfile;
    this.instrumentName = other.instrumentName;
    this.elementWidth = other.elementWidth;
  }

  public GlobalParameters(int numFrames, int bins, double binWidth, double tofCorrectionTime) {
    this.numFrames = numFrames;
    this.bins = bins;
    this.binWidth = binWidth;
    this.tofCorrectionTime = tofCorrectionTime;
  }

  public String getDateStarted() {
    return dateStarted;
  }

  public void setDateStarted(String dateStarted) {
    this.dateStarted = dateStarted;
  }

  public int getNumFrames() {
    return numFrames;
  }

  public void setNumFrames(int numFrames) {
    this.numFrames = numFrames;
  }

  public int getTimeOffset() {
    return timeOffset;
  }

  public void setTimeOffset(int timeOffset) {
    this.timeOffset = timeOffset;
  }

  public double getBinWidth() {
    return binWidth;
  }

  public void setBinWidth(double binWidth) {
    this.binWidth = binWidth;
  }

  public int getBins() {
    return bins;
  }

  public void setBins(int bins) {
    this.bins = bins;
  }

  public double getTofCorrectionTime() {
    return tofCorrectionTime;
  }

  public void setTofCorrectionTime(double tofCorrectionTime) {
    this.tofCorrectionTime = tofCorrectionTime;
  }

  public double getFrameDataBlobVersion() {
    return frameDataBlobVersion;
  }

  public void setFrameDataBlobVersion(double frameDataBlobVersion) {
    this.frameDataBlobVersion = frameDataBlobVersion;
  }

  public double getScanDataBlobVersion() {
    return scanDataBlobVersion;
  }

  public void setScanDataBlobVersion(double scanDataBlobVersion) {
    this.scanDataBlobVersion = scanDataBlobVersion;
  }

  public String getTofIntensityType() {
    return tofIntensityType;
  }

  public void setTofIntensityType(String tofIntensityType) {
    this.tofIntensityType = tofIntensityType;
  }

  public String getDatasetType() {
    return datasetType;
  }

  public void setDatasetType(String datasetType) {
    this.datasetType = datasetType;
  }

  public int getPrescanTofPulses() {
    return prescanTofPulses;
  }

  public void setPrescanTofPulses(int prescanTofPulses) {
    this.prescanTofPulses = prescanTofPulses;
  }

  public int getPrescanAccumulations() {
    return prescanAccumulations;
  }

  public void setPrescanAccumulations(int prescanAccumulations) {
    this.prescanAccumulations = prescanAccumulations;
  }

  public int getPrescanTicThreshold() {
    return prescanTicThreshold;
  }

  public void setPrescanTicThreshold(int prescanTicThreshold) {
    this.prescanTicThreshold = prescanTicThreshold;
  }

  public boolean isPrescanContinuous() {
    return prescanContinuous;
  }

  public void setPrescanContinuous(boolean prescanContinuous) {
    this.prescanContinuous = prescanContinuous;
  }

  public String getPrescanProfile() {
    return prescanProfile;
  }

  public void setPrescanProfile(String prescanProfile) {
    this.prescanProfile = prescanProfile;
  }

  public String getInstrumentName() {
    return instrumentName;
  }

  public void setInstrumentName(String instrumentName) {
    this.instrumentName = instrumentName;
  }

  public ElementWidth getElementWidth() {
    return elementWidth;
  }

  public void setElementWidth(ElementWidth elementWidth) {
    this.elementWidth = elementWidth;
  }
}
