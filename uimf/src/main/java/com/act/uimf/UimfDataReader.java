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

import com.act.uimf.bincentric.BinCentricTableReader;
import com.act.uimf.bincentric.BinPoint;
import com.act.uimf.calibration.MzCalibrator;
import com.act.uimf.calibration.UnsupportedCalibrationException;
import com.act.uimf.codec.DecodedSpectrum;
import com.act.uimf.codec.ElementWidth;
import com.act.uimf.codec.IntensityConverter;
import com.act.uimf.db.FrameParametersTable;
import com.act.uimf.db.FrameScansTable;
import com.act.uimf.db.GlobalParametersTable;
import com.act.uimf.db.UimfDB;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read access to a UIMF file.  Frames are addressed by logical index: the position of a frame in the ascending list of
 * frame numbers of the active frame type.  Switching the active type rebuilds that list; parameters read for any frame
 * are cached until calibration changes.  Parameter objects returned to callers are copies of the cached ones.
 *
 * Instances hold an open connection and are not thread safe.
 */
public class UimfDataReader implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(UimfDataReader.class);

  public static final String CALIBRATION_TABLE_MARKER = "Calib";

  // Types tried, in order, to choose the initially active frame type.
  private static final FrameType[] INITIAL_FRAME_TYPES = new FrameType[] {
      FrameType.MS_LEGACY, FrameType.MS, FrameType.MS_MS, FrameType.CALIBRATION
  };

  private final UimfDB db;
  private final IntensityConverter converter;
  private UimfStatusListener listener;

  private GlobalParameters globalParameters;
  private final Map<Integer, FrameParameters> frameParametersCache = new HashMap<>();
  private FrameType activeFrameType = FrameType.MS;
  private boolean frameIndexLoaded = false;
  private int[] frameNumbers = new int[0];
  private boolean legacyWarningIssued = false;
  private BinCentricTableReader binCentricTableReader;

  public static UimfDataReader open(File file) throws IOException, SQLException {
    return open(file, UimfConfig.loadDefault(), UimfStatusListener.NOOP);
  }

  public static UimfDataReader open(File file, UimfConfig config, UimfStatusListener listener)
      throws IOException, SQLException {
    if (!file.exists()) {
      // The JDBC driver would happily create an empty database, which is never what a reader wants.
      throw new FileNotFoundException(String.format("UIMF file %s does not exist", file.getAbsolutePath()));
    }
    UimfDB db = new UimfDB().connectToDB(file);
    try {
      return new UimfDataReader(db, config, listener);
    } catch (IOException | SQLException | RuntimeException e) {
      db.close();
      throw e;
    }
  }

  public UimfDataReader(UimfDB db, UimfConfig config, UimfStatusListener listener) throws IOException, SQLException {
    this.db = db;
    this.listener = listener == null ? UimfStatusListener.NOOP : listener;

    Pair<GlobalParameters, Integer> gp = GlobalParametersTable.getGlobalParameters(db);
    if (gp == null) {
      String msg = String.format("No rows in %s of %s", GlobalParametersTable.TABLE_NAME, db.getFile());
      LOGGER.error(msg);
      throw new IOException(msg);
    }
    this.globalParameters = gp.getLeft();
    warnOnMissingColumns(gp.getRight());

    // A width recorded in the file always wins over the configured one.
    ElementWidth width = config.getElementWidth();
    ElementWidth fileWidth = globalParameters.getElementWidth();
    if (fileWidth != null && fileWidth != width) {
      LOGGER.info("%s records %s intensities; ignoring configured width %s", db.getFile(), fileWidth, width);
      width = fileWidth;
    }
    this.converter = new IntensityConverter(width);

    for (FrameType type : INITIAL_FRAME_TYPES) {
      if (setActiveFrameType(type) > 0) {
        break;
      }
    }
    if (frameNumbers.length == 0) {
      setActiveFrameType(FrameType.MS);
    }
    LOGGER.info("Opened %s: %d bins, %d frames of type %s", db.getFile(), globalParameters.getBins(),
        frameNumbers.length, activeFrameType);
  }

  public void setStatusListener(UimfStatusListener listener) {
    this.listener = listener == null ? UimfStatusListener.NOOP : listener;
  }

  public GlobalParameters getGlobalParameters() {
    return new GlobalParameters(globalParameters);
  }

  public ElementWidth getElementWidth() {
    return converter.getWidth();
  }

  /* ----------------------------------------
   * Frame index
   */

  /**
   * Make a frame type active, rebuilding the logical frame index.  Re-selecting the active type touches nothing.
   * @param frameType The type to activate.
   * @return The number of frames of that type.
   * @throws SQLException
   */
  public int setActiveFrameType(FrameType frameType) throws SQLException {
    if (frameIndexLoaded && frameType == activeFrameType) {
      return frameNumbers.length;
    }

    int count = FrameParametersTable.countFramesByFrameType(db, frameType);
    int[] newFrameNumbers = FrameParametersTable.getFrameNumbersByFrameType(db, frameType, count);
    if (newFrameNumbers.length != count) {
      String msg = String.format("Found %d frame numbers for type %s but counted %d",
          newFrameNumbers.length, frameType, count);
      LOGGER.error(msg);
      throw new RuntimeException(msg);
    }

    this.frameNumbers = newFrameNumbers;
    this.activeFrameType = frameType;
    this.frameIndexLoaded = true;
    return count;
  }

  public FrameType getActiveFrameType() {
    return activeFrameType;
  }

  public int getNumFrames() {
    return frameNumbers.length;
  }

  public int getNumFrames(FrameType frameType) throws SQLException {
    if (frameIndexLoaded && frameType == activeFrameType) {
      return frameNumbers.length;
    }
    return FrameParametersTable.countFramesByFrameType(db, frameType);
  }

  public int[] getFrameNumbers() {
    return Arrays.copyOf(frameNumbers, frameNumbers.length);
  }

  public int getFrameNumber(int frameIndex) {
    checkFrameIndex(frameIndex);
    return frameNumbers[frameIndex];
  }

  /**
   * @return The logical index of a frame number under the active type, or -1 if it is not a frame of that type.
   */
  public int frameIndexOf(int frameNumber) {
    int index = Arrays.binarySearch(frameNumbers, frameNumber);
    return index >= 0 ? index : -1;
  }

  private void checkFrameIndex(int frameIndex) {
    if (frameIndex < 0 || frameIndex >= frameNumbers.length) {
      throw new IllegalArgumentException(String.format(
          "Frame index %d is out of range: %d frames of type %s", frameIndex, frameNumbers.length, activeFrameType));
    }
  }

  private void checkFrameRange(int startFrameIndex, int endFrameIndex) {
    if (endFrameIndex < startFrameIndex) {
      throw new IllegalArgumentException(String.format(
          "End frame index %d is before start frame index %d", endFrameIndex, startFrameIndex));
    }
    checkFrameIndex(startFrameIndex);
    checkFrameIndex(endFrameIndex);
  }

  private static void checkScanRange(int startScan, int endScan) {
    if (startScan < 0 || endScan < startScan) {
      throw new IllegalArgumentException(String.format("Invalid scan range [%d, %d]", startScan, endScan));
    }
  }

  /* ----------------------------------------
   * Frame parameters
   */

  public FrameParameters getFrameParameters(int frameIndex) throws SQLException {
    return new FrameParameters(frameParametersAt(frameIndex));
  }

  public FrameParameters getFrameParametersByNumber(int frameNumber) throws SQLException {
    return new FrameParameters(cachedFrameParameters(frameNumber));
  }

  private FrameParameters frameParametersAt(int frameIndex) throws SQLException {
    checkFrameIndex(frameIndex);
    return cachedFrameParameters(frameNumbers[frameIndex]);
  }

  private FrameParameters cachedFrameParameters(int frameNumber) throws SQLException {
    FrameParameters cached = frameParametersCache.get(frameNumber);
    if (cached != null) {
      return cached;
    }

    Pair<FrameParameters, Integer> result = FrameParametersTable.getFrameParametersByFrameNum(db, frameNumber);
    if (result == null) {
      throw new IllegalArgumentException(String.format("No parameters stored for frame %d", frameNumber));
    }
    warnOnMissingColumns(result.getRight());
    frameParametersCache.put(frameNumber, result.getLeft());
    return result.getLeft();
  }

  /**
   * Read the parameters of every frame of one type, filling the cache as a side effect.
   * @param frameType The type of frames to read.
   * @return A map of frame number to parameters, in frame number order.
   * @throws SQLException
   */
  public SortedMap<Integer, FrameParameters> getAllFrameParameters(FrameType frameType) throws SQLException {
    SortedMap<Integer, FrameParameters> results = new TreeMap<>();
    for (Pair<FrameParameters, Integer> pair : FrameParametersTable.getFrameParametersByFrameType(db, frameType)) {
      warnOnMissingColumns(pair.getRight());
      FrameParameters fp = frameParametersCache.get(pair.getLeft().getFrameNum());
      if (fp == null) {
        fp = pair.getLeft();
        frameParametersCache.put(fp.getFrameNum(), fp);
      }
      results.put(fp.getFrameNum(), new FrameParameters(fp));
    }
    return results;
  }

  public MzCalibrator getCalibrator(int frameIndex) throws SQLException {
    return frameParametersAt(frameIndex).makeCalibrator();
  }

  public void updateCalibration(int frameIndex, double slope, double intercept) throws SQLException {
    checkFrameIndex(frameIndex);
    FrameParametersTable.updateCalibrationByFrameNum(db, frameNumbers[frameIndex], slope, intercept);
    frameParametersCache.clear();
  }

  public void updateAllCalibration(double slope, double intercept) throws SQLException {
    FrameParametersTable.updateAllCalibration(db, slope, intercept);
    frameParametersCache.clear();
  }

  private void warnOnMissingColumns(int missingColumns) {
    if (missingColumns <= 0 || legacyWarningIssued) {
      return;
    }
    legacyWarningIssued = true;
    String msg = String.format("%s was written by an older version of the format: %d expected columns are missing " +
        "and will read as zero", db.getFile(), missingColumns);
    LOGGER.warn(msg);
    listener.onWarning(msg);
  }

  /* ----------------------------------------
   * Spectra
   */

  private DecodedSpectrum decode(FrameScansTable.ScanRecord record) throws IOException {
    int hint = record.getNonZeroCount() > 0 ? record.getNonZeroCount() : -1;
    return converter.decode(record.getIntensities(), globalParameters.getBins(), hint);
  }

  /**
   * Read one scan's non-zero points.
   * @param frameIndex The logical frame index.
   * @param scan The drift scan number.
   * @return The points in ascending bin order; empty if nothing was recorded for the scan.
   */
  public DecodedSpectrum getSpectrum(int frameIndex, int scan) throws IOException, SQLException {
    checkFrameIndex(frameIndex);
    FrameScansTable.ScanRecord record = FrameScansTable.getScanRecord(db, frameNumbers[frameIndex], scan);
    if (record == null) {
      return DecodedSpectrum.EMPTY;
    }
    return decode(record);
  }

  public Pair<double[], int[]> getSpectrumAsMz(int frameIndex, int scan) throws IOException, SQLException {
    DecodedSpectrum spectrum = getSpectrum(frameIndex, scan);
    FrameParameters fp = frameParametersAt(frameIndex);
    MzCalibrator calibrator = fp.makeCalibrator();

    int[] bins = spectrum.getBins();
    double[] mzs = new double[bins.length];
    for (int i = 0; i < bins.length; i++) {
      mzs[i] = calibrator.binToMz(bins[i], globalParameters.getBinWidth(),
          globalParameters.getTofCorrectionTime(), fp.getResidualPolynomial());
    }
    return Pair.of(mzs, spectrum.getIntensities());
  }

  public int getCountPerSpectrum(int frameIndex, int scan) throws SQLException {
    checkFrameIndex(frameIndex);
    return FrameScansTable.getNonZeroCount(db, frameNumbers[frameIndex], scan);
  }

  public int getCountPerFrame(int frameIndex) throws SQLException {
    checkFrameIndex(frameIndex);
    return FrameScansTable.getNonZeroCountForFrame(db, frameNumbers[frameIndex]);
  }

  /* ----------------------------------------
   * Intensity blocks
   */

  private int clampStartBin(int startBin) {
    return Math.max(startBin, 0);
  }

  private int clampEndBin(int endBin) {
    return Math.min(endBin, globalParameters.getBins());
  }

  /**
   * Read a dense block of intensities from one frame.  Row i is scan startScan + i and column j is bin startBin + j,
   * after the bin range is clamped to the dataset's bins.
   */
  public int[][] getIntensityBlock(int frameIndex, int startScan, int endScan, int startBin, int endBin)
      throws IOException, SQLException {
    return getIntensityBlock(frameIndex, frameIndex, startScan, endScan, startBin, endBin)[0];
  }

  /**
   * Read a dense block of intensities from a range of frames.  The first dimension is the logical frame index offset
   * from startFrameIndex; frames of other types that fall between the bounding frame numbers are skipped.
   */
  public int[][][] getIntensityBlock(int startFrameIndex, int endFrameIndex, int startScan, int endScan,
                                     int startBin, int endBin) throws IOException, SQLException {
    checkFrameRange(startFrameIndex, endFrameIndex);
    checkScanRange(startScan, endScan);
    startBin = clampStartBin(startBin);
    endBin = clampEndBin(endBin);
    if (endBin < startBin) {
      throw new IllegalArgumentException(String.format("Invalid bin range [%d, %d]", startBin, endBin));
    }

    int[][][] intensities =
        new int[endFrameIndex - startFrameIndex + 1][endScan - startScan + 1][endBin - startBin + 1];
    List<FrameScansTable.ScanRecord> records = FrameScansTable.getScanRecordsInRange(
        db, frameNumbers[startFrameIndex], frameNumbers[endFrameIndex], startScan, endScan);

    for (FrameScansTable.ScanRecord record : records) {
      int frameIndex = frameIndexOf(record.getFrameNum());
      if (frameIndex < 0) {
        continue;
      }

      DecodedSpectrum spectrum = decode(record);
      int[] bins = spectrum.getBins();
      int[] values = spectrum.getIntensities();
      int[] row = intensities[frameIndex - startFrameIndex][record.getScanNum() - startScan];
      for (int i = 0; i < bins.length; i++) {
        if (bins[i] > endBin) {
          break;
        }
        if (bins[i] >= startBin) {
          row[bins[i] - startBin] = values[i];
        }
      }
    }
    return intensities;
  }

  /**
   * Read every scan of a physical frame as a sorted map of bin to intensity.
   * @param frameNumber The physical frame number, of any type.
   * @return One map per scan, indexed by scan number; scans with no data have empty maps.
   */
  public List<SortedMap<Integer, Integer>> getIntensityBlockOfFrame(int frameNumber) throws IOException, SQLException {
    FrameParameters fp = cachedFrameParameters(frameNumber);
    List<FrameScansTable.ScanRecord> records = FrameScansTable.getScanRecordsForFrame(db, frameNumber);

    int scans = fp.getScans();
    for (FrameScansTable.ScanRecord record : records) {
      scans = Math.max(scans, record.getScanNum() + 1);
    }

    List<SortedMap<Integer, Integer>> results = new ArrayList<>(scans);
    for (int i = 0; i < scans; i++) {
      results.add(new TreeMap<>());
    }

    for (FrameScansTable.ScanRecord record : records) {
      DecodedSpectrum spectrum = decode(record);
      SortedMap<Integer, Integer> scanMap = results.get(record.getScanNum());
      int[] bins = spectrum.getBins();
      int[] values = spectrum.getIntensities();
      for (int i = 0; i < bins.length; i++) {
        if (values[i] > 0) {
          scanMap.put(bins[i], values[i]);
        }
      }
    }
    return results;
  }

  /**
   * Read every stored point of one frame under the active type.
   * @param frameIndex The logical frame index.
   * @return The frame's non-empty scans and their points, in scan then bin order.
   */
  public FrameData getFrameData(int frameIndex) throws IOException, SQLException {
    checkFrameIndex(frameIndex);
    List<FrameScansTable.ScanRecord> records = FrameScansTable.getScanRecordsForFrame(db, frameNumbers[frameIndex]);

    List<DecodedSpectrum> spectra = new ArrayList<>(records.size());
    List<Integer> scanNumbers = new ArrayList<>(records.size());
    int points = 0;
    for (FrameScansTable.ScanRecord record : records) {
      DecodedSpectrum spectrum = decode(record);
      if (spectrum.size() > 0) {
        spectra.add(spectrum);
        scanNumbers.add(record.getScanNum());
        points += spectrum.size();
      }
    }

    int[] scans = new int[spectra.size()];
    int[] counts = new int[spectra.size()];
    int[] bins = new int[points];
    int[] intensities = new int[points];
    int offset = 0;
    for (int i = 0; i < spectra.size(); i++) {
      DecodedSpectrum spectrum = spectra.get(i);
      scans[i] = scanNumbers.get(i);
      counts[i] = spectrum.size();
      System.arraycopy(spectrum.getBins(), 0, bins, offset, spectrum.size());
      System.arraycopy(spectrum.getIntensities(), 0, intensities, offset, spectrum.size());
      offset += spectrum.size();
    }
    return new FrameData(scans, counts, bins, intensities);
  }

  /**
   * Sum the intensity in each drift scan of one frame over a bin range.
   * @return One value per scan of the frame.
   */
  public int[] getMobilityData(int frameIndex, int minBin, int maxBin) throws IOException, SQLException {
    FrameParameters fp = frameParametersAt(frameIndex);
    int[] mobility = new int[fp.getScans()];
    for (FrameScansTable.ScanRecord record : FrameScansTable.getScanRecordsForFrame(db, fp.getFrameNum())) {
      if (record.getScanNum() >= mobility.length) {
        continue;
      }
      DecodedSpectrum spectrum = decode(record);
      int[] bins = spectrum.getBins();
      int[] values = spectrum.getIntensities();
      for (int i = 0; i < bins.length && bins[i] <= maxBin; i++) {
        if (bins[i] >= minBin) {
          mobility[record.getScanNum()] += values[i];
        }
      }
    }
    return mobility;
  }

  public int[] getMobilityData(int frameIndex) throws IOException, SQLException {
    return getMobilityData(frameIndex, 0, globalParameters.getBins());
  }

  /* ----------------------------------------
   * Summed spectra
   */

  /**
   * Sum all scans in a frame and scan range into a single spectrum indexed by bin.  The m/z of each bin comes from the
   * calibration of the first frame that contributes an intensity to it.
   */
  public SummedSpectrum sumScans(int startFrameIndex, int endFrameIndex, int startScan, int endScan)
      throws IOException, SQLException {
    checkFrameRange(startFrameIndex, endFrameIndex);
    checkScanRange(startScan, endScan);

    int totalBins = globalParameters.getBins();
    long[] intensities = new long[totalBins + 1];
    double[] mzs = new double[totalBins + 1];

    List<FrameScansTable.ScanRecord> records = FrameScansTable.getScanRecordsInRange(
        db, frameNumbers[startFrameIndex], frameNumbers[endFrameIndex], startScan, endScan);
    int maxBin = accumulate(records, intensities, mzs, -1);
    return new SummedSpectrum(mzs, intensities, maxBin + 1);
  }

  /**
   * Add every record of a frame of the active type into the running sums.
   * @return The highest bin summed so far.
   */
  private int accumulate(List<FrameScansTable.ScanRecord> records, long[] intensities, double[] mzs, int maxBin)
      throws IOException, SQLException {
    for (FrameScansTable.ScanRecord record : records) {
      if (frameIndexOf(record.getFrameNum()) < 0) {
        continue;
      }
      DecodedSpectrum spectrum = decode(record);
      if (spectrum.size() == 0) {
        continue;
      }

      FrameParameters fp = cachedFrameParameters(record.getFrameNum());
      MzCalibrator calibrator = fp.makeCalibrator();
      int[] bins = spectrum.getBins();
      int[] values = spectrum.getIntensities();
      for (int i = 0; i < bins.length; i++) {
        int bin = bins[i];
        intensities[bin] += values[i];
        if (mzs[bin] == 0.0) {
          mzs[bin] = calibrator.binToMz(bin, globalParameters.getBinWidth(),
              globalParameters.getTofCorrectionTime(), fp.getResidualPolynomial());
        }
        if (bin > maxBin) {
          maxBin = bin;
        }
      }
    }
    return maxBin;
  }

  /**
   * Sum a different set of scans from each of a list of frames.
   * @param frameIndices Logical frame indices; a frame listed twice is summed twice.
   * @param scans scans[i] lists the scans to take from frameIndices[i].
   * @return The summed spectrum, with m/z values as in {@link #sumScans(int, int, int, int)}.
   */
  public SummedSpectrum sumScans(int[] frameIndices, int[][] scans) throws IOException, SQLException {
    if (frameIndices.length != scans.length) {
      throw new IllegalArgumentException(String.format(
          "Got %d frame indices but %d scan lists", frameIndices.length, scans.length));
    }
    for (int i = 0; i < frameIndices.length; i++) {
      checkFrameIndex(frameIndices[i]);
      for (int scan : scans[i]) {
        if (scan < 0) {
          throw new IllegalArgumentException(String.format(
              "Invalid scan %d for frame index %d", scan, frameIndices[i]));
        }
      }
    }

    int totalBins = globalParameters.getBins();
    long[] intensities = new long[totalBins + 1];
    double[] mzs = new double[totalBins + 1];
    int maxBin = -1;
    for (int i = 0; i < frameIndices.length; i++) {
      List<FrameScansTable.ScanRecord> records = FrameScansTable.getScanRecordsForFrameAndScans(
          db, frameNumbers[frameIndices[i]], scans[i]);
      maxBin = accumulate(records, intensities, mzs, maxBin);
    }
    return new SummedSpectrum(mzs, intensities, maxBin + 1);
  }

  /**
   * Sum a different set of scans from each of a list of frames, keeping only the non-zero bins whose m/z lies in
   * [minMz, maxMz].  Every bin is placed on the m/z axis with the calibration of the first listed frame.
   * @return Parallel arrays of m/z and summed intensity, in ascending bin order.
   */
  public Pair<double[], long[]> sumScans(int[] frameIndices, int[][] scans, double minMz, double maxMz)
      throws IOException, SQLException {
    SummedSpectrum summed = sumScans(frameIndices, scans);
    if (frameIndices.length == 0) {
      return Pair.of(new double[0], new long[0]);
    }

    FrameParameters fp = frameParametersAt(frameIndices[0]);
    MzCalibrator calibrator = fp.makeCalibrator();
    long[] intensities = summed.getIntensities();
    List<Integer> keptBins = new ArrayList<>();
    List<Double> keptMzs = new ArrayList<>();
    for (int bin = 0; bin < summed.getLength(); bin++) {
      if (intensities[bin] <= 0) {
        continue;
      }
      double mz = calibrator.binToMz(bin, globalParameters.getBinWidth(), globalParameters.getTofCorrectionTime(),
          fp.getResidualPolynomial());
      if (minMz <= mz && mz <= maxMz) {
        keptBins.add(bin);
        keptMzs.add(mz);
      }
    }

    double[] mzs = new double[keptBins.size()];
    long[] values = new long[keptBins.size()];
    for (int i = 0; i < mzs.length; i++) {
      mzs[i] = keptMzs.get(i);
      values[i] = intensities[keptBins.get(i)];
    }
    return Pair.of(mzs, values);
  }

  /**
   * Like {@link #sumScans(int[], int[][])}, but with frame indices taken under the given frame type.  The active frame
   * type is restored afterwards.
   */
  public SummedSpectrum sumScansForVariableRange(FrameType frameType, int[] frameIndices, int[][] scans)
      throws IOException, SQLException {
    FrameType previous = activeFrameType;
    setActiveFrameType(frameType);
    try {
      return sumScans(frameIndices, scans);
    } finally {
      setActiveFrameType(previous);
    }
  }

  public SummedSpectrum sumScans(int startFrameIndex, int endFrameIndex, int scan) throws IOException, SQLException {
    return sumScans(startFrameIndex, endFrameIndex, scan, scan);
  }

  public SummedSpectrum sumScans(int frameIndex) throws IOException, SQLException {
    int scans = frameParametersAt(frameIndex).getScans();
    if (scans == 0) {
      int totalBins = globalParameters.getBins();
      return new SummedSpectrum(new double[totalBins + 1], new long[totalBins + 1], 0);
    }
    return sumScans(frameIndex, frameIndex, 0, scans - 1);
  }

  /**
   * Sum scans over a window of frames centered on midFrameIndex, clipped to the frames of the active type.
   */
  public SummedSpectrum sumScansRange(int midFrameIndex, int range, int startScan, int endScan)
      throws IOException, SQLException {
    checkFrameIndex(midFrameIndex);
    int startFrameIndex = Math.max(midFrameIndex - range, 0);
    int endFrameIndex = Math.min(midFrameIndex + range, frameNumbers.length - 1);
    return sumScans(startFrameIndex, endFrameIndex, startScan, endScan);
  }

  /* ----------------------------------------
   * Chromatograms
   */

  public double getTic(int frameIndex, int scan) throws SQLException {
    checkFrameIndex(frameIndex);
    return FrameScansTable.getTic(db, frameNumbers[frameIndex], scan);
  }

  public double[] getTic(int startFrameIndex, int endFrameIndex, int startScan, int endScan) throws SQLException {
    return sumByFrame(FrameScansTable.SummaryValue.TIC, startFrameIndex, endFrameIndex, startScan, endScan);
  }

  // Per-frame TIC over every scan.
  public double[] getTicByFrame(int startFrameIndex, int endFrameIndex) throws SQLException {
    return getTic(startFrameIndex, endFrameIndex, 0, 0);
  }

  public double[] getBpi(int startFrameIndex, int endFrameIndex, int startScan, int endScan) throws SQLException {
    return sumByFrame(FrameScansTable.SummaryValue.BPI, startFrameIndex, endFrameIndex, startScan, endScan);
  }

  // Scan bounds of (0, 0) mean every scan.
  private double[] sumByFrame(FrameScansTable.SummaryValue value, int startFrameIndex, int endFrameIndex,
                              int startScan, int endScan) throws SQLException {
    checkFrameRange(startFrameIndex, endFrameIndex);
    if (!(startScan == 0 && endScan == 0)) {
      checkScanRange(startScan, endScan);
    }

    double[] results = new double[endFrameIndex - startFrameIndex + 1];
    Map<Integer, Double> sums = FrameScansTable.sumByFrame(db, value,
        frameNumbers[startFrameIndex], frameNumbers[endFrameIndex], startScan, endScan);
    for (Map.Entry<Integer, Double> entry : sums.entrySet()) {
      int frameIndex = frameIndexOf(entry.getKey());
      if (frameIndex >= 0) {
        results[frameIndex - startFrameIndex] = entry.getValue();
      }
    }
    return results;
  }

  /**
   * @return (frame number, scan number, base peak intensity) for every stored scan, most intense first.
   */
  public List<Triple<Integer, Integer, Double>> getFrameAndScanListByDescendingIntensity() throws SQLException {
    return FrameScansTable.getScansByDescendingBpi(db);
  }

  /* ----------------------------------------
   * m/z targeted profiles
   */

  public double getBinClosestToMz(int frameIndex, double mz) throws SQLException, UnsupportedCalibrationException {
    FrameParameters fp = frameParametersAt(frameIndex);
    return fp.makeCalibrator().mzToBin(mz, globalParameters.getBinWidth(), globalParameters.getTofCorrectionTime(),
        fp.getResidualPolynomial());
  }

  private int[] getLowerUpperBins(int frameIndex, double targetMz, double toleranceInMz)
      throws SQLException, UnsupportedCalibrationException {
    double lowerBin = getBinClosestToMz(frameIndex, targetMz - toleranceInMz);
    double upperBin = getBinClosestToMz(frameIndex, targetMz + toleranceInMz);
    return new int[] {(int) Math.round(lowerBin), (int) Math.round(upperBin)};
  }

  private int[][][] getIntensityBlockForMz(int startFrameIndex, int endFrameIndex, int startScan, int endScan,
                                           double targetMz, double toleranceInMz)
      throws IOException, SQLException, UnsupportedCalibrationException {
    checkFrameRange(startFrameIndex, endFrameIndex);
    checkScanRange(startScan, endScan);
    int[] bins = getLowerUpperBins(startFrameIndex, targetMz, toleranceInMz);
    return getIntensityBlock(startFrameIndex, endFrameIndex, startScan, endScan, bins[0], bins[1]);
  }

  private static int sum(int[] values) {
    int total = 0;
    for (int v : values) {
      total += v;
    }
    return total;
  }

  /**
   * Sum the intensity within targetMz +/- toleranceInMz for every (frame, scan) pair in range.
   * @return An array indexed by [frame index - startFrameIndex][scan - startScan].
   */
  public int[][] getFramesAndScanIntensitiesForAGivenMz(int startFrameIndex, int endFrameIndex, int startScan,
                                                        int endScan, double targetMz, double toleranceInMz)
      throws IOException, SQLException, UnsupportedCalibrationException {
    int[][][] block = getIntensityBlockForMz(startFrameIndex, endFrameIndex, startScan, endScan,
        targetMz, toleranceInMz);
    int[][] results = new int[block.length][];
    for (int f = 0; f < block.length; f++) {
      results[f] = new int[block[f].length];
      for (int s = 0; s < block[f].length; s++) {
        results[f][s] = sum(block[f][s]);
      }
    }
    return results;
  }

  /**
   * @return The elution of an m/z over frames: one summed intensity per frame index from startFrameIndex.
   */
  public int[] getLcProfile(int startFrameIndex, int endFrameIndex, int startScan, int endScan,
                            double targetMz, double toleranceInMz)
      throws IOException, SQLException, UnsupportedCalibrationException {
    int[][] frameScan = getFramesAndScanIntensitiesForAGivenMz(startFrameIndex, endFrameIndex, startScan, endScan,
        targetMz, toleranceInMz);
    int[] results = new int[frameScan.length];
    for (int f = 0; f < frameScan.length; f++) {
      results[f] = sum(frameScan[f]);
    }
    return results;
  }

  /**
   * @return The drift profile of an m/z: one summed intensity per scan from startScan.
   */
  public int[] getDriftTimeProfile(int startFrameIndex, int endFrameIndex, int startScan, int endScan,
                                   double targetMz, double toleranceInMz)
      throws IOException, SQLException, UnsupportedCalibrationException {
    int[][] frameScan = getFramesAndScanIntensitiesForAGivenMz(startFrameIndex, endFrameIndex, startScan, endScan,
        targetMz, toleranceInMz);
    int[] results = new int[endScan - startScan + 1];
    for (int[] scans : frameScan) {
      for (int s = 0; s < scans.length; s++) {
        results[s] += scans[s];
      }
    }
    return results;
  }

  /**
   * @return (frame index, scan, summed intensity) for every frame and scan in range, frame-major.
   */
  public List<Triple<Integer, Integer, Integer>> get3dElutionProfile(
      int startFrameIndex, int endFrameIndex, int startScan, int endScan, double targetMz, double toleranceInMz)
      throws IOException, SQLException, UnsupportedCalibrationException {
    int[][] frameScan = getFramesAndScanIntensitiesForAGivenMz(startFrameIndex, endFrameIndex, startScan, endScan,
        targetMz, toleranceInMz);
    List<Triple<Integer, Integer, Integer>> results = new ArrayList<>(frameScan.length * (endScan - startScan + 1));
    for (int f = 0; f < frameScan.length; f++) {
      for (int s = 0; s < frameScan[f].length; s++) {
        results.add(Triple.of(startFrameIndex + f, startScan + s, frameScan[f][s]));
      }
    }
    return results;
  }

  /* ----------------------------------------
   * Metadata
   */

  public boolean hasMsMsData() throws SQLException {
    FrameType previous = activeFrameType;
    int fragmentationFrames = setActiveFrameType(FrameType.MS_MS);
    setActiveFrameType(previous);
    return fragmentationFrames > 0;
  }

  public boolean tableExists(String tableName) throws SQLException {
    return db.tableExists(tableName);
  }

  public List<String> getCalibrationTableNames() throws SQLException {
    List<String> results = new ArrayList<>();
    for (String name : db.getTableNames()) {
      if (name.contains(CALIBRATION_TABLE_MARKER)) {
        results.add(name);
      }
    }
    return Collections.unmodifiableList(results);
  }

  public byte[] getFileBytesFromTable(String tableName) throws SQLException {
    return db.getFileBytesFromTable(tableName);
  }

  /**
   * Read one bin from the bin-centric table.
   * @param bin The m/z bin.
   * @return Every non-zero (frame, scan, intensity) point of the bin.
   * @throws IllegalStateException If the file has no bin-centric table.
   */
  public List<BinPoint> getBinCentricIntensities(int bin) throws SQLException {
    if (binCentricTableReader == null) {
      BinCentricTableReader binReader = new BinCentricTableReader(db);
      if (!binReader.isAvailable()) {
        throw new IllegalStateException(String.format("%s has no bin-centric table", db.getFile()));
      }
      binCentricTableReader = binReader;
    }
    return binCentricTableReader.readBin(bin);
  }

  public int getMaxScansPerFrame() throws SQLException {
    return FrameParametersTable.getMaxScans(db);
  }

  protected UimfDB getDb() {
    return db;
  }

  @Override
  public void close() throws SQLException {
    db.close();
  }
}
