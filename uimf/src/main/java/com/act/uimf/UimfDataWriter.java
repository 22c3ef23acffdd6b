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

import com.act.uimf.bincentric.BinCentricTableBuilder;
import com.act.uimf.calibration.MzCalibrator;
import com.act.uimf.calibration.ResidualPolynomial;
import com.act.uimf.codec.ElementWidth;
import com.act.uimf.codec.EncodedSpectrum;
import com.act.uimf.codec.IntensityConverter;
import com.act.uimf.db.FrameParametersTable;
import com.act.uimf.db.FrameScansTable;
import com.act.uimf.db.GlobalParametersTable;
import com.act.uimf.db.UimfDB;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;

/**
 * Creates UIMF files and appends parameters and spectra to them.  Callers that write many scans should wrap them in
 * beginTransaction()/commit(); SQLite commits every statement on its own otherwise.
 */
public class UimfDataWriter implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(UimfDataWriter.class);

  private final UimfDB db;
  private final UimfConfig config;
  private UimfStatusListener listener = UimfStatusListener.NOOP;
  private IntensityConverter converter;
  private GlobalParameters globalParameters;

  public static UimfDataWriter open(File file) throws IOException, SQLException {
    return open(file, UimfConfig.loadDefault());
  }

  public static UimfDataWriter open(File file, UimfConfig config) throws SQLException {
    return new UimfDataWriter(new UimfDB().connectToDB(file), config);
  }

  public UimfDataWriter(UimfDB db, UimfConfig config) {
    this.db = db;
    this.config = config;
    this.converter = new IntensityConverter(config.getElementWidth());
  }

  public void setStatusListener(UimfStatusListener listener) {
    this.listener = listener == null ? UimfStatusListener.NOOP : listener;
  }

  public UimfDB getDb() {
    return db;
  }

  /**
   * Create the three core tables in an empty file.
   * @param elementWidth The element width used to encode every spectrum written through this writer.
   */
  public void createTables(ElementWidth elementWidth) throws SQLException {
    this.converter = new IntensityConverter(elementWidth);
    GlobalParametersTable.createTable(db);
    FrameParametersTable.createTable(db);
    FrameScansTable.createTable(db);
    LOGGER.info("Created UIMF tables in %s with %s spectra", db.getFile(), elementWidth);
  }

  public void createTables() throws SQLException {
    createTables(config.getElementWidth());
  }

  /**
   * Store the dataset parameters.  The element width recorded with them is always the one this writer encodes with,
   * so readers can decode the file whatever their own configuration says.
   */
  public void insertGlobalParameters(GlobalParameters globalParameters) throws SQLException {
    GlobalParameters stored = new GlobalParameters(globalParameters);
    stored.setElementWidth(converter.getWidth());
    GlobalParametersTable.insertGlobalParameters(db, stored);
    this.globalParameters = stored;
  }

  public void insertFrameParameters(FrameParameters frameParameters) throws SQLException {
    FrameParametersTable.insertFrameParameters(db, frameParameters);
  }

  /**
   * Encode and store one scan.  Scans with no non-zero intensities are not stored.
   * @param frameNum The physical frame number.
   * @param scanNum The drift scan number.
   * @param intensities One intensity per bin, starting at bin 0.
   * @param binWidth The bin width in nanoseconds, used to place the base peak on the m/z axis.
   * @param calibrator The frame's calibration.
   * @return The number of non-zero intensities stored.
   */
  public int insertScan(int frameNum, int scanNum, int[] intensities, double binWidth, MzCalibrator calibrator)
      throws SQLException {
    EncodedSpectrum encoded = converter.encode(intensities);
    if (encoded.isEmpty()) {
      return 0;
    }

    double correctionTime = globalParameters == null ? 0.0 : globalParameters.getTofCorrectionTime();
    double bpiMz = calibrator.binToMz(encoded.getBasePeakBin(), binWidth, correctionTime, ResidualPolynomial.ZERO);
    FrameScansTable.insertScan(db, new FrameScansTable.ScanRecord(frameNum, scanNum, encoded.getNonZeroCount(),
        encoded.getBasePeakIntensity(), bpiMz, encoded.getTotalIonCurrent(), encoded.getPayload()));
    return encoded.getNonZeroCount();
  }

  public void beginTransaction() throws SQLException {
    db.beginTransaction();
  }

  public void commit() throws SQLException {
    db.commit();
  }

  public void rollback() throws SQLException {
    db.rollback();
  }

  /**
   * Add the Bin_Intensities table to this file.
   * @param workingDirectory Where the scratch store goes; null means the configured working directory.
   */
  public void createBinCentricTables(File workingDirectory) throws IOException, SQLException {
    File directory = workingDirectory == null ? config.getWorkingDirectoryFile() : workingDirectory;
    // The reader shares this writer's connection, so it must not be closed here.
    UimfConfig readConfig = config.withElementWidth(converter.getWidth());
    UimfDataReader reader = new UimfDataReader(db, readConfig, listener);
    new BinCentricTableBuilder(db, reader, readConfig, listener).build(directory);
  }

  public void createBinCentricTables() throws IOException, SQLException {
    createBinCentricTables(null);
  }

  @Override
  public void close() throws SQLException {
    db.close();
  }
}
