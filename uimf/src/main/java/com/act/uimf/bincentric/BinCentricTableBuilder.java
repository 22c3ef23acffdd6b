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

package com.act.uimf.bincentric;

import com.act.uimf.UimfConfig;
import com.act.uimf.UimfDataReader;
import com.act.uimf.UimfStatusListener;
import com.act.uimf.db.BinIntensitiesTable;
import com.act.uimf.db.FrameParametersTable;
import com.act.uimf.db.UimfDB;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;

import java.io.File;
import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Adds a Bin_Intensities table to a UIMF file: the same data as Frame_Scans, transposed so that every m/z bin's
 * intensities across all frames and scans sit in one row.
 *
 * The transpose runs in three phases over a scratch store:
 * <ol>
 *   <li>Scatter: decode every scan and route each (bin, frame, scan, intensity) point to the bucket holding its bin.
 *   <li>Index: index each bucket on (bin, frame, scan).
 *   <li>Gather: for each bin, read its points in (frame, scan) order, encode them and insert one row.
 * </ol>
 * Progress is reported as 0-37% for scatter, 37-67% for index and 67-100% for gather.  A builder runs once; a failure
 * leaves it in the FAILED phase and a new builder must start over.
 */
public class BinCentricTableBuilder {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BinCentricTableBuilder.class);

  public static final String TEMPORARY_FILE_SUFFIX = "_temporary.db3";

  static final double SCATTER_END_PERCENT = 37.0;
  static final double INDEX_END_PERCENT = SCATTER_END_PERCENT + 30.0;
  static final double GATHER_END_PERCENT = 100.0;

  public enum Phase {
    NOT_STARTED,
    SCATTER,
    INDEX,
    GATHER,
    DONE,
    FAILED,
  }

  private final UimfDB db;
  private final UimfDataReader reader;
  private final UimfConfig config;
  private final UimfStatusListener listener;

  private Phase phase = Phase.NOT_STARTED;
  private double lastPercentComplete = 0.0;

  /**
   * @param db The file to add the table to.
   * @param reader A reader over the same file.
   * @param config Bucket size, progress interval and intermediate store type.
   * @param listener Receives progress; may be null.
   */
  public BinCentricTableBuilder(UimfDB db, UimfDataReader reader, UimfConfig config, UimfStatusListener listener) {
    this.db = db;
    this.reader = reader;
    this.config = config;
    this.listener = listener == null ? UimfStatusListener.NOOP : listener;
  }

  public Phase getPhase() {
    return phase;
  }

  /**
   * Work out where the scratch store for a source file goes: the source's name with its .UIMF/.uimf extension
   * replaced, in the working directory.
   * @throws IOException If that path is the source file itself.
   */
  public static File getTemporaryStoreFile(File sourceFile, File workingDirectory) throws IOException {
    String tempName = sourceFile.getName()
        .replace(".UIMF", TEMPORARY_FILE_SUFFIX)
        .replace(".uimf", TEMPORARY_FILE_SUFFIX);
    File tempFile = new File(workingDirectory, tempName);
    if (tempFile.getAbsolutePath().equalsIgnoreCase(sourceFile.getAbsolutePath())) {
      throw new IOException(String.format(
          "Cannot add bin-centric tables, temporary SqLite file has the same name as the source SqLite file: %s",
          sourceFile.getAbsolutePath()));
    }
    return tempFile;
  }

  // Here to allow tests to substitute the scratch store.
  protected IntermediateBinStore makeStore(File location, int numBins) {
    switch (config.getIntermediateStore()) {
      case ROCKSDB:
        return new RocksDBIntermediateBinStore(location, config.getBucketSize(), numBins);
      case SQLITE:
        return new SQLiteIntermediateBinStore(location, config.getBucketSize(), numBins);
      default:
        throw new RuntimeException(String.format("Unknown intermediate store type %s", config.getIntermediateStore()));
    }
  }

  /**
   * Build the bin-centric table.
   * @param workingDirectory Where to put the scratch store.
   * @throws IOException If the preconditions fail or the scratch store can't be prepared.
   * @throws SQLException If either database fails.
   */
  public void build(File workingDirectory) throws IOException, SQLException {
    if (phase != Phase.NOT_STARTED) {
      throw new IllegalStateException(String.format("Cannot build from phase %s; builders run only once", phase));
    }

    File tempFile = getTemporaryStoreFile(db.getFile(), workingDirectory);
    if (BinIntensitiesTable.exists(db)) {
      throw new IOException(String.format("%s already has a %s table",
          db.getFile().getAbsolutePath(), BinIntensitiesTable.TABLE_NAME));
    }

    DateTime start = DateTime.now();
    int numBins = reader.getGlobalParameters().getBins();
    LOGGER.info("Building %s for %s (%d bins) using %s", BinIntensitiesTable.TABLE_NAME,
        db.getFile().getAbsolutePath(), numBins, tempFile.getAbsolutePath());

    if (tempFile.exists()) {
      LOGGER.info("Removing stale intermediate store at %s", tempFile.getAbsolutePath());
      FileUtils.forceDelete(tempFile);
    }

    IntermediateBinStore store = makeStore(tempFile, numBins);
    try {
      store.create();
      scatter(store);
      index(store);
      gather(store, numBins);
      transition(Phase.GATHER, Phase.DONE);
      reportProgress(GATHER_END_PERCENT, "Done");
    } catch (IOException | SQLException | RuntimeException e) {
      LOGGER.error("Bin-centric table construction failed in phase %s: %s", phase, e.getMessage());
      phase = Phase.FAILED;
      throw e;
    } finally {
      cleanUp(store);
    }

    DateTime end = DateTime.now();
    LOGGER.info("Bin-centric table construction completed in %dms", end.getMillis() - start.getMillis());
  }

  private void transition(Phase expected, Phase next) {
    if (phase != expected) {
      String msg = String.format("Cannot move to phase %s from phase %s (expected %s)", next, phase, expected);
      LOGGER.error(msg);
      throw new IllegalStateException(msg);
    }
    phase = next;
  }

  void scatter(IntermediateBinStore store) throws IOException, SQLException {
    transition(Phase.NOT_STARTED, Phase.SCATTER);
    DateTime start = DateTime.now();

    int[] frameNumbers = FrameParametersTable.getAllFrameNumbers(db);
    int numFrames = frameNumbers.length;
    long points = 0;

    store.beginScatter();
    for (int i = 0; i < numFrames; i++) {
      int frameNum = frameNumbers[i];
      List<SortedMap<Integer, Integer>> scans = reader.getIntensityBlockOfFrame(frameNum);
      for (int scan = 0; scan < scans.size(); scan++) {
        for (Map.Entry<Integer, Integer> entry : scans.get(scan).entrySet()) {
          store.insert(entry.getKey(), frameNum, scan, entry.getValue());
          points++;
        }
      }
      reportProgress((i + 1) / (double) numFrames * SCATTER_END_PERCENT,
          String.format("Processing Frame: %d / %d", i + 1, numFrames));
    }
    store.commitScatter();

    LOGGER.info("Scattered %d points from %d frames in %dms", points, numFrames,
        DateTime.now().getMillis() - start.getMillis());
  }

  void index(IntermediateBinStore store) throws SQLException {
    transition(Phase.SCATTER, Phase.INDEX);
    DateTime start = DateTime.now();

    int numBins = reader.getGlobalParameters().getBins();
    int bucketCount = store.getBucketCount();
    for (int bucket = 0; bucket < bucketCount; bucket++) {
      store.indexBucket(bucket);
      if (numBins > 0) {
        int bin = Math.min(bucket * config.getBucketSize(), numBins);
        reportProgress(SCATTER_END_PERCENT + bin / (double) numBins * (INDEX_END_PERCENT - SCATTER_END_PERCENT),
            String.format("Creating indices, Bin: %d / %d", bin, numBins));
      }
    }

    LOGGER.info("Indexed %d buckets in %dms", bucketCount, DateTime.now().getMillis() - start.getMillis());
  }

  void gather(IntermediateBinStore store, int numBins) throws SQLException {
    transition(Phase.INDEX, Phase.GATHER);
    DateTime start = DateTime.now();

    BinIntensityCodec codec = new BinIntensityCodec(reader.getMaxScansPerFrame());
    long progressIntervalMs = config.getProgressIntervalMs();
    long lastProgressMillis = start.getMillis();
    int rows = 0;

    BinIntensitiesTable.createTable(db);
    try (PreparedStatement insert = db.prepareStatement(BinIntensitiesTable.QUERY_INSERT_BIN)) {
      for (int bin = 0; bin <= numBins; bin++) {
        byte[] encoded = codec.encode(store.readBin(bin));
        if (encoded != null) {
          BinIntensitiesTable.insertBin(insert, bin, encoded);
          rows++;
        }

        long now = DateTime.now().getMillis();
        if (now - lastProgressMillis >= progressIntervalMs && numBins > 0) {
          lastProgressMillis = now;
          reportProgress(INDEX_END_PERCENT + bin / (double) numBins * (GATHER_END_PERCENT - INDEX_END_PERCENT),
              String.format("Processing Bin: %d / %d", bin, numBins));
        }
      }
    }
    BinIntensitiesTable.createIndex(db);

    LOGGER.info("Wrote %d bin rows in %dms", rows, DateTime.now().getMillis() - start.getMillis());
  }

  private void reportProgress(double percentComplete, String message) {
    // Never let rounding move the bar backwards.
    double percent = Math.min(GATHER_END_PERCENT, Math.max(lastPercentComplete, percentComplete));
    lastPercentComplete = percent;
    LOGGER.debug("%.1f%%: %s", percent, message);
    listener.onProgress(percent, message);
    listener.onMessage(message);
  }

  private void cleanUp(IntermediateBinStore store) {
    try {
      store.close();
    } catch (SQLException e) {
      LOGGER.warn("Unable to close intermediate store at %s: %s", store.getLocation().getAbsolutePath(),
          e.getMessage());
    }
    try {
      store.delete();
    } catch (IOException e) {
      LOGGER.warn("Unable to delete intermediate store at %s: %s", store.getLocation().getAbsolutePath(),
          e.getMessage());
    }
  }
}
