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

import com.act.uimf.db.UimfDB;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps each bucket of bins in its own table of a scratch SQLite file, named for the bins it covers, e.g.
 * Bin_Intensities_0_199.
 */
public class SQLiteIntermediateBinStore implements IntermediateBinStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SQLiteIntermediateBinStore.class);

  private static final String TABLE_PREFIX = "Bin_Intensities_";

  private final File location;
  private final int bucketSize;
  private final int numBins;

  private UimfDB db;
  private PreparedStatement[] insertStatements;

  public SQLiteIntermediateBinStore(File location, int bucketSize, int numBins) {
    this.location = location;
    this.bucketSize = bucketSize;
    this.numBins = numBins;
  }

  @Override
  public File getLocation() {
    return location;
  }

  @Override
  public int getBucketCount() {
    return numBins / bucketSize + 1;
  }

  String tableName(int bucket) {
    int minBin = bucket * bucketSize;
    int maxBin = minBin + bucketSize - 1;
    return String.format("%s%d_%d", TABLE_PREFIX, minBin, maxBin);
  }

  private int bucketOf(int bin) {
    return bin / bucketSize;
  }

  @Override
  public void create() throws SQLException {
    db = new UimfDB().connectToDB(location);
    // Scratch data: a crash means starting over anyway.
    db.execute("PRAGMA synchronous = OFF");
    db.execute("PRAGMA journal_mode = OFF");

    for (int bucket = 0; bucket < getBucketCount(); bucket++) {
      db.execute(StringUtils.join(new String[]{
          "CREATE TABLE", tableName(bucket),
          "(MZ_BIN int(11), SCAN_LC int(11), SCAN_IMS int(11), INTENSITY int(11))",
      }, " "));
    }
    LOGGER.debug("Created %d bucket tables in %s", getBucketCount(), location.getAbsolutePath());
  }

  @Override
  public void beginScatter() throws SQLException {
    insertStatements = new PreparedStatement[getBucketCount()];
    for (int bucket = 0; bucket < insertStatements.length; bucket++) {
      insertStatements[bucket] = db.prepareStatement(StringUtils.join(new String[]{
          "INSERT INTO", tableName(bucket),
          "(MZ_BIN, SCAN_LC, SCAN_IMS, INTENSITY) VALUES (?, ?, ?, ?)",
      }, " "));
    }
    db.beginTransaction();
  }

  @Override
  public void insert(int bin, int frameNum, int scanNum, int intensity) throws SQLException {
    PreparedStatement stmt = insertStatements[bucketOf(bin)];
    stmt.setInt(1, bin);
    stmt.setInt(2, frameNum);
    stmt.setInt(3, scanNum);
    stmt.setInt(4, intensity);
    stmt.executeUpdate();
  }

  @Override
  public void commitScatter() throws SQLException {
    db.commit();
    closeInsertStatements();
  }

  private void closeInsertStatements() throws SQLException {
    if (insertStatements == null) {
      return;
    }
    for (PreparedStatement stmt : insertStatements) {
      if (stmt != null) {
        stmt.close();
      }
    }
    insertStatements = null;
  }

  @Override
  public void indexBucket(int bucket) throws SQLException {
    String table = tableName(bucket);
    db.execute(StringUtils.join(new String[]{
        "CREATE INDEX", table + "_MZ_BIN_SCAN_LC_SCAN_IMS_IDX",
        "ON", table, "(MZ_BIN, SCAN_LC, SCAN_IMS)",
    }, " "));
  }

  @Override
  public List<BinPoint> readBin(int bin) throws SQLException {
    String query = StringUtils.join(new String[]{
        "SELECT SCAN_LC, SCAN_IMS, INTENSITY FROM", tableName(bucketOf(bin)),
        "WHERE MZ_BIN = ?",
        "ORDER BY SCAN_LC, SCAN_IMS",
    }, " ");

    List<BinPoint> points = new ArrayList<>();
    try (PreparedStatement stmt = db.prepareStatement(query)) {
      stmt.setInt(1, bin);
      try (ResultSet resultSet = stmt.executeQuery()) {
        while (resultSet.next()) {
          points.add(new BinPoint(resultSet.getInt(1), resultSet.getInt(2), resultSet.getInt(3)));
        }
      }
    }
    return points;
  }

  @Override
  public void close() throws SQLException {
    if (db == null) {
      return;
    }
    try {
      db.rollback();
      closeInsertStatements();
    } finally {
      db.close();
      db = null;
    }
  }

  @Override
  public void delete() throws IOException {
    if (location.exists()) {
      FileUtils.forceDelete(location);
    }
  }
}
