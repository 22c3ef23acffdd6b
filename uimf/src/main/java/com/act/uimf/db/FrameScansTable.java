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

package com.act.uimf.db;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class FrameScansTable {
  public static final String TABLE_NAME = "Frame_Scans";

  private enum DB_FIELD implements DBFieldEnumeration {
    FRAME_NUM(1, 1, "FrameNum", "INT(4) NOT NULL"),
    SCAN_NUM(2, 2, "ScanNum", "INT(2) NOT NULL"),
    NON_ZERO_COUNT(3, 3, "NonZeroCount", "INT(4) NOT NULL"),
    BPI(4, 4, "BPI", "DOUBLE NOT NULL"),
    BPI_MZ(5, 5, "BPI_MZ", "DOUBLE NOT NULL"),
    TIC(6, 6, "TIC", "DOUBLE NOT NULL"),
    INTENSITIES(7, 7, "Intensities", "BLOB"),
    ;

    private final int offset;
    private final int insertUpdateOffset;
    private final String fieldName;
    private final String columnType;

    DB_FIELD(int offset, int insertUpdateOffset, String fieldName, String columnType) {
      this.offset = offset;
      this.insertUpdateOffset = insertUpdateOffset;
      this.fieldName = fieldName;
      this.columnType = columnType;
    }

    @Override
    public int getOffset() {
      return offset;
    }

    @Override
    public int getInsertUpdateOffset() {
      return insertUpdateOffset;
    }

    @Override
    public String getFieldName() {
      return fieldName;
    }

    public String getColumnType() {
      return columnType;
    }

    @Override
    public String toString() {
      return this.fieldName;
    }

    public static String[] names() {
      DB_FIELD[] values = DB_FIELD.values();
      String[] names = new String[values.length];
      for (int i = 0; i < values.length; i++) {
        names[i] = values[i].getFieldName();
      }
      return names;
    }
  }
  protected static final List<String> ALL_FIELDS = Collections.unmodifiableList(Arrays.asList(DB_FIELD.names()));

  // The two per-scan summary values that can be totalled per frame.
  public enum SummaryValue {
    TIC("TIC"),
    BPI("BPI"),
    ;

    private final String columnName;

    SummaryValue(String columnName) {
      this.columnName = columnName;
    }

    public String getColumnName() {
      return columnName;
    }
  }

  public static final String QUERY_CREATE_TABLE;
  static {
    List<String> columnDefs = new ArrayList<>(DB_FIELD.values().length);
    for (DB_FIELD field : DB_FIELD.values()) {
      columnDefs.add(String.format("%s %s", field.getFieldName(), field.getColumnType()));
    }
    QUERY_CREATE_TABLE = StringUtils.join(new String[]{
        "CREATE TABLE", TABLE_NAME, "(", StringUtils.join(columnDefs, ", "), ")"
    }, " ");
  }

  public static final String QUERY_CREATE_INDEX = StringUtils.join(new String[]{
      "CREATE UNIQUE INDEX pk_index ON", TABLE_NAME, "(FrameNum, ScanNum)",
  }, " ");

  // Select
  public static final String QUERY_GET_SCANS_IN_RANGE = StringUtils.join(new String[]{
      "SELECT", StringUtils.join(ALL_FIELDS, ", "),
      "FROM", TABLE_NAME,
      "WHERE FrameNum >= ? AND FrameNum <= ? AND ScanNum >= ? AND ScanNum <= ?",
      "ORDER BY FrameNum, ScanNum",
  }, " ");

  public static final String QUERY_GET_SCANS_FOR_FRAME = StringUtils.join(new String[]{
      "SELECT", StringUtils.join(ALL_FIELDS, ", "),
      "FROM", TABLE_NAME,
      "WHERE FrameNum = ?",
      "ORDER BY ScanNum",
  }, " ");

  public static final String QUERY_GET_SCAN = StringUtils.join(new String[]{
      "SELECT", StringUtils.join(ALL_FIELDS, ", "),
      "FROM", TABLE_NAME,
      "WHERE FrameNum = ? AND ScanNum = ?",
  }, " ");

  public static final String QUERY_GET_NON_ZERO_COUNT = StringUtils.join(new String[]{
      "SELECT NonZeroCount FROM", TABLE_NAME,
      "WHERE FrameNum = ? AND ScanNum = ?",
  }, " ");

  public static final String QUERY_SUM_NON_ZERO_COUNT_FOR_FRAME = StringUtils.join(new String[]{
      "SELECT SUM(NonZeroCount) FROM", TABLE_NAME,
      "WHERE FrameNum = ?",
  }, " ");

  public static final String QUERY_GET_TIC = StringUtils.join(new String[]{
      "SELECT TIC FROM", TABLE_NAME,
      "WHERE FrameNum = ? AND ScanNum = ?",
  }, " ");

  public static final String QUERY_GET_SCANS_BY_DESCENDING_BPI = StringUtils.join(new String[]{
      "SELECT FrameNum, ScanNum, BPI FROM", TABLE_NAME,
      "ORDER BY BPI DESC",
  }, " ");

  // Insert
  public static final String QUERY_INSERT_SCAN = StringUtils.join(new String[]{
      "INSERT INTO", TABLE_NAME, "(", StringUtils.join(ALL_FIELDS, ", "), ") VALUES (",
      StringUtils.repeat("?", ", ", ALL_FIELDS.size()),
      ")"
  }, " ");

  /**
   * One row of Frame_Scans: a single drift scan of a single frame.
   */
  public static class ScanRecord {
    private final int frameNum;
    private final int scanNum;
    private final int nonZeroCount;
    private final double bpi;
    private final double bpiMz;
    private final double tic;
    private final byte[] intensities;

    public ScanRecord(int frameNum, int scanNum, int nonZeroCount, double bpi, double bpiMz, double tic,
                      byte[] intensities) {
      this.frameNum = frameNum;
      this.scanNum = scanNum;
      this.nonZeroCount = nonZeroCount;
      this.bpi = bpi;
      this.bpiMz = bpiMz;
      this.tic = tic;
      this.intensities = intensities;
    }

    public int getFrameNum() {
      return frameNum;
    }

    public int getScanNum() {
      return scanNum;
    }

    public int getNonZeroCount() {
      return nonZeroCount;
    }

    public double getBpi() {
      return bpi;
    }

    public double getBpiMz() {
      return bpiMz;
    }

    public double getTic() {
      return tic;
    }

    public byte[] getIntensities() {
      return intensities;
    }
  }

  public static void createTable(UimfDB db) throws SQLException {
    db.execute(QUERY_CREATE_TABLE);
    db.execute(QUERY_CREATE_INDEX);
  }

  protected static ScanRecord fromResultSet(ResultSet resultSet) throws SQLException {
    return new ScanRecord(
        resultSet.getInt(DB_FIELD.FRAME_NUM.getOffset()),
        resultSet.getInt(DB_FIELD.SCAN_NUM.getOffset()),
        resultSet.getInt(DB_FIELD.NON_ZERO_COUNT.getOffset()),
        resultSet.getDouble(DB_FIELD.BPI.getOffset()),
        resultSet.getDouble(DB_FIELD.BPI_MZ.getOffset()),
        resultSet.getDouble(DB_FIELD.TIC.getOffset()),
        resultSet.getBytes(DB_FIELD.INTENSITIES.getOffset())
    );
  }

  protected static List<ScanRecord> allFromResultSet(ResultSet resultSet) throws SQLException {
    List<ScanRecord> results = new ArrayList<>();
    while (resultSet.next()) {
      results.add(fromResultSet(resultSet));
    }
    return results;
  }

  public static ScanRecord getScanRecord(UimfDB db, int frameNum, int scanNum) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_SCAN)) {
      stmt.setInt(1, frameNum);
      stmt.setInt(2, scanNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next() ? fromResultSet(resultSet) : null;
      }
    }
  }

  /**
   * Fetch every scan whose frame and scan numbers fall in the given inclusive ranges.  Frame numbers here are physical
   * numbers, so the result may include frames of any type.
   */
  public static List<ScanRecord> getScanRecordsInRange(UimfDB db, int startFrameNum, int endFrameNum,
                                                       int startScan, int endScan) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_SCANS_IN_RANGE)) {
      stmt.setInt(1, startFrameNum);
      stmt.setInt(2, endFrameNum);
      stmt.setInt(3, startScan);
      stmt.setInt(4, endScan);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return allFromResultSet(resultSet);
      }
    }
  }

  public static List<ScanRecord> getScanRecordsForFrame(UimfDB db, int frameNum) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_SCANS_FOR_FRAME)) {
      stmt.setInt(1, frameNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return allFromResultSet(resultSet);
      }
    }
  }

  /**
   * Fetch the listed scans of one frame.  Scan numbers with no stored row are ignored.
   * @param db The file to read.
   * @param frameNum The physical frame number.
   * @param scanNums The scans to fetch, in any order; duplicates are fetched once.
   * @return The stored scans in scan number order.
   * @throws SQLException
   */
  public static List<ScanRecord> getScanRecordsForFrameAndScans(UimfDB db, int frameNum, int[] scanNums)
      throws SQLException {
    if (scanNums.length == 0) {
      return new ArrayList<>();
    }

    String query = StringUtils.join(new String[]{
        "SELECT", StringUtils.join(ALL_FIELDS, ", "),
        "FROM", TABLE_NAME,
        "WHERE FrameNum = ? AND ScanNum IN (", StringUtils.repeat("?", ", ", scanNums.length), ")",
        "ORDER BY ScanNum",
    }, " ");
    try (PreparedStatement stmt = db.prepareStatement(query)) {
      stmt.setInt(1, frameNum);
      for (int i = 0; i < scanNums.length; i++) {
        stmt.setInt(i + 2, scanNums[i]);
      }
      try (ResultSet resultSet = stmt.executeQuery()) {
        return allFromResultSet(resultSet);
      }
    }
  }

  public static int getNonZeroCount(UimfDB db, int frameNum, int scanNum) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_NON_ZERO_COUNT)) {
      stmt.setInt(1, frameNum);
      stmt.setInt(2, scanNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next() ? resultSet.getInt(1) : 0;
      }
    }
  }

  public static int getNonZeroCountForFrame(UimfDB db, int frameNum) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_SUM_NON_ZERO_COUNT_FOR_FRAME)) {
      stmt.setInt(1, frameNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        // SUM over zero rows is NULL, which getInt reads as 0.
        return resultSet.next() ? resultSet.getInt(1) : 0;
      }
    }
  }

  public static double getTic(UimfDB db, int frameNum, int scanNum) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_TIC)) {
      stmt.setInt(1, frameNum);
      stmt.setInt(2, scanNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next() ? resultSet.getDouble(1) : 0.0;
      }
    }
  }

  /**
   * Total one of the per-scan summary columns over each frame in a range.
   * @param db The file to read.
   * @param value Which summary column to total.
   * @param startFrameNum The first physical frame number, inclusive.
   * @param endFrameNum The last physical frame number, inclusive.
   * @param startScan The first scan, inclusive.
   * @param endScan The last scan, inclusive.  When both scan bounds are zero every scan is included.
   * @return A map of frame number to total, in frame number order.
   * @throws SQLException
   */
  public static Map<Integer, Double> sumByFrame(UimfDB db, SummaryValue value, int startFrameNum, int endFrameNum,
                                                int startScan, int endScan) throws SQLException {
    boolean allScans = startScan == 0 && endScan == 0;
    String query = StringUtils.join(new String[]{
        "SELECT FrameNum, SUM(", value.getColumnName(), ") AS Value FROM", TABLE_NAME,
        "WHERE FrameNum >= ? AND FrameNum <= ?",
        allScans ? "" : "AND ScanNum >= ? AND ScanNum <= ?",
        "GROUP BY FrameNum ORDER BY FrameNum",
    }, " ");

    Map<Integer, Double> results = new TreeMap<>();
    try (PreparedStatement stmt = db.prepareStatement(query)) {
      stmt.setInt(1, startFrameNum);
      stmt.setInt(2, endFrameNum);
      if (!allScans) {
        stmt.setInt(3, startScan);
        stmt.setInt(4, endScan);
      }
      try (ResultSet resultSet = stmt.executeQuery()) {
        while (resultSet.next()) {
          results.put(resultSet.getInt(1), resultSet.getDouble(2));
        }
      }
    }
    return results;
  }

  public static List<Triple<Integer, Integer, Double>> getScansByDescendingBpi(UimfDB db) throws SQLException {
    List<Triple<Integer, Integer, Double>> results = new ArrayList<>();
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_SCANS_BY_DESCENDING_BPI);
         ResultSet resultSet = stmt.executeQuery()) {
      while (resultSet.next()) {
        results.add(Triple.of(resultSet.getInt(1), resultSet.getInt(2), resultSet.getDouble(3)));
      }
    }
    return results;
  }

  public static void insertScan(UimfDB db, ScanRecord record) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_INSERT_SCAN)) {
      stmt.setInt(DB_FIELD.FRAME_NUM.getInsertUpdateOffset(), record.getFrameNum());
      stmt.setInt(DB_FIELD.SCAN_NUM.getInsertUpdateOffset(), record.getScanNum());
      stmt.setInt(DB_FIELD.NON_ZERO_COUNT.getInsertUpdateOffset(), record.getNonZeroCount());
      stmt.setDouble(DB_FIELD.BPI.getInsertUpdateOffset(), record.getBpi());
      stmt.setDouble(DB_FIELD.BPI_MZ.getInsertUpdateOffset(), record.getBpiMz());
      stmt.setDouble(DB_FIELD.TIC.getInsertUpdateOffset(), record.getTic());
      if (record.getIntensities() != null) {
        stmt.setBytes(DB_FIELD.INTENSITIES.getInsertUpdateOffset(), record.getIntensities());
      } else {
        stmt.setNull(DB_FIELD.INTENSITIES.getInsertUpdateOffset(), Types.BLOB);
      }
      stmt.executeUpdate();
    }
  }
}
