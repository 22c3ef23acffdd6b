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

import com.act.uimf.GlobalParameters;
import com.act.uimf.codec.ElementWidth;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class GlobalParametersTable {
  public static final String TABLE_NAME = "Global_Parameters";

  private enum DB_FIELD implements DBFieldEnumeration {
    DATE_STARTED(1, 1, "DateStarted", "STRING", false),
    NUM_FRAMES(2, 2, "NumFrames", "INT(4)", false),
    TIME_OFFSET(3, 3, "TimeOffset", "INT(4)", false),
    BIN_WIDTH(4, 4, "BinWidth", "DOUBLE", false),
    BINS(5, 5, "Bins", "INT(4)", false),
    TOF_CORRECTION_TIME(6, 6, "TOFCorrectionTime", "FLOAT", true),
    FRAME_DATA_BLOB_VERSION(7, 7, "FrameDataBlobVersion", "FLOAT", false),
    SCAN_DATA_BLOB_VERSION(8, 8, "ScanDataBlobVersion", "FLOAT", false),
    TOF_INTENSITY_TYPE(9, 9, "TOFIntensityType", "STRING", false),
    DATASET_TYPE(10, 10, "DatasetType", "STRING", false),
    PRESCAN_TOF_PULSES(11, 11, "Prescan_TOFPulses", "INT(4)", false),
    PRESCAN_ACCUMULATIONS(12, 12, "Prescan_Accumulations", "INT(4)", false),
    PRESCAN_TIC_THRESHOLD(13, 13, "Prescan_TICThreshold", "INT(4)", false),
    PRESCAN_CONTINUOUS(14, 14, "Prescan_Continuous", "BOOLEAN", false),
    PRESCAN_PROFILE(15, 15, "Prescan_Profile", "STRING", false),
    INSTRUMENT_NAME(16, 16, "Instrument_Name", "TEXT", true),
    // Bytes per run-length element of every Frame_Scans payload.
    INTENSITY_ELEMENT_WIDTH(17, 17, "IntensityElementWidth", "INT(4)", true),
    ;

    private final int offset;
    private final int insertUpdateOffset;
    private final String fieldName;
    private final String columnType;
    // Older files may lack this column entirely.
    private final boolean optional;

    DB_FIELD(int offset, int insertUpdateOffset, String fieldName, String columnType, boolean optional) {
      this.offset = offset;
      this.insertUpdateOffset = insertUpdateOffset;
      this.fieldName = fieldName;
      this.columnType = columnType;
      this.optional = optional;
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

    public boolean isOptional() {
      return optional;
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

  public static final String QUERY_GET_GLOBAL_PARAMETERS = StringUtils.join(new String[]{
      "SELECT * FROM", TABLE_NAME,
  }, " ");

  public static final String QUERY_INSERT_GLOBAL_PARAMETERS = StringUtils.join(new String[]{
      "INSERT INTO", TABLE_NAME, "(", StringUtils.join(ALL_FIELDS, ", "), ") VALUES (",
      StringUtils.repeat("?", ", ", ALL_FIELDS.size()),
      ")"
  }, " ");

  public static void createTable(UimfDB db) throws SQLException {
    db.execute(QUERY_CREATE_TABLE);
  }

  /**
   * Read the single row of dataset parameters.
   * @param db The file to read.
   * @return The parameters and the number of optional columns that were absent, or null if the table is empty.
   * @throws SQLException
   */
  public static Pair<GlobalParameters, Integer> getGlobalParameters(UimfDB db) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_GLOBAL_PARAMETERS);
         ResultSet resultSet = stmt.executeQuery()) {
      Set<String> columns = UimfDB.columnNames(resultSet);
      Pair<GlobalParameters, Integer> result = null;
      while (resultSet.next()) {
        // There should only be one row; if not, the last one wins.
        result = fromResultSet(resultSet, columns);
      }
      return result;
    }
  }

  protected static Pair<GlobalParameters, Integer> fromResultSet(ResultSet resultSet, Set<String> columns)
      throws SQLException {
    for (DB_FIELD field : DB_FIELD.values()) {
      if (!field.isOptional() && !columns.contains(field.getFieldName())) {
        throw new SQLException(String.format("Required column %s is missing from %s", field, TABLE_NAME));
      }
    }

    int missingColumns = 0;
    GlobalParameters gp = new GlobalParameters();
    gp.setDateStarted(resultSet.getString(DB_FIELD.DATE_STARTED.getFieldName()));
    gp.setNumFrames(resultSet.getInt(DB_FIELD.NUM_FRAMES.getFieldName()));
    gp.setTimeOffset(resultSet.getInt(DB_FIELD.TIME_OFFSET.getFieldName()));
    gp.setBinWidth(resultSet.getDouble(DB_FIELD.BIN_WIDTH.getFieldName()));
    gp.setBins(resultSet.getInt(DB_FIELD.BINS.getFieldName()));
    if (columns.contains(DB_FIELD.TOF_CORRECTION_TIME.getFieldName())) {
      gp.setTofCorrectionTime(resultSet.getDouble(DB_FIELD.TOF_CORRECTION_TIME.getFieldName()));
    } else {
      missingColumns++;
    }
    gp.setFrameDataBlobVersion(resultSet.getDouble(DB_FIELD.FRAME_DATA_BLOB_VERSION.getFieldName()));
    gp.setScanDataBlobVersion(resultSet.getDouble(DB_FIELD.SCAN_DATA_BLOB_VERSION.getFieldName()));
    gp.setTofIntensityType(resultSet.getString(DB_FIELD.TOF_INTENSITY_TYPE.getFieldName()));
    gp.setDatasetType(resultSet.getString(DB_FIELD.DATASET_TYPE.getFieldName()));
    gp.setPrescanTofPulses(resultSet.getInt(DB_FIELD.PRESCAN_TOF_PULSES.getFieldName()));
    gp.setPrescanAccumulations(resultSet.getInt(DB_FIELD.PRESCAN_ACCUMULATIONS.getFieldName()));
    gp.setPrescanTicThreshold(resultSet.getInt(DB_FIELD.PRESCAN_TIC_THRESHOLD.getFieldName()));
    gp.setPrescanContinuous(resultSet.getBoolean(DB_FIELD.PRESCAN_CONTINUOUS.getFieldName()));
    gp.setPrescanProfile(resultSet.getString(DB_FIELD.PRESCAN_PROFILE.getFieldName()));
    // Instrument name was added late and is not worth a warning when absent.
    if (columns.contains(DB_FIELD.INSTRUMENT_NAME.getFieldName())) {
      gp.setInstrumentName(resultSet.getString(DB_FIELD.INSTRUMENT_NAME.getFieldName()));
    }
    // Files without it are decoded with the configured width.
    if (columns.contains(DB_FIELD.INTENSITY_ELEMENT_WIDTH.getFieldName())) {
      int widthBytes = resultSet.getInt(DB_FIELD.INTENSITY_ELEMENT_WIDTH.getFieldName());
      if (!resultSet.wasNull()) {
        try {
          gp.setElementWidth(ElementWidth.fromBytes(widthBytes));
        } catch (IllegalArgumentException e) {
          throw new SQLException(String.format("Unsupported %s %d in %s",
              DB_FIELD.INTENSITY_ELEMENT_WIDTH, widthBytes, TABLE_NAME), e);
        }
      }
    }

    return Pair.of(gp, missingColumns);
  }

  public static void insertGlobalParameters(UimfDB db, GlobalParameters gp) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_INSERT_GLOBAL_PARAMETERS)) {
      stmt.setString(DB_FIELD.DATE_STARTED.getInsertUpdateOffset(), gp.getDateStarted());
      stmt.setInt(DB_FIELD.NUM_FRAMES.getInsertUpdateOffset(), gp.getNumFrames());
      stmt.setInt(DB_FIELD.TIME_OFFSET.getInsertUpdateOffset(), gp.getTimeOffset());
      stmt.setDouble(DB_FIELD.BIN_WIDTH.getInsertUpdateOffset(), gp.getBinWidth());
      stmt.setInt(DB_FIELD.BINS.getInsertUpdateOffset(), gp.getBins());
      stmt.setDouble(DB_FIELD.TOF_CORRECTION_TIME.getInsertUpdateOffset(), gp.getTofCorrectionTime());
      stmt.setDouble(DB_FIELD.FRAME_DATA_BLOB_VERSION.getInsertUpdateOffset(), gp.getFrameDataBlobVersion());
      stmt.setDouble(DB_FIELD.SCAN_DATA_BLOB_VERSION.getInsertUpdateOffset(), gp.getScanDataBlobVersion());
      stmt.setString(DB_FIELD.TOF_INTENSITY_TYPE.getInsertUpdateOffset(), gp.getTofIntensityType());
      stmt.setString(DB_FIELD.DATASET_TYPE.getInsertUpdateOffset(), gp.getDatasetType());
      stmt.setInt(DB_FIELD.PRESCAN_TOF_PULSES.getInsertUpdateOffset(), gp.getPrescanTofPulses());
      stmt.setInt(DB_FIELD.PRESCAN_ACCUMULATIONS.getInsertUpdateOffset(), gp.getPrescanAccumulations());
      stmt.setInt(DB_FIELD.PRESCAN_TIC_THRESHOLD.getInsertUpdateOffset(), gp.getPrescanTicThreshold());
      stmt.setBoolean(DB_FIELD.PRESCAN_CONTINUOUS.getInsertUpdateOffset(), gp.isPrescanContinuous());
      stmt.setString(DB_FIELD.PRESCAN_PROFILE.getInsertUpdateOffset(), gp.getPrescanProfile());
      if (gp.getInstrumentName() != null) {
        stmt.setString(DB_FIELD.INSTRUMENT_NAME.getInsertUpdateOffset(), gp.getInstrumentName());
      } else {
        stmt.setNull(DB_FIELD.INSTRUMENT_NAME.getInsertUpdateOffset(), Types.VARCHAR);
      }
      if (gp.getElementWidth() != null) {
        stmt.setInt(DB_FIELD.INTENSITY_ELEMENT_WIDTH.getInsertUpdateOffset(), gp.getElementWidth().getBytes());
      } else {
        stmt.setNull(DB_FIELD.INTENSITY_ELEMENT_WIDTH.getInsertUpdateOffset(), Types.INTEGER);
      }
      stmt.executeUpdate();
    }
  }
}
