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

import com.act.uimf.FrameParameters;
import com.act.uimf.FrameType;
import com.act.uimf.calibration.ResidualPolynomial;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class FrameParametersTable {
  public static final String TABLE_NAME = "Frame_Parameters";

  /* Columns fall into three groups: typed fields that drive reading and calibration, opaque instrument readings that
   * are carried through as a name -> value map, and columns added in later versions of the format.  The last group is
   * allowed to be absent; missing values default to zero and are counted so the reader can warn about old files. */
  private enum DB_FIELD implements DBFieldEnumeration {
    FRAME_NUM(1, 1, "FrameNum", "INT(4)", false, false),
    START_TIME(2, 2, "StartTime", "DOUBLE", false, false),
    DURATION(3, 3, "Duration", "DOUBLE", false, false),
    ACCUMULATIONS(4, 4, "Accumulations", "INT(2)", false, false),
    FRAME_TYPE(5, 5, "FrameType", "SHORT", false, false),
    SCANS(6, 6, "Scans", "INT(4)", false, false),
    IMF_PROFILE(7, 7, "IMFProfile", "STRING", false, false),
    TOF_LOSSES(8, 8, "TOFLosses", "DOUBLE", false, false),
    AVERAGE_TOF_LENGTH(9, 9, "AverageTOFLength", "DOUBLE NOT NULL", false, false),
    CALIBRATION_SLOPE(10, 10, "CalibrationSlope", "DOUBLE", false, false),
    CALIBRATION_INTERCEPT(11, 11, "CalibrationIntercept", "DOUBLE", false, false),
    TEMPERATURE(12, 12, "Temperature", "DOUBLE", true, false),
    VOLT_HV_RACK1(13, 13, "voltHVRack1", "DOUBLE", true, false),
    VOLT_HV_RACK2(14, 14, "voltHVRack2", "DOUBLE", true, false),
    VOLT_HV_RACK3(15, 15, "voltHVRack3", "DOUBLE", true, false),
    VOLT_HV_RACK4(16, 16, "voltHVRack4", "DOUBLE", true, false),
    VOLT_CAP_INLET(17, 17, "voltCapInlet", "DOUBLE", true, false),
    VOLT_ENTRANCE_IFT_IN(18, 18, "voltEntranceIFTIn", "DOUBLE", true, false),
    VOLT_ENTRANCE_IFT_OUT(19, 19, "voltEntranceIFTOut", "DOUBLE", true, false),
    VOLT_ENTRANCE_COND_LMT(20, 20, "voltEntranceCondLmt", "DOUBLE", true, false),
    VOLT_TRAP_OUT(21, 21, "voltTrapOut", "DOUBLE", true, false),
    VOLT_TRAP_IN(22, 22, "voltTrapIn", "DOUBLE", true, false),
    VOLT_JET_DIST(23, 23, "voltJetDist", "DOUBLE", true, false),
    VOLT_QUAD1(24, 24, "voltQuad1", "DOUBLE", true, false),
    VOLT_COND1(25, 25, "voltCond1", "DOUBLE", true, false),
    VOLT_QUAD2(26, 26, "voltQuad2", "DOUBLE", true, false),
    VOLT_COND2(27, 27, "voltCond2", "DOUBLE", true, false),
    VOLT_IMS_OUT(28, 28, "voltIMSOut", "DOUBLE", true, false),
    VOLT_EXIT_IFT_IN(29, 29, "voltExitIFTIn", "DOUBLE", true, false),
    VOLT_EXIT_IFT_OUT(30, 30, "voltExitIFTOut", "DOUBLE", true, false),
    VOLT_EXIT_COND_LMT(31, 31, "voltExitCondLmt", "DOUBLE", true, false),
    PRESSURE_FRONT(32, 32, "PressureFront", "DOUBLE", true, false),
    PRESSURE_BACK(33, 33, "PressureBack", "DOUBLE", true, false),
    MP_BIT_ORDER(34, 34, "MPBitOrder", "TINYINT", false, false),
    FRAGMENTATION_PROFILE(35, 35, "FragmentationProfile", "BLOB", false, false),
    HIGH_PRESSURE_FUNNEL_PRESSURE(36, 36, "HighPressureFunnelPressure", "DOUBLE", true, true),
    ION_FUNNEL_TRAP_PRESSURE(37, 37, "IonFunnelTrapPressure", "DOUBLE", true, true),
    REAR_ION_FUNNEL_PRESSURE(38, 38, "RearIonFunnelPressure", "DOUBLE", true, true),
    QUADRUPOLE_PRESSURE(39, 39, "QuadrupolePressure", "DOUBLE", true, true),
    ESI_VOLTAGE(40, 40, "ESIVoltage", "DOUBLE", true, true),
    FLOAT_VOLTAGE(41, 41, "FloatVoltage", "DOUBLE", true, true),
    CALIBRATION_DONE(42, 42, "CALIBRATIONDONE", "INTEGER", false, true),
    A2(43, 43, "a2", "DOUBLE", false, true),
    B2(44, 44, "b2", "DOUBLE", false, true),
    C2(45, 45, "c2", "DOUBLE", false, true),
    D2(46, 46, "d2", "DOUBLE", false, true),
    E2(47, 47, "e2", "DOUBLE", false, true),
    F2(48, 48, "f2", "DOUBLE", false, true),
    ;

    private final int offset;
    private final int insertUpdateOffset;
    private final String fieldName;
    private final String columnType;
    private final boolean auxiliary;
    private final boolean legacyOptional;

    DB_FIELD(int offset, int insertUpdateOffset, String fieldName, String columnType,
             boolean auxiliary, boolean legacyOptional) {
      this.offset = offset;
      this.insertUpdateOffset = insertUpdateOffset;
      this.fieldName = fieldName;
      this.columnType = columnType;
      this.auxiliary = auxiliary;
      this.legacyOptional = legacyOptional;
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

    public boolean isAuxiliary() {
      return auxiliary;
    }

    public boolean isLegacyOptional() {
      return legacyOptional;
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

  public static final String QUERY_CREATE_INDEX = StringUtils.join(new String[]{
      "CREATE UNIQUE INDEX pk_index_FrameNum ON", TABLE_NAME, "(FrameNum)",
  }, " ");

  // Select
  public static final String QUERY_GET_FRAME_PARAMETERS_BY_FRAME_NUM = StringUtils.join(new String[]{
      "SELECT * FROM", TABLE_NAME,
      "WHERE FrameNum = ?",
  }, " ");

  public static final String QUERY_GET_FRAME_PARAMETERS_BY_FRAME_TYPE = StringUtils.join(new String[]{
      "SELECT * FROM", TABLE_NAME,
      "WHERE FrameType = ?",
      "ORDER BY FrameNum",
  }, " ");

  public static final String QUERY_COUNT_FRAMES_BY_FRAME_TYPE = StringUtils.join(new String[]{
      "SELECT COUNT(FrameNum) FROM", TABLE_NAME,
      "WHERE FrameType = ?",
  }, " ");

  public static final String QUERY_GET_FRAME_NUMBERS_BY_FRAME_TYPE = StringUtils.join(new String[]{
      "SELECT FrameNum FROM", TABLE_NAME,
      "WHERE FrameType = ?",
      "ORDER BY FrameNum ASC",
  }, " ");

  public static final String QUERY_GET_ALL_FRAME_NUMBERS = StringUtils.join(new String[]{
      "SELECT FrameNum FROM", TABLE_NAME,
      "ORDER BY FrameNum ASC",
  }, " ");

  public static final String QUERY_GET_MAX_SCANS = StringUtils.join(new String[]{
      "SELECT MAX(Scans) FROM", TABLE_NAME,
  }, " ");

  // Insert/Update
  public static final String QUERY_INSERT_FRAME_PARAMETERS = StringUtils.join(new String[]{
      "INSERT INTO", TABLE_NAME, "(", StringUtils.join(ALL_FIELDS, ", "), ") VALUES (",
      StringUtils.repeat("?", ", ", ALL_FIELDS.size()),
      ")"
  }, " ");

  public static final String QUERY_UPDATE_CALIBRATION_BY_FRAME_NUM = StringUtils.join(new String[]{
      "UPDATE", TABLE_NAME,
      "SET CalibrationSlope = ?, CalibrationIntercept = ?",
      "WHERE FrameNum = ?",
  }, " ");

  public static final String QUERY_UPDATE_CALIBRATION_ALL = StringUtils.join(new String[]{
      "UPDATE", TABLE_NAME,
      "SET CalibrationSlope = ?, CalibrationIntercept = ?",
  }, " ");

  public static void createTable(UimfDB db) throws SQLException {
    db.execute(QUERY_CREATE_TABLE);
    db.execute(QUERY_CREATE_INDEX);
  }

  /**
   * Build one FrameParameters from the current row.  Legacy columns that are absent get zero values.
   * @param resultSet A result set positioned on a Frame_Parameters row.
   * @param columns The columns present in the result set.
   * @return The parameters and the count of legacy columns that were missing.
   * @throws SQLException If a column every version of the format has is missing.
   */
  protected static Pair<FrameParameters, Integer> fromResultSet(ResultSet resultSet, Set<String> columns)
      throws SQLException {
    int missingColumns = 0;
    double[] polynomial = new double[6];
    FrameParameters fp = new FrameParameters();

    for (DB_FIELD field : DB_FIELD.values()) {
      String name = field.getFieldName();
      if (!columns.contains(name)) {
        if (!field.isLegacyOptional()) {
          throw new SQLException(String.format("Required column %s is missing from %s", name, TABLE_NAME));
        }
        missingColumns++;
        if (field.isAuxiliary()) {
          fp.setAuxiliaryReading(name, 0.0);
        }
        continue;
      }

      if (field.isAuxiliary()) {
        fp.setAuxiliaryReading(name, resultSet.getDouble(name));
        continue;
      }

      switch (field) {
        case FRAME_NUM:
          fp.setFrameNum(resultSet.getInt(name));
          break;
        case START_TIME:
          fp.setStartTime(resultSet.getDouble(name));
          break;
        case DURATION:
          fp.setDuration(resultSet.getDouble(name));
          break;
        case ACCUMULATIONS:
          fp.setAccumulations(resultSet.getInt(name));
          break;
        case FRAME_TYPE:
          fp.setFrameType(FrameType.fromValue(resultSet.getInt(name)));
          break;
        case SCANS:
          fp.setScans(resultSet.getInt(name));
          break;
        case IMF_PROFILE:
          fp.setImfProfile(resultSet.getString(name));
          break;
        case TOF_LOSSES:
          fp.setTofLosses(resultSet.getDouble(name));
          break;
        case AVERAGE_TOF_LENGTH:
          fp.setAverageTofLength(resultSet.getDouble(name));
          break;
        case CALIBRATION_SLOPE:
          fp.setCalibrationSlope(resultSet.getDouble(name));
          break;
        case CALIBRATION_INTERCEPT:
          fp.setCalibrationIntercept(resultSet.getDouble(name));
          break;
        case MP_BIT_ORDER:
          fp.setMpBitOrder(resultSet.getInt(name));
          break;
        case FRAGMENTATION_PROFILE:
          fp.setFragmentationProfile(bytesToDoubles(resultSet.getBytes(name)));
          break;
        case CALIBRATION_DONE:
          fp.setCalibrationDone(resultSet.getInt(name));
          break;
        case A2:
        case B2:
        case C2:
        case D2:
        case E2:
        case F2:
          polynomial[field.ordinal() - DB_FIELD.A2.ordinal()] = resultSet.getDouble(name);
          break;
        default:
          // Every non-auxiliary field is handled above, so reaching here means the enum grew without this method.
          throw new RuntimeException(String.format("Unhandled Frame_Parameters column %s", name));
      }
    }

    fp.setResidualPolynomial(new ResidualPolynomial(
        polynomial[0], polynomial[1], polynomial[2], polynomial[3], polynomial[4], polynomial[5]));
    return Pair.of(fp, missingColumns);
  }

  protected static List<Pair<FrameParameters, Integer>> fromResultSet(ResultSet resultSet) throws SQLException {
    Set<String> columns = UimfDB.columnNames(resultSet);
    List<Pair<FrameParameters, Integer>> results = new ArrayList<>();
    while (resultSet.next()) {
      results.add(fromResultSet(resultSet, columns));
    }
    return results;
  }

  public static Pair<FrameParameters, Integer> getFrameParametersByFrameNum(UimfDB db, int frameNum)
      throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_FRAME_PARAMETERS_BY_FRAME_NUM)) {
      stmt.setInt(1, frameNum);
      try (ResultSet resultSet = stmt.executeQuery()) {
        List<Pair<FrameParameters, Integer>> results = fromResultSet(resultSet);
        if (results.size() > 1) {
          throw new SQLException(String.format("Found multiple %s rows for FrameNum = %d", TABLE_NAME, frameNum));
        }
        return results.size() == 0 ? null : results.get(0);
      }
    }
  }

  public static List<Pair<FrameParameters, Integer>> getFrameParametersByFrameType(UimfDB db, FrameType frameType)
      throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_FRAME_PARAMETERS_BY_FRAME_TYPE)) {
      stmt.setInt(1, frameType.getValue());
      try (ResultSet resultSet = stmt.executeQuery()) {
        return fromResultSet(resultSet);
      }
    }
  }

  public static int countFramesByFrameType(UimfDB db, FrameType frameType) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_COUNT_FRAMES_BY_FRAME_TYPE)) {
      stmt.setInt(1, frameType.getValue());
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next() ? resultSet.getInt(1) : 0;
      }
    }
  }

  public static int[] getFrameNumbersByFrameType(UimfDB db, FrameType frameType, int expectedCount)
      throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_FRAME_NUMBERS_BY_FRAME_TYPE)) {
      stmt.setInt(1, frameType.getValue());
      try (ResultSet resultSet = stmt.executeQuery()) {
        return readFrameNumbers(resultSet, expectedCount);
      }
    }
  }

  public static int[] getAllFrameNumbers(UimfDB db) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_ALL_FRAME_NUMBERS);
         ResultSet resultSet = stmt.executeQuery()) {
      return readFrameNumbers(resultSet, 16);
    }
  }

  private static int[] readFrameNumbers(ResultSet resultSet, int expectedCount) throws SQLException {
    List<Integer> frameNumbers = new ArrayList<>(Math.max(expectedCount, 0));
    while (resultSet.next()) {
      frameNumbers.add(resultSet.getInt(1));
    }
    int[] results = new int[frameNumbers.size()];
    for (int i = 0; i < results.length; i++) {
      results[i] = frameNumbers.get(i);
    }
    return results;
  }

  public static int getMaxScans(UimfDB db) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_MAX_SCANS);
         ResultSet resultSet = stmt.executeQuery()) {
      return resultSet.next() ? resultSet.getInt(1) : 0;
    }
  }

  public static void insertFrameParameters(UimfDB db, FrameParameters fp) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_INSERT_FRAME_PARAMETERS)) {
      double[] polynomial = fp.getResidualPolynomial().toArray();
      for (DB_FIELD field : DB_FIELD.values()) {
        int i = field.getInsertUpdateOffset();
        if (field.isAuxiliary()) {
          stmt.setDouble(i, fp.getAuxiliaryReading(field.getFieldName()));
          continue;
        }

        switch (field) {
          case FRAME_NUM:
            stmt.setInt(i, fp.getFrameNum());
            break;
          case START_TIME:
            stmt.setDouble(i, fp.getStartTime());
            break;
          case DURATION:
            stmt.setDouble(i, fp.getDuration());
            break;
          case ACCUMULATIONS:
            stmt.setInt(i, fp.getAccumulations());
            break;
          case FRAME_TYPE:
            stmt.setInt(i, fp.getFrameType().getValue());
            break;
          case SCANS:
            stmt.setInt(i, fp.getScans());
            break;
          case IMF_PROFILE:
            stmt.setString(i, fp.getImfProfile());
            break;
          case TOF_LOSSES:
            stmt.setDouble(i, fp.getTofLosses());
            break;
          case AVERAGE_TOF_LENGTH:
            stmt.setDouble(i, fp.getAverageTofLength());
            break;
          case CALIBRATION_SLOPE:
            stmt.setDouble(i, fp.getCalibrationSlope());
            break;
          case CALIBRATION_INTERCEPT:
            stmt.setDouble(i, fp.getCalibrationIntercept());
            break;
          case MP_BIT_ORDER:
            stmt.setInt(i, fp.getMpBitOrder());
            break;
          case FRAGMENTATION_PROFILE:
            stmt.setBytes(i, doublesToBytes(fp.getFragmentationProfile()));
            break;
          case CALIBRATION_DONE:
            stmt.setInt(i, fp.getCalibrationDone());
            break;
          case A2:
          case B2:
          case C2:
          case D2:
          case E2:
          case F2:
            stmt.setDouble(i, polynomial[field.ordinal() - DB_FIELD.A2.ordinal()]);
            break;
          default:
            throw new RuntimeException(String.format("Unhandled Frame_Parameters column %s", field));
        }
      }
      stmt.executeUpdate();
    }
  }

  public static int updateCalibrationByFrameNum(UimfDB db, int frameNum, double slope, double intercept)
      throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_UPDATE_CALIBRATION_BY_FRAME_NUM)) {
      stmt.setDouble(1, slope);
      stmt.setDouble(2, intercept);
      stmt.setInt(3, frameNum);
      return stmt.executeUpdate();
    }
  }

  public static int updateAllCalibration(UimfDB db, double slope, double intercept) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_UPDATE_CALIBRATION_ALL)) {
      stmt.setDouble(1, slope);
      stmt.setDouble(2, intercept);
      return stmt.executeUpdate();
    }
  }

  // The fragmentation profile is a packed array of little-endian IEEE-754 doubles.
  public static double[] bytesToDoubles(byte[] blob) {
    if (blob == null) {
      return new double[0];
    }
    ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
    double[] values = new double[blob.length / Double.BYTES];
    for (int i = 0; i < values.length; i++) {
      values[i] = buffer.getDouble();
    }
    return values;
  }

  public static byte[] doublesToBytes(double[] values) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (double v : values) {
      buffer.putDouble(v);
    }
    return buffer.array();
  }
}
