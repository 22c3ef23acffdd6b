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

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * The bin-centric view of a dataset: one row per m/z bin holding every (frame, scan) intensity for that bin.
 */
public class BinIntensitiesTable {
  public static final String TABLE_NAME = "Bin_Intensities";

  public static final String QUERY_CREATE_TABLE = StringUtils.join(new String[]{
      "CREATE TABLE", TABLE_NAME, "(MZ_BIN int(11), INTENSITIES BLOB)",
  }, " ");

  public static final String QUERY_CREATE_INDEX = StringUtils.join(new String[]{
      "CREATE INDEX Bin_Intensities_MZ_BIN_IDX ON", TABLE_NAME, "(MZ_BIN)",
  }, " ");

  public static final String QUERY_INSERT_BIN = StringUtils.join(new String[]{
      "INSERT INTO", TABLE_NAME, "(MZ_BIN, INTENSITIES) VALUES (?, ?)",
  }, " ");

  public static final String QUERY_GET_BIN = StringUtils.join(new String[]{
      "SELECT INTENSITIES FROM", TABLE_NAME,
      "WHERE MZ_BIN = ?",
  }, " ");

  public static void createTable(UimfDB db) throws SQLException {
    db.execute(QUERY_CREATE_TABLE);
  }

  public static void createIndex(UimfDB db) throws SQLException {
    db.execute(QUERY_CREATE_INDEX);
  }

  public static boolean exists(UimfDB db) throws SQLException {
    return db.tableExists(TABLE_NAME);
  }

  public static void insertBin(PreparedStatement stmt, int bin, byte[] intensities) throws SQLException {
    stmt.setInt(1, bin);
    stmt.setBytes(2, intensities);
    stmt.executeUpdate();
  }

  /**
   * @return The encoded intensities for one bin, or null if the bin has no row.
   */
  public static byte[] getBinIntensities(UimfDB db, int bin) throws SQLException {
    try (PreparedStatement stmt = db.prepareStatement(QUERY_GET_BIN)) {
      stmt.setInt(1, bin);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next() ? resultSet.getBytes(1) : null;
      }
    }
  }
}
