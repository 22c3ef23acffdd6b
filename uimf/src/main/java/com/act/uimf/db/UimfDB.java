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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A thin wrapper around a JDBC connection to one SQLite file.  All table classes go through prepareStatement so tests
 * can observe (or intercept) every query issued against a file.
 */
public class UimfDB implements AutoCloseable {
  public static final String JDBC_URL_PREFIX = "jdbc:sqlite:";

  public static final String QUERY_TABLE_EXISTS = StringUtils.join(new String[]{
      "SELECT name FROM sqlite_master",
      "WHERE type = 'table' AND name = ?",
  }, " ");

  public static final String QUERY_ALL_TABLE_NAMES = StringUtils.join(new String[]{
      "SELECT name FROM sqlite_master",
      "WHERE type = 'table'",
      "ORDER BY name",
  }, " ");

  Connection conn;
  File file;

  public UimfDB connectToDB(File file) throws SQLException {
    this.file = file;
    this.conn = DriverManager.getConnection(JDBC_URL_PREFIX + file.getAbsolutePath());
    return this;
  }

  public Connection getConn() {
    return conn;
  }

  public File getFile() {
    return file;
  }

  public PreparedStatement prepareStatement(String sql) throws SQLException {
    return conn.prepareStatement(sql);
  }

  public void execute(String sql) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
    }
  }

  public void beginTransaction() throws SQLException {
    conn.setAutoCommit(false);
  }

  public void commit() throws SQLException {
    conn.commit();
    conn.setAutoCommit(true);
  }

  public void rollback() throws SQLException {
    if (!conn.getAutoCommit()) {
      conn.rollback();
      conn.setAutoCommit(true);
    }
  }

  public boolean tableExists(String tableName) throws SQLException {
    try (PreparedStatement stmt = prepareStatement(QUERY_TABLE_EXISTS)) {
      stmt.setString(1, tableName);
      try (ResultSet resultSet = stmt.executeQuery()) {
        return resultSet.next();
      }
    }
  }

  public List<String> getTableNames() throws SQLException {
    List<String> names = new ArrayList<>();
    try (PreparedStatement stmt = prepareStatement(QUERY_ALL_TABLE_NAMES);
         ResultSet resultSet = stmt.executeQuery()) {
      while (resultSet.next()) {
        names.add(resultSet.getString(1));
      }
    }
    return names;
  }

  /**
   * Read every FileText value stored in a table, concatenated in row order.  Calibration and instrument settings files
   * are archived this way alongside the data.
   * @param tableName A table with a FileText column.
   * @return The stored bytes, or null if the table does not exist or holds no file text.
   * @throws SQLException
   */
  public byte[] getFileBytesFromTable(String tableName) throws SQLException {
    if (!tableExists(tableName)) {
      return null;
    }

    // Table names can't be bound as parameters; tableExists has confirmed this one is real.
    String query = StringUtils.join(new String[]{"SELECT FileText FROM", "\"" + tableName + "\""}, " ");
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    boolean found = false;
    try (PreparedStatement stmt = prepareStatement(query);
         ResultSet resultSet = stmt.executeQuery()) {
      while (resultSet.next()) {
        byte[] fileText = resultSet.getBytes(1);
        if (fileText != null) {
          bytes.write(fileText, 0, fileText.length);
          found = true;
        }
      }
    }
    return found ? bytes.toByteArray() : null;
  }

  /**
   * Collect the column labels of a result set.  SQLite column names are case insensitive, so the result is too.
   * @param resultSet A result set from any query.
   * @return The set of column labels present.
   * @throws SQLException
   */
  public static Set<String> columnNames(ResultSet resultSet) throws SQLException {
    ResultSetMetaData metaData = resultSet.getMetaData();
    Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      names.add(metaData.getColumnLabel(i));
    }
    return Collections.unmodifiableSet(names);
  }

  @Override
  public void close() throws SQLException {
    if (conn != null && !conn.isClosed()) {
      conn.close();
    }
  }
}
