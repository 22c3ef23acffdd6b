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

package com.act.uimf.utils.rocksdb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.CompressionType;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

public class DBUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DBUtil.class);
  private static final Charset UTF8 = StandardCharsets.UTF_8;

  static {
    // Options objects are native handles, so the library has to be loaded before the first one is built.
    RocksDB.loadLibrary();
  }

  /* Stores made here are scratch space that is written once, read once in key order and then thrown away, so durability
   * knobs are off and compression is cheap. */
  private static final Options ROCKS_DB_CREATE_OPTIONS = new Options()
      .setCreateIfMissing(true)
      .setErrorIfExists(true)
      .setUseFsync(false)
      .setAllowMmapReads(true)
      .setWriteBufferSize(1 << 26)
      .setArenaBlockSize(1 << 20)
      .setCompressionType(CompressionType.LZ4_COMPRESSION)
      ;

  /**
   * Create a new rocks DB at a particular location on disk.
   * @param pathToStore A path to the directory where the store will be created; must not already hold a DB.
   * @param columnFamilies Column families to create in the DB.
   * @param <T> A type (probably an enum) that represents a set of column families.
   * @return A DB and map of column family labels (as T) to handles.
   * @throws RocksDBException
   */
  public static <T extends ColumnFamilyEnumeration<T>> RocksDBAndHandles<T> createNewRocksDB(
      File pathToStore, T[] columnFamilies) throws RocksDBException {
    Map<T, ColumnFamilyHandle> columnFamilyHandles = new HashMap<>();

    RocksDB db = RocksDB.open(ROCKS_DB_CREATE_OPTIONS, pathToStore.getAbsolutePath());

    for (T cf : columnFamilies) {
      LOGGER.debug("Creating column family %s", cf.getName());
      ColumnFamilyHandle cfh =
          db.createColumnFamily(new ColumnFamilyDescriptor(cf.getName().getBytes(UTF8)));
      columnFamilyHandles.put(cf, cfh);
    }

    return new RocksDBAndHandles<T>(db, columnFamilyHandles);
  }
}
