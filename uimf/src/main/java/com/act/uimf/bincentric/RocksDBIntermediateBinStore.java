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

import com.act.uimf.utils.rocksdb.ColumnFamilyEnumeration;
import com.act.uimf.utils.rocksdb.DBUtil;
import com.act.uimf.utils.rocksdb.RocksDBAndHandles;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps scattered points in a scratch RocksDB store.  Keys are four big-endian ints (bucket, bin, frame, scan), so the
 * store's byte-wise key order is exactly the order the gather phase wants, and reading a bin is a prefix seek.
 */
public class RocksDBIntermediateBinStore implements IntermediateBinStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RocksDBIntermediateBinStore.class);

  static final int KEY_BYTES = Integer.BYTES * 4;
  static final int PREFIX_BYTES = Integer.BYTES * 2;
  // Points written per write batch during the scatter phase.
  static final int BATCH_SIZE = 1 << 16;

  static {
    // WriteOptions are native objects, so load the library even when handed an already open DB.
    RocksDB.loadLibrary();
  }

  enum ColumnFamilies implements ColumnFamilyEnumeration<ColumnFamilies> {
    // (bucket, bin, frame, scan) -> intensity
    BIN_POINTS("bin_points"),
    ;

    private static final Map<String, ColumnFamilies> reverseNameMap =
        new HashMap<String, ColumnFamilies>() {{
          for (ColumnFamilies cf : ColumnFamilies.values()) {
            put(cf.getName(), cf);
          }
        }};

    private String name;

    ColumnFamilies(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public ColumnFamilies getFamilyByName(String name) {
      return reverseNameMap.get(name);
    }
  }

  private final File location;
  private final int bucketSize;
  private final int numBins;

  private RocksDBAndHandles<ColumnFamilies> dbAndHandles;
  private RocksDBAndHandles.RocksDBWriteBatch<ColumnFamilies> writeBatch;
  private int pendingWrites = 0;

  public RocksDBIntermediateBinStore(File location, int bucketSize, int numBins) {
    this(location, bucketSize, numBins, null);
  }

  // Accepts a pre-built store so tests can substitute an in-memory one.
  RocksDBIntermediateBinStore(File location, int bucketSize, int numBins,
                              RocksDBAndHandles<ColumnFamilies> dbAndHandles) {
    this.location = location;
    this.bucketSize = bucketSize;
    this.numBins = numBins;
    this.dbAndHandles = dbAndHandles;
  }

  @Override
  public File getLocation() {
    return location;
  }

  @Override
  public int getBucketCount() {
    return numBins / bucketSize + 1;
  }

  static byte[] makeKey(int bucket, int bin, int frameNum, int scanNum) {
    return ByteBuffer.allocate(KEY_BYTES).putInt(bucket).putInt(bin).putInt(frameNum).putInt(scanNum).array();
  }

  static byte[] makePrefix(int bucket, int bin) {
    return ByteBuffer.allocate(PREFIX_BYTES).putInt(bucket).putInt(bin).array();
  }

  private static boolean hasPrefix(byte[] key, byte[] prefix) {
    if (key.length < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; i++) {
      if (key[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  private static SQLException wrap(String action, RocksDBException e) {
    String msg = String.format("RocksDB intermediate store failed to %s: %s", action, e.getMessage());
    LOGGER.error(msg);
    return new SQLException(msg, e);
  }

  @Override
  public void create() throws SQLException {
    if (dbAndHandles != null) {
      return;
    }
    try {
      LOGGER.debug("Creating intermediate store at %s", location.getAbsolutePath());
      dbAndHandles = DBUtil.createNewRocksDB(location, ColumnFamilies.values());
    } catch (RocksDBException e) {
      throw wrap("create", e);
    }
  }

  @Override
  public void beginScatter() throws SQLException {
    WriteOptions writeOptions = new WriteOptions();
    writeOptions.setDisableWAL(true);
    writeOptions.setSync(false);
    dbAndHandles.setWriteOptions(writeOptions);
    writeBatch = dbAndHandles.makeWriteBatch();
    pendingWrites = 0;
  }

  @Override
  public void insert(int bin, int frameNum, int scanNum, int intensity) throws SQLException {
    try {
      writeBatch.put(ColumnFamilies.BIN_POINTS, makeKey(bin / bucketSize, bin, frameNum, scanNum),
          ByteBuffer.allocate(Integer.BYTES).putInt(intensity).array());
      pendingWrites++;
      if (pendingWrites >= BATCH_SIZE) {
        flushBatch();
      }
    } catch (RocksDBException e) {
      throw wrap("insert", e);
    }
  }

  private void flushBatch() throws RocksDBException {
    writeBatch.write();
    writeBatch.close();
    writeBatch = dbAndHandles.makeWriteBatch();
    pendingWrites = 0;
  }

  @Override
  public void commitScatter() throws SQLException {
    try {
      writeBatch.write();
      writeBatch.close();
      writeBatch = null;
      pendingWrites = 0;
      dbAndHandles.flush(true);
    } catch (RocksDBException e) {
      throw wrap("commit", e);
    }
  }

  @Override
  public void indexBucket(int bucket) throws SQLException {
    try {
      dbAndHandles.compactRange(ColumnFamilies.BIN_POINTS,
          makeKey(bucket, 0, 0, 0), makeKey(bucket + 1, 0, 0, 0));
    } catch (RocksDBException e) {
      throw wrap("compact", e);
    }
  }

  @Override
  public List<BinPoint> readBin(int bin) throws SQLException {
    byte[] prefix = makePrefix(bin / bucketSize, bin);
    List<BinPoint> points = new ArrayList<>();
    RocksDBAndHandles.RocksDBIterator iterator;
    try {
      iterator = dbAndHandles.newIterator(ColumnFamilies.BIN_POINTS);
    } catch (RocksDBException e) {
      throw wrap("read", e);
    }

    try {
      for (iterator.seek(prefix); iterator.isValid() && hasPrefix(iterator.key(), prefix); iterator.next()) {
        ByteBuffer key = ByteBuffer.wrap(iterator.key());
        key.position(PREFIX_BYTES);
        int frameNum = key.getInt();
        int scanNum = key.getInt();
        int intensity = ByteBuffer.wrap(iterator.value()).getInt();
        points.add(new BinPoint(frameNum, scanNum, intensity));
      }
    } finally {
      iterator.close();
    }
    return points;
  }

  @Override
  public void close() throws SQLException {
    if (writeBatch != null) {
      writeBatch.close();
      writeBatch = null;
    }
    if (dbAndHandles != null) {
      dbAndHandles.close();
      dbAndHandles = null;
    }
  }

  @Override
  public void delete() throws IOException {
    if (location.exists()) {
      FileUtils.deleteDirectory(location);
    }
  }
}
