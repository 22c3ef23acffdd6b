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

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.FlushOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.util.ArrayList;
import java.util.Map;

public class RocksDBAndHandles<T extends ColumnFamilyEnumeration<T>> {
  RocksDB db;
  Map<T, ColumnFamilyHandle> columnFamilyHandleMap;

  WriteOptions writeOptions = null;

  // Here to hijack the DB interface for easy testing or alternate implementations.
  protected RocksDBAndHandles() {

  }

  public RocksDBAndHandles(RocksDB db, Map<T, ColumnFamilyHandle> columnFamilyHandleMap) {
    this.db = db;
    this.columnFamilyHandleMap = columnFamilyHandleMap;
  }

  public void close() {
    // Handles must go before the DB that owns them.
    for (ColumnFamilyHandle handle : this.columnFamilyHandleMap.values()) {
      handle.close();
    }
    if (this.writeOptions != null) {
      this.writeOptions.close();
    }
    this.db.close();
  }

  public WriteOptions getWriteOptions() {
    return writeOptions;
  }

  public void setWriteOptions(WriteOptions writeOptions) {
    this.writeOptions = writeOptions;
  }

  public RocksDB getDb() {
    return db;
  }

  protected ColumnFamilyHandle getHandle(T columnFamilyLabel) {
    return this.columnFamilyHandleMap.get(columnFamilyLabel);
  }

  public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
    if (writeOptions != null) {
      this.db.put(getHandle(columnFamily), writeOptions, key, val);
    } else {
      this.db.put(getHandle(columnFamily), key, val);
    }
  }

  public byte[] get(T columnFamily, byte[] key) throws RocksDBException {
    return this.db.get(getHandle(columnFamily), key);
  }

  public void flush(boolean waitForFlush) throws RocksDBException {
    try (FlushOptions options = new FlushOptions()) {
      options.setWaitForFlush(waitForFlush);
      // A bare flush only covers the default column family.
      db.flush(options, new ArrayList<>(columnFamilyHandleMap.values()));
    }
  }

  /**
   * Compact one key range of a column family so later range scans over it read few, sorted files.
   * @param columnFamily The column family to compact.
   * @param begin The first key of the range, inclusive.
   * @param end The last key of the range, exclusive.
   * @throws RocksDBException
   */
  public void compactRange(T columnFamily, byte[] begin, byte[] end) throws RocksDBException {
    db.compactRange(getHandle(columnFamily), begin, end);
  }

  // Wrap cursors for easier testing.
  public RocksDBIterator newIterator(T columnFamily) throws RocksDBException {
    return new RocksDBIterator(this.db.newIterator(getHandle(columnFamily)));
  }

  // Wrap write batches for easier CF management and testing.
  public RocksDBWriteBatch<T> makeWriteBatch() {
    return new RocksDBWriteBatch<T>(this, RocksDBWriteBatch.RESERVED_BYTES);
  }

  /* ----------------------------------------
   * Proxy classes for write batches and cursors.  These proxies allow us to condense the API to the parts we care about
   * and create hooks we can override for testing without using an actual DB.
   */

  public static class RocksDBWriteBatch<T extends ColumnFamilyEnumeration<T>> {
    protected static final int RESERVED_BYTES = 1 << 18;
    private static final WriteOptions DEFAULT_WRITE_OPTIONS;
    static {
      // Note: the WriteOptions constructor requires a native library call, so make sure RocksDB is loaded first.
      RocksDB.loadLibrary();
      DEFAULT_WRITE_OPTIONS = new WriteOptions();
    }
    WriteBatch batch;
    RocksDBAndHandles<T> parent;

    protected RocksDBWriteBatch() {
      // Just for testing.
    }

    protected RocksDBWriteBatch(RocksDBAndHandles<T> parent, int reservedBytes) {
      this.parent = parent;
      this.batch = new WriteBatch(reservedBytes);
    }

    public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
      batch.put(parent.getHandle(columnFamily), key, val);
    }

    public int count() {
      return batch.count();
    }

    // Writes everything accumulated so far and leaves the batch empty for reuse.
    public void write() throws RocksDBException {
      WriteOptions writeOptions = parent.getWriteOptions() != null ? parent.getWriteOptions() : DEFAULT_WRITE_OPTIONS;
      parent.getDb().write(writeOptions, batch);
      batch.clear();
    }

    public void close() {
      batch.close();
    }
  }

  /* RocksDB's iterators talk about byte arrays and use a next-then-isValid protocol rather than hasNext-then-next.
   * Keys are compared as unsigned bytes, so big-endian encoded non-negative ints sort numerically. */
  public static class RocksDBIterator {
    RocksIterator rocksIter;

    protected RocksDBIterator() {
      // Just for testing.
    }

    protected RocksDBIterator(RocksIterator rocksIter) {
      this.rocksIter = rocksIter;
      this.rocksIter.seekToFirst();
    }

    public void reset() { // Easy synonym so users don't have to think about seeking.
      seekToFirst();
    }

    public void seekToFirst() {
      rocksIter.seekToFirst();
    }

    // Position at the first key that is >= target.
    public void seek(byte[] target) {
      rocksIter.seek(target);
    }

    public void next() {
      rocksIter.next();
    }

    public boolean isValid() {
      return rocksIter.isValid();
    }

    public byte[] value() {
      return rocksIter.value();
    }

    public byte[] key() {
      return rocksIter.key();
    }

    public void close() {
      rocksIter.close();
    }
  }
}
