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

package com.act.uimf.utils;

import com.act.uimf.utils.rocksdb.ColumnFamilyEnumeration;
import com.act.uimf.utils.rocksdb.RocksDBAndHandles;
import org.rocksdb.RocksDBException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class MockRocksDBAndHandles<T extends ColumnFamilyEnumeration<T>> extends RocksDBAndHandles<T> {
  T[] columnFamilies;
  Map<T, Map<List<Byte>, byte[]>> fakeDB = new HashMap<>();
  boolean closed = false;
  int compactions = 0;

  public MockRocksDBAndHandles(T[] columnFamilies) {
    super();
    this.columnFamilies = columnFamilies;
    for (T family : columnFamilies) {
      fakeDB.put(family, new HashMap<>());
    }
  }

  public static List<Byte> byteArrayToList(byte[] array) {
    // byte[] hashes by address, so keys must be wrapped.
    List<Byte> keyList = new ArrayList<>(array.length);
    for (byte b : array) {
      keyList.add(b);
    }
    return keyList;
  }

  public static byte[] byteListToArray(List<Byte> list) {
    byte[] array = new byte[list.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = list.get(i);
    }
    return array;
  }

  // RocksDB's default comparator treats bytes as unsigned.
  static int compareKeys(List<Byte> a, List<Byte> b) {
    for (int i = 0; i < a.size() && i < b.size(); i++) {
      int cmp = Integer.compare(a.get(i) & 0xff, b.get(i) & 0xff);
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(a.size(), b.size());
  }

  public Map<T, Map<List<Byte>, byte[]>> getFakeDB() {
    return this.fakeDB;
  }

  public boolean isClosed() {
    return closed;
  }

  public int getCompactions() {
    return compactions;
  }

  @Override
  public void close() {
    closed = true;
  }

  @Override
  public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
    // Copy the value bytes since they'll likely be modified in place.
    fakeDB.get(columnFamily).put(byteArrayToList(key), Arrays.copyOf(val, val.length));
  }

  @Override
  public byte[] get(T columnFamily, byte[] key) throws RocksDBException {
    return fakeDB.get(columnFamily).get(byteArrayToList(key));
  }

  @Override
  public RocksDBIterator newIterator(T columnFamily) throws RocksDBException {
    return new MockRocksDBIterator(fakeDB.get(columnFamily));
  }

  @Override
  public void flush(boolean waitForFlush) throws RocksDBException {

  }

  @Override
  public void compactRange(T columnFamily, byte[] begin, byte[] end) throws RocksDBException {
    compactions++;
  }

  @Override
  public RocksDBWriteBatch<T> makeWriteBatch() {
    return new MockRocksDBWriteBatch<T>(this);
  }

  public static class MockRocksDBWriteBatch<T extends ColumnFamilyEnumeration<T>>
      extends RocksDBWriteBatch<T> {
    RocksDBAndHandles<T> parent;
    Map<T, Map<List<Byte>, byte[]>> batch = new HashMap<>();
    int count = 0;

    protected MockRocksDBWriteBatch(RocksDBAndHandles<T> parent) {
      super();
      this.parent = parent;
    }

    @Override
    public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
      Map<List<Byte>, byte[]> columnFamilyMap = batch.get(columnFamily);
      if (columnFamilyMap == null) {
        columnFamilyMap = new HashMap<>();
        batch.put(columnFamily, columnFamilyMap);
      }

      columnFamilyMap.put(byteArrayToList(key), Arrays.copyOf(val, val.length));
      count++;
    }

    @Override
    public int count() {
      return count;
    }

    @Override
    public void write() throws RocksDBException {
      // Nothing shows up in the parent until write is called, and the batch is empty afterwards.
      for (Map.Entry<T, Map<List<Byte>, byte[]>> cfEntry : batch.entrySet()) {
        T cf = cfEntry.getKey();
        for (Map.Entry<List<Byte>, byte[]> kvEntry : cfEntry.getValue().entrySet()) {
          parent.put(cf, byteListToArray(kvEntry.getKey()), kvEntry.getValue());
        }
      }
      batch.clear();
      count = 0;
    }

    @Override
    public void close() {

    }
  }

  public static class MockRocksDBIterator extends RocksDBIterator {
    Map<List<Byte>, byte[]> index;
    List<List<Byte>> keys;
    int cursor = 0;

    public MockRocksDBIterator(Map<List<Byte>, byte[]> index) {
      super();
      this.index = index;
      reset();
    }

    @Override
    public void reset() {
      List<List<Byte>> keys = new ArrayList<>(index.keySet());
      Collections.sort(keys, MockRocksDBAndHandles::compareKeys);
      this.keys = keys;
      this.cursor = 0;
    }

    @Override
    public void seekToFirst() {
      reset();
    }

    @Override
    public void seek(byte[] target) {
      reset();
      List<Byte> targetKey = byteArrayToList(target);
      while (this.cursor < this.keys.size() && compareKeys(this.keys.get(cursor), targetKey) < 0) {
        this.cursor++;
      }
    }

    @Override
    public void next() {
      this.cursor++;
    }

    @Override
    public boolean isValid() {
      return this.cursor >= 0 && this.cursor < this.keys.size();
    }

    @Override
    public byte[] value() {
      return index.get(keys.get(cursor));
    }

    @Override
    public byte[] key() {
      return byteListToArray(this.keys.get(cursor));
    }

    @Override
    public void close() {

    }
  }
}
