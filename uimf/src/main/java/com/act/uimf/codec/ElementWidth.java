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

package com.act.uimf.codec;

import java.nio.ByteBuffer;

/**
 * The integer width used for every element of a run-length zero encoded spectrum.  This is fixed per dataset: a
 * payload written with one width can only be read back with the same width.
 */
public enum ElementWidth {
  INT16(Short.BYTES, Short.MIN_VALUE, Short.MAX_VALUE) {
    @Override
    public void put(ByteBuffer buffer, long value) {
      buffer.putShort((short) value);
    }

    @Override
    public int get(ByteBuffer buffer) {
      return buffer.getShort();
    }
  },
  INT32(Integer.BYTES, Integer.MIN_VALUE, Integer.MAX_VALUE) {
    @Override
    public void put(ByteBuffer buffer, long value) {
      buffer.putInt((int) value);
    }

    @Override
    public int get(ByteBuffer buffer) {
      return buffer.getInt();
    }
  },
  ;

  private final int bytes;
  private final long minValue;
  private final long maxValue;

  ElementWidth(int bytes, long minValue, long maxValue) {
    this.bytes = bytes;
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  public int getBytes() {
    return bytes;
  }

  public long getMinValue() {
    return minValue;
  }

  public long getMaxValue() {
    return maxValue;
  }

  /**
   * The longest zero run a single negative element can describe.
   * @return The magnitude of the most negative representable value.
   */
  public long getMaxZeroRun() {
    return -minValue;
  }

  /**
   * @param bytes The element size recorded in a file.
   * @return The width with that many bytes.
   * @throws IllegalArgumentException If no width has that size.
   */
  public static ElementWidth fromBytes(int bytes) {
    for (ElementWidth width : values()) {
      if (width.bytes == bytes) {
        return width;
      }
    }
    throw new IllegalArgumentException(String.format("No element width of %d bytes", bytes));
  }

  public abstract void put(ByteBuffer buffer, long value);

  public abstract int get(ByteBuffer buffer);
}
