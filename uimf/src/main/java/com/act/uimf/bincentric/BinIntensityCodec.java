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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Encodes the points of one bin as a zero-run stream over linear (frame, scan) positions, where position is
 * frame * scansPerFrame + scan.  A negative element skips that many positions and a non-negative element is the
 * intensity at the current position.  Elements are little-endian int32s with no further compression.
 */
public class BinIntensityCodec {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BinIntensityCodec.class);

  private final int scansPerFrame;

  public BinIntensityCodec(int scansPerFrame) {
    this.scansPerFrame = scansPerFrame;
  }

  public int getScansPerFrame() {
    return scansPerFrame;
  }

  /**
   * @param points Points in ascending (frame, scan) order.
   * @return The encoded stream, or null if there are no points.
   */
  public byte[] encode(List<BinPoint> points) {
    if (points.isEmpty()) {
      return null;
    }

    // A point costs at most a gap and a value.
    ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES * 2 * points.size()).order(ByteOrder.LITTLE_ENDIAN);
    long previousLocation = -1;
    for (BinPoint point : points) {
      if (point.getScanNum() < 0 || point.getScanNum() >= scansPerFrame) {
        String msg = String.format("Scan %d of frame %d is outside the %d scans per frame",
            point.getScanNum(), point.getFrameNum(), scansPerFrame);
        LOGGER.error(msg);
        throw new RuntimeException(msg);
      }

      long location = (long) point.getFrameNum() * scansPerFrame + point.getScanNum();
      long difference = location - previousLocation - 1;
      if (difference < 0) {
        String msg = String.format("Points out of order at frame %d scan %d", point.getFrameNum(), point.getScanNum());
        LOGGER.error(msg);
        throw new RuntimeException(msg);
      }
      if (difference > Integer.MAX_VALUE) {
        String msg = String.format("Gap of %d positions before frame %d scan %d does not fit in an int32",
            difference, point.getFrameNum(), point.getScanNum());
        LOGGER.error(msg);
        throw new RuntimeException(msg);
      }

      if (difference > 0) {
        buffer.putInt((int) -difference);
      }
      buffer.putInt(point.getIntensity());
      previousLocation = location;
    }

    buffer.flip();
    byte[] result = new byte[buffer.remaining()];
    buffer.get(result);
    return result;
  }

  public List<BinPoint> decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      return Collections.emptyList();
    }
    if (scansPerFrame <= 0) {
      String msg = String.format("Cannot place bin intensities with %d scans per frame", scansPerFrame);
      LOGGER.error(msg);
      throw new RuntimeException(msg);
    }

    ByteBuffer buffer = ByteBuffer.wrap(encoded).order(ByteOrder.LITTLE_ENDIAN);
    List<BinPoint> points = new ArrayList<>(encoded.length / Integer.BYTES);
    long location = 0;
    while (buffer.remaining() >= Integer.BYTES) {
      int value = buffer.getInt();
      if (value < 0) {
        location -= value;
      } else {
        points.add(new BinPoint((int) (location / scansPerFrame), (int) (location % scansPerFrame), value));
        location++;
      }
    }
    return points;
  }
}
