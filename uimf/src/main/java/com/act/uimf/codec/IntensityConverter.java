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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Converts intensity arrays to and from the compact form stored in the Frame_Scans table.
 *
 * The encoded form is a stream of integers of a fixed {@link ElementWidth}, written little-endian and then compressed.
 * Runs of zero intensities collapse to a single negative element whose magnitude is the length of the run; every
 * positive element is an intensity at the current bin.  A zero element only appears after a run too long for the
 * element width, and stands for one more zero bin.  So the spectrum
 * <pre>
 *   [0, 5, 0, 0, 9, 2]
 * </pre>
 * becomes the element stream
 * <pre>
 *   [-1, 5, -2, 9, 2]
 * </pre>
 * Trailing zeros are never written, and a spectrum with no non-zero intensities has no payload at all.
 */
public class IntensityConverter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(IntensityConverter.class);

  private final ElementWidth width;
  private final SpectrumCompressor compressor;

  public IntensityConverter(ElementWidth width) {
    this(width, new SpectrumCompressor());
  }

  public IntensityConverter(ElementWidth width, SpectrumCompressor compressor) {
    this.width = width;
    this.compressor = compressor;
  }

  public ElementWidth getWidth() {
    return width;
  }

  /**
   * Run-length zero encode and compress a spectrum, computing its TIC and base peak along the way.
   * @param intensities One intensity per bin.  Values must be non-negative and fit in the element width.
   * @return The payload (null if the spectrum is empty) plus summary values.
   */
  public EncodedSpectrum encode(int[] intensities) {
    // Every bin produces at most two elements (a run flush and a value, or a run flush and its placeholder).
    ByteBuffer rlze = ByteBuffer.allocate(width.getBytes() * (2 * intensities.length + 2))
        .order(ByteOrder.LITTLE_ENDIAN);

    long zeroCount = 0; // Always <= 0 while counting.
    long maxZeroRun = width.getMaxZeroRun();
    double tic = 0.0;
    double bpi = 0.0;
    int bpiBin = 0;
    int nonZeroCount = 0;

    for (int i = 0; i < intensities.length; i++) {
      int intensity = intensities[i];
      if (intensity < 0) {
        throw new IllegalArgumentException(
            String.format("Intensities must be non-negative, found %d at bin %d", intensity, i));
      }

      if (intensity > 0) {
        if (intensity > width.getMaxValue()) {
          throw new IllegalArgumentException(String.format(
              "Intensity %d at bin %d does not fit in element width %s", intensity, i, width));
        }

        tic += intensity;
        if (intensity > bpi) {
          bpi = intensity;
          bpiBin = i;
        }

        if (zeroCount < 0) {
          width.put(rlze, zeroCount);
          zeroCount = 0;
        }

        width.put(rlze, intensity);
        nonZeroCount++;
      } else if (zeroCount == -maxZeroRun) {
        /* The run counter can't grow any further without wrapping around.  Write out the full run and a zero-valued
         * placeholder, which itself accounts for this bin, then start counting from scratch. */
        width.put(rlze, zeroCount);
        width.put(rlze, 0);
        zeroCount = 0;
      } else {
        zeroCount--;
      }
    }

    rlze.flip();
    int rlzeBytes = rlze.remaining();
    if (rlzeBytes == 0) {
      return new EncodedSpectrum(null, tic, bpi, bpiBin, nonZeroCount);
    }

    byte[] payload = compressor.compress(rlze.array(), rlzeBytes);
    return new EncodedSpectrum(payload, tic, bpi, bpiBin, nonZeroCount);
  }

  /**
   * Decode a payload into its non-zero points without any size hint.
   * @param payload The compressed payload, possibly null.
   * @param totalBins The highest addressable bin.
   * @return The decoded points in ascending bin order.
   * @throws DataCorruptionException If the payload cannot be decompressed or is not a whole number of elements.
   */
  public DecodedSpectrum decode(byte[] payload, int totalBins) throws DataCorruptionException {
    return decode(payload, totalBins, -1);
  }

  /**
   * Decode a payload into (bin, intensity) points.  Decoding stops as soon as the bin cursor moves past totalBins.
   * @param payload The compressed payload, possibly null.
   * @param totalBins The highest addressable bin.
   * @param expectedNonZeroCount The number of non-zero points recorded for this spectrum, used to bound the
   *                             decompression buffer; pass a negative value if unknown.
   * @return The decoded points in ascending bin order.
   * @throws DataCorruptionException If the payload cannot be decompressed or is not a whole number of elements.
   */
  public DecodedSpectrum decode(byte[] payload, int totalBins, int expectedNonZeroCount)
      throws DataCorruptionException {
    if (payload == null || payload.length == 0) {
      return DecodedSpectrum.EMPTY;
    }

    byte[] raw = compressor.decompress(payload, maxDecodedBytes(totalBins, expectedNonZeroCount));
    if (raw.length % width.getBytes() != 0) {
      String msg = String.format("Decoded spectrum length %d is not a multiple of element size %d",
          raw.length, width.getBytes());
      LOGGER.error(msg);
      throw new DataCorruptionException(msg);
    }

    ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
    int elements = raw.length / width.getBytes();
    int[] bins = new int[elements];
    int[] intensities = new int[elements];
    int points = 0;

    long cursor = 0;
    while (buffer.hasRemaining() && cursor <= totalBins) {
      int value = width.get(buffer);
      if (value < 0) {
        cursor -= value;
      } else if (value == 0) {
        // Run overflow placeholder.
        cursor++;
      } else {
        bins[points] = (int) cursor;
        intensities[points] = value;
        points++;
        cursor++;
      }
    }

    return new DecodedSpectrum(Arrays.copyOf(bins, points), Arrays.copyOf(intensities, points));
  }

  int maxDecodedBytes(int totalBins, int expectedNonZeroCount) {
    long overflowElements = 2L * (totalBins / width.getMaxZeroRun() + 1);
    long fullBound = 2L * ((long) totalBins + 1) + 2;
    long elements = fullBound;
    if (expectedNonZeroCount >= 0) {
      // One value and at most one preceding run per point, one leading run, plus run overflow flushes.
      elements = Math.min(fullBound, 2L * expectedNonZeroCount + 1 + overflowElements);
    }
    return (int) Math.min(Integer.MAX_VALUE - 8, elements * width.getBytes());
  }
}
