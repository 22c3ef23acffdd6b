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

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

import java.util.Arrays;

/**
 * General purpose compression applied on top of the run-length zero encoded element stream.  Uses raw LZ4 blocks, so
 * the decompressed size is not stored: callers must supply an upper bound when decompressing.
 */
public class SpectrumCompressor {
  private final LZ4Compressor compressor;
  private final LZ4SafeDecompressor decompressor;

  public SpectrumCompressor() {
    LZ4Factory factory = LZ4Factory.fastestInstance();
    this.compressor = factory.fastCompressor();
    this.decompressor = factory.safeDecompressor();
  }

  public byte[] compress(byte[] data, int length) {
    int maxCompressedLength = compressor.maxCompressedLength(length);
    byte[] compressed = new byte[maxCompressedLength];
    int compressedLength = compressor.compress(data, 0, length, compressed, 0, maxCompressedLength);
    return Arrays.copyOf(compressed, compressedLength);
  }

  /**
   * Decompress a payload into at most maxDecompressedLength bytes.
   * @param data The compressed payload.
   * @param maxDecompressedLength An upper bound on the decompressed size.
   * @return The decompressed bytes, exactly sized.
   * @throws DataCorruptionException If the payload is malformed or expands past the bound.
   */
  public byte[] decompress(byte[] data, int maxDecompressedLength) throws DataCorruptionException {
    byte[] decompressed = new byte[maxDecompressedLength];
    int decompressedLength;
    try {
      decompressedLength = decompressor.decompress(data, 0, data.length, decompressed, 0, maxDecompressedLength);
    } catch (LZ4Exception e) {
      throw new DataCorruptionException(
          String.format("Unable to decompress %d byte payload into %d bytes", data.length, maxDecompressedLength), e);
    }
    return Arrays.copyOf(decompressed, decompressedLength);
  }
}
