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

import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.util.List;

/**
 * Scratch storage for the scatter/index/gather transpose.  Points are routed to fixed-width buckets of consecutive bins
 * on insert, each bucket is indexed once every point is in, and then points are read back one bin at a time.
 *
 * Stores are single use: create, scatter, index every bucket, read, close, delete.
 */
public interface IntermediateBinStore {
  File getLocation();

  void create() throws SQLException;

  void beginScatter() throws SQLException;

  void insert(int bin, int frameNum, int scanNum, int intensity) throws SQLException;

  void commitScatter() throws SQLException;

  /**
   * @return The number of buckets needed to hold bins 0 through the highest bin, inclusive.
   */
  int getBucketCount();

  void indexBucket(int bucket) throws SQLException;

  /**
   * @return Every point stored for one bin, ordered by frame number and then scan.
   */
  List<BinPoint> readBin(int bin) throws SQLException;

  void close() throws SQLException;

  void delete() throws IOException;
}
