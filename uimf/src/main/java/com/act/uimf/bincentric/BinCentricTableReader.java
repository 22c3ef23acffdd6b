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

import com.act.uimf.db.BinIntensitiesTable;
import com.act.uimf.db.FrameParametersTable;
import com.act.uimf.db.UimfDB;

import java.sql.SQLException;
import java.util.List;

/**
 * Reads rows of Bin_Intensities back into (frame, scan, intensity) points.
 */
public class BinCentricTableReader {
  private final UimfDB db;
  private final BinIntensityCodec codec;

  public BinCentricTableReader(UimfDB db) throws SQLException {
    this.db = db;
    // Must match the position layout the builder used.
    this.codec = new BinIntensityCodec(FrameParametersTable.getMaxScans(db));
  }

  public boolean isAvailable() throws SQLException {
    return BinIntensitiesTable.exists(db);
  }

  /**
   * @param bin The m/z bin to read.
   * @return The bin's points ordered by frame then scan; empty if the bin has no row.
   */
  public List<BinPoint> readBin(int bin) throws SQLException {
    return codec.decode(BinIntensitiesTable.getBinIntensities(db, bin));
  }
}
