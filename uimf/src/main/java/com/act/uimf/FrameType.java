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

package com.act.uimf;

import java.util.HashMap;
import java.util.Map;

public enum FrameType {
  MS_LEGACY(0),
  MS(1),
  MS_MS(2),
  CALIBRATION(3),
  PRESCAN(4),
  ;

  private static final Map<Integer, FrameType> VALUE_MAP = new HashMap<Integer, FrameType>() {{
    for (FrameType type : FrameType.values()) {
      put(type.getValue(), type);
    }
  }};

  private final int value;

  FrameType(int value) {
    this.value = value;
  }

  // The integer tag stored in Frame_Parameters.FrameType.
  public int getValue() {
    return value;
  }

  public static FrameType fromValue(int value) {
    FrameType type = VALUE_MAP.get(value);
    if (type == null) {
      throw new IllegalArgumentException(String.format("Unknown frame type tag: %d", value));
    }
    return type;
  }
}
