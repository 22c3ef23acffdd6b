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

/**
 * Receives advisory status events from long-running operations and from the reader.  None of these events affect
 * control flow, so implementations may ignore any of them.
 */
public interface UimfStatusListener {
  UimfStatusListener NOOP = new UimfStatusListener() {
    @Override
    public void onProgress(double percentComplete, String message) {
    }

    @Override
    public void onMessage(String message) {
    }

    @Override
    public void onWarning(String message) {
    }
  };

  /**
   * @param percentComplete A value in [0, 100] that never decreases over the course of one operation.
   * @param message A human readable description of the current step.
   */
  void onProgress(double percentComplete, String message);

  void onMessage(String message);

  void onWarning(String message);
}
