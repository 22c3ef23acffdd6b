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

import com.act.uimf.codec.ElementWidth;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class UimfConfigTest {

  @Test
  public void testDefaultsComeFromBundledResource() throws Exception {
    UimfConfig config = UimfConfig.loadDefault();
    assertEquals(ElementWidth.INT32, config.getElementWidth());
    assertEquals(Integer.valueOf(200), config.getBucketSize());
    assertEquals(Long.valueOf(5000L), config.getProgressIntervalMs());
    assertEquals(UimfConfig.IntermediateStoreType.SQLITE, config.getIntermediateStore());
    assertNull(config.getWorkingDirectory());
    assertEquals(new File(System.getProperty("java.io.tmpdir")), config.getWorkingDirectoryFile());
  }

  @Test
  public void testLoadFromFileOverridesOnlyNamedFields() throws Exception {
    File dir = Files.createTempDirectory(UimfConfigTest.class.getName()).toFile();
    try {
      File configFile = new File(dir, "config.json");
      FileUtils.writeStringToFile(configFile, String.join("\n",
          "{",
          "  \"element_width\": \"INT16\",",
          "  \"intermediate_store\": \"ROCKSDB\",",
          "  \"working_directory\": \"/scratch\",",
          "  \"some_future_setting\": true",
          "}"), StandardCharsets.UTF_8);

      UimfConfig config = UimfConfig.loadFromFile(configFile);
      assertEquals(ElementWidth.INT16, config.getElementWidth());
      assertEquals(UimfConfig.IntermediateStoreType.ROCKSDB, config.getIntermediateStore());
      assertEquals(new File("/scratch"), config.getWorkingDirectoryFile());
      assertEquals("Unnamed fields keep their defaults", Integer.valueOf(200), config.getBucketSize());
    } finally {
      FileUtils.deleteDirectory(dir);
    }
  }

  @Test
  public void testWithElementWidthCopies() throws Exception {
    UimfConfig config = new UimfConfig();
    config.setBucketSize(17);
    config.setWorkingDirectory("/scratch");

    UimfConfig copy = config.withElementWidth(ElementWidth.INT16);
    assertEquals(ElementWidth.INT16, copy.getElementWidth());
    assertEquals(ElementWidth.INT32, config.getElementWidth());
    assertEquals(Integer.valueOf(17), copy.getBucketSize());
    assertEquals("/scratch", copy.getWorkingDirectory());
  }
}
