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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Settings shared by the reader, writer and bin-centric table builder.  Defaults live in uimf-config.json on the
 * classpath; callers can also load their own file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UimfConfig {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  public static final String DEFAULT_CONFIG_RESOURCE = "/uimf-config.json";

  public enum IntermediateStoreType {
    SQLITE,
    ROCKSDB,
  }

  // Element width of every Frame_Scans payload in a dataset.  Must match whatever wrote the file.
  @JsonProperty(value = "element_width")
  private ElementWidth elementWidth = ElementWidth.INT32;

  // Number of consecutive bins that share one intermediate bucket during bin-centric table construction.
  @JsonProperty(value = "bucket_size")
  private Integer bucketSize = 200;

  @JsonProperty(value = "progress_interval_ms")
  private Long progressIntervalMs = 5000L;

  // Where the disposable intermediate store goes; null means the JVM temp dir.
  @JsonProperty(value = "working_directory")
  private String workingDirectory;

  @JsonProperty(value = "intermediate_store")
  private IntermediateStoreType intermediateStore = IntermediateStoreType.SQLITE;

  public UimfConfig() {
  }

  public static UimfConfig loadDefault() throws IOException {
    try (InputStream is = UimfConfig.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
      if (is == null) {
        // No bundled file is fine: the field initializers are the defaults.
        return new UimfConfig();
      }
      return OBJECT_MAPPER.readValue(is, UimfConfig.class);
    }
  }

  public static UimfConfig loadFromFile(File configFile) throws IOException {
    return OBJECT_MAPPER.readValue(configFile, UimfConfig.class);
  }

  /**
   * @return A copy of this configuration with a different element width.
   */
  public UimfConfig withElementWidth(ElementWidth width) {
    UimfConfig copy = OBJECT_MAPPER.convertValue(this, UimfConfig.class);
    copy.setElementWidth(width);
    return copy;
  }

  public ElementWidth getElementWidth() {
    return elementWidth;
  }

  public void setElementWidth(ElementWidth elementWidth) {
    this.elementWidth = elementWidth;
  }

  public Integer getBucketSize() {
    return bucketSize;
  }

  public void setBucketSize(Integer bucketSize) {
    this.bucketSize = bucketSize;
  }

  public Long getProgressIntervalMs() {
    return progressIntervalMs;
  }

  public void setProgressIntervalMs(Long progressIntervalMs) {
    this.progressIntervalMs = progressIntervalMs;
  }

  public String getWorkingDirectory() {
    return workingDirectory;
  }

  public void setWorkingDirectory(String workingDirectory) {
    this.workingDirectory = workingDirectory;
  }

  @JsonIgnore
  public File getWorkingDirectoryFile() {
    return new File(workingDirectory == null ? System.getProperty("java.io.tmpdir") : workingDirectory);
  }

  public IntermediateStoreType getIntermediateStore() {
    return intermediateStore;
  }

  public void setIntermediateStore(IntermediateStoreType intermediateStore) {
    this.intermediateStore = intermediateStore;
  }
}
