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

import com.act.uimf.calibration.MzCalibrator;
import com.act.uimf.calibration.ResidualPolynomial;
import com.act.uimf.calibration.UnsupportedCalibrationException;
import com.act.uimf.codec.DecodedSpectrum;
import com.act.uimf.codec.ElementWidth;
import com.act.uimf.db.UimfDB;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.SortedMap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class UimfDataReaderTest {
  private static final String DATASET_NAME = "reader_test.uimf";

  private File tempDir;
  private File datasetFile;
  private UimfDataReader reader;

  @Before
  public void setUp() throws Exception {
    tempDir = Files.createTempDirectory(UimfDataReaderTest.class.getName()).toFile();
    datasetFile = UimfTestData.writeDataset(tempDir, DATASET_NAME, ElementWidth.INT32);
  }

  @After
  public void tearDown() throws Exception {
    if (reader != null) {
      reader.close();
    }
    FileUtils.deleteDirectory(tempDir);
  }

  private UimfDataReader openReader() throws Exception {
    reader = UimfDataReader.open(datasetFile, UimfTestData.makeConfig(ElementWidth.INT32), null);
    return reader;
  }

  private void alterDataset(String... statements) throws Exception {
    try (UimfDB db = new UimfDB().connectToDB(datasetFile)) {
      for (String sql : statements) {
        db.execute(sql);
      }
    }
  }

  @Test
  public void testOpenIndexesMsFrames() throws Exception {
    openReader();
    assertEquals(FrameType.MS, reader.getActiveFrameType());
    assertEquals(3, reader.getNumFrames());
    assertArrayEquals(UimfTestData.MS_FRAME_NUMBERS, reader.getFrameNumbers());
    assertEquals(1, reader.getNumFrames(FrameType.MS_MS));
    assertEquals(UimfTestData.BINS, reader.getGlobalParameters().getBins());
    assertEquals("IMS_TEST", reader.getGlobalParameters().getInstrumentName());

    assertEquals(2, reader.frameIndexOf(4));
    assertEquals("Frames of another type have no index", -1, reader.frameIndexOf(3));
    assertEquals(-1, reader.frameIndexOf(99));
    assertEquals(4, reader.getFrameNumber(2));
    assertEquals(UimfTestData.SCANS, reader.getMaxScansPerFrame());
  }

  @Test(expected = FileNotFoundException.class)
  public void testOpenMissingFileFails() throws Exception {
    UimfDataReader.open(new File(tempDir, "missing.uimf"));
  }

  @Test
  public void testReselectingActiveFrameTypeDoesNotQuery() throws Exception {
    UimfDB db = spy(new UimfDB().connectToDB(datasetFile));
    reader = new UimfDataReader(db, UimfTestData.makeConfig(ElementWidth.INT32), null);

    clearInvocations(db);
    assertEquals(3, reader.setActiveFrameType(FrameType.MS));
    verify(db, never()).prepareStatement(anyString());

    assertEquals(1, reader.setActiveFrameType(FrameType.MS_MS));
    verify(db, atLeastOnce()).prepareStatement(anyString());
    assertArrayEquals(new int[] {3}, reader.getFrameNumbers());
  }

  @Test
  public void testHasMsMsDataRestoresActiveType() throws Exception {
    openReader();
    assertTrue(reader.hasMsMsData());
    assertEquals(FrameType.MS, reader.getActiveFrameType());
    assertArrayEquals(UimfTestData.MS_FRAME_NUMBERS, reader.getFrameNumbers());
  }

  @Test
  public void testSpectraMatchWrittenIntensities() throws Exception {
    openReader();
    for (int frameIndex = 0; frameIndex < reader.getNumFrames(); frameIndex++) {
      int frameNum = UimfTestData.MS_FRAME_NUMBERS[frameIndex];
      int frameNonZero = 0;
      for (int scan = 0; scan < UimfTestData.SCANS; scan++) {
        int[] expected = UimfTestData.spectrum(frameNum, scan);
        DecodedSpectrum spectrum = reader.getSpectrum(frameIndex, scan);
        assertArrayEquals(String.format("Frame %d scan %d", frameNum, scan),
            expected, spectrum.toDense(UimfTestData.BINS + 1));
        assertEquals(spectrum.size(), reader.getCountPerSpectrum(frameIndex, scan));
        frameNonZero += spectrum.size();
      }
      assertEquals(frameNonZero, reader.getCountPerFrame(frameIndex));
    }

    assertSame("Empty scans are not stored", DecodedSpectrum.EMPTY, reader.getSpectrum(1, 3));
    assertEquals(0, reader.getCountPerSpectrum(1, 3));
  }

  @Test
  public void testSpectrumAsMzUsesFrameCalibration() throws Exception {
    openReader();
    DecodedSpectrum spectrum = reader.getSpectrum(0, 1);
    double[] mzs = reader.getSpectrumAsMz(0, 1).getLeft();
    assertEquals(spectrum.size(), mzs.length);

    MzCalibrator calibrator = new MzCalibrator(UimfTestData.SLOPE, UimfTestData.INTERCEPT);
    for (int i = 0; i < mzs.length; i++) {
      assertEquals(calibrator.binToMz(spectrum.getBins()[i], UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO),
          mzs[i], 1e-9);
    }
  }

  @Test
  public void testIntensityBlockSkipsOtherFrameTypes() throws Exception {
    openReader();
    int[][][] block = reader.getIntensityBlock(0, 2, 0, UimfTestData.SCANS - 1, 0, UimfTestData.BINS);
    assertEquals(3, block.length);
    for (int f = 0; f < block.length; f++) {
      assertEquals(UimfTestData.SCANS, block[f].length);
      for (int s = 0; s < block[f].length; s++) {
        assertArrayEquals(UimfTestData.spectrum(UimfTestData.MS_FRAME_NUMBERS[f], s), block[f][s]);
      }
    }
  }

  @Test
  public void testIntensityBlockClampsBins() throws Exception {
    openReader();
    int[][] block = reader.getIntensityBlock(1, 1, 2, 5, 500);
    assertEquals(2, block.length);
    assertEquals("Bins past the dataset's last bin are dropped", UimfTestData.BINS - 5 + 1, block[0].length);
    for (int bin = 5; bin <= UimfTestData.BINS; bin++) {
      assertEquals(UimfTestData.intensityAt(2, 1, bin), block[0][bin - 5]);
      assertEquals(UimfTestData.intensityAt(2, 2, bin), block[1][bin - 5]);
    }
  }

  @Test
  public void testIntensityBlockOfFrameReadsAnyFrameType() throws Exception {
    openReader();
    List<SortedMap<Integer, Integer>> scans = reader.getIntensityBlockOfFrame(3);
    assertEquals(UimfTestData.SCANS, scans.size());
    for (int scan = 0; scan < scans.size(); scan++) {
      for (int bin = 0; bin <= UimfTestData.BINS; bin++) {
        int expected = UimfTestData.intensityAt(3, scan, bin);
        Integer actual = scans.get(scan).get(bin);
        assertEquals(expected, actual == null ? 0 : actual.intValue());
      }
    }
    assertTrue(reader.getIntensityBlockOfFrame(2).get(3).isEmpty());
  }

  @Test
  public void testMobilityData() throws Exception {
    openReader();
    int[] mobility = reader.getMobilityData(0);
    int[] windowed = reader.getMobilityData(0, 5, 10);
    assertEquals(UimfTestData.SCANS, mobility.length);
    for (int scan = 0; scan < UimfTestData.SCANS; scan++) {
      int total = 0;
      int window = 0;
      for (int bin = 0; bin <= UimfTestData.BINS; bin++) {
        total += UimfTestData.intensityAt(1, scan, bin);
        if (bin >= 5 && bin <= 10) {
          window += UimfTestData.intensityAt(1, scan, bin);
        }
      }
      assertEquals(total, mobility[scan]);
      assertEquals(window, windowed[scan]);
    }
  }

  @Test
  public void testSumScans() throws Exception {
    openReader();
    SummedSpectrum summed = reader.sumScans(0, 2, 0, UimfTestData.SCANS - 1);
    long[] expected = new long[UimfTestData.BINS + 1];
    int maxBin = -1;
    for (int frameNum : UimfTestData.MS_FRAME_NUMBERS) {
      for (int scan = 0; scan < UimfTestData.SCANS; scan++) {
        for (int bin = 0; bin <= UimfTestData.BINS; bin++) {
          expected[bin] += UimfTestData.intensityAt(frameNum, scan, bin);
          if (expected[bin] > 0) {
            maxBin = Math.max(maxBin, bin);
          }
        }
      }
    }
    assertArrayEquals(expected, summed.getIntensities());
    assertEquals(maxBin + 1, summed.getLength());

    MzCalibrator calibrator = new MzCalibrator(UimfTestData.SLOPE, UimfTestData.INTERCEPT);
    for (int bin = 0; bin <= UimfTestData.BINS; bin++) {
      double expectedMz = expected[bin] > 0 ?
          calibrator.binToMz(bin, UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO) : 0.0;
      assertEquals(String.format("m/z of bin %d", bin), expectedMz, summed.getMzs()[bin], 1e-9);
    }

    assertArrayEquals("A window wider than the data covers every frame",
        expected, reader.sumScansRange(1, 5, 0, UimfTestData.SCANS - 1).getIntensities());
  }

  private static void addScans(long[] sums, int frameNum, int... scans) {
    for (int scan : scans) {
      for (int bin = 0; bin < sums.length; bin++) {
        sums[bin] += UimfTestData.intensityAt(frameNum, scan, bin);
      }
    }
  }

  @Test
  public void testSumScansOfWholeFrameStopsAtLastScan() throws Exception {
    // A stray row one past the frame's last scan must not be summed.
    alterDataset("INSERT INTO Frame_Scans SELECT FrameNum, " + UimfTestData.SCANS +
        ", NonZeroCount, BPI, BPI_MZ, TIC, Intensities FROM Frame_Scans WHERE FrameNum = 1 AND ScanNum = 0");
    openReader();

    long[] expected = new long[UimfTestData.BINS + 1];
    addScans(expected, 1, 0, 1, 2, 3);
    assertArrayEquals(expected, reader.sumScans(0).getIntensities());
  }

  @Test
  public void testSumScansOverPerFrameScanLists() throws Exception {
    openReader();
    int[] frameIndices = new int[] {0, 2};
    int[][] scans = new int[][] {{2, 0}, {1, 3, 3}};
    SummedSpectrum summed = reader.sumScans(frameIndices, scans);

    long[] expected = new long[UimfTestData.BINS + 1];
    addScans(expected, 1, 0, 2);
    addScans(expected, 4, 1, 3);
    assertArrayEquals(expected, summed.getIntensities());

    assertEquals("Empty scan lists contribute nothing", 0,
        reader.sumScans(new int[] {1}, new int[][] {{}}).getLength());
    assertArrayEquals("Empty scans contribute nothing", new long[UimfTestData.BINS + 1],
        reader.sumScans(new int[] {1}, new int[][] {{3}}).getIntensities());
  }

  @Test
  public void testSumScansWithinMzRange() throws Exception {
    openReader();
    int[] frameIndices = new int[] {0, 1};
    int[][] scans = new int[][] {{0, 1}, {2}};
    long[] sums = new long[UimfTestData.BINS + 1];
    addScans(sums, 1, 0, 1);
    addScans(sums, 2, 2);

    MzCalibrator calibrator = new MzCalibrator(UimfTestData.SLOPE, UimfTestData.INTERCEPT);
    double minMz = calibrator.binToMz(5, UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO);
    double maxMz = calibrator.binToMz(12, UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO);
    Pair<double[], long[]> result = reader.sumScans(frameIndices, scans, minMz, maxMz);

    int kept = 0;
    for (int bin = 5; bin <= 12; bin++) {
      if (sums[bin] > 0) {
        assertEquals(calibrator.binToMz(bin, UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO),
            result.getLeft()[kept], 1e-9);
        assertEquals(sums[bin], result.getRight()[kept]);
        kept++;
      }
    }
    assertTrue(kept > 0);
    assertEquals(kept, result.getLeft().length);
    assertEquals(kept, result.getRight().length);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSumScansRejectsMismatchedScanLists() throws Exception {
    openReader();
    reader.sumScans(new int[] {0, 1}, new int[][] {{0}});
  }

  @Test
  public void testSumScansForVariableRangeUsesRequestedFrameType() throws Exception {
    openReader();
    SummedSpectrum summed = reader.sumScansForVariableRange(FrameType.MS_MS, new int[] {0}, new int[][] {{0, 3}});

    long[] expected = new long[UimfTestData.BINS + 1];
    addScans(expected, 3, 0, 3);
    assertArrayEquals(expected, summed.getIntensities());
    assertEquals(FrameType.MS, reader.getActiveFrameType());
    assertArrayEquals(UimfTestData.MS_FRAME_NUMBERS, reader.getFrameNumbers());
  }

  @Test
  public void testFrameDataListsNonEmptyScans() throws Exception {
    openReader();
    FrameData data = reader.getFrameData(1);
    assertArrayEquals("Scan 3 of frame 2 is empty", new int[] {0, 1, 2}, data.getScanNumbers());

    int offset = 0;
    for (int i = 0; i < data.getNumScans(); i++) {
      int[] expected = UimfTestData.spectrum(2, data.getScanNumbers()[i]);
      int[] dense = new int[expected.length];
      for (int p = offset; p < offset + data.getSpectrumCounts()[i]; p++) {
        dense[data.getBins()[p]] = data.getIntensities()[p];
      }
      assertArrayEquals(expected, dense);
      assertEquals(reader.getCountPerSpectrum(1, data.getScanNumbers()[i]), data.getSpectrumCounts()[i]);
      offset += data.getSpectrumCounts()[i];
    }
    assertEquals(data.getNumPoints(), offset);
    assertEquals(reader.getCountPerFrame(1), data.getNumPoints());
  }

  @Test
  public void testChangingReturnedParametersDoesNotAffectReads() throws Exception {
    openReader();
    reader.getGlobalParameters().setBins(3);
    assertEquals(UimfTestData.BINS, reader.getGlobalParameters().getBins());
    assertArrayEquals(UimfTestData.spectrum(1, 0), reader.getSpectrum(0, 0).toDense(UimfTestData.BINS + 1));

    reader.getFrameParameters(0).setCalibrationSlope(9.0);
    reader.getFrameParametersByNumber(1).setCalibrationIntercept(9.0);
    reader.getAllFrameParameters(FrameType.MS).get(1).setScans(0);
    assertEquals(UimfTestData.SLOPE, reader.getCalibrator(0).getSlope(), 0.0);
    assertEquals(UimfTestData.INTERCEPT, reader.getCalibrator(0).getIntercept(), 0.0);
    assertEquals(UimfTestData.SCANS, reader.getMobilityData(0).length);
  }

  @Test
  public void testStoredElementWidthOverridesConfiguredWidth() throws Exception {
    File int16File = UimfTestData.writeDataset(tempDir, "int16.uimf", ElementWidth.INT16);
    try (UimfDataReader int16Reader =
             UimfDataReader.open(int16File, UimfTestData.makeConfig(ElementWidth.INT32), null)) {
      assertEquals(ElementWidth.INT16, int16Reader.getElementWidth());
      assertEquals(ElementWidth.INT16, int16Reader.getGlobalParameters().getElementWidth());
      for (int scan = 0; scan < UimfTestData.SCANS; scan++) {
        assertArrayEquals(UimfTestData.spectrum(4, scan),
            int16Reader.getSpectrum(2, scan).toDense(UimfTestData.BINS + 1));
      }
    }
  }

  @Test
  public void testFilesWithoutElementWidthUseConfiguredWidth() throws Exception {
    alterDataset("ALTER TABLE Global_Parameters DROP COLUMN IntensityElementWidth");
    UimfStatusListener listener = mock(UimfStatusListener.class);
    reader = UimfDataReader.open(datasetFile, UimfTestData.makeConfig(ElementWidth.INT32), listener);

    assertNull(reader.getGlobalParameters().getElementWidth());
    assertEquals(ElementWidth.INT32, reader.getElementWidth());
    assertArrayEquals(UimfTestData.spectrum(1, 2), reader.getSpectrum(0, 2).toDense(UimfTestData.BINS + 1));
    verify(listener, never()).onWarning(anyString());
  }

  @Test(expected = SQLException.class)
  public void testUnknownStoredElementWidthIsRejected() throws Exception {
    alterDataset("UPDATE Global_Parameters SET IntensityElementWidth = 3");
    openReader();
  }

  @Test
  public void testTicAndBpiByFrame() throws Exception {
    openReader();
    double[] tic = reader.getTicByFrame(0, 2);
    double[] ticScans12 = reader.getTic(0, 2, 1, 2);
    double[] bpi = reader.getBpi(0, 2, 0, 0);
    assertEquals(3, tic.length);

    for (int f = 0; f < UimfTestData.MS_FRAME_NUMBERS.length; f++) {
      int frameNum = UimfTestData.MS_FRAME_NUMBERS[f];
      double expectedTic = 0.0;
      double expectedTicScans12 = 0.0;
      double expectedBpi = 0.0;
      for (int scan = 0; scan < UimfTestData.SCANS; scan++) {
        double scanTic = 0.0;
        double scanBpi = 0.0;
        for (int bin = 0; bin <= UimfTestData.BINS; bin++) {
          int intensity = UimfTestData.intensityAt(frameNum, scan, bin);
          scanTic += intensity;
          scanBpi = Math.max(scanBpi, intensity);
        }
        expectedTic += scanTic;
        expectedBpi += scanBpi;
        if (scan == 1 || scan == 2) {
          expectedTicScans12 += scanTic;
        }
        assertEquals(scanTic, reader.getTic(f, scan), 0.0);
      }
      assertEquals(String.format("TIC of frame %d", frameNum), expectedTic, tic[f], 0.0);
      assertEquals(expectedTicScans12, ticScans12[f], 0.0);
      assertEquals(expectedBpi, bpi[f], 0.0);
    }
  }

  @Test
  public void testScansByDescendingIntensity() throws Exception {
    openReader();
    List<Triple<Integer, Integer, Double>> scans = reader.getFrameAndScanListByDescendingIntensity();
    assertEquals("Every stored scan of every frame type", 4 * UimfTestData.SCANS - 1, scans.size());
    for (int i = 1; i < scans.size(); i++) {
      assertTrue(scans.get(i - 1).getRight() >= scans.get(i).getRight());
    }
  }

  @Test
  public void testMzProfiles() throws Exception {
    openReader();
    int targetBin = 7;
    double targetMz = new MzCalibrator(UimfTestData.SLOPE, UimfTestData.INTERCEPT)
        .binToMz(targetBin, UimfTestData.BIN_WIDTH, 0.0, ResidualPolynomial.ZERO);
    assertEquals(targetBin, reader.getBinClosestToMz(0, targetMz), 1e-6);

    int startScan = 1;
    int endScan = 3;
    int[][] frameScan = reader.getFramesAndScanIntensitiesForAGivenMz(0, 2, startScan, endScan, targetMz, 0.1);
    int[] lc = reader.getLcProfile(0, 2, startScan, endScan, targetMz, 0.1);
    int[] drift = reader.getDriftTimeProfile(0, 2, startScan, endScan, targetMz, 0.1);
    List<Triple<Integer, Integer, Integer>> elution =
        reader.get3dElutionProfile(0, 2, startScan, endScan, targetMz, 0.1);

    assertEquals(3, lc.length);
    assertEquals(endScan - startScan + 1, drift.length);
    assertEquals(3 * (endScan - startScan + 1), elution.size());

    int[] expectedDrift = new int[drift.length];
    for (int f = 0; f < 3; f++) {
      int expectedLc = 0;
      for (int scan = startScan; scan <= endScan; scan++) {
        int intensity = UimfTestData.intensityAt(UimfTestData.MS_FRAME_NUMBERS[f], scan, targetBin);
        assertEquals(intensity, frameScan[f][scan - startScan]);
        expectedLc += intensity;
        expectedDrift[scan - startScan] += intensity;
      }
      assertEquals(expectedLc, lc[f]);
    }
    assertArrayEquals(expectedDrift, drift);

    Triple<Integer, Integer, Integer> last = elution.get(elution.size() - 1);
    assertEquals(Integer.valueOf(2), last.getLeft());
    assertEquals(Integer.valueOf(endScan), last.getMiddle());
    assertEquals(Integer.valueOf(frameScan[2][endScan - startScan]), last.getRight());
  }

  @Test(expected = UnsupportedCalibrationException.class)
  public void testClosestBinRefusesPolynomialCalibration() throws Exception {
    alterDataset("UPDATE Frame_Parameters SET b2 = 0.001 WHERE FrameNum = 1");
    openReader();
    reader.getBinClosestToMz(0, 500.0);
  }

  @Test
  public void testUpdateCalibrationClearsCache() throws Exception {
    openReader();
    FrameParameters before = reader.getFrameParameters(0);
    assertEquals(UimfTestData.SLOPE, before.getCalibrationSlope(), 0.0);
    assertNotSame("Callers get copies", before, reader.getFrameParameters(0));

    reader.updateCalibration(0, 0.5, 0.01);
    FrameParameters after = reader.getFrameParameters(0);
    assertEquals(0.5, after.getCalibrationSlope(), 0.0);
    assertEquals(0.01, after.getCalibrationIntercept(), 0.0);
    assertEquals("Other frames keep their calibration", UimfTestData.SLOPE,
        reader.getFrameParameters(1).getCalibrationSlope(), 0.0);

    reader.updateAllCalibration(0.6, 0.02);
    for (FrameParameters fp : reader.getAllFrameParameters(FrameType.MS).values()) {
      assertEquals(0.6, fp.getCalibrationSlope(), 0.0);
      assertEquals(0.6, reader.getCalibrator(reader.frameIndexOf(fp.getFrameNum())).getSlope(), 0.0);
    }
  }

  @Test
  public void testLegacyColumnsDefaultToZeroAndWarnOnce() throws Exception {
    alterDataset(
        "ALTER TABLE Frame_Parameters DROP COLUMN a2",
        "ALTER TABLE Frame_Parameters DROP COLUMN b2",
        "ALTER TABLE Frame_Parameters DROP COLUMN CALIBRATIONDONE",
        "ALTER TABLE Frame_Parameters DROP COLUMN FloatVoltage"
    );

    UimfStatusListener listener = mock(UimfStatusListener.class);
    reader = UimfDataReader.open(datasetFile, UimfTestData.makeConfig(ElementWidth.INT32), listener);

    FrameParameters fp = reader.getFrameParameters(0);
    assertEquals(ResidualPolynomial.ZERO, fp.getResidualPolynomial());
    assertEquals(0, fp.getCalibrationDone());
    assertEquals(Double.valueOf(0.0), fp.getAuxiliaryReading("FloatVoltage"));
    assertEquals(UimfTestData.SCANS, fp.getScans());

    reader.getFrameParameters(1);
    reader.getAllFrameParameters(FrameType.MS_MS);
    verify(listener, times(1)).onWarning(anyString());
  }

  @Test
  public void testCalibrationTablesAndFileBytes() throws Exception {
    try (UimfDB db = new UimfDB().connectToDB(datasetFile)) {
      db.execute("CREATE TABLE Calib_Settings (FileText BLOB)");
      try (PreparedStatement stmt = db.prepareStatement("INSERT INTO Calib_Settings (FileText) VALUES (?)")) {
        for (String part : new String[] {"slope=0.35\n", "intercept=0.03\n"}) {
          stmt.setBytes(1, part.getBytes(StandardCharsets.UTF_8));
          stmt.executeUpdate();
        }
      }
    }

    openReader();
    assertTrue(reader.tableExists("Frame_Scans"));
    assertEquals(1, reader.getCalibrationTableNames().size());
    assertEquals("Calib_Settings", reader.getCalibrationTableNames().get(0));
    assertEquals("slope=0.35\nintercept=0.03\n",
        new String(reader.getFileBytesFromTable("Calib_Settings"), StandardCharsets.UTF_8));
    assertNull(reader.getFileBytesFromTable("No_Such_Table"));
  }

  @Test(expected = IllegalStateException.class)
  public void testBinCentricReadsNeedTable() throws Exception {
    openReader();
    reader.getBinCentricIntensities(0);
  }

  @Test
  public void testOutOfRangeArgumentsAreRejected() throws Exception {
    openReader();
    try {
      reader.getSpectrum(3, 0);
      fail("Frame index past the last frame should be rejected");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
    try {
      reader.getIntensityBlock(2, 1, 0, 0, 0, UimfTestData.BINS);
      fail("Reversed frame range should be rejected");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
    try {
      reader.sumScans(0, 0, 2, 1);
      fail("Reversed scan range should be rejected");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
    try {
      reader.getFrameParametersByNumber(42);
      fail("Unknown frame number should be rejected");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
  }
}
