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

import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class IntensityConverterTest {
  private static final SpectrumCompressor COMPRESSOR = new SpectrumCompressor();

  private static List<Integer> elements(byte[] payload, ElementWidth width, int maxBytes) throws Exception {
    ByteBuffer buffer = ByteBuffer.wrap(COMPRESSOR.decompress(payload, maxBytes)).order(ByteOrder.LITTLE_ENDIAN);
    List<Integer> results = new ArrayList<>();
    while (buffer.hasRemaining()) {
      results.add(width.get(buffer));
    }
    return results;
  }

  @Test
  public void testEncodeComputesSummaryValues() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT32);
    EncodedSpectrum encoded = converter.encode(new int[] {0, 5, 0, 0, 9, 2});

    assertEquals("TIC sums all intensities", 16.0, encoded.getTotalIonCurrent(), 0.0);
    assertEquals("BPI is the largest intensity", 9.0, encoded.getBasePeakIntensity(), 0.0);
    assertEquals("Base peak is at bin 4", 4, encoded.getBasePeakBin());
    assertEquals(3, encoded.getNonZeroCount());
  }

  @Test
  public void testEncodeCollapsesZeroRuns() throws Exception {
    for (ElementWidth width : ElementWidth.values()) {
      IntensityConverter converter = new IntensityConverter(width);
      EncodedSpectrum encoded = converter.encode(new int[] {0, 5, 0, 0, 9, 2, 0, 0, 0});

      List<Integer> expected = new ArrayList<Integer>() {{
        add(-1);
        add(5);
        add(-2);
        add(9);
        add(2);
      }};
      assertEquals(String.format("Element stream for %s drops trailing zeros", width),
          expected, elements(encoded.getPayload(), width, 1024));
    }
  }

  private static int[] randomSpectrum(Random random, int length, double density, int maxIntensity) {
    int[] intensities = new int[length];
    for (int i = 0; i < length; i++) {
      if (random.nextDouble() < density) {
        intensities[i] = 1 + random.nextInt(maxIntensity);
      }
    }
    return intensities;
  }

  private static void assertRoundTrip(IntensityConverter converter, int[] intensities) throws Exception {
    EncodedSpectrum encoded = converter.encode(intensities);
    long tic = 0;
    int nonZero = 0;
    for (int intensity : intensities) {
      tic += intensity;
      nonZero += intensity > 0 ? 1 : 0;
    }
    assertEquals(nonZero, encoded.getNonZeroCount());
    assertEquals((double) tic, encoded.getTotalIonCurrent(), 0.0);

    int hint = encoded.getNonZeroCount() > 0 ? encoded.getNonZeroCount() : -1;
    DecodedSpectrum decoded = converter.decode(encoded.getPayload(), intensities.length - 1, hint);
    assertEquals(nonZero, decoded.size());
    assertArrayEquals(String.format("%s round trip of %d bins", converter.getWidth(), intensities.length),
        intensities, decoded.toDense(intensities.length));
  }

  @Test
  public void testRandomSpectraRoundTrip() throws Exception {
    Random random = new Random(20170523L);
    double[] densities = new double[] {0.0, 0.0005, 0.01, 0.2, 0.7, 1.0};
    for (ElementWidth width : ElementWidth.values()) {
      IntensityConverter converter = new IntensityConverter(width);
      int maxIntensity = (int) Math.min(width.getMaxValue(), 5000000L);
      for (int i = 0; i < 300; i++) {
        int length = 1 + random.nextInt(4000);
        double density = densities[random.nextInt(densities.length)];
        assertRoundTrip(converter, randomSpectrum(random, length, density, maxIntensity));
      }
    }
  }

  @Test
  public void testLongSparseInt16SpectraRoundTrip() throws Exception {
    // Gaps here routinely exceed the longest run a single INT16 element can hold.
    Random random = new Random(42L);
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT16);
    for (int i = 0; i < 25; i++) {
      int length = 70000 + random.nextInt(150000);
      int[] intensities = randomSpectrum(random, length, 0.00002, Short.MAX_VALUE);
      intensities[length - 1] = 1 + random.nextInt(Short.MAX_VALUE);
      assertRoundTrip(converter, intensities);
    }
  }

  @Test
  public void testDecodeRecoversPoints() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT32);
    byte[] payload = converter.encode(new int[] {0, 5, 0, 0, 9, 2}).getPayload();

    DecodedSpectrum decoded = converter.decode(payload, 5, 3);
    assertArrayEquals(new int[] {1, 4, 5}, decoded.getBins());
    assertArrayEquals(new int[] {5, 9, 2}, decoded.getIntensities());
    assertArrayEquals(new int[] {0, 5, 0, 0, 9, 2}, decoded.toDense(6));

    // No size hint should decode the same points.
    assertEquals(decoded, converter.decode(payload, 5));
  }

  @Test
  public void testDecodeStopsPastLastBin() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT32);
    byte[] payload = converter.encode(new int[] {0, 0, 0, 4, 0, 6}).getPayload();

    DecodedSpectrum decoded = converter.decode(payload, 3);
    assertArrayEquals(new int[] {3}, decoded.getBins());
    assertArrayEquals(new int[] {4}, decoded.getIntensities());
  }

  @Test
  public void testEmptySpectrumHasNoPayload() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT32);
    EncodedSpectrum encoded = converter.encode(new int[] {0, 0, 0, 0});

    assertTrue(encoded.isEmpty());
    assertNull(encoded.getPayload());
    assertEquals(0.0, encoded.getTotalIonCurrent(), 0.0);
    assertEquals(0, encoded.getNonZeroCount());
    assertSame(DecodedSpectrum.EMPTY, converter.decode(null, 10));
    assertSame(DecodedSpectrum.EMPTY, converter.decode(new byte[0], 10));
  }

  @Test
  public void testInt16RunOfExactlyMaximumLength() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT16);
    int[] intensities = new int[32769];
    intensities[32768] = 7;

    EncodedSpectrum encoded = converter.encode(intensities);
    List<Integer> expected = new ArrayList<Integer>() {{
      add(-32768);
      add(7);
    }};
    assertEquals("A maximal run fits in one element", expected, elements(encoded.getPayload(), ElementWidth.INT16, 64));

    DecodedSpectrum decoded = converter.decode(encoded.getPayload(), 32768, encoded.getNonZeroCount());
    assertArrayEquals(new int[] {32768}, decoded.getBins());
    assertArrayEquals(new int[] {7}, decoded.getIntensities());
  }

  @Test
  public void testInt16RunLongerThanMaximumLength() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT16);
    int[] intensities = new int[40001];
    intensities[40000] = 3;

    EncodedSpectrum encoded = converter.encode(intensities);
    List<Integer> expected = new ArrayList<Integer>() {{
      add(-32768);
      add(0);
      add(-7231);
      add(3);
    }};
    assertEquals("Overflowing runs are split around a placeholder",
        expected, elements(encoded.getPayload(), ElementWidth.INT16, 64));

    DecodedSpectrum decoded = converter.decode(encoded.getPayload(), 40000, encoded.getNonZeroCount());
    assertArrayEquals("The placeholder does not become a point", new int[] {40000}, decoded.getBins());
    assertArrayEquals(new int[] {3}, decoded.getIntensities());
    assertArrayEquals(intensities, decoded.toDense(intensities.length));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeIntensityIsRejected() throws Exception {
    new IntensityConverter(ElementWidth.INT32).encode(new int[] {1, -1, 2});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testIntensityTooWideForInt16IsRejected() throws Exception {
    new IntensityConverter(ElementWidth.INT16).encode(new int[] {0, 40000});
  }

  @Test(expected = DataCorruptionException.class)
  public void testPartialElementIsCorrupt() throws Exception {
    byte[] payload = COMPRESSOR.compress(new byte[] {1, 2, 3}, 3);
    new IntensityConverter(ElementWidth.INT32).decode(payload, 10);
  }

  @Test(expected = DataCorruptionException.class)
  public void testPayloadLargerThanBinsIsCorrupt() throws Exception {
    IntensityConverter converter = new IntensityConverter(ElementWidth.INT32);
    int[] intensities = new int[300];
    for (int i = 0; i < intensities.length; i++) {
      intensities[i] = i + 1;
    }
    byte[] payload = converter.encode(intensities).getPayload();

    // Five bins can never need 1200 bytes of elements.
    converter.decode(payload, 5);
  }
}
