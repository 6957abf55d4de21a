package com.elphel.icf.center;
/**
 **
 ** InitialGuessEstimatorTest - centroid and fallback of the initial center
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InitialGuessEstimatorTest.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class InitialGuessEstimatorTest {

	@Test
	public void fullyMaskedImageReturnsGeometricCenter() {
		int width = 40, height = 30;
		double [] image = SyntheticImages.getRingImage(width, height, 12.0, 9.0);
		double [] center = InitialGuessEstimator.getCenter(image, SyntheticImages.getMask(image.length, false), width);
		assertArrayEquals(new double [] {20.0, 15.0}, center, 0.0);
	}

	@Test
	public void zeroIntensityReturnsGeometricCenter() {
		int width = 7, height = 5;
		double [] center = InitialGuessEstimator.getCenter(new double [width * height],
				SyntheticImages.getMask(width * height, true), width);
		assertArrayEquals(new double [] {3.5, 2.5}, center, 0.0);
	}

	@Test
	public void centroidUsesOnlyValidPixels() {
		int width = 4;
		double [] image = {
				0, 0, 0, 0,
				0, 2, 0, 0,
				0, 0, 0, 6,
				100, 0, 0, 0};
		boolean [] mask = SyntheticImages.getMask(image.length, true);
		mask[12] = false; // bright pixel at (0, 3) is masked
		double [] center = InitialGuessEstimator.getCenter(image, mask, width);
		assertEquals((1 * 2 + 3 * 6) / 8.0, center[0], 1e-12);
		assertEquals((1 * 2 + 2 * 6) / 8.0, center[1], 1e-12);
	}

	@Test
	public void nanPixelsAreIgnored() {
		int width = 3;
		double [] image = {
				Double.NaN, 0, 0,
				0, 0, 0,
				0, 0, 5};
		double [] center = InitialGuessEstimator.getCenter(image, SyntheticImages.getMask(image.length, true), width);
		assertArrayEquals(new double [] {2.0, 2.0}, center, 1e-12);
	}

	@Test
	public void symmetricImageCentroidIsNearCenter() {
		double [] image = SyntheticImages.getRingImage(SyntheticImages.SIZE, SyntheticImages.SIZE, 30.0, 33.0);
		double [] center = InitialGuessEstimator.getCenter(image,
				SyntheticImages.getMask(image.length, true), SyntheticImages.SIZE);
		assertEquals(30.0, center[0], 0.5);
		assertEquals(33.0, center[1], 0.5);
	}

	@Test
	public void mismatchedMaskIsRejected() {
		assertThrows(IllegalArgumentException.class,
				() -> InitialGuessEstimator.getCenter(new double [12], new boolean [11], 4));
		assertThrows(IllegalArgumentException.class,
				() -> InitialGuessEstimator.getCenter(new double [10], new boolean [10], 4));
	}
}
