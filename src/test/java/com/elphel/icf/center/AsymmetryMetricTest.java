package com.elphel.icf.center;
/**
 **
 ** AsymmetryMetricTest - opposite wedge comparison
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AsymmetryMetricTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class AsymmetryMetricTest {
	static final double NaN = Double.NaN;

	static double getMetric(
			double []  image,
			boolean [] mask,
			int        size,
			int        n_wedges,
			double []  center) {
		RadialWedgeProfiler profiler = new RadialWedgeProfiler(n_wedges, size / 2, 0.0, size / 2.0);
		OffsetField offsets = new OffsetField(size, size, new double [] {size / 2.0, size / 2.0});
		return AsymmetryMetric.getMetric(profiler.getProfiles(image, mask, offsets, center));
	}

	@Test
	public void onlyBinsPresentOnBothSidesAreCompared() {
		double [][] profiles = {
				{1.0, 2.0, NaN, 4.0},
				{0.0, 0.0, 0.0, 0.0},
				{2.0, NaN, 5.0, 1.0},
				{0.0, 3.0, NaN, NaN}};
		// pair 0-2: (1-2)^2 + (4-1)^2, pair 1-3: 0 + 3^2
		assertEquals((1.0 + 9.0 + 0.0 + 9.0) / 4, AsymmetryMetric.getMetric(profiles), 1e-12);
	}

	@Test
	public void noComparableBinsGivesNoData() {
		double [][] profiles = {
				{1.0, NaN},
				{NaN, 2.0}};
		double metric = AsymmetryMetric.getMetric(profiles);
		assertTrue(AsymmetryMetric.isNoData(metric));
		assertTrue(metric > Double.MAX_VALUE);
	}

	@Test
	public void oddNumberOfProfilesIsRejected() {
		assertThrows(CenterFinderConfigurationException.class,
				() -> AsymmetryMetric.getMetric(new double [3][2]));
	}

	@Test
	public void opposedQuadrantsAreSymmetricOnlyAtTrueCenter() {
		int size = SyntheticImages.SIZE;
		double [] image = SyntheticImages.getQuadrantImage(size, size, 32.0, 32.0, 100.0);
		boolean [] mask = SyntheticImages.getMask(image.length, true);
		double at_center = getMetric(image, mask, size, 4, new double [] {32.0, 32.0});
		assertEquals(0.0, at_center, 1e-9);
		double [][] offsets = {{2, 0}, {-2, 0}, {0, 2}, {0, -2}, {0.5, 0}, {0, 0.5}, {1, 1}, {-1, 1}};
		for (double [] d : offsets) {
			double metric = getMetric(image, mask, size, 4, new double [] {32.0 + d[0], 32.0 + d[1]});
			assertTrue(metric > at_center, "offset "+d[0]+":"+d[1]+" -> "+metric);
		}
	}

	@Test
	public void metricScalesAsSquareOfIntensity() {
		int size = SyntheticImages.SIZE;
		double [] image = SyntheticImages.getRingImage(size, size, 32.0, 31.0);
		boolean [] mask = SyntheticImages.getMask(image.length, true);
		double [] candidate = {30.3, 32.1};
		double metric =        getMetric(image, mask, size, 16, candidate);
		double metric_scaled = getMetric(SyntheticImages.scale(image, 3.0), mask, size, 16, candidate);
		assertTrue(metric > 0.0);
		assertEquals(9.0, metric_scaled / metric, 1e-9);
	}

	@Test
	public void fullyMaskedImageGivesNoData() {
		int size = 16;
		double [] image = SyntheticImages.getRingImage(size, size, 8.0, 8.0);
		double metric = getMetric(image, SyntheticImages.getMask(image.length, false), size, 4, new double [] {8.0, 8.0});
		assertTrue(AsymmetryMetric.isNoData(metric));
	}
}
