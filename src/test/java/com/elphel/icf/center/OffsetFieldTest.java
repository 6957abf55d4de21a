package com.elphel.icf.center;
/**
 **
 ** OffsetFieldTest - offsets translated from the base center
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OffsetFieldTest.java is free software: you can redistribute it and/or modify
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

import org.junit.jupiter.api.Test;

public class OffsetFieldTest {

	@Test
	public void offsetsAreRelativeToBaseCenter() {
		OffsetField offsets = new OffsetField(5, 3, new double [] {1.5, 0.25});
		int indx = 2 * 5 + 4; // col 4, row 2
		assertEquals(2.5,  offsets.getDx(indx, 0.0), 0.0);
		assertEquals(1.75, offsets.getDy(indx, 0.0), 0.0);
		assertEquals(15,   offsets.getLength());
	}

	@Test
	public void translatedOffsetsMatchCandidateOffsets() {
		double [] base =      {30.5, 31.25};
		double [] candidate = {32.0, 31.0};
		OffsetField offsets = new OffsetField(8, 6, base);
		double [] shift = offsets.getShift(candidate);
		for (int indx = 0; indx < offsets.getLength(); indx++) {
			assertEquals((indx % 8) - candidate[0], offsets.getDx(indx, shift[0]), 1e-12);
			assertEquals((indx / 8) - candidate[1], offsets.getDy(indx, shift[1]), 1e-12);
		}
	}

	@Test
	public void profilesDoNotDependOnBaseCenter() {
		int size = SyntheticImages.SIZE;
		double [] image = SyntheticImages.getRingImage(size, size, 32.0, 31.0);
		boolean [] mask = SyntheticImages.getMask(image.length, true);
		RadialWedgeProfiler profiler = new RadialWedgeProfiler(8, 28, 0.0, 28.0);
		double [] candidate = {32.0, 31.0};
		WedgeProfiles translated = profiler.getProfiles(image, mask, new OffsetField(size, size, new double [] {30.5, 31.25}), candidate);
		WedgeProfiles direct =     profiler.getProfiles(image, mask, new OffsetField(size, size, candidate), candidate);
		for (int w = 0; w < 8; w++) {
			assertArrayEquals(direct.getProfile(w), translated.getProfile(w), 0.0);
		}
	}
}
