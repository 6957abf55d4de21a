package com.elphel.icf.center;
/**
 **
 ** DiffractionCenterParametersTest - parameter validation and persistence
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DiffractionCenterParametersTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class DiffractionCenterParametersTest {

	@Test
	public void defaultsAreUsable() {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		assertEquals(16,  dcp.icf_n_wedges);
		assertEquals(2.5, dcp.icf_skip_tol, 0.0);
		assertEquals(30.0, dcp.getRMax(80, 60), 0.0);
		dcp.validate(80, 60);
		assertEquals(16, dcp.getProfiler(80, 60).getNumWedges());
	}

	@Test
	public void loadsPrefixedResource() throws IOException {
		DiffractionCenterParameters dcp = DiffractionCenterParameters.loadResource("DC.", "/center_finder.properties");
		assertEquals(8,     dcp.icf_n_wedges);
		assertEquals(64,    dcp.icf_n_rad_bins);
		assertTrue(Double.isNaN(dcp.icf_r_max));
		assertEquals(1e-6,  dcp.icf_fatol, 0.0);
		assertEquals(3.0,   dcp.icf_skip_tol, 0.0);
		assertTrue(dcp.icf_symmetric_mask);
		assertEquals(1024.0, dcp.icf_xmax, 0.0);
		assertEquals(0,     dcp.icf_debug_level); // not in the file
		assertThrows(IOException.class, () -> DiffractionCenterParameters.loadResource("DC.", "/missing.properties"));
	}

	@Test
	public void propertiesKeepUnboundedLimits() {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		dcp.icf_n_rad_bins = 150;
		dcp.icf_ymax =       512.0;
		Properties properties = new Properties();
		dcp.setProperties("CENTER.", properties);
		assertEquals("-Infinity", properties.getProperty("CENTER.icf_xmin"));
		DiffractionCenterParameters restored = new DiffractionCenterParameters();
		restored.getProperties("CENTER.", properties);
		assertEquals(150, restored.icf_n_rad_bins);
		assertEquals(512.0, restored.icf_ymax, 0.0);
		assertEquals(Double.NEGATIVE_INFINITY, restored.icf_xmin, 0.0);
		assertTrue(restored.isWithinBounds(new double [] {-1e9, 511.9}));
		assertFalse(restored.isWithinBounds(new double [] {0.0, 512.0}));
		assertFalse(restored.isWithinBounds(new double [] {Double.NaN, 0.0}));
	}

	@Test
	public void cloneIsIndependent() {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		DiffractionCenterParameters copy = dcp.clone();
		copy.icf_n_wedges = 4;
		copy.icf_symmetric_mask = true;
		assertEquals(16, dcp.icf_n_wedges);
		assertFalse(dcp.icf_symmetric_mask);
	}

	@Test
	public void validationRejectsUnusableSettings() {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		dcp.icf_r_min = 40.0; // beyond default r_max of a 64x64 image
		assertThrows(CenterFinderConfigurationException.class, () -> dcp.validate(64, 64));
		dcp.icf_r_min = 0.0;
		dcp.icf_max_iter = 0;
		assertThrows(CenterFinderConfigurationException.class, () -> dcp.validate(64, 64));
		dcp.icf_max_iter = 10;
		dcp.icf_xatol = -1.0;
		assertThrows(CenterFinderConfigurationException.class, () -> dcp.validate(64, 64));
		dcp.icf_xatol = 0.1;
		dcp.icf_xmin = 100.0;
		dcp.icf_xmax = 100.0;
		assertThrows(CenterFinderConfigurationException.class, () -> dcp.validate(64, 64));
	}
}
