package com.elphel.icf.center;
/**
 **
 ** WedgeProfiles - radial median profiles of the angular wedges around a candidate center
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  WedgeProfiles.java is free software: you can redistribute it and/or modify
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

public class WedgeProfiles {
	final double [][] profiles;  // [wedge][radial bin], NaN - no data
	final int    [][] counts;    // [wedge][radial bin] - number of member pixels
	final double []   r_centers; // radial bin centers

	WedgeProfiles(
			double [][] profiles,
			int    [][] counts,
			double []   r_centers) {
		this.profiles =  profiles;
		this.counts =    counts;
		this.r_centers = r_centers;
	}

	public double [] getProfile(int wedge) {
		return profiles[wedge];
	}

	public double [][] getProfiles() {
		return profiles;
	}

	public int getCount(int wedge, int bin) {
		return counts[wedge][bin];
	}

	public double [] getRadialCenters() {
		return r_centers;
	}

	public static boolean isMissing(double v) {
		return Double.isNaN(v);
	}
}
