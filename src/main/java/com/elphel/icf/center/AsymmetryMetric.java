package com.elphel.icf.center;
/**
 **
 ** AsymmetryMetric - mean squared difference between radial profiles of the
 ** opposite wedges
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AsymmetryMetric.java is free software: you can redistribute it and/or modify
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

public class AsymmetryMetric {
	/** No comparable radial bins, worse than any finite score */
	public static final double NO_DATA = Double.POSITIVE_INFINITY;

	public static boolean isNoData(double metric) {
		return metric == NO_DATA;
	}

	/**
	 * Compare each wedge i in [0, n/2) with the opposite wedge i + n/2 bin by bin. Only bins
	 * where both profiles have data are used. The result is not normalized by intensity scale.
	 * @param profiles [n_wedges][n_rad_bins], NaN for missing bins, n_wedges even
	 * @return sum of squared differences / number of compared bins, or NO_DATA
	 */
	public static double getMetric(double [][] profiles) {
		if ((profiles.length % 2) != 0) {
			throw new CenterFinderConfigurationException ("Number of wedge profiles should be even, got "+profiles.length);
		}
		int half = profiles.length / 2;
		double s2 = 0.0;
		int    num = 0;
		for (int i = 0; i < half; i++) {
			double [] p1 = profiles[i];
			double [] p2 = profiles[i + half];
			int nbins = Math.min(p1.length, p2.length);
			for (int bin = 0; bin < nbins; bin++) {
				if (!Double.isNaN(p1[bin]) && !Double.isNaN(p2[bin])) {
					double d = p1[bin] - p2[bin];
					s2 += d * d;
					num++;
				}
			}
		}
		return (num > 0) ? (s2 / num) : NO_DATA;
	}

	public static double getMetric(WedgeProfiles wedge_profiles) {
		return getMetric(wedge_profiles.getProfiles());
	}
}
