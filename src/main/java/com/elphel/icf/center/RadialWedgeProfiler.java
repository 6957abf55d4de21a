package com.elphel.icf.center;
/**
 **
 ** RadialWedgeProfiler - split valid pixels around a candidate center into angular
 ** wedges and radial bins, calculate per-bin median intensity of each wedge
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  RadialWedgeProfiler.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/*
 * Wedge w covers angles [-PI + w * step, -PI + w * step + step), step = 2 * PI / n_wedges,
 * angles are atan2(dy, dx) in image coordinates (y down).
 * Radial bin k covers [r_edges[k], r_edges[k+1]), pixels at or beyond r_max are not used.
 * Pixels are bucketed by (wedge, bin) once per call (counting sort), then medians are
 * calculated per bucket.
 */
public class RadialWedgeProfiler {
	public static final int    DEFAULT_WEDGES =   16;
	public static final int    DEFAULT_RAD_BINS = 100;

	final int        n_wedges;
	final int        n_rad_bins;
	final double     r_min;
	final double     r_max;
	final double []  r_edges;
	final double []  r_centers;
	final double     wedge_step;

	public RadialWedgeProfiler(
			int    n_wedges,
			int    n_rad_bins,
			double r_min,
			double r_max) {
		if ((n_wedges <= 0) || ((n_wedges % 2) != 0)) {
			throw new CenterFinderConfigurationException ("Number of wedges should be positive and even, got "+n_wedges);
		}
		if (n_rad_bins <= 0) {
			throw new CenterFinderConfigurationException ("Number of radial bins should be positive, got "+n_rad_bins);
		}
		if (!(r_max > 0) || Double.isInfinite(r_max)) {
			throw new CenterFinderConfigurationException ("Maximal radius should be positive and finite, got "+r_max);
		}
		if (!(r_min >= 0) || !(r_min < r_max)) {
			throw new CenterFinderConfigurationException ("Minimal radius should be in [0, "+r_max+"), got "+r_min);
		}
		this.n_wedges =   n_wedges;
		this.n_rad_bins = n_rad_bins;
		this.r_min =      r_min;
		this.r_max =      r_max;
		this.wedge_step = 2 * Math.PI / n_wedges;
		this.r_edges =    new double [n_rad_bins + 1];
		double r_step =   (r_max - r_min) / n_rad_bins;
		for (int i = 0; i < n_rad_bins; i++) {
			r_edges[i] = r_min + i * r_step;
		}
		r_edges[n_rad_bins] = r_max;
		this.r_centers = new double [n_rad_bins];
		for (int i = 0; i < n_rad_bins; i++) {
			r_centers[i] = 0.5 * (r_edges[i] + r_edges[i + 1]);
		}
	}

	/**
	 * Default maximal radius - half of the smaller image dimension
	 */
	public static double getDefaultRMax(int width, int height) {
		return Math.min(width, height) / 2.0;
	}

	public int getNumWedges() {
		return n_wedges;
	}

	public double [] getRadialEdges() {
		return r_edges.clone();
	}

	public double getAngleMin(int wedge) {
		return -Math.PI + wedge * wedge_step;
	}

	public double getAngleMax(int wedge) {
		return getAngleMin(wedge) + wedge_step;
	}

	/**
	 * Radial bin of the radius
	 * @param r distance from the candidate center
	 * @return bin index or -1 if r is outside of [r_min, r_max)
	 */
	public int getBin(double r) {
		if (!(r >= r_min) || !(r < r_max)) {
			return -1;
		}
		int k = (int) Math.floor((r - r_min) / (r_max - r_min) * n_rad_bins);
		if (k >= n_rad_bins) k = n_rad_bins - 1;
		while ((k > 0) && (r < r_edges[k])) k--;
		while ((k < (n_rad_bins - 1)) && (r >= r_edges[k + 1])) k++;
		return k;
	}

	/**
	 * Calculate median radial profiles of all wedges
	 * @param image     pixel intensities, linescan order
	 * @param mask      true for usable pixels
	 * @param offsets   per-pixel offsets from the base center
	 * @param center    candidate center {x, y}
	 * @return per-wedge profiles, NaN for empty bins and bins containing NaN pixels
	 */
	public WedgeProfiles getProfiles(
			double []    image,
			boolean []   mask,
			OffsetField  offsets,
			double []    center) {
		int npix = offsets.getLength();
		if ((image.length != npix) || (mask.length != npix)) {
			throw new IllegalArgumentException ("getProfiles(): image/mask length ("+image.length+"/"+mask.length+
					") does not match offset field size "+npix);
		}
		double [] shift = offsets.getShift(center);
		int n_buckets =   n_wedges * n_rad_bins;
		int [] bucket_counts = new int [n_buckets];
		// pixel may match two wedges when rounded boundaries overlap, reserve for that
		int    [] entry_bucket = new int    [npix];
		double [] entry_value =  new double [npix];
		int num_entries = 0;
		for (int indx = 0; indx < npix; indx++) if (mask[indx]) {
			double dx = offsets.getDx(indx, shift[0]);
			double dy = offsets.getDy(indx, shift[1]);
			int bin = getBin(Math.sqrt(dx * dx + dy * dy));
			if (bin < 0) {
				continue;
			}
			double theta = Math.atan2(dy, dx);
			int w0 = (int) Math.floor((theta + Math.PI) / wedge_step);
			for (int w = w0 - 1; w <= w0 + 1; w++) if ((w >= 0) && (w < n_wedges)) {
				if ((theta >= getAngleMin(w)) && (theta < getAngleMax(w))) {
					if (num_entries >= entry_bucket.length) {
						entry_bucket = Arrays.copyOf(entry_bucket, entry_bucket.length + npix / 8 + 1);
						entry_value =  Arrays.copyOf(entry_value,  entry_bucket.length);
					}
					int bucket = w * n_rad_bins + bin;
					entry_bucket[num_entries] = bucket;
					entry_value[num_entries] =  image[indx];
					bucket_counts[bucket]++;
					num_entries++;
				}
			}
		}
		int [] bucket_start = new int [n_buckets + 1];
		for (int b = 0; b < n_buckets; b++) {
			bucket_start[b + 1] = bucket_start[b] + bucket_counts[b];
		}
		double [] sorted = new double [num_entries];
		int [] fill = Arrays.copyOf(bucket_start, n_buckets);
		for (int i = 0; i < num_entries; i++) {
			sorted[fill[entry_bucket[i]]++] = entry_value[i];
		}

		Median median = new Median();
		double [][] profiles = new double [n_wedges][n_rad_bins];
		int    [][] counts =   new int    [n_wedges][n_rad_bins];
		for (int w = 0; w < n_wedges; w++) {
			for (int bin = 0; bin < n_rad_bins; bin++) {
				int bucket = w * n_rad_bins + bin;
				int start =  bucket_start[bucket];
				int len =    bucket_counts[bucket];
				counts[w][bin] = len;
				profiles[w][bin] = getBucketMedian(median, sorted, start, len);
			}
		}
		return new WedgeProfiles(profiles, counts, r_centers.clone());
	}

	static double getBucketMedian(
			Median    median,
			double [] values,
			int       start,
			int       len) {
		if (len == 0) {
			return Double.NaN;
		}
		for (int i = start; i < (start + len); i++) {
			if (Double.isNaN(values[i])) {
				return Double.NaN;
			}
		}
		return median.evaluate(values, start, len);
	}
}
