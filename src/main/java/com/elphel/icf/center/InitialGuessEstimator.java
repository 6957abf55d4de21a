package com.elphel.icf.center;
/**
 **
 ** InitialGuessEstimator - intensity-weighted centroid of the valid pixels,
 ** used as a starting point for the center refinement
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InitialGuessEstimator.java is free software: you can redistribute it and/or modify
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InitialGuessEstimator {
	private static final Logger LOGGER = LoggerFactory.getLogger(InitialGuessEstimator.class);

	/**
	 * Intensity-weighted centroid over pixels where mask is true. Non-finite pixels are skipped.
	 * Falls back to the geometric image center {width/2, height/2} when the total valid
	 * intensity is zero (fully masked or all-zero image) or the centroid is not finite.
	 * @param image pixel intensities, linescan order
	 * @param mask  true for usable pixels, same length as image
	 * @param width image width
	 * @return {cx, cy}, always finite
	 */
	public static double [] getCenter(
			double []  image,
			boolean [] mask,
			int        width) {
		int height = checkShape(image, mask, width);
		double s0 =  0.0;
		double sx =  0.0;
		double sy =  0.0;
		for (int row = 0; row < height; row++) {
			int indx = row * width;
			for (int col = 0; col < width; col++) {
				if (mask[indx]) {
					double d = image[indx];
					if (!Double.isNaN(d) && !Double.isInfinite(d)) {
						s0 += d;
						sx += d * col;
						sy += d * row;
					}
				}
				indx++;
			}
		}
		double [] geometric = {width / 2.0, height / 2.0};
		if (s0 == 0.0) {
			LOGGER.debug("getCenter(): no valid intensity, using geometric center "+geometric[0]+":"+geometric[1]);
			return geometric;
		}
		double [] centroid = {sx / s0, sy / s0};
		if (Double.isNaN(centroid[0]) || Double.isInfinite(centroid[0]) ||
				Double.isNaN(centroid[1]) || Double.isInfinite(centroid[1])) {
			LOGGER.warn("getCenter(): centroid is not finite (total intensity "+s0+"), using geometric center");
			return geometric;
		}
		return centroid;
	}

	static int checkShape(
			double []  image,
			boolean [] mask,
			int        width) {
		if (width <= 0) {
			throw new IllegalArgumentException ("Image width should be positive, got "+width);
		}
		if ((image == null) || (mask == null)) {
			throw new IllegalArgumentException ("Image and mask are required");
		}
		if (image.length != mask.length) {
			throw new IllegalArgumentException ("Mask length ("+mask.length+") does not match image length ("+image.length+")");
		}
		if ((image.length == 0) || ((image.length % width) != 0)) {
			throw new IllegalArgumentException ("Image length ("+image.length+") is not a positive multiple of width ("+width+")");
		}
		return image.length / width;
	}
}
