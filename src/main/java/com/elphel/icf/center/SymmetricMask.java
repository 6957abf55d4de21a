package com.elphel.icf.center;
/**
 **
 ** SymmetricMask - keep only pixels whose point reflection about the candidate
 ** center is inside the image and valid too
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SymmetricMask.java is free software: you can redistribute it and/or modify
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

public class SymmetricMask {

	/**
	 * Build a mask of the mirrored pixel pairs. Mirror of pixel (x, y) is
	 * (rint(2*cx - x), rint(2*cy - y)). A pair is kept when both pixels are valid, a pixel
	 * that is its own mirror is kept when valid. Source mask is not modified.
	 * @param mask   source mask, true - usable pixel
	 * @param width  image width
	 * @param height image height
	 * @param center candidate center {x, y}
	 * @return new mask
	 */
	public static boolean [] getMask(
			boolean [] mask,
			int        width,
			int        height,
			double []  center) {
		if (mask.length != (width * height)) {
			throw new IllegalArgumentException ("SymmetricMask.getMask(): mask length "+mask.length+
					" does not match "+width+"x"+height);
		}
		boolean [] sym_mask = new boolean [mask.length];
		double mx0 = 2.0 * center[0];
		double my0 = 2.0 * center[1];
		for (int indx = 0; indx < mask.length; indx++) {
			if (!mask[indx]) {
				continue;
			}
			int mirror = getMirrorIndex(indx, width, height, mx0, my0);
			if (mirror < 0) {
				continue;
			}
			if (mirror == indx) {
				sym_mask[indx] = true;
			} else if ((mirror > indx) && mask[mirror]) {
				sym_mask[indx] =   true;
				sym_mask[mirror] = true;
			}
		}
		return sym_mask;
	}

	static int getMirrorIndex(
			int    indx,
			int    width,
			int    height,
			double mx0,
			double my0) {
		double fx = Math.rint(mx0 - (indx % width));
		double fy = Math.rint(my0 - (indx / width));
		if (!(fx >= 0) || !(fy >= 0) || !(fx < width) || !(fy < height)) { // also NaN
			return -1;
		}
		return ((int) fy) * width + ((int) fx);
	}
}
