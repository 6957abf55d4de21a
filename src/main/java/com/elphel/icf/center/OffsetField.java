package com.elphel.icf.center;
/**
 **
 ** OffsetField - per-pixel coordinate offsets from the base center of a frame,
 ** translated (not recalculated) for every candidate center
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OffsetField.java is free software: you can redistribute it and/or modify
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

public class OffsetField {
	final int        width;
	final int        height;
	final double []  base_center; // {x, y}
	final double []  dx_base;     // column - base_x, linescan order
	final double []  dy_base;     // row - base_y, linescan order

	public OffsetField(
			int        width,
			int        height,
			double []  base_center) {
		if ((width <= 0) || (height <= 0)) {
			throw new IllegalArgumentException ("OffsetField(): invalid image size "+width+"x"+height);
		}
		if ((base_center == null) || (base_center.length < 2)) {
			throw new IllegalArgumentException ("OffsetField(): base center should be {x, y}");
		}
		this.width =       width;
		this.height =      height;
		this.base_center = new double [] {base_center[0], base_center[1]};
		this.dx_base =     new double [width * height];
		this.dy_base =     new double [width * height];
		for (int row = 0; row < height; row++) {
			double dy = row - base_center[1];
			int indx = row * width;
			for (int col = 0; col < width; col++) {
				dx_base[indx] = col - base_center[0];
				dy_base[indx] = dy;
				indx++;
			}
		}
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getLength() {
		return dx_base.length;
	}

	/**
	 * Shift of the candidate center relative to the base center
	 * @param center candidate center {x, y}
	 * @return {candidate_x - base_x, candidate_y - base_y}
	 */
	public double [] getShift(double [] center) {
		return new double [] {center[0] - base_center[0], center[1] - base_center[1]};
	}

	/**
	 * Horizontal offset of the pixel from a shifted center
	 * @param indx pixel linescan index
	 * @param shift_x candidate_x - base_x
	 * @return column - candidate_x
	 */
	public double getDx(int indx, double shift_x) {
		return dx_base[indx] - shift_x;
	}

	public double getDy(int indx, double shift_y) {
		return dy_base[indx] - shift_y;
	}
}
