package com.elphel.icf.frames;
/**
 **
 ** DiffractionFrame - intensity image and validity mask of a single detector frame
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DiffractionFrame.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ImageProcessor;

/**
 * Image (linescan order doubles) and mask (true - usable pixel) of the same size. Arrays are
 * shared with the caller and are not modified by the center finder.
 */
public class DiffractionFrame {
	final String     title;
	final int        width;
	final int        height;
	final double []  pixels;
	final boolean [] mask;

	public DiffractionFrame(
			String     title,
			double []  pixels,
			boolean [] mask,
			int        width) {
		if (width <= 0) {
			throw new IllegalArgumentException ("Frame width should be positive, got "+width);
		}
		if ((pixels == null) || (pixels.length == 0) || ((pixels.length % width) != 0)) {
			throw new IllegalArgumentException ("Frame "+title+": pixel array length is not a positive multiple of width "+width);
		}
		if (mask == null) {
			mask = new boolean [pixels.length];
			Arrays.fill(mask, true);
		} else if (mask.length != pixels.length) {
			throw new IllegalArgumentException ("Frame "+title+": mask length ("+mask.length+
					") does not match pixel array length ("+pixels.length+")");
		}
		this.title =  title;
		this.width =  width;
		this.height = pixels.length / width;
		this.pixels = pixels;
		this.mask =   mask;
	}

	/**
	 * Create frame from [row][column] arrays
	 * @param title frame name for messages
	 * @param data intensities [height][width]
	 * @param mask validity [height][width] or null for all valid
	 */
	public static DiffractionFrame fromArrays(
			String        title,
			double [][]   data,
			boolean [][]  mask) {
		if ((data == null) || (data.length == 0) || (data[0].length == 0)) {
			throw new IllegalArgumentException ("Frame "+title+": empty data");
		}
		int height = data.length;
		int width =  data[0].length;
		double []  pixels =   new double [width * height];
		boolean [] pix_mask = (mask == null) ? null : new boolean [width * height];
		for (int row = 0; row < height; row++) {
			if ((data[row].length != width) || ((mask != null) && ((mask.length != height) || (mask[row].length != width)))) {
				throw new IllegalArgumentException ("Frame "+title+": row "+row+" size mismatch");
			}
			System.arraycopy(data[row], 0, pixels, row * width, width);
			if (pix_mask != null) {
				System.arraycopy(mask[row], 0, pix_mask, row * width, width);
			}
		}
		return new DiffractionFrame(title, pixels, pix_mask, width);
	}

	/**
	 * Create frame from ImageJ processors
	 * @param title frame name for messages
	 * @param ip intensity image of any ImageJ type
	 * @param mask_ip mask image of the same size, nonzero - usable pixel, null - all usable
	 */
	public static DiffractionFrame fromProcessors(
			String          title,
			ImageProcessor  ip,
			ImageProcessor  mask_ip) {
		int width =  ip.getWidth();
		int height = ip.getHeight();
		float [] fpixels = (float []) ip.convertToFloat().getPixels();
		double [] pixels = new double [fpixels.length];
		for (int i = 0; i < pixels.length; i++) {
			pixels[i] = fpixels[i];
		}
		boolean [] mask = null;
		if (mask_ip != null) {
			if ((mask_ip.getWidth() != width) || (mask_ip.getHeight() != height)) {
				throw new IllegalArgumentException ("Frame "+title+": mask size "+mask_ip.getWidth()+"x"+mask_ip.getHeight()+
						" does not match image size "+width+"x"+height);
			}
			mask = getMask(mask_ip);
		}
		return new DiffractionFrame(title, pixels, mask, width);
	}

	/**
	 * Create frame from a slice of an ImageJ stack
	 * @param imp image or stack
	 * @param slice 1-based slice number
	 * @param mask_ip mask image, nonzero - usable pixel, null - all usable
	 */
	public static DiffractionFrame fromImagePlus(
			ImagePlus       imp,
			int             slice,
			ImageProcessor  mask_ip) {
		ImageStack stack = imp.getStack();
		if ((slice < 1) || (slice > stack.getSize())) {
			throw new IllegalArgumentException ("Slice "+slice+" is outside of 1.."+stack.getSize()+" for "+imp.getTitle());
		}
		return fromProcessors(imp.getTitle()+":"+slice, stack.getProcessor(slice), mask_ip);
	}

	public static boolean [] getMask(ImageProcessor mask_ip) {
		boolean [] mask = new boolean [mask_ip.getWidth() * mask_ip.getHeight()];
		for (int i = 0; i < mask.length; i++) {
			float v = mask_ip.getf(i);
			mask[i] = (v != 0.0f) && !Float.isNaN(v);
		}
		return mask;
	}

	public String getTitle() {
		return title;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public double [] getPixels() {
		return pixels;
	}

	public boolean [] getMask() {
		return mask;
	}

	public int getNumValid() {
		int num = 0;
		for (boolean b : mask) if (b) num++;
		return num;
	}
}
