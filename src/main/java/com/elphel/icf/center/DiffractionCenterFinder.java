package com.elphel.icf.center;
/**
 **
 ** DiffractionCenterFinder - refine diffraction (beam) center of a frame by
 ** minimizing asymmetry of the opposite wedge radial profiles
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DiffractionCenterFinder.java is free software: you can redistribute it and/or modify
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

import com.elphel.icf.frames.DiffractionFrame;

/*
 * Per-frame sequence:
 *  initial center (caller-provided or intensity centroid) -> offset field ->
 *  metric at the initial center -> [skip if below icf_skip_tol] -> simplex search.
 * Keeps no state between calls, so one instance may serve frames from many threads.
 */
public class DiffractionCenterFinder {
	private static final Logger LOGGER = LoggerFactory.getLogger(DiffractionCenterFinder.class);

	final DiffractionCenterParameters params;

	public DiffractionCenterFinder() {
		this(new DiffractionCenterParameters());
	}

	public DiffractionCenterFinder(DiffractionCenterParameters params) {
		this.params = params.clone();
	}

	public DiffractionCenterParameters getParameters() {
		return params.clone();
	}

	public static double [] initialGuess(
			double []  image,
			boolean [] mask,
			int        width) {
		return InitialGuessEstimator.getCenter(image, mask, width);
	}

	public static double [] initialGuess(DiffractionFrame frame) {
		return initialGuess(frame.getPixels(), frame.getMask(), frame.getWidth());
	}

	/**
	 * Refined center of the frame
	 * @param image pixel intensities, linescan order
	 * @param mask true for usable pixels
	 * @param width image width
	 * @param initial_center start point {x, y} or null to use the intensity centroid
	 * @return refined center {x, y}
	 */
	public double [] refineCenter(
			double []  image,
			boolean [] mask,
			int        width,
			double []  initial_center) {
		return refine(image, mask, width, initial_center).getCenter();
	}

	public CenterRefinement refine(
			double []  image,
			boolean [] mask,
			int        width,
			double []  initial_center) {
		int height = InitialGuessEstimator.checkShape(image, mask, width);
		RadialWedgeProfiler profiler = params.getProfiler(width, height); // validates before any evaluation
		double [] base_center;
		if (initial_center == null) {
			base_center = InitialGuessEstimator.getCenter(image, mask, width);
		} else {
			if ((initial_center.length < 2) ||
					Double.isNaN(initial_center[0]) || Double.isInfinite(initial_center[0]) ||
					Double.isNaN(initial_center[1]) || Double.isInfinite(initial_center[1])) {
				throw new IllegalArgumentException ("Initial center should be finite {x, y}");
			}
			base_center = new double [] {initial_center[0], initial_center[1]};
		}
		if (params.icf_debug_level > 0) {
			LOGGER.info("Starting center refinement with initial center "+base_center[0]+":"+base_center[1]);
		}
		OffsetField offsets = new OffsetField(width, height, base_center);
		CenterAsymmetryObjective objective = new CenterAsymmetryObjective(
				image,
				mask,
				offsets,
				profiler,
				params.icf_symmetric_mask,
				params.icf_debug_level);
		double initial_metric = objective.getMetric(base_center);
		if (initial_metric < params.icf_skip_tol) {
			if (params.icf_debug_level > 0) {
				LOGGER.info("Metric at initial center ("+initial_metric+") is below "+params.icf_skip_tol+", skipping optimization");
			}
			return new CenterRefinement(
					CenterRefinement.STATUS_SKIPPED,
					base_center,
					base_center.clone(),
					initial_metric,
					initial_metric,
					0,
					0,
					true);
		}
		NelderMeadSimplex simplex = new NelderMeadSimplex(
				params.icf_xatol,
				params.icf_fatol,
				params.icf_max_iter,
				params.icf_debug_level);
		double [] refined = simplex.minimize(objective, base_center);
		double metric = simplex.getBestValue();
		if (AsymmetryMetric.isNoData(metric)) {
			LOGGER.warn("No comparable radial bins for any candidate near "+base_center[0]+":"+base_center[1]+
					" - insufficient valid data");
			refined = base_center.clone();
		}
		CenterRefinement refinement = new CenterRefinement(
				CenterRefinement.STATUS_REFINED,
				base_center,
				refined,
				initial_metric,
				metric,
				simplex.getNumIterations(),
				simplex.getNumEvaluations(),
				simplex.isConverged());
		if (params.icf_debug_level > 0) {
			LOGGER.info("Refined center: "+refinement);
		}
		return refinement;
	}

	public CenterRefinement refineFrame(DiffractionFrame frame) {
		return refineFrame(frame, null);
	}

	/**
	 * Refine the frame center and check it against icf_xmin..icf_ymax. Both the initial
	 * and the refined centers should be inside, otherwise the result has status
	 * STATUS_OUT_OF_BOUNDS and a NaN center.
	 * @param frame image and mask
	 * @param initial_center start point or null to use the intensity centroid
	 * @return refinement result
	 */
	public CenterRefinement refineFrame(
			DiffractionFrame frame,
			double []        initial_center) {
		params.validate(frame.getWidth(), frame.getHeight());
		double [] guess = (initial_center != null) ? initial_center : initialGuess(frame);
		if (!params.isWithinBounds(guess)) {
			LOGGER.warn("Frame "+frame.getTitle()+": initial center "+guess[0]+":"+guess[1]+" is out of bounds");
			return CenterRefinement.rejected(guess.clone(), Double.NaN);
		}
		CenterRefinement refinement = refine(frame.getPixels(), frame.getMask(), frame.getWidth(), guess);
		if (!params.isWithinBounds(refinement.center)) {
			LOGGER.warn("Frame "+frame.getTitle()+": refined center "+refinement.center[0]+":"+refinement.center[1]+" is out of bounds");
			return refinement.reject();
		}
		return refinement;
	}
}
