package com.elphel.icf.center;
/**
 **
 ** CenterAsymmetryObjective - asymmetry metric of one frame as a function of the
 ** candidate center
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CenterAsymmetryObjective.java is free software: you can redistribute it and/or modify
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

import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CenterAsymmetryObjective implements ToDoubleFunction<double []> {
	private static final Logger LOGGER = LoggerFactory.getLogger(CenterAsymmetryObjective.class);

	final double []            image;
	final boolean []           mask;
	final OffsetField          offsets;
	final RadialWedgeProfiler  profiler;
	final boolean              symmetric_mask;
	final int                  debug_level;
	int                        num_evaluations = 0;

	public CenterAsymmetryObjective(
			double []            image,
			boolean []           mask,
			OffsetField          offsets,
			RadialWedgeProfiler  profiler,
			boolean              symmetric_mask,
			int                  debug_level) {
		this.image =          image;
		this.mask =           mask;
		this.offsets =        offsets;
		this.profiler =       profiler;
		this.symmetric_mask = symmetric_mask;
		this.debug_level =    debug_level;
	}

	public WedgeProfiles getProfiles(double [] center) {
		boolean [] used_mask = symmetric_mask ?
				SymmetricMask.getMask(mask, offsets.getWidth(), offsets.getHeight(), center) : mask;
		return profiler.getProfiles(image, used_mask, offsets, center);
	}

	public double getMetric(double [] center) {
		num_evaluations++;
		double metric = AsymmetryMetric.getMetric(getProfiles(center));
		if (debug_level > 1) {
			LOGGER.debug("Candidate center: "+center[0]+":"+center[1]+", metric: "+metric);
		}
		return metric;
	}

	@Override
	public double applyAsDouble(double [] center) {
		return getMetric(center);
	}

	public int getNumEvaluations() {
		return num_evaluations;
	}
}
