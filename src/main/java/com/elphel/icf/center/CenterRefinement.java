package com.elphel.icf.center;
/**
 **
 ** CenterRefinement - result of the center refinement of one frame
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CenterRefinement.java is free software: you can redistribute it and/or modify
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

public class CenterRefinement {
	public static final int STATUS_SKIPPED =       0; // initial center was good enough
	public static final int STATUS_REFINED =       1; // simplex search was run
	public static final int STATUS_OUT_OF_BOUNDS = 2; // initial or refined center outside acceptance bounds
	public static final String [] STATUS_NAMES = {"skipped", "refined", "out of bounds"};

	final int       status;
	final double [] initial_center;
	final double [] center;          // {NaN, NaN} for STATUS_OUT_OF_BOUNDS
	final double    initial_metric;
	final double    metric;
	final int       num_iterations;  // simplex iterations
	final int       num_evaluations; // metric evaluations by the simplex search
	final boolean   converged;

	CenterRefinement(
			int       status,
			double [] initial_center,
			double [] center,
			double    initial_metric,
			double    metric,
			int       num_iterations,
			int       num_evaluations,
			boolean   converged) {
		this.status =          status;
		this.initial_center =  initial_center;
		this.center =          center;
		this.initial_metric =  initial_metric;
		this.metric =          metric;
		this.num_iterations =  num_iterations;
		this.num_evaluations = num_evaluations;
		this.converged =       converged;
	}

	static CenterRefinement rejected(
			double [] initial_center,
			double    initial_metric) {
		return new CenterRefinement(
				STATUS_OUT_OF_BOUNDS,
				initial_center,
				new double [] {Double.NaN, Double.NaN},
				initial_metric,
				Double.NaN,
				0,
				0,
				false);
	}

	CenterRefinement reject() {
		return new CenterRefinement(
				STATUS_OUT_OF_BOUNDS,
				initial_center,
				new double [] {Double.NaN, Double.NaN},
				initial_metric,
				metric,
				num_iterations,
				num_evaluations,
				converged);
	}

	public int getStatus() {
		return status;
	}

	public double [] getCenter() {
		return center.clone();
	}

	public double getX() {
		return center[0];
	}

	public double getY() {
		return center[1];
	}

	public double [] getInitialCenter() {
		return initial_center.clone();
	}

	public double getInitialMetric() {
		return initial_metric;
	}

	public double getMetric() {
		return metric;
	}

	public int getNumIterations() {
		return num_iterations;
	}

	public int getNumEvaluations() {
		return num_evaluations;
	}

	public boolean isSkipped() {
		return status == STATUS_SKIPPED;
	}

	public boolean isConverged() {
		return converged;
	}

	/**
	 * False when no candidate had comparable data in the opposite wedges,
	 * the caller should report insufficient valid data
	 */
	public boolean hasData() {
		return !AsymmetryMetric.isNoData(metric) && !Double.isNaN(metric);
	}

	public boolean isWithin(double xmin, double xmax, double ymin, double ymax) {
		return (center[0] >= xmin) && (center[0] < xmax) && (center[1] >= ymin) && (center[1] < ymax);
	}

	@Override
	public String toString() {
		return String.format("%s: (%.3f, %.3f) -> (%.3f, %.3f), metric %g -> %g, %d iterations, %d evaluations%s",
				STATUS_NAMES[status], initial_center[0], initial_center[1], center[0], center[1],
				initial_metric, metric, num_iterations, num_evaluations, (converged ? "" : ", not converged"));
	}
}
