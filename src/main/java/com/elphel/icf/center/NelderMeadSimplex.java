package com.elphel.icf.center;
/**
 **
 ** NelderMeadSimplex - derivative-free minimization of a function of a few
 ** variables (here - the center x, y)
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  NelderMeadSimplex.java is free software: you can redistribute it and/or modify
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
import java.util.function.ToDoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NelderMeadSimplex {
	private static final Logger LOGGER = LoggerFactory.getLogger(NelderMeadSimplex.class);

	static final double RHO =           1.0;     // reflection
	static final double CHI =           2.0;     // expansion
	static final double PSI =           0.5;     // contraction
	static final double SIGMA =         0.5;     // shrink
	static final double NONZERO_DELTA = 0.05;    // relative initial step for nonzero coordinates
	static final double ZERO_DELTA =    0.00025; // initial step for zero coordinates

	final double xatol;
	final double fatol;
	final int    max_iter;
	final int    debug_level;

	double [][]  simplex =         null;
	double []    values =          null;
	int          num_iter =        0;
	int          num_evaluations = 0;
	boolean      converged =       false;

	public NelderMeadSimplex(
			double xatol,     // stop when all vertices are within xatol of the best one
			double fatol,     // stop when all values are within fatol of the best one
			int    max_iter,
			int    debug_level) {
		this.xatol =       xatol;
		this.fatol =       fatol;
		this.max_iter =    max_iter;
		this.debug_level = debug_level;
	}

	/**
	 * Minimize the function starting from x0. Stops at the first of: simplex size within xatol,
	 * vertex values spread within fatol, max_iter iterations. Infinite values are
	 * accepted and treated as worse than any finite one.
	 * @param func function to minimize
	 * @param x0 start point
	 * @return best point found
	 */
	public double [] minimize(
			ToDoubleFunction<double []> func,
			double []                   x0) {
		int n = x0.length;
		simplex =         new double [n + 1][];
		values =          new double [n + 1];
		num_iter =        0;
		num_evaluations = 0;
		converged =       false;
		simplex[0] = x0.clone();
		for (int k = 0; k < n; k++) {
			double [] y = x0.clone();
			y[k] = (y[k] != 0.0) ? ((1.0 + NONZERO_DELTA) * y[k]) : ZERO_DELTA;
			simplex[k + 1] = y;
		}
		for (int i = 0; i <= n; i++) {
			values[i] = evaluate(func, simplex[i]);
		}
		sortSimplex();

		while (num_iter < max_iter) {
			if (checkConvergence()) {
				converged = true;
				break;
			}
			double [] xbar = new double [n];
			for (int i = 0; i < n; i++) {
				for (int k = 0; k < n; k++) {
					xbar[k] += simplex[i][k] / n;
				}
			}
			double [] worst = simplex[n];
			double [] xr =  combine(xbar, worst, 1.0 + RHO, -RHO);
			double    fxr = evaluate(func, xr);
			boolean shrink = false;
			if (fxr < values[0]) {
				double [] xe =  combine(xbar, worst, 1.0 + RHO * CHI, -RHO * CHI);
				double    fxe = evaluate(func, xe);
				if (fxe < fxr) {
					replaceWorst(xe, fxe);
				} else {
					replaceWorst(xr, fxr);
				}
			} else if (fxr < values[n - 1]) {
				replaceWorst(xr, fxr);
			} else if (fxr < values[n]) { // outside contraction
				double [] xc =  combine(xbar, worst, 1.0 + PSI * RHO, -PSI * RHO);
				double    fxc = evaluate(func, xc);
				if (fxc <= fxr) {
					replaceWorst(xc, fxc);
				} else {
					shrink = true;
				}
			} else { // inside contraction
				double [] xcc =  combine(xbar, worst, 1.0 - PSI, PSI);
				double    fxcc = evaluate(func, xcc);
				if (fxcc < values[n]) {
					replaceWorst(xcc, fxcc);
				} else {
					shrink = true;
				}
			}
			if (shrink) {
				for (int i = 1; i <= n; i++) {
					simplex[i] = combine(simplex[0], simplex[i], 1.0 - SIGMA, SIGMA);
					values[i] =  evaluate(func, simplex[i]);
				}
			}
			sortSimplex();
			num_iter++;
			if (debug_level > 2) {
				LOGGER.debug("Step "+num_iter+(shrink ? " (shrink)" : "")+": best "+Arrays.toString(simplex[0])+
						" -> "+values[0]+", worst -> "+values[n]);
			}
		}
		if (!converged && checkConvergence()) {
			converged = true;
		}
		if (debug_level > 0) {
			LOGGER.info("Simplex search "+(converged ? "converged" : "reached iteration limit")+" after "+
					num_iter+" iterations, "+num_evaluations+" evaluations: "+Arrays.toString(simplex[0])+" -> "+values[0]);
		}
		return simplex[0].clone();
	}

	boolean checkConvergence() {
		double dx_max = 0.0;
		double df_max = 0.0;
		for (int i = 1; i < simplex.length; i++) {
			for (int k = 0; k < simplex[0].length; k++) {
				dx_max = Math.max(dx_max, Math.abs(simplex[i][k] - simplex[0][k]));
			}
			df_max = Math.max(df_max, Math.abs(values[i] - values[0])); // NaN for two infinities
		}
		return (dx_max <= xatol) || (df_max <= fatol);
	}

	double evaluate(
			ToDoubleFunction<double []> func,
			double []                   x) {
		num_evaluations++;
		return func.applyAsDouble(x);
	}

	void replaceWorst(double [] x, double fx) {
		simplex[simplex.length - 1] = x;
		values[values.length - 1] =   fx;
	}

	// stable, so ties keep earlier (older best) vertices first
	void sortSimplex() {
		Integer [] order = new Integer [values.length];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		final double [] vals = values;
		Arrays.sort(order, (a, b) -> Double.compare(vals[a], vals[b]));
		double [][] sorted_simplex = new double [simplex.length][];
		double []   sorted_values =  new double [values.length];
		for (int i = 0; i < order.length; i++) {
			sorted_simplex[i] = simplex[order[i]];
			sorted_values[i] =  values[order[i]];
		}
		simplex = sorted_simplex;
		values =  sorted_values;
	}

	static double [] combine(
			double [] a,
			double [] b,
			double    ka,
			double    kb) {
		double [] rslt = new double [a.length];
		for (int k = 0; k < a.length; k++) {
			rslt[k] = ka * a[k] + kb * b[k];
		}
		return rslt;
	}

	public double [] getBest() {
		return (simplex == null) ? null : simplex[0].clone();
	}

	public double getBestValue() {
		return (values == null) ? Double.NaN : values[0];
	}

	public int getNumIterations() {
		return num_iter;
	}

	public int getNumEvaluations() {
		return num_evaluations;
	}

	public boolean isConverged() {
		return converged;
	}
}
