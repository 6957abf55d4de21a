package com.elphel.icf.center;
/**
 **
 ** DiffractionCenterParameters - Class for handling configuration parameters
 ** of the diffraction center refinement
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DiffractionCenterParameters.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;

import com.elphel.icf.common.EProperties;

public class DiffractionCenterParameters {
	public int        icf_n_wedges =       RadialWedgeProfiler.DEFAULT_WEDGES;   // even
	public int        icf_n_rad_bins =     RadialWedgeProfiler.DEFAULT_RAD_BINS;
	public double     icf_r_min =          0.0;
	public double     icf_r_max =          Double.NaN; // NaN - half of the smaller image dimension
	public double     icf_xatol =          0.1;        // pixels
	public double     icf_fatol =          0.1;        // metric units (intensity squared)
	public int        icf_max_iter =       300;
	public double     icf_skip_tol =       2.5;        // do not optimize if the initial metric is lower
	public boolean    icf_symmetric_mask = false;      // use only pixels with valid point-reflected pairs
	public double     icf_xmin =           Double.NEGATIVE_INFINITY; // acceptable centers, [min, max)
	public double     icf_xmax =           Double.POSITIVE_INFINITY;
	public double     icf_ymin =           Double.NEGATIVE_INFINITY;
	public double     icf_ymax =           Double.POSITIVE_INFINITY;
	public int        icf_debug_level =    0;

	public DiffractionCenterParameters() {
	}

	public DiffractionCenterParameters(
			int    n_wedges,
			int    n_rad_bins,
			double xatol,
			double fatol,
			int    max_iter,
			double skip_tol) {
		this.icf_n_wedges =   n_wedges;
		this.icf_n_rad_bins = n_rad_bins;
		this.icf_xatol =      xatol;
		this.icf_fatol =      fatol;
		this.icf_max_iter =   max_iter;
		this.icf_skip_tol =   skip_tol;
	}

	/**
	 * Maximal radius used for this image size
	 */
	public double getRMax(int width, int height) {
		return Double.isNaN(icf_r_max) ? RadialWedgeProfiler.getDefaultRMax(width, height) : icf_r_max;
	}

	/**
	 * Check parameters for the image size
	 * @throws CenterFinderConfigurationException for unusable settings
	 */
	public void validate(int width, int height) {
		if ((icf_n_wedges <= 0) || ((icf_n_wedges % 2) != 0)) {
			throw new CenterFinderConfigurationException ("icf_n_wedges should be positive and even, got "+icf_n_wedges);
		}
		if (icf_n_rad_bins <= 0) {
			throw new CenterFinderConfigurationException ("icf_n_rad_bins should be positive, got "+icf_n_rad_bins);
		}
		double r_max = getRMax(width, height);
		if (!(r_max > 0) || Double.isInfinite(r_max)) {
			throw new CenterFinderConfigurationException ("icf_r_max should be positive and finite, got "+r_max+
					" (image "+width+"x"+height+")");
		}
		if (!(icf_r_min >= 0) || !(icf_r_min < r_max)) {
			throw new CenterFinderConfigurationException ("icf_r_min should be in [0, "+r_max+"), got "+icf_r_min);
		}
		if (icf_max_iter <= 0) {
			throw new CenterFinderConfigurationException ("icf_max_iter should be positive, got "+icf_max_iter);
		}
		if (!(icf_xatol >= 0) || !(icf_fatol >= 0)) {
			throw new CenterFinderConfigurationException ("Tolerances should be non-negative, got xatol="+icf_xatol+
					", fatol="+icf_fatol);
		}
		if (Double.isNaN(icf_skip_tol)) {
			throw new CenterFinderConfigurationException ("icf_skip_tol should be a number");
		}
		if (!(icf_xmin < icf_xmax) || !(icf_ymin < icf_ymax)) {
			throw new CenterFinderConfigurationException ("Empty acceptance bounds x:["+icf_xmin+", "+icf_xmax+
					"), y:["+icf_ymin+", "+icf_ymax+")");
		}
	}

	public RadialWedgeProfiler getProfiler(int width, int height) {
		validate(width, height);
		return new RadialWedgeProfiler(
				icf_n_wedges,
				icf_n_rad_bins,
				icf_r_min,
				getRMax(width, height));
	}

	public boolean isWithinBounds(double [] center) {
		return (center != null) &&
				(center[0] >= icf_xmin) && (center[0] < icf_xmax) &&
				(center[1] >= icf_ymin) && (center[1] < icf_ymax);
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"icf_n_wedges",       this.icf_n_wedges+"");
		properties.setProperty(prefix+"icf_n_rad_bins",     this.icf_n_rad_bins+"");
		properties.setProperty(prefix+"icf_r_min",          this.icf_r_min+"");
		properties.setProperty(prefix+"icf_r_max",          this.icf_r_max+"");
		properties.setProperty(prefix+"icf_xatol",          this.icf_xatol+"");
		properties.setProperty(prefix+"icf_fatol",          this.icf_fatol+"");
		properties.setProperty(prefix+"icf_max_iter",       this.icf_max_iter+"");
		properties.setProperty(prefix+"icf_skip_tol",       this.icf_skip_tol+"");
		properties.setProperty(prefix+"icf_symmetric_mask", this.icf_symmetric_mask+"");
		properties.setProperty(prefix+"icf_xmin",           this.icf_xmin+"");
		properties.setProperty(prefix+"icf_xmax",           this.icf_xmax+"");
		properties.setProperty(prefix+"icf_ymin",           this.icf_ymin+"");
		properties.setProperty(prefix+"icf_ymax",           this.icf_ymax+"");
		properties.setProperty(prefix+"icf_debug_level",    this.icf_debug_level+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"icf_n_wedges")!=null)       this.icf_n_wedges=Integer.parseInt(properties.getProperty(prefix+"icf_n_wedges").trim());
		if (properties.getProperty(prefix+"icf_n_rad_bins")!=null)     this.icf_n_rad_bins=Integer.parseInt(properties.getProperty(prefix+"icf_n_rad_bins").trim());
		if (properties.getProperty(prefix+"icf_r_min")!=null)          this.icf_r_min=Double.parseDouble(properties.getProperty(prefix+"icf_r_min"));
		if (properties.getProperty(prefix+"icf_r_max")!=null)          this.icf_r_max=Double.parseDouble(properties.getProperty(prefix+"icf_r_max"));
		if (properties.getProperty(prefix+"icf_xatol")!=null)          this.icf_xatol=Double.parseDouble(properties.getProperty(prefix+"icf_xatol"));
		if (properties.getProperty(prefix+"icf_fatol")!=null)          this.icf_fatol=Double.parseDouble(properties.getProperty(prefix+"icf_fatol"));
		if (properties.getProperty(prefix+"icf_max_iter")!=null)       this.icf_max_iter=Integer.parseInt(properties.getProperty(prefix+"icf_max_iter").trim());
		if (properties.getProperty(prefix+"icf_skip_tol")!=null)       this.icf_skip_tol=Double.parseDouble(properties.getProperty(prefix+"icf_skip_tol"));
		if (properties.getProperty(prefix+"icf_symmetric_mask")!=null) this.icf_symmetric_mask=Boolean.parseBoolean(properties.getProperty(prefix+"icf_symmetric_mask").trim());
		if (properties.getProperty(prefix+"icf_xmin")!=null)           this.icf_xmin=Double.parseDouble(properties.getProperty(prefix+"icf_xmin"));
		if (properties.getProperty(prefix+"icf_xmax")!=null)           this.icf_xmax=Double.parseDouble(properties.getProperty(prefix+"icf_xmax"));
		if (properties.getProperty(prefix+"icf_ymin")!=null)           this.icf_ymin=Double.parseDouble(properties.getProperty(prefix+"icf_ymin"));
		if (properties.getProperty(prefix+"icf_ymax")!=null)           this.icf_ymax=Double.parseDouble(properties.getProperty(prefix+"icf_ymax"));
		if (properties.getProperty(prefix+"icf_debug_level")!=null)    this.icf_debug_level=Integer.parseInt(properties.getProperty(prefix+"icf_debug_level").trim());
	}

	/**
	 * Read parameters from a properties file, missing keys keep defaults
	 */
	public static DiffractionCenterParameters load(String prefix, Path path) throws IOException {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		dcp.getProperties(prefix, EProperties.load(path));
		return dcp;
	}

	public static DiffractionCenterParameters loadResource(String prefix, String resource) throws IOException {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		dcp.getProperties(prefix, EProperties.loadResource(DiffractionCenterParameters.class, resource));
		return dcp;
	}

	@Override
	public DiffractionCenterParameters clone() {
		DiffractionCenterParameters dcp = new DiffractionCenterParameters();
		dcp.icf_n_wedges =       this.icf_n_wedges;
		dcp.icf_n_rad_bins =     this.icf_n_rad_bins;
		dcp.icf_r_min =          this.icf_r_min;
		dcp.icf_r_max =          this.icf_r_max;
		dcp.icf_xatol =          this.icf_xatol;
		dcp.icf_fatol =          this.icf_fatol;
		dcp.icf_max_iter =       this.icf_max_iter;
		dcp.icf_skip_tol =       this.icf_skip_tol;
		dcp.icf_symmetric_mask = this.icf_symmetric_mask;
		dcp.icf_xmin =           this.icf_xmin;
		dcp.icf_xmax =           this.icf_xmax;
		dcp.icf_ymin =           this.icf_ymin;
		dcp.icf_ymax =           this.icf_ymax;
		dcp.icf_debug_level =    this.icf_debug_level;
		return dcp;
	}
}
