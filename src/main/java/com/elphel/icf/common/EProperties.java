package com.elphel.icf.common;
/**
 **
 ** EProperties - java.util.Properties with typed getters and loaders
 **
 ** Copyright (C) 2025 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  EProperties.java is free software: you can redistribute it and/or modify
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
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883045L;
	private static final Logger LOGGER = LoggerFactory.getLogger(EProperties.class);

	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value).trim());
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value));
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value).trim());
	}

	public static EProperties load(Path path) throws IOException {
		EProperties properties = new EProperties();
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		LOGGER.info("Loaded "+properties.size()+" properties from "+path);
		return properties;
	}

	/**
	 * Load properties from the class path
	 * @param cls class used to resolve the resource name
	 * @param resource resource name, absolute ("/name") or relative to the class package
	 * @return loaded properties
	 * @throws IOException if the resource is missing or can not be read
	 */
	public static EProperties loadResource(Class<?> cls, String resource) throws IOException {
		EProperties properties = new EProperties();
		try (InputStream is = cls.getResourceAsStream(resource)) {
			if (is == null) {
				throw new IOException("Resource "+resource+" is not found for "+cls.getName());
			}
			properties.load(is);
		}
		LOGGER.info("Loaded "+properties.size()+" properties from resource "+resource);
		return properties;
	}
}
