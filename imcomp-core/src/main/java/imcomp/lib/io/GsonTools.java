/*-
 * #%L
 * This file is part of ImageComplexity.
 * %%
 * Copyright (C) 2024 ImageComplexity developers
 * %%
 * ImageComplexity is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ImageComplexity is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ImageComplexity.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package imcomp.lib.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Helper class providing consistently-configured Gson instances.
 * <p>
 * Special floating point values (NaN, infinities) are supported, since these can legitimately 
 * occur in both parameters and measurement results.
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient();

	private static final Gson gson = builder.create();
	private static final Gson gsonPretty = builder.create().newBuilder().setPrettyPrinting().create();

	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Access a builder inheriting the default settings.
	 * Changes to the returned builder do not affect the instances returned by {@link #getInstance()}.
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting GsonBuilder");
		return gson.newBuilder();
	}

	/**
	 * Get a default Gson instance.
	 * @return
	 */
	public static Gson getInstance() {
		return getInstance(false);
	}

	/**
	 * Get a default Gson instance, optionally with pretty printing.
	 * @param pretty
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		return pretty ? gsonPretty : gson;
	}

}
