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

package imcomp.lib.measurements;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.common.ThreadTools;
import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ops.Preprocessor;
import imcomp.lib.regions.PatchGrid;

/**
 * Compute the requested complexity measures for one image or a batch of images.
 * <p>
 * For each image the processor preprocesses once, derives the gradient magnitude image if needed, 
 * then evaluates each requested measure on the original and/or gradient image:
 * <ul>
 *   <li>by default, measures are computed on the preprocessed image only</li>
 *   <li>with {@code useGradToo}, each measure is also computed on the gradient image, 
 *   giving an additional column with the suffix {@link ComplexityMeasures#GRADIENT_SUFFIX}</li>
 *   <li>with {@code useGradOnly}, the gradient image replaces the original and columns keep their plain names; 
 *   this takes precedence over {@code useGradToo}</li>
 * </ul>
 * A measure that throws an exception gives NaN for that image; other measures are unaffected.
 * <p>
 * Batch processing uses a fixed-size thread pool with one task per image. 
 * Records are returned in input order, regardless of the order in which images complete.
 */
public class ComplexityProcessor {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityProcessor.class);

	private final ComplexityParameters params;
	private final Preprocessor preprocessor;
	private final Map<String, ComplexityMeasure> measures;
	private final List<String> columns;

	/**
	 * Create a processor using the default measures.
	 * @param params
	 * @throws ConfigurationException if the parameters are invalid
	 */
	public ComplexityProcessor(ComplexityParameters params) throws ConfigurationException {
		this(params, ComplexityMeasures.getDefaultMeasures());
	}

	/**
	 * Create a processor with a custom set of available measures.
	 * @param params
	 * @param available all available measures, keyed by name; the requested measures are selected from these
	 * @throws ConfigurationException if the parameters are invalid
	 */
	public ComplexityProcessor(ComplexityParameters params, Map<String, ComplexityMeasure> available) throws ConfigurationException {
		params.validate();
		this.params = params;
		this.preprocessor = Preprocessor.create(params.isIgnoreAlpha(), params.getGreyscale(), params.getResize(), params.getBlur());
		this.measures = selectMeasures(params.getMeasures(), available);
		this.columns = Collections.unmodifiableList(createColumns(measures.keySet(), params));

		if (params.isUseGradOnly() && params.isUseGradToo())
			logger.info("Both useGradOnly and useGradToo are set - measures will be computed on the gradient image only");
		if (params.isResizeSet() && params.getWassersteinDownscale() != 1.0)
			logger.info("Wasserstein downscale {} is ignored because resize is set to {}", params.getWassersteinDownscale(), params.getResize());
		logger.debug("Created processor with {} and columns {}", preprocessor, columns);
	}

	private static Map<String, ComplexityMeasure> selectMeasures(List<String> names, Map<String, ComplexityMeasure> available) {
		if (names == null)
			return new LinkedHashMap<>(available);
		Map<String, ComplexityMeasure> selected = new LinkedHashMap<>();
		for (String name : names) {
			ComplexityMeasure measure = available.get(name);
			if (measure == null)
				logger.warn("Unknown measure '{}' will be omitted", name);
			else
				selected.put(name, measure);
		}
		return selected;
	}

	private static List<String> createColumns(Iterable<String> names, ComplexityParameters params) {
		boolean both = params.isUseGradToo() && !params.isUseGradOnly();
		List<String> columns = new ArrayList<>();
		for (String name : names) {
			columns.add(name);
			if (both)
				columns.add(name + ComplexityMeasures.GRADIENT_SUFFIX);
		}
		return columns;
	}

	/**
	 * Get the output column names, excluding the image identifier.
	 * @return
	 */
	public List<String> getColumns() {
		return columns;
	}

	/**
	 * Get the parameters.
	 * @return
	 */
	public ComplexityParameters getParameters() {
		return params;
	}

	/**
	 * Returns true if an image has a channel count supported by the current parameters: 
	 * 1 or 3 channels, or any number in multispectral mode.
	 * @param image
	 * @return
	 */
	public boolean isSupported(ImageBuffer image) {
		int n = image.nChannels();
		return params.isMultispectral() || n == 1 || n == 3;
	}

	/**
	 * Measure a single image.
	 * @param imageId identifier for the output record
	 * @param image the decoded image
	 * @return
	 * @throws IllegalArgumentException if the image has an unsupported number of channels
	 */
	public MeasurementRecord process(String imageId, ImageBuffer image) throws IllegalArgumentException {
		if (!isSupported(image))
			throw new IllegalArgumentException("Image " + imageId + " has " + image.nChannels() + " channels - expected 1 or 3 unless mspec is set");

		long startTime = System.currentTimeMillis();
		ImageBuffer preprocessed = preprocessor.apply(image);
		ImageBuffer gradient = null;
		if (params.isUseGradOnly() || params.isUseGradToo())
			gradient = preprocessor.gradient(preprocessed);

		PatchGrid grid = params.isUseGradOnly() ? null : createGrid(imageId, preprocessed);
		PatchGrid gradientGrid = gradient == null ? null : createGrid(imageId + " (gradient)", gradient);

		List<MeasureResult> results = new ArrayList<>(columns.size());
		for (var entry : measures.entrySet()) {
			String name = entry.getKey();
			ComplexityMeasure measure = entry.getValue();
			if (params.isUseGradOnly()) {
				results.add(computeIsolated(imageId, name, measure, gradient, gradientGrid));
				continue;
			}
			results.add(computeIsolated(imageId, name, measure, preprocessed, grid));
			if (gradient != null) {
				String gradName = name + ComplexityMeasures.GRADIENT_SUFFIX;
				results.add(computeIsolated(imageId, gradName, measure, gradient, gradientGrid));
			}
		}
		long endTime = System.currentTimeMillis();
		logger.debug("Measured {} in {} ms", imageId, endTime - startTime);
		return new MeasurementRecord(imageId, results);
	}

	private PatchGrid createGrid(String imageId, ImageBuffer image) {
		PatchGrid grid = PatchGrid.decompose(image, params.getPatchSize(), params.getStride(), params.getBoundaryPolicy());
		if (grid.isEmpty())
			logger.warn("No valid patches for {} - patch-based measures will be NaN", imageId);
		return grid;
	}

	private MeasureResult computeIsolated(String imageId, String name, ComplexityMeasure measure, ImageBuffer image, PatchGrid grid) {
		double value;
		try {
			value = measure.compute(image, grid, params);
			if (Double.isNaN(value))
				logger.debug("{} is undefined for {}", name, imageId);
		} catch (RuntimeException e) {
			logger.warn("Unable to compute {} for {}: {}", name, imageId, e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			value = Double.NaN;
		}
		return MeasureResult.create(name, value);
	}

	/**
	 * Measure a batch of images in parallel.
	 * <p>
	 * Images that cannot be decoded, or that have an unsupported number of channels, are logged and skipped.
	 * 
	 * @param sources
	 * @return one record per successfully measured image, in the same order as {@code sources}
	 * @throws InterruptedException if interrupted while waiting for results
	 */
	public List<MeasurementRecord> processAll(List<? extends ImageSource> sources) throws InterruptedException {
		if (sources.isEmpty())
			return Collections.emptyList();
		int nThreads = Math.min(params.resolveNumThreads(), sources.size());
		ExecutorService pool = Executors.newFixedThreadPool(nThreads, ThreadTools.createThreadFactory("complexity-", true));
		long startTime = System.currentTimeMillis();
		try {
			List<Future<MeasurementRecord>> futures = new ArrayList<>(sources.size());
			for (ImageSource source : sources)
				futures.add(pool.submit(() -> processSource(source)));

			List<MeasurementRecord> records = new ArrayList<>(sources.size());
			for (int i = 0; i < futures.size(); i++) {
				try {
					MeasurementRecord record = futures.get(i).get();
					if (record != null)
						records.add(record);
				} catch (ExecutionException e) {
					logger.error("Error processing " + sources.get(i).getId() + ": " + e.getCause().getLocalizedMessage(), e.getCause());
				}
			}
			long endTime = System.currentTimeMillis();
			logger.info("Processed {}/{} images in {} ms", records.size(), sources.size(), endTime - startTime);
			return records;
		} finally {
			pool.shutdownNow();
		}
	}

	private MeasurementRecord processSource(ImageSource source) {
		ImageBuffer image;
		try {
			image = source.read();
		} catch (IOException e) {
			logger.warn("Unable to read {} - image will be skipped: {}", source.getId(), e.getLocalizedMessage());
			return null;
		}
		if (!isSupported(image)) {
			logger.warn("Skipping {}: {} channels, expected 1 or 3 (set mspec for other channel counts)", source.getId(), image.nChannels());
			return null;
		}
		return process(source.getId(), image);
	}

}
