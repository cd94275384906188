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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import imcomp.lib.images.ImageBuffer;
import imcomp.lib.images.ImageBuffers;
import imcomp.lib.regions.PatchGrid.BoundaryPolicy;

@SuppressWarnings("javadoc")
public class TestComplexityProcessor {

	private static final double EPSILON = 1e-9;

	private static ImageBuffer blocks() {
		return ImageBuffers.fromArray(new double[][] {
			{0, 0, 255, 255},
			{0, 0, 255, 255},
			{100, 100, 100, 100},
			{100, 100, 100, 100}
		}, 255);
	}

	private static ImageBuffer ramp(int w, int h) {
		double[][] values = new double[h][w];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				values[y][x] = 10 * x;
		}
		return ImageBuffers.fromArray(values, 255);
	}

	private static Map<String, ComplexityMeasure> firstPixelMeasures() {
		Map<String, ComplexityMeasure> map = new LinkedHashMap<>();
		map.put("first", (image, grid, params) -> image.getValue(0, 0, 0));
		map.put("failing", (image, grid, params) -> {
			throw new IllegalStateException("Always fails");
		});
		map.put("patches", (image, grid, params) -> grid.nValid());
		return map;
	}

	@Test
	public void test_columns() {
		var params = ComplexityParameters.builder().measures("dwt_energy", "discrete_pixel_entropy").build();
		assertEquals(List.of("dwt_energy", "discrete_pixel_entropy"), new ComplexityProcessor(params).getColumns());

		var gradToo = params.toBuilder().useGradToo(true).build();
		assertEquals(List.of("dwt_energy", "dwt_energy_grad", "discrete_pixel_entropy", "discrete_pixel_entropy_grad"),
				new ComplexityProcessor(gradToo).getColumns());

		// Gradient-only takes precedence and keeps plain names
		var gradOnly = gradToo.toBuilder().useGradOnly(true).build();
		assertEquals(List.of("dwt_energy", "discrete_pixel_entropy"), new ComplexityProcessor(gradOnly).getColumns());
	}

	@Test
	public void test_allMeasuresByDefault() {
		var processor = new ComplexityProcessor(ComplexityParameters.getDefault());
		assertEquals(ComplexityMeasures.getNames(), processor.getColumns());
	}

	@Test
	public void test_unknownMeasureOmitted() {
		var params = ComplexityParameters.builder().measures("dwt_energy", "not_a_measure").build();
		var processor = new ComplexityProcessor(params);
		assertEquals(List.of("dwt_energy"), processor.getColumns());
		var record = processor.process("ramp", ramp(16, 16));
		assertEquals(List.of("dwt_energy"), record.getColumnNames());
		assertFalse(record.containsColumn("not_a_measure"));
	}

	@Test
	public void test_blocks() {
		var params = ComplexityParameters.builder()
				.patchSize(2)
				.measures(ComplexityMeasures.GLOBAL_PATCH_COVARIANCE, ComplexityMeasures.LOCAL_PATCH_COVARIANCE)
				.localCovarianceEpsilon(1.0)
				.build();
		var record = new ComplexityProcessor(params).process("blocks", blocks());
		assertEquals("blocks", record.getImageId());
		assertEquals(Math.log(33268.75), record.getValue(ComplexityMeasures.GLOBAL_PATCH_COVARIANCE), EPSILON);
		assertEquals(0.0, record.getValue(ComplexityMeasures.LOCAL_PATCH_COVARIANCE), EPSILON);
	}

	@Test
	public void test_clippedBoundary() {
		double[][] values = new double[5][5];
		for (int y = 0; y < 5; y++) {
			for (int x = 0; x < 5; x++)
				values[y][x] = 10 * x + 3 * y;
		}
		var img = ImageBuffers.fromArray(values, 255);
		var drop = ComplexityParameters.builder()
				.patchSize(2)
				.measures(ComplexityMeasures.GLOBAL_PATCH_COVARIANCE, ComplexityMeasures.DIFFERENTIAL_PATCH_ENTROPY, "patches")
				.build();
		var clip = drop.toBuilder().boundaryPolicy(BoundaryPolicy.CLIP).build();

		Map<String, ComplexityMeasure> measures = new LinkedHashMap<>(ComplexityMeasures.getDefaultMeasures());
		measures.put("patches", (image, grid, params) -> grid.nValid());
		var recordDrop = new ComplexityProcessor(drop, measures).process("drop", img);
		var recordClip = new ComplexityProcessor(clip, measures).process("clip", img);

		for (String name : List.of(ComplexityMeasures.GLOBAL_PATCH_COVARIANCE, ComplexityMeasures.DIFFERENTIAL_PATCH_ENTROPY)) {
			double value = recordClip.getValue(name);
			assertTrue(Double.isFinite(value), name + " should be finite, but was " + value);
			assertEquals(recordDrop.getValue(name), value, EPSILON);
		}
		// Other measures still see the clipped patches
		assertEquals(4, recordDrop.getValue("patches"), EPSILON);
		assertEquals(9, recordClip.getValue("patches"), EPSILON);
	}

	@Test
	public void test_allDefaultMeasures() {
		var params = ComplexityParameters.builder()
				.patchSize(4)
				.entropyMaxSamples(500)
				.build();
		var image = ramp(16, 12);
		var record = new ComplexityProcessor(params).process("ramp", image);
		assertEquals(ComplexityMeasures.getNames(), record.getColumnNames());
		assertTrue(record.getValue(ComplexityMeasures.DISCRETE_PIXEL_ENTROPY) > 0);
		assertTrue(record.getValue(ComplexityMeasures.PAIRWISE_MEAN_DISTANCE) > 0);
		assertTrue(record.getValue(ComplexityMeasures.PATCH_WASSERSTEIN) > 0);
		assertTrue(Double.isFinite(record.getValue(ComplexityMeasures.FOURIER_WEIGHTED_ENERGY)));
	}

	@Test
	public void test_failureIsolation() {
		var params = ComplexityParameters.builder().patchSize(2).build();
		var processor = new ComplexityProcessor(params, firstPixelMeasures());
		var record = processor.process("blocks", blocks());
		assertEquals(List.of("first", "failing", "patches"), record.getColumnNames());
		assertEquals(0.0, record.getValue("first"));
		assertTrue(Double.isNaN(record.getValue("failing")));
		assertEquals(4.0, record.getValue("patches"));
	}

	@Test
	public void test_gradient() {
		Map<String, ComplexityMeasure> map = Map.of("first", (image, grid, params) -> image.getValue(0, 0, 0));
		var image = ImageBuffers.fromArray(new double[][] {
			{5, 15, 25},
			{5, 15, 25}
		}, 255);

		var gradToo = new ComplexityProcessor(ComplexityParameters.builder().useGradToo(true).patchSize(1).build(), map);
		var record = gradToo.process("ramp", image);
		assertEquals(5.0, record.getValue("first"), EPSILON);
		assertEquals(10.0, record.getValue("first_grad"), EPSILON);

		var gradOnly = new ComplexityProcessor(ComplexityParameters.builder().useGradOnly(true).useGradToo(true).patchSize(1).build(), map);
		record = gradOnly.process("ramp", image);
		assertEquals(List.of("first"), record.getColumnNames());
		assertEquals(10.0, record.getValue("first"), EPSILON);
	}

	@Test
	public void test_unsupportedChannels() {
		var fourChannels = ImageBuffers.createConstant(4, 4, 4, 1f, 255);
		var processor = new ComplexityProcessor(ComplexityParameters.builder().measures("discrete_pixel_entropy").build());
		assertFalse(processor.isSupported(fourChannels));
		assertThrows(IllegalArgumentException.class, () -> processor.process("four", fourChannels));

		var mspec = new ComplexityProcessor(ComplexityParameters.builder().multispectral(true).measures("discrete_pixel_entropy").build());
		assertTrue(mspec.isSupported(fourChannels));
		assertEquals(0.0, mspec.process("four", fourChannels).getValue("discrete_pixel_entropy"), EPSILON);
	}

	@Test
	public void test_batch() throws InterruptedException {
		var params = ComplexityParameters.builder().patchSize(2).nThreads(3).build();
		var processor = new ComplexityProcessor(params, firstPixelMeasures());
		List<ImageSource> sources = List.of(
				ImageSource.create("a", ImageBuffers.createConstant(4, 4, 1, 1f, 255)),
				ImageSource.create("unreadable", () -> {
					throw new IOException("Corrupt file");
				}),
				ImageSource.create("b", ImageBuffers.createConstant(4, 4, 3, 2f, 255)),
				ImageSource.create("four", ImageBuffers.createConstant(4, 4, 4, 3f, 255)),
				ImageSource.create("c", ImageBuffers.createConstant(6, 6, 1, 4f, 255))
				);
		var records = processor.processAll(sources);
		assertEquals(3, records.size());
		assertEquals("a", records.get(0).getImageId());
		assertEquals("b", records.get(1).getImageId());
		assertEquals("c", records.get(2).getImageId());
		assertEquals(1.0, records.get(0).getValue("first"));
		assertEquals(2.0, records.get(1).getValue("first"));
		assertEquals(4.0, records.get(2).getValue("first"));
		assertEquals(9.0, records.get(2).getValue("patches"));

		assertTrue(processor.processAll(List.of()).isEmpty());
	}

	@Test
	public void test_noMeasures() {
		Map<String, ComplexityMeasure> map = Map.of();
		var params = ComplexityParameters.getDefault();
		var processor = new ComplexityProcessor(params, map);
		assertTrue(processor.getColumns().isEmpty());
		assertEquals(params, processor.getParameters());
	}

}
