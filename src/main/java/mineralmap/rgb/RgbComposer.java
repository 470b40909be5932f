/*
 *     This file is part of MineralMap.
 *
 *     MineralMap is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     MineralMap is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with MineralMap.  If not, see <http://www.gnu.org/licenses/>.
 */

package mineralmap.rgb;

import ij.ImageStack;
import ij.process.FloatProcessor;
import mineralmap.raster.RasterCube;
import mineralmap.raster.RasterMetadata;
import mineralmap.util.ProcessingContext;
import mineralmap.util.TiledProcessor;
import org.scijava.log.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Builds a visible light image from the red, green and blue bands of a known sensor. Pixel
 * values are copied unchanged; the per-band metadata comes from the sensor's band table.
 */
public class RgbComposer
{
	private static final String DESCRIPTION = "Composing RGB image";

	/** Source fields copied unchanged into the RGB image. */
	static final List<String> PASS_THROUGH = Arrays.asList(
			RasterMetadata.MAP_INFO,
			"coordinate system string",
			RasterMetadata.SENSOR_TYPE,
			RasterMetadata.DATA_IGNORE_VALUE);

	public static RgbImage toRgb(RasterCube image) throws InterruptedException
	{
		return toRgb(image, ProcessingContext.defaults());
	}

	public static RgbImage toRgb(final RasterCube image, ProcessingContext context) throws InterruptedException
	{
		final Logger log = context.getLog();
		final Sensor sensor = Sensor.detect(image);
		final int[] bands = sensor.getBands();

		log.info("Composing RGB image of " + image.getName() + " from " + sensor.getLabel() + " bands " + Arrays.toString(bands));

		final int width = image.getWidth();
		final int height = image.getHeight();
		final float[][] channels = new float[3][width * height];

		new TiledProcessor(context).process(height, DESCRIPTION, (firstRow, numRows) -> {
			for(int y = firstRow; y < firstRow + numRows; y++)
				for(int x = 0; x < width; x++)
					for(int c = 0; c < 3; c++)
						channels[c][y * width + x] = image.getSample(x, y, bands[c]);
		});

		final ImageStack stack = new ImageStack(width, height);
		stack.addSlice("Red", new FloatProcessor(width, height, channels[0]));
		stack.addSlice("Green", new FloatProcessor(width, height, channels[1]));
		stack.addSlice("Blue", new FloatProcessor(width, height, channels[2]));

		return new RgbImage(stack, sensor, metadataFor(image.getMetadata(), sensor));
	}

	static RasterMetadata metadataFor(RasterMetadata source, Sensor sensor)
	{
		final RasterMetadata metadata = new RasterMetadata();
		metadata.put(RasterMetadata.DESCRIPTION, "{" + RgbImage.description() + "}");
		metadata.put(RasterMetadata.FILE_TYPE, "ENVI Standard");

		for(String key : PASS_THROUGH)
			if(source.containsKey(key))
				metadata.put(key, source.get(key));

		metadata.putList(RasterMetadata.BAND_NAMES, Arrays.asList("Red", "Green", "Blue"));
		metadata.put(RasterMetadata.WAVELENGTH_UNITS, "Nanometers");
		metadata.putNumbers(RasterMetadata.WAVELENGTH, sensor.getWavelengths());
		metadata.putNumbers(RasterMetadata.FWHM, sensor.getFwhm());

		final int[] bbl = sensor.getBbl();
		metadata.putList(RasterMetadata.BBL, Arrays.asList(bbl[0], bbl[1], bbl[2]));

		metadata.putNumbers(RasterMetadata.CORRECTION_FACTORS, sensor.getCorrectionFactors());
		metadata.putNumbers(RasterMetadata.SMOOTHING_FACTORS, sensor.getSmoothingFactors());

		return metadata;
	}
}
