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
import mineralmap.raster.EnviDataType;
import mineralmap.raster.EnviWriter;
import mineralmap.raster.RasterMetadata;
import mineralmap.util.MineralMapVersion;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Three float bands (red, green, blue) copied from a hyperspectral image, with the metadata of
 * those three bands.
 */
public class RgbImage
{
	public static final String DESCRIPTION_SUFFIX = "visible-light image.";

	private final ImageStack stack;
	private final Sensor sensor;
	private final RasterMetadata metadata;

	RgbImage(ImageStack stack, Sensor sensor, RasterMetadata metadata)
	{
		if(stack.getSize() != 3)
			throw new IllegalArgumentException("An RGB image has 3 bands, found " + stack.getSize());

		this.stack = stack;
		this.sensor = sensor;
		this.metadata = metadata.copy();
	}

	public static String description()
	{
		return MineralMapVersion.getNameAndVersion() + " " + DESCRIPTION_SUFFIX;
	}

	public int getWidth()
	{
		return stack.getWidth();
	}

	public int getHeight()
	{
		return stack.getHeight();
	}

	public Sensor getSensor()
	{
		return sensor;
	}

	/** @param channel 0 for red, 1 for green, 2 for blue */
	public float[] getChannel(int channel)
	{
		return (float[]) stack.getPixels(channel + 1);
	}

	public ImageStack getStack()
	{
		return stack;
	}

	public RasterMetadata getMetadata()
	{
		return metadata.copy();
	}

	public void write(Path headerFile) throws IOException
	{
		EnviWriter.write(headerFile, stack, EnviDataType.FLOAT32, metadata);
	}
}
