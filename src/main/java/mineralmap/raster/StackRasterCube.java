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

package mineralmap.raster;

import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * {@link RasterCube} held in memory as an ImageJ stack with one float slice per band.
 */
public class StackRasterCube implements RasterCube
{
	private final String name;
	private final int width;
	private final int height;
	private final float[][] bands;
	private final double[] wavelengths;
	private final RasterMetadata metadata;

	public StackRasterCube(String name, ImageStack stack, RasterMetadata metadata)
	{
		if(stack.getSize() < 1)
			throw new IllegalArgumentException("Raster " + name + " has no bands");

		this.name = name;
		this.width = stack.getWidth();
		this.height = stack.getHeight();
		this.metadata = metadata.copy();

		bands = new float[stack.getSize()][];
		for(int b = 0; b < bands.length; b++)
		{
			ImageProcessor slice = stack.getProcessor(b + 1);
			if(!(slice instanceof FloatProcessor))
				slice = slice.convertToFloatProcessor();

			bands[b] = (float[]) slice.getPixels();
		}

		this.wavelengths = Wavelengths.fromMetadata(metadata);
		if(wavelengths.length != 0 && wavelengths.length != bands.length)
			throw new IllegalArgumentException("Raster " + name + " has " + bands.length + " bands but " +
					wavelengths.length + " wavelengths");
	}

	/**
	 * Builds a cube from {@code spectra[y][x][band]}. Values are stored as floats.
	 */
	public static StackRasterCube fromSpectra(String name, double[][][] spectra, RasterMetadata metadata)
	{
		final int height = spectra.length;
		final int width = spectra[0].length;
		final int numBands = spectra[0][0].length;

		final ImageStack stack = new ImageStack(width, height);
		for(int b = 0; b < numBands; b++)
		{
			final float[] pixels = new float[width * height];
			for(int y = 0; y < height; y++)
				for(int x = 0; x < width; x++)
					pixels[y * width + x] = (float) spectra[y][x][b];

			stack.addSlice(null, new FloatProcessor(width, height, pixels));
		}

		return new StackRasterCube(name, stack, metadata);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public int getWidth()
	{
		return width;
	}

	@Override
	public int getHeight()
	{
		return height;
	}

	@Override
	public int getNumBands()
	{
		return bands.length;
	}

	@Override
	public double[] getWavelengths()
	{
		return wavelengths.clone();
	}

	@Override
	public void getSpectrum(int x, int y, double[] spectrum)
	{
		final int index = y * width + x;
		for(int b = 0; b < bands.length; b++)
			spectrum[b] = bands[b][index];
	}

	@Override
	public float getSample(int x, int y, int band)
	{
		return bands[band][y * width + x];
	}

	/** The backing pixels of {@code band}. Not a copy. */
	public float[] getBandPixels(int band)
	{
		return bands[band];
	}

	@Override
	public RasterMetadata getMetadata()
	{
		return metadata.copy();
	}
}
