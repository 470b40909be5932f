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

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ColorProcessor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * 8-bit color rendering of an {@link RgbImage}. Each channel is multiplied by its sensor
 * correction factor and linearly stretched between its 2nd and 98th percentiles.
 */
public class RgbPreview
{
	public static final double LOW_PERCENTILE = 0.02;
	public static final double HIGH_PERCENTILE = 0.98;

	public static ColorProcessor render(RgbImage rgb)
	{
		final int numPixels = rgb.getWidth() * rgb.getHeight();
		final double[] correctionFactors = rgb.getSensor().getCorrectionFactors();

		final int[] packed = new int[numPixels];
		for(int c = 0; c < 3; c++)
		{
			final byte[] channel = stretch(rgb.getChannel(c), correctionFactors[c]);
			final int shift = 16 - 8 * c;

			for(int i = 0; i < numPixels; i++)
				packed[i] |= (channel[i] & 0xff) << shift;
		}

		return new ColorProcessor(rgb.getWidth(), rgb.getHeight(), packed);
	}

	public static void save(RgbImage rgb, Path pngFile) throws IOException
	{
		final ImagePlus preview = new ImagePlus(pngFile.getFileName().toString(), render(rgb));
		if(!new FileSaver(preview).saveAsPng(pngFile.toString()))
			throw new IOException("Failed to write RGB preview " + pngFile);
	}

	static byte[] stretch(float[] values, double correctionFactor)
	{
		final double[] corrected = new double[values.length];
		int numFinite = 0;
		for(float value : values)
		{
			final double scaled = value * correctionFactor;
			if(Double.isFinite(scaled))
				corrected[numFinite++] = scaled;
		}

		final byte[] stretched = new byte[values.length];
		if(numFinite == 0)
			return stretched;

		final double[] sorted = Arrays.copyOf(corrected, numFinite);
		Arrays.sort(sorted);
		final double low = sorted[(int) Math.floor(LOW_PERCENTILE * (numFinite - 1))];
		final double high = sorted[(int) Math.ceil(HIGH_PERCENTILE * (numFinite - 1))];

		for(int i = 0; i < values.length; i++)
		{
			final double scaled = values[i] * correctionFactor;
			final int level;
			if(!Double.isFinite(scaled) || scaled <= low)
				level = 0;
			else if(scaled >= high)
				level = 0xff;
			else
				level = (int) Math.round((scaled - low) / (high - low) * 0xff);

			stretched[i] = (byte) level;
		}

		return stretched;
	}
}
