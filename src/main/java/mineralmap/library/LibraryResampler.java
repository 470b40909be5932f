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

package mineralmap.library;

import mineralmap.raster.BandMismatchException;

import java.util.ArrayList;
import java.util.List;

/**
 * Linearly interpolates every spectrum of a library onto another wavelength axis, so a library
 * measured at a finer resolution can be matched against an image.
 */
public class LibraryResampler
{
	/**
	 * @param targetWavelengths ascending band centres in nanometres
	 * @throws BandMismatchException if the library has no wavelengths or does not cover the target axis
	 */
	public static ReferenceLibrary resample(ReferenceLibrary library, double[] targetWavelengths)
	{
		if(!library.hasWavelengths())
			throw new BandMismatchException("Reference library has no wavelengths and cannot be resampled");

		if(targetWavelengths.length == 0)
			throw new BandMismatchException("Image has no wavelengths to resample the reference library onto");

		final double[] source = library.getWavelengths();
		requireAscending(source, "Reference library");
		requireAscending(targetWavelengths, "Image");

		final double first = source[0];
		final double last = source[source.length - 1];
		if(targetWavelengths[0] < first || targetWavelengths[targetWavelengths.length - 1] > last)
			throw new BandMismatchException("Image wavelengths " + targetWavelengths[0] + "-" +
					targetWavelengths[targetWavelengths.length - 1] + " nm are outside the reference library range " +
					first + "-" + last + " nm");

		// lower source index and interpolation weight per target band
		final int[] lower = new int[targetWavelengths.length];
		final double[] weight = new double[targetWavelengths.length];

		int s = 0;
		for(int t = 0; t < targetWavelengths.length; t++)
		{
			final double wavelength = targetWavelengths[t];
			while(s < source.length - 2 && source[s + 1] < wavelength)
				s++;

			lower[t] = s;
			if(source.length == 1)
			{
				weight[t] = 0;
			}
			else
			{
				final double span = source[s + 1] - source[s];
				weight[t] = Math.min(1, Math.max(0, (wavelength - source[s]) / span));
			}
		}

		final List<ReferenceSpectrum> resampled = new ArrayList<>(library.size());
		for(ReferenceSpectrum spectrum : library.getSpectra())
		{
			final double[] values = new double[targetWavelengths.length];
			for(int t = 0; t < values.length; t++)
			{
				final int i = lower[t];
				values[t] = weight[t] == 0 ? spectrum.getValue(i)
						: spectrum.getValue(i) * (1 - weight[t]) + spectrum.getValue(i + 1) * weight[t];
			}

			resampled.add(new ReferenceSpectrum(spectrum.getName(), values));
		}

		return new ReferenceLibrary(resampled, targetWavelengths);
	}

	private static void requireAscending(double[] wavelengths, String owner)
	{
		for(int i = 1; i < wavelengths.length; i++)
			if(!(wavelengths[i] > wavelengths[i - 1]))
				throw new BandMismatchException(owner + " wavelengths are not strictly ascending at band " + i);
	}
}
