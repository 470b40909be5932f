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

import ij.ImageStack;
import mineralmap.raster.EnviHeader;
import mineralmap.raster.EnviReader;
import mineralmap.raster.RasterMetadata;
import mineralmap.raster.Wavelengths;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads an ENVI spectral library ({@code .hdr} plus {@code .sli}). Each line of the library
 * image is one spectrum; {@code samples} is the number of bands per spectrum and
 * {@code spectra names} labels the lines in order.
 */
public class SpectralLibraryReader
{
	public static ReferenceLibrary read(Path path) throws IOException
	{
		final Path headerFile = EnviHeader.headerFileFor(path);
		final RasterMetadata metadata = EnviHeader.read(headerFile);

		final List<String> names = metadata.getList(RasterMetadata.SPECTRA_NAMES);
		final ImageStack stack = EnviReader.readPixels(headerFile, metadata);

		if(stack.getSize() != 1)
			throw new IOException(headerFile + ": a spectral library must have 1 band, found " + stack.getSize());

		final int numBands = stack.getWidth();
		final int numSpectra = stack.getHeight();

		if(names.size() != numSpectra)
			throw new IOException(headerFile + ": \"" + RasterMetadata.SPECTRA_NAMES + "\" lists " + names.size() +
					" names for " + numSpectra + " spectra");

		final double[] wavelengths;
		try
		{
			wavelengths = Wavelengths.fromMetadata(metadata);
		}
		catch (IllegalArgumentException e)
		{
			throw new IOException(headerFile + ": " + e.getMessage(), e);
		}

		if(wavelengths.length != 0 && wavelengths.length != numBands)
			throw new IOException(headerFile + ": " + wavelengths.length + " wavelengths for " + numBands + " bands per spectrum");

		final float[] pixels = (float[]) stack.getPixels(1);
		final List<ReferenceSpectrum> spectra = new ArrayList<>(numSpectra);

		for(int i = 0; i < numSpectra; i++)
		{
			final double[] values = new double[numBands];
			for(int b = 0; b < numBands; b++)
				values[b] = pixels[i * numBands + b];

			spectra.add(new ReferenceSpectrum(names.get(i), values));
		}

		return new ReferenceLibrary(spectra, wavelengths);
	}
}
