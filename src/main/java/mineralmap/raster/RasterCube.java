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

import java.util.OptionalDouble;

/**
 * Read access to a multi-band raster: dimensions, wavelength axis, per-pixel spectra and
 * pass-through metadata.
 */
public interface RasterCube
{
	/** Base name of the raster, used to recognise sensor naming conventions. */
	String getName();

	int getWidth();

	int getHeight();

	int getNumBands();

	/** Band centres in nanometres, or an empty array if the raster carries none. */
	double[] getWavelengths();

	/** Copies the spectrum at (x, y) into {@code spectrum}, which must hold at least {@link #getNumBands()} values. */
	void getSpectrum(int x, int y, double[] spectrum);

	default double[] getSpectrum(int x, int y)
	{
		final double[] spectrum = new double[getNumBands()];
		getSpectrum(x, y, spectrum);
		return spectrum;
	}

	float getSample(int x, int y, int band);

	RasterMetadata getMetadata();

	default OptionalDouble getDataIgnoreValue()
	{
		return getMetadata().getDouble(RasterMetadata.DATA_IGNORE_VALUE);
	}
}
