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

import java.util.Locale;

/**
 * Wavelength axis helpers. Axes are always held in nanometres.
 */
public final class Wavelengths
{
	public static final double TOLERANCE_NM = 0.01;

	private Wavelengths() {}

	/** Scale factor from the given {@code wavelength units} value to nanometres. Missing units mean nanometres. */
	public static double toNanometreFactor(String units)
	{
		if(units == null)
			return 1;

		switch (units.trim().toLowerCase(Locale.ROOT))
		{
			case "":
			case "nm":
			case "nanometers":
			case "nanometres":
				return 1;
			case "um":
			case "µm":
			case "micrometers":
			case "micrometres":
			case "microns":
				return 1000;
			case "mm":
			case "millimeters":
			case "millimetres":
				return 1_000_000;
			default:
				throw new IllegalArgumentException("Unsupported wavelength units \"" + units + "\"");
		}
	}

	/** The {@code wavelength} field of {@code metadata} in nanometres, or an empty axis when it has none. */
	public static double[] fromMetadata(RasterMetadata metadata)
	{
		final double[] wavelengths = metadata.getNumbers(RasterMetadata.WAVELENGTH);
		final double factor = toNanometreFactor(metadata.getString(RasterMetadata.WAVELENGTH_UNITS));

		for(int i = 0; i < wavelengths.length; i++)
			wavelengths[i] *= factor;

		return wavelengths;
	}

	public static boolean matches(double[] a, double[] b)
	{
		if(a.length != b.length)
			return false;

		for(int i = 0; i < a.length; i++)
			if(Math.abs(a[i] - b[i]) > TOLERANCE_NM)
				return false;

		return true;
	}

	/**
	 * Checks that an image can be compared band by band with a library. Empty axes only
	 * compare band counts.
	 *
	 * @throws BandMismatchException if band counts differ or the axes disagree
	 */
	public static void requireCompatible(int imageBands, double[] imageAxis, int libraryBands, double[] libraryAxis)
	{
		if(imageBands != libraryBands)
			throw new BandMismatchException("Image has " + imageBands + " bands but the reference library has " +
					libraryBands + " bands per spectrum");

		if(imageAxis.length == 0 || libraryAxis.length == 0)
			return;

		for(int i = 0; i < imageAxis.length; i++)
		{
			if(Math.abs(imageAxis[i] - libraryAxis[i]) > TOLERANCE_NM)
				throw new BandMismatchException("Wavelength of band " + i + " differs: image " + imageAxis[i] +
						" nm, reference library " + libraryAxis[i] + " nm");
		}
	}
}
