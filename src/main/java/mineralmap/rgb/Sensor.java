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

import mineralmap.raster.RasterCube;
import mineralmap.raster.RasterMetadata;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Supported imaging spectrometers and the red, green and blue bands used to compose visible
 * light images from them.
 */
public enum Sensor
{
	AVIRIS_NG("AVIRIS-NG", Pattern.compile("ang\\d{8}t\\d{6}"), new String[] {"AVIRISNG", "AVIRISNEXTGENERATION"},
			new int[] {61, 31, 23},
			new double[] {682.3093, 532.0142, 491.9382},
			new double[] {5.7733, 5.6129, 5.5717},
			new double[] {1.0, 1.0, 1.0},
			new double[] {1.0, 1.0, 1.0}),

	AVIRIS_C("AVIRIS-C", Pattern.compile("f\\d{6}t\\d{2}p\\d{2}r\\d{2}"), new String[] {"AVIRISC", "AVIRISCLASSIC", "AVIRIS"},
			new int[] {32, 17, 13},
			new double[] {678.063, 530.992, 492.0},
			new double[] {9.7549, 9.8183, 9.8361},
			new double[] {1.0086, 1.0011, 0.9954},
			new double[] {0.9972, 0.9998, 1.0021});

	/** How far an image band may lie from the tabulated centre and still be accepted. */
	public static final double WAVELENGTH_TOLERANCE_NM = 5;

	private final String label;
	private final Pattern namePattern;
	private final String[] sensorTypes;
	private final int[] bands;
	private final double[] wavelengths;
	private final double[] fwhm;
	private final double[] correctionFactors;
	private final double[] smoothingFactors;

	Sensor(String label, Pattern namePattern, String[] sensorTypes, int[] bands, double[] wavelengths, double[] fwhm,
		   double[] correctionFactors, double[] smoothingFactors)
	{
		this.label = label;
		this.namePattern = namePattern;
		this.sensorTypes = sensorTypes;
		this.bands = bands;
		this.wavelengths = wavelengths;
		this.fwhm = fwhm;
		this.correctionFactors = correctionFactors;
		this.smoothingFactors = smoothingFactors;
	}

	public String getLabel()
	{
		return label;
	}

	/** Zero-based source band indices of red, green and blue. */
	public int[] getBands()
	{
		return bands.clone();
	}

	public double[] getWavelengths()
	{
		return wavelengths.clone();
	}

	public double[] getFwhm()
	{
		return fwhm.clone();
	}

	/** Bad band flags of the three bands; all of them are usable. */
	public int[] getBbl()
	{
		return new int[] {1, 1, 1};
	}

	public double[] getCorrectionFactors()
	{
		return correctionFactors.clone();
	}

	public double[] getSmoothingFactors()
	{
		return smoothingFactors.clone();
	}

	/**
	 * Sensor of {@code image}, from its {@code sensor type} field or else its name, checked
	 * against the band table.
	 *
	 * @throws UnknownSensorException if no sensor matches or the image does not fit the table
	 */
	public static Sensor detect(RasterCube image)
	{
		final Sensor sensor = fromSensorType(image.getMetadata().getString(RasterMetadata.SENSOR_TYPE));
		final Sensor detected = sensor != null ? sensor : fromName(image.getName());

		if(detected == null)
			throw new UnknownSensorException("Cannot determine the sensor of " + image.getName() +
					": no recognised \"" + RasterMetadata.SENSOR_TYPE + "\" and the name matches no known sensor");

		detected.requireBands(image);
		return detected;
	}

	/** Sensor for a {@code sensor type} value, or null. */
	public static Sensor fromSensorType(String sensorType)
	{
		if(sensorType == null)
			return null;

		final String normalised = sensorType.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
		for(Sensor sensor : values())
			for(String type : sensor.sensorTypes)
				if(type.equals(normalised))
					return sensor;

		return null;
	}

	/** Sensor whose flight line naming convention {@code name} follows, or null. */
	public static Sensor fromName(String name)
	{
		if(name == null)
			return null;

		final String lowerCase = name.toLowerCase(Locale.ROOT);
		for(Sensor sensor : values())
			if(sensor.namePattern.matcher(lowerCase).find())
				return sensor;

		return null;
	}

	void requireBands(RasterCube image)
	{
		final int numBands = image.getNumBands();
		final double[] imageWavelengths = image.getWavelengths();

		for(int i = 0; i < bands.length; i++)
		{
			final int band = bands[i];
			if(band >= numBands)
				throw new UnknownSensorException(image.getName() + " has " + numBands + " bands but " + label +
						" needs band " + band);

			if(imageWavelengths.length != 0 && Math.abs(imageWavelengths[band] - wavelengths[i]) > WAVELENGTH_TOLERANCE_NM)
				throw new UnknownSensorException(image.getName() + " band " + band + " is centred at " + imageWavelengths[band] +
						" nm, not the " + wavelengths[i] + " nm " + label + " expects");
		}
	}
}
