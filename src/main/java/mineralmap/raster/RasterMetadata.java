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

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Ordered, case-insensitive mapping of raster metadata fields to their raw text values.
 * <p>
 * Values are kept exactly as written so that fields such as {@code map info} can be copied
 * verbatim from one raster to another. List valued fields are stored in ENVI brace notation,
 * e.g. <code>{No data, Alunite, Kaolinite}</code>.
 */
public class RasterMetadata
{
	public static final String DESCRIPTION = "description";
	public static final String SAMPLES = "samples";
	public static final String LINES = "lines";
	public static final String BANDS = "bands";
	public static final String HEADER_OFFSET = "header offset";
	public static final String FILE_TYPE = "file type";
	public static final String DATA_TYPE = "data type";
	public static final String INTERLEAVE = "interleave";
	public static final String BYTE_ORDER = "byte order";
	public static final String SENSOR_TYPE = "sensor type";
	public static final String MAP_INFO = "map info";
	public static final String CLASSES = "classes";
	public static final String CLASS_NAMES = "class names";
	public static final String CLASS_LOOKUP = "class lookup";
	public static final String WAVELENGTH = "wavelength";
	public static final String WAVELENGTH_UNITS = "wavelength units";
	public static final String FWHM = "fwhm";
	public static final String BBL = "bbl";
	public static final String CORRECTION_FACTORS = "correction factors";
	public static final String SMOOTHING_FACTORS = "smoothing factors";
	public static final String DATA_IGNORE_VALUE = "data ignore value";
	public static final String SPECTRA_NAMES = "spectra names";
	public static final String BAND_NAMES = "band names";

	private final LinkedHashMap<String, String> values = new LinkedHashMap<>();

	public RasterMetadata() {}

	public RasterMetadata(RasterMetadata other)
	{
		values.putAll(other.values);
	}

	public RasterMetadata copy()
	{
		return new RasterMetadata(this);
	}

	public static String normaliseKey(String key)
	{
		return key.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
	}

	public boolean containsKey(String key)
	{
		return values.containsKey(normaliseKey(key));
	}

	/** The raw value, braces included, or null if the field is absent. */
	public String get(String key)
	{
		return values.get(normaliseKey(key));
	}

	public void put(String key, String rawValue)
	{
		values.put(normaliseKey(key), rawValue.trim());
	}

	public void putInt(String key, int value)
	{
		put(key, Integer.toString(value));
	}

	public void putList(String key, List<?> listValues)
	{
		put(key, "{" + listValues.stream().map(String::valueOf).collect(Collectors.joining(", ")) + "}");
	}

	public void putNumbers(String key, double[] numbers)
	{
		List<String> formatted = new ArrayList<>(numbers.length);
		for(double number : numbers)
			formatted.add(formatNumber(number));

		putList(key, formatted);
	}

	public void remove(String key)
	{
		values.remove(normaliseKey(key));
	}

	public Set<String> keySet()
	{
		return Collections.unmodifiableSet(values.keySet());
	}

	public int size()
	{
		return values.size();
	}

	/** The value with enclosing braces removed and whitespace trimmed, or null if absent. */
	public String getString(String key)
	{
		String raw = get(key);
		if(raw == null)
			return null;

		return stripBraces(raw);
	}

	/** The comma separated entries of a list field, or an empty list if the field is absent. */
	public List<String> getList(String key)
	{
		String raw = get(key);
		if(raw == null)
			return new ArrayList<>(0);

		String content = stripBraces(raw);
		if(content.isEmpty())
			return new ArrayList<>(0);

		return Arrays.stream(content.split(","))
				.map(String::trim)
				.collect(Collectors.toList());
	}

	public double[] getNumbers(String key)
	{
		List<String> entries = getList(key);
		double[] numbers = new double[entries.size()];

		for(int i = 0; i < numbers.length; i++)
		{
			try
			{
				numbers[i] = Double.parseDouble(entries.get(i));
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Field \"" + normaliseKey(key) + "\" entry " + i + " is not a number: \"" + entries.get(i) + "\"", e);
			}
		}

		return numbers;
	}

	public OptionalInt getInt(String key)
	{
		String value = getString(key);
		if(value == null || value.isEmpty())
			return OptionalInt.empty();

		try
		{
			return OptionalInt.of(Integer.parseInt(value));
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Field \"" + normaliseKey(key) + "\" is not an integer: \"" + value + "\"", e);
		}
	}

	public OptionalDouble getDouble(String key)
	{
		String value = getString(key);
		if(value == null || value.isEmpty())
			return OptionalDouble.empty();

		try
		{
			return OptionalDouble.of(Double.parseDouble(value));
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Field \"" + normaliseKey(key) + "\" is not a number: \"" + value + "\"", e);
		}
	}

	/** Shortest plain representation, e.g. 682.3093 or 1 */
	public static String formatNumber(double number)
	{
		if(Double.isNaN(number) || Double.isInfinite(number))
			return Double.toString(number);

		String plain = BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
		return plain.equals("-0") ? "0" : plain;
	}

	private static String stripBraces(String raw)
	{
		String value = raw.trim();
		if(value.startsWith("{") && value.endsWith("}"))
			value = value.substring(1, value.length() - 1).trim();

		return value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RasterMetadata that = (RasterMetadata) o;
		return values.equals(that.values);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(values);
	}

	@Override
	public String toString()
	{
		return values.toString();
	}
}
