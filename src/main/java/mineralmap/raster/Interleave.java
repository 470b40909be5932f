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

/** Sample ordering of an ENVI data file. */
public enum Interleave
{
	/** Band sequential: one whole band after another. */
	BSQ,
	/** Band interleaved by line: each line holds one row of every band. */
	BIL,
	/** Band interleaved by pixel: each pixel holds all of its bands. */
	BIP;

	public String getHeaderValue()
	{
		return name().toLowerCase(Locale.ROOT);
	}

	public static Interleave fromHeaderValue(String value)
	{
		try
		{
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e)
		{
			throw new IllegalArgumentException("Unsupported interleave \"" + value + "\"", e);
		}
	}
}
