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

import java.util.Arrays;
import java.util.Objects;

/**
 * A named reference reflectance spectrum.
 */
public final class ReferenceSpectrum
{
	private final String name;
	private final double[] values;

	public ReferenceSpectrum(String name, double[] values)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.values = values.clone();
	}

	public String getName()
	{
		return name;
	}

	public int getNumBands()
	{
		return values.length;
	}

	public double getValue(int band)
	{
		return values[band];
	}

	public double[] getValues()
	{
		return values.clone();
	}

	public double getNorm()
	{
		double sumOfSquares = 0;
		for(double value : values)
			sumOfSquares += value * value;

		return Math.sqrt(sumOfSquares);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ReferenceSpectrum that = (ReferenceSpectrum) o;
		return name.equals(that.name) && Arrays.equals(values, that.values);
	}

	@Override
	public int hashCode()
	{
		return 31 * name.hashCode() + Arrays.hashCode(values);
	}

	@Override
	public String toString()
	{
		return name + " (" + values.length + " bands)";
	}
}
