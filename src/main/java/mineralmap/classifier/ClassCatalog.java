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

package mineralmap.classifier;

import java.util.*;

/**
 * Ordered class names of a classified raster, indexed by class id. When present, the
 * {@value #NO_DATA} class is always id 0.
 */
public final class ClassCatalog
{
	public static final String NO_DATA = "No data";
	public static final int NO_DATA_ID = 0;
	public static final int MAX_CLASSES = 1 << 16;

	private final List<String> names;
	private final Map<String, Integer> idByName;

	public ClassCatalog(List<String> names)
	{
		if(names.isEmpty())
			throw new IllegalArgumentException("A class catalog needs at least one class");

		if(names.size() > MAX_CLASSES)
			throw new IllegalArgumentException("At most " + MAX_CLASSES + " classes are supported, found " + names.size());

		final Map<String, Integer> idByName = new HashMap<>();
		for(int i = 0; i < names.size(); i++)
		{
			final String name = Objects.requireNonNull(names.get(i), "class name");
			if(idByName.put(name, i) != null)
				throw new IllegalArgumentException("Duplicate class name \"" + name + "\"");
		}

		final Integer noDataId = idByName.get(NO_DATA);
		if(noDataId != null && noDataId != NO_DATA_ID)
			throw new IllegalArgumentException("\"" + NO_DATA + "\" must be class " + NO_DATA_ID + ", found at " + noDataId);

		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.idByName = Collections.unmodifiableMap(idByName);
	}

	/** A catalog of {@value #NO_DATA} followed by {@code classNames}. */
	public static ClassCatalog withNoData(List<String> classNames)
	{
		final List<String> names = new ArrayList<>(classNames.size() + 1);
		names.add(NO_DATA);
		names.addAll(classNames);

		return new ClassCatalog(names);
	}

	public int size()
	{
		return names.size();
	}

	public String getName(int id)
	{
		return names.get(id);
	}

	/** Class id of {@code name}, or -1. */
	public int getId(String name)
	{
		final Integer id = idByName.get(name);
		return id == null ? -1 : id;
	}

	public boolean isValidId(int id)
	{
		return id >= 0 && id < names.size();
	}

	public boolean hasNoData()
	{
		return idByName.containsKey(NO_DATA);
	}

	public List<String> getNames()
	{
		return names;
	}

	/**
	 * ENVI {@code class lookup} entries, three per class. Classes are spread evenly over the
	 * gray ramp from black (first class) to white (last class).
	 */
	public int[] getGrayLookup()
	{
		final int numClasses = names.size();
		final int[] classColors = new int[numClasses];

		classColors[0] = 0;
		if(numClasses > 1)
		{
			for(int i = 1; i < numClasses; i++)
				classColors[i] = (int) Math.round(0xff * (double) i / (numClasses - 1));
		}

		final int[] lookup = new int[numClasses * 3];
		for(int i = 0; i < numClasses; i++)
			Arrays.fill(lookup, i * 3, i * 3 + 3, classColors[i]);

		return lookup;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return names.equals(((ClassCatalog) o).names);
	}

	@Override
	public int hashCode()
	{
		return names.hashCode();
	}

	@Override
	public String toString()
	{
		return names.toString();
	}
}
