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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Drops classes that no pixel uses and renumbers the remaining ones contiguously, keeping their
 * relative order. Pixel names never change, only their ids. Applying it twice has the same
 * effect as applying it once.
 */
public class ClassCompactor
{
	/**
	 * Compacts {@code image} in place and returns it.
	 *
	 * @throws IllegalStateException if a pixel holds an id its catalog does not name
	 */
	public static ClassifiedImage filterClasses(ClassifiedImage image)
	{
		final ClassCatalog catalog = image.getCatalog();
		final short[] classIds = (short[]) image.getClassIds().getPixels();

		final boolean[] present = new boolean[catalog.size()];
		for(int i = 0; i < classIds.length; i++)
		{
			final int id = classIds[i] & 0xffff;
			if(!catalog.isValidId(id))
				throw new IllegalStateException("Pixel (" + (i % image.getWidth()) + ", " + (i / image.getWidth()) +
						") has class id " + id + " but the catalog only has " + catalog.size() + " classes");

			present[id] = true;
		}

		final int[] remap = new int[catalog.size()];
		Arrays.fill(remap, -1);

		final List<String> names = new ArrayList<>();
		for(int id = 0; id < present.length; id++)
		{
			if(present[id])
			{
				remap[id] = names.size();
				names.add(catalog.getName(id));
			}
		}

		if(names.isEmpty())
			return image;

		for(int i = 0; i < classIds.length; i++)
			classIds[i] = (short) remap[classIds[i] & 0xffff];

		image.setCatalog(new ClassCatalog(names), filterLookup(image.getClassLookup(), present, catalog.size()));
		return image;
	}

	/** Lookup entries of the surviving classes, or null if there is no usable lookup. */
	static int[] filterLookup(int[] lookup, boolean[] present, int numClasses)
	{
		if(lookup == null || lookup.length != numClasses * 3)
			return null;

		int numPresent = 0;
		for(boolean p : present)
			if(p)
				numPresent++;

		final int[] filtered = new int[numPresent * 3];
		int next = 0;
		for(int id = 0; id < numClasses; id++)
		{
			if(present[id])
			{
				System.arraycopy(lookup, id * 3, filtered, next * 3, 3);
				next++;
			}
		}

		return filtered;
	}
}
