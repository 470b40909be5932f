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

import ij.ImageStack;
import ij.process.ShortProcessor;
import mineralmap.raster.*;
import mineralmap.util.MineralMapVersion;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Raster of unsigned 16-bit class ids paired with the {@link ClassCatalog} naming them and the
 * metadata written alongside.
 */
public class ClassifiedImage
{
	public static final String FILE_TYPE = "ENVI Classification";
	public static final String DESCRIPTION_SUFFIX = "mineral classified image.";

	private final ShortProcessor classIds;
	private ClassCatalog catalog;
	private final RasterMetadata metadata;

	public ClassifiedImage(ShortProcessor classIds, ClassCatalog catalog, RasterMetadata metadata)
	{
		this.classIds = classIds;
		this.catalog = catalog;
		this.metadata = metadata.copy();
		updateCatalogMetadata();
	}

	public static String description()
	{
		return MineralMapVersion.getNameAndVersion() + " " + DESCRIPTION_SUFFIX;
	}

	public int getWidth()
	{
		return classIds.getWidth();
	}

	public int getHeight()
	{
		return classIds.getHeight();
	}

	public int getClassId(int x, int y)
	{
		return classIds.get(x, y);
	}

	public String getClassName(int x, int y)
	{
		return catalog.getName(getClassId(x, y));
	}

	public ShortProcessor getClassIds()
	{
		return classIds;
	}

	public ClassCatalog getCatalog()
	{
		return catalog;
	}

	public RasterMetadata getMetadata()
	{
		return metadata.copy();
	}

	/** Replaces the catalog after the ids have been rewritten to match it. */
	void setCatalog(ClassCatalog catalog, int[] classLookup)
	{
		this.catalog = catalog;
		updateCatalogMetadata();

		if(classLookup == null)
			metadata.remove(RasterMetadata.CLASS_LOOKUP);
		else
			putLookup(metadata, classLookup);
	}

	/** Current {@code class lookup} entries, or null when there are none. */
	int[] getClassLookup()
	{
		if(!metadata.containsKey(RasterMetadata.CLASS_LOOKUP))
			return null;

		final double[] values = metadata.getNumbers(RasterMetadata.CLASS_LOOKUP);
		final int[] lookup = new int[values.length];
		for(int i = 0; i < values.length; i++)
			lookup[i] = (int) values[i];

		return lookup;
	}

	static void putLookup(RasterMetadata metadata, int[] classLookup)
	{
		final List<Integer> entries = new ArrayList<>(classLookup.length);
		for(int value : classLookup)
			entries.add(value);

		metadata.putList(RasterMetadata.CLASS_LOOKUP, entries);
	}

	private void updateCatalogMetadata()
	{
		metadata.putInt(RasterMetadata.CLASSES, catalog.size());
		metadata.putList(RasterMetadata.CLASS_NAMES, catalog.getNames());
	}

	public void write(Path headerFile) throws IOException
	{
		write(headerFile, EnviHeader.dataFileFor(headerFile));
	}

	public void write(Path headerFile, Path dataFile) throws IOException
	{
		final ImageStack stack = new ImageStack(getWidth(), getHeight());
		stack.addSlice(null, classIds);

		EnviWriter.write(headerFile, dataFile, stack, EnviDataType.UINT16, metadata);
	}

	/**
	 * Reads a single band ENVI classification. Ids are not checked against the catalog here;
	 * {@link ClassCompactor} rejects ids the catalog does not name.
	 */
	public static ClassifiedImage read(Path path) throws IOException
	{
		final Path headerFile = EnviHeader.headerFileFor(path);
		final RasterMetadata metadata = EnviHeader.read(headerFile);
		final ImageStack stack = EnviReader.readPixels(headerFile, metadata);

		if(stack.getSize() != 1)
			throw new IOException(headerFile + ": a classification must have 1 band, found " + stack.getSize());

		final List<String> names = metadata.getList(RasterMetadata.CLASS_NAMES);
		if(names.isEmpty())
			throw new IOException(headerFile + ": missing required field \"" + RasterMetadata.CLASS_NAMES + "\"");

		final ClassCatalog catalog;
		try
		{
			if(metadata.getInt(RasterMetadata.CLASSES).isPresent() && metadata.getInt(RasterMetadata.CLASSES).getAsInt() != names.size())
				throw new IllegalArgumentException("\"" + RasterMetadata.CLASSES + "\" is " + metadata.getInt(RasterMetadata.CLASSES).getAsInt() +
						" but " + names.size() + " class names are listed");

			catalog = new ClassCatalog(names);
		}
		catch (IllegalArgumentException e)
		{
			throw new IOException(headerFile + ": " + e.getMessage(), e);
		}

		final int width = stack.getWidth();
		final int height = stack.getHeight();
		final float[] values = (float[]) stack.getPixels(1);
		final short[] ids = new short[values.length];

		for(int i = 0; i < values.length; i++)
		{
			final float value = values[i];
			if(!(value >= 0 && value < ClassCatalog.MAX_CLASSES) || value != (int) value)
				throw new IOException(headerFile + ": pixel (" + (i % width) + ", " + (i / width) + ") holds " + value +
						", which is not a class id");

			ids[i] = (short) (int) value;
		}

		return new ClassifiedImage(new ShortProcessor(width, height, ids, null), catalog, metadata);
	}
}
