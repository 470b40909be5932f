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

package mineralmap;

import mineralmap.classifier.ClassCompactor;
import mineralmap.classifier.ClassifiedImage;
import mineralmap.raster.EnviHeader;
import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.log.Logger;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

@Plugin(type = Command.class, headless = true,
		menuPath = "Plugins>Hyperspectral>MineralMap>Filter Mineral Classes")
public class FilterMineralClasses implements Command
{
	@Parameter
	private LogService log;

	@Parameter(label = "Classified image", type = ItemIO.INPUT,
			description = "ENVI classification to rewrite without its unused classes.")
	private File classifiedFile;

	/**
	 * Removes unused classes from an ENVI classification, rewriting its header and data file in
	 * place.
	 */
	public static ClassifiedImage run(Path classified, Logger log) throws IOException
	{
		final Path headerFile = EnviHeader.headerFileFor(classified);
		final Path dataFile = EnviHeader.findDataFile(headerFile);

		final ClassifiedImage image = ClassifiedImage.read(headerFile);
		final int numClasses = image.getCatalog().size();

		ClassCompactor.filterClasses(image);
		image.write(headerFile, dataFile);

		log.info("Filtered " + headerFile + " from " + numClasses + " to " + image.getCatalog().size() + " classes");
		return image;
	}

	@Override
	public void run()
	{
		try
		{
			run(classifiedFile.toPath(), log);
		}
		catch (Exception e)
		{
			log.error(e);
			throw new RuntimeException(e);
		}
	}
}
