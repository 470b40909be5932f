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

import mineralmap.classifier.ClassificationConfig;
import mineralmap.classifier.ClassifiedImage;
import mineralmap.classifier.MineralClassifier;
import mineralmap.library.LibraryResampler;
import mineralmap.library.ReferenceLibrary;
import mineralmap.library.SpectralLibraryReader;
import mineralmap.raster.RasterCube;
import mineralmap.raster.EnviReader;
import mineralmap.util.ProcessingContext;
import org.scijava.ItemIO;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.log.Logger;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.prefs.PrefService;
import org.scijava.widget.FileWidget;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Plugin(type = Command.class, headless = true,
		menuPath = "Plugins>Hyperspectral>MineralMap>Classify Minerals")
public class ClassifyMinerals implements Command
{
	@Parameter
	private LogService log;

	@Parameter
	private StatusService statusService;

	@Parameter
	private PrefService prefService;

	@Parameter(label = "Hyperspectral image", type = ItemIO.INPUT,
			description = "ENVI header of the reflectance image to classify.")
	private File imageFile;

	@Parameter(label = "Spectral library", type = ItemIO.INPUT,
			description = "ENVI header of the spectral library holding the reference spectra.")
	private File libraryFile;

	@Parameter(label = "Output classification", type = ItemIO.INPUT, style = FileWidget.SAVE_STYLE,
			description = "ENVI header to write the classified image to.")
	private File outputFile;

	@Parameter(label = "Classes", required = false,
			description = "Comma separated library names to restrict the classification to. Leave empty to use every class.")
	private String classNames = "";

	/**
	 * Classifies an ENVI image against an ENVI spectral library and writes the result as an ENVI
	 * classification.
	 *
	 * @param resampleLibrary interpolate the library onto the image wavelengths first
	 */
	public static ClassifiedImage run(Path image, Path library, Path output, ClassificationConfig config,
									  boolean resampleLibrary, ProcessingContext context) throws IOException, InterruptedException
	{
		final Logger log = context.getLog();

		final RasterCube cube = EnviReader.readCube(image);
		log.info("Read " + image + " (" + cube.getWidth() + "x" + cube.getHeight() + ", " + cube.getNumBands() + " bands)");

		ReferenceLibrary referenceLibrary = SpectralLibraryReader.read(library);
		log.info("Read " + referenceLibrary.size() + " reference spectra from " + library);

		if(resampleLibrary)
		{
			referenceLibrary = LibraryResampler.resample(referenceLibrary, cube.getWavelengths());
			log.info("Resampled reference library onto " + cube.getNumBands() + " image bands");
		}

		final ClassifiedImage classified = MineralClassifier.classifyImage(cube, referenceLibrary, config, context);

		classified.write(output);
		log.info("Wrote " + classified.getCatalog().size() + " class classification to " + output);

		return classified;
	}

	static List<String> parseClassNames(String classNames)
	{
		return Arrays.stream(classNames.split(","))
				.map(String::trim)
				.filter(name -> !name.isEmpty())
				.collect(Collectors.toList());
	}

	@Override
	public void run()
	{
		try
		{
			ClassificationConfig config = ClassificationConfig.defaults();

			final double threshold = MineralMapSettings.getThreshold(prefService);
			if(threshold > 0)
				config = config.withThreshold(threshold);

			final List<String> subset = parseClassNames(classNames == null ? "" : classNames);
			if(!subset.isEmpty())
				config = config.withClassNames(subset);

			run(imageFile.toPath(), libraryFile.toPath(), outputFile.toPath(), config,
					MineralMapSettings.isResampleLibrary(prefService),
					MineralMapSettings.createContext(prefService, log, statusService));
		}
		catch (Exception e)
		{
			log.error(e);
			throw new RuntimeException(e);
		}
	}
}
