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

package mineralmap.cli;

import mineralmap.ClassifyMinerals;
import mineralmap.classifier.ClassificationConfig;
import mineralmap.util.ProcessingContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

@Command(name = "classify", mixinStandardHelpOptions = true,
		description = "Classify every pixel of an image against a spectral library.")
public class ClassifyCommand implements Callable<Integer>
{
	@ParentCommand
	private MineralMapCli parent;

	@Option(names = {"-i", "--image"}, required = true, description = "ENVI header of the image to classify.")
	private Path image;

	@Option(names = {"-s", "--library"}, required = true, description = "ENVI header of the spectral library.")
	private Path library;

	@Option(names = {"-o", "--output"}, required = true, description = "ENVI header of the classification to write.")
	private Path output;

	@Option(names = "--threshold", description = "Minimum similarity (0-1) of an accepted match.")
	private Double threshold;

	@Option(names = "--class-names", split = ",", description = "Restrict the classification to these library classes.")
	private List<String> classNames;

	@Option(names = "--resample", description = "Interpolate the library onto the image wavelengths.")
	private boolean resample;

	@Option(names = "--tile-rows", defaultValue = "" + ProcessingContext.DEFAULT_TILE_ROWS,
			description = "Rows per parallel task (default: ${DEFAULT-VALUE}).")
	private int tileRows;

	@Option(names = "--threads", description = "Worker threads (default: ImageJ thread setting).")
	private Integer threads;

	@Override
	public Integer call() throws Exception
	{
		ClassificationConfig config = ClassificationConfig.defaults();
		if(threshold != null)
			config = config.withThreshold(threshold);
		if(classNames != null)
			config = config.withClassNames(classNames);

		final ExecutorService executor = MineralMapCli.createExecutor(threads);
		try
		{
			ClassifyMinerals.run(image, library, output, config, resample, parent.createContext(tileRows, executor));
		}
		finally
		{
			if(executor != null)
				executor.shutdown();
		}

		return 0;
	}
}
