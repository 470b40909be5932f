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

import mineralmap.util.MineralMapEnvironment;
import mineralmap.util.ProcessingContext;
import mineralmap.util.ProgressListener;
import org.scijava.ItemIO;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.log.Logger;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.prefs.PrefService;
import org.scijava.widget.NumberWidget;

/**
 * Runs the Plugins::Hyperspectral::MineralMap::MineralMap Settings dialog and holds the
 * persisted defaults the other commands read.
 */
@Plugin(type = Command.class, menuPath = "Plugins>Hyperspectral>MineralMap>MineralMap Settings")
public class MineralMapSettings implements Command
{
	public static final int DEFAULT_TILE_ROWS = ProcessingContext.DEFAULT_TILE_ROWS;
	public static final int DEFAULT_NUM_THREADS = 0;
	public static final double DEFAULT_THRESHOLD = 0;
	public static final boolean DEFAULT_RESAMPLE_LIBRARY = false;

	public static final String MINERALMAP_TILE_ROWS = "MineralMap Tile Rows";
	public static final String MINERALMAP_NUM_THREADS = "MineralMap Num Threads";
	public static final String MINERALMAP_THRESHOLD = "MineralMap Threshold";
	public static final String MINERALMAP_RESAMPLE_LIBRARY = "MineralMap Resample Library";

	@Parameter
	private PrefService preferences;

	@Parameter(label = "Rows per tile", type = ItemIO.INPUT,
			style = NumberWidget.SPINNER_STYLE, min = "1", initializer = "initialiseValues",
			description = "Number of image rows processed by each parallel task. Smaller tiles report progress " +
					"more often and respond to cancellation sooner.")
	private int tileRows = DEFAULT_TILE_ROWS;

	@Parameter(label = "Threads", type = ItemIO.INPUT,
			style = NumberWidget.SPINNER_STYLE, min = "0", initializer = "initialiseValues",
			description = "Number of worker threads. If 0 is selected the ImageJ thread setting is used.")
	private int numThreads = DEFAULT_NUM_THREADS;

	@Parameter(label = "Default similarity threshold", type = ItemIO.INPUT,
			style = NumberWidget.SLIDER_STYLE, min = "0", max = "1", stepSize = "0.01", initializer = "initialiseValues",
			description = "Pixels whose best match is less similar than this are classified as \"No data\". " +
					"0 disables the threshold.")
	private double threshold = DEFAULT_THRESHOLD;

	@Parameter(label = "Resample spectral library", type = ItemIO.INPUT, initializer = "initialiseValues",
			description = "Interpolate the spectral library onto the image wavelengths before classifying.")
	private boolean resampleLibrary = DEFAULT_RESAMPLE_LIBRARY;

	protected void initialiseValues()
	{
		tileRows = getTileRows(preferences);
		numThreads = preferences.getInt(MineralMapSettings.class, MINERALMAP_NUM_THREADS, DEFAULT_NUM_THREADS);
		threshold = getThreshold(preferences);
		resampleLibrary = isResampleLibrary(preferences);
	}

	@Override
	public void run()
	{
		preferences.put(MineralMapSettings.class, MINERALMAP_TILE_ROWS, tileRows);
		preferences.put(MineralMapSettings.class, MINERALMAP_NUM_THREADS, numThreads);
		preferences.put(MineralMapSettings.class, MINERALMAP_THRESHOLD, threshold);
		preferences.put(MineralMapSettings.class, MINERALMAP_RESAMPLE_LIBRARY, resampleLibrary);
	}

	public static int getTileRows(PrefService preferences)
	{
		return Math.max(1, preferences.getInt(MineralMapSettings.class, MINERALMAP_TILE_ROWS, DEFAULT_TILE_ROWS));
	}

	public static double getThreshold(PrefService preferences)
	{
		return preferences.getDouble(MineralMapSettings.class, MINERALMAP_THRESHOLD, DEFAULT_THRESHOLD);
	}

	public static boolean isResampleLibrary(PrefService preferences)
	{
		return preferences.getBoolean(MineralMapSettings.class, MINERALMAP_RESAMPLE_LIBRARY, DEFAULT_RESAMPLE_LIBRARY);
	}

	/**
	 * Context for a command run from the saved settings. A saved thread count above zero resizes
	 * the shared worker pool.
	 */
	public static ProcessingContext createContext(PrefService preferences, Logger log, StatusService statusService)
	{
		final int numThreads = preferences.getInt(MineralMapSettings.class, MINERALMAP_NUM_THREADS, DEFAULT_NUM_THREADS);
		if(numThreads > 0)
			MineralMapEnvironment.setNumThreads(numThreads);

		return ProcessingContext.defaults()
				.withTileRows(getTileRows(preferences))
				.withLog(log)
				.withProgressListener(ProgressListener.forStatusService(statusService));
	}
}
