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

import mineralmap.raster.EnviReader;
import mineralmap.raster.RasterCube;
import mineralmap.rgb.RgbComposer;
import mineralmap.rgb.RgbImage;
import mineralmap.rgb.RgbPreview;
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

@Plugin(type = Command.class, headless = true,
		menuPath = "Plugins>Hyperspectral>MineralMap>Convert to RGB")
public class ConvertToRgb implements Command
{
	@Parameter
	private LogService log;

	@Parameter
	private StatusService statusService;

	@Parameter
	private PrefService prefService;

	@Parameter(label = "Hyperspectral image", type = ItemIO.INPUT,
			description = "ENVI header of an AVIRIS-NG or AVIRIS-C image.")
	private File imageFile;

	@Parameter(label = "Output RGB image", type = ItemIO.INPUT, style = FileWidget.SAVE_STYLE,
			description = "ENVI header to write the three band image to.")
	private File outputFile;

	@Parameter(label = "PNG preview", type = ItemIO.INPUT, style = FileWidget.SAVE_STYLE, required = false,
			description = "Optional 8-bit color preview. Leave empty to skip.")
	private File previewFile;

	/**
	 * @param preview PNG preview to write as well, or null
	 */
	public static RgbImage run(Path image, Path output, Path preview, ProcessingContext context) throws IOException, InterruptedException
	{
		final Logger log = context.getLog();

		final RasterCube cube = EnviReader.readCube(image);
		final RgbImage rgb = RgbComposer.toRgb(cube, context);

		rgb.write(output);
		log.info("Wrote " + rgb.getSensor().getLabel() + " RGB image to " + output);

		if(preview != null)
		{
			RgbPreview.save(rgb, preview);
			log.info("Wrote RGB preview to " + preview);
		}

		return rgb;
	}

	@Override
	public void run()
	{
		try
		{
			run(imageFile.toPath(), outputFile.toPath(), previewFile == null ? null : previewFile.toPath(),
					MineralMapSettings.createContext(prefService, log, statusService));
		}
		catch (Exception e)
		{
			log.error(e);
			throw new RuntimeException(e);
		}
	}
}
