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

import mineralmap.ConvertToRgb;
import mineralmap.util.ProcessingContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "rgb", mixinStandardHelpOptions = true,
		description = "Compose a visible light image from an AVIRIS-NG or AVIRIS-C image.")
public class RgbCommand implements Callable<Integer>
{
	@ParentCommand
	private MineralMapCli parent;

	@Option(names = {"-i", "--image"}, required = true, description = "ENVI header of the source image.")
	private Path image;

	@Option(names = {"-o", "--output"}, required = true, description = "ENVI header of the RGB image to write.")
	private Path output;

	@Option(names = "--png", description = "Also write an 8-bit PNG preview.")
	private Path png;

	@Override
	public Integer call() throws Exception
	{
		ConvertToRgb.run(image, output, png, parent.createContext(ProcessingContext.DEFAULT_TILE_ROWS, null));
		return 0;
	}
}
