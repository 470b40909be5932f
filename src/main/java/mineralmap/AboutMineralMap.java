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

import mineralmap.util.MineralMapVersion;
import org.scijava.ItemIO;
import org.scijava.ItemVisibility;
import org.scijava.command.Command;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

@Plugin(type = Command.class, menuPath = "Plugins>Hyperspectral>MineralMap>About MineralMap")
public class AboutMineralMap implements Command
{
	@Parameter(visibility = ItemVisibility.MESSAGE, type = ItemIO.OUTPUT)
	private String about;

	public static String getText()
	{
		return "ABOUT " + MineralMapVersion.getNameAndVersion().toUpperCase() + "\n\n" +
				"MineralMap classifies the pixels of AVIRIS-NG and AVIRIS-C reflectance images into minerals by " +
				"comparing each pixel spectrum with the reference spectra of an ENVI spectral library, such as the " +
				"USGS Digital Spectral Library, using the spectral angle." +
				"\n\n" +
				"It can also remove unused classes from a classified image and compose visible light RGB images " +
				"from the red, green and blue bands of either sensor.";
	}

	@Override
	public void run()
	{
		about = getText();
	}
}
