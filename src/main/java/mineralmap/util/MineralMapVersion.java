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

package mineralmap.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class MineralMapVersion
{
	public static final String NAME = "MineralMap";

	private static final String VERSION_RESOURCE = "/mineralmap/version.properties";
	private static final String UNKNOWN_VERSION = "unknown";

	private static String version = null;

	public static synchronized String getVersion()
	{
		if(version == null)
			version = readVersion();

		return version;
	}

	/** e.g. "MineralMap 0.5.0" */
	public static String getNameAndVersion()
	{
		return NAME + " " + getVersion();
	}

	private static String readVersion()
	{
		try (InputStream input = MineralMapVersion.class.getResourceAsStream(VERSION_RESOURCE))
		{
			if(input == null)
				return UNKNOWN_VERSION;

			Properties properties = new Properties();
			properties.load(input);

			String value = properties.getProperty("version", UNKNOWN_VERSION).trim();

			//unfiltered resource, e.g. when run from an IDE without Maven resource processing
			if(value.isEmpty() || value.startsWith("${"))
				return UNKNOWN_VERSION;

			return value;
		}
		catch (IOException e)
		{
			throw new IllegalStateException("Failed to read " + VERSION_RESOURCE, e);
		}
	}
}
