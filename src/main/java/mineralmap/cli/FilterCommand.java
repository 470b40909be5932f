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

import mineralmap.FilterMineralClasses;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "filter", mixinStandardHelpOptions = true,
		description = "Remove unused classes from a classification, in place.")
public class FilterCommand implements Callable<Integer>
{
	@ParentCommand
	private MineralMapCli parent;

	@Parameters(index = "0", description = "ENVI header of the classification.")
	private Path classified;

	@Override
	public Integer call() throws Exception
	{
		FilterMineralClasses.run(classified, parent.getLog());
		return 0;
	}
}
