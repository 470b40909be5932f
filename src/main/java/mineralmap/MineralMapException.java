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

/**
 * Base class of the domain failures raised by classification, compaction and RGB composition.
 */
public class MineralMapException extends RuntimeException
{
	static final long serialVersionUID = 42L;

	public MineralMapException(String message)
	{
		super(message);
	}

	public MineralMapException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
