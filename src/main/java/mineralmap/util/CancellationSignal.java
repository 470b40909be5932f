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

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abort flag shared between the caller and running tiles. Tiles that have already started run
 * to completion; tiles that start after {@link #cancel()} fail with a
 * {@link CancellationException}.
 */
public class CancellationSignal
{
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public void cancel()
	{
		cancelled.set(true);
	}

	public boolean isCancelled()
	{
		return cancelled.get();
	}

	public void throwIfCancelled(String operation)
	{
		if(isCancelled())
			throw new CancellationException(operation + " cancelled");
	}
}
