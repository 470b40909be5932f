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

import org.scijava.log.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits an image into horizontal, non-overlapping tiles of whole rows and runs one task per
 * tile on the context's executor. Tasks must only write to the rows they are given.
 */
public class TiledProcessor
{
	public interface RowTask
	{
		void processRows(int firstRow, int numRows);
	}

	private final ProcessingContext context;

	public TiledProcessor(ProcessingContext context)
	{
		this.context = context;
	}

	public int getNumTiles(int height)
	{
		final int tileRows = context.getTileRows();
		return (height + tileRows - 1) / tileRows;
	}

	/**
	 * Blocks until every tile has been processed. The first failing tile cancels the tiles that
	 * have not started yet and its exception is rethrown unchanged.
	 */
	public void process(final int height, final String description, final RowTask task) throws InterruptedException
	{
		final int tileRows = context.getTileRows();
		final int numTiles = getNumTiles(height);
		final CancellationSignal cancellationSignal = context.getCancellationSignal();
		final ProgressListener progressListener = context.getProgressListener();
		final Logger log = context.getLog();

		final AtomicInteger numProcessed = new AtomicInteger(0);
		final List<Future<?>> futures = new ArrayList<>(numTiles);

		cancellationSignal.throwIfCancelled(description);

		for(int tile = 0; tile < numTiles; tile++)
		{
			final int firstRow = tile * tileRows;
			final int numRows = Math.min(tileRows, height - firstRow);

			futures.add(context.getExecutor().submit(() -> {
				cancellationSignal.throwIfCancelled(description);

				long startTime = System.currentTimeMillis();
				task.processRows(firstRow, numRows);

				int processed = numProcessed.incrementAndGet();
				if(log.isDebug())
					log.debug(description + ": rows " + firstRow + "-" + (firstRow + numRows - 1) + " in " +
							(System.currentTimeMillis() - startTime) + "ms [" + processed + "/" + numTiles + "]");

				progressListener.onProgress(processed, numTiles, description);
				return null;
			}));
		}

		try
		{
			for(Future<?> future : futures)
				future.get();
		}
		catch (ExecutionException e)
		{
			for(Future<?> future : futures)
				future.cancel(false);

			final Throwable cause = e.getCause();
			if(cause instanceof RuntimeException)
				throw (RuntimeException) cause;
			if(cause instanceof Error)
				throw (Error) cause;

			throw new IllegalStateException(description + " failed", cause);
		}
		catch (InterruptedException e)
		{
			for(Future<?> future : futures)
				future.cancel(true);

			throw e;
		}
	}
}
