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

import org.jetbrains.annotations.NotNull;
import org.scijava.log.Logger;
import org.scijava.log.StderrLogService;

import java.util.concurrent.ExecutorService;

/**
 * Execution settings of one processing run, separate from its inputs. Instances are immutable;
 * the {@code with*} methods return modified copies.
 */
public final class ProcessingContext
{
	public static final int DEFAULT_TILE_ROWS = 64;

	private final ExecutorService executor;
	private final int tileRows;
	private final ProgressListener progressListener;
	private final CancellationSignal cancellationSignal;
	private final Logger log;

	private ProcessingContext(ExecutorService executor, int tileRows, ProgressListener progressListener,
							  CancellationSignal cancellationSignal, Logger log)
	{
		if(tileRows < 1)
			throw new IllegalArgumentException("Tile rows must be at least 1. Requested: " + tileRows);

		this.executor = executor;
		this.tileRows = tileRows;
		this.progressListener = progressListener == null ? ProgressListener.getDummy() : progressListener;
		this.cancellationSignal = cancellationSignal == null ? new CancellationSignal() : cancellationSignal;
		this.log = log == null ? new StderrLogService() : log;
	}

	public static ProcessingContext defaults()
	{
		return new ProcessingContext(null, DEFAULT_TILE_ROWS, null, null, null);
	}

	public ProcessingContext withExecutor(ExecutorService executor)
	{
		return new ProcessingContext(executor, tileRows, progressListener, cancellationSignal, log);
	}

	public ProcessingContext withTileRows(int tileRows)
	{
		return new ProcessingContext(executor, tileRows, progressListener, cancellationSignal, log);
	}

	public ProcessingContext withProgressListener(ProgressListener progressListener)
	{
		return new ProcessingContext(executor, tileRows, progressListener, cancellationSignal, log);
	}

	public ProcessingContext withCancellationSignal(CancellationSignal cancellationSignal)
	{
		return new ProcessingContext(executor, tileRows, progressListener, cancellationSignal, log);
	}

	public ProcessingContext withLog(Logger log)
	{
		return new ProcessingContext(executor, tileRows, progressListener, cancellationSignal, log);
	}

	/** The explicit executor, or the shared {@link MineralMapEnvironment} pool when none was given. */
	@NotNull
	public ExecutorService getExecutor()
	{
		return executor == null ? MineralMapEnvironment.getProcessingExecutor() : executor;
	}

	public int getTileRows()
	{
		return tileRows;
	}

	@NotNull
	public ProgressListener getProgressListener()
	{
		return progressListener;
	}

	@NotNull
	public CancellationSignal getCancellationSignal()
	{
		return cancellationSignal;
	}

	@NotNull
	public Logger getLog()
	{
		return log;
	}
}
