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

import ij.Prefs;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

/**
 * Shared worker pool used when a {@link ProcessingContext} is built without an explicit executor.
 */
public class MineralMapEnvironment {

    private static int numThreads = Math.max(1, Prefs.getThreads());
    private static ExecutorService processingExecutor = new ForkJoinPool(numThreads);

    public static synchronized void setNumThreads(int numThreads) {
        if (numThreads < 1)
            throw new IllegalArgumentException("Number of threads must be at least 1. Requested: " + numThreads);

        if (numThreads == MineralMapEnvironment.numThreads)
            return;

        processingExecutor.shutdown();

        MineralMapEnvironment.numThreads = numThreads;
        processingExecutor = new ForkJoinPool(numThreads);
    }

    public static synchronized ExecutorService getProcessingExecutor() {
        return processingExecutor;
    }

    public static synchronized int getNumThreads() {
        return numThreads;
    }

}
