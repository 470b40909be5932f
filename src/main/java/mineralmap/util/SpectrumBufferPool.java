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

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

/**
 * Scratch spectra for tile workers, so a tile does not allocate a band-length array per pixel.
 */
public class SpectrumBufferPool extends GenericObjectPool<double[]> {

	private final int numBands;

	public SpectrumBufferPool(int size, final int numBands) {
		super(new BasePooledObjectFactory<double[]>() {
			@Override
			public double[] create() {
				return new double[numBands];
			}

			@Override
			public PooledObject<double[]> wrap(double[] spectrum) {
				return new DefaultPooledObject<>(spectrum);
			}
		}, config(size));

		this.numBands = numBands;
	}

	public int getNumBands() {
		return numBands;
	}

	public double[] borrowSpectrum() {
		try {
			return borrowObject();
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to borrow a " + numBands + " band spectrum buffer", e);
		}
	}

	public void returnSpectrum(double[] spectrum) {
		returnObject(spectrum);
	}

	static GenericObjectPoolConfig<double[]> config(int size) {
		final GenericObjectPoolConfig<double[]> config = new GenericObjectPoolConfig<>();
		config.setMaxIdle(size);
		config.setMaxTotal(size);
		config.setBlockWhenExhausted(true);

		return config;
	}
}
