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

package mineralmap.classifier;

import ij.process.ShortProcessor;
import mineralmap.library.InvalidLibraryException;
import mineralmap.library.ReferenceLibrary;
import mineralmap.library.ReferenceSpectrum;
import mineralmap.raster.RasterCube;
import mineralmap.raster.RasterMetadata;
import mineralmap.raster.Wavelengths;
import mineralmap.util.ProcessingContext;
import mineralmap.util.SpectrumBufferPool;
import mineralmap.util.TiledProcessor;
import org.scijava.log.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Assigns every pixel of a raster cube to the reference spectrum with the smallest spectral
 * angle.
 * <p>
 * Nodata pixels (all zero, all equal to the raster's {@code data ignore value}, or holding a
 * non-finite value) are assigned {@value ClassCatalog#NO_DATA} without comparison. Ties go to
 * the reference listed first. A winner whose similarity is below the configured threshold is
 * replaced by {@value ClassCatalog#NO_DATA}; the threshold never changes which reference wins.
 */
public class MineralClassifier
{
	private static final String DESCRIPTION = "Classifying minerals";

	public static ClassifiedImage classifyImage(RasterCube image, ReferenceLibrary library, ClassificationConfig config) throws InterruptedException
	{
		return classifyImage(image, library, config, ProcessingContext.defaults());
	}

	public static ClassifiedImage classifyImage(final RasterCube image, ReferenceLibrary library, ClassificationConfig config,
												ProcessingContext context) throws InterruptedException
	{
		final Logger log = context.getLog();

		Wavelengths.requireCompatible(image.getNumBands(), image.getWavelengths(), library.getNumBands(), library.getWavelengths());

		final List<ReferenceSpectrum> eligible = selectEligible(library, config, log);
		final List<String> eligibleNames = new ArrayList<>(eligible.size());
		for(ReferenceSpectrum spectrum : eligible)
			eligibleNames.add(spectrum.getName());

		if(eligibleNames.size() >= ClassCatalog.MAX_CLASSES)
			throw new InvalidLibraryException("At most " + (ClassCatalog.MAX_CLASSES - 1) + " reference spectra can be classified, found " +
					eligibleNames.size());

		final ClassCatalog catalog = ClassCatalog.withNoData(eligibleNames);

		final int numReferences = eligible.size();
		final double[][] references = new double[numReferences][];
		final double[] referenceNorms = new double[numReferences];
		for(int i = 0; i < numReferences; i++)
		{
			references[i] = eligible.get(i).getValues();
			referenceNorms[i] = SpectralAngle.norm(references[i]);
		}

		final int width = image.getWidth();
		final int height = image.getHeight();
		final int numBands = image.getNumBands();
		final OptionalDouble dataIgnoreValue = image.getDataIgnoreValue();
		final OptionalDouble threshold = config.getThreshold();

		log.info("Classifying " + image.getName() + " (" + width + "x" + height + ", " + numBands + " bands) against " +
				numReferences + " reference spectra" + (threshold.isPresent() ? " with threshold " + threshold.getAsDouble() : ""));

		final long startTime = System.currentTimeMillis();

		final short[] classIds = new short[width * height];
		final TiledProcessor tiledProcessor = new TiledProcessor(context);
		final SpectrumBufferPool bufferPool = new SpectrumBufferPool(tiledProcessor.getNumTiles(height), numBands);

		try
		{
			tiledProcessor.process(height, DESCRIPTION, (firstRow, numRows) -> {
				final double[] spectrum = bufferPool.borrowSpectrum();
				try
				{
					for(int y = firstRow; y < firstRow + numRows; y++)
					{
						for(int x = 0; x < width; x++)
						{
							image.getSpectrum(x, y, spectrum);

							classIds[y * width + x] = (short) classifyPixel(spectrum, numBands, dataIgnoreValue,
									references, referenceNorms, threshold);
						}
					}
				}
				finally
				{
					bufferPool.returnSpectrum(spectrum);
				}
			});
		}
		finally
		{
			bufferPool.close();
		}

		log.info("Classified " + image.getName() + " in " + (System.currentTimeMillis() - startTime) + "ms");

		final RasterMetadata metadata = new RasterMetadata();
		metadata.put(RasterMetadata.DESCRIPTION, "{" + ClassifiedImage.description() + "}");
		metadata.put(RasterMetadata.FILE_TYPE, ClassifiedImage.FILE_TYPE);

		final RasterMetadata sourceMetadata = image.getMetadata();
		if(sourceMetadata.containsKey(RasterMetadata.MAP_INFO))
			metadata.put(RasterMetadata.MAP_INFO, sourceMetadata.get(RasterMetadata.MAP_INFO));

		ClassifiedImage.putLookup(metadata, catalog.getGrayLookup());

		return new ClassifiedImage(new ShortProcessor(width, height, classIds, null), catalog, metadata);
	}

	/**
	 * Class id for one spectrum: 0 for nodata or a winner below the threshold, otherwise one
	 * more than the index of the closest reference.
	 */
	static int classifyPixel(double[] spectrum, int numBands, OptionalDouble dataIgnoreValue,
							 double[][] references, double[] referenceNorms, OptionalDouble threshold)
	{
		if(isNoData(spectrum, numBands, dataIgnoreValue))
			return ClassCatalog.NO_DATA_ID;

		double norm = 0;
		for(int b = 0; b < numBands; b++)
			norm += spectrum[b] * spectrum[b];
		norm = Math.sqrt(norm);

		int best = -1;
		double bestAngle = Double.POSITIVE_INFINITY;
		for(int i = 0; i < references.length; i++)
		{
			final double angle = SpectralAngle.angle(spectrum, norm, references[i], referenceNorms[i]);

			// strict comparison keeps the earliest reference on ties
			if(angle < bestAngle)
			{
				bestAngle = angle;
				best = i;
			}
		}

		if(threshold.isPresent() && SpectralAngle.similarity(bestAngle) < threshold.getAsDouble())
			return ClassCatalog.NO_DATA_ID;

		return best + 1;
	}

	static boolean isNoData(double[] spectrum, int numBands, OptionalDouble dataIgnoreValue)
	{
		boolean allZero = true;
		boolean allIgnored = dataIgnoreValue.isPresent();
		// samples are held as floats, so the ignore value is narrowed the same way
		final double ignored = dataIgnoreValue.isPresent() ? (double) (float) dataIgnoreValue.getAsDouble() : Double.NaN;

		for(int b = 0; b < numBands; b++)
		{
			final double value = spectrum[b];
			if(!Double.isFinite(value))
				return true;

			allZero &= value == 0;
			allIgnored &= value == ignored;
		}

		return allZero || allIgnored;
	}

	private static List<ReferenceSpectrum> selectEligible(ReferenceLibrary library, ClassificationConfig config, Logger log)
	{
		if(!config.hasClassNames())
			return library.getSpectra();

		final List<String> requested = config.getClassNames();
		for(String name : requested)
			if(!library.contains(name))
				log.warn("Class \"" + name + "\" is not in the reference library and is ignored");

		final List<ReferenceSpectrum> eligible = new ArrayList<>();
		for(ReferenceSpectrum spectrum : library.getSpectra())
			if(requested.contains(spectrum.getName()))
				eligible.add(spectrum);

		if(eligible.isEmpty())
			throw new EmptySubsetException("None of the requested classes " + requested + " are in the reference library");

		return eligible;
	}
}
