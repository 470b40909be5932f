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

package mineralmap.raster;

import ij.ImageStack;
import ij.io.FileInfo;
import ij.io.ImageReader;
import ij.process.FloatProcessor;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads ENVI rasters into memory through ImageJ's raw image reader. Every band becomes a float
 * slice regardless of the stored sample type, so 64-bit float data (ENVI data type 5) is
 * rounded to 32-bit precision on read. Integer samples up to 24 bits are held exactly.
 */
public class EnviReader
{
	private static final int BUFFER_SIZE = 1 << 16;

	/** Storage layout declared by a header. */
	static class Layout
	{
		final int samples;
		final int lines;
		final int bands;
		final EnviDataType dataType;
		final Interleave interleave;
		final boolean littleEndian;
		final long headerOffset;

		Layout(int samples, int lines, int bands, EnviDataType dataType, Interleave interleave, boolean littleEndian, long headerOffset)
		{
			this.samples = samples;
			this.lines = lines;
			this.bands = bands;
			this.dataType = dataType;
			this.interleave = interleave;
			this.littleEndian = littleEndian;
			this.headerOffset = headerOffset;
		}

		long getDataSize()
		{
			return (long) samples * lines * bands * dataType.getBytesPerSample();
		}

		static Layout of(RasterMetadata metadata, Path headerFile) throws IOException
		{
			try
			{
				final int samples = required(metadata, RasterMetadata.SAMPLES, headerFile);
				final int lines = required(metadata, RasterMetadata.LINES, headerFile);
				final int bands = required(metadata, RasterMetadata.BANDS, headerFile);
				final EnviDataType dataType = EnviDataType.fromCode(required(metadata, RasterMetadata.DATA_TYPE, headerFile));

				final String interleaveValue = metadata.getString(RasterMetadata.INTERLEAVE);
				final Interleave interleave = interleaveValue == null ? Interleave.BSQ : Interleave.fromHeaderValue(interleaveValue);

				final int byteOrder = metadata.getInt(RasterMetadata.BYTE_ORDER).orElse(0);
				if(byteOrder != 0 && byteOrder != 1)
					throw new IllegalArgumentException("byte order must be 0 or 1, found " + byteOrder);

				final int headerOffset = metadata.getInt(RasterMetadata.HEADER_OFFSET).orElse(0);
				if(samples < 1 || lines < 1 || bands < 1 || headerOffset < 0)
					throw new IllegalArgumentException("invalid dimensions " + samples + "x" + lines + "x" + bands +
							" with header offset " + headerOffset);

				if((long) samples * lines > Integer.MAX_VALUE)
					throw new IllegalArgumentException("band of " + samples + "x" + lines + " pixels is too large");

				return new Layout(samples, lines, bands, dataType, interleave, byteOrder == 0, headerOffset);
			}
			catch (IllegalArgumentException e)
			{
				throw new IOException(headerFile + ": " + e.getMessage(), e);
			}
		}

		private static int required(RasterMetadata metadata, String key, Path headerFile) throws IOException
		{
			if(!metadata.getInt(key).isPresent())
				throw new IOException(headerFile + ": missing required field \"" + key + "\"");

			return metadata.getInt(key).getAsInt();
		}
	}

	public static StackRasterCube readCube(Path path) throws IOException
	{
		final Path headerFile = EnviHeader.headerFileFor(path);
		final RasterMetadata metadata = EnviHeader.read(headerFile);
		final Layout layout = Layout.of(metadata, headerFile);
		final Path dataFile = EnviHeader.findDataFile(headerFile);

		final ImageStack stack = readStack(dataFile, layout);

		try
		{
			return new StackRasterCube(rasterName(headerFile), stack, metadata);
		}
		catch (IllegalArgumentException e)
		{
			throw new IOException(headerFile + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Reads the pixels described by an already parsed header, one slice per band. Used for
	 * files whose wavelength axis does not run along the bands, such as spectral libraries.
	 */
	public static ImageStack readPixels(Path headerFile, RasterMetadata metadata) throws IOException
	{
		return readStack(EnviHeader.findDataFile(headerFile), Layout.of(metadata, headerFile));
	}

	/** Header base name without a trailing data file extension, e.g. {@code ang20150420t182050_img}. */
	static String rasterName(Path headerFile)
	{
		final String base = EnviHeader.baseName(headerFile);
		final String lowerCase = base.toLowerCase(Locale.ROOT);

		for(String extension : new String[] {".img", ".dat", ".raw", ".bsq", ".bil", ".bip", ".sli"})
			if(lowerCase.endsWith(extension))
				return base.substring(0, base.length() - extension.length());

		return base;
	}

	static ImageStack readStack(Path dataFile, Layout layout) throws IOException
	{
		final long expectedSize = layout.headerOffset + layout.getDataSize();
		final long actualSize = Files.size(dataFile);
		if(actualSize < expectedSize)
			throw new IOException(dataFile + " is truncated: expected " + expectedSize + " bytes but found " + actualSize);

		final int samples = layout.samples;
		final int lines = layout.lines;
		final int numBands = layout.bands;
		final EnviDataType type = layout.dataType;

		final float[][] bandPixels = new float[numBands][samples * lines];

		try (InputStream in = new BufferedInputStream(Files.newInputStream(dataFile), BUFFER_SIZE))
		{
			switch (layout.interleave)
			{
				case BSQ:
				{
					final ImageReader reader = new ImageReader(fileInfo(layout, samples, lines));
					for(int b = 0; b < numBands; b++)
					{
						final Object pixels = readChunk(reader, in, b == 0 ? layout.headerOffset : 0, dataFile);
						final float[] band = bandPixels[b];
						for(int i = 0; i < band.length; i++)
							band[i] = type.sampleAt(pixels, i);
					}
					break;
				}
				case BIL:
				{
					// one image line holds a row of every band
					final ImageReader reader = new ImageReader(fileInfo(layout, samples, numBands));
					for(int y = 0; y < lines; y++)
					{
						final Object pixels = readChunk(reader, in, y == 0 ? layout.headerOffset : 0, dataFile);
						final int rowStart = y * samples;
						for(int b = 0; b < numBands; b++)
							for(int x = 0; x < samples; x++)
								bandPixels[b][rowStart + x] = type.sampleAt(pixels, b * samples + x);
					}
					break;
				}
				case BIP:
				{
					final ImageReader reader = new ImageReader(fileInfo(layout, numBands, samples));
					for(int y = 0; y < lines; y++)
					{
						final Object pixels = readChunk(reader, in, y == 0 ? layout.headerOffset : 0, dataFile);
						final int rowStart = y * samples;
						for(int x = 0; x < samples; x++)
							for(int b = 0; b < numBands; b++)
								bandPixels[b][rowStart + x] = type.sampleAt(pixels, x * numBands + b);
					}
					break;
				}
				default:
					throw new IllegalStateException("Unhandled interleave " + layout.interleave);
			}
		}

		final ImageStack stack = new ImageStack(samples, lines);
		for(float[] band : bandPixels)
			stack.addSlice(null, new FloatProcessor(samples, lines, band));

		return stack;
	}

	private static FileInfo fileInfo(Layout layout, int width, int height)
	{
		final FileInfo fi = new FileInfo();
		fi.fileFormat = FileInfo.RAW;
		fi.fileType = layout.dataType.getImageJFileType();
		fi.width = width;
		fi.height = height;
		fi.nImages = 1;
		fi.intelByteOrder = layout.littleEndian;
		return fi;
	}

	private static Object readChunk(ImageReader reader, InputStream in, long skip, Path dataFile) throws IOException
	{
		final Object pixels = reader.readPixels(in, skip);
		if(pixels == null)
			throw new IOException("Failed to read pixel data from " + dataFile);

		return pixels;
	}
}
