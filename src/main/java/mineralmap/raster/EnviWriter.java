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
import ij.io.ImageWriter;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes band sequential, little-endian ENVI rasters through ImageJ's raw image writer.
 * <p>
 * Data and header are first written to {@code .part} files and only renamed over their
 * destinations once both are complete. Any existing header is removed before the data is
 * replaced and the new header is renamed last, so a failed write leaves either the old raster
 * or a data file with no header, never new data described by an old header.
 */
public class EnviWriter
{
	public static final String PART_SUFFIX = ".part";
	public static final String ENVI_STANDARD = "ENVI Standard";

	private static final int BUFFER_SIZE = 1 << 16;

	public static void write(Path headerFile, ImageStack stack, EnviDataType dataType, RasterMetadata metadata) throws IOException
	{
		write(headerFile, EnviHeader.dataFileFor(headerFile), stack, dataType, metadata);
	}

	public static void write(Path headerFile, Path dataFile, ImageStack stack, EnviDataType dataType, RasterMetadata metadata) throws IOException
	{
		final int fileType = fileTypeFor(dataType, stack);

		final RasterMetadata headerMetadata = metadata.copy();
		if(!headerMetadata.containsKey(RasterMetadata.FILE_TYPE))
			headerMetadata.put(RasterMetadata.FILE_TYPE, ENVI_STANDARD);
		headerMetadata.putInt(RasterMetadata.SAMPLES, stack.getWidth());
		headerMetadata.putInt(RasterMetadata.LINES, stack.getHeight());
		headerMetadata.putInt(RasterMetadata.BANDS, stack.getSize());
		headerMetadata.putInt(RasterMetadata.HEADER_OFFSET, 0);
		headerMetadata.putInt(RasterMetadata.DATA_TYPE, dataType.getCode());
		headerMetadata.put(RasterMetadata.INTERLEAVE, Interleave.BSQ.getHeaderValue());
		headerMetadata.putInt(RasterMetadata.BYTE_ORDER, 0);

		final Path dataPart = partFile(dataFile);
		final Path headerPart = partFile(headerFile);

		try
		{
			final FileInfo fi = new FileInfo();
			fi.fileFormat = FileInfo.RAW;
			fi.fileType = fileType;
			fi.width = stack.getWidth();
			fi.height = stack.getHeight();
			fi.nImages = stack.getSize();
			fi.intelByteOrder = true;
			fi.pixels = stack.getSize() > 1 ? stack.getImageArray() : stack.getPixels(1);

			try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(dataPart), BUFFER_SIZE))
			{
				new ImageWriter(fi).write(out);
			}

			EnviHeader.write(headerMetadata, headerPart);

			Files.deleteIfExists(headerFile);
			move(dataPart, dataFile);
			move(headerPart, headerFile);
		}
		catch (IOException | RuntimeException e)
		{
			deleteQuietly(dataPart, e);
			deleteQuietly(headerPart, e);
			throw e;
		}
	}

	static Path partFile(Path file)
	{
		return file.resolveSibling(file.getFileName() + PART_SUFFIX);
	}

	private static int fileTypeFor(EnviDataType dataType, ImageStack stack)
	{
		final Object pixels = stack.getPixels(1);
		switch (dataType)
		{
			case BYTE:
				if(pixels instanceof byte[])
					return FileInfo.GRAY8;
				break;
			case UINT16:
				if(pixels instanceof short[])
					return FileInfo.GRAY16_UNSIGNED;
				break;
			case FLOAT32:
				if(pixels instanceof float[])
					return FileInfo.GRAY32_FLOAT;
				break;
			default:
				throw new IllegalArgumentException("Writing ENVI data type " + dataType + " is not supported");
		}

		throw new IllegalArgumentException("Stack pixels of type " + pixels.getClass().getSimpleName() +
				" cannot be written as " + dataType);
	}

	private static void move(Path source, Path target) throws IOException
	{
		try
		{
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e)
		{
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static void deleteQuietly(Path file, Exception failure)
	{
		try
		{
			Files.deleteIfExists(file);
		}
		catch (IOException e)
		{
			failure.addSuppressed(e);
		}
	}
}
