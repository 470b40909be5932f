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

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes ENVI text headers. Brace enclosed values may span several lines and are
 * kept verbatim, line breaks included.
 */
public final class EnviHeader
{
	public static final String MAGIC = "ENVI";
	public static final String HEADER_EXTENSION = ".hdr";
	public static final String DATA_EXTENSION = ".img";

	static final Charset CHARSET = StandardCharsets.ISO_8859_1;

	private static final List<String> DATA_EXTENSIONS = Arrays.asList("", DATA_EXTENSION, ".dat", ".raw", ".bsq",
			".bil", ".bip", ".sli");

	private static final List<String> LEADING_FIELDS = Arrays.asList(
			RasterMetadata.DESCRIPTION,
			RasterMetadata.SAMPLES,
			RasterMetadata.LINES,
			RasterMetadata.BANDS,
			RasterMetadata.HEADER_OFFSET,
			RasterMetadata.FILE_TYPE,
			RasterMetadata.DATA_TYPE,
			RasterMetadata.INTERLEAVE,
			RasterMetadata.BYTE_ORDER);

	private EnviHeader() {}

	public static RasterMetadata read(Path headerFile) throws IOException
	{
		if(!Files.isRegularFile(headerFile))
			throw new NoSuchFileException(headerFile.toString(), null, "ENVI header not found");

		return parse(Files.readAllLines(headerFile, CHARSET), headerFile.toString());
	}

	/**
	 * @param source names the header in error messages
	 */
	public static RasterMetadata parse(List<String> lines, String source) throws IOException
	{
		int lineIndex = 0;
		while(lineIndex < lines.size() && lines.get(lineIndex).trim().isEmpty())
			lineIndex++;

		if(lineIndex == lines.size() || !lines.get(lineIndex).trim().equals(MAGIC))
			throw new IOException(source + " is not an ENVI header: first line must be \"" + MAGIC + "\"");

		final RasterMetadata metadata = new RasterMetadata();

		for(lineIndex++; lineIndex < lines.size(); lineIndex++)
		{
			final String line = lines.get(lineIndex);
			final String trimmed = line.trim();
			if(trimmed.isEmpty() || trimmed.startsWith(";"))
				continue;

			final int separator = line.indexOf('=');
			if(separator < 1)
				throw new IOException(source + " line " + (lineIndex + 1) + " is not a \"key = value\" pair: " + trimmed);

			final String key = line.substring(0, separator);
			final StringBuilder value = new StringBuilder(line.substring(separator + 1).trim());

			if(value.length() > 0 && value.charAt(0) == '{')
			{
				final int startLine = lineIndex;
				while(value.indexOf("}") < 0)
				{
					lineIndex++;
					if(lineIndex == lines.size())
						throw new IOException(source + " line " + (startLine + 1) + ": unterminated \"{\" in field \"" + key.trim() + "\"");

					value.append('\n').append(lines.get(lineIndex).trim());
				}
			}

			metadata.put(key, value.toString());
		}

		return metadata;
	}

	public static List<String> format(RasterMetadata metadata)
	{
		final List<String> lines = new ArrayList<>(metadata.size() + 1);
		lines.add(MAGIC);

		for(String key : LEADING_FIELDS)
			if(metadata.containsKey(key))
				lines.add(key + " = " + metadata.get(key));

		for(String key : metadata.keySet())
			if(!LEADING_FIELDS.contains(key))
				lines.add(key + " = " + metadata.get(key));

		return lines;
	}

	public static void write(RasterMetadata metadata, Path headerFile) throws IOException
	{
		Files.write(headerFile, format(metadata), CHARSET);
	}

	/**
	 * The header belonging to {@code path}: the path itself if it is a header, otherwise the
	 * path with its extension replaced by (or, failing that, extended with) {@code .hdr}.
	 */
	public static Path headerFileFor(Path path)
	{
		final String name = path.getFileName().toString();
		if(name.toLowerCase(Locale.ROOT).endsWith(HEADER_EXTENSION))
			return path;

		final Path replaced = path.resolveSibling(stripExtension(name) + HEADER_EXTENSION);
		final Path appended = path.resolveSibling(name + HEADER_EXTENSION);

		if(!Files.exists(replaced) && Files.exists(appended))
			return appended;

		return replaced;
	}

	/** Locates the binary file described by {@code headerFile}. */
	public static Path findDataFile(Path headerFile) throws IOException
	{
		final String base = baseName(headerFile);

		for(String extension : DATA_EXTENSIONS)
		{
			final Path candidate = headerFile.resolveSibling(base + extension);
			if(!candidate.equals(headerFile) && Files.isRegularFile(candidate))
				return candidate;
		}

		throw new NoSuchFileException(headerFile.toString(), null, "no data file found next to ENVI header (tried " +
				base + " with extensions " + DATA_EXTENSIONS + ")");
	}

	/** The data file {@link EnviWriter} pairs with {@code headerFile}. */
	public static Path dataFileFor(Path headerFile)
	{
		return headerFile.resolveSibling(baseName(headerFile) + DATA_EXTENSION);
	}

	/** File name of {@code headerFile} without its {@code .hdr} extension. */
	public static String baseName(Path headerFile)
	{
		final String name = headerFile.getFileName().toString();
		if(name.toLowerCase(Locale.ROOT).endsWith(HEADER_EXTENSION))
			return name.substring(0, name.length() - HEADER_EXTENSION.length());

		return name;
	}

	static String stripExtension(String name)
	{
		final int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}
}
