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

import ij.io.FileInfo;

/**
 * ENVI {@code data type} codes and the ImageJ raw file type used to read or write them.
 * Signed 16-bit samples are read as raw unsigned words and re-signed after reading.
 */
public enum EnviDataType
{
	BYTE(1, 1, FileInfo.GRAY8),
	INT16(2, 2, FileInfo.GRAY16_UNSIGNED),
	INT32(3, 4, FileInfo.GRAY32_INT),
	FLOAT32(4, 4, FileInfo.GRAY32_FLOAT),
	FLOAT64(5, 8, FileInfo.GRAY64_FLOAT),
	UINT16(12, 2, FileInfo.GRAY16_UNSIGNED),
	UINT32(13, 4, FileInfo.GRAY32_UNSIGNED);

	private final int code;
	private final int bytesPerSample;
	private final int imageJFileType;

	EnviDataType(int code, int bytesPerSample, int imageJFileType)
	{
		this.code = code;
		this.bytesPerSample = bytesPerSample;
		this.imageJFileType = imageJFileType;
	}

	public int getCode()
	{
		return code;
	}

	public int getBytesPerSample()
	{
		return bytesPerSample;
	}

	int getImageJFileType()
	{
		return imageJFileType;
	}

	public static EnviDataType fromCode(int code)
	{
		for(EnviDataType type : values())
			if(type.code == code)
				return type;

		throw new IllegalArgumentException("Unsupported ENVI data type " + code);
	}

	/** Sample {@code index} of an array returned by ImageJ's reader for this type. */
	float sampleAt(Object pixels, int index)
	{
		switch (this)
		{
			case BYTE:
				return ((byte[]) pixels)[index] & 0xff;
			case INT16:
				return (short) ((short[]) pixels)[index];
			case UINT16:
				return ((short[]) pixels)[index] & 0xffff;
			default:
				return ((float[]) pixels)[index];
		}
	}
}
