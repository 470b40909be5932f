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

package mineralmap.library;

import mineralmap.classifier.ClassCatalog;

import java.util.*;

/**
 * Ordered, immutable collection of reference spectra sharing one wavelength axis.
 * <p>
 * Construction validates the library: it must be non-empty, every spectrum must have the
 * same number of bands (matching the axis when one is given), names must be non-blank,
 * unique and different from {@value ClassCatalog#NO_DATA}, and every spectrum must be finite
 * with a non-zero norm.
 */
public final class ReferenceLibrary
{
	private final List<ReferenceSpectrum> spectra;
	private final double[] wavelengths;
	private final Map<String, Integer> indexByName;

	/**
	 * @param wavelengths band centres in nanometres, or an empty array if unknown
	 * @throws InvalidLibraryException if the library is not usable for classification
	 */
	public ReferenceLibrary(List<ReferenceSpectrum> spectra, double[] wavelengths)
	{
		if(spectra.isEmpty())
			throw new InvalidLibraryException("Reference library is empty");

		final int numBands = spectra.get(0).getNumBands();
		if(numBands == 0)
			throw new InvalidLibraryException("Reference spectra have no bands");

		if(wavelengths.length != 0 && wavelengths.length != numBands)
			throw new InvalidLibraryException("Reference library has " + wavelengths.length +
					" wavelengths but its spectra have " + numBands + " bands");

		final Map<String, Integer> indexByName = new HashMap<>();
		for(int i = 0; i < spectra.size(); i++)
		{
			final ReferenceSpectrum spectrum = spectra.get(i);
			final String name = spectrum.getName();

			if(name.trim().isEmpty())
				throw new InvalidLibraryException("Reference spectrum " + i + " has no name");

			if(name.equals(ClassCatalog.NO_DATA))
				throw new InvalidLibraryException("\"" + ClassCatalog.NO_DATA + "\" is reserved and cannot name a reference spectrum");

			if(indexByName.put(name, i) != null)
				throw new InvalidLibraryException("Duplicate reference spectrum name \"" + name + "\"");

			if(spectrum.getNumBands() != numBands)
				throw new InvalidLibraryException("Reference spectrum \"" + name + "\" has " + spectrum.getNumBands() +
						" bands, expected " + numBands);

			for(int b = 0; b < numBands; b++)
				if(!Double.isFinite(spectrum.getValue(b)))
					throw new InvalidLibraryException("Reference spectrum \"" + name + "\" has a non-finite value in band " + b);

			if(spectrum.getNorm() == 0)
				throw new InvalidLibraryException("Reference spectrum \"" + name + "\" is all zero");
		}

		this.spectra = Collections.unmodifiableList(new ArrayList<>(spectra));
		this.wavelengths = wavelengths.clone();
		this.indexByName = Collections.unmodifiableMap(indexByName);
	}

	public int size()
	{
		return spectra.size();
	}

	public ReferenceSpectrum get(int index)
	{
		return spectra.get(index);
	}

	public List<ReferenceSpectrum> getSpectra()
	{
		return spectra;
	}

	public int getNumBands()
	{
		return spectra.get(0).getNumBands();
	}

	public double[] getWavelengths()
	{
		return wavelengths.clone();
	}

	public boolean hasWavelengths()
	{
		return wavelengths.length != 0;
	}

	public List<String> getNames()
	{
		final List<String> names = new ArrayList<>(spectra.size());
		for(ReferenceSpectrum spectrum : spectra)
			names.add(spectrum.getName());

		return names;
	}

	public boolean contains(String name)
	{
		return indexByName.containsKey(name);
	}

	/** Position of the spectrum called {@code name}, or -1. */
	public int indexOf(String name)
	{
		final Integer index = indexByName.get(name);
		return index == null ? -1 : index;
	}
}
