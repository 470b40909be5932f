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

import java.util.*;

/**
 * Optional similarity threshold and class subset for a classification run. Immutable.
 */
public final class ClassificationConfig
{
	private static final ClassificationConfig DEFAULTS = new ClassificationConfig(null, null);

	private final Double threshold;
	private final List<String> classNames;

	private ClassificationConfig(Double threshold, List<String> classNames)
	{
		if(threshold != null && !(threshold >= 0 && threshold <= 1))
			throw new IllegalArgumentException("Threshold must be between 0 and 1. Requested: " + threshold);

		this.threshold = threshold;
		this.classNames = classNames == null ? null :
				Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(classNames)));
	}

	/** No threshold and every library class eligible. */
	public static ClassificationConfig defaults()
	{
		return DEFAULTS;
	}

	public ClassificationConfig withThreshold(double threshold)
	{
		return new ClassificationConfig(threshold, classNames);
	}

	public ClassificationConfig withoutThreshold()
	{
		return new ClassificationConfig(null, classNames);
	}

	public ClassificationConfig withClassNames(Collection<String> classNames)
	{
		return new ClassificationConfig(threshold, new ArrayList<>(classNames));
	}

	public OptionalDouble getThreshold()
	{
		return threshold == null ? OptionalDouble.empty() : OptionalDouble.of(threshold);
	}

	public boolean hasClassNames()
	{
		return classNames != null;
	}

	/** The requested subset in the order given, or null when every class is eligible. */
	public List<String> getClassNames()
	{
		return classNames;
	}

	@Override
	public String toString()
	{
		return "ClassificationConfig{threshold=" + threshold + ", classNames=" + classNames + "}";
	}
}
