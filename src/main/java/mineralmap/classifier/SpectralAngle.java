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

/**
 * Spectral angle between two spectra and the similarity derived from it.
 * <p>
 * The angle is taken from the chord between the two unit vectors, {@code 2 asin(|a' - b'| / 2)},
 * which is exactly 0 for identical spectra. Angles beyond &pi;/2 are clamped to &pi;/2.
 * Similarity is linear in the angle: {@code 1 - angle / (pi / 2)}.
 */
public final class SpectralAngle
{
	public static final double MAX_ANGLE = Math.PI / 2;

	private SpectralAngle() {}

	public static double norm(double[] spectrum)
	{
		double sumOfSquares = 0;
		for(double value : spectrum)
			sumOfSquares += value * value;

		return Math.sqrt(sumOfSquares);
	}

	public static double angle(double[] a, double[] b)
	{
		return angle(a, norm(a), b, norm(b));
	}

	/** Angle in radians, given precomputed norms. Both norms must be non-zero. */
	public static double angle(double[] a, double normA, double[] b, double normB)
	{
		double chordSquared = 0;
		for(int i = 0; i < b.length; i++)
		{
			final double difference = a[i] / normA - b[i] / normB;
			chordSquared += difference * difference;
		}

		final double halfChord = Math.sqrt(chordSquared) / 2;
		if(!(halfChord < 1))
			return MAX_ANGLE;

		return Math.min(MAX_ANGLE, 2 * Math.asin(halfChord));
	}

	public static double similarity(double angle)
	{
		return 1 - angle / MAX_ANGLE;
	}

	public static double similarity(double[] a, double[] b)
	{
		return similarity(angle(a, b));
	}
}
