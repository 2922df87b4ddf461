/*-
 * #%L
 * Software for the reconstruction of multi-view microscopic acquisitions
 * like Selective Plane Illumination Microscopy (SPIM) Data.
 * %%
 * Copyright (C) 2012 - 2025 Multiview Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.gms.process.gms;

/**
 * Chooses for every left cell the right cell with most votes and verifies it by comparing the
 * votes of the whole 3x3 neighborhood against {@code alpha * sqrt( mean number of points per left neighbor )}.
 */
public class CellPairSelector
{
	/**
	 * the left cell received no votes
	 */
	public static final int NO_VOTES = -1;

	/**
	 * the best cell pair did not reach the threshold
	 */
	public static final int REJECTED = -2;

	private final double alpha;

	public CellPairSelector( final double alpha )
	{
		if ( !( alpha > 0 ) )
			throw new IllegalArgumentException( "alpha must be positive, but is " + alpha );

		this.alpha = alpha;
	}

	public double getAlpha() { return alpha; }

	/**
	 * @param statistics the votes of the current pass
	 * @param left neighborhoods of the left grid
	 * @param right neighborhoods of the right grid
	 * @param rotationSlots the active rotation pattern as 0-based slots, see {@link RotationPatterns#slots(int)}
	 * @param cellPairs output, per left cell the accepted right cell, {@link #NO_VOTES} or {@link #REJECTED}
	 */
	public void verify(
			final MotionStatistics statistics,
			final NeighborhoodTable left,
			final NeighborhoodTable right,
			final int[] rotationSlots,
			final int[] cellPairs )
	{
		for ( int i = 0; i < statistics.numLeftCells(); ++i )
		{
			if ( statistics.numPointsLeft( i ) == 0 )
			{
				cellPairs[ i ] = NO_VOTES;
				continue;
			}

			final int best = statistics.bestRightCell( i );

			int score = 0;
			double thresh = 0;
			int numPairs = 0;

			for ( int k = 0; k < NeighborhoodTable.SIZE; ++k )
			{
				final int ll = left.get( i, k );
				final int rr = right.get( best, rotationSlots[ k ] );

				if ( ll == Grid.INVALID || rr == Grid.INVALID )
					continue;

				score += statistics.get( ll, rr );
				thresh += statistics.numPointsLeft( ll );
				++numPairs;
			}

			// cannot happen as the center maps onto itself, an isolated pair is not trusted anyways
			if ( numPairs == 0 )
			{
				cellPairs[ i ] = REJECTED;
				continue;
			}

			thresh = alpha * Math.sqrt( thresh / numPairs );

			cellPairs[ i ] = score < thresh ? REJECTED : best;
		}
	}
}
