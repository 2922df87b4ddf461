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

import java.util.Arrays;

import net.imglib2.util.Intervals;

/**
 * The vote histogram over (left cell, right cell) pairs plus the number of correspondences per left cell.
 * Coherent local motion concentrates votes in few pairs, random mismatches scatter them.
 * 
 * The buffers are allocated once and cleared by {@link #reset()}, an instance must not be shared
 * between concurrently running trials.
 */
public class MotionStatistics
{
	private final int numLeftCells, numRightCells;

	// row-major, numLeftCells x numRightCells
	private final int[] statistics;

	private final int[] numPointsLeft;

	public MotionStatistics( final int numLeftCells, final int numRightCells )
	{
		final long size = Intervals.numElements( numLeftCells, numRightCells );

		if ( size > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Cannot store " + numLeftCells + "x" + numRightCells + " cell pairs." );

		this.numLeftCells = numLeftCells;
		this.numRightCells = numRightCells;
		this.statistics = new int[ (int)size ];
		this.numPointsLeft = new int[ numLeftCells ];
	}

	public int numLeftCells() { return numLeftCells; }
	public int numRightCells() { return numRightCells; }

	public void reset()
	{
		Arrays.fill( statistics, 0 );
		Arrays.fill( numPointsLeft, 0 );
	}

	/**
	 * Votes for every correspondence whose left and right cell are both valid.
	 *
	 * @param leftCells left cell index per correspondence
	 * @param rightCells right cell index per correspondence
	 */
	public void accumulate( final int[] leftCells, final int[] rightCells )
	{
		for ( int i = 0; i < leftCells.length; ++i )
		{
			final int l = leftCells[ i ];
			final int r = rightCells[ i ];

			if ( l == Grid.INVALID || r == Grid.INVALID )
				continue;

			++statistics[ l * numRightCells + r ];
			++numPointsLeft[ l ];
		}
	}

	public int get( final int leftCell, final int rightCell ) { return statistics[ leftCell * numRightCells + rightCell ]; }

	/**
	 * @param leftCell the left cell
	 * @return number of correspondences in this cell, which equals the sum of its row
	 */
	public int numPointsLeft( final int leftCell ) { return numPointsLeft[ leftCell ]; }

	/**
	 * @param leftCell the left cell
	 * @return the right cell with most votes, the lowest index if several are equal, {@link Grid#INVALID} if there are no votes
	 */
	public int bestRightCell( final int leftCell )
	{
		final int offset = leftCell * numRightCells;

		int best = Grid.INVALID;
		int max = 0;

		for ( int j = 0; j < numRightCells; ++j )
		{
			final int value = statistics[ offset + j ];

			if ( value > max )
			{
				max = value;
				best = j;
			}
		}

		return best;
	}
}
