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

import net.imglib2.util.IntervalIndexer;

/**
 * For every cell of a grid the row-major 3x3 neighborhood, slot 4 is the cell itself.
 * Slots that fall outside of the grid hold {@link Grid#INVALID}.
 */
public class NeighborhoodTable
{
	public static final int SIZE = 9;

	public static final int CENTER = 4;

	private final int[][] neighbors;

	public NeighborhoodTable( final int width, final int height )
	{
		final int[] dimensions = new int[] { width, height };
		final int[] position = new int[ 2 ];
		final int[] neighbor = new int[ 2 ];

		this.neighbors = new int[ width * height ][ SIZE ];

		for ( int i = 0; i < neighbors.length; ++i )
		{
			Arrays.fill( neighbors[ i ], Grid.INVALID );
			IntervalIndexer.indexToPosition( i, dimensions, position );

			for ( int yi = -1; yi <= 1; ++yi )
				for ( int xi = -1; xi <= 1; ++xi )
				{
					neighbor[ 0 ] = position[ 0 ] + xi;
					neighbor[ 1 ] = position[ 1 ] + yi;

					if ( neighbor[ 0 ] < 0 || neighbor[ 0 ] >= width || neighbor[ 1 ] < 0 || neighbor[ 1 ] >= height )
						continue;

					neighbors[ i ][ ( xi + 1 ) + ( yi + 1 ) * 3 ] = IntervalIndexer.positionToIndex( neighbor, dimensions );
				}
		}
	}

	public int numCells() { return neighbors.length; }

	/**
	 * @param cell the cell index
	 * @param slot 0...8, row-major
	 * @return the index of the neighboring cell or {@link Grid#INVALID}
	 */
	public int get( final int cell, final int slot ) { return neighbors[ cell ][ slot ]; }

	public int numValid( final int cell )
	{
		int count = 0;

		for ( final int n : neighbors[ cell ] )
			if ( n != Grid.INVALID )
				++count;

		return count;
	}
}
