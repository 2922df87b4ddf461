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
 * The eight 3x3 neighborhood permutations of the discrete rotation group. Entry k of a pattern
 * (1-based values) names the slot of the right neighborhood that is compared to slot k of the
 * left neighborhood. Pattern 1 is the identity.
 */
public final class RotationPatterns
{
	public static final int NUM_PATTERNS = 8;

	public static final int IDENTITY = 1;

	private static final int[][] PATTERNS = new int[][] {
		{ 1, 2, 3,
		  4, 5, 6,
		  7, 8, 9 },

		{ 4, 1, 2,
		  7, 5, 3,
		  8, 9, 6 },

		{ 7, 4, 1,
		  8, 5, 2,
		  9, 6, 3 },

		{ 8, 7, 4,
		  9, 5, 1,
		  6, 3, 2 },

		{ 9, 8, 7,
		  6, 5, 4,
		  3, 2, 1 },

		{ 6, 9, 8,
		  3, 5, 7,
		  2, 1, 4 },

		{ 3, 6, 9,
		  2, 5, 8,
		  1, 4, 7 },

		{ 2, 3, 6,
		  1, 5, 9,
		  4, 7, 8 } };

	private RotationPatterns() {}

	/**
	 * @param rotationType 1...8
	 * @return a copy of the pattern, values 1...9
	 */
	public static int[] get( final int rotationType )
	{
		return PATTERNS[ checkType( rotationType ) - 1 ].clone();
	}

	/**
	 * @param rotationType 1...8
	 * @return the pattern as 0-based neighborhood slots
	 */
	public static int[] slots( final int rotationType )
	{
		final int[] pattern = PATTERNS[ checkType( rotationType ) - 1 ];
		final int[] slots = new int[ pattern.length ];

		for ( int k = 0; k < pattern.length; ++k )
			slots[ k ] = pattern[ k ] - 1;

		return slots;
	}

	private static int checkType( final int rotationType )
	{
		if ( rotationType < 1 || rotationType > NUM_PATTERNS )
			throw new IllegalArgumentException( "Rotation type must be within 1..." + NUM_PATTERNS + ", but is " + rotationType );

		return rotationType;
	}
}
