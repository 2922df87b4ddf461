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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;

import org.junit.Test;

public class RotationPatternsTest
{
	@Test
	public void testPermutations()
	{
		final HashSet< String > distinct = new HashSet<>();

		for ( int type = 1; type <= RotationPatterns.NUM_PATTERNS; ++type )
		{
			final int[] pattern = RotationPatterns.get( type );
			final boolean[] seen = new boolean[ 10 ];

			assertEquals( 9, pattern.length );

			for ( final int v : pattern )
			{
				assertTrue( v >= 1 && v <= 9 );
				assertFalse( "duplicate " + v + " in pattern " + type, seen[ v ] );
				seen[ v ] = true;
			}

			// the cell itself always maps onto itself
			assertEquals( 5, pattern[ NeighborhoodTable.CENTER ] );

			distinct.add( Arrays.toString( pattern ) );
		}

		assertEquals( RotationPatterns.NUM_PATTERNS, distinct.size() );
	}

	@Test
	public void testIdentity()
	{
		assertArrayEquals( new int[] { 1, 2, 3, 4, 5, 6, 7, 8, 9 }, RotationPatterns.get( RotationPatterns.IDENTITY ) );
		assertArrayEquals( new int[] { 0, 1, 2, 3, 4, 5, 6, 7, 8 }, RotationPatterns.slots( RotationPatterns.IDENTITY ) );
	}

	@Test
	public void testRotationBy180()
	{
		assertArrayEquals( new int[] { 9, 8, 7, 6, 5, 4, 3, 2, 1 }, RotationPatterns.get( 5 ) );
	}

	@Test
	public void testDefensiveCopy()
	{
		RotationPatterns.get( 1 )[ 0 ] = 42;
		assertEquals( 1, RotationPatterns.get( 1 )[ 0 ] );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidType()
	{
		RotationPatterns.get( 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidTypeSlots()
	{
		RotationPatterns.slots( 9 );
	}
}
