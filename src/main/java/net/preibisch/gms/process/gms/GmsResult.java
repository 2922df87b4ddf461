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

import java.util.List;

/**
 * The inlier mask of one (scale, rotation) trial, aligned 1:1 with the correspondences.
 */
public class GmsResult
{
	private final boolean[] inlierMask;
	private final int numInliers;
	private final double scaleRatio;
	private final int rotationType;

	public GmsResult( final boolean[] inlierMask, final double scaleRatio, final int rotationType )
	{
		this.inlierMask = inlierMask;
		this.scaleRatio = scaleRatio;
		this.rotationType = rotationType;

		int count = 0;

		for ( final boolean inlier : inlierMask )
			if ( inlier )
				++count;

		this.numInliers = count;
	}

	/**
	 * The best of a list of trial results: the strictly largest number of inliers, the first one wins ties.
	 *
	 * @param results trial results in enumeration order
	 * @return the best result
	 */
	public static GmsResult best( final List< GmsResult > results )
	{
		if ( results.isEmpty() )
			throw new IllegalArgumentException( "No trial results to choose from." );

		return results.stream().reduce( ( a, b ) -> b.numInliers > a.numInliers ? b : a ).get();
	}

	public boolean[] getInlierMask() { return inlierMask.clone(); }
	public boolean isInlier( final int i ) { return inlierMask[ i ]; }
	public int size() { return inlierMask.length; }
	public int numInliers() { return numInliers; }
	public double getScaleRatio() { return scaleRatio; }
	public int getRotationType() { return rotationType; }

	public int[] inlierIndices()
	{
		final int[] indices = new int[ numInliers ];

		for ( int i = 0, j = 0; i < inlierMask.length; ++i )
			if ( inlierMask[ i ] )
				indices[ j++ ] = i;

		return indices;
	}

	@Override
	public String toString()
	{
		return numInliers + "/" + inlierMask.length + " inliers (scale ratio " + scaleRatio + ", rotation type " + rotationType + ")";
	}
}
