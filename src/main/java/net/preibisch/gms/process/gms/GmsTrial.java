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
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One (scale, rotation) hypothesis: four lattice-offset passes of vote accumulation and cell-pair
 * verification, OR-combined into one inlier mask. All inputs are only read, the scratch buffers
 * belong to this trial, so trials can run concurrently.
 */
public class GmsTrial implements Callable< GmsResult >
{
	private static final Logger LOG = LoggerFactory.getLogger( GmsTrial.class );

	final NormalizedPoints leftPoints, rightPoints;
	final List< Correspondence > correspondences;
	final Grid leftGrid, rightGrid;
	final double scaleRatio;
	final int rotationType;
	final CellPairSelector selector;

	public GmsTrial(
			final NormalizedPoints leftPoints,
			final NormalizedPoints rightPoints,
			final List< Correspondence > correspondences,
			final Grid leftGrid,
			final Grid rightGrid,
			final double scaleRatio,
			final int rotationType,
			final CellPairSelector selector )
	{
		this.leftPoints = leftPoints;
		this.rightPoints = rightPoints;
		this.correspondences = correspondences;
		this.leftGrid = leftGrid;
		this.rightGrid = rightGrid;
		this.scaleRatio = scaleRatio;
		this.rotationType = rotationType;
		this.selector = selector;
	}

	public double getScaleRatio() { return scaleRatio; }
	public int getRotationType() { return rotationType; }

	@Override
	public GmsResult call()
	{
		final int n = correspondences.size();
		final int[] rotationSlots = RotationPatterns.slots( rotationType );

		final MotionStatistics statistics = new MotionStatistics( leftGrid.numCells(), rightGrid.numCells() );
		final int[] cellPairs = new int[ leftGrid.numCells() ];

		final int[] leftCells = new int[ n ];
		final int[] rightCells = new int[ n ];
		final boolean[] inlierMask = new boolean[ n ];

		// the right grid is never shifted
		for ( int i = 0; i < n; ++i )
		{
			final int r = correspondences.get( i ).getRightIndex();
			rightCells[ i ] = rightGrid.index( rightPoints.getX( r ), rightPoints.getY( r ) );
		}

		for ( final LatticeOffset offset : LatticeOffset.values() )
		{
			for ( int i = 0; i < n; ++i )
			{
				final int l = correspondences.get( i ).getLeftIndex();
				leftCells[ i ] = leftGrid.index( leftPoints.getX( l ), leftPoints.getY( l ), offset );
			}

			statistics.reset();
			statistics.accumulate( leftCells, rightCells );

			selector.verify( statistics, leftGrid.getNeighborhood(), rightGrid.getNeighborhood(), rotationSlots, cellPairs );

			for ( int i = 0; i < n; ++i )
				inlierMask[ i ] |= isAccepted( leftCells[ i ], rightCells[ i ], cellPairs );
		}

		final GmsResult result = new GmsResult( inlierMask, scaleRatio, rotationType );

		LOG.debug( "scale ratio {}, rotation type {}, right grid {}: {}/{} inliers", scaleRatio, rotationType, rightGrid, result.numInliers(), n );

		return result;
	}

	private static boolean isAccepted( final int leftCell, final int rightCell, final int[] cellPairs )
	{
		if ( leftCell == Grid.INVALID || rightCell == Grid.INVALID )
			return false;

		return cellPairs[ leftCell ] == rightCell;
	}
}
