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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Dimensions;
import net.imglib2.RealLocalizable;
import net.preibisch.gms.Threads;

/**
 * Grid-based Motion Statistics (GMS): separates geometrically consistent correspondences from
 * spurious ones by voting on a grid, without fitting a model. Unknown relative scale and rotation
 * are handled by a bounded search over {@link ScaleRatios} and {@link RotationPatterns}, the trial
 * with the most inliers wins.
 * 
 * See "GMS: Grid-based Motion Statistics for Fast, Ultra-robust Feature Correspondence", Bian et al., CVPR 2017.
 */
public class GmsMatcher
{
	private static final Logger LOG = LoggerFactory.getLogger( GmsMatcher.class );

	final NormalizedPoints leftPoints, rightPoints;
	final List< Correspondence > correspondences;
	final Grid leftGrid;
	final CellPairSelector selector;
	final GmsParameters params;

	/**
	 * @param leftKeypoints keypoints of the left image (pixel coordinates)
	 * @param leftSize size of the left image
	 * @param rightKeypoints keypoints of the right image (pixel coordinates)
	 * @param rightSize size of the right image
	 * @param correspondences one entry per query point, indices into the keypoint lists
	 * @param params grid size, alpha and the default search mode
	 */
	public GmsMatcher(
			final List< ? extends RealLocalizable > leftKeypoints,
			final Dimensions leftSize,
			final List< ? extends RealLocalizable > rightKeypoints,
			final Dimensions rightSize,
			final List< Correspondence > correspondences,
			final GmsParameters params )
	{
		this.leftPoints = new NormalizedPoints( leftKeypoints, leftSize );
		this.rightPoints = new NormalizedPoints( rightKeypoints, rightSize );
		this.correspondences = new ArrayList<>( correspondences );
		this.params = params;

		for ( final Correspondence c : this.correspondences )
			if ( c.getLeftIndex() < 0 || c.getLeftIndex() >= leftPoints.size() || c.getRightIndex() < 0 || c.getRightIndex() >= rightPoints.size() )
				throw new IllegalArgumentException(
						"Correspondence " + c + " is out of bounds (" + leftPoints.size() + " left, " + rightPoints.size() + " right keypoints)." );

		this.leftGrid = new Grid( params.getGridWidth(), params.getGridHeight() );
		this.selector = new CellPairSelector( params.getAlpha() );
	}

	public int numCorrespondences() { return correspondences.size(); }
	public GmsParameters getParameters() { return params; }

	/**
	 * @return the inlier mask using the search mode of the {@link GmsParameters}
	 */
	public GmsResult getInlierMask()
	{
		return getInlierMask( params.withScale(), params.withRotation() );
	}

	/**
	 * Evaluates all trials sequentially.
	 *
	 * @param withScale search over all scale ratios instead of 1.0 only
	 * @param withRotation search over all rotation patterns instead of the identity only
	 * @return the best trial
	 */
	public GmsResult getInlierMask( final boolean withScale, final boolean withRotation )
	{
		final ArrayList< GmsResult > results = new ArrayList<>();

		for ( final GmsTrial trial : createTrials( withScale, withRotation ) )
			results.add( trial.call() );

		return logBest( GmsResult.best( results ) );
	}

	/**
	 * Evaluates all trials on the given executor, the result is identical to {@link #getInlierMask(boolean, boolean)}.
	 *
	 * @param withScale search over all scale ratios instead of 1.0 only
	 * @param withRotation search over all rotation patterns instead of the identity only
	 * @param service the executor the trials are submitted to
	 * @return the best trial
	 */
	public GmsResult getInlierMask( final boolean withScale, final boolean withRotation, final ExecutorService service )
	{
		// results come back in enumeration order, so ties are broken like sequentially
		final List< GmsResult > results = Threads.execTasks( createTrials( withScale, withRotation ), service, "evaluate GMS trials" );

		return logBest( GmsResult.best( results ) );
	}

	/**
	 * Evaluates all trials on a temporary fixed thread pool of {@link Threads#numThreads()} threads.
	 *
	 * @param withScale search over all scale ratios instead of 1.0 only
	 * @param withRotation search over all rotation patterns instead of the identity only
	 * @return the best trial
	 */
	public GmsResult getInlierMaskMultithreaded( final boolean withScale, final boolean withRotation )
	{
		final ExecutorService service = Threads.createFixedExecutorService();

		try
		{
			return getInlierMask( withScale, withRotation, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * @param withScale all scale ratios or 1.0 only
	 * @param withRotation all rotation patterns or the identity only
	 * @return the trials, scale-major and rotation-minor
	 */
	public List< GmsTrial > createTrials( final boolean withScale, final boolean withRotation )
	{
		final int numScales = withScale ? ScaleRatios.NUM_RATIOS : 1;
		final int numRotations = withRotation ? RotationPatterns.NUM_PATTERNS : 1;

		final ArrayList< GmsTrial > trials = new ArrayList<>( numScales * numRotations );

		for ( int s = 0; s < numScales; ++s )
		{
			final double ratio = ScaleRatios.get( s );

			// one right grid per scale, shared read-only by its rotation trials
			final Grid rightGrid = ScaleRatios.rightGrid( leftGrid, ratio );

			if ( leftGrid.getWidth() * ratio < 1 || leftGrid.getHeight() * ratio < 1 )
				LOG.warn( "Right grid clamped to {} for left grid {} and scale ratio {}", rightGrid, leftGrid, ratio );

			for ( int r = 0; r < numRotations; ++r )
				trials.add( new GmsTrial( leftPoints, rightPoints, correspondences, leftGrid, rightGrid, ratio, RotationPatterns.IDENTITY + r, selector ) );
		}

		return trials;
	}

	private static GmsResult logBest( final GmsResult best )
	{
		LOG.debug( "Best trial: {}", best );
		return best;
	}
}
