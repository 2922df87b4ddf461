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
package net.preibisch.gms.process.pruning;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mpicbg.models.Point;
import mpicbg.models.PointMatch;
import net.imglib2.Dimensions;
import net.imglib2.RealLocalizable;
import net.preibisch.gms.process.gms.Correspondence;
import net.preibisch.gms.process.gms.GmsMatcher;
import net.preibisch.gms.process.gms.GmsParameters;
import net.preibisch.gms.process.gms.GmsResult;

/**
 * Prunes putative k-nearest-neighbor descriptor matches with GMS. Every query is reduced to its best
 * candidate, the candidates that GMS accepts are kept.
 */
public class GmsMatchPruner
{
	private static final Logger LOG = LoggerFactory.getLogger( GmsMatchPruner.class );

	private final List< ? extends RealLocalizable > queryKeypoints, referKeypoints;
	private final List< ? extends List< DescriptorMatch > > putativeMatches;

	private final ArrayList< DescriptorMatch > prunedMatches = new ArrayList<>();
	private final ArrayList< PointMatch > matchedPoints = new ArrayList<>();

	private double[][] knnDistances;
	private double[] scores;

	private GmsResult gmsResult;

	private long time = 0;
	private String result = "", desc = "GMS";

	/**
	 * @param queryKeypoints keypoints of the query image
	 * @param querySize size of the query image
	 * @param referKeypoints keypoints of the reference image
	 * @param referSize size of the reference image
	 * @param putativeMatches per query the candidates ordered by distance, best first
	 * @param params GMS parameters
	 * @param service executor to evaluate the GMS trials on, null to run them sequentially
	 */
	public GmsMatchPruner(
			final List< ? extends RealLocalizable > queryKeypoints,
			final Dimensions querySize,
			final List< ? extends RealLocalizable > referKeypoints,
			final Dimensions referSize,
			final List< ? extends List< DescriptorMatch > > putativeMatches,
			final GmsParameters params,
			final ExecutorService service )
	{
		this.queryKeypoints = queryKeypoints;
		this.referKeypoints = referKeypoints;
		this.putativeMatches = putativeMatches;

		pruneMatches( querySize, referSize, params, service );
	}

	public GmsMatchPruner(
			final List< ? extends RealLocalizable > queryKeypoints,
			final Dimensions querySize,
			final List< ? extends RealLocalizable > referKeypoints,
			final Dimensions referSize,
			final List< ? extends List< DescriptorMatch > > putativeMatches )
	{
		this( queryKeypoints, querySize, referKeypoints, referSize, putativeMatches, new GmsParameters(), null );
	}

	protected void pruneMatches( final Dimensions querySize, final Dimensions referSize, final GmsParameters params, final ExecutorService service )
	{
		// the best candidate of every query, and which candidate list it came from
		final ArrayList< DescriptorMatch > initialMatches = new ArrayList<>();
		final ArrayList< Integer > initialLists = new ArrayList<>();
		final ArrayList< Correspondence > correspondences = new ArrayList<>();

		for ( int i = 0; i < putativeMatches.size(); ++i )
		{
			final List< DescriptorMatch > candidates = putativeMatches.get( i );

			if ( candidates.isEmpty() )
				continue;

			final DescriptorMatch best = candidates.get( 0 );

			initialMatches.add( best );
			initialLists.add( i );
			correspondences.add( new Correspondence( best.getQueryIdx(), best.getTrainIdx() ) );
		}

		final int numSkipped = putativeMatches.size() - initialMatches.size();

		if ( numSkipped > 0 )
			LOG.warn( "Skipped {} queries without candidates.", numSkipped );

		final GmsMatcher matcher = new GmsMatcher( queryKeypoints, querySize, referKeypoints, referSize, correspondences, params );

		if ( service == null )
			gmsResult = matcher.getInlierMask( params.withScale(), params.withRotation() );
		else
			gmsResult = matcher.getInlierMask( params.withScale(), params.withRotation(), service );

		final int knn = putativeMatches.isEmpty() ? 0 : putativeMatches.get( 0 ).size();

		knnDistances = new double[ gmsResult.numInliers() ][ knn ];
		scores = new double[ gmsResult.numInliers() ];

		int j = 0;

		for ( final int i : gmsResult.inlierIndices() )
		{
			final DescriptorMatch match = initialMatches.get( i );

			prunedMatches.add( match );
			matchedPoints.add( new PointMatch(
					toPoint( queryKeypoints.get( match.getQueryIdx() ) ),
					toPoint( referKeypoints.get( match.getTrainIdx() ) ) ) );

			final List< DescriptorMatch > candidates = putativeMatches.get( initialLists.get( i ) );

			Arrays.fill( knnDistances[ j ], Double.NaN );
			for ( int k = 0; k < Math.min( knn, candidates.size() ); ++k )
				knnDistances[ j ][ k ] = candidates.get( k ).getDistance();

			// GMS has no notion of match quality, all accepted matches are equally good
			scores[ j ] = 1.0;

			++j;
		}

		final NumberFormat nf = NumberFormat.getPercentInstance();
		final double ratio = correspondences.isEmpty() ? 0 : (double)prunedMatches.size() / (double)correspondences.size();

		setResult(
				System.currentTimeMillis(),
				"Remaining matches after GMS: " + prunedMatches.size() + " of " + correspondences.size() + " (" + nf.format( ratio ) + ")" +
				" with scale ratio " + gmsResult.getScaleRatio() + " and rotation type " + gmsResult.getRotationType() );
	}

	private static Point toPoint( final RealLocalizable p )
	{
		return new Point( new double[] { p.getDoublePosition( 0 ), p.getDoublePosition( 1 ) } );
	}

	protected void setResult( final long time, final String result )
	{
		this.time = time;
		this.result = result;
		LOG.info( getFullDesc() );
	}

	public void setDescription( final String desc ) { this.desc = desc; }
	public String getDescription() { return desc; }
	public String getFullDesc() { return "(" + new Date( time ) + "): " + desc + ": " + result; }

	public GmsResult getGmsResult() { return gmsResult; }
	public List< DescriptorMatch > getMatches() { return Collections.unmodifiableList( prunedMatches ); }

	/**
	 * @return the kept matches as pairs of keypoints in pixel coordinates (query, reference)
	 */
	public List< PointMatch > getMatchedPoints() { return Collections.unmodifiableList( matchedPoints ); }

	/**
	 * @return per kept match the distances of its k nearest neighbors, NaN where a query had fewer candidates
	 */
	public double[][] getKnnDistances()
	{
		final double[][] copy = new double[ knnDistances.length ][];
		Arrays.setAll( copy, i -> knnDistances[ i ].clone() );
		return copy;
	}

	/**
	 * @return per kept match its score, lower is more likely correct
	 */
	public double[] getMatchingScores() { return scores.clone(); }
}
