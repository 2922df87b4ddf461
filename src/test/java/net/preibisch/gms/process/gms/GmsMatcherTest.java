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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import net.imglib2.FinalDimensions;
import net.imglib2.RealPoint;
import net.preibisch.gms.Threads;

public class GmsMatcherTest
{
	private static final long SEED = 3544;

	private static ExecutorService service;

	@BeforeClass
	public static void createService()
	{
		service = Threads.createFixedExecutorService( 4 );
	}

	@AfterClass
	public static void shutdownService()
	{
		service.shutdown();
	}

	private static GmsParameters params( final boolean withScale, final boolean withRotation )
	{
		return new GmsParameters( 15, 15, 6.0, withScale, withRotation );
	}

	@Test
	public void testStructuredVersusRandom()
	{
		final SyntheticCorrespondences data = new SyntheticCorrespondences( SEED );
		final GmsResult result = data.matcher( params( false, false ) ).getInlierMask( false, false );

		final int structured = SyntheticCorrespondences.count( result, 0, SyntheticCorrespondences.NUM_STRUCTURED );
		final int random = SyntheticCorrespondences.count(
				result, SyntheticCorrespondences.NUM_STRUCTURED, SyntheticCorrespondences.NUM_STRUCTURED + SyntheticCorrespondences.NUM_RANDOM );

		assertTrue( "structured inliers: " + structured, structured >= 70 );
		assertTrue( "random inliers: " + random, random <= 5 );

		assertEquals( 1.0, result.getScaleRatio(), 0 );
		assertEquals( RotationPatterns.IDENTITY, result.getRotationType() );
	}

	@Test
	public void testEmptyInput()
	{
		final FinalDimensions size = new FinalDimensions( 100, 100 );

		for ( final boolean withScale : new boolean[] { false, true } )
			for ( final boolean withRotation : new boolean[] { false, true } )
			{
				final GmsMatcher matcher = new GmsMatcher(
						new ArrayList< RealPoint >(), size, new ArrayList< RealPoint >(), size, new ArrayList<>(), params( withScale, withRotation ) );

				final GmsResult result = matcher.getInlierMask();

				assertEquals( 0, result.size() );
				assertEquals( 0, result.numInliers() );
				assertEquals( 0, result.getInlierMask().length );
			}
	}

	@Test
	public void testLengthAndCount()
	{
		final SyntheticCorrespondences data = new SyntheticCorrespondences( SEED );
		final GmsMatcher matcher = data.matcher( params( true, true ) );

		for ( final boolean withScale : new boolean[] { false, true } )
			for ( final boolean withRotation : new boolean[] { false, true } )
			{
				final GmsResult result = matcher.getInlierMask( withScale, withRotation );
				final boolean[] mask = result.getInlierMask();

				assertEquals( data.correspondences.size(), mask.length );

				int popcount = 0;
				for ( final boolean b : mask )
					if ( b )
						++popcount;

				assertEquals( popcount, result.numInliers() );
				assertEquals( popcount, result.inlierIndices().length );
			}
	}

	@Test
	public void testDeterminism()
	{
		final GmsResult a = new SyntheticCorrespondences( SEED ).matcher( params( true, true ) ).getInlierMask();
		final GmsResult b = new SyntheticCorrespondences( SEED ).matcher( params( true, true ) ).getInlierMask();

		assertArrayEquals( a.getInlierMask(), b.getInlierMask() );
		assertEquals( a.numInliers(), b.numInliers() );
		assertEquals( a.getScaleRatio(), b.getScaleRatio(), 0 );
		assertEquals( a.getRotationType(), b.getRotationType() );
	}

	@Test
	public void testModeConsistency()
	{
		for ( long seed = 0; seed < 5; ++seed )
		{
			final GmsMatcher matcher = new SyntheticCorrespondences( seed ).matcher( params( false, false ) );

			final GmsResult none = matcher.getInlierMask( false, false );
			final GmsResult rotation = matcher.getInlierMask( false, true );
			final GmsResult scale = matcher.getInlierMask( true, false );
			final GmsResult both = matcher.getInlierMask( true, true );

			// the single trial equals the first trial of every search
			final GmsResult single = matcher.createTrials( false, false ).get( 0 ).call();
			assertArrayEquals( single.getInlierMask(), none.getInlierMask() );

			assertTrue( rotation.numInliers() >= none.numInliers() );
			assertTrue( scale.numInliers() >= none.numInliers() );
			assertTrue( both.numInliers() >= rotation.numInliers() );
			assertTrue( both.numInliers() >= scale.numInliers() );
		}
	}

	@Test
	public void testTrialEnumeration()
	{
		final GmsMatcher matcher = new SyntheticCorrespondences( SEED ).matcher( params( true, true ) );

		assertEquals( 1, matcher.createTrials( false, false ).size() );
		assertEquals( 8, matcher.createTrials( false, true ).size() );
		assertEquals( 5, matcher.createTrials( true, false ).size() );

		final List< GmsTrial > trials = matcher.createTrials( true, true );
		assertEquals( 40, trials.size() );

		// scale-major, rotation-minor
		for ( int s = 0; s < ScaleRatios.NUM_RATIOS; ++s )
			for ( int r = 0; r < RotationPatterns.NUM_PATTERNS; ++r )
			{
				final GmsTrial trial = trials.get( s * RotationPatterns.NUM_PATTERNS + r );
				assertEquals( ScaleRatios.get( s ), trial.getScaleRatio(), 0 );
				assertEquals( r + 1, trial.getRotationType() );
			}
	}

	@Test
	public void testMultithreadedEqualsSequential()
	{
		for ( long seed = 0; seed < 3; ++seed )
		{
			final GmsMatcher matcher = new SyntheticCorrespondences( seed ).matcher( params( true, true ) );

			final GmsResult sequential = matcher.getInlierMask( true, true );
			final GmsResult parallel = matcher.getInlierMask( true, true, service );

			assertArrayEquals( sequential.getInlierMask(), parallel.getInlierMask() );
			assertEquals( sequential.getScaleRatio(), parallel.getScaleRatio(), 0 );
			assertEquals( sequential.getRotationType(), parallel.getRotationType() );

			assertArrayEquals( sequential.getInlierMask(), matcher.getInlierMaskMultithreaded( true, true ).getInlierMask() );
		}
	}

	@Test
	public void testKeypointsOutsideTheImage()
	{
		final SyntheticCorrespondences data = new SyntheticCorrespondences( SEED );

		data.add( -5, 100, 100, 100 );
		data.add( SyntheticCorrespondences.SIZE, 100, 100, 100 );
		data.add( 100, 100, 100, SyntheticCorrespondences.SIZE + 10 );

		final GmsResult result = data.matcher( params( false, false ) ).getInlierMask();
		final int n = data.correspondences.size();

		assertEquals( n, result.size() );
		assertFalse( result.isInlier( n - 1 ) );
		assertFalse( result.isInlier( n - 2 ) );
		assertFalse( result.isInlier( n - 3 ) );
	}

	@Test
	public void testNormalizationAbsorbsImageSize()
	{
		// the right image is the left one downsampled by 2, keypoints keep their normalized position
		final FinalDimensions leftSize = new FinalDimensions( 600, 600 );
		final FinalDimensions rightSize = new FinalDimensions( 300, 300 );

		final ArrayList< RealPoint > left = new ArrayList<>();
		final ArrayList< RealPoint > right = new ArrayList<>();

		for ( int dy = -6; dy <= 6; dy += 4 )
			for ( int dx = -8; dx <= 8; dx += 4 )
			{
				left.add( new RealPoint( 300.0 + dx, 300.0 + dy ) );
				right.add( new RealPoint( ( 300.0 + dx ) / 2, ( 300.0 + dy ) / 2 ) );
			}

		final GmsMatcher matcher = new GmsMatcher(
				left, leftSize, right, rightSize, SyntheticCorrespondences.identity( left.size() ), params( true, false ) );

		final GmsResult result = matcher.getInlierMask();

		// all of them are found by the first trial already, which wins the tie
		assertEquals( left.size(), result.numInliers() );
		assertEquals( 1.0, result.getScaleRatio(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testCorrespondenceOutOfBounds()
	{
		final FinalDimensions size = new FinalDimensions( 100, 100 );
		final ArrayList< RealPoint > points = new ArrayList<>();
		points.add( new RealPoint( 10.0, 10.0 ) );

		final ArrayList< Correspondence > correspondences = new ArrayList<>();
		correspondences.add( new Correspondence( 0, 1 ) );

		new GmsMatcher( points, size, points, size, correspondences, params( false, false ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidImageSize()
	{
		new GmsMatcher(
				new ArrayList< RealPoint >(), new FinalDimensions( 0, 100 ),
				new ArrayList< RealPoint >(), new FinalDimensions( 100, 100 ),
				new ArrayList<>(), params( false, false ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidGrid()
	{
		new GmsParameters( 15, 0, 6.0, false, false );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidAlpha()
	{
		new GmsParameters( 15, 15, Double.NaN, false, false );
	}
}
