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

import net.imglib2.Dimensions;
import net.imglib2.RealLocalizable;

/**
 * Keypoints of one image mapped into the unit square, i.e. x / width and y / height.
 * Coordinates are stored flattened, one array per axis.
 */
public class NormalizedPoints
{
	private final double[] x, y;

	/**
	 * @param keypoints keypoints in pixel coordinates, only the first two dimensions are used
	 * @param imageSize size of the image the keypoints were detected in
	 */
	public NormalizedPoints( final List< ? extends RealLocalizable > keypoints, final Dimensions imageSize )
	{
		if ( imageSize.numDimensions() < 2 )
			throw new IllegalArgumentException( "Image size must be at least two-dimensional, but is " + imageSize.numDimensions() + "-dimensional." );

		final long width = imageSize.dimension( 0 );
		final long height = imageSize.dimension( 1 );

		if ( width <= 0 || height <= 0 )
			throw new IllegalArgumentException( "Image size must be positive, but is " + width + "x" + height );

		final int n = keypoints.size();

		this.x = new double[ n ];
		this.y = new double[ n ];

		int i = 0;

		for ( final RealLocalizable p : keypoints )
		{
			x[ i ] = p.getDoublePosition( 0 ) / width;
			y[ i ] = p.getDoublePosition( 1 ) / height;
			++i;
		}
	}

	public int size() { return x.length; }
	public double getX( final int i ) { return x[ i ]; }
	public double getY( final int i ) { return y[ i ]; }
}
