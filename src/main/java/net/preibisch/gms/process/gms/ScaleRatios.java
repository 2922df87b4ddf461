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
 * The scale hypotheses, i.e. ratios between the right and the left grid resolution.
 */
public final class ScaleRatios
{
	public static final int NUM_RATIOS = 5;

	private static final double[] RATIOS = new double[] { 1.0, 1.0 / 2, 1.0 / Math.sqrt( 2.0 ), Math.sqrt( 2.0 ), 2.0 };

	private ScaleRatios() {}

	/**
	 * @param i 0...4, 0 is the ratio 1.0
	 * @return the ratio
	 */
	public static double get( final int i ) { return RATIOS[ i ]; }

	public static double[] all() { return RATIOS.clone(); }

	/**
	 * @param leftDimension number of cells of the left grid along one axis
	 * @param ratio the scale ratio
	 * @return floor( leftDimension * ratio ), at least 1
	 */
	public static int rightGridDimension( final int leftDimension, final double ratio )
	{
		return Math.max( 1, (int)Math.floor( leftDimension * ratio ) );
	}

	public static Grid rightGrid( final Grid leftGrid, final double ratio )
	{
		return new Grid(
				rightGridDimension( leftGrid.getWidth(), ratio ),
				rightGridDimension( leftGrid.getHeight(), ratio ) );
	}
}
