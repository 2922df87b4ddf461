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

public class GmsParameters
{
	public static int grid_width = 15;
	public static int grid_height = 15;
	public static double alpha_threshold = 6.0;
	public static boolean with_scale = true;
	public static boolean with_rotation = true;

	protected final int gridWidth, gridHeight;
	protected final double alpha;
	protected final boolean withScale, withRotation;

	/**
	 * @param gridWidth number of cells of the left grid along x
	 * @param gridHeight number of cells of the left grid along y
	 * @param alpha factor of the threshold, larger values demand stronger consensus
	 * @param withScale search over the scale ratios
	 * @param withRotation search over the rotation patterns
	 */
	public GmsParameters( final int gridWidth, final int gridHeight, final double alpha, final boolean withScale, final boolean withRotation )
	{
		if ( gridWidth <= 0 || gridHeight <= 0 )
			throw new IllegalArgumentException( "Grid dimensions must be positive, but are " + gridWidth + "x" + gridHeight );

		if ( !( alpha > 0 ) || Double.isInfinite( alpha ) )
			throw new IllegalArgumentException( "alpha must be a positive number, but is " + alpha );

		this.gridWidth = gridWidth;
		this.gridHeight = gridHeight;
		this.alpha = alpha;
		this.withScale = withScale;
		this.withRotation = withRotation;
	}

	public GmsParameters()
	{
		this( grid_width, grid_height, alpha_threshold, with_scale, with_rotation );
	}

	public int getGridWidth() { return gridWidth; }
	public int getGridHeight() { return gridHeight; }
	public double getAlpha() { return alpha; }
	public boolean withScale() { return withScale; }
	public boolean withRotation() { return withRotation; }

	@Override
	public String toString()
	{
		return "grid=" + gridWidth + "x" + gridHeight + ", alpha=" + alpha + ", withScale=" + withScale + ", withRotation=" + withRotation;
	}
}
