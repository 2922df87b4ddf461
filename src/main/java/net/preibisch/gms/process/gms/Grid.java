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
 * A uniform W x H partition of the unit square, cells are indexed row-major ({@code x + y * W}).
 */
public class Grid
{
	/**
	 * index of any position outside of the grid
	 */
	public static final int INVALID = -1;

	private final int width, height;
	private final NeighborhoodTable neighborhood;

	public Grid( final int width, final int height )
	{
		if ( width <= 0 || height <= 0 )
			throw new IllegalArgumentException( "Grid dimensions must be positive, but are " + width + "x" + height );

		if ( (long)width * (long)height > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Grid " + width + "x" + height + " has too many cells." );

		this.width = width;
		this.height = height;
		this.neighborhood = new NeighborhoodTable( width, height );
	}

	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public int numCells() { return width * height; }
	public NeighborhoodTable getNeighborhood() { return neighborhood; }

	/**
	 * @param x normalized x coordinate
	 * @param y normalized y coordinate
	 * @return the cell index of the unshifted grid or {@link #INVALID}
	 */
	public int index( final double x, final double y )
	{
		return index( x, y, LatticeOffset.UNSHIFTED );
	}

	/**
	 * @param x normalized x coordinate
	 * @param y normalized y coordinate
	 * @param offset the alignment of the grid
	 * @return the cell index or {@link #INVALID} if the (shifted) position is not inside the grid
	 */
	public int index( final double x, final double y, final LatticeOffset offset )
	{
		final double cx = Math.floor( x * width + offset.getDx() );
		final double cy = Math.floor( y * height + offset.getDy() );

		// also catches NaN
		if ( !( cx >= 0 && cx < width && cy >= 0 && cy < height ) )
			return INVALID;

		return (int)cx + (int)cy * width;
	}

	@Override
	public String toString() { return width + "x" + height; }
}
