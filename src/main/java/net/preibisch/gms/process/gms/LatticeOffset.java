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
 * The four alignments of the left grid. A correspondence is accepted if any of them validates it,
 * which cancels the quantization bias at cell boundaries.
 */
public enum LatticeOffset
{
	UNSHIFTED( 0.0, 0.0 ),
	SHIFTED_X( 0.5, 0.0 ),
	SHIFTED_Y( 0.0, 0.5 ),
	SHIFTED_XY( 0.5, 0.5 );

	private final double dx, dy;

	private LatticeOffset( final double dx, final double dy )
	{
		this.dx = dx;
		this.dy = dy;
	}

	/**
	 * @return offset along x in units of cells
	 */
	public double getDx() { return dx; }

	/**
	 * @return offset along y in units of cells
	 */
	public double getDy() { return dy; }
}
