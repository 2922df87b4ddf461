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
 * A putative correspondence between keypoint {@code leftIndex} of the left image
 * and keypoint {@code rightIndex} of the right image.
 */
public class Correspondence
{
	private final int leftIndex, rightIndex;

	public Correspondence( final int leftIndex, final int rightIndex )
	{
		this.leftIndex = leftIndex;
		this.rightIndex = rightIndex;
	}

	public int getLeftIndex() { return leftIndex; }
	public int getRightIndex() { return rightIndex; }

	@Override
	public int hashCode()
	{
		final int prime = 31;
		int result = 1;
		result = prime * result + leftIndex;
		result = prime * result + rightIndex;
		return result;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( obj == null )
			return false;
		if ( getClass() != obj.getClass() )
			return false;
		final Correspondence other = (Correspondence) obj;
		return leftIndex == other.leftIndex && rightIndex == other.rightIndex;
	}

	@Override
	public String toString() { return "(" + leftIndex + " -> " + rightIndex + ")"; }
}
