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

/**
 * One nearest-neighbor candidate of descriptor matching: query keypoint, train (reference) keypoint
 * and the descriptor distance.
 */
public class DescriptorMatch
{
	private final int queryIdx, trainIdx;
	private final double distance;

	public DescriptorMatch( final int queryIdx, final int trainIdx, final double distance )
	{
		this.queryIdx = queryIdx;
		this.trainIdx = trainIdx;
		this.distance = distance;
	}

	public int getQueryIdx() { return queryIdx; }
	public int getTrainIdx() { return trainIdx; }
	public double getDistance() { return distance; }

	@Override
	public String toString() { return queryIdx + " -> " + trainIdx + " (" + distance + ")"; }
}
