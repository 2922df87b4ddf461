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
package net.preibisch.gms;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for the executorService
	 */
	public static int numThreads() { return Math.max( 1, Runtime.getRuntime().availableProcessors() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Runs all tasks and returns their results in the order of the tasks, not in the order of completion.
	 *
	 * @param tasks the tasks
	 * @param service the executor
	 * @param jobDescription for error messages
	 * @param <T> result type
	 * @return the results
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService service, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>( tasks.size() );

		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< T > future : service.invokeAll( tasks ) )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			LOG.error( "Interrupted while trying to " + jobDescription, e );
			throw new IllegalStateException( "Interrupted while trying to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			LOG.error( "Failed to " + jobDescription + ": " + e.getCause(), e );
			throw new IllegalStateException( "Failed to " + jobDescription, e.getCause() );
		}

		return results;
	}
}
