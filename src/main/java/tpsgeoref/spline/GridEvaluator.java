/*-
 * #%L
 * Thin plate spline georeferencing.
 * %%
 * Copyright (C) 2014 - 2022 Howard Hughes Medical Institute.
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */
package tpsgeoref.spline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a fitted {@link ThinPlateSpline} at every point of a dense grid.
 * <p>
 * Grid points are processed in chunks. For a chunk of M points the
 * M x (N+3) evaluation matrix [ U | 1 qx qy ] is built, U holding the kernel
 * values between each grid point and each landmark, and multiplied with the
 * (N+3) x 2 weight matrix, giving both output channels at once. Chunks write
 * to disjoint ranges of the output, so they may run on several threads
 * without changing the result.
 */
public class GridEvaluator
{
	public static final int DEFAULT_CHUNK_SIZE = 4096;

	protected static Logger logger = LoggerFactory.getLogger( GridEvaluator.class );

	private final int numThreads;

	private final int chunkSize;

	public GridEvaluator()
	{
		this( 1, DEFAULT_CHUNK_SIZE );
	}

	public GridEvaluator( final int numThreads )
	{
		this( numThreads, DEFAULT_CHUNK_SIZE );
	}

	public GridEvaluator( final int numThreads, final int chunkSize )
	{
		if ( numThreads < 1 )
			throw new IllegalArgumentException( "numThreads must be at least 1, was " + numThreads );
		if ( chunkSize < 1 )
			throw new IllegalArgumentException( "chunkSize must be at least 1, was " + chunkSize );

		this.numThreads = numThreads;
		this.chunkSize = chunkSize;
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	public int getChunkSize()
	{
		return chunkSize;
	}

	/**
	 * Evaluates the spline over rows 1..height and columns 1..width.
	 *
	 * @param tps the fitted spline
	 * @param height grid height
	 * @param width grid width
	 * @return spline values in grid enumeration order
	 */
	public WarpedGrid evaluate( final ThinPlateSpline tps, final int height, final int width )
	{
		final WarpedGrid grid = new WarpedGrid( height, width );
		final int n = grid.size();

		final List< int[] > chunks = new ArrayList<>();
		for ( int start = 0; start < n; start += chunkSize )
			chunks.add( new int[] { start, Math.min( n, start + chunkSize ) } );

		logger.debug( "evaluating {} grid points against {} landmarks in {} chunks on {} thread(s)",
				n, tps.getNumLandmarks(), chunks.size(), numThreads );

		if ( numThreads == 1 || chunks.size() == 1 )
		{
			final ChunkBuffers buffers = new ChunkBuffers( tps.getNumLandmarks(), chunkSize );
			for ( final int[] chunk : chunks )
				evaluateChunk( tps, grid, chunk[ 0 ], chunk[ 1 ], buffers );
		}
		else
		{
			evaluateParallel( tps, grid, chunks );
		}

		return grid;
	}

	private void evaluateParallel( final ThinPlateSpline tps, final WarpedGrid grid, final List< int[] > chunks )
	{
		final ExecutorService executor = Executors.newFixedThreadPool( numThreads );
		try
		{
			final List< Future< ? > > futures = new ArrayList<>();
			for ( final int[] chunk : chunks )
			{
				futures.add( executor.submit( () -> evaluateChunk( tps, grid, chunk[ 0 ], chunk[ 1 ],
						new ChunkBuffers( tps.getNumLandmarks(), chunk[ 1 ] - chunk[ 0 ] ) ) ) );
			}

			for ( final Future< ? > future : futures )
				future.get();
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException( "grid evaluation was interrupted", e );
		}
		catch ( final ExecutionException e )
		{
			final Throwable cause = e.getCause();
			if ( cause instanceof RuntimeException )
				throw ( RuntimeException ) cause;

			throw new IllegalStateException( "grid evaluation failed", cause );
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	/**
	 * Evaluates grid indexes [ start, end ) into the grid's channels.
	 */
	protected void evaluateChunk( final ThinPlateSpline tps, final WarpedGrid grid,
			final int start, final int end, final ChunkBuffers buffers )
	{
		final ControlPointSet controlPoints = tps.getControlPoints();
		final int nLandmarks = tps.getNumLandmarks();
		final int m = end - start;

		buffers.reshape( m );
		final DMatrixRMaj rMatrix = buffers.rMatrix;
		final DMatrixRMaj uMatrix = buffers.uMatrix;
		final DMatrixRMaj eMatrix = buffers.eMatrix;
		final DMatrixRMaj out = buffers.out;

		for ( int r = 0; r < m; r++ )
		{
			final int k = start + r;
			final double qx = grid.row( k );
			final double qy = grid.col( k );
			for ( int i = 0; i < nLandmarks; i++ )
			{
				final double dx = controlPoints.basisX( i ) - qx;
				final double dy = controlPoints.basisY( i ) - qy;
				rMatrix.unsafe_set( r, i, Math.sqrt( dx * dx + dy * dy ) );
			}
		}

		RadialBasisKernel.apply( rMatrix, uMatrix );
		CommonOps_DDRM.insert( uMatrix, eMatrix, 0, 0 );

		for ( int r = 0; r < m; r++ )
		{
			final int k = start + r;
			eMatrix.unsafe_set( r, nLandmarks, 1.0 );
			eMatrix.unsafe_set( r, nLandmarks + 1, grid.row( k ) );
			eMatrix.unsafe_set( r, nLandmarks + 2, grid.col( k ) );
		}

		CommonOps_DDRM.mult( eMatrix, tps.getWeights(), out );

		final double[] xw = grid.getXw();
		final double[] yw = grid.getYw();
		for ( int r = 0; r < m; r++ )
		{
			xw[ start + r ] = out.unsafe_get( r, 0 );
			yw[ start + r ] = out.unsafe_get( r, 1 );
		}
	}

	/**
	 * Per-thread scratch matrices, resized for the last (shorter) chunk.
	 */
	protected static class ChunkBuffers
	{
		final int nLandmarks;

		final DMatrixRMaj rMatrix;

		final DMatrixRMaj uMatrix;

		final DMatrixRMaj eMatrix;

		final DMatrixRMaj out;

		ChunkBuffers( final int nLandmarks, final int maxRows )
		{
			this.nLandmarks = nLandmarks;
			rMatrix = new DMatrixRMaj( maxRows, nLandmarks );
			uMatrix = new DMatrixRMaj( maxRows, nLandmarks );
			eMatrix = new DMatrixRMaj( maxRows, nLandmarks + LinearSystemAssembler.NAFFINE );
			out = new DMatrixRMaj( maxRows, ControlPointSet.NDIMS );
		}

		void reshape( final int rows )
		{
			rMatrix.reshape( rows, nLandmarks );
			uMatrix.reshape( rows, nLandmarks );
			eMatrix.reshape( rows, nLandmarks + LinearSystemAssembler.NAFFINE );
			out.reshape( rows, ControlPointSet.NDIMS );
		}
	}

}
