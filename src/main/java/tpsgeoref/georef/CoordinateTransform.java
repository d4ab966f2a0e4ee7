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
package tpsgeoref.georef;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tpsgeoref.spline.ControlPointSet;
import tpsgeoref.spline.WarpedGrid;

/**
 * Converts between pixel coordinates (origin top left, x along columns) and
 * the mathematical frame the spline is fitted in (origin bottom left, axes
 * swapped).
 * <p>
 * Landmarks are ingested as
 *
 * <pre>
 * ( xs, ys ) = ( y, x )
 * ( xp, yp ) = ( flipHeight + v, u )
 * </pre>
 *
 * Points files store canvas v as a non-positive offset from the top edge, so
 * flipHeight + v counts rows from the bottom. On output the grid point
 * ( row, col ) becomes canvas pixel ( u, v ) = ( col, row ) and the two spline
 * channels are swapped back.
 */
public class CoordinateTransform
{
	protected static Logger logger = LoggerFactory.getLogger( CoordinateTransform.class );

	private final int canvasHeight;

	private final double flipHeight;

	/**
	 * Uses the canvas height as the flip height.
	 *
	 * @param canvasHeight output canvas height
	 */
	public CoordinateTransform( final int canvasHeight )
	{
		this( canvasHeight, canvasHeight );
	}

	/**
	 * @param canvasHeight output canvas height
	 * @param flipHeight height used to invert the v axis of landmarks
	 */
	public CoordinateTransform( final int canvasHeight, final double flipHeight )
	{
		if ( canvasHeight < 1 )
			throw new IllegalArgumentException( "canvas height must be positive, was " + canvasHeight );

		this.canvasHeight = canvasHeight;
		this.flipHeight = flipHeight;

		if ( flipHeight != canvasHeight )
			logger.warn( "landmark flip height {} differs from canvas height {}, output rows will be offset by {}",
					flipHeight, canvasHeight, flipHeight - canvasHeight );
	}

	public int getCanvasHeight()
	{
		return canvasHeight;
	}

	public double getFlipHeight()
	{
		return flipHeight;
	}

	/**
	 * Maps landmarks into the mathematical frame, keeping their order.
	 *
	 * @param landmarks the landmarks, enabled or not
	 * @return basis and target points
	 */
	public ControlPointSet toControlPoints( final List< Landmark > landmarks )
	{
		final int n = landmarks.size();
		final double[][] basis = new double[ ControlPointSet.NDIMS ][ n ];
		final double[][] targets = new double[ ControlPointSet.NDIMS ][ n ];

		for ( int i = 0; i < n; i++ )
		{
			final Landmark landmark = landmarks.get( i );
			targets[ 0 ][ i ] = landmark.getY();
			targets[ 1 ][ i ] = landmark.getX();
			basis[ 0 ][ i ] = flipHeight + landmark.getV();
			basis[ 1 ][ i ] = landmark.getU();
		}

		return new ControlPointSet( basis, targets );
	}

	/**
	 * Position along the v axis as the enumeration walks it, from
	 * canvasHeight down to 1.
	 *
	 * @param row 1-based grid row
	 * @return the descending axis value
	 */
	public int vAxisValue( final int row )
	{
		return canvasHeight - row + 1;
	}

	/**
	 * @param grid the evaluated grid
	 * @param k grid index
	 * @return canvas v of the grid point, counted from the bottom
	 */
	public int canvasV( final WarpedGrid grid, final int k )
	{
		return canvasHeight + 1 - vAxisValue( grid.row( k ) );
	}

	/**
	 * @param grid the evaluated grid
	 * @param k grid index
	 * @return canvas u of the grid point
	 */
	public int canvasU( final WarpedGrid grid, final int k )
	{
		return grid.col( k );
	}

	/**
	 * @param grid the evaluated grid
	 * @param k grid index
	 * @return source image x, taken from the second spline channel
	 */
	public double sourceX( final WarpedGrid grid, final int k )
	{
		return grid.getYw()[ k ];
	}

	/**
	 * @param grid the evaluated grid
	 * @param k grid index
	 * @return source image y, taken from the first spline channel
	 */
	public double sourceY( final WarpedGrid grid, final int k )
	{
		return grid.getXw()[ k ];
	}

}
