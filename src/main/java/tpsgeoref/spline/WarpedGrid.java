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

/**
 * Spline values at every point of a height x width grid.
 * <p>
 * Grid points are enumerated column by column: index k = ( col - 1 ) * height
 * + ( row - 1 ) with 1-based row in [1, height] and col in [1, width]. The
 * grid point with index k sits at ( qx, qy ) = ( row, col ).
 */
public class WarpedGrid
{
	private final int height;

	private final int width;

	private final double[] xw;

	private final double[] yw;

	public WarpedGrid( final int height, final int width )
	{
		this( height, width, new double[ size( height, width ) ], new double[ size( height, width ) ] );
	}

	public WarpedGrid( final int height, final int width, final double[] xw, final double[] yw )
	{
		final int n = size( height, width );
		if ( xw.length != n || yw.length != n )
			throw new IllegalArgumentException( "channels must have " + n + " entries" );

		this.height = height;
		this.width = width;
		this.xw = xw;
		this.yw = yw;
	}

	public static int size( final int height, final int width )
	{
		if ( height < 1 || width < 1 )
			throw new IllegalArgumentException( "grid must be at least 1x1, was " + height + "x" + width );

		final long n = ( long ) height * width;
		if ( n > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "grid of " + height + "x" + width + " points is too large" );

		return ( int ) n;
	}

	public int getHeight()
	{
		return height;
	}

	public int getWidth()
	{
		return width;
	}

	public int size()
	{
		return xw.length;
	}

	/**
	 * @param k grid index
	 * @return 1-based row, the qx coordinate
	 */
	public int row( final int k )
	{
		return k % height + 1;
	}

	/**
	 * @param k grid index
	 * @return 1-based column, the qy coordinate
	 */
	public int col( final int k )
	{
		return k / height + 1;
	}

	public int index( final int row, final int col )
	{
		return ( col - 1 ) * height + ( row - 1 );
	}

	/**
	 * @return values of the first spline channel, by grid index
	 */
	public double[] getXw()
	{
		return xw;
	}

	/**
	 * @return values of the second spline channel, by grid index
	 */
	public double[] getYw()
	{
		return yw;
	}

}
