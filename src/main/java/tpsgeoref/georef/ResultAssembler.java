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

import tpsgeoref.spline.WarpedGrid;

/**
 * Pairs every evaluated grid point with its canvas pixel.
 * <p>
 * The result has one row per canvas pixel. Points outside the hull of the
 * landmarks are extrapolated by the spline like any other.
 */
public class ResultAssembler
{
	private final CoordinateTransform transform;

	public ResultAssembler( final CoordinateTransform transform )
	{
		this.transform = transform;
	}

	public LookupTable assemble( final WarpedGrid grid )
	{
		if ( grid.getHeight() != transform.getCanvasHeight() )
			throw new IllegalArgumentException( "grid height " + grid.getHeight()
					+ " does not match canvas height " + transform.getCanvasHeight() );

		final int n = grid.size();
		final double[] x = new double[ n ];
		final double[] y = new double[ n ];
		final int[] u = new int[ n ];
		final int[] v = new int[ n ];

		for ( int k = 0; k < n; k++ )
		{
			x[ k ] = transform.sourceX( grid, k );
			y[ k ] = transform.sourceY( grid, k );
			u[ k ] = transform.canvasU( grid, k );
			v[ k ] = transform.canvasV( grid, k );
		}

		return new LookupTable( grid.getWidth(), grid.getHeight(), x, y, u, v );
	}

}
