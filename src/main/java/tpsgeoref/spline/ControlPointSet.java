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
 * Ordered landmark correspondences in the mathematical frame.
 * <p>
 * Basis points are the kernel centres (where the spline is evaluated), target
 * points are the values the spline must reproduce there. Both are stored as
 * [ dimension ][ landmark ] arrays, so index i refers to the same landmark in
 * every matrix built from this set.
 */
public class ControlPointSet
{
	public static final int NDIMS = 2;

	private final double[][] basis;

	private final double[][] targets;

	private final int nLandmarks;

	public ControlPointSet( final double[][] basis, final double[][] targets )
	{
		if ( basis.length != NDIMS || targets.length != NDIMS )
			throw new IllegalArgumentException( "control points must be " + NDIMS + "-dimensional" );

		nLandmarks = basis[ 0 ].length;
		for ( int d = 0; d < NDIMS; d++ )
		{
			if ( basis[ d ].length != nLandmarks || targets[ d ].length != nLandmarks )
				throw new IllegalArgumentException( "basis and target coordinates must all have "
						+ nLandmarks + " entries" );
		}

		this.basis = basis;
		this.targets = targets;
	}

	public int getNumLandmarks()
	{
		return nLandmarks;
	}

	public double basisX( final int i )
	{
		return basis[ 0 ][ i ];
	}

	public double basisY( final int i )
	{
		return basis[ 1 ][ i ];
	}

	public double targetX( final int i )
	{
		return targets[ 0 ][ i ];
	}

	public double targetY( final int i )
	{
		return targets[ 1 ][ i ];
	}

	public double[][] getBasis()
	{
		return basis;
	}

	public double[][] getTargets()
	{
		return targets;
	}

}
