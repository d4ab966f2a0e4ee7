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

import org.ejml.data.DMatrixRMaj;

/**
 * The thin plate spline radial basis function U(r) = 2 r^2 log(r), with
 * U(0) = 0.
 * <p>
 * Zero distances are handled by taking the logarithm of 1 instead of 0 at
 * those entries only. The squared distance factor is left untouched, which
 * gives the same value (0) as substituting before squaring would. Input
 * matrices are never modified.
 */
public final class RadialBasisKernel
{

	private RadialBasisKernel()
	{
	}

	/**
	 * Evaluates the kernel for a single non-negative distance.
	 *
	 * @param r the distance
	 * @return 2 r^2 log(r), or exactly 0 when r is 0
	 */
	public static double evaluate( final double r )
	{
		final double logArg = ( r == 0 ) ? 1.0 : r;
		return 2 * r * r * Math.log( logArg );
	}

	/**
	 * Kernel value from the components of a displacement, avoiding the square
	 * root: 2 r^2 log(r) = s log(s) where s = r^2.
	 *
	 * @param dx first component
	 * @param dy second component
	 * @return the kernel value
	 */
	public static double evaluateFromDisplacement( final double dx, final double dy )
	{
		final double s = dx * dx + dy * dy;
		if ( s == 0 )
			return 0;

		return s * Math.log( s );
	}

	/**
	 * Applies the kernel elementwise to a matrix of distances.
	 *
	 * @param distances non-negative pairwise distances
	 * @return a new matrix of the same shape holding the kernel values
	 */
	public static DMatrixRMaj apply( final DMatrixRMaj distances )
	{
		final DMatrixRMaj out = new DMatrixRMaj( distances.numRows, distances.numCols );
		apply( distances, out );
		return out;
	}

	/**
	 * Applies the kernel elementwise, writing into a preallocated matrix.
	 *
	 * @param distances non-negative pairwise distances
	 * @param out destination, must have the shape of distances and must not be
	 *            the same instance
	 */
	public static void apply( final DMatrixRMaj distances, final DMatrixRMaj out )
	{
		if ( distances.numRows != out.numRows || distances.numCols != out.numCols )
			throw new IllegalArgumentException( "kernel output is " + out.numRows + "x" + out.numCols
					+ " but distances are " + distances.numRows + "x" + distances.numCols );

		if ( distances == out )
			throw new IllegalArgumentException( "kernel output must not alias the distance matrix" );

		final double[] r = distances.data;
		final double[] k = out.data;
		final int n = distances.getNumElements();
		for ( int i = 0; i < n; i++ )
			k[ i ] = evaluate( r[ i ] );
	}

}
