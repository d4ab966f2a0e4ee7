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
 * A fitted two-dimensional thin plate spline.
 * <p>
 * Holds the kernel centres and the (N+3) x 2 weight matrix W. Rows 0..N-1 of
 * W are the kernel weights, rows N..N+2 the affine coefficients
 * ( a0, ax, ay ). Column 0 produces the first output coordinate, column 1 the
 * second.
 */
public class ThinPlateSpline
{
	private final ControlPointSet controlPoints;

	private final DMatrixRMaj wMatrix;

	private final int nLandmarks;

	public ThinPlateSpline( final ControlPointSet controlPoints, final DMatrixRMaj wMatrix )
	{
		final int n = controlPoints.getNumLandmarks();
		if ( wMatrix.numRows != n + LinearSystemAssembler.NAFFINE || wMatrix.numCols != ControlPointSet.NDIMS )
			throw new IllegalArgumentException( "weight matrix is " + wMatrix.numRows + "x" + wMatrix.numCols
					+ " but " + ( n + LinearSystemAssembler.NAFFINE ) + "x" + ControlPointSet.NDIMS + " is needed" );

		this.controlPoints = controlPoints;
		this.wMatrix = wMatrix;
		this.nLandmarks = n;
	}

	public int getNumLandmarks()
	{
		return nLandmarks;
	}

	public ControlPointSet getControlPoints()
	{
		return controlPoints;
	}

	public DMatrixRMaj getWeights()
	{
		return wMatrix;
	}

	/**
	 * @param d output channel
	 * @return the N kernel weights of that channel
	 */
	public double[] getKernelWeights( final int d )
	{
		final double[] w = new double[ nLandmarks ];
		for ( int i = 0; i < nLandmarks; i++ )
			w[ i ] = wMatrix.get( i, d );

		return w;
	}

	/**
	 * @param d output channel
	 * @return ( a0, ax, ay ) of that channel
	 */
	public double[] getAffine( final int d )
	{
		final double[] a = new double[ LinearSystemAssembler.NAFFINE ];
		for ( int i = 0; i < a.length; i++ )
			a[ i ] = wMatrix.get( nLandmarks + i, d );

		return a;
	}

	/**
	 * Transforms the input point according to the affine part of the spline
	 * only.
	 *
	 * @param pt the point
	 * @return the transformed point
	 */
	public double[] applyAffine( final double[] pt )
	{
		final double[] result = new double[ ControlPointSet.NDIMS ];
		for ( int d = 0; d < ControlPointSet.NDIMS; d++ )
		{
			result[ d ] = wMatrix.get( nLandmarks, d )
					+ wMatrix.get( nLandmarks + 1, d ) * pt[ 0 ]
					+ wMatrix.get( nLandmarks + 2, d ) * pt[ 1 ];
		}
		return result;
	}

	/**
	 * Transform a point pt into result. pt and result must NOT be the same
	 * array.
	 *
	 * @param pt the point
	 * @param result the result
	 */
	public void apply( final double[] pt, final double[] result )
	{
		double fx = 0;
		double fy = 0;
		for ( int i = 0; i < nLandmarks; i++ )
		{
			final double u = RadialBasisKernel.evaluateFromDisplacement(
					controlPoints.basisX( i ) - pt[ 0 ],
					controlPoints.basisY( i ) - pt[ 1 ] );

			fx += u * wMatrix.get( i, 0 );
			fy += u * wMatrix.get( i, 1 );
		}

		final double[] affine = applyAffine( pt );
		result[ 0 ] = fx + affine[ 0 ];
		result[ 1 ] = fy + affine[ 1 ];
	}

	public double[] apply( final double[] pt )
	{
		final double[] result = new double[ ControlPointSet.NDIMS ];
		apply( pt, result );
		return result;
	}

}
