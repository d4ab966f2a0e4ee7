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
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the augmented thin plate spline system
 *
 * <pre>
 * L = [ K   P ]      Y = [ targets ]
 *     [ P^T 0 ]          [    0    ]
 * </pre>
 *
 * where K is the N x N kernel block between basis points and P the N x 3
 * polynomial block with rows [ 1, xp, yp ].
 * <p>
 * F. L. Bookstein, "Principal warps: thin-plate splines and the decomposition
 * of deformations," IEEE Trans. Pattern Anal. Mach. Intell., vol. 11, no. 6,
 * pp. 567–585, Jun. 1989.
 */
public class LinearSystemAssembler
{
	/**
	 * Number of affine coefficients per output channel: constant, x and y.
	 */
	public static final int NAFFINE = ControlPointSet.NDIMS + 1;

	/**
	 * Fewest landmarks for which the affine block can be determined.
	 */
	public static final int MIN_LANDMARKS = NAFFINE;

	protected static Logger logger = LoggerFactory.getLogger( LinearSystemAssembler.class );

	/**
	 * Assembles L and Y for the given control points.
	 *
	 * @param controlPoints the landmarks
	 * @return the system
	 * @throws InsufficientLandmarksException if there are fewer than three
	 *             landmarks
	 */
	public LinearSystem assemble( final ControlPointSet controlPoints )
	{
		checkLandmarkCount( controlPoints.getNumLandmarks() );

		final DMatrixRMaj lMatrix = computeL( controlPoints );
		final DMatrixRMaj yMatrix = buildTargets( controlPoints );

		logger.debug( "assembled {}x{} system for {} landmarks", lMatrix.numRows, lMatrix.numCols,
				controlPoints.getNumLandmarks() );

		return new LinearSystem( controlPoints, lMatrix, yMatrix );
	}

	public static void checkLandmarkCount( final int nLandmarks )
	{
		if ( nLandmarks < MIN_LANDMARKS )
			throw new InsufficientLandmarksException( nLandmarks, MIN_LANDMARKS );
	}

	/**
	 * Euclidean distances between every pair of basis points.
	 *
	 * @param controlPoints the landmarks
	 * @return N x N symmetric distance matrix with a zero diagonal
	 */
	public DMatrixRMaj computeDistances( final ControlPointSet controlPoints )
	{
		final int n = controlPoints.getNumLandmarks();
		final DMatrixRMaj rMatrix = new DMatrixRMaj( n, n );

		int i = 0;
		while ( i < n )
		{
			int j = i + 1;
			while ( j < n )
			{
				final double dx = controlPoints.basisX( i ) - controlPoints.basisX( j );
				final double dy = controlPoints.basisY( i ) - controlPoints.basisY( j );
				final double r = Math.sqrt( dx * dx + dy * dy );

				rMatrix.set( i, j, r );
				rMatrix.set( j, i, r );
				j++;
			}
			i++;
		}
		return rMatrix;
	}

	/**
	 * Builds the K matrix from the basis points.
	 *
	 * @param controlPoints the landmarks
	 * @return the N x N kernel block
	 */
	public DMatrixRMaj computeK( final ControlPointSet controlPoints )
	{
		return RadialBasisKernel.apply( computeDistances( controlPoints ) );
	}

	/**
	 * Builds the P matrix, one row [ 1, xp, yp ] per landmark.
	 *
	 * @param controlPoints the landmarks
	 * @return the N x 3 polynomial block
	 */
	public DMatrixRMaj computeP( final ControlPointSet controlPoints )
	{
		final int n = controlPoints.getNumLandmarks();
		final DMatrixRMaj pMatrix = new DMatrixRMaj( n, NAFFINE );
		for ( int i = 0; i < n; i++ )
		{
			pMatrix.set( i, 0, 1.0 );
			pMatrix.set( i, 1, controlPoints.basisX( i ) );
			pMatrix.set( i, 2, controlPoints.basisY( i ) );
		}
		return pMatrix;
	}

	public DMatrixRMaj computeL( final ControlPointSet controlPoints )
	{
		final DMatrixRMaj kMatrix = computeK( controlPoints );
		final DMatrixRMaj pMatrix = computeP( controlPoints );

		final int n = controlPoints.getNumLandmarks();
		final DMatrixRMaj lMatrix = new DMatrixRMaj( n + NAFFINE, n + NAFFINE );

		CommonOps_DDRM.insert( kMatrix, lMatrix, 0, 0 );
		CommonOps_DDRM.insert( pMatrix, lMatrix, 0, kMatrix.getNumCols() );
		CommonOps_DDRM.transpose( pMatrix );
		CommonOps_DDRM.insert( pMatrix, lMatrix, kMatrix.getNumRows(), 0 );
		// bottom right 3x3 block is already zero after initializing lMatrix

		return lMatrix;
	}

	/**
	 * Stacks the target coordinates (one row per landmark) on a 3 x 2 zero
	 * block.
	 *
	 * @param controlPoints the landmarks
	 * @return the (N+3) x 2 right hand side
	 */
	public DMatrixRMaj buildTargets( final ControlPointSet controlPoints )
	{
		final int n = controlPoints.getNumLandmarks();
		final DMatrixRMaj yMatrix = new DMatrixRMaj( n + NAFFINE, ControlPointSet.NDIMS );
		for ( int i = 0; i < n; i++ )
		{
			yMatrix.set( i, 0, controlPoints.targetX( i ) );
			yMatrix.set( i, 1, controlPoints.targetY( i ) );
		}
		return yMatrix;
	}

}
