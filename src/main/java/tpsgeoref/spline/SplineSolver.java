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
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves L W = Y for the thin plate spline weights with a dense LU solver.
 * <p>
 * L is invertible exactly when the basis points are pairwise distinct and
 * not all on one line. Both conditions are tested on the landmark geometry
 * before the solve, relative to the spread of the landmarks, so the test
 * does not depend on the scale of the coordinates (the kernel block grows
 * with r^2 log r while the affine block does not). The system is rejected
 * with a {@link SingularSystemException} when either test fails, when the
 * LU decomposition fails, or when the solution is not finite or does not
 * reproduce Y.
 */
public class SplineSolver
{
	public static final double DEFAULT_TOLERANCE = 1e-12;

	/**
	 * Largest accepted ||L W - Y|| / ( ||L|| ||W|| + ||Y|| ), Frobenius norms.
	 */
	public static final double MAX_RELATIVE_RESIDUAL = 1e-8;

	protected static Logger logger = LoggerFactory.getLogger( SplineSolver.class );

	private final double tolerance;

	public SplineSolver()
	{
		this( DEFAULT_TOLERANCE );
	}

	/**
	 * @param tolerance smallest accepted relative spread of the landmarks
	 *            across their second principal axis, and smallest accepted
	 *            distance between two landmarks relative to their extent
	 */
	public SplineSolver( final double tolerance )
	{
		if ( !( tolerance >= 0 ) )
			throw new IllegalArgumentException( "tolerance must be non-negative, was " + tolerance );

		this.tolerance = tolerance;
	}

	public double getTolerance()
	{
		return tolerance;
	}

	public ThinPlateSpline solve( final LinearSystem system )
	{
		LinearSystemAssembler.checkLandmarkCount( system.getNumLandmarks() );

		final ControlPointSet controlPoints = system.getControlPoints();
		checkGeometry( controlPoints );

		final DMatrixRMaj lMatrix = system.getL();
		final DMatrixRMaj yMatrix = system.getY();

		final LinearSolverDense< DMatrixRMaj > solver = LinearSolverFactory_DDRM.linear( lMatrix.numCols );
		final DMatrixRMaj a = solver.modifiesA() ? lMatrix.copy() : lMatrix;
		if ( !solver.setA( a ) )
			throw new SingularSystemException( "LU decomposition of the system matrix failed", Double.NaN );

		final DMatrixRMaj wMatrix = new DMatrixRMaj( lMatrix.numCols, yMatrix.numCols );
		solver.solve( solver.modifiesB() ? yMatrix.copy() : yMatrix, wMatrix );

		if ( MatrixFeatures_DDRM.hasUncountable( wMatrix ) )
			throw new SingularSystemException( "solving the system produced non-finite weights", Double.NaN );

		final double residual = relativeResidual( lMatrix, wMatrix, yMatrix );
		logger.debug( "relative residual of L W = Y: {}", residual );
		if ( !( residual <= MAX_RELATIVE_RESIDUAL ) )
			throw new SingularSystemException( "solution does not satisfy the system (relative residual "
					+ residual + "), the system matrix is numerically singular", residual );

		return new ThinPlateSpline( controlPoints, wMatrix );
	}

	protected void checkGeometry( final ControlPointSet controlPoints )
	{
		final DMatrixRMaj centred = centredBasis( controlPoints );

		final double spread = reciprocalCondition( centred );
		logger.debug( "relative spread of the landmarks: {}", spread );
		if ( !( spread > tolerance ) )
			throw new SingularSystemException( "system matrix is singular, landmarks are collinear (relative spread "
					+ spread + " is not above " + tolerance + ")", spread );

		final double extent = CommonOps_DDRM.elementMaxAbs( centred );
		final int n = controlPoints.getNumLandmarks();
		for ( int i = 0; i < n; i++ )
			for ( int j = i + 1; j < n; j++ )
			{
				final double separation = Math.hypot(
						controlPoints.basisX( i ) - controlPoints.basisX( j ),
						controlPoints.basisY( i ) - controlPoints.basisY( j ) ) / extent;

				if ( !( separation > tolerance ) )
					throw new SingularSystemException( "system matrix is singular, landmarks " + i + " and " + j
							+ " are duplicated (relative separation " + separation + ")", separation );
			}
	}

	/**
	 * @param controlPoints the landmarks
	 * @return N x 2 basis coordinates minus their mean
	 */
	public static DMatrixRMaj centredBasis( final ControlPointSet controlPoints )
	{
		final int n = controlPoints.getNumLandmarks();

		double meanX = 0;
		double meanY = 0;
		for ( int i = 0; i < n; i++ )
		{
			meanX += controlPoints.basisX( i );
			meanY += controlPoints.basisY( i );
		}
		meanX /= n;
		meanY /= n;

		final DMatrixRMaj centred = new DMatrixRMaj( n, ControlPointSet.NDIMS );
		for ( int i = 0; i < n; i++ )
		{
			centred.unsafe_set( i, 0, controlPoints.basisX( i ) - meanX );
			centred.unsafe_set( i, 1, controlPoints.basisY( i ) - meanY );
		}
		return centred;
	}

	/**
	 * @param mtx any matrix
	 * @return smallest over largest singular value, 0 for a zero matrix
	 */
	public static double reciprocalCondition( final DMatrixRMaj mtx )
	{
		final SingularValueDecomposition_F64< DMatrixRMaj > svd =
				DecompositionFactory_DDRM.svd( mtx.numRows, mtx.numCols, false, false, true );

		if ( !svd.decompose( svd.inputModified() ? mtx.copy() : mtx ) )
			return 0;

		final double[] sv = svd.getSingularValues();
		final int n = svd.numberOfSingularValues();

		double max = 0;
		double min = Double.MAX_VALUE;
		for ( int i = 0; i < n; i++ )
		{
			max = Math.max( max, sv[ i ] );
			min = Math.min( min, sv[ i ] );
		}

		if ( max == 0 )
			return 0;

		return min / max;
	}

	/**
	 * @return ||L W - Y|| / ( ||L|| ||W|| + ||Y|| ), 0 when Y and W are zero
	 */
	public static double relativeResidual( final DMatrixRMaj lMatrix, final DMatrixRMaj wMatrix,
			final DMatrixRMaj yMatrix )
	{
		final DMatrixRMaj residual = new DMatrixRMaj( yMatrix.numRows, yMatrix.numCols );
		CommonOps_DDRM.mult( lMatrix, wMatrix, residual );
		CommonOps_DDRM.subtractEquals( residual, yMatrix );

		final double scale = NormOps_DDRM.normF( lMatrix ) * NormOps_DDRM.normF( wMatrix )
				+ NormOps_DDRM.normF( yMatrix );
		if ( scale == 0 )
			return 0;

		return NormOps_DDRM.normF( residual ) / scale;
	}

}
