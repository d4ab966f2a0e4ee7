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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.ejml.data.DMatrixRMaj;
import org.junit.Test;

public class SplineSolverTests
{
	private final LinearSystemAssembler assembler = new LinearSystemAssembler();

	private final SplineSolver solver = new SplineSolver();

	private ThinPlateSpline fit( final double[][] basis, final double[][] targets )
	{
		return solver.solve( assembler.assemble( new ControlPointSet( basis, targets ) ) );
	}

	/*
	 * ( 0, 0 ) -> ( 0, 0 ), ( 10, 0 ) -> ( 20, 0 ), ( 0, 10 ) -> ( 0, 20 )
	 */
	public ThinPlateSpline scaleBy2()
	{
		final double[][] basis = new double[][] {
				{ 0.0, 10.0, 0.0 },	// x
				{ 0.0, 0.0, 10.0 } };	// y

		final double[][] targets = new double[][] {
				{ 0.0, 20.0, 0.0 },	// x
				{ 0.0, 0.0, 20.0 } };	// y

		return fit( basis, targets );
	}

	public ThinPlateSpline nonlinear()
	{
		return solver.solve( assembler.assemble( LinearSystemAssemblerTests.fiveLandmarks() ) );
	}

	@Test
	public void testInterpolatesLandmarks()
	{
		final ThinPlateSpline tps = nonlinear();
		final ControlPointSet pts = tps.getControlPoints();

		final double[] result = new double[ 2 ];
		for ( int i = 0; i < pts.getNumLandmarks(); i++ )
		{
			tps.apply( new double[] { pts.basisX( i ), pts.basisY( i ) }, result );
			assertEquals( "x of landmark " + i, pts.targetX( i ), result[ 0 ], 1e-6 );
			assertEquals( "y of landmark " + i, pts.targetY( i ), result[ 1 ], 1e-6 );
		}

		// a nonlinear fit has non-zero kernel weights
		double maxWeight = 0;
		for ( final double w : tps.getKernelWeights( 0 ) )
			maxWeight = Math.max( maxWeight, Math.abs( w ) );
		assertTrue( maxWeight > 1e-6 );
	}

	@Test
	public void testKernelWeightsSumToZero()
	{
		// side conditions P^T w = 0 from the lower block rows of L
		final ThinPlateSpline tps = nonlinear();
		final ControlPointSet pts = tps.getControlPoints();
		for ( int d = 0; d < 2; d++ )
		{
			final double[] w = tps.getKernelWeights( d );
			double sum = 0;
			double sumX = 0;
			double sumY = 0;
			for ( int i = 0; i < w.length; i++ )
			{
				sum += w[ i ];
				sumX += w[ i ] * pts.basisX( i );
				sumY += w[ i ] * pts.basisY( i );
			}
			assertEquals( 0.0, sum, 1e-9 );
			assertEquals( 0.0, sumX, 1e-9 );
			assertEquals( 0.0, sumY, 1e-9 );
		}
	}

	@Test
	public void testThreeLandmarksAreAffine()
	{
		final ThinPlateSpline tps = scaleBy2();

		for ( int d = 0; d < 2; d++ )
			for ( final double w : tps.getKernelWeights( d ) )
				assertThat( Math.abs( w ), lessThan( 1e-9 ) );

		final double[] ax = tps.getAffine( 0 );
		final double[] ay = tps.getAffine( 1 );
		assertEquals( 0.0, ax[ 0 ], 1e-9 );
		assertEquals( 2.0, ax[ 1 ], 1e-9 );
		assertEquals( 0.0, ax[ 2 ], 1e-9 );
		assertEquals( 0.0, ay[ 0 ], 1e-9 );
		assertEquals( 0.0, ay[ 1 ], 1e-9 );
		assertEquals( 2.0, ay[ 2 ], 1e-9 );

		for ( double x = -20; x <= 40; x += 7.5 )
			for ( double y = -20; y <= 40; y += 7.5 )
			{
				final double[] pt = new double[] { x, y };
				final double[] full = tps.apply( pt );
				final double[] affine = tps.applyAffine( pt );
				assertThat( full[ 0 ], closeTo( 2 * x, 1e-8 ) );
				assertThat( full[ 1 ], closeTo( 2 * y, 1e-8 ) );
				assertThat( full[ 0 ], closeTo( affine[ 0 ], 1e-8 ) );
				assertThat( full[ 1 ], closeTo( affine[ 1 ], 1e-8 ) );
			}
	}

	@Test
	public void testCollinearLandmarksAreSingular()
	{
		final double[][] horizontal = new double[][] {
				{ 0.0, 5.0, 10.0 },
				{ 0.0, 0.0, 0.0 } };

		final double[][] diagonal = new double[][] {
				{ 1.0, 2.0, 3.0 },
				{ 2.0, 4.0, 6.0 } };

		final double[][] targets = new double[][] {
				{ 0.0, 1.0, 2.0 },
				{ 3.0, 4.0, 5.0 } };

		assertSingular( horizontal, targets );
		assertSingular( diagonal, targets );
	}

	@Test
	public void testDuplicateLandmarksAreSingular()
	{
		final double[][] basis = new double[][] {
				{ 0.0, 10.0, 0.0, 10.0 },
				{ 0.0, 0.0, 10.0, 0.0 } };

		final double[][] targets = new double[][] {
				{ 0.0, 20.0, 0.0, 20.0 },
				{ 0.0, 0.0, 20.0, 0.0 } };

		assertSingular( basis, targets );
	}

	private void assertSingular( final double[][] basis, final double[][] targets )
	{
		try
		{
			final ThinPlateSpline tps = fit( basis, targets );
			fail( "expected a singular system but solved to " + tps.getWeights() );
		}
		catch ( final SingularSystemException e )
		{
			assertThat( e.getDegeneracy(), lessThanOrEqualTo( SplineSolver.DEFAULT_TOLERANCE ) );
		}
	}

	@Test( expected = InsufficientLandmarksException.class )
	public void testTooFewLandmarks()
	{
		final ControlPointSet pts = new ControlPointSet(
				new double[][] { { 0.0, 1.0 }, { 0.0, 1.0 } },
				new double[][] { { 0.0, 2.0 }, { 0.0, 2.0 } } );

		// hand-built system, the solver checks on its own
		solver.solve( new LinearSystem( pts, new DMatrixRMaj( 5, 5 ),
				new DMatrixRMaj( 5, 2 ) ) );
	}

	/*
	 * Landmarks spread over a 1920 x 1080 canvas in the mathematical frame
	 * ( 1080 + v, u ), mapped to UTM coordinates.
	 */
	public static ControlPointSet canvasLandmarks( final double scale )
	{
		final double[][] basis = new double[][] {
				{ 1000, 960, 540, 70, 90, 780, 280 },
				{ 100, 1800, 950, 150, 1750, 600, 1300 } };

		for ( int d = 0; d < 2; d++ )
			for ( int i = 0; i < basis[ d ].length; i++ )
				basis[ d ][ i ] *= scale;

		final double[][] targets = new double[][] {
				{ 5619960.12, 5619941.05, 5619728.66, 5619494.27, 5619503.81, 5619851.44, 5619597.30 },
				{ 512050.37, 512901.84, 512473.90, 512071.15, 512879.02, 512302.55, 512648.73 } };

		return new ControlPointSet( basis, targets );
	}

	@Test
	public void testInterpolatesAtCanvasScale()
	{
		for ( final double scale : new double[] { 0.01, 1.0, 5.0 } )
		{
			final ThinPlateSpline tps = solver.solve( assembler.assemble( canvasLandmarks( scale ) ) );
			final ControlPointSet pts = tps.getControlPoints();

			final double[] result = new double[ 2 ];
			for ( int i = 0; i < pts.getNumLandmarks(); i++ )
			{
				tps.apply( new double[] { pts.basisX( i ), pts.basisY( i ) }, result );
				assertEquals( "x of landmark " + i + " at scale " + scale, pts.targetX( i ), result[ 0 ], 1e-4 );
				assertEquals( "y of landmark " + i + " at scale " + scale, pts.targetY( i ), result[ 1 ], 1e-4 );
			}
		}
	}

	@Test
	public void testGeometryCheckIgnoresScale()
	{
		final double[][] collinear = new double[][] {
				{ 100.0, 300.0, 500.0, 700.0 },
				{ 200.0, 600.0, 1000.0, 1400.0 } };

		final double[][] duplicate = new double[][] {
				{ 1000.0, 960.0, 540.0, 70.0, 540.0 },
				{ 100.0, 1800.0, 950.0, 150.0, 950.0 } };

		for ( final double scale : new double[] { 1e-3, 1.0, 1e3 } )
		{
			solver.checkGeometry( canvasLandmarks( scale ) );

			assertRejected( scaled( collinear, scale ) );
			assertRejected( scaled( duplicate, scale ) );
		}
	}

	private static ControlPointSet scaled( final double[][] basis, final double scale )
	{
		final int n = basis[ 0 ].length;
		final double[][] scaledBasis = new double[ 2 ][ n ];
		for ( int d = 0; d < 2; d++ )
			for ( int i = 0; i < n; i++ )
				scaledBasis[ d ][ i ] = basis[ d ][ i ] * scale;

		return new ControlPointSet( scaledBasis, new double[ 2 ][ n ] );
	}

	private void assertRejected( final ControlPointSet pts )
	{
		try
		{
			solver.checkGeometry( pts );
			fail( "expected degenerate landmarks to be rejected" );
		}
		catch ( final SingularSystemException e )
		{
			assertThat( e.getDegeneracy(), lessThanOrEqualTo( SplineSolver.DEFAULT_TOLERANCE ) );
		}
	}

	@Test
	public void testRelativeResidual()
	{
		final DMatrixRMaj l = new DMatrixRMaj( new double[][] {
				{ 2.0, 1.0 },
				{ 1.0, 3.0 } } );
		final DMatrixRMaj w = new DMatrixRMaj( new double[][] { { 1.0 }, { 2.0 } } );
		final DMatrixRMaj y = new DMatrixRMaj( new double[][] { { 4.0 }, { 7.0 } } );
		assertEquals( 0.0, SplineSolver.relativeResidual( l, w, y ), 0.0 );

		final DMatrixRMaj wrong = new DMatrixRMaj( new double[][] { { 1.0 }, { 1.0 } } );
		assertThat( SplineSolver.relativeResidual( l, wrong, y ), greaterThan( 0.1 ) );

		assertEquals( 0.0, SplineSolver.relativeResidual( l, new DMatrixRMaj( 2, 1 ), new DMatrixRMaj( 2, 1 ) ), 0.0 );
	}

	@Test
	public void testReciprocalCondition()
	{
		final DMatrixRMaj scaledIdentity = new DMatrixRMaj( new double[][] {
				{ 2.0, 0.0 },
				{ 0.0, 2.0 } } );
		assertEquals( 1.0, SplineSolver.reciprocalCondition( scaledIdentity ), 1e-12 );

		final DMatrixRMaj rankOne = new DMatrixRMaj( new double[][] {
				{ 1.0, 2.0 },
				{ 2.0, 4.0 } } );
		assertThat( SplineSolver.reciprocalCondition( rankOne ), lessThan( 1e-12 ) );

		assertEquals( 0.0, SplineSolver.reciprocalCondition( new DMatrixRMaj( 3, 3 ) ), 0.0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNegativeTolerance()
	{
		new SplineSolver( -1 );
	}

}
