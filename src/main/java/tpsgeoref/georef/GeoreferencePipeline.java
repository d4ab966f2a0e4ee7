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
import tpsgeoref.spline.GridEvaluator;
import tpsgeoref.spline.LinearSystem;
import tpsgeoref.spline.LinearSystemAssembler;
import tpsgeoref.spline.SplineSolver;
import tpsgeoref.spline.ThinPlateSpline;
import tpsgeoref.spline.WarpedGrid;

/**
 * Fits a thin plate spline to landmarks and maps every pixel of a canvas
 * through it.
 */
public class GeoreferencePipeline
{
	protected static Logger logger = LoggerFactory.getLogger( GeoreferencePipeline.class );

	private final LinearSystemAssembler assembler;

	private final SplineSolver solver;

	private final GridEvaluator evaluator;

	public GeoreferencePipeline()
	{
		this( new LinearSystemAssembler(), new SplineSolver(), new GridEvaluator() );
	}

	public GeoreferencePipeline( final LinearSystemAssembler assembler, final SplineSolver solver,
			final GridEvaluator evaluator )
	{
		this.assembler = assembler;
		this.solver = solver;
		this.evaluator = evaluator;
	}

	/**
	 * Runs with the canvas height as flip height.
	 */
	public LookupTable run( final List< Landmark > landmarks, final int width, final int height )
	{
		return run( landmarks, width, height, new CoordinateTransform( height ) );
	}

	/**
	 * @param landmarks the correspondences, all of which are used
	 * @param width canvas width
	 * @param height canvas height
	 * @param transform pixel to mathematical frame conversion for this canvas
	 * @return one lookup row per canvas pixel
	 */
	public LookupTable run( final List< Landmark > landmarks, final int width, final int height,
			final CoordinateTransform transform )
	{
		logger.info( "run: start crunching data, {} landmarks, {}x{} canvas", landmarks.size(), width, height );

		final ThinPlateSpline tps = fit( landmarks, transform );
		logger.info( "run: system solved" );

		final WarpedGrid grid = evaluator.evaluate( tps, height, width );
		logger.info( "run: mapped all {} points of the canvas", grid.size() );

		final LookupTable table = new ResultAssembler( transform ).assemble( grid );
		logger.info( "run: warp computed, {} lookup rows", table.size() );

		return table;
	}

	public ThinPlateSpline fit( final List< Landmark > landmarks, final CoordinateTransform transform )
	{
		LinearSystemAssembler.checkLandmarkCount( landmarks.size() );

		final long disabled = landmarks.stream().filter( l -> !l.isEnabled() ).count();
		if ( disabled > 0 )
			logger.debug( "fit: {} disabled landmarks are included in the fit", disabled );

		final ControlPointSet controlPoints = transform.toControlPoints( landmarks );
		final LinearSystem system = assembler.assemble( controlPoints );
		return solver.solve( system );
	}

}
