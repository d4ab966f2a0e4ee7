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
package tpsgeoref.client;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.Parameter;

import tpsgeoref.georef.CoordinateTransform;
import tpsgeoref.georef.GeoreferencePipeline;
import tpsgeoref.georef.Landmark;
import tpsgeoref.georef.LookupTable;
import tpsgeoref.io.LandmarkReader;
import tpsgeoref.io.LookupTableWriter;
import tpsgeoref.spline.GridEvaluator;
import tpsgeoref.spline.LinearSystemAssembler;
import tpsgeoref.spline.SplineSolver;

/**
 * Transforms an image into a georeferenced lookup table: reads landmarks from
 * a points file, fits a thin plate spline and writes, for every pixel of a
 * width x height canvas, the matching source image coordinate.
 * <p>
 * Usage: <code>[input-path] [canvas-width] [canvas-height] [output-path]</code>
 */
public class TpsGeoreferenceClient
{
	public static class Parameters extends CommandLineParameters
	{
		@Parameter(
				description = "<input-path> <canvas-width> <canvas-height> <output-path>",
				required = true )
		public List< String > positional;

		@Parameter(
				names = "--flipHeight",
				description = "Height used to invert the v axis of landmarks (default: canvas height)" )
		public Double flipHeight;

		@Parameter(
				names = "--threads",
				description = "Number of threads evaluating the canvas" )
		public int threads = 1;

		@Parameter(
				names = "--tolerance",
				description = "Smallest accepted relative spread and separation of the landmarks" )
		public double tolerance = SplineSolver.DEFAULT_TOLERANCE;

		@Override
		public void validate() throws IllegalArgumentException
		{
			if ( positional == null || positional.size() != 4 )
				throw new IllegalArgumentException( "expected 4 positional parameters "
						+ "<input-path> <canvas-width> <canvas-height> <output-path> but found "
						+ ( positional == null ? 0 : positional.size() ) );

			getWidth();
			getHeight();

			if ( threads < 1 )
				throw new IllegalArgumentException( "--threads must be at least 1, was " + threads );
		}

		public Path getInputPath()
		{
			return Paths.get( positional.get( 0 ) );
		}

		public int getWidth()
		{
			return parseDimension( "canvas-width", positional.get( 1 ) );
		}

		public int getHeight()
		{
			return parseDimension( "canvas-height", positional.get( 2 ) );
		}

		public Path getOutputPath()
		{
			return Paths.get( positional.get( 3 ) );
		}

		public double getFlipHeight()
		{
			return flipHeight == null ? getHeight() : flipHeight;
		}

		private static int parseDimension( final String name, final String value )
		{
			final int dim;
			try
			{
				dim = Integer.parseInt( value.trim() );
			}
			catch ( final NumberFormatException e )
			{
				throw new IllegalArgumentException( name + " must be an integer, was '" + value + "'", e );
			}

			if ( dim < 1 )
				throw new IllegalArgumentException( name + " must be positive, was " + dim );

			return dim;
		}

		@Override
		public String toString()
		{
			return "{positional=" + positional + ", flipHeight=" + flipHeight + ", threads=" + threads
					+ ", tolerance=" + tolerance + "}";
		}
	}

	public static void main( final String[] args )
	{
		final ClientRunner clientRunner = new ClientRunner( args )
		{
			@Override
			public void runClient( final String[] args ) throws Exception
			{
				final Parameters parameters = new Parameters();
				parameters.parse( args );

				logger.info( "runClient: entry, parameters={}", parameters );

				new TpsGeoreferenceClient( parameters ).run();
			}
		};
		clientRunner.run();
	}

	protected static Logger logger = LoggerFactory.getLogger( TpsGeoreferenceClient.class );

	private final Parameters parameters;

	public TpsGeoreferenceClient( final Parameters parameters ) throws IllegalArgumentException
	{
		this.parameters = parameters;
		parameters.validate();
	}

	public LookupTable buildLookupTable() throws IOException
	{
		final List< Landmark > landmarks = new LandmarkReader().read( parameters.getInputPath() );

		final GeoreferencePipeline pipeline = new GeoreferencePipeline(
				new LinearSystemAssembler(),
				new SplineSolver( parameters.tolerance ),
				new GridEvaluator( parameters.threads ) );

		final CoordinateTransform transform =
				new CoordinateTransform( parameters.getHeight(), parameters.getFlipHeight() );

		return pipeline.run( landmarks, parameters.getWidth(), parameters.getHeight(), transform );
	}

	public void run() throws IOException
	{
		final LookupTable table = buildLookupTable();

		logger.info( "run: write to file..." );
		new LookupTableWriter().write( table, parameters.getOutputPath() );
		logger.info( "run: values written to {}", parameters.getOutputPath() );
	}

}
