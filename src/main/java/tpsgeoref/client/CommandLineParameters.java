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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

/**
 * Base parameters for command line tools.
 */
@Parameters
public class CommandLineParameters
{
	@Parameter(
			names = "--help",
			description = "Display this note",
			help = true )
	public boolean help;

	private JCommander jCommander;

	protected static Logger logger = LoggerFactory.getLogger( CommandLineParameters.class );

	public CommandLineParameters()
	{
		this.help = false;
		this.jCommander = null;
	}

	/**
	 * Parses and validates the arguments, exiting with status 1 if they are
	 * invalid or help was requested.
	 *
	 * @param args the arguments
	 */
	public void parse( final String[] args )
	{
		parse( args, this.getClass().getEnclosingClass(), true );
	}

	/**
	 * @param args the arguments
	 * @param programClass class whose name is shown in the usage note
	 * @param exitOnHelpOrFailure exit the JVM instead of returning false
	 * @return true if the arguments were parsed and validated, false if help
	 *         was requested or they are invalid
	 */
	public boolean parse( final String[] args, final Class< ? > programClass, final boolean exitOnHelpOrFailure )
	{
		jCommander = new JCommander( this );
		jCommander.setProgramName( "java -cp tps-georeference.jar "
				+ ( programClass == null ? getClass().getName() : programClass.getName() ) );

		boolean parseFailed = true;
		try
		{
			jCommander.parse( args );
			if ( !help )
				validate();

			parseFailed = false;
		}
		catch ( final ParameterException | IllegalArgumentException e )
		{
			logger.error( "failed to parse command line arguments: " + e.getMessage() );
		}

		if ( help || parseFailed )
		{
			jCommander.usage();
			if ( exitOnHelpOrFailure )
				System.exit( 1 );

			return false;
		}

		return true;
	}

	/**
	 * Checks what JCommander cannot check on its own.
	 *
	 * @throws IllegalArgumentException if any value is invalid
	 */
	public void validate() throws IllegalArgumentException
	{
	}

	/**
	 * Helper for testing parameter parsing.
	 *
	 * @param parameters parameters instance to test
	 */
	public static void parseHelp( final CommandLineParameters parameters )
	{
		parameters.parse( new String[] { "--help" }, parameters.getClass().getEnclosingClass(), false );
	}

}
