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

/**
 * Command line wrapper that logs unexpected exceptions and overall process
 * completion events, then exits with status 0 on success and 1 on failure.
 * <p>
 * Absence of the exit log message means the process was terminated
 * abnormally.
 */
public abstract class ClientRunner
{
	private final String[] args;

	private static final Logger logger = LoggerFactory.getLogger( ClientRunner.class );

	public ClientRunner( final String[] args )
	{
		this.args = args;
	}

	public void run()
	{
		logger.info( "run: entry" );

		final long startTime = System.currentTimeMillis();
		try
		{
			runClient( args );
			logger.info( "run: exit, processing completed in {}ms", System.currentTimeMillis() - startTime );
			System.exit( 0 );
		}
		catch ( final Throwable t )
		{
			logger.error( "run: caught exception", t );
			logger.info( "run: exit, processing failed after {}ms", System.currentTimeMillis() - startTime );
			System.exit( 1 );
		}
	}

	/**
	 * The wrapped client implementation.
	 *
	 * @param args command line arguments
	 * @throws Exception if the client fails for any reason
	 */
	public abstract void runClient( final String[] args ) throws Exception;

}
