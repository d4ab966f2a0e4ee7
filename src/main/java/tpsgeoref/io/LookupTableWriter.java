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
package tpsgeoref.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tpsgeoref.georef.LookupRow;
import tpsgeoref.georef.LookupTable;

/**
 * Writes a lookup table as comma separated text with the header x,y,u,v.
 * <p>
 * x and y are written with 9 fractional digits, u and v as integers. The
 * table is written to a temporary file next to the destination and moved
 * into place once complete.
 */
public class LookupTableWriter
{
	public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader( "x", "y", "u", "v" )
			.setRecordSeparator( '\n' )
			.build();

	protected static Logger logger = LoggerFactory.getLogger( LookupTableWriter.class );

	public void write( final LookupTable table, final Path outputPath ) throws IOException
	{
		final Path target = outputPath.toAbsolutePath();
		final Path directory = target.getParent();
		final Path tmp = Files.createTempFile( directory, target.getFileName().toString(), ".tmp" );

		try
		{
			try ( final BufferedWriter writer = Files.newBufferedWriter( tmp, StandardCharsets.UTF_8 ) )
			{
				write( table, writer );
			}
			moveIntoPlace( tmp, target );
		}
		catch ( final IOException | RuntimeException e )
		{
			Files.deleteIfExists( tmp );
			throw e;
		}

		logger.info( "write: saved {} lookup rows in {}", table.size(), target );
	}

	/**
	 * @param table the table
	 * @param out destination, flushed but not closed
	 * @throws IOException if writing fails
	 */
	public void write( final LookupTable table, final Appendable out ) throws IOException
	{
		final CSVPrinter printer = new CSVPrinter( out, FORMAT );
		for ( final LookupRow row : table )
			printer.printRecord( formatCoordinate( row.getX() ), formatCoordinate( row.getY() ),
					Integer.toString( row.getU() ), Integer.toString( row.getV() ) );

		printer.flush();
	}

	public static String formatCoordinate( final double value )
	{
		return String.format( Locale.ROOT, "%.9f", value );
	}

	private static void moveIntoPlace( final Path tmp, final Path target ) throws IOException
	{
		try
		{
			Files.move( tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE );
		}
		catch ( final AtomicMoveNotSupportedException e )
		{
			logger.debug( "moveIntoPlace: atomic move not supported, falling back to a plain move" );
			Files.move( tmp, target, StandardCopyOption.REPLACE_EXISTING );
		}
	}

}
