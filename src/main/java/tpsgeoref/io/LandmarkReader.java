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

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tpsgeoref.georef.Landmark;

/**
 * Reads landmarks from a comma separated points file.
 * <p>
 * The first record is a header and is skipped, lines starting with '#' are
 * comments. Every other record holds x, y, u, v, enable. Trailing columns
 * after these five (the residual columns some tools append) are ignored.
 */
public class LandmarkReader
{
	public static final int NCOLUMNS = 5;

	public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setCommentMarker( '#' )
			.setIgnoreEmptyLines( true )
			.setIgnoreSurroundingSpaces( true )
			.build();

	private static final String[] COLUMN_NAMES = { "x", "y", "u", "v", "enable" };

	protected static Logger logger = LoggerFactory.getLogger( LandmarkReader.class );

	public List< Landmark > read( final Path path ) throws IOException
	{
		try ( final Reader reader = Files.newBufferedReader( path, StandardCharsets.UTF_8 ) )
		{
			final List< Landmark > landmarks = read( reader, path.toString() );
			logger.info( "read: loaded {} landmarks from {}", landmarks.size(), path );
			return landmarks;
		}
	}

	/**
	 * @param reader source of the points table, not closed by this method
	 * @param sourceName name used in error messages
	 * @return landmarks in file order
	 * @throws MalformedLandmarkFileException if a record is short or not
	 *             numeric
	 * @throws IOException if reading fails
	 */
	public List< Landmark > read( final Reader reader, final String sourceName ) throws IOException
	{
		final List< Landmark > landmarks = new ArrayList<>();

		final FailureRecordingReader source = new FailureRecordingReader( reader );
		final CSVParser parser = FORMAT.parse( source );
		boolean headerSkipped = false;
		try
		{
			for ( final CSVRecord record : parser )
			{
				if ( !headerSkipped )
				{
					headerSkipped = true;
					logger.debug( "read: skipping header {}", record );
					continue;
				}

				landmarks.add( parseRecord( record, sourceName ) );
			}
		}
		catch ( final UncheckedIOException | IllegalStateException e )
		{
			final IOException failure = source.getFailure();
			if ( failure != null && e.getCause() == failure )
				throw failure;

			// raised by the lexer, e.g. an unterminated quote
			throw new MalformedLandmarkFileException( sourceName, parser.getRecordNumber() + 1, e.getMessage(), e );
		}

		return landmarks;
	}

	protected Landmark parseRecord( final CSVRecord record, final String sourceName )
			throws MalformedLandmarkFileException
	{
		if ( record.size() < NCOLUMNS )
			throw new MalformedLandmarkFileException( sourceName, record.getRecordNumber(),
					"expected " + NCOLUMNS + " columns (x, y, u, v, enable) but found " + record.size() );

		final double[] values = new double[ NCOLUMNS ];
		for ( int c = 0; c < NCOLUMNS; c++ )
		{
			final String value = record.get( c );
			try
			{
				values[ c ] = Double.parseDouble( value );
			}
			catch ( final NumberFormatException e )
			{
				throw new MalformedLandmarkFileException( sourceName, record.getRecordNumber(),
						"column " + COLUMN_NAMES[ c ] + " is not numeric: '" + value + "'", e );
			}

			if ( !Double.isFinite( values[ c ] ) )
				throw new MalformedLandmarkFileException( sourceName, record.getRecordNumber(),
						"column " + COLUMN_NAMES[ c ] + " is not finite: '" + value + "'" );
		}

		return new Landmark( values[ 0 ], values[ 1 ], values[ 2 ], values[ 3 ], values[ 4 ] != 0 );
	}

	/**
	 * Remembers the last exception thrown by the wrapped reader, so that read
	 * failures can be told apart from syntax errors once the parser has
	 * wrapped both.
	 */
	private static class FailureRecordingReader extends FilterReader
	{
		private IOException failure;

		FailureRecordingReader( final Reader in )
		{
			super( in );
		}

		IOException getFailure()
		{
			return failure;
		}

		@Override
		public int read() throws IOException
		{
			try
			{
				return super.read();
			}
			catch ( final IOException e )
			{
				failure = e;
				throw e;
			}
		}

		@Override
		public int read( final char[] cbuf, final int off, final int len ) throws IOException
		{
			try
			{
				return super.read( cbuf, off, len );
			}
			catch ( final IOException e )
			{
				failure = e;
				throw e;
			}
		}
	}

}
