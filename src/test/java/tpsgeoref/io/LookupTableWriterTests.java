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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import tpsgeoref.georef.LookupTable;

public class LookupTableWriterTests
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static LookupTable table()
	{
		// width 2, height 2
		return new LookupTable( 2, 2,
				new double[] { 1.5, -0.25, 1234.123456789, 1.0 / 3.0 },
				new double[] { 2.0, 0.0, -7.0000000004, 2.0 / 3.0 },
				new int[] { 1, 1, 2, 2 },
				new int[] { 1, 2, 1, 2 } );
	}

	@Test
	public void testFormat() throws IOException
	{
		final StringBuilder out = new StringBuilder();
		new LookupTableWriter().write( table(), out );

		final String expected =
				"x,y,u,v\n" +
				"1.500000000,2.000000000,1,1\n" +
				"-0.250000000,0.000000000,1,2\n" +
				"1234.123456789,-7.000000000,2,1\n" +
				"0.333333333,0.666666667,2,2\n";

		assertEquals( expected, out.toString() );
	}

	@Test
	public void testFormatCoordinate()
	{
		assertEquals( "0.000000000", LookupTableWriter.formatCoordinate( 0.0 ) );
		assertEquals( "-1.000000001", LookupTableWriter.formatCoordinate( -1.000000001 ) );
		assertEquals( "1920.500000000", LookupTableWriter.formatCoordinate( 1920.5 ) );
	}

	@Test
	public void testWriteFile() throws IOException
	{
		final File dir = folder.newFolder( "out" );
		final Path output = dir.toPath().resolve( "tps.csv" );

		// existing content is replaced
		Files.write( output, "stale".getBytes( StandardCharsets.UTF_8 ) );

		new LookupTableWriter().write( table(), output );

		final List< String > lines = Files.readAllLines( output, StandardCharsets.UTF_8 );
		assertThat( lines.size(), is( 5 ) );
		assertThat( lines.get( 0 ), is( "x,y,u,v" ) );
		assertThat( lines.get( 4 ), is( "0.333333333,0.666666667,2,2" ) );

		// no temporary files are left behind
		final String[] names = dir.list();
		assertThat( names.length, is( 1 ) );
		assertThat( names[ 0 ], is( "tps.csv" ) );
	}

	@Test( expected = IOException.class )
	public void testMissingDirectory() throws IOException
	{
		final Path output = folder.getRoot().toPath().resolve( "missing" ).resolve( "tps.csv" );
		new LookupTableWriter().write( table(), output );
	}

}
