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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The complete per-pixel lookup table of a canvas, stored column-wise and
 * read back as {@link LookupRow}s in grid enumeration order.
 */
public class LookupTable implements Iterable< LookupRow >
{
	private final int width;

	private final int height;

	private final double[] x;

	private final double[] y;

	private final int[] u;

	private final int[] v;

	public LookupTable( final int width, final int height,
			final double[] x, final double[] y, final int[] u, final int[] v )
	{
		final int n = x.length;
		if ( ( long ) width * height != n || y.length != n || u.length != n || v.length != n )
			throw new IllegalArgumentException( "lookup table columns must all have "
					+ ( ( long ) width * height ) + " entries" );

		this.width = width;
		this.height = height;
		this.x = x;
		this.y = y;
		this.u = u;
		this.v = v;
	}

	public int getWidth()
	{
		return width;
	}

	public int getHeight()
	{
		return height;
	}

	public int size()
	{
		return x.length;
	}

	public LookupRow get( final int k )
	{
		return new LookupRow( x[ k ], y[ k ], u[ k ], v[ k ] );
	}

	@Override
	public Iterator< LookupRow > iterator()
	{
		return new Iterator< LookupRow >()
		{
			private int k = 0;

			@Override
			public boolean hasNext()
			{
				return k < x.length;
			}

			@Override
			public LookupRow next()
			{
				if ( !hasNext() )
					throw new NoSuchElementException();

				return get( k++ );
			}
		};
	}

}
