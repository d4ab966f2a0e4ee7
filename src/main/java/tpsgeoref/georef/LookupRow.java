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

/**
 * One lookup table record: canvas pixel ( u, v ) maps to source image
 * coordinate ( x, y ).
 */
public class LookupRow
{
	private final double x;

	private final double y;

	private final int u;

	private final int v;

	public LookupRow( final double x, final double y, final int u, final int v )
	{
		this.x = x;
		this.y = y;
		this.u = u;
		this.v = v;
	}

	public double getX()
	{
		return x;
	}

	public double getY()
	{
		return y;
	}

	public int getU()
	{
		return u;
	}

	public int getV()
	{
		return v;
	}

	@Override
	public String toString()
	{
		return "( " + u + ", " + v + " ) -> ( " + x + ", " + y + " )";
	}

}
