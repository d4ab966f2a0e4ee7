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
 * One landmark correspondence as read from a points file, in pixel
 * coordinates: a point ( x, y ) of the source image and the matching canvas
 * point ( u, v ).
 * <p>
 * The enable flag is carried along but is not used to exclude landmarks from
 * the fit.
 */
public class Landmark
{
	private final double x;

	private final double y;

	private final double u;

	private final double v;

	private final boolean enabled;

	public Landmark( final double x, final double y, final double u, final double v, final boolean enabled )
	{
		this.x = x;
		this.y = y;
		this.u = u;
		this.v = v;
		this.enabled = enabled;
	}

	public Landmark( final double x, final double y, final double u, final double v )
	{
		this( x, y, u, v, true );
	}

	public double getX()
	{
		return x;
	}

	public double getY()
	{
		return y;
	}

	public double getU()
	{
		return u;
	}

	public double getV()
	{
		return v;
	}

	public boolean isEnabled()
	{
		return enabled;
	}

	@Override
	public String toString()
	{
		return "( " + x + ", " + y + " ) <- ( " + u + ", " + v + " )" + ( enabled ? "" : " [disabled]" );
	}

}
