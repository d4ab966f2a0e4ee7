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
package tpsgeoref.spline;

/**
 * Thrown when fewer landmarks are supplied than the affine part of the thin
 * plate spline needs.
 */
public class InsufficientLandmarksException extends IllegalArgumentException
{

	private static final long serialVersionUID = 4125770954331069437L;

	private final int numLandmarks;

	private final int minLandmarks;

	public InsufficientLandmarksException( final int numLandmarks, final int minLandmarks )
	{
		super( numLandmarks + " landmarks were supplied but at least " + minLandmarks + " are required" );
		this.numLandmarks = numLandmarks;
		this.minLandmarks = minLandmarks;
	}

	public int getNumLandmarks()
	{
		return numLandmarks;
	}

	public int getMinLandmarks()
	{
		return minLandmarks;
	}

}
