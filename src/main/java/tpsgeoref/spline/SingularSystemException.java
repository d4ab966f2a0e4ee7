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
 * Thrown when the thin plate spline system matrix is singular or cannot be
 * solved accurately, which happens for collinear or duplicated landmarks.
 */
public class SingularSystemException extends IllegalStateException
{

	private static final long serialVersionUID = -2838431650712903391L;

	private final double degeneracy;

	public SingularSystemException( final String message, final double degeneracy )
	{
		super( message );
		this.degeneracy = degeneracy;
	}

	/**
	 * @return the scale free measure that failed its check (relative spread
	 *         of the landmarks, relative separation of the closest pair, or
	 *         relative residual of the solve), NaN when none applies
	 */
	public double getDegeneracy()
	{
		return degeneracy;
	}

}
