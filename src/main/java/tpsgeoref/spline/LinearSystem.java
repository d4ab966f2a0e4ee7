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

import org.ejml.data.DMatrixRMaj;

/**
 * The assembled thin plate spline system L W = Y.
 * <p>
 * L is (N+3)x(N+3), Y is (N+3)x2.
 */
public class LinearSystem
{
	private final ControlPointSet controlPoints;

	private final DMatrixRMaj lMatrix;

	private final DMatrixRMaj yMatrix;

	public LinearSystem( final ControlPointSet controlPoints, final DMatrixRMaj lMatrix, final DMatrixRMaj yMatrix )
	{
		this.controlPoints = controlPoints;
		this.lMatrix = lMatrix;
		this.yMatrix = yMatrix;
	}

	public ControlPointSet getControlPoints()
	{
		return controlPoints;
	}

	public DMatrixRMaj getL()
	{
		return lMatrix;
	}

	public DMatrixRMaj getY()
	{
		return yMatrix;
	}

	public int getNumLandmarks()
	{
		return controlPoints.getNumLandmarks();
	}

}
