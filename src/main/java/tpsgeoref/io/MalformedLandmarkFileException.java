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

import java.io.IOException;

/**
 * Thrown when a points file does not parse into landmark records.
 */
public class MalformedLandmarkFileException extends IOException
{

	private static final long serialVersionUID = 7780421356916287714L;

	private final String source;

	private final long recordNumber;

	public MalformedLandmarkFileException( final String source, final long recordNumber, final String message )
	{
		this( source, recordNumber, message, null );
	}

	public MalformedLandmarkFileException( final String source, final long recordNumber, final String message,
			final Throwable cause )
	{
		super( source + ", record " + recordNumber + ": " + message, cause );
		this.source = source;
		this.recordNumber = recordNumber;
	}

	public String getSource()
	{
		return source;
	}

	public long getRecordNumber()
	{
		return recordNumber;
	}

}
