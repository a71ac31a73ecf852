/*
 * Copyright 2014 Tyler Ward.
 *
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
 */
package edu.columbia.tjw.gprn;

/**
 * Thrown for parameter values a mean function cannot be evaluated with, such
 * as an eccentricity outside [0, 1) or a non-positive period.
 *
 * @author tyler
 */
public class InvalidParameterException extends MeanFunctionException
{
    private static final long serialVersionUID = 0x6e0d8a41f27c93b5L;

    public InvalidParameterException(final String message_)
    {
        super(message_);
    }
}
