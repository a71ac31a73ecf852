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
 * Base class of the errors raised by mean functions. These are thrown at the
 * point of detection and never retried internally.
 *
 * @author tyler
 */
public class MeanFunctionException extends IllegalArgumentException
{
    private static final long serialVersionUID = 0x4c1e9f3a27d5b681L;

    public MeanFunctionException(final String message_)
    {
        super(message_);
    }

    public MeanFunctionException(final String message_, final Throwable cause_)
    {
        super(message_, cause_);
    }
}
