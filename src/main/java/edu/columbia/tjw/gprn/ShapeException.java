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
 * Thrown when arrays that must line up have incompatible lengths.
 *
 * @author tyler
 */
public class ShapeException extends MeanFunctionException
{
    private static final long serialVersionUID = 0x2a7f51c0d9e3b648L;

    public ShapeException(final String message_)
    {
        super(message_);
    }

    public ShapeException(final String name_, final int expected_, final int actual_)
    {
        this("Length mismatch in " + name_ + ": " + actual_ + " != " + expected_);
    }
}
