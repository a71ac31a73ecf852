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
 * Thrown when a parameter vector is shorter than a mean function requires, or
 * when the number of supplied values disagrees with the derived count.
 *
 * @author tyler
 */
public class ParameterCountException extends MeanFunctionException
{
    private static final long serialVersionUID = 0x19b2e07c5a3f4d12L;

    private final int _expected;
    private final int _actual;

    public ParameterCountException(final String name_, final int expected_, final int actual_)
    {
        super("Wrong number of parameters for " + name_ + ", expected " + expected_ + " got " + actual_);
        _expected = expected_;
        _actual = actual_;
    }

    public int getExpected()
    {
        return _expected;
    }

    public int getActual()
    {
        return _actual;
    }
}
