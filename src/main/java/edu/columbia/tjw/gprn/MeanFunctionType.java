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
 * The closed set of mean function variants.
 *
 * @author tyler
 */
public enum MeanFunctionType
{
    CONSTANT(1),
    LINEAR(2),
    PARABOLA(3),
    CUBIC(4),
    SINE(3),
    KEPLERIAN(6),
    MULTI_CONSTANT(-1),
    SUM(-1),
    PRODUCT(-1);

    private final int _paramCount;

    private MeanFunctionType(final int paramCount_)
    {
        _paramCount = paramCount_;
    }

    /**
     * True if every instance of this type has the same number of parameters.
     *
     * @return True unless the count depends on the instance
     */
    public boolean hasFixedParamCount()
    {
        return _paramCount >= 0;
    }

    public boolean isComposite()
    {
        return this == SUM || this == PRODUCT;
    }

    /**
     * The parameter count shared by all instances of this type.
     *
     * @return The number of parameters
     * @throws IllegalStateException If the count varies by instance
     */
    public int getParamCount()
    {
        if (!hasFixedParamCount())
        {
            throw new IllegalStateException("Parameter count of " + this + " depends on the instance.");
        }

        return _paramCount;
    }
}
