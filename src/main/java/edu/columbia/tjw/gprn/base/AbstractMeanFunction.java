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
package edu.columbia.tjw.gprn.base;

import edu.columbia.tjw.gprn.InvalidParameterException;
import edu.columbia.tjw.gprn.MeanFunction;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.ParameterCountException;
import edu.columbia.tjw.gprn.util.MathFunctions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A leaf mean function that stores its own parameter vector.
 *
 * @author tyler
 */
public abstract class AbstractMeanFunction implements MeanFunction
{
    private final MeanFunctionType _type;
    private final List<String> _paramNames;

    //Replaced wholesale on update, so an evaluation sees either the old or the new vector.
    private double[] _params;

    protected AbstractMeanFunction(final MeanFunctionType type_, final List<String> paramNames_, final double[] params_)
    {
        this(type_, paramNames_, params_, true);
    }

    /**
     * @param type_ The type of this function
     * @param paramNames_ One name per parameter
     * @param params_ The starting parameters, copied
     * @param validate_ False only for placeholder instances that are expected
     * to be overwritten before they are evaluated
     */
    protected AbstractMeanFunction(final MeanFunctionType type_, final List<String> paramNames_, final double[] params_,
            final boolean validate_)
    {
        if (null == type_)
        {
            throw new NullPointerException("Type cannot be null.");
        }
        if (paramNames_.size() != params_.length)
        {
            throw new ParameterCountException(this.getClass().getSimpleName(), paramNames_.size(), params_.length);
        }

        _type = type_;
        _paramNames = Collections.unmodifiableList(new ArrayList<>(paramNames_));

        final double[] params = params_.clone();

        if (validate_)
        {
            validate(params);
        }

        _params = params;
    }

    /**
     * Checks a candidate parameter vector before it is accepted. The default
     * implementation requires every value to be finite.
     *
     * @param params_ The candidate parameters, of length getParamCount()
     * @throws InvalidParameterException If the parameters are unusable
     */
    protected void validate(final double[] params_)
    {
        for (int i = 0; i < params_.length; i++)
        {
            if (!MathFunctions.isWellDefined(params_[i]))
            {
                throw new InvalidParameterException("Invalid " + _paramNames.get(i) + " for "
                        + this.getClass().getSimpleName() + ": " + params_[i]);
            }
        }
    }

    /**
     * The live parameter vector, for use by evaluate. Must not be modified.
     *
     * @return The current parameters, not copied
     */
    protected final double[] params()
    {
        return _params;
    }

    public final double getParam(final int index_)
    {
        return _params[index_];
    }

    @Override
    public final double[] getParameters()
    {
        return _params.clone();
    }

    @Override
    public final double[] setParameters(final double[] stream_)
    {
        if (null == stream_)
        {
            throw new NullPointerException("Parameter stream cannot be null.");
        }

        final int count = getParamCount();

        if (stream_.length < count)
        {
            throw new ParameterCountException(this.getClass().getSimpleName(), count, stream_.length);
        }

        final double[] candidate = Arrays.copyOf(stream_, count);
        validate(candidate);
        _params = candidate;

        final double[] remainder = Arrays.copyOfRange(stream_, count, stream_.length);
        return remainder;
    }

    @Override
    public final int getParamCount()
    {
        return _paramNames.size();
    }

    @Override
    public final List<String> getParamNames()
    {
        return _paramNames;
    }

    @Override
    public final MeanFunctionType getType()
    {
        return _type;
    }

    @Override
    public String toString()
    {
        final StringBuilder builder = new StringBuilder();
        builder.append(this.getClass().getSimpleName());
        builder.append("(");

        final double[] params = _params;

        for (int i = 0; i < params.length; i++)
        {
            if (i != 0)
            {
                builder.append(", ");
            }

            builder.append(params[i]);
        }

        builder.append(")");
        return builder.toString();
    }

}
