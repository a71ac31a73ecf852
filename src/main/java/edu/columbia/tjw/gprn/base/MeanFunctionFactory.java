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

import edu.columbia.tjw.gprn.MeanFunction;
import edu.columbia.tjw.gprn.MeanFunctionType;
import edu.columbia.tjw.gprn.MeanSettings;
import edu.columbia.tjw.gprn.ParameterCountException;

/**
 * Builds leaf mean functions by type, for callers that only hold a
 * MeanFunctionType and a flat parameter array.
 *
 * Only types with a fixed parameter count can be generated here. A
 * MultiConstant needs its observation context and composites need their
 * children, so those are built directly.
 *
 * @author tyler
 */
public final class MeanFunctionFactory
{
    private final MeanSettings _settings;

    public MeanFunctionFactory()
    {
        this(MeanSettings.getDefault());
    }

    public MeanFunctionFactory(final MeanSettings settings_)
    {
        if (null == settings_)
        {
            throw new NullPointerException("Settings cannot be null.");
        }

        _settings = settings_;
    }

    /**
     * Generates a mean function from params_[offset_ .. offset_ + count).
     *
     * @param type_ The type to build
     * @param offset_ Position of the first parameter in params_
     * @param params_ The flat parameter array, not modified
     * @return A new mean function of the given type
     */
    public MeanFunction generate(final MeanFunctionType type_, final int offset_, final double[] params_)
    {
        checkFixed(type_);

        final int count = type_.getParamCount();

        if (offset_ < 0 || params_.length - offset_ < count)
        {
            throw new ParameterCountException(type_.toString(), count, Math.max(0, params_.length - offset_));
        }

        switch (type_)
        {
            case CONSTANT:
                return new Constant(params_[offset_]);
            case LINEAR:
                return new Linear(params_[offset_], params_[offset_ + 1]);
            case PARABOLA:
                return new Parabola(params_[offset_], params_[offset_ + 1], params_[offset_ + 2]);
            case CUBIC:
                return new Cubic(params_[offset_], params_[offset_ + 1], params_[offset_ + 2], params_[offset_ + 3]);
            case SINE:
                return new Sine(params_[offset_], params_[offset_ + 1], params_[offset_ + 2]);
            case KEPLERIAN:
                return new Keplerian(_settings, params_[offset_], params_[offset_ + 1], params_[offset_ + 2],
                        params_[offset_ + 3], params_[offset_ + 4], params_[offset_ + 5]);
            default:
                throw new RuntimeException("Impossible, unknown type: " + type_);
        }
    }

    /**
     * Generates a mean function of the given type with all parameters zero.
     *
     * @param type_ The type to build
     * @return A new zero mean function
     */
    public MeanFunction initialize(final MeanFunctionType type_)
    {
        checkFixed(type_);

        switch (type_)
        {
            case CONSTANT:
                return Constant.initialize();
            case LINEAR:
                return Linear.initialize();
            case PARABOLA:
                return Parabola.initialize();
            case CUBIC:
                return Cubic.initialize();
            case SINE:
                return Sine.initialize();
            case KEPLERIAN:
                return Keplerian.initialize(_settings);
            default:
                throw new RuntimeException("Impossible, unknown type: " + type_);
        }
    }

    private static void checkFixed(final MeanFunctionType type_)
    {
        if (!type_.hasFixedParamCount())
        {
            throw new IllegalArgumentException("Cannot generate " + type_ + " from parameters alone.");
        }
    }
}
