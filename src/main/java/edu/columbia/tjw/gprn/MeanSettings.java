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

import edu.columbia.tjw.gprn.orbit.ConvergenceCheck;

/**
 * Numerical settings for the iterative mean functions.
 *
 * @author tyler
 */
public final class MeanSettings
{
    private static final double DEFAULT_KEPLER_TOLERANCE = 1.0e-10;
    private static final int DEFAULT_KEPLER_MAX_ITERATIONS = 100;
    private static final ConvergenceCheck DEFAULT_CONVERGENCE_CHECK = ConvergenceCheck.SINGLE_PASS;

    private static final MeanSettings DEFAULT = new MeanSettings();

    private final double _keplerTolerance;
    private final int _keplerMaxIterations;

    //How the Kepler solver decides that it is done, see ConvergenceCheck.
    private final ConvergenceCheck _convergenceCheck;

    public MeanSettings()
    {
        _keplerTolerance = DEFAULT_KEPLER_TOLERANCE;
        _keplerMaxIterations = DEFAULT_KEPLER_MAX_ITERATIONS;
        _convergenceCheck = DEFAULT_CONVERGENCE_CHECK;
    }

    public MeanSettings(final MeanSettingsBuilder builder_)
    {
        if (!(builder_.getKeplerTolerance() > 0.0))
        {
            throw new IllegalArgumentException("Tolerance must be positive: " + builder_.getKeplerTolerance());
        }
        if (builder_.getKeplerMaxIterations() < 1)
        {
            throw new IllegalArgumentException("Iteration cap must be positive: " + builder_.getKeplerMaxIterations());
        }
        if (null == builder_.getConvergenceCheck())
        {
            throw new NullPointerException("Convergence check cannot be null.");
        }

        _keplerTolerance = builder_.getKeplerTolerance();
        _keplerMaxIterations = builder_.getKeplerMaxIterations();
        _convergenceCheck = builder_.getConvergenceCheck();
    }

    public static MeanSettings getDefault()
    {
        return DEFAULT;
    }

    public double getKeplerTolerance()
    {
        return _keplerTolerance;
    }

    public int getKeplerMaxIterations()
    {
        return _keplerMaxIterations;
    }

    public ConvergenceCheck getConvergenceCheck()
    {
        return _convergenceCheck;
    }

    public MeanSettingsBuilder makeBuilder()
    {
        return new MeanSettingsBuilder(this);
    }

    @Override
    public String toString()
    {
        return "MeanSettings[" + _keplerTolerance + ", " + _keplerMaxIterations + ", " + _convergenceCheck + "]";
    }

    public static final class MeanSettingsBuilder
    {
        private double _keplerTolerance;
        private int _keplerMaxIterations;
        private ConvergenceCheck _convergenceCheck;

        public MeanSettingsBuilder()
        {
            this(DEFAULT);
        }

        public MeanSettingsBuilder(final MeanSettings base_)
        {
            _keplerTolerance = base_.getKeplerTolerance();
            _keplerMaxIterations = base_.getKeplerMaxIterations();
            _convergenceCheck = base_.getConvergenceCheck();
        }

        public MeanSettings build()
        {
            return new MeanSettings(this);
        }

        public double getKeplerTolerance()
        {
            return _keplerTolerance;
        }

        public int getKeplerMaxIterations()
        {
            return _keplerMaxIterations;
        }

        public ConvergenceCheck getConvergenceCheck()
        {
            return _convergenceCheck;
        }

        public MeanSettingsBuilder setKeplerTolerance(final double keplerTolerance_)
        {
            this._keplerTolerance = keplerTolerance_;
            return this;
        }

        public MeanSettingsBuilder setKeplerMaxIterations(final int keplerMaxIterations_)
        {
            this._keplerMaxIterations = keplerMaxIterations_;
            return this;
        }

        public MeanSettingsBuilder setConvergenceCheck(final ConvergenceCheck convergenceCheck_)
        {
            this._convergenceCheck = convergenceCheck_;
            return this;
        }
    }
}
