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

import edu.columbia.tjw.gprn.composite.Product;
import edu.columbia.tjw.gprn.composite.Sum;
import java.util.List;

/**
 * A deterministic trend evaluated over a vector of times, driven by a flat
 * vector of parameters.
 *
 * Evaluation is read-only and may be called from several threads at once,
 * provided no call to setParameters runs concurrently on the same instance.
 * Calls to setParameters must be serialized by the caller.
 *
 * @author tyler
 */
public interface MeanFunction
{

    /**
     * Evaluates this mean function at each of the given times.
     *
     * @param times_ The times of interest, not modified
     * @return A new array of the same length as times_
     */
    public double[] evaluate(final double[] times_);

    /**
     * Evaluates this mean function at a single time, as a one element vector.
     *
     * @param time_ The time of interest
     * @return A one element array
     */
    public default double[] evaluate(final double time_)
    {
        return evaluate(new double[]
        {
            time_
        });
    }

    /**
     * Gets a copy of the current parameters.
     *
     * @return A new array of length getParamCount()
     */
    public double[] getParameters();

    /**
     * Consumes exactly getParamCount() values from the front of stream_ and
     * assigns them to this function, in order.
     *
     * @param stream_ The values to draw from, not modified
     * @return The unconsumed tail of stream_, empty if nothing is left
     * @throws ParameterCountException If stream_ is too short
     * @throws InvalidParameterException If the values are not acceptable, in
     * which case this function is left unchanged
     */
    public double[] setParameters(final double[] stream_);

    public int getParamCount();

    /**
     * Names of the parameters, in the order of getParameters().
     *
     * @return An unmodifiable list of length getParamCount()
     */
    public List<String> getParamNames();

    public MeanFunctionType getType();

    public default MeanFunction plus(final MeanFunction other_)
    {
        return new Sum(this, other_);
    }

    public default MeanFunction times(final MeanFunction other_)
    {
        return new Product(this, other_);
    }

}
