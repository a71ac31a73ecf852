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
package edu.columbia.tjw.gprn.util;

import java.util.logging.Logger;

/**
 *
 * @author tyler
 */
public final class LogUtil
{
    private LogUtil()
    {
    }

    public static Logger getLogger(final Class<?> clazz_)
    {
        final String name = clazz_.getName();
        final Logger output = Logger.getLogger(name);
        return output;
    }

    /**
     * Renders at most maxCount_ leading elements of the array, for log
     * messages about long time vectors.
     *
     * @param values_ The values to render
     * @param maxCount_ The maximum number of elements to include
     * @return A bracketed, comma separated rendering of the leading elements
     */
    public static String abbreviate(final double[] values_, final int maxCount_)
    {
        if (null == values_)
        {
            return "null";
        }

        final int count = Math.min(values_.length, maxCount_);
        final StringBuilder builder = new StringBuilder();
        builder.append("[");

        for (int i = 0; i < count; i++)
        {
            if (i != 0)
            {
                builder.append(", ");
            }

            builder.append(values_[i]);
        }

        if (count < values_.length)
        {
            builder.append(", ... (");
            builder.append(values_.length);
            builder.append(" total)");
        }

        builder.append("]");
        return builder.toString();
    }

}
