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
package edu.columbia.tjw.gprn.composite;

import edu.columbia.tjw.gprn.MeanFunction;
import edu.columbia.tjw.gprn.MeanFunctionType;

/**
 * m(t) = left(t) * right(t)
 *
 * @author tyler
 */
public final class Product extends CompositeMeanFunction
{
    public Product(final MeanFunction left_, final MeanFunction right_)
    {
        super(MeanFunctionType.PRODUCT, left_, right_);
    }

    @Override
    protected double combine(final double left_, final double right_)
    {
        return left_ * right_;
    }

    @Override
    protected String getOperator()
    {
        return "*";
    }
}
