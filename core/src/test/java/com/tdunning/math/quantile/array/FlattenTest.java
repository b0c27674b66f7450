/*
 * Licensed to Ted Dunning under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tdunning.math.quantile.array;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class FlattenTest {
    @Test
    public void testIsCollection() {
        assertTrue(Flatten.isCollection(Collections.emptyList()));
        assertTrue(Flatten.isCollection(new Object[0]));
        assertTrue(Flatten.isCollection(new double[0]));
        assertTrue(Flatten.isCollection(new int[0]));
        assertTrue(Flatten.isCollection(new long[0]));
        assertTrue(Flatten.isCollection(new float[0]));
        assertTrue(Flatten.isCollection(new double[0][0]));
        assertTrue(Flatten.isCollection(new DenseMatrix(Arrays.asList(1, 2))));
        assertFalse(Flatten.isCollection(null));
        assertFalse(Flatten.isCollection("[1, 2]"));
        assertFalse(Flatten.isCollection(3.0));
        assertFalse(Flatten.isCollection(Collections.singleton(1)));
    }

    @Test
    public void testDepthFirstOrder() {
        Object nested = Arrays.asList(1, Arrays.asList(2, Arrays.asList(3, 4)), new int[]{5, 6}, 7);
        assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6, 7), Flatten.flatten(nested));

        double[][] grid = {{1, 2}, {3, 4}};
        assertEquals(Arrays.asList(1.0, 2.0, 3.0, 4.0), Flatten.flatten(grid));

        DenseMatrix m = new DenseMatrix(new long[][]{{1, 2}, {3, 4}});
        assertEquals(Arrays.asList(1L, 2L, 3L, 4L), Flatten.flatten(m));
    }

    @Test
    public void testFlattenCopies() {
        List<Double> data = Arrays.asList(3.0, 1.0, 2.0);
        List<Object> flat = Flatten.flatten(data);
        assertNotSame(data, flat);
        flat.set(0, 42.0);
        assertEquals(3.0, data.get(0), 0);
    }

    @Test
    public void testEmpty() {
        assertTrue(Flatten.flatten(Collections.emptyList()).isEmpty());
        assertTrue(Flatten.flatten(Arrays.asList(Collections.emptyList(), new double[0])).isEmpty());
    }

    @Test
    public void testToNestedList() {
        Object r = Flatten.toNestedList(new double[][]{{1, 2}, {3, 4}});
        assertEquals(Arrays.asList(Arrays.asList(1.0, 2.0), Arrays.asList(3.0, 4.0)), r);
        assertEquals(5, Flatten.toNestedList(5));
    }
}
