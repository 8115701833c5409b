/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.rbjs.rbCompiler.compiler;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

/** Target feature level of the generated program, ordered from oldest to newest. */
public enum EsLevel {
    ES5(2009),
    ES2015(2015),
    ES2016(2016),
    ES2017(2017),
    ES2018(2018),
    ES2019(2019),
    ES2020(2020),
    ES2021(2021),
    ES2022(2022),
    ES2023(2023),
    ES2024(2024),
    ES2025(2025);

    public final int year;

    EsLevel(int year) {
        this.year = year;
    }

    public boolean atLeast(EsLevel other) {
        return this.compareTo(other) >= 0;
    }

    /** The level for a year such as 2020, or a level number such as 5 or 11. */
    public static EsLevel fromYear(int year) {
        if (year == 5)
            return ES5;
        if (year >= 6 && year <= 16)
            year += 2009;
        for (EsLevel level: values())
            if (level.year == year)
                return level;
        throw new IllegalArgumentException("Unsupported target level " + year);
    }

    @Override
    public String toString() {
        return this == ES5 ? "ES5" : "ES" + this.year;
    }

    /** Converts command-line arguments such as "2020" or "es2020". */
    public static class Converter implements IStringConverter<EsLevel> {
        @Override
        public EsLevel convert(String value) {
            String digits = value.toLowerCase().startsWith("es") ? value.substring(2) : value;
            try {
                return fromYear(Integer.parseInt(digits));
            } catch (IllegalArgumentException ex) {
                throw new ParameterException("Illegal target level " + value + ": " + ex.getMessage());
            }
        }
    }
}
