/*
 * Copyright 2026 GridPulse contributors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.gridpulse.anomaly.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(100, parser.getNumberOfTrees());
        assertEquals(256, parser.getSampleSize());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(42, parser.getRandomSeed());
    }

    @Test
    public void testParse() {
        parser.parse("--number-of-trees", "222", "--sample-size", "123", "--delimiter", "\t", "--header-row", "true",
                "--random-seed", "7");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(7, parser.getRandomSeed());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-n", "222", "-s", "123", "-d", ";");

        assertEquals(222, parser.getNumberOfTrees());
        assertEquals(123, parser.getSampleSize());
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testDuplicateFlag() {
        assertThrows(IllegalArgumentException.class, () -> parser.addArgument(
                new ArgumentParser.IntegerArgument("-n", "--another-flag", "clashes with --number-of-trees", 1)));
        assertThrows(IllegalArgumentException.class, () -> parser
                .addArgument(new ArgumentParser.IntegerArgument(null, "--sample-size", "clashes", 1)));
    }

    @Test
    public void testHelpMessage() {
        ArgumentParser.IntegerArgument argument = new ArgumentParser.IntegerArgument("-x", "--example",
                "An example.", 3);
        assertEquals("--example, -x: An example. (default: 3)", argument.getHelpMessage());
        ArgumentParser.BooleanArgument longOnly = new ArgumentParser.BooleanArgument(null, "--flag", "A flag.",
                false);
        assertEquals("--flag: A flag. (default: false)", longOnly.getHelpMessage());
    }
}
