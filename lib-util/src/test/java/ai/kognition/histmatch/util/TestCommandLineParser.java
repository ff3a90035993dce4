/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.histmatch.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class TestCommandLineParser {

    @Test
    public void testOptionsFlagsAndNonOptions() {
        final CommandLineParser cl = new CommandLineParser(new String[] {"extra","-s","source.png","-parallel","-r","reference.png","-verbose"});

        assertEquals(7, cl.getTotalArgCount());
        assertEquals(4, cl.getOptionCount());
        assertEquals("source.png", cl.getProperty("s"));
        assertEquals("reference.png", cl.getProperty("r"));
        assertEquals("true", cl.getProperty("parallel"));
        assertTrue(cl.isSet("verbose"));
        assertFalse(cl.isSet("missing"));
        assertNull(cl.getProperty("missing"));
        assertEquals("dflt", cl.getProperty("missing", "dflt"));
        assertEquals(List.of("extra"), cl.getNonOptionArgs());
    }

    @Test
    public void testNullArgs() {
        final CommandLineParser cl = new CommandLineParser(null);
        assertEquals(0, cl.getTotalArgCount());
        assertEquals(0, cl.getOptionCount());
        assertTrue(cl.getNonOptionArgs().isEmpty());
    }

    @Test
    public void testDoubleDashKeepsSecondDash() {
        final CommandLineParser cl = new CommandLineParser(new String[] {"--help"});
        assertEquals("true", cl.getProperty("-help"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testNonOptionArgsAreReadOnly() {
        new CommandLineParser(new String[] {"a"}).getNonOptionArgs().add("b");
    }
}
