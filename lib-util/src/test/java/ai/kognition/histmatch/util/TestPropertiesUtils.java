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
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestPropertiesUtils {

    @Rule public TemporaryFolder tempDir = new TemporaryFolder();

    @Test
    public void testGetSection() {
        final Properties props = new Properties();
        props.setProperty("histmatch.tiebreak", "last");
        props.setProperty("histmatch.output.suffix", "-x");
        props.setProperty("histmatch", "top");
        props.setProperty("histmatcher.other", "no");
        props.setProperty("other.key", "no");

        final Properties stripped = PropertiesUtils.getSection(props, "histmatch", true);
        assertEquals(2, stripped.size());
        assertEquals("last", stripped.getProperty("tiebreak"));
        assertEquals("-x", stripped.getProperty("output.suffix"));

        final Properties kept = PropertiesUtils.getSection(props, "histmatch", false);
        assertEquals(3, kept.size());
        assertEquals("top", kept.getProperty("histmatch"));
        assertEquals("last", kept.getProperty("histmatch.tiebreak"));
    }

    @Test
    public void testSaveAndLoad() throws Exception {
        final File file = new File(tempDir.getRoot(), "test.properties");
        final Properties props = new Properties();
        props.setProperty("b.key", "2");
        props.setProperty("a.key", "1");
        PropertiesUtils.saveProps(props, file.getAbsolutePath(), "written by test");

        final Properties loaded = new Properties();
        assertTrue(PropertiesUtils.loadProps(loaded, file.getAbsolutePath()));
        assertEquals(props, loaded);
    }

    @Test
    public void testSaveAndLoadEscapedValues() throws Exception {
        final File file = new File(tempDir.getRoot(), "escaped.properties");
        final Properties props = new Properties();
        props.setProperty("histmatch.output.dir", "C:\\out\\x");
        props.setProperty("histmatch.output.suffix", "-gef\u00e4rbt");
        props.setProperty("key with=odd:chars", " #leading space!");
        props.setProperty("multi.line", "one\ntwo\tthree");
        PropertiesUtils.saveProps(props, file.getAbsolutePath(), "written by test");

        final Properties loaded = new Properties();
        assertTrue(PropertiesUtils.loadProps(loaded, file.getAbsolutePath()));
        assertEquals("C:\\out\\x", loaded.getProperty("histmatch.output.dir"));
        assertEquals("-gef\u00e4rbt", loaded.getProperty("histmatch.output.suffix"));
        assertEquals(props, loaded);
    }

    @Test
    public void testLoadMissingFile() {
        final Properties loaded = new Properties();
        assertFalse(PropertiesUtils.loadProps(loaded, new File(tempDir.getRoot(), "nothere.properties").getAbsolutePath()));
        assertTrue(loaded.isEmpty());
    }

    @Test
    public void testTypedGetters() {
        final Properties props = new Properties();
        props.setProperty("flag", " true ");
        props.setProperty("name", " value ");

        assertTrue(PropertiesUtils.getBoolean(props, "flag", false));
        assertFalse(PropertiesUtils.getBoolean(props, "missing", false));
        assertEquals("value", PropertiesUtils.getString(props, "name", "dflt"));
        assertEquals("dflt", PropertiesUtils.getString(props, "missing", "dflt"));
    }
}
