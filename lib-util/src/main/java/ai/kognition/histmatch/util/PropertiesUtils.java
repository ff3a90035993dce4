/***********************************************************************
 * Legacy Film to DVD Project
 * Copyright (C) 2005 James F. Carroll
 * 
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 51 Franklin St, Fifth Floor, Boston, MA 02110-1301 USA
 ****************************************************************************/

package ai.kognition.histmatch.util;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Select all of the properties that start with {@code sectionName + "."}. When
     * {@code removeSectionName} is set the prefix is stripped from the keys of the result.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final String key: props.stringPropertyNames()) {
            if(key.startsWith(prefix)) {
                final String newkey = removeSectionName ? key.substring(prefix.length()) : key;
                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName)
                ret.setProperty(key, props.getProperty(key));
        }

        return ret;
    }

    /**
     * Load the UTF-8 properties file into {@code p}. Returns false, rather than throwing, if
     * the file can't be read.
     */
    public static boolean loadProps(final Properties p, final String fname) {
        try(Reader reader = new InputStreamReader(new FileInputStream(fname), StandardCharsets.UTF_8);) {
            p.load(reader);
        } catch(final IOException ioe) {
            LOGGER.warn("Couldn't load properties from {}", fname, ioe);
            return false;
        }

        LOGGER.debug("Loaded {} properties from {}", p.size(), fname);
        return true;
    }

    public static boolean getBoolean(final Properties p, final String key, final boolean defaultValue) {
        final String val = p.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public static String getString(final Properties p, final String key, final String defaultValue) {
        final String val = p.getProperty(key);
        return val == null ? defaultValue : val.trim();
    }

    /**
     * Write the properties as UTF-8, sorted by key, with {@code comment} as a header line.
     * Keys and values are escaped so {@link #loadProps(Properties, String)} reads back
     * exactly what was written.
     */
    public static void saveProps(final Properties p, final String fname, final String comment) throws IOException {
        final List<String> keys = new ArrayList<>(p.stringPropertyNames());
        Collections.sort(keys);

        try(PrintStream os = new PrintStream(new FileOutputStream(fname), false, StandardCharsets.UTF_8.name());) {
            os.println("# " + comment);
            os.println();
            for(final String key: keys)
                os.println(escape(key, true) + "=" + escape(p.getProperty(key), false));
            os.flush();
            if(os.checkError())
                throw new IOException("Failed writing properties to " + fname);
        }
    }

    private static String escape(final String str, final boolean isKey) {
        final StringBuilder sb = new StringBuilder(str.length() * 2);
        for(int i = 0; i < str.length(); i++) {
            final char c = str.charAt(i);
            switch(c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case ' ':
                    // the loader ends a key at a space and strips leading value whitespace
                    if(isKey || i == 0)
                        sb.append('\\');
                    sb.append(c);
                    break;
                case '=':
                case ':':
                case '#':
                case '!':
                    sb.append('\\').append(c);
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
