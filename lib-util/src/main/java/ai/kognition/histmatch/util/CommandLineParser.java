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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * <p>
 * Builds a map of option name to option value from a command line. Given:
 * </p>
 *
 * <pre>
 *   java HistMatch -s source.png -r reference.png -parallel extra
 * </pre>
 *
 * <p>
 * the parser will contain {@code s -> source.png}, {@code r -> reference.png} and
 * {@code parallel -> "true"}. Arguments that don't belong to an option ({@code extra}
 * above) are available from {@link #getNonOptionArgs()}.
 * </p>
 *
 * <p>
 * An option followed by another option, or by nothing, is a flag and gets the value
 * {@code "true"}.
 * </p>
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 1599477341664265366L;

    private int argc = 0;
    private final List<String> noargs = new ArrayList<>();

    /**
     * This constructor can handle a null argument list which results in an empty parser.
     */
    public CommandLineParser(final String[] args) {
        parse(args);
    }

    public int getTotalArgCount() {
        return argc;
    }

    public int getOptionCount() {
        return size();
    }

    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(noargs);
    }

    public String getProperty(final String key) {
        return get(key);
    }

    public String getProperty(final String key, final String defaultValue) {
        final String ret = get(key);
        return ret == null ? defaultValue : ret;
    }

    public boolean isSet(final String key) {
        return Boolean.parseBoolean(get(key));
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        argc = args.length;

        for(int i = 0; i < argc; i++) {
            String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(cur.charAt(0) == '-') {
                // strip the dash off of cur
                if(cur.length() > 1)
                    cur = cur.substring(1);

                String val = null;
                if(i + 1 < argc) {
                    val = args[i + 1].trim();
                    if(val.isEmpty() || val.charAt(0) == '-')
                        // then this is not a val ... its the next selection...
                        val = null;
                    else
                        i++;
                }

                put(cur, val == null ? "true" : val);
            } else
                noargs.add(cur);
        }
    }
}
