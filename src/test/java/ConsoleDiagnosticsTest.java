/**
 **
 ** ConsoleDiagnosticsTest.java - tests for console diagnostics
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ConsoleDiagnosticsTest.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.Test;

public class ConsoleDiagnosticsTest
{
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ConsoleDiagnostics diagnostics(int debugLevel)
    {
        return new ConsoleDiagnostics(debugLevel, new PrintStream(out, true), new PrintStream(err, true));
    }

    @Test
    public void testDefaultLevelHidesDebug()
    {
        ConsoleDiagnostics diagnostics = diagnostics(1);
        diagnostics.debug(" hidden");
        diagnostics.info(" shown");
        diagnostics.warning(" careful");
        assertThat(out.toString(), not(containsString("hidden")));
        assertThat(out.toString(), containsString("INFO: shown"));
        assertThat(err.toString(), containsString("WARNING: careful"));
    }

    @Test
    public void testVerboseLevelShowsDebug()
    {
        ConsoleDiagnostics diagnostics = diagnostics(2);
        diagnostics.debug(" Beginning simulation");
        assertThat(out.toString(), containsString("DEBUG: Beginning simulation"));
        assertThat(diagnostics.getDebugLevel(), equalTo(2));
    }

    @Test
    public void testCriticalIsAlwaysShown()
    {
        ConsoleDiagnostics diagnostics = diagnostics(0);
        diagnostics.info(" quiet");
        diagnostics.warning(" quiet");
        diagnostics.critical(" Number of slices should be odd!");
        assertThat(out.toString(), equalTo(""));
        assertThat(err.toString(), containsString("CRITICAL: Number of slices should be odd!"));
        assertThat(err.toString(), not(containsString("quiet")));
    }
}
