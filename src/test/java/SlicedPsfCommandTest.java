/**
 **
 ** SlicedPsfCommandTest.java - tests for the command line entry point
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SlicedPsfCommandTest.java is free software: you can redistribute it and/or modify
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
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;

public class SlicedPsfCommandTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int execute(String... args)
    {
        return SlicedPsfCommand.execute(args, new PrintStream(out, true), new PrintStream(err, true));
    }

    private File config(String sampling, int nSlices) throws IOException
    {
        return config(sampling, nSlices, 100.0);
    }

    private File config(String sampling, int nSlices, double hfov) throws IOException
    {
        File file = folder.newFile("config.xml");
        FileWriter writer = new FileWriter(file);
        writer.write("<slicedPsf>\n" + "  <debugLevel>1</debugLevel>\n"
                + "  <general><nSlices>" + nSlices + "</nSlices></general>\n"
                + "  <pupil><sampling>" + sampling + "</sampling><gamma>2</gamma></pupil>\n"
                + "  <output><resamplingFactor>2</resamplingFactor><hfov>" + hfov + "</hfov></output>\n"
                + "</slicedPsf>\n");
        writer.close();
        return file;
    }

    @Test
    public void testHelp()
    {
        assertThat(execute("-help"), equalTo(0));
        assertThat(out.toString(), containsString("-fn"));
    }

    @Test
    public void testUnknownOption()
    {
        assertThat(execute("-bogus"), equalTo(1));
        assertThat(err.toString(), containsString("Error:"));
    }

    @Test
    public void testMissingConfiguration()
    {
        assertThat(execute("-c", new File(folder.getRoot(), "missing.xml").getPath()), equalTo(1));
        assertThat(err.toString(), containsString("can not read configuration"));
    }

    @Test
    public void testAbortExitsWithError() throws IOException
    {
        assertThat(execute("-c", config("100", 3).getPath()), equalTo(1));
        assertThat(err.toString(), containsString("CRITICAL: Pupil sampling should be a power of two!"));
    }

    @Test
    public void testEmptyOutputGridExitsWithError() throws IOException
    {
        File cube = new File(folder.getRoot(), "cube.tif");
        assertThat(execute("-c", config("16", 3, 0.001).getPath(), "-f", "-fn", cube.getPath()), equalTo(1));
        assertThat(err.toString(), containsString("CRITICAL: Output half field of view"));
        assertThat(cube.exists(), is(false));
    }

    @Test
    public void testWritesCube() throws IOException
    {
        File cube = new File(folder.getRoot(), "cube.tif");
        assertThat(execute("-c", config("16", 3).getPath(), "-f", "-fn", cube.getPath()), equalTo(0));
        assertThat(cube.exists(), is(true));
        ImagePlus imp = CubeWriter.read(cube.getPath());
        assertThat(imp.getStackSize(), equalTo(1));
        // pupil 16x2 samples; plate scale 1um/(2*8mm) doubled by the resampling factor, +/-100 arcsec
        double pscale = 2 * Pupil.ARCSEC_PER_RADIAN * 1E-6 / (2 * 0.008);
        assertThat(imp.getWidth(), equalTo(Resampler.getOutputSize(pscale, 100.0)));
        assertThat(out.toString(), containsString("Wrote 1 plane cube"));
    }
}
