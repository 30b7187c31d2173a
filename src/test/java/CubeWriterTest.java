/**
 **
 ** CubeWriterTest.java - tests for writing the spectral cube
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CubeWriterTest.java is free software: you can redistribute it and/or modify
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

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.junit.Assert.assertThat;

import java.io.File;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;

public class CubeWriterTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static SpectralCube cube()
    {
        SpectralCube cube = new SpectralCube(2, 8, 0.01, null);
        cube.addImage(SpectralCubeTest.composite(8, "800E-9", 1.0));
        cube.addImage(SpectralCubeTest.composite(8, "1000E-9", 0.5));
        return cube;
    }

    @Test
    public void testStackHasOnePlanePerWavelength()
    {
        ImagePlus imp = CubeWriter.toImagePlus(cube(), "cube");
        assertThat(imp.getStackSize(), equalTo(2));
        assertThat(imp.getWidth(), equalTo(8));
        assertThat(imp.getStack().getSliceLabel(1), equalTo("800nm"));
        assertThat(imp.getStack().getSliceLabel(2), equalTo("1000nm"));
        assertThat((double) imp.getStack().getProcessor(2).getf(3, 3), closeTo(0.25, 1E-7));
        assertThat(imp.getCalibration().getUnit(), equalTo("arcsec"));
        assertThat(imp.getCalibration().pixelWidth, equalTo(0.01));
        assertThat((String) imp.getProperty("Info"), containsString("WAVE2 = 0.000001000"));
    }

    @Test
    public void testWriteTiffStack() throws IOException
    {
        File file = new File(folder.getRoot(), "cube.tif");
        new CubeWriter(new ConsoleDiagnostics(0)).write(cube(), file.getPath());
        assertThat(file.exists(), is(true));
        ImagePlus imp = CubeWriter.read(file.getPath());
        assertThat(imp, is(notNullValue()));
        assertThat(imp.getStackSize(), equalTo(2));
        assertThat(imp.getWidth(), equalTo(8));
        assertThat((double) imp.getStack().getProcessor(1).getf(0, 0), closeTo(1.0, 1E-7));
        assertThat((double) imp.getStack().getProcessor(2).getf(7, 7), closeTo(0.25, 1E-7));
    }

    @Test
    public void testIncompleteCubeIsNotWritten() throws IOException
    {
        SpectralCube cube = new SpectralCube(2, 8, 0.01, null);
        cube.addImage(SpectralCubeTest.composite(8, "800E-9", 1.0));
        exception.expect(IllegalStateException.class);
        new CubeWriter(new ConsoleDiagnostics(0)).write(cube, new File(folder.getRoot(), "cube.tif").getPath());
    }
}
