/**
 **
 ** SlicedPsfSimulationTest.java - end-to-end tests of the sliced PSF simulation
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SlicedPsfSimulationTest.java is free software: you can redistribute it and/or modify
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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SlicedPsfSimulationTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final SimulationDiagnostics diagnostics = new ConsoleDiagnostics(0);

    private static SlicedPsfParameters smallParameters()
    {
        SlicedPsfParameters parameters = new SlicedPsfParameters();
        parameters.pupil.sampling = "16";
        parameters.pupil.gamma = "2";
        parameters.general.nSlices = 3;
        parameters.general.wavelengthStart = new BigDecimal("1000E-9");
        parameters.general.wavelengthEnd = new BigDecimal("1200E-9");
        parameters.general.wavelengthInterval = new BigDecimal("100E-9");
        parameters.pupil.resampleTo = new BigDecimal("1000E-9");
        return parameters;
    }

    private File writeWfeMaps(int sampling, double value) throws IOException
    {
        File dir = folder.newFolder("wfe");
        int n = 0;
        for (String wave : new String[] { "1.0000", "1.1000", "1.2000" })
        {
            for (double fx : new double[] { -0.1, 0.0, 0.1 })
            {
                WfeFixtures.writeMap(dir, "wfe_" + (n++) + ".txt", wave, "um", fx, 0.0, sampling, value);
            }
        }
        return dir;
    }

    @Test
    public void testSingleWavelengthCube()
    {
        // 256 samples, gamma 4, 5 slices of 1 resolution element, no WFE, 1000 nm
        SlicedPsfParameters parameters = new SlicedPsfParameters();
        SpectralCube cube = new SlicedPsfSimulation(parameters, diagnostics, null).run();
        assertThat(cube.getNumberOfWavelengths(), equalTo(1));
        assertThat(cube.isComplete(), is(true));
        assertThat(cube.getWidth(), equalTo(1024));
        assertThat(cube.getPlane(0).length, equalTo(1024 * 1024));
        assertThat(cube.getWavelength(0).compareTo(new BigDecimal("1E-6")), equalTo(0));
    }

    @Test
    public void testCompositeHasAllSlicesInsideTheBand()
    {
        SlicedPsfParameters parameters = new SlicedPsfParameters();
        SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, null);
        CompositeImage composite = simulation.runWavelength(new BigDecimal("1000E-9"), null);
        assertThat(composite.getNumberOfSlices(), equalTo(5));
        assertThat(composite.getSliceNumbers(), contains(1, 2, 3, 4, 5));
        assertThat(composite.isFinalized(), is(true));
        assertThat(composite.getSize(), equalTo(1024));
        assertThat(composite.getPlateScale(), closeTo(simulation.getReferenceImage().getPlateScale(), 1E-12));

        double[] intensity = composite.getIntensity();
        int size = 1024;
        int center = (size / 2) * size + size / 2;
        double peak = intensity[center];
        double energy = 0.0;
        for (int i = 0; i < intensity.length; i++)
        {
            assertThat(intensity[i], lessThanOrEqualTo(peak));
            energy += intensity[i];
        }
        assertThat(energy, lessThan(1.0));
        // 5 slices of 4 samples cover columns -10..9 around the center
        for (int i = 0; i < size; i += 17)
        {
            assertThat(intensity[i * size + size / 2 + 10], lessThan(1E-12 * peak));
            assertThat(intensity[i * size + size / 2 - 11], lessThan(1E-12 * peak));
        }
    }

    @Test
    public void testThreadedRunMatchesSequentialRun()
    {
        SlicedPsfParameters parameters = smallParameters();
        SpectralCube sequential = new SlicedPsfSimulation(parameters, diagnostics, null).run();
        parameters.threadsMax = 3;
        SpectralCube threaded = new SlicedPsfSimulation(parameters, diagnostics, null).run();
        assertThat(threaded.getNumberOfPlanes(), equalTo(3));
        for (int n = 0; n < 3; n++)
        {
            assertThat(threaded.getWavelength(n).compareTo(sequential.getWavelength(n)), equalTo(0));
            assertArrayEquals(sequential.getPlane(n), threaded.getPlane(n), 0.0);
        }
        assertThat(threaded.getWavelength(2).compareTo(new BigDecimal("1.2E-6")), equalTo(0));
    }

    @Test
    public void testLongerWavelengthsShareThePlateScale()
    {
        SlicedPsfParameters parameters = smallParameters();
        SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, null);
        simulation.prepare();
        double pscale = simulation.getReferenceImage().getPlateScale();
        for (BigDecimal wave : simulation.getWavelengths())
        {
            CompositeImage composite = simulation.runWavelength(wave, new ComplexFHT());
            assertThat(composite.getPlateScale(), closeTo(pscale, 1E-12 * pscale));
            assertThat(composite.getSize(), equalTo(32));
        }
    }

    @Test
    public void testOddGammaRuns()
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.pupil.sampling = "8";
        parameters.pupil.gamma = "3";
        parameters.general.wavelengthEnd = parameters.general.wavelengthStart;
        SpectralCube cube = new SlicedPsfSimulation(parameters, diagnostics, null).run();
        assertThat(cube.getWidth(), equalTo(24));
    }

    @Test
    public void testZeroWfeDoesNotChangeTheResult() throws IOException
    {
        SlicedPsfParameters parameters = smallParameters();
        SpectralCube reference = new SlicedPsfSimulation(parameters, diagnostics, null).run();

        parameters.general.doWfe = true;
        parameters.wfe.directory = writeWfeMaps(16, 0.0).getPath();
        parameters.wfe.prefix = "wfe_";
        PsfVisualization visualization = mock(PsfVisualization.class);
        SpectralCube cube = new SlicedPsfSimulation(parameters, diagnostics, visualization).run();
        for (int n = 0; n < 3; n++)
        {
            assertArrayEquals(reference.getPlane(n), cube.getPlane(n), 0.0);
        }
        // one WFE plot per slice and wavelength
        verify(visualization, times(9)).addImagePlot(eq("wfe (radians)"), any(double[].class), eq(32), anyDouble(), eq("mm"));
        verify(visualization).draw();
    }

    @Test
    public void testConstantWfeKeepsIntensity() throws IOException
    {
        // gamma 1: the WFE map covers the whole pupil grid, so a constant phase is a global factor
        SlicedPsfParameters parameters = smallParameters();
        parameters.pupil.gamma = "1";
        SpectralCube reference = new SlicedPsfSimulation(parameters, diagnostics, null).run();

        parameters.general.doWfe = true;
        parameters.wfe.directory = writeWfeMaps(16, 0.5).getPath();
        parameters.wfe.prefix = "wfe_";
        SpectralCube cube = new SlicedPsfSimulation(parameters, diagnostics, null).run();
        double[] expected = reference.getPlane(1);
        double[] actual = cube.getPlane(1);
        for (int i = 0; i < expected.length; i++)
        {
            assertThat(actual[i], closeTo(expected[i], 1E-12));
        }
    }

    @Test
    public void testWorkerErrorFailsTheRun()
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.threadsMax = 3;
        PsfVisualization failing = new PsfVisualization()
        {
            public void addImagePlot(String title, double[] pixels, int width, double halfExtent, String units)
            {
                if (title.startsWith("-> take slice 2"))
                {
                    throw new OutOfMemoryError("no room for slice 2");
                }
            }

            public void draw()
            {
                fail("plots should not be drawn after a failure");
            }
        };
        try
        {
            new SlicedPsfSimulation(parameters, diagnostics, failing).run();
            fail("run should not return an incomplete cube");
        }
        catch (OutOfMemoryError e)
        {
            assertThat(e.getMessage(), equalTo("no room for slice 2"));
        }
    }

    @Test
    public void testEmptyOutputFieldAborts()
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.general.wavelengthEnd = parameters.general.wavelengthStart;
        parameters.output.hfov = 0.001;
        SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, null);
        SpectralCube cube = simulation.run();
        try
        {
            simulation.resampleOutput(cube);
            fail("an empty output grid should abort");
        }
        catch (SimulationAbortedException e)
        {
            assertThat(e.getErrors().get(0).getKind(), equalTo(SimulationError.Kind.INVALID_PARAMETER));
            assertThat(e.getMessage(), containsString("Output half field of view"));
        }
        assertThat(cube.isResampled(), is(false));
    }

    @Test
    public void testOutputIsResampledToTheOutputGrid()
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.general.wavelengthEnd = parameters.general.wavelengthStart;
        parameters.output.resamplingFactor = 2.0;
        parameters.output.hfov = 100.0;
        SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, null);
        SpectralCube cube = simulation.run();
        double pscale = cube.getPlateScale();
        simulation.resampleOutput(cube);
        assertThat(cube.isResampled(), is(true));
        assertThat(cube.getPlateScale(), closeTo(2.0 * pscale, 1E-12));
        assertThat(cube.getWidth(), equalTo(Resampler.getOutputSize(2.0 * pscale, 100.0)));
    }

    @Test
    public void testWfeSamplingMismatchAborts() throws IOException
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.general.doWfe = true;
        parameters.wfe.directory = writeWfeMaps(8, 0.0).getPath();
        parameters.wfe.prefix = "wfe_";
        try
        {
            new SlicedPsfSimulation(parameters, diagnostics, null).run();
            fail("simulation should abort");
        }
        catch (SimulationAbortedException e)
        {
            assertThat(e.getErrors().get(0).getKind(), equalTo(SimulationError.Kind.WFE_SAMPLING_MISMATCH));
            assertThat(e.getMessage(), containsString("(8 != 16)"));
        }
    }

    @Test
    public void testInvalidParametersAbortBeforeAnyTransform()
    {
        SlicedPsfParameters parameters = smallParameters();
        parameters.pupil.sampling = "100";
        parameters.general.nSlices = 4;
        SlicedPsfSimulation simulation = new SlicedPsfSimulation(parameters, diagnostics, null);
        try
        {
            simulation.run();
            fail("simulation should abort");
        }
        catch (SimulationAbortedException e)
        {
            List<SimulationError.Kind> kinds = new ArrayList<SimulationError.Kind>();
            for (SimulationError error : e.getErrors())
            {
                kinds.add(error.getKind());
            }
            assertThat(kinds, hasItem(SimulationError.Kind.SAMPLING_NOT_POWER_OF_TWO));
            assertThat(kinds, hasItem(SimulationError.Kind.EVEN_NUMBER_OF_SLICES));
        }
        assertThat(simulation.getReferenceImage(), is(nullValue()));
    }
}
