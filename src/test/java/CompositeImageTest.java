/**
 **
 ** CompositeImageTest.java - tests for the coherent slice accumulator
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CompositeImageTest.java is free software: you can redistribute it and/or modify
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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class CompositeImageTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    private static final BigDecimal WAVE = new BigDecimal("1000E-9");

    private static Image randomImage(int size, BigDecimal wave, long seed)
    {
        Random random = new Random(seed);
        double[][] reIm = new double[2][size * size];
        for (int i = 0; i < size * size; i++)
        {
            reIm[0][i] = random.nextGaussian();
            reIm[1][i] = random.nextGaussian();
        }
        return new Image(reIm, wave, 0.01, size / 2, 2, 0.008, null);
    }

    private List<Image> slices()
    {
        Slicer slicer = new Slicer(3, 1.0, 2);
        List<Image> slices = slicer.sliceUp(randomImage(16, WAVE, 7L));
        return slices;
    }

    @Test
    public void testAccumulationIsOrderIndependent()
    {
        List<Image> slices = slices();
        CompositeImage forward = new CompositeImage(16, WAVE, 3);
        CompositeImage backward = new CompositeImage(16, WAVE, 3);
        for (int k = 0; k < 3; k++)
        {
            forward.addSlice(slices.get(k));
            backward.addSlice(slices.get(2 - k));
        }
        double[][] f = forward.getReIm();
        double[][] b = backward.getReIm();
        for (int i = 0; i < f[0].length; i++)
        {
            assertThat(b[0][i], closeTo(f[0][i], 1E-14));
            assertThat(b[1][i], closeTo(f[1][i], 1E-14));
        }
        assertThat(backward.getSliceNumbers(), contains(3, 2, 1));
    }

    @Test
    public void testSumIsComplex()
    {
        Image a = randomImage(8, WAVE, 1L);
        Image b = randomImage(8, WAVE, 2L);
        CompositeImage composite = new CompositeImage(8, WAVE, 2);
        composite.addSlice(a);
        composite.addSlice(b);
        double[][] ra = a.getReIm();
        double[][] rb = b.getReIm();
        double[] intensity = composite.getIntensity();
        for (int i = 0; i < intensity.length; i++)
        {
            double re = ra[0][i] + rb[0][i];
            double im = ra[1][i] + rb[1][i];
            assertThat(intensity[i], closeTo(re * re + im * im, 1E-12));
        }
    }

    @Test
    public void testFinalizedAfterExpectedSlices()
    {
        List<Image> slices = slices();
        CompositeImage composite = new CompositeImage(16, WAVE, 3);
        composite.addSlice(slices.get(0));
        composite.addSlice(slices.get(1));
        assertThat(composite.isFinalized(), is(false));
        composite.addSlice(slices.get(2));
        assertThat(composite.isFinalized(), is(true));
        assertThat(composite.getNumberOfSlices(), equalTo(3));

        exception.expect(IllegalStateException.class);
        composite.addSlice(slices.get(0));
    }

    @Test
    public void testShapeMismatchIsRejected()
    {
        CompositeImage composite = new CompositeImage(16, WAVE, 3);
        exception.expect(IllegalArgumentException.class);
        composite.addSlice(randomImage(8, WAVE, 1L));
    }

    @Test
    public void testWavelengthMismatchIsRejected()
    {
        CompositeImage composite = new CompositeImage(16, WAVE, 3);
        exception.expect(IllegalArgumentException.class);
        composite.addSlice(randomImage(16, new BigDecimal("1010E-9"), 1L));
    }

    @Test
    public void testEqualWavelengthsWithDifferentScaleAreAccepted()
    {
        CompositeImage composite = new CompositeImage(16, WAVE, 1);
        composite.addSlice(randomImage(16, new BigDecimal("0.0000010"), 1L));
        assertThat(composite.isFinalized(), is(true));
        assertThat(composite.getPlateScale(), equalTo(0.01));
    }
}
