/**
 **
 ** ComplexFHTTest.java - tests for the complex FHT based Fourier transform
 **
 ** Copyright (C) 2010-2011 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ComplexFHTTest.java is free software: you can redistribute it and/or modify
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
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

import java.util.Random;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

public class ComplexFHTTest
{
    @Rule
    public ExpectedException exception = ExpectedException.none();

    private final ComplexFHT fht = new ComplexFHT();

    private static double[][] randomField(int size, long seed)
    {
        Random random = new Random(seed);
        double[][] reIm = new double[2][size * size];
        for (int i = 0; i < size * size; i++)
        {
            reIm[0][i] = random.nextGaussian();
            reIm[1][i] = random.nextGaussian();
        }
        return reIm;
    }

    private static double energy(double[][] reIm)
    {
        double e = 0.0;
        for (int i = 0; i < reIm[0].length; i++)
        {
            e += reIm[0][i] * reIm[0][i] + reIm[1][i] * reIm[1][i];
        }
        return e;
    }

    @Test
    public void testPowerOfTwo()
    {
        assertThat(ComplexFHT.isPowerOfTwo(256), is(true));
        assertThat(ComplexFHT.isPowerOfTwo(1), is(true));
        assertThat(ComplexFHT.isPowerOfTwo(100), is(false));
        assertThat(ComplexFHT.isPowerOfTwo(0), is(false));
        assertThat(ComplexFHT.powerOf2Size(32 * 32), is(true));
        assertThat(ComplexFHT.powerOf2Size(24 * 24), is(false));
    }

    @Test
    public void testDeltaTransformsToConstant()
    {
        int size = 16;
        double[][] delta = new double[2][size * size];
        delta[0][0] = 1.0;
        double[][] spectrum = fht.forward(delta);
        for (int i = 0; i < size * size; i++)
        {
            assertThat(spectrum[0][i], closeTo(1.0 / size, 1E-12));
            assertThat(spectrum[1][i], closeTo(0.0, 1E-12));
        }
    }

    @Test
    public void testPlaneWaveTransformsToSinglePeak()
    {
        int size = 32;
        int u0 = 3;
        double[][] wave = new double[2][size * size];
        for (int i = 0; i < size; i++)
        {
            for (int j = 0; j < size; j++)
            {
                wave[0][i * size + j] = Math.cos(2 * Math.PI * u0 * j / size);
                wave[1][i * size + j] = Math.sin(2 * Math.PI * u0 * j / size);
            }
        }
        double[][] spectrum = fht.forward(wave);
        for (int i = 0; i < size * size; i++)
        {
            double expected = (i == u0) ? size : 0.0;
            assertThat("re[" + i + "]", spectrum[0][i], closeTo(expected, 1E-9));
            assertThat("im[" + i + "]", spectrum[1][i], closeTo(0.0, 1E-9));
        }
    }

    @Test
    public void testRoundTrip()
    {
        double[][] field = randomField(64, 1L);
        double[][] back = fht.inverse(fht.forward(field));
        for (int i = 0; i < field[0].length; i++)
        {
            assertThat(back[0][i], closeTo(field[0][i], 1E-10));
            assertThat(back[1][i], closeTo(field[1][i], 1E-10));
        }
    }

    @Test
    public void testTransformIsUnitary()
    {
        double[][] field = randomField(32, 2L);
        double e = energy(field);
        assertThat(energy(fht.forward(field)), closeTo(e, 1E-9 * e));
        assertThat(energy(fht.inverse(field)), closeTo(e, 1E-9 * e));
    }

    @Test
    public void testInputIsNotModified()
    {
        double[][] field = randomField(16, 3L);
        double[][] copy = new double[][] { field[0].clone(), field[1].clone() };
        fht.forward(field);
        assertThat(field[0], equalTo(copy[0]));
        assertThat(field[1], equalTo(copy[1]));
    }

    @Test
    public void testDirectTransformMatchesFastTransform()
    {
        // 24x24 is not a power of 2, the plane wave peak must come out the same way
        int size = 24;
        int u0 = 5;
        double[][] wave = new double[2][size * size];
        for (int i = 0; i < size; i++)
        {
            for (int j = 0; j < size; j++)
            {
                wave[0][i * size + j] = Math.cos(2 * Math.PI * u0 * j / size);
                wave[1][i * size + j] = Math.sin(2 * Math.PI * u0 * j / size);
            }
        }
        double[][] spectrum = fht.forward(wave);
        assertThat(spectrum[0][u0], closeTo(size, 1E-9));
        assertThat(spectrum[0][u0 + 1], closeTo(0.0, 1E-9));

        double[][] field = randomField(size, 4L);
        double[][] back = fht.inverse(fht.forward(field));
        for (int i = 0; i < field[0].length; i++)
        {
            assertThat(back[0][i], closeTo(field[0][i], 1E-10));
            assertThat(back[1][i], closeTo(field[1][i], 1E-10));
        }
    }

    @Test
    public void testSwapQuadrantsMovesCornerToCenter()
    {
        int size = 8;
        double[] data = new double[size * size];
        data[0] = 1.0;
        ComplexFHT.swapQuadrants(data);
        assertThat(data[(size / 2) * size + size / 2], equalTo(1.0));
        assertThat(data[0], equalTo(0.0));
        ComplexFHT.swapQuadrants(data);
        assertThat(data[0], equalTo(1.0));
    }

    @Test
    public void testOddSideIsRejected()
    {
        exception.expect(IllegalArgumentException.class);
        fht.forward(new double[2][9 * 9]);
    }
}
